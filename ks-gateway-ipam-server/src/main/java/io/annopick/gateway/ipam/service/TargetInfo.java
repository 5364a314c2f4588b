package io.annopick.gateway.ipam.service;

import lombok.Value;

@Value
public class TargetInfo {

    private static final TargetInfo ABSENT = new TargetInfo(null, null);

    Integer targetPort;
    String targetAddr;

    public static TargetInfo absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return targetPort != null && targetAddr != null;
    }
}
