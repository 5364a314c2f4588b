package io.annopick.gateway.ipam.service;

import lombok.Value;

@Value
public class MappingResult {

    private static final MappingResult OK = new MappingResult(null, MappingStatus.OK);

    String error;
    MappingStatus status;

    public static MappingResult ok() {
        return OK;
    }

    public static MappingResult failure(String error, MappingStatus status) {
        return new MappingResult(error, status);
    }

    public boolean isOk() {
        return status == MappingStatus.OK;
    }
}
