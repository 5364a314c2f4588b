package io.annopick.gateway.ipam.model;

import lombok.Value;

@Value
public class ProbeTarget {
    String targetName;
    String targetAddr;
}
