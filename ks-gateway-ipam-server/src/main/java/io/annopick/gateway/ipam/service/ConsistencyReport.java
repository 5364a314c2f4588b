package io.annopick.gateway.ipam.service;

import lombok.Value;

/**
 * Whether a port map record and its two firewall rules agree. An empty message means they do.
 */
@Value
public class ConsistencyReport {
    String message;
    MappingStatus status;

    public boolean isConsistent() {
        return status == MappingStatus.OK;
    }
}
