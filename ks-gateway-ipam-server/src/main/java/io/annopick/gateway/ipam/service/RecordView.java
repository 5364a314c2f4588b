package io.annopick.gateway.ipam.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.annopick.gateway.ipam.model.PortMapping;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecordView {
    String name;
    String targetAddr;
    Integer targetPort;
    String component;
    Boolean routable;

    static RecordView of(PortMapping mapping) {
        return new RecordView(mapping.getTargetName(), mapping.getTargetAddr(), mapping.getTargetPort(),
            mapping.getTargetComponent(), mapping.getRoutable());
    }
}
