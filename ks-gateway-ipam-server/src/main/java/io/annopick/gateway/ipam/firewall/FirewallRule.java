package io.annopick.gateway.ipam.firewall;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * One port map rule as parsed from an iptables listing. {@code connPort} is only set for nat rules.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FirewallRule {
    @JsonIgnore
    FirewallTable table;
    @JsonIgnore
    String position;
    String targetAddr;
    int targetPort;
    Integer connPort;

    boolean targets(String addr, Integer port) {
        return targetAddr.equals(addr) && port != null && targetPort == port;
    }
}
