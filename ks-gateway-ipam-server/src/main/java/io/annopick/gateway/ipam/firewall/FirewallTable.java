package io.annopick.gateway.ipam.firewall;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two iptables tables holding port map rules, each with the one chain this service writes to.
 */
@Getter
@RequiredArgsConstructor
public enum FirewallTable {
    NAT("nat", "PREROUTING"),
    FILTER("filter", "FORWARD");

    private final String tableName;
    private final String chain;

    public static FirewallTable of(String table) {
        if (table != null) {
            for (FirewallTable candidate : values()) {
                if (candidate.tableName.equalsIgnoreCase(table)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
            String.format("Param \"table\" must be either \"nat\" or \"filter\", supplied: %s", table));
    }
}
