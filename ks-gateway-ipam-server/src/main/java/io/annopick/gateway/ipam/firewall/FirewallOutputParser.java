package io.annopick.gateway.ipam.firewall;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses {@code iptables --numeric -L <chain> -t <table> --line-numbers} output into rules keyed by position.
 */
@Slf4j
final class FirewallOutputParser {

    // LOG and the catch-all ACCEPT installed when the gateway was provisioned
    private static final Set<String> BUILTIN_FORWARD_RULES = Set.of("1", "2");

    // Chain header and column header precede the rules
    private static final int HEADER_LINES = 2;

    private FirewallOutputParser() {
    }

    static Map<String, FirewallRule> parse(FirewallTable table, String output) {
        return table == FirewallTable.NAT ? parseNat(output) : parseFilter(output);
    }

    /*
     * Chain PREROUTING (policy ACCEPT)
     * num  target     prot opt source               destination
     * 1    DNAT       tcp  --  0.0.0.0/0            0.0.0.0/0            tcp dpt:6000 to:192.168.1.2:22
     */
    static Map<String, FirewallRule> parseNat(String output) {
        Map<String, FirewallRule> rules = new LinkedHashMap<>();
        for (String[] columns : rows(output)) {
            String target = columns[columns.length - 1];
            String[] destination = target.split(":");
            if (columns.length < 3 || !target.startsWith("to:") || destination.length != 3) {
                log.debug("Skipping nat rule {} without a DNAT destination", columns[0]);
                continue;
            }
            String connPort = lastField(columns[columns.length - 2]);
            rules.put(columns[0], FirewallRule.builder()
                .table(FirewallTable.NAT)
                .position(columns[0])
                .connPort(Integer.parseInt(connPort))
                .targetAddr(destination[1])
                .targetPort(Integer.parseInt(destination[2]))
                .build());
        }
        return rules;
    }

    /*
     * Chain FORWARD (policy ACCEPT)
     * num  target     prot opt source               destination
     * 1    LOG        all  --  0.0.0.0/0            0.0.0.0/0            LOG flags 0 level 4
     * 2    ACCEPT     all  --  0.0.0.0/0            0.0.0.0/0
     * 3    ACCEPT     tcp  --  0.0.0.0/0            192.168.1.2          tcp dpt:22
     */
    static Map<String, FirewallRule> parseFilter(String output) {
        Map<String, FirewallRule> rules = new LinkedHashMap<>();
        for (String[] columns : rows(output)) {
            String position = columns[0];
            if (BUILTIN_FORWARD_RULES.contains(position)) {
                continue;
            }
            if (columns.length < 8 || !columns[7].startsWith("dpt:")) {
                log.debug("Skipping filter rule {} without a destination port", position);
                continue;
            }
            rules.put(position, FirewallRule.builder()
                .table(FirewallTable.FILTER)
                .position(position)
                .targetAddr(columns[5])
                .targetPort(Integer.parseInt(lastField(columns[7])))
                .build());
        }
        return rules;
    }

    private static List<String[]> rows(String output) {
        String[] lines = output.split("\n");
        List<String[]> rows = new ArrayList<>();
        for (int i = HEADER_LINES; i < lines.length; i++) {
            String line = lines[i].trim();
            if (!line.isEmpty()) {
                rows.add(line.split("\\s+"));
            }
        }
        return rows;
    }

    private static String lastField(String column) {
        return column.substring(column.lastIndexOf(':') + 1);
    }
}
