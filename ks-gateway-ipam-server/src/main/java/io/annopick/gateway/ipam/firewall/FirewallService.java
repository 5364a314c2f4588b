package io.annopick.gateway.ipam.firewall;

import io.annopick.gateway.ipam.config.IpamProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Thread-safe access to the iptables rules that implement port maps.
 *
 * <p>Rules are addressed by position, so every listing and mutation runs under one process-wide
 * reentrant lock. Callers that need several calls to observe the same table state wrap them in
 * {@link #exclusively(Supplier)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FirewallService {

    private final ReentrantLock lock = new ReentrantLock();
    private final CommandRunner commandRunner;
    private final IpamProperties properties;

    /**
     * Run {@code work} while holding the firewall lock. The lock is reentrant, so {@code work} may call
     * any other method of this service.
     */
    public <T> T exclusively(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public MappedRules mapPort(int connPort, int targetPort, String targetAddr) {
        return exclusively(() -> {
            // FORWARD first: without the DNAT rule it lets nothing through
            String forwardId = forward(targetAddr, targetPort);
            String preroutingId;
            try {
                preroutingId = prerouting(connPort, targetAddr, targetPort);
            } catch (RuntimeException e) {
                log.error("Failed to create PREROUTING rule for port {} to {}:{}, removing FORWARD rule {}",
                    connPort, targetAddr, targetPort, forwardId);
                undoRule(forwardId, FirewallTable.FILTER, e);
                throw e;
            }
            try {
                saveRules();
            } catch (RuntimeException e) {
                log.error("Failed to save rules for port {}, removing PREROUTING rule {} and FORWARD rule {}",
                    connPort, preroutingId, forwardId);
                undoRule(preroutingId, FirewallTable.NAT, e);
                undoRule(forwardId, FirewallTable.FILTER, e);
                throw e;
            }
            log.info("Mapped port {} to {}:{} (FORWARD {}, PREROUTING {})",
                connPort, targetAddr, targetPort, forwardId, preroutingId);
            return new MappedRules(forwardId, preroutingId);
        });
    }

    public String forward(String targetAddr, int targetPort) {
        return exclusively(() -> {
            commandRunner.run(iptables("-A", "FORWARD", "-p", "tcp", "-d", targetAddr,
                "--dport", String.valueOf(targetPort), "-j", "ACCEPT"));
            try {
                return findRule(targetAddr, targetPort, FirewallTable.FILTER.getTableName(), null);
            } catch (RuleNotFoundException e) {
                throw new RuleNotFoundException(String.format(
                    "Unable to find newly created FORWARD rule for %s:%d", targetAddr, targetPort), e);
            }
        });
    }

    public String prerouting(int connPort, String targetAddr, int targetPort) {
        return exclusively(() -> {
            commandRunner.run(iptables("-A", "PREROUTING", "-t", "nat",
                "-i", properties.getFirewall().getExternalInterface(), "-p", "tcp",
                "--dport", String.valueOf(connPort), "-j", "DNAT", "--to", targetAddr + ":" + targetPort));
            try {
                return findRule(targetAddr, targetPort, FirewallTable.NAT.getTableName(), connPort);
            } catch (RuleNotFoundException e) {
                throw new RuleNotFoundException(String.format(
                    "Unable to find newly created PREROUTING rule for port %d to %s:%d",
                    connPort, targetAddr, targetPort), e);
            }
        });
    }

    public void deleteRule(String ruleId, String table) {
        FirewallTable firewallTable = FirewallTable.of(table);
        exclusively(() -> {
            commandRunner.run(iptables("-t", firewallTable.getTableName(), "-D", firewallTable.getChain(), ruleId));
            log.info("Deleted {} rule {} from {}", firewallTable.getChain(), ruleId, firewallTable.getTableName());
            return null;
        });
    }

    // Nat rules must also match connPort; filter rules carry no connection port
    public String findRule(String targetAddr, Integer targetPort, String table, Integer connPort) {
        FirewallTable firewallTable = FirewallTable.of(table);
        if (firewallTable == FirewallTable.NAT && connPort == null) {
            throw new IllegalArgumentException("Must supply conn_port when looking up NAT rules");
        }
        return exclusively(() -> {
            List<String> matches = new ArrayList<>();
            for (FirewallRule rule : show(firewallTable.getTableName()).values()) {
                if (rule.targets(targetAddr, targetPort)
                        && (firewallTable == FirewallTable.FILTER || connPort.equals(rule.getConnPort()))) {
                    matches.add(rule.getPosition());
                }
            }
            if (matches.isEmpty()) {
                throw new RuleNotFoundException(String.format("Unable to find %s rule for %s:%s",
                    firewallTable.getTableName(), targetAddr, targetPort));
            }
            if (matches.size() > 1) {
                log.warn("Ambiguous {} lookup for {}:{}, rules {} all match; using {}",
                    firewallTable.getTableName(), targetAddr, targetPort, matches, matches.get(0));
            }
            return matches.get(0);
        });
    }

    public Optional<FirewallRule> findNatRule(int connPort) {
        return exclusively(() -> show(FirewallTable.NAT.getTableName()).values().stream()
            .filter(rule -> rule.getConnPort() != null && rule.getConnPort() == connPort)
            .findFirst());
    }

    // Keyed by position; the built-in FORWARD rules are left out
    public Map<String, FirewallRule> show(String table) {
        FirewallTable firewallTable = FirewallTable.of(table);
        return exclusively(() -> FirewallOutputParser.parse(firewallTable, showRaw(table)));
    }

    public String showRaw(String table) {
        FirewallTable firewallTable = FirewallTable.of(table);
        return exclusively(() -> commandRunner.run(iptables("--numeric", "-L", firewallTable.getChain(),
            "-t", firewallTable.getTableName(), "--line-numbers")).getStdout());
    }

    public void saveRules() {
        exclusively(() -> {
            CommandResult result = commandRunner.run(properties.getFirewall().getSaveCommand());
            Path rulesFile = Path.of(properties.getFirewall().getRulesFile());
            try {
                Files.writeString(rulesFile, result.getStdout(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new FirewallException("Failed to write firewall rules to " + rulesFile, e);
            }
            log.debug("Saved firewall rules to {}", rulesFile);
            return null;
        });
    }

    private void undoRule(String ruleId, FirewallTable table, RuntimeException failure) {
        try {
            deleteRule(ruleId, table.getTableName());
        } catch (RuntimeException undo) {
            log.error("Failed to remove {} rule {}", table.getChain(), ruleId, undo);
            failure.addSuppressed(undo);
        }
    }

    private List<String> iptables(String... args) {
        List<String> command = new ArrayList<>(properties.getFirewall().getCommand());
        command.addAll(Arrays.asList(args));
        return command;
    }
}
