package io.annopick.gateway.ipam.service;

import io.annopick.gateway.ipam.firewall.FirewallRule;
import io.annopick.gateway.ipam.firewall.FirewallService;
import io.annopick.gateway.ipam.firewall.FirewallTable;
import io.annopick.gateway.ipam.firewall.RuleNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Creates and destroys port maps so the database record and both firewall rules appear and
 * disappear together. Each step that fails after an earlier one succeeded is followed by a
 * compensating action, and the original failure is what the caller sees.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortMapCoordinator {

    static final String RECORD_WITHOUT_RULES = "DB record exist, but no iptable record; contact admin.";
    static final String RULES_WITHOUT_RECORD = "iptable record exist, but no DB record; contact admin.";
    static final String NO_SUCH_MAPPING = "No such port mapping record";

    private final PortMapRecordService recordService;
    private final FirewallService firewallService;

    public int create(String targetAddr, int targetPort, String targetName, String targetComponent) {
        int connPort = recordService.addRecord(targetAddr, targetPort, targetName, targetComponent);
        try {
            firewallService.mapPort(connPort, targetPort, targetAddr);
        } catch (RuntimeException e) {
            log.error("Failed to create firewall rules for port {} to {}:{}, removing record",
                connPort, targetAddr, targetPort, e);
            try {
                recordService.deleteRecord(connPort);
            } catch (RuntimeException undo) {
                log.error("Failed to remove record for port {}", connPort, undo);
                e.addSuppressed(undo);
            }
            throw e;
        }
        log.info("Created port map {} -> {}:{} for {}", connPort, targetAddr, targetPort, targetName);
        return connPort;
    }

    // A null id or target field means that rule or the record was not found
    public ConsistencyReport consistencyCheck(String natRuleId, String filterRuleId,
                                              Integer targetPort, String targetAddr) {
        boolean recordPresent = targetPort != null && targetAddr != null;
        boolean rulesPresent = natRuleId != null && filterRuleId != null;
        if (recordPresent && !rulesPresent) {
            return new ConsistencyReport(RECORD_WITHOUT_RULES, MappingStatus.SERVER_ERROR);
        } else if (!recordPresent && rulesPresent) {
            return new ConsistencyReport(RULES_WITHOUT_RECORD, MappingStatus.SERVER_ERROR);
        } else if (!recordPresent) {
            return new ConsistencyReport(NO_SUCH_MAPPING, MappingStatus.NOT_FOUND);
        }
        return new ConsistencyReport("", MappingStatus.OK);
    }

    public MappingResult destroy(int connPort) {
        TargetInfo record = recordService.getRecord(connPort);
        return firewallService.exclusively(() -> {
            Integer targetPort = record.getTargetPort();
            String targetAddr = record.getTargetAddr();
            if (!record.isPresent()) {
                // Follow the DNAT rule so rules left behind without a record are still reported
                Optional<FirewallRule> natRule = firewallService.findNatRule(connPort);
                if (natRule.isPresent()) {
                    targetPort = natRule.get().getTargetPort();
                    targetAddr = natRule.get().getTargetAddr();
                }
            }
            String natId = locate(targetAddr, targetPort, FirewallTable.NAT, connPort);
            String filterId = locate(targetAddr, targetPort, FirewallTable.FILTER, null);
            ConsistencyReport report = consistencyCheck(natId, filterId, record.getTargetPort(), record.getTargetAddr());
            if (!report.isConsistent()) {
                log.warn("Refusing to destroy port map {}: {}", connPort, report.getMessage());
                return MappingResult.failure(report.getMessage(), report.getStatus());
            }
            return removePortMap(natId, filterId, targetPort, targetAddr, connPort);
        });
    }

    public Map<Integer, RecordView> lookupRecords(String name, String addr, String component,
                                                  Integer connPort, Integer targetPort) {
        return recordService.lookupByFilter(name, addr, component, connPort, targetPort);
    }

    public Map<String, AddressView> lookupAddresses(String name, String addr, String component) {
        return recordService.lookupAddresses(name, addr, component);
    }

    public Map<String, FirewallRule> showRules(String table) {
        return firewallService.show(table);
    }

    public String showRawRules(String table) {
        return firewallService.showRaw(table);
    }

    // Caller holds the firewall lock
    private MappingResult removePortMap(String natId, String filterId, int targetPort, String targetAddr,
                                        int connPort) {
        try {
            firewallService.deleteRule(natId, FirewallTable.NAT.getTableName());
        } catch (RuntimeException e) {
            log.error("Failed to delete PREROUTING rule {} of port map {}", natId, connPort, e);
            return MappingResult.failure(e.getMessage(), MappingStatus.SERVER_ERROR);
        }
        try {
            firewallService.deleteRule(filterId, FirewallTable.FILTER.getTableName());
        } catch (RuntimeException e) {
            log.error("Failed to delete FORWARD rule {} of port map {}, restoring", filterId, connPort, e);
            try {
                firewallService.forward(targetAddr, targetPort);
                firewallService.saveRules();
            } catch (RuntimeException undo) {
                log.error("Failed to restore FORWARD rule for {}:{}", targetAddr, targetPort, undo);
            }
            return MappingResult.failure(e.getMessage(), MappingStatus.SERVER_ERROR);
        }
        try {
            recordService.deleteRecord(connPort);
        } catch (RuntimeException e) {
            log.error("Failed to delete record of port map {}, restoring firewall rules", connPort, e);
            try {
                firewallService.mapPort(connPort, targetPort, targetAddr);
            } catch (RuntimeException undo) {
                log.error("Failed to restore firewall rules for port map {}", connPort, undo);
            }
            return MappingResult.failure(e.getMessage(), MappingStatus.SERVER_ERROR);
        }
        log.info("Destroyed port map {} -> {}:{}", connPort, targetAddr, targetPort);
        try {
            firewallService.saveRules();
        } catch (RuntimeException e) {
            // The live tables no longer hold the port map, only the rules file is stale
            log.error("Destroyed port map {} but failed to save firewall rules", connPort, e);
        }
        return MappingResult.ok();
    }

    private String locate(String targetAddr, Integer targetPort, FirewallTable table, Integer connPort) {
        if (targetAddr == null || targetPort == null) {
            return null;
        }
        try {
            return firewallService.findRule(targetAddr, targetPort, table.getTableName(), connPort);
        } catch (RuleNotFoundException e) {
            log.debug("No {} rule for port map {}: {}", table.getTableName(), connPort, e.getMessage());
            return null;
        }
    }
}
