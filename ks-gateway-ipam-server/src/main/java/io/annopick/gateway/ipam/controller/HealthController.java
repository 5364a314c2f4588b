package io.annopick.gateway.ipam.controller;

import io.annopick.gateway.ipam.firewall.FirewallService;
import io.annopick.gateway.ipam.firewall.FirewallTable;
import io.annopick.gateway.ipam.service.PortMapRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/1/ipam/healthcheck")
@RequiredArgsConstructor
public class HealthController {

    private final PortMapRecordService recordService;
    private final FirewallService firewallService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        String version = HealthController.class.getPackage().getImplementationVersion();
        body.put("version", version == null ? "unknown" : version);
        try {
            body.put("database", recordService.listRecords());
            Map<String, String> firewall = new LinkedHashMap<>();
            firewall.put("nat", firewallService.showRaw(FirewallTable.NAT.getTableName()));
            firewall.put("filter", firewallService.showRaw(FirewallTable.FILTER.getTableName()));
            body.put("firewall", firewall);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Health check failed", e);
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }
}
