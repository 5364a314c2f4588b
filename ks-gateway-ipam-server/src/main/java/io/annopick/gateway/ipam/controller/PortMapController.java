package io.annopick.gateway.ipam.controller;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.service.MappingResult;
import io.annopick.gateway.ipam.service.PortMapCoordinator;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/1/ipam/portmap")
@RequiredArgsConstructor
public class PortMapController {

    private final PortMapCoordinator coordinator;
    private final IpamProperties properties;

    @GetMapping
    public ResponseEntity<ApiResponse> lookup(
            @RequestHeader(value = ApiTokens.HEADER, required = false) String apiToken,
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "target_addr", required = false) String targetAddr,
            @RequestParam(value = "component", required = false) String component,
            @RequestParam(value = "conn_port", required = false) String connPort,
            @RequestParam(value = "target_port", required = false) String targetPort) {

        if (!ApiTokens.valid(properties, apiToken)) {
            return ApiTokens.unauthorized();
        }

        Integer connPortFilter;
        Integer targetPortFilter;
        try {
            connPortFilter = portFilter("conn_port", connPort);
            targetPortFilter = portFilter("target_port", targetPort);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        }

        try {
            return ResponseEntity.ok(ApiResponse.content(
                coordinator.lookupRecords(name, targetAddr, component, connPortFilter, targetPortFilter)));
        } catch (Exception e) {
            log.error("Failed to look up port maps", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<ApiResponse> create(
            @RequestHeader(value = ApiTokens.HEADER, required = false) String apiToken,
            @RequestBody CreatePortMapRequest request) {

        if (!ApiTokens.valid(properties, apiToken)) {
            return ApiTokens.unauthorized();
        }
        List<String> missing = request.missingFields();
        if (!missing.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Missing required field(s): " + missing));
        }

        try {
            int connPort = coordinator.create(request.getTargetAddr(), request.getTargetPort(),
                request.getTargetName(), request.getTargetComponent());
            return ResponseEntity.ok(ApiResponse.content(Map.of("conn_port", connPort)));
        } catch (Exception e) {
            log.error("Failed to create port map to {}:{}", request.getTargetAddr(), request.getTargetPort(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(e.getMessage()));
        }
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse> destroy(
            @RequestHeader(value = ApiTokens.HEADER, required = false) String apiToken,
            @RequestBody DestroyPortMapRequest request) {

        if (!ApiTokens.valid(properties, apiToken)) {
            return ApiTokens.unauthorized();
        }
        if (request.getConnPort() == null) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Missing required field(s): [conn_port]"));
        }

        try {
            MappingResult result = coordinator.destroy(request.getConnPort());
            return ResponseEntity.status(result.getStatus().getHttpStatus())
                .body(new ApiResponse(Map.of(), result.getError()));
        } catch (Exception e) {
            log.error("Failed to destroy port map {}", request.getConnPort(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/rules")
    public ResponseEntity<ApiResponse> rules(
            @RequestHeader(value = ApiTokens.HEADER, required = false) String apiToken,
            @RequestParam(value = "table", defaultValue = "filter") String table,
            @RequestParam(value = "format", defaultValue = "parsed") String format) {

        if (!ApiTokens.valid(properties, apiToken)) {
            return ApiTokens.unauthorized();
        }

        try {
            Object rules = "raw".equalsIgnoreCase(format)
                ? coordinator.showRawRules(table)
                : coordinator.showRules(table);
            return ResponseEntity.ok(ApiResponse.content(rules));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to list {} rules", table, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(e.getMessage()));
        }
    }

    // Absent and zero both mean "no filter"
    private static Integer portFilter(String param, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Param %s must be a number, supplied: %s", param, value));
        }
        return port == 0 ? null : port;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CreatePortMapRequest {
        private String targetAddr;
        private Integer targetPort;
        private String targetName;
        private String targetComponent;

        List<String> missingFields() {
            List<String> missing = new ArrayList<>();
            if (targetAddr == null) {
                missing.add("target_addr");
            }
            if (targetPort == null) {
                missing.add("target_port");
            }
            if (targetName == null) {
                missing.add("target_name");
            }
            if (targetComponent == null) {
                missing.add("target_component");
            }
            return missing;
        }
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DestroyPortMapRequest {
        private Integer connPort;
    }
}
