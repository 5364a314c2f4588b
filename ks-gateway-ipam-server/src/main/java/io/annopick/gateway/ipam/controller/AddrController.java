package io.annopick.gateway.ipam.controller;

import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.service.PortMapCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api/1/ipam/addr")
@RequiredArgsConstructor
public class AddrController {

    private static final Pattern IPV4 = Pattern.compile(
        "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private final PortMapCoordinator coordinator;
    private final IpamProperties properties;

    @GetMapping
    public ResponseEntity<ApiResponse> lookup(
            @RequestHeader(value = ApiTokens.HEADER, required = false) String apiToken,
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "addr", required = false) String addr,
            @RequestParam(value = "component", required = false) String component) {

        if (!ApiTokens.valid(properties, apiToken)) {
            return ApiTokens.unauthorized();
        }
        if (!argsValid(name, addr, component)) {
            return ResponseEntity.badRequest().body(ApiResponse.error(String.format(
                "Params are mutually exclusive. Supplied: name=%s, addr=%s, component=%s", name, addr, component)));
        }

        try {
            return ResponseEntity.ok(ApiResponse.content(coordinator.lookupAddresses(
                emptyToNull(name), emptyToNull(addr), emptyToNull(component))));
        } catch (Exception e) {
            log.error("Failed to look up addresses", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(e.getMessage()));
        }
    }

    static boolean argsValid(String name, String addr, String component) {
        int supplied = 0;
        for (String param : new String[]{name, addr, component}) {
            if (StringUtils.hasText(param)) {
                supplied++;
            }
        }
        if (supplied > 1) {
            return false;
        }
        return !StringUtils.hasText(addr) || IPV4.matcher(addr).matches();
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
