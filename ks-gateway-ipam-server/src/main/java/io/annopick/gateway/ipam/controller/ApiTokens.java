package io.annopick.gateway.ipam.controller;

import io.annopick.gateway.ipam.config.IpamProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ApiTokens {

    static final String HEADER = "X-API-Token";

    private ApiTokens() {
    }

    static boolean valid(IpamProperties properties, String apiToken) {
        String expected = properties.getSecurity().getApiToken();
        return expected != null && !expected.isEmpty() && expected.equals(apiToken);
    }

    static ResponseEntity<ApiResponse> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiResponse.error("Invalid API token"));
    }
}
