package com.kumc.anam.gateway.controller;

import com.kumc.anam.gateway.config.AnamGatewayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AnamGatewayProperties properties;

    /**
     * Liveness check. No authentication, no portal call.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "version", properties.getAppVersion()
        ));
    }
}
