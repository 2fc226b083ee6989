package com.qoeboost.api.controller;

import com.qoeboost.api.storage.StorageMode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints. The service stays healthy in fallback mode; /health
 * reports which store it is running on instead of failing.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final StorageMode storageMode;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "QoE Boost API is running");
        response.put("status", "healthy");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", storageMode.isDegraded() ? "degraded" : "healthy");
        response.put("storage", storageMode);
        response.put("database", storageMode.isDegraded() ? "unavailable" : "connected");
        return ResponseEntity.ok(response);
    }
}
