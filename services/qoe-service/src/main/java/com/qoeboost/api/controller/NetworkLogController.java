package com.qoeboost.api.controller;

import com.qoeboost.api.dto.NetworkLogRequest;
import com.qoeboost.api.dto.NetworkLogResponse;
import com.qoeboost.api.dto.TelemetryResponse;
import com.qoeboost.api.entity.User;
import com.qoeboost.api.service.AuthService;
import com.qoeboost.api.service.TelemetryService;
import com.qoeboost.api.storage.Paging;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * NetworkLogController - create and list network quality measurements.
 *
 * Endpoints:
 * - POST /network-logs                     - Submit a measurement
 * - GET  /network-logs?offset=0&limit=100  - Caller's measurements, oldest first
 *
 * Same authentication rules as FeedbackController.
 */
@RestController
@RequestMapping("/network-logs")
@RequiredArgsConstructor
public class NetworkLogController {

    private final AuthService authService;
    private final TelemetryService telemetryService;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<TelemetryResponse<NetworkLogResponse>> create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody NetworkLogRequest request) {
        Instant now = clock.instant();
        User caller = authService.resolveBearer(authorization, now).orElse(null);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(telemetryService.submitNetworkLog(caller, request, now));
    }

    @GetMapping
    public ResponseEntity<TelemetryResponse<List<NetworkLogResponse>>> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + Paging.DEFAULT_LIMIT) int limit) {
        User caller = authService.resolveBearer(authorization, clock.instant()).orElse(null);
        return ResponseEntity.ok(telemetryService.listNetworkLogs(caller, offset, limit));
    }
}
