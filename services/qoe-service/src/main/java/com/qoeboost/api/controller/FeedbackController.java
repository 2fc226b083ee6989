package com.qoeboost.api.controller;

import com.qoeboost.api.dto.FeedbackRequest;
import com.qoeboost.api.dto.FeedbackResponse;
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
 * FeedbackController - create and list user feedback.
 *
 * Endpoints:
 * - POST /feedback                     - Submit a rating
 * - GET  /feedback?offset=0&limit=100  - Caller's feedback, oldest first
 *
 * The bearer token is optional here. Without one the request is anonymous,
 * which only the degraded (in-memory) mode accepts.
 *
 * @see TelemetryService for ownership rules
 */
@RestController
@RequestMapping("/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final AuthService authService;
    private final TelemetryService telemetryService;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<TelemetryResponse<FeedbackResponse>> create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody FeedbackRequest request) {
        Instant now = clock.instant();
        User caller = authService.resolveBearer(authorization, now).orElse(null);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(telemetryService.submitFeedback(caller, request, now));
    }

    @GetMapping
    public ResponseEntity<TelemetryResponse<List<FeedbackResponse>>> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + Paging.DEFAULT_LIMIT) int limit) {
        User caller = authService.resolveBearer(authorization, clock.instant()).orElse(null);
        return ResponseEntity.ok(telemetryService.listFeedback(caller, offset, limit));
    }
}
