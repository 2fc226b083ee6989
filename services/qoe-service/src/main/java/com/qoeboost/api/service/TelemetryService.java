package com.qoeboost.api.service;

import com.qoeboost.api.dto.FeedbackRequest;
import com.qoeboost.api.dto.FeedbackResponse;
import com.qoeboost.api.dto.NetworkLogRequest;
import com.qoeboost.api.dto.NetworkLogResponse;
import com.qoeboost.api.dto.TelemetryResponse;
import com.qoeboost.api.entity.Feedback;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.entity.User;
import com.qoeboost.api.exception.UnauthorizedException;
import com.qoeboost.api.storage.PersistenceGateway;
import com.qoeboost.api.storage.StorageMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * TelemetryService - feedback and network-log submission and listing.
 *
 * Callers are either an authenticated user or anonymous (caller == null):
 * - authenticated: records are owned by the user, listings show only theirs
 * - anonymous, FALLBACK storage: accepted without an owner, listings are
 *   unscoped, responses are flagged degraded and anonymous
 * - anonymous, DURABLE storage: rejected with UnauthorizedException
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryService {

    private final PersistenceGateway persistenceGateway;

    public TelemetryResponse<FeedbackResponse> submitFeedback(User caller, FeedbackRequest request, Instant now) {
        Long owner = ownerOf(caller);
        Feedback saved = persistenceGateway.createFeedback(Feedback.builder()
                .userId(owner)
                .rating(request.getRating())
                .category(request.getCategory())
                .content(request.getContent())
                .createdAt(now)
                .build());
        log.info("Feedback stored: id={}, userId={}, rating={}", saved.getId(), owner, saved.getRating());
        return envelope(caller, FeedbackResponse.from(saved)).build();
    }

    public TelemetryResponse<List<FeedbackResponse>> listFeedback(User caller, int offset, int limit) {
        List<FeedbackResponse> items = persistenceGateway.listFeedback(ownerOf(caller), offset, limit).stream()
                .map(FeedbackResponse::from)
                .collect(Collectors.toList());
        return envelope(caller, items).offset(offset).limit(limit).build();
    }

    public TelemetryResponse<NetworkLogResponse> submitNetworkLog(User caller, NetworkLogRequest request, Instant now) {
        Long owner = ownerOf(caller);
        NetworkLog saved = persistenceGateway.createNetworkLog(NetworkLog.builder()
                .userId(owner)
                .location(request.getLocation())
                .provider(request.getProvider())
                .networkType(request.getNetworkType())
                .latencyMs(request.getLatencyMs())
                .downloadMbps(request.getDownloadMbps())
                .uploadMbps(request.getUploadMbps())
                .signalStrengthDbm(request.getSignalStrengthDbm())
                .createdAt(now)
                .build());
        log.info("Network log stored: id={}, userId={}, location={}, provider={}",
                saved.getId(), owner, saved.getLocation(), saved.getProvider());
        return envelope(caller, NetworkLogResponse.from(saved)).build();
    }

    public TelemetryResponse<List<NetworkLogResponse>> listNetworkLogs(User caller, int offset, int limit) {
        List<NetworkLogResponse> items = persistenceGateway.listNetworkLogs(ownerOf(caller), offset, limit).stream()
                .map(NetworkLogResponse::from)
                .collect(Collectors.toList());
        return envelope(caller, items).offset(offset).limit(limit).build();
    }

    /**
     * @return the owning user id, or null for an anonymous degraded-mode caller
     */
    private Long ownerOf(User caller) {
        if (caller != null) {
            return caller.getId();
        }
        if (persistenceGateway.storageMode().isDegraded()) {
            return null;
        }
        log.warn("Anonymous telemetry request refused on durable storage");
        throw new UnauthorizedException();
    }

    private <T> TelemetryResponse.TelemetryResponseBuilder<T> envelope(User caller, T data) {
        StorageMode mode = persistenceGateway.storageMode();
        return TelemetryResponse.<T>builder()
                .storage(mode)
                .degraded(mode.isDegraded())
                .anonymous(caller == null)
                .data(data);
    }
}
