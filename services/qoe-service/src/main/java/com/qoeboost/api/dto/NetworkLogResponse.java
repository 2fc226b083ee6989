package com.qoeboost.api.dto;

import com.qoeboost.api.entity.NetworkLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkLogResponse {

    private Long id;
    private Long userId;
    private String location;
    private String provider;
    private String networkType;
    private Double latencyMs;
    private Double downloadMbps;
    private Double uploadMbps;
    private Integer signalStrengthDbm;
    private Instant createdAt;

    public static NetworkLogResponse from(NetworkLog log) {
        return NetworkLogResponse.builder()
                .id(log.getId())
                .userId(log.getUserId())
                .location(log.getLocation())
                .provider(log.getProvider())
                .networkType(log.getNetworkType())
                .latencyMs(log.getLatencyMs())
                .downloadMbps(log.getDownloadMbps())
                .uploadMbps(log.getUploadMbps())
                .signalStrengthDbm(log.getSignalStrengthDbm())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
