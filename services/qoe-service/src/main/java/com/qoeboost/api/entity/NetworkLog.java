package com.qoeboost.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * NetworkLog - one network quality measurement taken by a mobile client.
 *
 * The location label is matched exactly by the recommendation aggregator,
 * so clients are expected to send a normalized label (e.g. a city or cell
 * area name). Metric columns are nullable: clients report what they measured.
 *
 * userId is null only for anonymous submissions accepted while the service
 * runs on the fallback store.
 */
@Entity
@Table(name = "network_logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NetworkLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(name = "location", nullable = false, updatable = false)
    private String location;

    @Column(name = "provider", nullable = false, updatable = false)
    private String provider;

    /** e.g. "4G", "5G", "WIFI" */
    @Column(name = "network_type", updatable = false)
    private String networkType;

    @Column(name = "latency_ms", updatable = false)
    private Double latencyMs;

    @Column(name = "download_mbps", updatable = false)
    private Double downloadMbps;

    @Column(name = "upload_mbps", updatable = false)
    private Double uploadMbps;

    @Column(name = "signal_strength_dbm", updatable = false)
    private Integer signalStrengthDbm;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
