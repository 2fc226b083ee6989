package com.qoeboost.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NetworkLogRequest - payload of POST /network-logs.
 *
 * <pre>
 * {
 *   "location": "Berlin-Mitte",
 *   "provider": "Telekom",
 *   "networkType": "5G",
 *   "latencyMs": 38.5,
 *   "downloadMbps": 112.0,
 *   "uploadMbps": 24.3,
 *   "signalStrengthDbm": -87
 * }
 * </pre>
 *
 * Metrics are optional individually; the recommendation aggregator ignores
 * logs that carry neither latency nor download throughput.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkLogRequest {

    @NotBlank
    @Size(max = 255)
    private String location;

    @NotBlank
    @Size(max = 100)
    private String provider;

    @Size(max = 20)
    private String networkType;

    @PositiveOrZero
    private Double latencyMs;

    @PositiveOrZero
    private Double downloadMbps;

    @PositiveOrZero
    private Double uploadMbps;

    @Min(-150)
    @Max(0)
    private Integer signalStrengthDbm;
}
