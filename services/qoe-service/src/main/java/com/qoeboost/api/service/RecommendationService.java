package com.qoeboost.api.service;

import com.qoeboost.api.dto.ProviderRecommendation;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.exception.ValidationFailedException;
import com.qoeboost.api.storage.PersistenceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * RecommendationService - ranks providers at a location from stored network logs.
 *
 * Scoring:
 * - per-log quality (0..100) is the mean of the metrics the log carries:
 *   downloadScore = min(100, downloadMbps), latencyScore = max(0, 100 - latencyMs / 5)
 * - logs with neither metric are ignored
 * - provider score = averageQuality + 2 * ln(sampleCount)
 *
 * More samples raise the score a little; quality dominates. Ordering is by
 * score (rounded to two decimals) descending, then provider name ascending.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    static final double SAMPLE_WEIGHT = 2.0;

    private static final Comparator<Ranked> RANKING = Comparator
            .comparingDouble((Ranked r) -> r.score).reversed()
            .thenComparing(r -> r.provider);

    private final PersistenceGateway persistenceGateway;

    /**
     * @param location exact location label
     * @return ranked providers, best first; empty when no scorable logs exist
     */
    public List<ProviderRecommendation> recommend(String location) {
        if (location == null || location.isBlank()) {
            throw new ValidationFailedException("location", "location must not be blank");
        }

        Map<String, List<Double>> qualityByProvider = new LinkedHashMap<>();
        for (NetworkLog entry : persistenceGateway.findNetworkLogsByLocation(location)) {
            OptionalDouble quality = quality(entry);
            if (quality.isPresent()) {
                qualityByProvider.computeIfAbsent(entry.getProvider(), p -> new ArrayList<>())
                        .add(quality.getAsDouble());
            }
        }

        List<Ranked> ranked = new ArrayList<>();
        qualityByProvider.forEach((provider, samples) -> {
            double average = samples.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            double score = average + SAMPLE_WEIGHT * Math.log(samples.size());
            // Rank on the reported precision
            ranked.add(new Ranked(provider, round(score), samples.size(), round(average)));
        });
        ranked.sort(RANKING);

        log.debug("Recommendations for location={}: {} providers", location, ranked.size());
        return ranked.stream()
                .map(r -> ProviderRecommendation.builder()
                        .provider(r.provider)
                        .score(r.score)
                        .sampleCount(r.sampleCount)
                        .averageQuality(r.averageQuality)
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Quality of one measurement on a 0..100 scale, empty if it carries no
     * usable metric.
     */
    static OptionalDouble quality(NetworkLog networkLog) {
        double sum = 0;
        int parts = 0;
        if (networkLog.getDownloadMbps() != null) {
            sum += Math.min(100.0, networkLog.getDownloadMbps());
            parts++;
        }
        if (networkLog.getLatencyMs() != null) {
            sum += Math.max(0.0, 100.0 - networkLog.getLatencyMs() / 5.0);
            parts++;
        }
        return parts == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / parts);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Ranked {
        private final String provider;
        private final double score;
        private final int sampleCount;
        private final double averageQuality;

        private Ranked(String provider, double score, int sampleCount, double averageQuality) {
            this.provider = provider;
            this.score = score;
            this.sampleCount = sampleCount;
            this.averageQuality = averageQuality;
        }
    }
}
