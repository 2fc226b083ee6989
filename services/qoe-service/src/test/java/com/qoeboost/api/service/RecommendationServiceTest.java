package com.qoeboost.api.service;

import com.qoeboost.api.dto.ProviderRecommendation;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.exception.ValidationFailedException;
import com.qoeboost.api.storage.InMemoryPersistenceGateway;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final InMemoryPersistenceGateway gateway = new InMemoryPersistenceGateway();
    private final RecommendationService service = new RecommendationService(gateway);

    @Test
    void higherQualityOutranksMoreSamples() {
        // quality 80: (80 + (100 - 100/5)) / 2
        log("Berlin", "A", 80.0, 100.0);
        log("Berlin", "A", 80.0, 100.0);
        // quality 90: (90 + (100 - 50/5)) / 2
        log("Berlin", "B", 90.0, 50.0);

        List<ProviderRecommendation> ranked = service.recommend("Berlin");

        assertEquals(List.of("B", "A"), providers(ranked));
        assertEquals(90.0, ranked.get(0).getScore());
        assertEquals(1, ranked.get(0).getSampleCount());
        assertEquals(80.0, ranked.get(1).getAverageQuality());
        assertEquals(2, ranked.get(1).getSampleCount());
        assertEquals(81.39, ranked.get(1).getScore());
    }

    @Test
    void moreSamplesWinAtEqualQuality() {
        log("Berlin", "A", 60.0, null);
        log("Berlin", "B", 60.0, null);
        log("Berlin", "B", 60.0, null);

        assertEquals(List.of("B", "A"), providers(service.recommend("Berlin")));
    }

    @Test
    void tiesAreBrokenByProviderName() {
        log("Berlin", "Zeta", 70.0, null);
        log("Berlin", "Alpha", 70.0, null);
        log("Berlin", "Mu", 70.0, null);

        assertEquals(List.of("Alpha", "Mu", "Zeta"), providers(service.recommend("Berlin")));
    }

    @Test
    void scoresEqualAfterRoundingAreOrderedByName() {
        log("Berlin", "Zeta", 70.004, null);
        log("Berlin", "Alpha", 70.001, null);

        List<ProviderRecommendation> ranked = service.recommend("Berlin");

        assertEquals(List.of("Alpha", "Zeta"), providers(ranked));
        assertEquals(70.0, ranked.get(0).getScore());
        assertEquals(70.0, ranked.get(1).getScore());
    }

    @Test
    void onlyExactLocationCounts() {
        log("Berlin", "A", 50.0, null);
        log("Hamburg", "B", 99.0, null);

        assertEquals(List.of("A"), providers(service.recommend("Berlin")));
    }

    @Test
    void unknownLocationYieldsEmptyList() {
        log("Berlin", "A", 50.0, null);

        assertTrue(service.recommend("Atlantis").isEmpty());
    }

    @Test
    void logsWithoutMetricsAreIgnored() {
        log("Berlin", "A", null, null);

        assertTrue(service.recommend("Berlin").isEmpty());
    }

    @Test
    void qualityIsClampedToScale() {
        NetworkLog fast = NetworkLog.builder().downloadMbps(500.0).latencyMs(0.0).build();
        NetworkLog slow = NetworkLog.builder().downloadMbps(0.0).latencyMs(2000.0).build();

        assertEquals(100.0, RecommendationService.quality(fast).getAsDouble());
        assertEquals(0.0, RecommendationService.quality(slow).getAsDouble());
    }

    @Test
    void blankLocationIsValidationError() {
        assertThrows(ValidationFailedException.class, () -> service.recommend(" "));
        assertThrows(ValidationFailedException.class, () -> service.recommend(null));
    }

    private void log(String location, String provider, Double downloadMbps, Double latencyMs) {
        gateway.createNetworkLog(NetworkLog.builder()
                .location(location)
                .provider(provider)
                .downloadMbps(downloadMbps)
                .latencyMs(latencyMs)
                .createdAt(NOW)
                .build());
    }

    private static List<String> providers(List<ProviderRecommendation> ranked) {
        return ranked.stream().map(ProviderRecommendation::getProvider).collect(Collectors.toList());
    }
}
