package com.qoeboost.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked provider for a location.
 *
 * score = averageQuality + 2 * ln(sampleCount), rounded to two decimals.
 * averageQuality is on a 0..100 scale.
 *
 * @see com.qoeboost.api.service.RecommendationService
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRecommendation {

    private String provider;
    private double score;
    private int sampleCount;
    private double averageQuality;
}
