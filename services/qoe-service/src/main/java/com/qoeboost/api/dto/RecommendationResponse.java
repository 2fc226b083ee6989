package com.qoeboost.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * RecommendationResponse - body of GET /recommendations.
 *
 * recommendations is ordered best first and is empty, not absent, when no
 * logs exist for the location.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    private String location;
    private List<ProviderRecommendation> recommendations;
}
