package com.qoeboost.api.controller;

import com.qoeboost.api.dto.RecommendationResponse;
import com.qoeboost.api.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /recommendations?location=... - providers ranked for a location.
 * Public: aggregates are not per-user data.
 */
@RestController
@RequestMapping("/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestParam String location) {
        return ResponseEntity.ok(RecommendationResponse.builder()
                .location(location)
                .recommendations(recommendationService.recommend(location))
                .build());
    }
}
