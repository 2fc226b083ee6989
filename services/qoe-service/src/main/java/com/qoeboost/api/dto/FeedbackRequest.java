package com.qoeboost.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * FeedbackRequest - payload of POST /feedback.
 *
 * The owner is never part of the payload: it comes from the bearer token,
 * or is absent for anonymous degraded-mode submissions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotNull
    @Min(1)
    @Max(5)
    private Integer rating;

    @Size(max = 50)
    private String category;

    @Size(max = 2000)
    private String content;
}
