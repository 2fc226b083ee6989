package com.qoeboost.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * ErrorResponse - uniform error body.
 *
 * <pre>
 * {
 *   "error": "validation_error",
 *   "message": "must not be blank",
 *   "field": "username",
 *   "status": 400,
 *   "path": "/auth/register",
 *   "timestamp": "2026-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * field is only present for validation errors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;
    private String message;
    private String field;
    private int status;
    private String path;
    private Instant timestamp;
}
