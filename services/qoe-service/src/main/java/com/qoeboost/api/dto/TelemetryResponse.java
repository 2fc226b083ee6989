package com.qoeboost.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qoeboost.api.storage.StorageMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TelemetryResponse - envelope of every feedback and network-log response.
 *
 * storage and degraded tell the client where its data went: a FALLBACK
 * response is never durable, and the envelope says so explicitly.
 * anonymous is true when the request carried no bearer token; such
 * submissions are only accepted in degraded mode.
 *
 * offset and limit are present on list responses only.
 *
 * @param <T> a FeedbackResponse, a NetworkLogResponse, or a list of either
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryResponse<T> {

    private StorageMode storage;
    private boolean degraded;
    private boolean anonymous;
    private Integer offset;
    private Integer limit;
    private T data;
}
