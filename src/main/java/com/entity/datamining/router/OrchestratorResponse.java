package com.entity.datamining.router;

import com.entity.datamining.policy.FieldResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Uniform response envelope returned for every request.
 *
 * @param success   whether the request succeeded
 * @param data      payload, may accompany an error
 * @param error     diagnostic text on failure
 * @param source    where the data came from
 * @param timestamp RFC 3339 time the response was produced
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestratorResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("data") Object data,
        @JsonProperty("error") String error,
        @JsonProperty("source") String source,
        @JsonProperty("timestamp") String timestamp
) {

    public static OrchestratorResponse success(Object data, String source, Instant at) {
        return new OrchestratorResponse(true, data, null, source, at.toString());
    }

    public static OrchestratorResponse failure(String error, Instant at) {
        return new OrchestratorResponse(false, null, error, null, at.toString());
    }

    public static OrchestratorResponse failure(String error, Object data, Instant at) {
        return new OrchestratorResponse(false, data, error, null, at.toString());
    }

    public static OrchestratorResponse from(FieldResponse response, Instant at) {
        if (response.success()) {
            return success(response.data(), response.source().getWireName(), at);
        }
        return failure(response.error(), at);
    }
}
