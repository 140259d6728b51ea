package com.entity.datamining.router;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound request envelope. Values are kept as sent; the router validates them.
 *
 * @param type       request type wire name
 * @param entityType entity type wire name
 * @param entityId   entity ID
 * @param field      field wire name
 * @param context    free-form context, e.g. {@code twitter_handle}, {@code category}, {@code limit}
 * @param query      search text
 * @param format     output format hint, passed through
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrchestratorRequest(
        @JsonProperty("type") String type,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("field") String field,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("query") String query,
        @JsonProperty("format") String format
) {

    public OrchestratorRequest {
        context = context == null ? Map.of() : context;
    }

    public static OrchestratorRequest fetch(String entityType, String entityId, String field, Map<String, Object> context) {
        return new OrchestratorRequest(RequestType.FETCH.getWireName(), entityType, entityId, field, context, null, null);
    }

    public static OrchestratorRequest forceFetch(String entityType, String entityId, String field, Map<String, Object> context) {
        return new OrchestratorRequest(RequestType.FORCE_FETCH.getWireName(), entityType, entityId, field, context, null, null);
    }

    public static OrchestratorRequest evaluateLatestPost(String entityType, String entityId, Map<String, Object> context) {
        return new OrchestratorRequest(RequestType.EVALUATE_LATEST_POST.getWireName(), entityType, entityId, null, context, null, null);
    }

    public static OrchestratorRequest search(String query, String entityType, Map<String, Object> context) {
        return new OrchestratorRequest(RequestType.SEARCH.getWireName(), entityType, null, null, context, query, null);
    }
}
