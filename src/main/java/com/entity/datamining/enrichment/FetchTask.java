package com.entity.datamining.enrichment;

import com.entity.datamining.core.model.EntityType;

import java.time.Instant;
import java.util.Objects;

/**
 * In-memory unit of background work: fan one fetched field out to entities related to the reference.
 *
 * @param type        task kind, always {@value #ENRICH}
 * @param entityType  type shared by the reference and the entities to update
 * @param field       field wire name to fetch
 * @param referenceId entity whose live fetch produced the task
 * @param enqueuedAt  creation time
 */
public record FetchTask(String type, EntityType entityType, String field, String referenceId, Instant enqueuedAt) {

    public static final String ENRICH = "enrich";

    public FetchTask {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(referenceId, "referenceId is required");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt is required");
    }

    public static FetchTask enrich(EntityType entityType, String field, String referenceId, Instant enqueuedAt) {
        return new FetchTask(ENRICH, entityType, field, referenceId, enqueuedAt);
    }
}
