package com.entity.datamining.source;

import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup from {@code (entity type, field)} to the source that fetches it live.
 * Built once at startup with concrete sources or test doubles.
 */
public final class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final Map<EntityType, Map<EntityField, SourceFunction>> sources;

    private SourceRegistry(Builder builder) {
        Map<EntityType, Map<EntityField, SourceFunction>> copy = new EnumMap<>(EntityType.class);
        builder.sources.forEach((type, fields) ->
                copy.put(type, Collections.unmodifiableMap(new EnumMap<>(fields))));
        this.sources = Collections.unmodifiableMap(copy);
    }

    /**
     * Finds the source for a field.
     *
     * @param entityType the entity type
     * @param field      the field wire name
     * @return the source, or empty if none is registered or the field is unknown
     */
    public Optional<SourceFunction> lookup(EntityType entityType, String field) {
        return EntityField.fromWire(field).flatMap(f -> lookup(entityType, f));
    }

    public Optional<SourceFunction> lookup(EntityType entityType, EntityField field) {
        Map<EntityField, SourceFunction> byField = sources.get(entityType);
        return byField == null ? Optional.empty() : Optional.ofNullable(byField.get(field));
    }

    /**
     * Fields with a registered source for the given type.
     */
    public Set<EntityField> registeredFields(EntityType entityType) {
        Map<EntityField, SourceFunction> byField = sources.get(entityType);
        return byField == null ? Set.of() : byField.keySet();
    }

    public static SourceRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<EntityType, Map<EntityField, SourceFunction>> sources = new EnumMap<>(EntityType.class);

        public Builder register(EntityType entityType, EntityField field, SourceFunction source) {
            Objects.requireNonNull(entityType, "entityType is required");
            Objects.requireNonNull(field, "field is required");
            Objects.requireNonNull(source, "source is required");
            if (!field.isWritable()) {
                throw new IllegalArgumentException("Field cannot be fetched: " + field.getWireName());
            }
            SourceFunction previous = sources.computeIfAbsent(entityType, k -> new EnumMap<>(EntityField.class))
                    .put(field, source);
            if (previous != null) {
                log.warn("Replacing source for {}/{}", entityType.getWireName(), field.getWireName());
            }
            return this;
        }

        public SourceRegistry build() {
            return new SourceRegistry(this);
        }
    }
}
