package com.entity.datamining.policy;

import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.store.EntityStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shapes the context handed to a source for fields that need more than the entity ID.
 */
public class FetchContextAssembler {

    public static final String TWITTER_HANDLE = EntityField.TWITTER_HANDLE.getWireName();

    private final EntityStore store;

    public FetchContextAssembler(EntityStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * Returns a copy of {@code context} completed with what the field's source needs.
     *
     * @throws MissingContextException if {@code latest_tweet} is requested and no handle is known
     * @throws com.entity.datamining.store.StorageException if the handle lookup fails
     */
    public Map<String, Object> assemble(EntityType entityType, String entityId, String field,
                                        Map<String, Object> context) {
        Map<String, Object> assembled = context == null ? new HashMap<>() : new HashMap<>(context);
        if (EntityField.LATEST_TWEET.getWireName().equals(field)) {
            String handle = resolveTwitterHandle(entityType, entityId, assembled)
                    .orElseThrow(() -> new MissingContextException(entityId, TWITTER_HANDLE));
            assembled.put(TWITTER_HANDLE, handle);
        }
        return assembled;
    }

    /**
     * Resolves the twitter handle from the context first, then from the store, without a leading {@code @}.
     */
    public Optional<String> resolveTwitterHandle(EntityType entityType, String entityId, Map<String, Object> context) {
        Object fromContext = context == null ? null : context.get(TWITTER_HANDLE);
        String handle = fromContext instanceof String s && !s.isBlank()
                ? s
                : store.getField(entityType, entityId, TWITTER_HANDLE)
                        .map(Object::toString)
                        .orElse(null);
        if (handle == null) {
            return Optional.empty();
        }
        String stripped = handle.strip();
        if (stripped.startsWith("@")) {
            stripped = stripped.substring(1);
        }
        return stripped.isEmpty() ? Optional.empty() : Optional.of(stripped);
    }
}
