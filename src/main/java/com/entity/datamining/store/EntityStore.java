package com.entity.datamining.store;

import com.entity.datamining.core.model.Category;
import com.entity.datamining.core.model.Entity;
import com.entity.datamining.core.model.EntityCategory;
import com.entity.datamining.core.model.EntityConnection;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.core.model.InfluencerDetails;
import com.entity.datamining.core.model.PoliticianDetails;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field-level access to the polymorphic entity model.
 * Hides which physical table backs a given field name.
 *
 * <p>"Not found" and "unknown field" are reported through return values so callers can decide
 * whether to fetch. Storage failures are thrown as {@link StorageException}.</p>
 */
public interface EntityStore extends AutoCloseable {

    /**
     * Reads a field of an entity.
     * Resolution order: base columns, the extension table of {@code entityType}, the synthetic
     * {@code categories}/{@code party} fields, then externally sourced values.
     *
     * @param entityType the type the caller believes the entity has
     * @param entityId   the entity ID
     * @param field      the field name
     * @return the value, or empty if the entity is missing, its stored type differs from
     *         {@code entityType}, the field is unknown, or the value is null
     */
    Optional<Object> getField(EntityType entityType, String entityId, String field);

    /**
     * Writes a field of an entity. Structured values are stored as JSON.
     * {@code category_<type>} fields assign a category, replacing the prior one for single-valued types.
     *
     * @return true if a row was written; false for unknown or read-only fields, type mismatches,
     *         missing entities and unresolvable categories
     */
    boolean setField(EntityType entityType, String entityId, String field, Object value);

    /**
     * Gets when a field was last written: the fetch time for sourced fields, the entity's
     * last update for column-backed fields.
     */
    Optional<Instant> getFieldUpdatedAt(EntityType entityType, String entityId, String field);

    /**
     * Finds entities of the same type connected to the reference entity, strongest first.
     */
    List<String> findRelevantEntities(EntityType entityType, String referenceId, int limit);

    /**
     * Text search over name, normalized name and bio.
     *
     * @param query      the search term
     * @param entityType optional type filter, may be null
     * @param category   optional category ID or code filter, may be null
     * @param limit      maximum results
     */
    List<Map<String, Object>> search(String query, EntityType entityType, String category, int limit);

    /**
     * Creates an entity along with the extension row its type requires.
     */
    Entity createEntity(Entity entity);

    Optional<Entity> getEntity(String entityId);

    Optional<PoliticianDetails> getPoliticianDetails(String entityId);

    Optional<InfluencerDetails> getInfluencerDetails(String entityId);

    /**
     * Lists the category assignments of an entity.
     */
    List<EntityCategory> getEntityCategories(String entityId);

    /**
     * Records a connection between two entities.
     *
     * @return the generated connection ID
     */
    long addConnection(EntityConnection connection);

    /**
     * Adds a category value to an existing category type.
     *
     * @return the generated category ID
     */
    long addCategory(String categoryType, String code, String name);

    List<Category> getCategories(String categoryType);

    @Override
    void close();
}
