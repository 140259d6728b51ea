package com.entity.datamining.store;

import com.entity.datamining.core.model.Category;
import com.entity.datamining.core.model.CategoryType;
import com.entity.datamining.core.model.Entity;
import com.entity.datamining.core.model.EntityCategory;
import com.entity.datamining.core.model.EntityConnection;
import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.core.model.FieldLocation;
import com.entity.datamining.core.model.InfluencerDetails;
import com.entity.datamining.core.model.PoliticianDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite implementation of {@link EntityStore}.
 *
 * <p>Column-backed fields are routed by {@link EntityField#getLocation()}; the column name is
 * always taken from the enum constant, never from caller input. Externally sourced values are
 * stored as JSON in {@code entity_field_values}.</p>
 */
public class SqliteEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteEntityStore.class);

    private static final String CATEGORY_SOURCE = "api_update";

    private final SqliteConnection conn;
    private final CategoryTypeCache categoryTypes;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SqliteEntityStore(SqliteConnection conn, CategoryTypeCache categoryTypes,
                             ObjectMapper objectMapper, Clock clock) {
        this.conn = Objects.requireNonNull(conn, "conn is required");
        this.categoryTypes = Objects.requireNonNull(categoryTypes, "categoryTypes is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Opens (and if needed creates) a store at the given database path.
     */
    public static SqliteEntityStore open(Path dbPath, Duration categoryCacheTtl) {
        return open(dbPath, categoryCacheTtl, Clock.systemUTC());
    }

    public static SqliteEntityStore open(Path dbPath, Duration categoryCacheTtl, Clock clock) {
        SqliteConnection connection = new SqliteConnection(dbPath);
        EntitySchema.initialize(connection);
        return new SqliteEntityStore(connection, new CategoryTypeCache(categoryCacheTtl),
                new ObjectMapper(), clock);
    }

    // ======== Field access ========

    @Override
    public Optional<Object> getField(EntityType entityType, String entityId, String field) {
        Optional<EntityField> known = EntityField.fromWire(field);
        if (known.isEmpty()) {
            log.warn("field.unknown field='{}' entityType={} entityId={}", field, entityType, entityId);
            return Optional.empty();
        }
        EntityField entityField = known.get();
        if (!entityField.appliesTo(entityType)) {
            log.warn("field.not_applicable field={} entityType={} entityId={}", field, entityType, entityId);
            return Optional.empty();
        }

        return query("read field " + field + " of " + entityId, c -> {
            if (!hasStoredType(c, entityId, entityType)) {
                return Optional.empty();
            }
            return switch (entityField.getLocation()) {
                case BASE -> readColumn(c, "entities", "id", entityField, entityId);
                case POLITICIAN -> readColumn(c, "politicians", "entity_id", entityField, entityId);
                case INFLUENCER -> readColumn(c, "influencers", "entity_id", entityField, entityId);
                case SYNTHETIC -> entityField == EntityField.CATEGORIES
                        ? Optional.<Object>of(readCategoriesByType(c, entityId))
                        : readParty(c, entityId);
                case SOURCED -> readSourcedValue(c, entityId, entityField);
            };
        });
    }

    @Override
    public boolean setField(EntityType entityType, String entityId, String field, Object value) {
        Optional<EntityField> known = EntityField.fromWire(field);
        if (known.isEmpty()) {
            Optional<String> categoryType = EntityField.parseCategoryType(field);
            if (categoryType.isPresent()) {
                return assignCategory(entityType, entityId, categoryType.get(), value);
            }
            log.warn("field.unknown field='{}' entityType={} entityId={}", field, entityType, entityId);
            return false;
        }

        EntityField entityField = known.get();
        if (!entityField.isWritable() || !entityField.appliesTo(entityType)) {
            log.warn("field.not_writable field={} entityType={} entityId={}", field, entityType, entityId);
            return false;
        }

        return transaction("write field " + field + " of " + entityId, c -> {
            if (!hasStoredType(c, entityId, entityType)) {
                log.warn("field.type_mismatch field={} entityType={} entityId={}", field, entityType, entityId);
                return false;
            }
            String now = clock.instant().toString();
            switch (entityField.getLocation()) {
                case BASE -> writeColumn(c, "entities", "id", entityField, entityId, toColumnValue(value));
                case POLITICIAN -> writeExtensionColumn(c, "politicians", entityField, entityId, toColumnValue(value));
                case INFLUENCER -> writeExtensionColumn(c, "influencers", entityField, entityId, toColumnValue(value));
                case SOURCED -> writeSourcedValue(c, entityId, entityField, toJson(value), now);
                case SYNTHETIC -> throw new IllegalStateException("Synthetic field is read-only: " + field);
            }
            touch(c, entityId, now);
            log.debug("field.updated field={} entityType={} entityId={}", field, entityType, entityId);
            return true;
        });
    }

    @Override
    public Optional<Instant> getFieldUpdatedAt(EntityType entityType, String entityId, String field) {
        Optional<EntityField> known = EntityField.fromWire(field);
        if (known.isEmpty()) {
            return Optional.empty();
        }
        return query("read update time of " + field, c -> {
            if (!hasStoredType(c, entityId, entityType)) {
                return Optional.empty();
            }
            String sql = known.get().getLocation() == FieldLocation.SOURCED
                    ? "SELECT fetched_at FROM entity_field_values WHERE entity_id = ? AND field_name = ?"
                    : "SELECT last_updated FROM entities WHERE id = ?";
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, entityId);
                if (known.get().getLocation() == FieldLocation.SOURCED) {
                    stmt.setString(2, known.get().getWireName());
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next() || rs.getString(1) == null) {
                        return Optional.empty();
                    }
                    return Optional.of(Instant.parse(rs.getString(1)));
                }
            }
        });
    }

    // ======== Relationships and search ========

    @Override
    public List<String> findRelevantEntities(EntityType entityType, String referenceId, int limit) {
        String sql = """
            SELECT e.id, MAX(ec.strength) AS strength
            FROM entity_connections ec
            JOIN entities e ON (ec.entity2_id = e.id AND ec.entity1_id = ?)
                           OR (ec.entity1_id = e.id AND ec.entity2_id = ?)
            WHERE e.entity_type = ? AND e.id <> ?
            GROUP BY e.id
            ORDER BY strength DESC, e.id
            LIMIT ?
            """;
        return query("find entities related to " + referenceId, c -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, referenceId);
                stmt.setString(2, referenceId);
                stmt.setString(3, entityType.getWireName());
                stmt.setString(4, referenceId);
                stmt.setInt(5, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString("id"));
                    }
                }
            }
            return ids;
        });
    }

    @Override
    public List<Map<String, Object>> search(String query, EntityType entityType, String category, int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT e.id, e.entity_type, e.name, e.normalized_name, e.bio, e.twitter_handle,
                   e.website_url, e.relevance_score, e.last_updated,
                   p.office, p.state, p.district, i.platform, i.audience_size
            FROM entities e
            LEFT JOIN politicians p ON p.entity_id = e.id
            LEFT JOIN influencers i ON i.entity_id = e.id
            WHERE (e.name LIKE ? ESCAPE '\\' OR e.normalized_name LIKE ? ESCAPE '\\' OR e.bio LIKE ? ESCAPE '\\')
            """);
        List<Object> params = new ArrayList<>();
        String pattern = "%" + escapeLike(query) + "%";
        params.add(pattern);
        params.add(pattern);
        params.add(pattern);

        if (entityType != null) {
            sql.append(" AND e.entity_type = ?");
            params.add(entityType.getWireName());
        }
        if (category != null && !category.isBlank()) {
            if (category.chars().allMatch(Character::isDigit)) {
                sql.append(" AND EXISTS (SELECT 1 FROM entity_categories ec"
                        + " WHERE ec.entity_id = e.id AND ec.category_id = ?)");
                params.add(Long.parseLong(category));
            } else {
                sql.append(" AND EXISTS (SELECT 1 FROM entity_categories ec"
                        + " JOIN categories c ON ec.category_id = c.id"
                        + " WHERE ec.entity_id = e.id AND c.code = ?)");
                params.add(category);
            }
        }
        sql.append(" ORDER BY e.relevance_score DESC, e.name LIMIT ?");
        params.add(limit);

        return transaction("search '" + query + "'", c -> {
            List<Map<String, Object>> results = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        results.add(rowToMap(rs));
                    }
                }
            }
            try (PreparedStatement stmt = c.prepareStatement(
                    "INSERT INTO search_history (query, timestamp, results_count) VALUES (?, ?, ?)")) {
                stmt.setString(1, query);
                stmt.setString(2, clock.instant().toString());
                stmt.setInt(3, results.size());
                stmt.executeUpdate();
            }
            return results;
        });
    }

    // ======== Entity lifecycle ========

    @Override
    public Entity createEntity(Entity entity) {
        return transaction("create entity " + entity.getId(), c -> {
            String sql = """
                INSERT INTO entities
                (id, entity_type, name, normalized_name, bio, twitter_handle, website_url, relevance_score, last_updated)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, entity.getId());
                stmt.setString(2, entity.getType().getWireName());
                stmt.setString(3, entity.getName());
                stmt.setString(4, entity.getNormalizedName());
                stmt.setString(5, entity.getBio());
                stmt.setString(6, entity.getTwitterHandle());
                stmt.setString(7, entity.getWebsiteUrl());
                stmt.setDouble(8, entity.getRelevanceScore());
                stmt.setString(9, entity.getLastUpdated() != null ? entity.getLastUpdated().toString() : null);
                stmt.executeUpdate();
            }
            switch (entity.getType()) {
                case POLITICIAN -> insertExtensionRow(c, "politicians", entity.getId());
                case INFLUENCER -> insertExtensionRow(c, "influencers", entity.getId());
                case ORGANIZATION -> { }
            }
            log.debug("entity.created id={} type={} name='{}'", entity.getId(), entity.getType(), entity.getName());
            return entity;
        });
    }

    @Override
    public Optional<Entity> getEntity(String entityId) {
        return query("read entity " + entityId, c -> {
            try (PreparedStatement stmt = c.prepareStatement("SELECT * FROM entities WHERE id = ?")) {
                stmt.setString(1, entityId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    String lastUpdated = rs.getString("last_updated");
                    return Optional.of(Entity.builder()
                            .id(rs.getString("id"))
                            .type(EntityType.fromWire(rs.getString("entity_type")).orElseThrow())
                            .name(rs.getString("name"))
                            .normalizedName(rs.getString("normalized_name"))
                            .bio(rs.getString("bio"))
                            .twitterHandle(rs.getString("twitter_handle"))
                            .websiteUrl(rs.getString("website_url"))
                            .relevanceScore(rs.getDouble("relevance_score"))
                            .lastUpdated(lastUpdated != null ? Instant.parse(lastUpdated) : null)
                            .build());
                }
            }
        });
    }

    @Override
    public Optional<PoliticianDetails> getPoliticianDetails(String entityId) {
        return query("read politician " + entityId, c -> {
            try (PreparedStatement stmt = c.prepareStatement("SELECT * FROM politicians WHERE entity_id = ?")) {
                stmt.setString(1, entityId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    int year = rs.getInt("election_year");
                    Integer electionYear = rs.wasNull() ? null : year;
                    return Optional.of(new PoliticianDetails(
                            rs.getString("entity_id"),
                            rs.getString("office"),
                            rs.getString("state"),
                            rs.getString("district"),
                            electionYear,
                            rs.getString("bioguide_id")));
                }
            }
        });
    }

    @Override
    public Optional<InfluencerDetails> getInfluencerDetails(String entityId) {
        return query("read influencer " + entityId, c -> {
            try (PreparedStatement stmt = c.prepareStatement("SELECT * FROM influencers WHERE entity_id = ?")) {
                stmt.setString(1, entityId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    long audienceSize = rs.getLong("audience_size");
                    Long audience = rs.wasNull() ? null : audienceSize;
                    return Optional.of(new InfluencerDetails(
                            rs.getString("entity_id"),
                            rs.getString("platform"),
                            audience,
                            rs.getString("content_focus"),
                            rs.getDouble("influence_score")));
                }
            }
        });
    }

    @Override
    public List<EntityCategory> getEntityCategories(String entityId) {
        String sql = """
            SELECT entity_id, category_id, confidence_score, source
            FROM entity_categories
            WHERE entity_id = ?
            ORDER BY category_id
            """;
        return query("list category assignments of " + entityId, c -> {
            List<EntityCategory> assignments = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, entityId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        assignments.add(new EntityCategory(rs.getString("entity_id"), rs.getLong("category_id"),
                                rs.getDouble("confidence_score"), rs.getString("source")));
                    }
                }
            }
            return assignments;
        });
    }

    @Override
    public long addConnection(EntityConnection connection) {
        String sql = """
            INSERT INTO entity_connections
            (entity1_id, entity2_id, connection_type, strength, source, first_detected, last_updated)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        return transaction("add connection", c -> {
            String now = clock.instant().toString();
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, connection.entity1Id());
                stmt.setString(2, connection.entity2Id());
                stmt.setString(3, connection.connectionType());
                stmt.setDouble(4, connection.strength());
                stmt.setString(5, connection.source());
                stmt.setString(6, now);
                stmt.setString(7, now);
                stmt.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public long addCategory(String categoryType, String code, String name) {
        return transaction("add category " + categoryType + "/" + code, c -> {
            CategoryType type = categoryTypes.get(c, categoryType)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown category type: " + categoryType));
            try (PreparedStatement stmt = c.prepareStatement(
                    "INSERT INTO categories (category_type_id, code, name) VALUES (?, ?, ?)")) {
                stmt.setLong(1, type.id());
                stmt.setString(2, code);
                stmt.setString(3, name);
                stmt.executeUpdate();
            }
            return lastInsertId(c);
        });
    }

    @Override
    public List<Category> getCategories(String categoryType) {
        String sql = """
            SELECT c.id, ct.name AS category_type, c.code, c.name
            FROM categories c
            JOIN category_types ct ON c.category_type_id = ct.id
            WHERE ct.name = ?
            ORDER BY c.display_order, c.name
            """;
        return query("list categories of " + categoryType, c -> {
            List<Category> categories = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, categoryType);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        categories.add(new Category(rs.getLong("id"), rs.getString("category_type"),
                                rs.getString("code"), rs.getString("name")));
                    }
                }
            }
            return categories;
        });
    }

    @Override
    public void close() {
        conn.close();
    }

    // ======== Categories ========

    private boolean assignCategory(EntityType entityType, String entityId, String categoryTypeName, Object value) {
        return transaction("assign " + categoryTypeName + " to " + entityId, c -> {
            if (!hasStoredType(c, entityId, entityType)) {
                log.warn("category.type_mismatch categoryType={} entityType={} entityId={}",
                        categoryTypeName, entityType, entityId);
                return false;
            }
            Optional<CategoryType> type = categoryTypes.get(c, categoryTypeName);
            if (type.isEmpty()) {
                log.error("category.type_not_found categoryType='{}'", categoryTypeName);
                return false;
            }
            Optional<Long> categoryId = resolveCategoryId(c, type.get(), value);
            if (categoryId.isEmpty()) {
                log.error("category.not_found categoryType={} value='{}'", categoryTypeName, value);
                return false;
            }

            if (!type.get().multiple()) {
                try (PreparedStatement stmt = c.prepareStatement("""
                        DELETE FROM entity_categories
                        WHERE entity_id = ? AND category_id IN (
                            SELECT id FROM categories WHERE category_type_id = ?
                        )
                        """)) {
                    stmt.setString(1, entityId);
                    stmt.setLong(2, type.get().id());
                    stmt.executeUpdate();
                }
            }

            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT OR REPLACE INTO entity_categories (entity_id, category_id, confidence_score, source)
                    VALUES (?, ?, 1.0, ?)
                    """)) {
                stmt.setString(1, entityId);
                stmt.setLong(2, categoryId.get());
                stmt.setString(3, CATEGORY_SOURCE);
                stmt.executeUpdate();
            }
            log.debug("category.assigned categoryType={} categoryId={} entityId={}",
                    categoryTypeName, categoryId.get(), entityId);
            return true;
        });
    }

    private Optional<Long> resolveCategoryId(Connection c, CategoryType type, Object value) throws SQLException {
        if (value instanceof Number number) {
            try (PreparedStatement stmt = c.prepareStatement(
                    "SELECT id FROM categories WHERE id = ? AND category_type_id = ?")) {
                stmt.setLong(1, number.longValue());
                stmt.setLong(2, type.id());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
                }
            }
        }
        if (value == null) {
            return Optional.empty();
        }
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT id FROM categories WHERE (code = ? OR name = ?) AND category_type_id = ?")) {
            stmt.setString(1, value.toString());
            stmt.setString(2, value.toString());
            stmt.setLong(3, type.id());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private Map<String, List<Map<String, Object>>> readCategoriesByType(Connection c, String entityId)
            throws SQLException {
        String sql = """
            SELECT c.id, c.code, c.name, c.description, ct.name AS category_type, ec.confidence_score
            FROM entity_categories ec
            JOIN categories c ON ec.category_id = c.id
            JOIN category_types ct ON c.category_type_id = ct.id
            WHERE ec.entity_id = ?
            ORDER BY ct.name, c.display_order, c.name
            """;
        Map<String, List<Map<String, Object>>> grouped = new LinkedHashMap<>();
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> category = new LinkedHashMap<>();
                    category.put("id", rs.getLong("id"));
                    category.put("code", rs.getString("code"));
                    category.put("name", rs.getString("name"));
                    category.put("description", rs.getString("description"));
                    category.put("confidence", rs.getDouble("confidence_score"));
                    grouped.computeIfAbsent(rs.getString("category_type"), k -> new ArrayList<>()).add(category);
                }
            }
        }
        return grouped;
    }

    private Optional<Object> readParty(Connection c, String entityId) throws SQLException {
        String sql = """
            SELECT c.name
            FROM entity_categories ec
            JOIN categories c ON ec.category_id = c.id
            JOIN category_types ct ON c.category_type_id = ct.id
            WHERE ec.entity_id = ? AND ct.name = 'party'
            LIMIT 1
            """;
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    // ======== Column and sourced-value helpers ========

    private boolean hasStoredType(Connection c, String entityId, EntityType expected) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement("SELECT entity_type FROM entities WHERE id = ?")) {
            stmt.setString(1, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    log.debug("entity.not_found entityId={}", entityId);
                    return false;
                }
                String stored = rs.getString(1);
                if (!expected.getWireName().equals(stored)) {
                    log.warn("entity.type_mismatch entityId={} requested={} stored={}", entityId, expected, stored);
                    return false;
                }
                return true;
            }
        }
    }

    private Optional<Object> readColumn(Connection c, String table, String keyColumn,
                                        EntityField field, String entityId) throws SQLException {
        String sql = "SELECT " + field.getWireName() + " FROM " + table + " WHERE " + keyColumn + " = ?";
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getObject(1)) : Optional.empty();
            }
        }
    }

    private void writeColumn(Connection c, String table, String keyColumn,
                             EntityField field, String entityId, Object value) throws SQLException {
        String sql = "UPDATE " + table + " SET " + field.getWireName() + " = ? WHERE " + keyColumn + " = ?";
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setObject(1, value);
            stmt.setString(2, entityId);
            stmt.executeUpdate();
        }
    }

    private void writeExtensionColumn(Connection c, String table, EntityField field,
                                      String entityId, Object value) throws SQLException {
        insertExtensionRow(c, table, entityId);
        writeColumn(c, table, "entity_id", field, entityId, value);
    }

    private void insertExtensionRow(Connection c, String table, String entityId) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement(
                "INSERT OR IGNORE INTO " + table + " (entity_id) VALUES (?)")) {
            stmt.setString(1, entityId);
            stmt.executeUpdate();
        }
    }

    private Optional<Object> readSourcedValue(Connection c, String entityId, EntityField field) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT field_value FROM entity_field_values WHERE entity_id = ? AND field_name = ?")) {
            stmt.setString(1, entityId);
            stmt.setString(2, field.getWireName());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next() || rs.getString(1) == null) {
                    return Optional.empty();
                }
                return Optional.ofNullable(fromJson(rs.getString(1)));
            }
        }
    }

    private void writeSourcedValue(Connection c, String entityId, EntityField field,
                                   String json, String fetchedAt) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement("""
                INSERT OR REPLACE INTO entity_field_values (entity_id, field_name, field_value, source, fetched_at)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, entityId);
            stmt.setString(2, field.getWireName());
            stmt.setString(3, json);
            stmt.setString(4, "external");
            stmt.setString(5, fetchedAt);
            stmt.executeUpdate();
        }
    }

    private void touch(Connection c, String entityId, String now) throws SQLException {
        try (PreparedStatement stmt = c.prepareStatement("UPDATE entities SET last_updated = ? WHERE id = ?")) {
            stmt.setString(1, now);
            stmt.setString(2, entityId);
            stmt.executeUpdate();
        }
    }

    private long lastInsertId(Connection c) throws SQLException {
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : -1L;
        }
    }

    /**
     * Escapes LIKE wildcards so the query matches literally.
     */
    static String escapeLike(String query) {
        return query.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Map<String, Object> rowToMap(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }

    /**
     * Scalars are stored as-is; maps, collections and other objects as JSON text.
     */
    private Object toColumnValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return toJson(value);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Value is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Object fromJson(String json) {
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            log.warn("field.corrupt_json error={}", e.getOriginalMessage());
            return json;
        }
    }

    private <T> T query(String description, SqliteConnection.TransactionFunction<T> function) {
        try {
            return conn.execute(function);
        } catch (SQLException e) {
            throw new StorageException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    private <T> T transaction(String description, SqliteConnection.TransactionFunction<T> function) {
        try {
            return conn.executeInTransaction(function);
        } catch (SQLException e) {
            throw new StorageException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }
}
