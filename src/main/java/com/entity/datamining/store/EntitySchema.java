package com.entity.datamining.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates and versions the SQLite schema of the entity store.
 */
public final class EntitySchema {

    private static final Logger log = LoggerFactory.getLogger(EntitySchema.class);

    public static final int CURRENT_VERSION = 1;

    private EntitySchema() {
    }

    /**
     * Creates all tables and seeds the standard category types if the database is fresh.
     */
    public static void initialize(SqliteConnection conn) {
        try {
            conn.executeInTransaction(c -> {
                int version = getSchemaVersion(c);
                if (version == 0) {
                    createAllTables(c);
                    seedCategoryTypes(c);
                    setSchemaVersion(c, CURRENT_VERSION);
                    log.info("Created entity schema v{} at {}", CURRENT_VERSION, conn.getDbFile());
                } else {
                    log.debug("Entity schema v{} up to date at {}", version, conn.getDbFile());
                }
                return null;
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize entity schema: " + e.getMessage(), e);
        }
    }

    private static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entities (
                    id TEXT PRIMARY KEY,
                    entity_type TEXT NOT NULL,
                    name TEXT NOT NULL,
                    normalized_name TEXT NOT NULL UNIQUE,
                    bio TEXT,
                    twitter_handle TEXT,
                    instagram_handle TEXT,
                    facebook_url TEXT,
                    website_url TEXT,
                    relevance_score REAL DEFAULT 0.0,
                    last_updated TEXT,
                    CHECK (entity_type IN ('politician', 'influencer', 'organization'))
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_entities_type ON entities(entity_type)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_entities_relevance ON entities(relevance_score DESC)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS politicians (
                    entity_id TEXT PRIMARY KEY,
                    office TEXT,
                    state TEXT,
                    district TEXT,
                    election_year INTEGER,
                    bioguide_id TEXT UNIQUE,
                    FOREIGN KEY (entity_id) REFERENCES entities(id) ON DELETE CASCADE
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS influencers (
                    entity_id TEXT PRIMARY KEY,
                    platform TEXT,
                    audience_size INTEGER,
                    content_focus TEXT,
                    influence_score REAL DEFAULT 0.0,
                    FOREIGN KEY (entity_id) REFERENCES entities(id) ON DELETE CASCADE
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS category_types (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    name TEXT NOT NULL UNIQUE,
                    description TEXT,
                    is_multiple INTEGER NOT NULL DEFAULT 0
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS categories (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    category_type_id INTEGER NOT NULL,
                    code TEXT NOT NULL,
                    name TEXT NOT NULL,
                    description TEXT,
                    display_order INTEGER DEFAULT 0,
                    UNIQUE (category_type_id, code),
                    FOREIGN KEY (category_type_id) REFERENCES category_types(id)
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_categories_code ON categories(code)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entity_categories (
                    entity_id TEXT NOT NULL,
                    category_id INTEGER NOT NULL,
                    confidence_score REAL DEFAULT 1.0,
                    source TEXT,
                    PRIMARY KEY (entity_id, category_id),
                    FOREIGN KEY (entity_id) REFERENCES entities(id) ON DELETE CASCADE,
                    FOREIGN KEY (category_id) REFERENCES categories(id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entity_connections (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    entity1_id TEXT NOT NULL,
                    entity2_id TEXT NOT NULL,
                    connection_type TEXT NOT NULL,
                    strength REAL DEFAULT 0.0,
                    source TEXT,
                    first_detected TEXT,
                    last_updated TEXT,
                    FOREIGN KEY (entity1_id) REFERENCES entities(id) ON DELETE CASCADE,
                    FOREIGN KEY (entity2_id) REFERENCES entities(id) ON DELETE CASCADE
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_connections_entity1 ON entity_connections(entity1_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_connections_entity2 ON entity_connections(entity2_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entity_field_values (
                    entity_id TEXT NOT NULL,
                    field_name TEXT NOT NULL,
                    field_value TEXT,
                    source TEXT,
                    fetched_at TEXT NOT NULL,
                    PRIMARY KEY (entity_id, field_name),
                    FOREIGN KEY (entity_id) REFERENCES entities(id) ON DELETE CASCADE
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS search_history (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    query TEXT NOT NULL,
                    timestamp TEXT NOT NULL,
                    results_count INTEGER
                )
                """);
        }
    }

    private static void seedCategoryTypes(Connection conn) throws SQLException {
        String sql = "INSERT OR IGNORE INTO category_types (name, description, is_multiple) VALUES (?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            addCategoryType(stmt, "party", "Political party affiliation", false);
            addCategoryType(stmt, "ideology", "Political ideology or worldview", true);
            addCategoryType(stmt, "trump_stance", "Position toward Donald Trump", false);
            addCategoryType(stmt, "entity_type", "General entity classification", false);
            addCategoryType(stmt, "entity_subtype", "Specific role or position", false);
            stmt.executeBatch();
        }
    }

    private static void addCategoryType(PreparedStatement stmt, String name, String description,
                                        boolean multiple) throws SQLException {
        stmt.setString(1, name);
        stmt.setString(2, description);
        stmt.setInt(3, multiple ? 1 : 0);
        stmt.addBatch();
    }
}
