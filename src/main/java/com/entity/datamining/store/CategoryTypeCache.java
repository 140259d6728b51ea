package com.entity.datamining.store;

import com.entity.datamining.core.model.CategoryType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed lookup of {@link CategoryType} rows by name.
 * Category types are seeded with the schema and change rarely; unknown names are not cached.
 */
public class CategoryTypeCache {
    private static final Logger log = LoggerFactory.getLogger(CategoryTypeCache.class);

    private static final int MAX_SIZE = 256;

    private final Cache<String, CategoryType> cache;

    public CategoryTypeCache(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(MAX_SIZE)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.debug("CategoryTypeCache initialized: ttl={}s", ttl.toSeconds());
    }

    /**
     * Resolves a category type by name, reading through to the given connection on a miss.
     *
     * @throws StorageException if the lookup query fails
     */
    public Optional<CategoryType> get(Connection conn, String name) {
        return Optional.ofNullable(cache.get(name, key -> load(conn, key)));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    private CategoryType load(Connection conn, String name) {
        String sql = "SELECT id, name, is_multiple FROM category_types WHERE name = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new CategoryType(rs.getLong("id"), rs.getString("name"), rs.getInt("is_multiple") != 0);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load category type '" + name + "': " + e.getMessage(), e);
        }
    }
}
