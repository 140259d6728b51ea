package com.entity.datamining.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * A tracked political actor: the shared columns of the {@code entities} table.
 * Type-specific attributes live in {@link PoliticianDetails} and {@link InfluencerDetails}.
 */
public class Entity {
    private final String id;
    private final EntityType type;
    private final String name;
    private final String normalizedName;
    private final String bio;
    private final String twitterHandle;
    private final String websiteUrl;
    private final double relevanceScore;
    private final Instant lastUpdated;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.name = builder.name;
        this.normalizedName = builder.normalizedName != null
                ? builder.normalizedName
                : normalize(builder.name);
        this.bio = builder.bio;
        this.twitterHandle = builder.twitterHandle;
        this.websiteUrl = builder.websiteUrl;
        this.relevanceScore = builder.relevanceScore;
        this.lastUpdated = builder.lastUpdated;
    }

    /**
     * Normalized form used for the unique name index.
     */
    public static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getBio() {
        return bio;
    }

    public String getTwitterHandle() {
        return twitterHandle;
    }

    public String getWebsiteUrl() {
        return websiteUrl;
    }

    public double getRelevanceScore() {
        return relevanceScore;
    }

    /**
     * Time of the last successful field write, or null if never updated.
     */
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", name='" + name + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", relevanceScore=" + relevanceScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String name;
        private String normalizedName;
        private String bio;
        private String twitterHandle;
        private String websiteUrl;
        private double relevanceScore;
        private Instant lastUpdated;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder bio(String bio) {
            this.bio = bio;
            return this;
        }

        public Builder twitterHandle(String twitterHandle) {
            this.twitterHandle = twitterHandle;
            return this;
        }

        public Builder websiteUrl(String websiteUrl) {
            this.websiteUrl = websiteUrl;
            return this;
        }

        public Builder relevanceScore(double relevanceScore) {
            this.relevanceScore = relevanceScore;
            return this;
        }

        public Builder lastUpdated(Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            return new Entity(this);
        }
    }
}
