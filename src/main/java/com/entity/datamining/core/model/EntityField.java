package com.entity.datamining.core.model;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of field identifiers an entity exposes, each routed to its backing table.
 * Category assignments ({@code category_<type>}) are not constants; see {@link #parseCategoryType(String)}.
 */
public enum EntityField {
    NAME("name", FieldLocation.BASE),
    NORMALIZED_NAME("normalized_name", FieldLocation.BASE),
    BIO("bio", FieldLocation.BASE),
    TWITTER_HANDLE("twitter_handle", FieldLocation.BASE),
    INSTAGRAM_HANDLE("instagram_handle", FieldLocation.BASE),
    FACEBOOK_URL("facebook_url", FieldLocation.BASE),
    WEBSITE_URL("website_url", FieldLocation.BASE),
    RELEVANCE_SCORE("relevance_score", FieldLocation.BASE),

    OFFICE("office", FieldLocation.POLITICIAN),
    STATE("state", FieldLocation.POLITICIAN),
    DISTRICT("district", FieldLocation.POLITICIAN),
    ELECTION_YEAR("election_year", FieldLocation.POLITICIAN),
    BIOGUIDE_ID("bioguide_id", FieldLocation.POLITICIAN),

    PLATFORM("platform", FieldLocation.INFLUENCER),
    AUDIENCE_SIZE("audience_size", FieldLocation.INFLUENCER),
    CONTENT_FOCUS("content_focus", FieldLocation.INFLUENCER),
    INFLUENCE_SCORE("influence_score", FieldLocation.INFLUENCER),

    CATEGORIES("categories", FieldLocation.SYNTHETIC),
    PARTY("party", FieldLocation.SYNTHETIC),

    LATEST_TWEET("latest_tweet", FieldLocation.SOURCED),
    LATEST_VIDEOS("latest_videos", FieldLocation.SOURCED),
    METRICS("metrics", FieldLocation.SOURCED),
    STANCES("stances", FieldLocation.SOURCED),
    FEC_FILINGS("fec_filings", FieldLocation.SOURCED),
    VOTING_RECORD("voting_record", FieldLocation.SOURCED),
    COMMITTEES("committees", FieldLocation.SOURCED);

    public static final String CATEGORY_PREFIX = "category_";

    private static final Map<String, EntityField> BY_WIRE_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(EntityField::getWireName, Function.identity()));

    private final String wireName;
    private final FieldLocation location;

    EntityField(String wireName, FieldLocation location) {
        this.wireName = wireName;
        this.location = location;
    }

    /**
     * Field name as used in requests; doubles as the column name for table-backed fields.
     */
    public String getWireName() {
        return wireName;
    }

    public FieldLocation getLocation() {
        return location;
    }

    /**
     * Whether this field exists on entities of the given type.
     * Extension columns only exist for their own entity type.
     */
    public boolean appliesTo(EntityType type) {
        return switch (location) {
            case POLITICIAN -> type == EntityType.POLITICIAN;
            case INFLUENCER -> type == EntityType.INFLUENCER;
            case BASE, SYNTHETIC, SOURCED -> true;
        };
    }

    public boolean isWritable() {
        return location != FieldLocation.SYNTHETIC;
    }

    public static Optional<EntityField> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(name));
    }

    /**
     * Extracts {@code <type>} from a {@code category_<type>} field name.
     */
    public static Optional<String> parseCategoryType(String name) {
        if (name == null || !name.startsWith(CATEGORY_PREFIX) || name.length() == CATEGORY_PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(name.substring(CATEGORY_PREFIX.length()));
    }
}
