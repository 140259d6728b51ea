package com.entity.datamining.router;

import java.util.Optional;

/**
 * Request types the router dispatches. Any other value is rejected.
 */
public enum RequestType {
    FETCH("fetch"),
    FORCE_FETCH("force_fetch"),
    EVALUATE_LATEST_POST("evaluate_latest_post"),
    SEARCH("search");

    private final String wireName;

    RequestType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<RequestType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RequestType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
