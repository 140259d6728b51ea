package com.entity.datamining.policy;

/**
 * Where the data in a response came from.
 */
public enum ResponseSource {
    LOCAL("local"),
    LOCAL_EMPTY("local_empty"),
    EXTERNAL("external"),
    EXTERNAL_FORCED("external_forced"),
    DATABASE_SEARCH("database_search");

    private final String wireName;

    ResponseSource(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
