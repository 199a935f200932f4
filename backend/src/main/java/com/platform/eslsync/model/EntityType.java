package com.platform.eslsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entity kinds understood by the sync queue.
 */
public enum EntityType {
    SPACE("space"),
    PERSON("person"),
    CONFERENCE("conference"),
    LIST("list");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
