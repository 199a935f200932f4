package com.platform.eslsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Schema-tolerant record returned by AIMS.
 * Field names vary across API versions, so nothing beyond the raw map is assumed here.
 */
public record RemoteRecord(Map<String, Object> fields) {

    public RemoteRecord {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RemoteRecord of(Map<String, Object> fields) {
        return new RemoteRecord(fields);
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
