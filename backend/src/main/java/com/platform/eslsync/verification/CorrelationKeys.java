package com.platform.eslsync.verification;

import com.platform.eslsync.model.LocalEntityRecord;
import com.platform.eslsync.model.RemoteRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the key used to pair a local record with its AIMS article.
 * Blank values count as absent; an absent key excludes the record from comparison.
 */
public final class CorrelationKeys {
    
    /**
     * AIMS identity fields in resolution order.
     */
    public static final List<String> REMOTE_ID_ALIASES = List.of("articleId", "article_id", "ARTICLE_ID", "id");
    
    private CorrelationKeys() {
    }
    
    public static Optional<String> forLocal(LocalEntityRecord record) {
        return normalize(record.externalId())
            .or(() -> normalize(record.virtualSpaceId()));
    }
    
    public static Optional<String> forRemote(RemoteRecord record) {
        for (String alias : REMOTE_ID_ALIASES) {
            Optional<String> key = record.field(alias).flatMap(CorrelationKeys::normalize);
            if (key.isPresent()) {
                return key;
            }
        }
        return Optional.empty();
    }
    
    private static Optional<String> normalize(Object value) {
        if (value == null || value instanceof Iterable<?> || value instanceof Map<?, ?>) {
            return Optional.empty();
        }
        String key = value.toString().trim();
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }
}
