package com.platform.eslsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of verifying one store for one entity type.
 * 
 * verified is true only when nothing local is missing remotely and no error occurred.
 * extraInRemote is informational and never affects verified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(
    String storeId,
    String storeName,
    EntityType entityType,
    int totalLocal,
    int totalRemote,
    List<String> missingInRemote,
    List<String> extraInRemote,
    boolean verified,
    String error
) {

    public VerificationResult {
        missingInRemote = missingInRemote == null ? List.of() : List.copyOf(missingInRemote);
        extraInRemote = extraInRemote == null ? List.of() : List.copyOf(extraInRemote);
    }

    public static VerificationResult completed(
            Store store,
            EntityType entityType,
            int totalLocal,
            int totalRemote,
            List<String> missingInRemote,
            List<String> extraInRemote) {
        return new VerificationResult(
            store.id(),
            store.displayName(),
            entityType,
            totalLocal,
            totalRemote,
            missingInRemote,
            extraInRemote,
            missingInRemote.isEmpty(),
            null
        );
    }

    /**
     * Remote side could not be read. Inconclusive, never reported as drift.
     */
    public static VerificationResult fetchFailed(Store store, EntityType entityType, int totalLocal, String error) {
        return new VerificationResult(
            store.id(),
            store.displayName(),
            entityType,
            totalLocal,
            0,
            List.of(),
            List.of(),
            false,
            error
        );
    }

    public static VerificationResult failed(Store store, EntityType entityType, String error) {
        return fetchFailed(store, entityType, 0, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasDrift() {
        return !verified && error == null;
    }
}
