package com.platform.eslsync.model;

/**
 * Locally persisted record that may have a counterpart in AIMS.
 * externalId and virtualSpaceId are both null for records never linked to AIMS.
 */
public record LocalEntityRecord(
    String id,
    String externalId,
    String virtualSpaceId,
    SyncStatus syncStatus,
    String payload
) {
}
