package com.platform.eslsync.model;

/**
 * Sync state of a locally persisted entity relative to AIMS.
 */
public enum SyncStatus {
    SYNCED,
    PENDING,
    FAILED
}
