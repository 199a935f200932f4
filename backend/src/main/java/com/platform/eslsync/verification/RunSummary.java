package com.platform.eslsync.verification;

import java.time.Instant;

/**
 * Per-run counts of store outcomes.
 */
public record RunSummary(
    Instant completedAt,
    int totalStores,
    int verified,
    int drifted,
    int failed
) {
}
