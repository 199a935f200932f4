package com.platform.eslsync.verification;

/**
 * How an operator-triggered verification interacts with the scheduled run.
 */
public enum ManualRunMode {
    /**
     * Manual runs ignore the in-flight guard and may overlap a scheduled run.
     * Overlaps can duplicate AIMS fetches and queue submissions; the sync queue deduplicates.
     */
    CONCURRENT,
    
    /**
     * Manual runs take the same in-flight guard and are rejected while a run is active.
     */
    EXCLUSIVE
}
