package com.platform.eslsync.observability;

/**
 * Event types for structured logs.
 */
public enum LogEventType {
    // Verification
    VERIFICATION_RUN_STARTED,
    VERIFICATION_RUN_COMPLETED,
    VERIFICATION_RUN_FAILED,
    VERIFICATION_DRIFT_DETECTED,
    VERIFICATION_STORE_FAILED,
    VERIFICATION_RESYNC_QUEUED,
    VERIFICATION_TICK_SKIPPED,
    
    // Scheduler lifecycle
    SCHEDULER_STARTED,
    SCHEDULER_STOPPED
}
