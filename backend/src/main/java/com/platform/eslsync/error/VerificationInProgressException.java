package com.platform.eslsync.error;

/**
 * Thrown by an exclusive manual verification when a run already holds the in-flight guard.
 */
public class VerificationInProgressException extends EslSyncException {
    
    public VerificationInProgressException() {
        super(ErrorCode.VERIFICATION_IN_PROGRESS);
    }
}
