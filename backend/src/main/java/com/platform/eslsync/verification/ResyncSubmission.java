package com.platform.eslsync.verification;

/**
 * What happened to one store's corrective batch.
 *
 * @param requested missing ids reported by detection
 * @param queued jobs the queue accepted
 * @param failed jobs the queue rejected
 */
public record ResyncSubmission(int requested, int queued, int failed) {
    
    public static ResyncSubmission none() {
        return new ResyncSubmission(0, 0, 0);
    }
    
    /**
     * Missing ids left for a later run by the per-store cap.
     */
    public int deferred() {
        return requested - queued - failed;
    }
}
