package com.platform.eslsync.verification;

import com.platform.eslsync.model.VerificationResult;
import com.platform.eslsync.observability.MetricsRegistry;
import com.platform.eslsync.observability.StructuredLogger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observability sink for verification results. Nothing is persisted.
 */
@Component
public class VerificationReporter {
    
    static final String OUTCOME_VERIFIED = "verified";
    static final String OUTCOME_DRIFT = "drift";
    static final String OUTCOME_ERROR = "error";
    
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final AtomicReference<RunSummary> lastSummary = new AtomicReference<>();
    
    public VerificationReporter(StructuredLogger structuredLogger, MetricsRegistry metricsRegistry) {
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
    }
    
    public RunSummary record(List<VerificationResult> results) {
        return record(results, Duration.ZERO);
    }
    
    /**
     * Partition results into verified, drift and error and emit one event per
     * drifted or failed store plus a run summary.
     */
    public RunSummary record(List<VerificationResult> results, Duration elapsed) {
        StructuredLogger.VerificationLogger events = structuredLogger.verification();
        int verified = 0;
        int drifted = 0;
        int failed = 0;
        
        for (VerificationResult result : results) {
            String entityType = result.entityType().getWireName();
            if (result.hasError()) {
                failed++;
                events.storeFailed(result);
                metricsRegistry.recordStoreOutcome(entityType, OUTCOME_ERROR);
            } else if (result.hasDrift()) {
                drifted++;
                events.driftDetected(result);
                metricsRegistry.recordStoreOutcome(entityType, OUTCOME_DRIFT);
            } else {
                verified++;
                metricsRegistry.recordStoreOutcome(entityType, OUTCOME_VERIFIED);
            }
        }
        
        events.runCompleted(results.size(), verified, drifted, failed, elapsed.toMillis());
        
        RunSummary summary = new RunSummary(Instant.now(), results.size(), verified, drifted, failed);
        lastSummary.set(summary);
        return summary;
    }
    
    public Optional<RunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }
}
