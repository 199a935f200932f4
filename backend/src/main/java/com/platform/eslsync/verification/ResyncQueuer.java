package com.platform.eslsync.verification;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.observability.MetricsRegistry;
import com.platform.eslsync.observability.StructuredLogger;
import com.platform.eslsync.queue.ResyncQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Queues bounded corrective work for records missing in AIMS.
 * 
 * At most maxResyncPerStore jobs go out per store and run; the rest are found
 * again on the next run. Each submission fails independently.
 */
@Slf4j
@Component
public class ResyncQueuer {
    
    /**
     * Marks a queued job as drift-triggered rather than a first-time sync.
     */
    public static final String PROVENANCE_KEY = "verificationResync";
    public static final String TRIGGER_KEY = "trigger";
    public static final String TRIGGER_VALUE = "drift-verification";
    
    private static final Map<String, Object> PROVENANCE = Map.of(
        PROVENANCE_KEY, true,
        TRIGGER_KEY, TRIGGER_VALUE
    );
    
    private final ResyncQueue queue;
    private final VerificationProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public ResyncQueuer(
            ResyncQueue queue,
            VerificationProperties properties,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.queue = queue;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    public ResyncSubmission submit(Store store, EntityType entityType, List<String> missingIds) {
        if (missingIds == null || missingIds.isEmpty()) {
            return ResyncSubmission.none();
        }
        
        int cap = Math.max(0, properties.getMaxResyncPerStore());
        List<String> batch = missingIds.subList(0, Math.min(cap, missingIds.size()));
        String type = entityType.getWireName();
        
        int queued = 0;
        int failed = 0;
        for (String entityId : batch) {
            try {
                queue.enqueue(store.id(), entityType, entityId, PROVENANCE);
                queued++;
                metricsRegistry.recordResyncQueued(type);
            } catch (RuntimeException e) {
                failed++;
                metricsRegistry.recordResyncFailed(type);
                log.error("Failed to queue re-sync of {} {} in {}: {}",
                    type, entityId, store.displayName(), e.getMessage());
            }
        }
        
        ResyncSubmission submission = new ResyncSubmission(missingIds.size(), queued, failed);
        metricsRegistry.recordResyncDeferred(type, submission.deferred());
        structuredLogger.verification().resyncQueued(store.id(), store.displayName(), type,
            queued, failed, submission.deferred());
        return submission;
    }
}
