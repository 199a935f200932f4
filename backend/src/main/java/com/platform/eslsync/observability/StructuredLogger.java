package com.platform.eslsync.observability;

import com.platform.eslsync.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for verification events.
 * 
 * All events are JSON-formatted and machine-parsable, tagged with the
 * emitting component and an optional key/value context.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(
            @Value("${spring.application.name:esl-sync-verifier}") String serviceName,
            @Value("${esl.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    /**
     * Get verification event logger.
     */
    public VerificationLogger verification() {
        return new VerificationLogger(serviceName, environment);
    }
    
    /**
     * Get scheduler event logger.
     */
    public SchedulerLogger scheduler() {
        return new SchedulerLogger(serviceName, environment);
    }
    
    // ==================== VERIFICATION LOGGER ====================
    
    public static class VerificationLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.verification");
        private static final String COMPONENT = "AimsVerify";
        private final String service;
        private final String environment;
        
        VerificationLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void runStarted(int storeCount) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_RUN_STARTED, "INFO", COMPONENT)
                .message("Verifying " + storeCount + " stores")
                .context(Map.of("store_count", storeCount))
                .build();
            log.info(event.toJson());
        }
        
        public void driftDetected(VerificationResult result) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_DRIFT_DETECTED, "WARN", COMPONENT)
                .message(String.format("%s: %d missing in AIMS, %d extra in AIMS",
                    result.storeName(), result.missingInRemote().size(), result.extraInRemote().size()))
                .storeId(result.storeId())
                .storeName(result.storeName())
                .entityType(result.entityType().getWireName())
                .success(false)
                .context(Map.of(
                    "total_local", result.totalLocal(),
                    "total_remote", result.totalRemote(),
                    "missing_in_remote", result.missingInRemote().size(),
                    "extra_in_remote", result.extraInRemote().size()
                ))
                .build();
            log.warn(event.toJson());
        }
        
        public void storeFailed(VerificationResult result) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_STORE_FAILED, "ERROR", COMPONENT)
                .message("Failed to verify store " + result.storeName())
                .storeId(result.storeId())
                .storeName(result.storeName())
                .entityType(result.entityType().getWireName())
                .success(false)
                .errorMessage(result.error())
                .build();
            log.error(event.toJson());
        }
        
        public void resyncQueued(String storeId, String storeName, String entityType,
                int queued, int failed, int deferred) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_RESYNC_QUEUED, failed > 0 ? "WARN" : "INFO", COMPONENT)
                .message(String.format("Queued %d %s records for re-sync in %s", queued, entityType, storeName))
                .storeId(storeId)
                .storeName(storeName)
                .entityType(entityType)
                .success(failed == 0)
                .context(Map.of(
                    "queued", queued,
                    "failed", failed,
                    "deferred", deferred
                ))
                .build();
            if (failed > 0) {
                log.warn(event.toJson());
            } else {
                log.info(event.toJson());
            }
        }
        
        public void runCompleted(int total, int verified, int drifted, int failed, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_RUN_COMPLETED, drifted > 0 ? "WARN" : "INFO", COMPONENT)
                .message(drifted > 0
                    ? "Drift detected in " + drifted + " stores"
                    : "Verification run complete")
                .success(failed == 0)
                .durationMs(durationMs)
                .context(Map.of(
                    "total", total,
                    "verified", verified,
                    "drifted", drifted,
                    "failed", failed
                ))
                .build();
            if (drifted > 0) {
                log.warn(event.toJson());
            } else {
                log.info(event.toJson());
            }
        }
        
        public void runFailed(String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_RUN_FAILED, "ERROR", COMPONENT)
                .message("Tick error")
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void tickSkipped() {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.VERIFICATION_TICK_SKIPPED, "INFO", COMPONENT)
                .message("Previous tick still running, skipping")
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== SCHEDULER LOGGER ====================
    
    public static class SchedulerLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.scheduler");
        private static final String COMPONENT = "AimsVerify";
        private final String service;
        private final String environment;
        
        SchedulerLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void started(long intervalMs, long initialDelayMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SCHEDULER_STARTED, "INFO", COMPONENT)
                .message("Starting verification job with " + intervalMs + "ms interval")
                .context(Map.of(
                    "interval_ms", intervalMs,
                    "initial_delay_ms", initialDelayMs
                ))
                .build();
            log.info(event.toJson());
        }
        
        public void stopped() {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.SCHEDULER_STOPPED, "INFO", COMPONENT)
                .message("Job stopped")
                .build();
            log.info(event.toJson());
        }
    }
}
