package com.platform.eslsync.verification;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.error.EslSyncException;
import com.platform.eslsync.error.ErrorCode;
import com.platform.eslsync.error.VerificationInProgressException;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.model.VerificationResult;
import com.platform.eslsync.observability.LoggingConfig;
import com.platform.eslsync.observability.MetricsRegistry;
import com.platform.eslsync.observability.StructuredLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives drift verification.
 * 
 * Two paths run the same pipeline (enumerate stores, detect drift, queue re-sync, report):
 * 1. Timer path: fixed-delay ticks plus one warm-up tick, gated by an in-flight flag.
 *    A tick that finds the flag taken is dropped, not queued.
 * 2. Manual path: verifyNow(), synchronous, guarded or not per ManualRunMode.
 * 
 * Stores are verified sequentially. stop() never interrupts a run in progress.
 */
@Slf4j
@Service
public class VerificationScheduler {
    
    static final String TRIGGER_SCHEDULED = "scheduled";
    static final String TRIGGER_MANUAL = "manual";
    
    private static final EntityType VERIFIED_ENTITY = EntityType.PERSON;
    
    private final StoreEnumerator storeEnumerator;
    private final DriftDetector driftDetector;
    private final ResyncQueuer resyncQueuer;
    private final VerificationReporter reporter;
    private final TaskScheduler taskScheduler;
    private final VerificationProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final Object timerLock = new Object();
    private ScheduledFuture<?> periodicTask;
    private ScheduledFuture<?> warmUpTask;
    
    // Stats
    private final AtomicLong completedRuns = new AtomicLong(0);
    private final AtomicLong skippedTicks = new AtomicLong(0);
    private final AtomicLong failedRuns = new AtomicLong(0);
    private volatile Instant lastRunAt;
    
    public VerificationScheduler(
            StoreEnumerator storeEnumerator,
            DriftDetector driftDetector,
            ResyncQueuer resyncQueuer,
            VerificationReporter reporter,
            TaskScheduler taskScheduler,
            VerificationProperties properties,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.storeEnumerator = storeEnumerator;
        this.driftDetector = driftDetector;
        this.resyncQueuer = resyncQueuer;
        this.reporter = reporter;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    @PostConstruct
    public void init() {
        metricsRegistry.registerGauge("esl.verification.runs.completed",
            "Verification runs that finished", completedRuns::get);
        metricsRegistry.registerGauge("esl.verification.runs.failed",
            "Scheduled runs aborted before per-store verification", failedRuns::get);
        metricsRegistry.registerGauge("esl.verification.in_flight",
            "1 while a guarded run is executing", () -> inFlight.get() ? 1 : 0);
        
        log.info("Verification scheduler initialized (manualRunMode={})", properties.getManualRunMode());
    }
    
    /**
     * Arm the periodic ticker and the warm-up tick.
     *
     * @return false if the job was already running
     */
    public boolean start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, was " + intervalMs);
        }
        synchronized (timerLock) {
            if (periodicTask != null) {
                log.info("Verification job already running");
                return false;
            }
            
            Instant now = Instant.now();
            Duration interval = Duration.ofMillis(intervalMs);
            periodicTask = taskScheduler.scheduleWithFixedDelay(this::tick, now.plus(interval), interval);
            warmUpTask = taskScheduler.schedule(this::tick, now.plusMillis(properties.getInitialDelayMs()));
            
            structuredLogger.scheduler().started(intervalMs, properties.getInitialDelayMs());
            return true;
        }
    }
    
    /**
     * Cancel future ticks. A run already executing completes normally.
     *
     * @return false if the job was not running
     */
    public boolean stop() {
        synchronized (timerLock) {
            if (periodicTask == null) {
                return false;
            }
            periodicTask.cancel(false);
            periodicTask = null;
            if (warmUpTask != null) {
                warmUpTask.cancel(false);
                warmUpTask = null;
            }
            structuredLogger.scheduler().stopped();
            return true;
        }
    }
    
    public boolean isRunning() {
        synchronized (timerLock) {
            return periodicTask != null;
        }
    }
    
    public boolean isInFlight() {
        return inFlight.get();
    }
    
    /**
     * One scheduled run. Returns immediately without touching any collaborator
     * if the previous run has not finished.
     */
    public void tick() {
        if (!inFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            metricsRegistry.recordSkippedTick();
            structuredLogger.verification().tickSkipped();
            return;
        }
        
        try {
            runPipeline(TRIGGER_SCHEDULED);
        } catch (Exception e) {
            failedRuns.incrementAndGet();
            metricsRegistry.recordRunFailure(TRIGGER_SCHEDULED);
            String code = e instanceof EslSyncException
                ? ((EslSyncException) e).getErrorCode().getCode()
                : ErrorCode.INTERNAL_ERROR.getCode();
            structuredLogger.verification().runFailed(code, e.getMessage());
            log.debug("Verification tick failed", e);
        } finally {
            inFlight.set(false);
        }
    }
    
    /**
     * Run the pipeline now and hand the results to the caller.
     *
     * @throws VerificationInProgressException in EXCLUSIVE mode while another run holds the guard
     */
    public List<VerificationResult> verifyNow() {
        log.info("Manual verification triggered");
        
        if (properties.getManualRunMode() != ManualRunMode.EXCLUSIVE) {
            return runPipeline(TRIGGER_MANUAL);
        }
        
        if (!inFlight.compareAndSet(false, true)) {
            throw new VerificationInProgressException();
        }
        try {
            return runPipeline(TRIGGER_MANUAL);
        } finally {
            inFlight.set(false);
        }
    }
    
    private List<VerificationResult> runPipeline(String trigger) {
        LoggingConfig.setRunContext(UUID.randomUUID().toString().substring(0, 8), trigger);
        long startedAt = System.nanoTime();
        try {
            List<Store> stores = storeEnumerator.list();
            structuredLogger.verification().runStarted(stores.size());
            
            List<VerificationResult> results = new ArrayList<>(stores.size());
            for (Store store : stores) {
                results.add(verifyStore(store));
            }
            
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            reporter.record(results, elapsed);
            metricsRegistry.recordRun(trigger, elapsed);
            completedRuns.incrementAndGet();
            lastRunAt = Instant.now();
            return results;
        } finally {
            LoggingConfig.clearRunContext();
        }
    }
    
    private VerificationResult verifyStore(Store store) {
        LoggingConfig.setStoreContext(store.id());
        try {
            VerificationResult result = driftDetector.verify(store, VERIFIED_ENTITY);
            if (!result.missingInRemote().isEmpty()) {
                resyncQueuer.submit(store, result.entityType(), result.missingInRemote());
            }
            return result;
        } catch (Exception e) {
            log.warn("Failed to verify store {}", store.displayName(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return VerificationResult.failed(store, VERIFIED_ENTITY, message);
        } finally {
            LoggingConfig.clearStoreContext();
        }
    }
    
    /**
     * Get scheduler statistics.
     */
    public SchedulerStats getStats() {
        return new SchedulerStats(
            isRunning(),
            inFlight.get(),
            properties.getManualRunMode(),
            completedRuns.get(),
            skippedTicks.get(),
            failedRuns.get(),
            lastRunAt,
            reporter.getLastSummary().orElse(null)
        );
    }
    
    public record SchedulerStats(
        boolean running,
        boolean inFlight,
        ManualRunMode manualRunMode,
        long completedRuns,
        long skippedTicks,
        long failedRuns,
        Instant lastRunAt,
        RunSummary lastSummary
    ) {}
}
