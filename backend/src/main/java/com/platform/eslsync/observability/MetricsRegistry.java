package com.platform.eslsync.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for application metrics.
 * Provides methods for recording verification outcomes, resync submissions and run timings.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Register a gauge backed by a supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .description(description)
            .register(meterRegistry);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record the outcome of verifying one store: verified, drift or error.
     */
    public void recordStoreOutcome(String entityType, String outcome) {
        incrementCounter("esl.verification.stores", "entity_type", entityType, "outcome", outcome);
    }
    
    /**
     * Record a completed verification run.
     */
    public void recordRun(String trigger, Duration duration) {
        Timer timer = timers.computeIfAbsent(trigger, k ->
            Timer.builder("esl.verification.run.duration")
                .tag("trigger", trigger)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(duration);
        log.debug("Recorded {} verification run in {}ms", trigger, duration.toMillis());
    }
    
    /**
     * Record a run that aborted before per-store verification.
     */
    public void recordRunFailure(String trigger) {
        incrementCounter("esl.verification.run.failures", "trigger", trigger);
    }
    
    /**
     * Record a tick skipped because a previous run was still in flight.
     */
    public void recordSkippedTick() {
        incrementCounter("esl.verification.ticks.skipped");
    }
    
    /**
     * Record a corrective job accepted by the sync queue.
     */
    public void recordResyncQueued(String entityType) {
        incrementCounter("esl.verification.resync.queued", "entity_type", entityType);
    }
    
    /**
     * Record a corrective job the sync queue rejected.
     */
    public void recordResyncFailed(String entityType) {
        incrementCounter("esl.verification.resync.failed", "entity_type", entityType);
    }
    
    /**
     * Record missing ids left for the next run because of the per-store cap.
     */
    public void recordResyncDeferred(String entityType, int count) {
        if (count <= 0) {
            return;
        }
        String key = "esl.verification.resync.deferred" + entityType;
        counters.computeIfAbsent(key, k ->
            Counter.builder("esl.verification.resync.deferred")
                .tag("entity_type", entityType)
                .register(meterRegistry))
            .increment(count);
    }
}
