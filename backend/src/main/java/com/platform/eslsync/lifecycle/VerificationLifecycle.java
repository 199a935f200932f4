package com.platform.eslsync.lifecycle;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.verification.VerificationScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Owns the verification job lifecycle.
 * 
 * Startup: arms the scheduler once the application is fully initialized.
 * Shutdown: cancels future ticks, then waits (bounded) for a run in progress.
 */
@Slf4j
@Component
public class VerificationLifecycle {
    
    private static final long POLL_INTERVAL_MS = 100;
    
    private final VerificationScheduler scheduler;
    private final VerificationProperties properties;
    
    @Value("${esl.shutdown.timeout-seconds:30}")
    private int shutdownTimeoutSeconds;
    
    public VerificationLifecycle(VerificationScheduler scheduler, VerificationProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("Verification job disabled (esl.verification.enabled=false)");
            return;
        }
        log.info("Application startup complete, starting verification job");
        scheduler.start(properties.getIntervalMs());
    }
    
    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (scheduler.stop()) {
            log.info("Verification job stopped for shutdown");
        }
        awaitInFlightRun();
    }
    
    private void awaitInFlightRun() {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(shutdownTimeoutSeconds));
        while (scheduler.isInFlight() && Instant.now().isBefore(deadline)) {
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for verification run to finish");
                return;
            }
        }
        if (scheduler.isInFlight()) {
            log.warn("Verification run still in progress after {}s, continuing shutdown", shutdownTimeoutSeconds);
        }
    }
}
