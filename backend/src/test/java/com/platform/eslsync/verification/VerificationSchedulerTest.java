package com.platform.eslsync.verification;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.error.SystemUnavailableException;
import com.platform.eslsync.error.VerificationInProgressException;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.model.VerificationResult;
import com.platform.eslsync.observability.MetricsRegistry;
import com.platform.eslsync.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VerificationSchedulerTest {

    private static final Store STORE_A = new Store("s1", "S001", "A", "c1", true);
    private static final Store STORE_B = new Store("s2", "S002", "B", "c1", true);

    private StoreEnumerator storeEnumerator;
    private DriftDetector driftDetector;
    private ResyncQueuer resyncQueuer;
    private TaskScheduler taskScheduler;
    private VerificationProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private VerificationScheduler scheduler;

    @BeforeEach
    void setUp() {
        storeEnumerator = mock(StoreEnumerator.class);
        driftDetector = mock(DriftDetector.class);
        resyncQueuer = mock(ResyncQueuer.class);
        taskScheduler = mock(TaskScheduler.class);
        properties = new VerificationProperties();
        meterRegistry = new SimpleMeterRegistry();
        scheduler = newScheduler();
    }

    @Test
    void tickVerifiesEveryStoreAndQueuesMissingRecords() {
        when(storeEnumerator.list()).thenReturn(List.of(STORE_A, STORE_B));
        when(driftDetector.verify(STORE_A, EntityType.PERSON))
            .thenReturn(VerificationResult.completed(STORE_A, EntityType.PERSON, 1, 1, List.of(), List.of()));
        when(driftDetector.verify(STORE_B, EntityType.PERSON))
            .thenReturn(VerificationResult.completed(STORE_B, EntityType.PERSON, 2, 1, List.of("p2"), List.of()));

        scheduler.tick();

        verify(resyncQueuer).submit(STORE_B, EntityType.PERSON, List.of("p2"));
        verify(resyncQueuer, never()).submit(eq(STORE_A), any(), anyList());
        RunSummary summary = scheduler.getStats().lastSummary();
        assertEquals(1, summary.verified());
        assertEquals(1, summary.drifted());
        assertEquals(1, scheduler.getStats().completedRuns());
        assertFalse(scheduler.isInFlight());
    }

    @Test
    void overlappingTickIsSkippedWithoutTouchingCollaborators() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(storeEnumerator.list()).thenReturn(List.of(STORE_A));
        when(driftDetector.verify(STORE_A, EntityType.PERSON)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return VerificationResult.completed(STORE_A, EntityType.PERSON, 0, 0, List.of(), List.of());
        });

        Thread first = new Thread(scheduler::tick);
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.isInFlight());

        scheduler.tick();

        verify(storeEnumerator, times(1)).list();
        verify(driftDetector, times(1)).verify(any(), any());
        assertEquals(1, scheduler.getStats().skippedTicks());
        assertEquals(1.0, meterRegistry.get("esl.verification.ticks.skipped").counter().count());

        release.countDown();
        first.join(5000);
        assertFalse(scheduler.isInFlight());
    }

    @Test
    void concurrentManualRunProceedsWhileTickInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        VerificationResult verified =
            VerificationResult.completed(STORE_A, EntityType.PERSON, 0, 0, List.of(), List.of());
        when(storeEnumerator.list()).thenReturn(List.of(STORE_A));
        when(driftDetector.verify(STORE_A, EntityType.PERSON))
            .thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return verified;
            })
            .thenReturn(verified);

        Thread first = new Thread(scheduler::tick);
        first.start();
        try {
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            List<VerificationResult> results = scheduler.verifyNow();

            assertEquals(List.of(verified), results);
            verify(storeEnumerator, times(2)).list();
            assertTrue(scheduler.isInFlight());
            assertEquals(0, scheduler.getStats().skippedTicks());
        } finally {
            release.countDown();
            first.join(5000);
        }
        assertFalse(scheduler.isInFlight());
        assertEquals(2, scheduler.getStats().completedRuns());
    }

    @Test
    void failingStoreDoesNotAffectOthers() {
        when(storeEnumerator.list()).thenReturn(List.of(STORE_A, STORE_B));
        when(driftDetector.verify(STORE_A, EntityType.PERSON)).thenThrow(new IllegalStateException("boom"));
        when(driftDetector.verify(STORE_B, EntityType.PERSON))
            .thenReturn(VerificationResult.completed(STORE_B, EntityType.PERSON, 1, 1, List.of(), List.of()));

        List<VerificationResult> results = scheduler.verifyNow();

        assertEquals(2, results.size());
        assertFalse(results.get(0).verified());
        assertEquals("boom", results.get(0).error());
        assertTrue(results.get(1).verified());
        assertNull(results.get(1).error());
    }

    @Test
    void storeListFailureIsCountedAndReleasesTheGuard() {
        when(storeEnumerator.list()).thenThrow(SystemUnavailableException.database("db down", null));

        assertDoesNotThrow(() -> scheduler.tick());

        assertFalse(scheduler.isInFlight());
        assertEquals(1, scheduler.getStats().failedRuns());
        verify(driftDetector, never()).verify(any(), any());

        when(storeEnumerator.list()).thenReturn(List.of());
        scheduler.tick();
        assertEquals(1, scheduler.getStats().completedRuns());
    }

    @Test
    void manualRunPropagatesStoreListFailure() {
        when(storeEnumerator.list()).thenThrow(SystemUnavailableException.database("db down", null));

        assertThrows(SystemUnavailableException.class, () -> scheduler.verifyNow());
    }

    @Test
    void exclusiveManualRunIsRejectedWhileTickInFlight() throws Exception {
        properties.setManualRunMode(ManualRunMode.EXCLUSIVE);
        scheduler = newScheduler();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(storeEnumerator.list()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        Thread first = new Thread(scheduler::tick);
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(VerificationInProgressException.class, () -> scheduler.verifyNow());

        release.countDown();
        first.join(5000);
        assertEquals(List.of(), scheduler.verifyNow());
    }

    @Test
    void startAndStopAreIdempotent() {
        ScheduledFuture<?> periodic = mock(ScheduledFuture.class);
        ScheduledFuture<?> warmUp = mock(ScheduledFuture.class);
        doReturn(periodic).when(taskScheduler)
            .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        doReturn(warmUp).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        assertTrue(scheduler.start(60_000));
        assertFalse(scheduler.start(60_000));
        assertTrue(scheduler.isRunning());
        verify(taskScheduler, times(1))
            .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(60_000)));
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));

        assertTrue(scheduler.stop());
        assertFalse(scheduler.stop());
        assertFalse(scheduler.isRunning());
        verify(periodic).cancel(false);
        verify(warmUp).cancel(false);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.start(0));
        assertFalse(scheduler.isRunning());
    }

    private VerificationScheduler newScheduler() {
        MetricsRegistry metricsRegistry = new MetricsRegistry(meterRegistry);
        StructuredLogger structuredLogger = new StructuredLogger("esl-sync-verifier", "test");
        return new VerificationScheduler(
            storeEnumerator,
            driftDetector,
            resyncQueuer,
            new VerificationReporter(structuredLogger, metricsRegistry),
            taskScheduler,
            properties,
            metricsRegistry,
            structuredLogger
        );
    }
}
