package com.platform.eslsync.verification;

import com.platform.eslsync.config.VerificationProperties;
import com.platform.eslsync.error.SystemUnavailableException;
import com.platform.eslsync.model.EntityType;
import com.platform.eslsync.model.Store;
import com.platform.eslsync.observability.MetricsRegistry;
import com.platform.eslsync.observability.StructuredLogger;
import com.platform.eslsync.queue.ResyncQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ResyncQueuerTest {

    private static final Store STORE = new Store("s1", "S001", "Main Street", "c1", true);

    private ResyncQueue queue;
    private SimpleMeterRegistry meterRegistry;
    private ResyncQueuer queuer;

    @BeforeEach
    void setUp() {
        queue = mock(ResyncQueue.class);
        meterRegistry = new SimpleMeterRegistry();
        queuer = new ResyncQueuer(queue, new VerificationProperties(),
            new MetricsRegistry(meterRegistry), new StructuredLogger("esl-sync-verifier", "test"));
    }

    @Test
    void queuesAtMostTenPerStore() {
        List<String> missing = ids(50);

        ResyncSubmission submission = queuer.submit(STORE, EntityType.PERSON, missing);

        ArgumentCaptor<String> entityIds = ArgumentCaptor.forClass(String.class);
        verify(queue, times(10)).enqueue(eq("s1"), eq(EntityType.PERSON), entityIds.capture(), any());
        assertEquals(missing.subList(0, 10), entityIds.getAllValues());
        assertEquals(50, submission.requested());
        assertEquals(10, submission.queued());
        assertEquals(0, submission.failed());
        assertEquals(40, submission.deferred());
        assertEquals(40.0, meterRegistry.get("esl.verification.resync.deferred").counter().count());
    }

    @Test
    void marksJobsAsDriftTriggered() {
        queuer.submit(STORE, EntityType.PERSON, List.of("p1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(queue).enqueue(eq("s1"), eq(EntityType.PERSON), eq("p1"), metadata.capture());
        assertEquals(Boolean.TRUE, metadata.getValue().get(ResyncQueuer.PROVENANCE_KEY));
        assertEquals("drift-verification", metadata.getValue().get(ResyncQueuer.TRIGGER_KEY));
    }

    @Test
    void oneFailedSubmissionDoesNotStopTheRest() {
        doThrow(SystemUnavailableException.syncQueue("queue down", null))
            .when(queue).enqueue(anyString(), any(), eq("p2"), any());

        ResyncSubmission submission = queuer.submit(STORE, EntityType.PERSON, List.of("p1", "p2", "p3"));

        verify(queue).enqueue(eq("s1"), eq(EntityType.PERSON), eq("p3"), any());
        assertEquals(2, submission.queued());
        assertEquals(1, submission.failed());
        assertEquals(0, submission.deferred());
        assertEquals(1.0, meterRegistry.get("esl.verification.resync.failed").counter().count());
        assertEquals(2.0, meterRegistry.get("esl.verification.resync.queued").counter().count());
    }

    @Test
    void nothingMissingMeansNoQueueCalls() {
        ResyncSubmission submission = queuer.submit(STORE, EntityType.PERSON, List.of());

        verifyNoInteractions(queue);
        assertEquals(ResyncSubmission.none(), submission);
    }

    @Test
    void respectsConfiguredCap() {
        VerificationProperties properties = new VerificationProperties();
        properties.setMaxResyncPerStore(3);
        queuer = new ResyncQueuer(queue, properties,
            new MetricsRegistry(meterRegistry), new StructuredLogger("esl-sync-verifier", "test"));

        queuer.submit(STORE, EntityType.PERSON, ids(5));

        verify(queue, times(3)).enqueue(eq("s1"), eq(EntityType.PERSON), anyString(), any());
    }

    private static List<String> ids(int count) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> "p" + i)
            .collect(Collectors.toList());
    }
}
