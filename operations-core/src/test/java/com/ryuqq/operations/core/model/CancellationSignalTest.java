package com.ryuqq.operations.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationSignal 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationSignalTest {

    private static final Instant NOW = Instant.parse("2025-01-15T09:30:00Z");

    @Test
    void newSignal_IsNotRequested() {
        CancellationSignal signal = new CancellationSignal();

        assertFalse(signal.isRequested());
        assertFalse(signal.isAcknowledged());
        assertNull(signal.getReason());
        assertEquals(CancellationState.none(), signal.snapshot());
    }

    @Test
    void request_First_ReturnsTrueAndStoresReason() {
        CancellationSignal signal = new CancellationSignal();

        boolean first = signal.request("user aborted", NOW);

        assertTrue(first);
        assertTrue(signal.isRequested());
        assertEquals("user aborted", signal.getReason());
        assertEquals(NOW, signal.snapshot().requestedAt());
    }

    @Test
    void request_Again_KeepsFirstReasonAndTime() {
        CancellationSignal signal = new CancellationSignal();
        signal.request("first", NOW);

        boolean second = signal.request("second", NOW.plusSeconds(10));

        assertFalse(second);
        assertEquals("first", signal.getReason());
        assertEquals(NOW, signal.snapshot().requestedAt());
    }

    @Test
    void request_BlankReasonThenReason_StoresLaterReason() {
        CancellationSignal signal = new CancellationSignal();
        signal.request("  ", NOW);

        signal.request("timeout", NOW);

        assertEquals("timeout", signal.getReason());
    }

    @Test
    void acknowledge_WithoutRequest_ThrowsException() {
        CancellationSignal signal = new CancellationSignal();

        assertThrows(IllegalStateException.class, signal::acknowledge);
        assertFalse(signal.isAcknowledged());
    }

    @Test
    void acknowledge_AfterRequest_IsRecordedOnce() {
        CancellationSignal signal = new CancellationSignal();
        signal.request(null, NOW);

        assertTrue(signal.acknowledge());
        assertFalse(signal.acknowledge());
        assertTrue(signal.snapshot().acknowledged());
    }

    @Test
    void request_Concurrent_ExactlyOneFirst() throws Exception {
        // Given
        CancellationSignal signal = new CancellationSignal();
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threads; i++) {
                String reason = "reason-" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    return signal.request(reason, NOW);
                }));
            }
            go.countDown();

            // Then
            int firsts = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    firsts++;
                }
            }
            assertEquals(1, firsts);
            assertNotNull(signal.getReason());
        } finally {
            pool.shutdownNow();
        }
    }
}
