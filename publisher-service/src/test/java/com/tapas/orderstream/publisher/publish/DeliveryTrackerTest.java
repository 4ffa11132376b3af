package com.tapas.orderstream.publisher.publish;

import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.common.metrics.MetricsSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryTrackerTest {

    private final MetricsRegistry metrics = new MetricsRegistry(Clock.systemUTC());
    private final DeliveryTracker tracker = new DeliveryTracker(metrics, Clock.systemUTC(), "producer");

    @Test
    @DisplayName("Each attempt lands in exactly one of sent_ok or sent_error")
    void settlesOnce() {
        long first = tracker.begin();
        long second = tracker.begin();
        tracker.failImmediately(new IllegalStateException("serialization"));

        tracker.complete(first, null);
        tracker.complete(second, new RuntimeException("broker said no"));
        tracker.complete(first, null);

        MetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(3, tracker.attempts());
        assertEquals(1, snapshot.sentOk());
        assertEquals(2, snapshot.sentError());
        assertEquals(0, tracker.pending());
    }

    @Test
    @DisplayName("Attempts still pending at the drain deadline count as errors, late acks are ignored")
    void drainTimeout() throws InterruptedException {
        long acked = tracker.begin();
        long late = tracker.begin();
        tracker.complete(acked, null);

        int abandoned = tracker.awaitDrain(Duration.ofMillis(20));
        tracker.complete(late, null);

        MetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(1, abandoned);
        assertEquals(1, snapshot.sentOk());
        assertEquals(1, snapshot.sentError());
        assertEquals(tracker.attempts(), snapshot.sendAttempts());
    }

    @Test
    @DisplayName("Drain returns as soon as the last callback arrives")
    void drainWakesOnLastCallback() throws Exception {
        long id = tracker.begin();
        CompletableFuture<Void> ack = CompletableFuture.runAsync(() -> {
            try {
                TimeUnit.MILLISECONDS.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            tracker.complete(id, null);
        });

        long started = System.nanoTime();
        int abandoned = tracker.awaitDrain(Duration.ofSeconds(10));
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        ack.get(5, TimeUnit.SECONDS);
        assertEquals(0, abandoned);
        assertTrue(waitedMs < 5_000, "drain should not wait for the full timeout");
        assertEquals(1, metrics.snapshot().sentOk());
    }
}
