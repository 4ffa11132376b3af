package com.tapas.orderstream.common.metrics;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the in-process counters. Callers hand in deltas and read back immutable
 * {@link MetricsSnapshot}s; the counters themselves never leave this class.
 */
public class MetricsRegistry {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private Instant startedAt;
    private long sentOk;
    private long sentError;
    private double ackLatencyTotalMs;
    private long processed;
    private long errors;
    private long latencySamples;
    private double latencyTotalMs;

    public MetricsRegistry(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Restarts the elapsed-time window used for throughput.
     */
    public void markStarted() {
        lock.lock();
        try {
            startedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public void recordDelivery(DeliveryRecord delivery) {
        lock.lock();
        try {
            if (delivery.outcome() == DeliveryRecord.Outcome.ACK_OK) {
                sentOk++;
                ackLatencyTotalMs += delivery.ackLatencyMs();
            } else {
                sentError++;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordProcessed(double endToEndLatencyMs) {
        lock.lock();
        try {
            processed++;
            latencySamples++;
            latencyTotalMs += endToEndLatencyMs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A record that was read but carried no usable event_time_ms.
     */
    public void recordProcessedWithoutLatency() {
        lock.lock();
        try {
            processed++;
        } finally {
            lock.unlock();
        }
    }

    public void recordError() {
        lock.lock();
        try {
            errors++;
        } finally {
            lock.unlock();
        }
    }

    public MetricsSnapshot snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            long elapsedMs = Math.max(0L, now.toEpochMilli() - startedAt.toEpochMilli());
            return new MetricsSnapshot(sentOk, sentError, ackLatencyTotalMs,
                    processed, errors, latencySamples, latencyTotalMs, elapsedMs, now);
        } finally {
            lock.unlock();
        }
    }
}
