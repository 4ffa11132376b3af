package com.tapas.orderstream.publisher.publish;

import com.tapas.orderstream.common.metrics.DeliveryRecord;
import com.tapas.orderstream.common.metrics.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outstanding publish attempts between send and broker ack.
 * Each attempt is settled exactly once: by its callback, or by the drain deadline.
 * A callback that arrives after its attempt was settled is ignored.
 */
@Slf4j
public class DeliveryTracker {

    private final MetricsRegistry metrics;
    private final Clock clock;
    private final String tag;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Map<Long, Instant> outstanding = new HashMap<>();
    private long nextId;
    private long attempts;

    public DeliveryTracker(MetricsRegistry metrics, Clock clock, String tag) {
        this.metrics = metrics;
        this.clock = clock;
        this.tag = tag;
    }

    /**
     * Registers a new attempt and returns its id.
     */
    public long begin() {
        lock.lock();
        try {
            long id = nextId++;
            attempts++;
            outstanding.put(id, clock.instant());
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles an attempt. A null error means the broker acknowledged it.
     */
    public void complete(long id, Exception error) {
        lock.lock();
        try {
            Instant sentAt = outstanding.remove(id);
            if (sentAt == null) {
                log.debug("[{}] late completion for attempt {} ignored", tag, id);
                return;
            }
            double latencyMs = Duration.between(sentAt, clock.instant()).toNanos() / 1_000_000.0;
            if (error == null) {
                metrics.recordDelivery(DeliveryRecord.ok(sentAt, latencyMs));
            } else {
                metrics.recordDelivery(DeliveryRecord.error(sentAt, latencyMs));
                log.warn("[{}][error] delivery failed: {}", tag, error.getMessage());
            }
            if (outstanding.isEmpty()) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * An attempt that failed before it reached the producer.
     */
    public void failImmediately(Exception error) {
        complete(begin(), error);
    }

    /**
     * Waits until every outstanding attempt is settled or the timeout passes.
     * Attempts still pending at the deadline are counted as errors.
     *
     * @return the number of attempts given up on
     */
    public int awaitDrain(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remainingNanos = timeout.toNanos();
            while (!outstanding.isEmpty() && remainingNanos > 0) {
                remainingNanos = drained.awaitNanos(remainingNanos);
            }
            int abandoned = outstanding.size();
            if (abandoned > 0) {
                Instant now = clock.instant();
                for (Instant sentAt : outstanding.values()) {
                    metrics.recordDelivery(DeliveryRecord.error(sentAt,
                            Duration.between(sentAt, now).toNanos() / 1_000_000.0));
                }
                outstanding.clear();
                log.warn("[{}] {} deliveries still unacknowledged after {} ms, counted as errors",
                        tag, abandoned, timeout.toMillis());
            }
            return abandoned;
        } finally {
            lock.unlock();
        }
    }

    public long attempts() {
        lock.lock();
        try {
            return attempts;
        } finally {
            lock.unlock();
        }
    }

    public int pending() {
        lock.lock();
        try {
            return outstanding.size();
        } finally {
            lock.unlock();
        }
    }
}
