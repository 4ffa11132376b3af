package com.tapas.orderstream.publisher.publish;

import com.tapas.orderstream.common.error.BrokerConnectionException;
import com.tapas.orderstream.common.error.EventSerializationException;
import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.common.metrics.MetricsSnapshot;
import com.tapas.orderstream.common.model.OrderEvent;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.common.retry.RetryTemplates;
import com.tapas.orderstream.publisher.config.PublisherProperties;
import com.tapas.orderstream.publisher.events.OrderEventGenerator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Publishes generated orders at a fixed target rate.
 * Sends are fire-and-track: the loop never waits for an ack, the {@link DeliveryTracker}
 * reconciles callbacks as they arrive. When the loop falls behind schedule it resets
 * the schedule instead of bursting to catch up.
 */
@Slf4j
@Component
public class RateGovernedPublisher {

    private static final long SHUTDOWN_GRACE_MS = 5_000;

    private final Producer<String, String> producer;
    private final OrderEventCodec codec;
    private final OrderEventGenerator generator;
    private final MetricsRegistry metrics;
    private final PublisherProperties properties;
    private final DeliveryTracker tracker;
    private final RetryTemplate handshakeRetry;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;

    public RateGovernedPublisher(Producer<String, String> producer,
                                 OrderEventCodec codec,
                                 OrderEventGenerator generator,
                                 MetricsRegistry metrics,
                                 PublisherProperties properties,
                                 Clock clock) {
        this.producer = producer;
        this.codec = codec;
        this.generator = generator;
        this.metrics = metrics;
        this.properties = properties;
        this.tracker = new DeliveryTracker(metrics, clock, properties.reportTag());
        this.handshakeRetry = RetryTemplates.exponential("broker handshake",
                properties.getRetry(), List.of(KafkaException.class));
    }

    /**
     * Runs until the duration or event cap is reached, or until {@link #stop()} is called,
     * then drains pending acks and returns the final snapshot.
     */
    public MetricsSnapshot run() throws InterruptedException {
        try {
            awaitBroker();
            running = true;
            metrics.markStarted();
            long produced = publishLoop();
            log.info("[{}] stopped issuing sends after {} events, draining {} pending acks",
                    properties.reportTag(), produced, tracker.pending());
            tracker.awaitDrain(Duration.ofMillis(properties.getDrainTimeoutMs()));

            MetricsSnapshot summary = metrics.snapshot();
            log.info("[{}][summary] {} {}", properties.reportTag(),
                    summary.toPublisherLine(), summary.elapsedSuffix());
            return summary;
        } finally {
            running = false;
            finished.countDown();
        }
    }

    /**
     * Asks the loop to stop. Honored within one pacing interval.
     */
    public void stop() {
        stopSignal.countDown();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        if (!running) {
            return;
        }
        try {
            // let the loop drain and report before the producer is closed
            finished.await(properties.getDrainTimeoutMs() + SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public long attempts() {
        return tracker.attempts();
    }

    private void awaitBroker() {
        String topic = properties.getTopic();
        try {
            var partitions = handshakeRetry.execute(ctx -> producer.partitionsFor(topic));
            log.info("[{}] connected, topic={} partitions={}", properties.reportTag(), topic,
                    partitions == null ? 0 : partitions.size());
        } catch (KafkaException e) {
            throw new BrokerConnectionException("Kafka cluster unreachable for topic " + topic
                    + " after " + properties.getRetry().getMaxAttempts() + " attempts", e);
        }
    }

    private long publishLoop() throws InterruptedException {
        long intervalNanos = Math.max(1L, Math.round(1_000_000_000L / properties.getEventsPerSecond()));
        long durationNanos = TimeUnit.SECONDS.toNanos(properties.getDurationSeconds());
        long maxEvents = properties.getMaxEvents();

        long start = System.nanoTime();
        long nextSendAt = start;
        long produced = 0;

        while (stopSignal.getCount() > 0) {
            if (durationNanos > 0 && System.nanoTime() - start >= durationNanos) {
                break;
            }
            if (maxEvents > 0 && produced >= maxEvents) {
                break;
            }

            publish(generator.next());
            produced++;

            nextSendAt += intervalNanos;
            long sleepNanos = nextSendAt - System.nanoTime();
            if (sleepNanos > 0) {
                if (stopSignal.await(sleepNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
            } else {
                // behind schedule: no catch-up burst
                nextSendAt = System.nanoTime();
            }
        }
        return produced;
    }

    void publish(OrderEvent event) {
        String payload;
        try {
            payload = codec.encode(event);
        } catch (EventSerializationException e) {
            tracker.failImmediately(e);
            return;
        }

        long attempt = tracker.begin();
        try {
            producer.send(new ProducerRecord<>(properties.getTopic(), event.orderId(), payload),
                    (metadata, exception) -> tracker.complete(attempt, exception));
        } catch (KafkaException | IllegalStateException e) {
            tracker.complete(attempt, e);
        }
    }
}
