package com.tapas.orderstream.monitor.tracking;

import com.tapas.orderstream.common.error.BrokerConnectionException;
import com.tapas.orderstream.common.error.MalformedPayloadException;
import com.tapas.orderstream.common.error.OffsetCommitException;
import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.common.metrics.MetricsSnapshot;
import com.tapas.orderstream.common.model.OrderEvent;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.common.retry.RetryTemplates;
import com.tapas.orderstream.monitor.config.MonitorProperties;
import jakarta.annotation.PreDestroy;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded poll loop that measures end-to-end latency per record and commits
 * offsets by hand: every {@code commit-every} processed records, when partitions are
 * revoked, and once more on an orderly stop.
 * <p>
 * A consumer that cannot reach the cluster keeps returning empty polls instead of
 * failing, so the broker is asked for metadata before subscribing and again after a run
 * of empty polls. Either check running out of retries ends the run.
 */
public class LatencyTrackingMonitor {

    private static final Logger log = LoggerFactory.getLogger(LatencyTrackingMonitor.class);

    private static final long STOP_TIMEOUT_MS = 30_000;

    private final Consumer<String, String> consumer;
    private final OrderEventCodec codec;
    private final MetricsRegistry metrics;
    private final MonitorProperties properties;
    private final Clock clock;
    private final RetryTemplate brokerRetry;
    private final RetryTemplate pollRetry;
    private final RetryTemplate commitRetry;

    private final ConsumerOffsetState offsets = new ConsumerOffsetState();
    private final ConsumerRebalanceListener rebalanceListener = new CommitOnRevoke();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile boolean running;
    private long seen;
    private OffsetCommitException revocationFailure;

    public LatencyTrackingMonitor(Consumer<String, String> consumer,
                                  OrderEventCodec codec,
                                  MetricsRegistry metrics,
                                  MonitorProperties properties,
                                  Clock clock) {
        this.consumer = consumer;
        this.codec = codec;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.brokerRetry = RetryTemplates.exponential("broker check", properties.getRetry(),
                List.of(KafkaException.class));
        this.pollRetry = RetryTemplates.exponential("poll", properties.getRetry(), List.of(KafkaException.class));
        this.commitRetry = RetryTemplates.exponential("offset commit", properties.getRetry(),
                List.of(KafkaException.class));
    }

    public MetricsSnapshot run() {
        running = true;
        try {
            checkBroker("startup");
            consumer.subscribe(List.of(properties.getTopic()), rebalanceListener);
            metrics.markStarted();
            log.info("[consumer] tracking topic={} group={} commit-every={}",
                    properties.getTopic(), properties.getGroupId(), properties.getCommitEvery());

            pollLoop();
            commit("shutdown");
        } finally {
            close();
        }
        return metrics.snapshot();
    }

    /**
     * Asks the loop to stop and waits until it has committed and closed the consumer.
     */
    @PreDestroy
    public void stop() {
        requestStop();
        if (!running) {
            return;
        }
        try {
            finished.await(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    ConsumerRebalanceListener rebalanceListener() {
        return rebalanceListener;
    }

    void requestStop() {
        stopRequested = true;
        consumer.wakeup();
    }

    private void pollLoop() {
        Duration timeout = Duration.ofMillis(properties.getPollTimeoutMs());
        int emptyPolls = 0;
        while (!stopRequested) {
            ConsumerRecords<String, String> records = poll(timeout);
            if (records.isEmpty()) {
                emptyPolls++;
                if (!stopRequested && emptyPolls >= properties.getIdlePollsBeforeBrokerCheck()) {
                    checkBroker(emptyPolls + " empty polls");
                    emptyPolls = 0;
                }
                continue;
            }
            emptyPolls = 0;
            for (ConsumerRecord<String, String> record : records) {
                account(record);
                if (properties.getMaxRecords() > 0 && seen >= properties.getMaxRecords()) {
                    log.info("[consumer] reached max-records={}", properties.getMaxRecords());
                    stopRequested = true;
                    break;
                }
            }
        }
    }

    /**
     * Lists topics, which always goes to the broker rather than to cached metadata.
     */
    private void checkBroker(String reason) {
        Duration timeout = Duration.ofMillis(properties.getBrokerTimeoutMs());
        try {
            brokerRetry.execute(ctx -> {
                try {
                    consumer.listTopics(timeout);
                } catch (WakeupException e) {
                    log.debug("[consumer] broker check ({}) cut short by a stop request", reason);
                }
                return null;
            });
        } catch (KafkaException e) {
            throw new BrokerConnectionException("Broker unreachable (" + reason + ") after "
                    + properties.getRetry().getMaxAttempts() + " attempts", e);
        }
        log.debug("[consumer] broker reachable ({})", reason);
    }

    private ConsumerRecords<String, String> poll(Duration timeout) {
        try {
            return pollRetry.execute(ctx -> {
                if (revocationFailure != null) {
                    throw revocationFailure;
                }
                try {
                    return consumer.poll(timeout);
                } catch (WakeupException e) {
                    // stop() interrupted a blocking poll
                    return ConsumerRecords.empty();
                }
            });
        } catch (KafkaException e) {
            if (revocationFailure != null) {
                throw revocationFailure;
            }
            throw new BrokerConnectionException("Polling " + properties.getTopic() + " kept failing after "
                    + properties.getRetry().getMaxAttempts() + " attempts", e);
        }
    }

    void account(ConsumerRecord<String, String> record) {
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        seen++;
        OrderEvent event;
        try {
            event = codec.decode(record.value());
        } catch (MalformedPayloadException e) {
            metrics.recordError();
            offsets.accounted(partition, record.offset(), false);
            log.debug("[consumer][error] {}@{} skipped: {}", partition, record.offset(), e.getMessage());
            return;
        }

        if (event.eventTimeMs() != null) {
            double latencyMs = clock.millis() - event.eventTimeMs();
            metrics.recordProcessed(latencyMs);
            log.debug("[consumer] order_id={} partition={} offset={} latency_ms={}",
                    event.orderId(), record.partition(), record.offset(), latencyMs);
        } else {
            metrics.recordProcessedWithoutLatency();
            log.debug("[consumer] order_id={} partition={} offset={} without event_time_ms",
                    event.orderId(), record.partition(), record.offset());
        }
        offsets.accounted(partition, record.offset(), true);

        if (properties.getCommitEvery() > 0 && offsets.processedSinceCommit() >= properties.getCommitEvery()) {
            commit("every " + properties.getCommitEvery());
        }
    }

    private void commit(String trigger) {
        if (offsets.isEmpty()) {
            return;
        }
        commitSync(offsets.toCommit(), trigger);
        offsets.committed();
    }

    private void commitSync(Map<TopicPartition, OffsetAndMetadata> toCommit, String trigger) {
        if (toCommit.isEmpty()) {
            return;
        }
        try {
            commitRetry.execute(ctx -> {
                try {
                    consumer.commitSync(toCommit);
                } catch (WakeupException e) {
                    // a stop request woke the commit; the wakeup is spent, so this one blocks
                    consumer.commitSync(toCommit);
                }
                return null;
            });
        } catch (KafkaException e) {
            throw new OffsetCommitException("Offset commit (" + trigger + ") failed after "
                    + properties.getRetry().getMaxAttempts() + " attempts: " + toCommit, e);
        }
        log.debug("[consumer] committed ({}) {}", trigger, toCommit);
    }

    private void close() {
        try {
            consumer.close(Duration.ofMillis(properties.getBrokerTimeoutMs()));
        } catch (KafkaException e) {
            log.warn("[consumer] error while closing the consumer: {}", e.getMessage());
        } finally {
            MetricsSnapshot summary = metrics.snapshot();
            log.info("[consumer][summary] {} {}", summary.toMonitorLine(), summary.elapsedSuffix());
            running = false;
            finished.countDown();
        }
    }

    /**
     * Commits what was counted for partitions before they move to another member.
     */
    private final class CommitOnRevoke implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            try {
                commitSync(offsets.toCommit(partitions), "revocation");
            } catch (OffsetCommitException e) {
                revocationFailure = e;
                throw e;
            }
            offsets.committed(partitions);
            offsets.forget(partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("[consumer] assigned {}", partitions);
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            log.warn("[consumer] lost {} without a chance to commit", partitions);
            offsets.forget(partitions);
        }
    }
}
