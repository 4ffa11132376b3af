package com.tapas.orderstream.monitor.tracking;

import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Per partition, the offset after the last record already counted in metrics.
 * This is exactly what gets committed, so a commit never runs ahead of the counters.
 */
class ConsumerOffsetState {

    private final Map<TopicPartition, Long> nextOffsets = new HashMap<>();
    private final Map<TopicPartition, Integer> uncommitted = new HashMap<>();

    void accounted(TopicPartition partition, long offset, boolean countsTowardCommit) {
        nextOffsets.merge(partition, offset + 1, Math::max);
        if (countsTowardCommit) {
            uncommitted.merge(partition, 1, Integer::sum);
        }
    }

    /**
     * Processed records on owned partitions that no commit covers yet.
     */
    int processedSinceCommit() {
        int total = 0;
        for (int count : uncommitted.values()) {
            total += count;
        }
        return total;
    }

    boolean isEmpty() {
        return nextOffsets.isEmpty();
    }

    Map<TopicPartition, OffsetAndMetadata> toCommit() {
        return toCommit(nextOffsets.keySet());
    }

    Map<TopicPartition, OffsetAndMetadata> toCommit(Collection<TopicPartition> partitions) {
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        for (TopicPartition partition : partitions) {
            Long next = nextOffsets.get(partition);
            if (next != null) {
                offsets.put(partition, new OffsetAndMetadata(next));
            }
        }
        return offsets;
    }

    void committed() {
        uncommitted.clear();
    }

    void committed(Collection<TopicPartition> partitions) {
        partitions.forEach(uncommitted::remove);
    }

    void forget(Collection<TopicPartition> partitions) {
        partitions.forEach(nextOffsets::remove);
        partitions.forEach(uncommitted::remove);
    }
}
