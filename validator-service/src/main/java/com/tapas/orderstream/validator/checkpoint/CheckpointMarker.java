package com.tapas.orderstream.validator.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Durable progress of one sink: the last offset whose output is on disk, per partition.
 */
public record CheckpointMarker(
        @JsonProperty("topic") String topic,
        @JsonProperty("batch_id") long batchId,
        @JsonProperty("log_epoch") long logEpoch,
        @JsonProperty("offsets") Map<Integer, Long> offsets,
        @JsonProperty("committed_at") Instant committedAt) {

    public CheckpointMarker {
        // sorted, so the marker file lists partitions in order
        Map<Integer, Long> sorted = offsets == null ? new TreeMap<>() : new TreeMap<>(offsets);
        offsets = Collections.unmodifiableMap(sorted);
    }

    public OptionalLong offset(int partition) {
        Long offset = offsets.get(partition);
        return offset == null ? OptionalLong.empty() : OptionalLong.of(offset);
    }
}
