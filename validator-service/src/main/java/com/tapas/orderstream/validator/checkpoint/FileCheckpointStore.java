package com.tapas.orderstream.validator.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.validator.sink.AtomicFiles;
import com.tapas.orderstream.validator.sink.SinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Checkpoint marker of one sink, kept in {@code <checkpoint-dir>/<sink>/marker.json}.
 * <p>
 * A marker never moves backwards: batch ids strictly increase and a partition offset
 * never decreases within one log epoch. Only {@link #resetPartitions(Collection)} may forget
 * partitions, and it opens one new epoch for all of them.
 */
public class FileCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final SinkKind sink;
    private final String topic;
    private final Path markerFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private CheckpointMarker current;

    public FileCheckpointStore(SinkKind sink, String topic, Path checkpointRoot,
                               ObjectMapper objectMapper, Clock clock) {
        this.sink = sink;
        this.topic = topic;
        this.markerFile = checkpointRoot.resolve(sink.directory()).resolve("marker.json");
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.current = load();
    }

    private CheckpointMarker load() {
        if (!Files.exists(markerFile)) {
            log.info("No {} checkpoint at {}, starting fresh", sink.directory(), markerFile);
            return null;
        }
        try {
            CheckpointMarker marker = objectMapper.readValue(markerFile.toFile(), CheckpointMarker.class);
            if (!topic.equals(marker.topic())) {
                throw new IllegalStateException("Checkpoint " + markerFile + " belongs to topic "
                        + marker.topic() + ", not " + topic);
            }
            log.info("Loaded {} checkpoint batch_id={} epoch={} offsets={}",
                    sink.directory(), marker.batchId(), marker.logEpoch(), marker.offsets());
            return marker;
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable checkpoint " + markerFile, e);
        }
    }

    public SinkKind sink() {
        return sink;
    }

    public synchronized CheckpointMarker current() {
        return current;
    }

    public synchronized long batchId() {
        return current == null ? 0 : current.batchId();
    }

    public synchronized long epoch() {
        return current == null ? 0 : current.logEpoch();
    }

    public synchronized OptionalLong offset(int partition) {
        return current == null ? OptionalLong.empty() : current.offset(partition);
    }

    /**
     * Advances the marker to {@code batchId}, merging the given last-processed offsets.
     *
     * @throws IllegalStateException if the batch id or any offset would regress
     */
    public synchronized CheckpointMarker commit(long batchId, Map<Integer, Long> advanced) throws IOException {
        if (batchId <= batchId()) {
            throw new IllegalStateException(sink.directory() + " checkpoint batch_id " + batchId
                    + " does not advance past " + batchId());
        }
        Map<Integer, Long> offsets = new HashMap<>(current == null ? Map.of() : current.offsets());
        advanced.forEach((partition, offset) -> {
            Long previous = offsets.get(partition);
            if (previous != null && offset < previous) {
                throw new IllegalStateException(sink.directory() + " checkpoint for partition " + partition
                        + " would move back from " + previous + " to " + offset);
            }
            offsets.put(partition, offset);
        });
        CheckpointMarker next = new CheckpointMarker(topic, batchId, epoch(), offsets, clock.instant());
        persist(next);
        current = next;
        return next;
    }

    /**
     * Forgets partitions whose log was reset underneath the checkpoint. However many
     * partitions are dropped, the epoch moves by exactly one.
     */
    public synchronized void resetPartitions(Collection<Integer> partitions) throws IOException {
        if (partitions.isEmpty()) {
            return;
        }
        Map<Integer, Long> offsets = new HashMap<>(current == null ? Map.of() : current.offsets());
        Map<Integer, Long> dropped = new TreeMap<>();
        for (Integer partition : partitions) {
            Long previous = offsets.remove(partition);
            if (previous != null) {
                dropped.put(partition, previous);
            }
        }
        CheckpointMarker next = new CheckpointMarker(topic, batchId(), epoch() + 1, offsets, clock.instant());
        persist(next);
        current = next;
        log.warn("{} checkpoint: partitions {} reset (were at {}), now epoch {}",
                sink.directory(), partitions, dropped, next.logEpoch());
    }

    private void persist(CheckpointMarker marker) throws IOException {
        AtomicFiles.write(markerFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(marker));
    }
}
