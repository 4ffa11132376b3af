package com.tapas.orderstream.validator.processing;

import com.tapas.orderstream.common.error.CheckpointCommitException;
import com.tapas.orderstream.common.error.MalformedPayloadException;
import com.tapas.orderstream.common.model.InvalidReason;
import com.tapas.orderstream.common.model.OrderEvent;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.common.model.OrderEventValidator;
import com.tapas.orderstream.common.model.ValidationOutcome;
import com.tapas.orderstream.validator.checkpoint.FileCheckpointStore;
import com.tapas.orderstream.validator.sink.JsonLinesSinkWriter;
import com.tapas.orderstream.validator.sink.SinkRecordMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Turns one polled batch into sink files and checkpoint markers.
 * <p>
 * Write order is valid data, invalid data, valid marker, invalid marker. A crash at any
 * point leaves markers at or behind the data on disk, and replaying the batch rewrites
 * the same slice files.
 */
public class MicroBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(MicroBatchProcessor.class);

    private final OrderEventCodec codec;
    private final SinkRecordMapper mapper;
    private final JsonLinesSinkWriter validSink;
    private final JsonLinesSinkWriter invalidSink;
    private final FileCheckpointStore validCheckpoint;
    private final FileCheckpointStore invalidCheckpoint;
    private final RetryTemplate ioRetry;
    private final ValidatorStats stats;

    private volatile BatchStage stage = BatchStage.IDLE;

    public MicroBatchProcessor(OrderEventCodec codec,
                               SinkRecordMapper mapper,
                               JsonLinesSinkWriter validSink,
                               JsonLinesSinkWriter invalidSink,
                               FileCheckpointStore validCheckpoint,
                               FileCheckpointStore invalidCheckpoint,
                               RetryTemplate ioRetry,
                               ValidatorStats stats) {
        this.codec = codec;
        this.mapper = mapper;
        this.validSink = validSink;
        this.invalidSink = invalidSink;
        this.validCheckpoint = validCheckpoint;
        this.invalidCheckpoint = invalidCheckpoint;
        this.ioRetry = ioRetry;
        this.stats = stats;
    }

    public BatchStage stage() {
        return stage;
    }

    /**
     * Next offset to consume for a partition: one past the lower of the two markers.
     * Empty when neither sink has seen the partition.
     */
    public OptionalLong resumeOffset(int partition) {
        OptionalLong valid = validCheckpoint.offset(partition);
        OptionalLong invalid = invalidCheckpoint.offset(partition);
        if (valid.isEmpty() && invalid.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.min(valid.orElse(-1), invalid.orElse(-1)) + 1);
    }

    /**
     * Highest offset either sink claims for a partition, used to spot a log that was reset.
     */
    public OptionalLong furthestCheckpoint(int partition) {
        OptionalLong valid = validCheckpoint.offset(partition);
        OptionalLong invalid = invalidCheckpoint.offset(partition);
        if (valid.isEmpty() && invalid.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.max(valid.orElse(-1), invalid.orElse(-1)));
    }

    /**
     * Drops the given partitions from both markers in a single new epoch.
     */
    public void resetPartitions(Collection<Integer> partitions) {
        if (partitions.isEmpty()) {
            return;
        }
        runWithRetry("reset partitions " + partitions, () -> {
            validCheckpoint.resetPartitions(partitions);
            invalidCheckpoint.resetPartitions(partitions);
        });
    }

    public BatchResult process(List<ConsumerRecord<String, String>> records) {
        try {
            return processBatch(records);
        } finally {
            stage = BatchStage.IDLE;
        }
    }

    private BatchResult processBatch(List<ConsumerRecord<String, String>> records) {
        moveTo(BatchStage.FETCHING_BATCH);
        long batchId = Math.max(validCheckpoint.batchId(), invalidCheckpoint.batchId()) + 1;
        if (records.isEmpty()) {
            return new BatchResult(batchId, 0, 0, 0);
        }

        moveTo(BatchStage.PARSING);
        List<Parsed> parsed = new ArrayList<>(records.size());
        for (ConsumerRecord<String, String> record : records) {
            parsed.add(parse(record));
        }

        moveTo(BatchStage.CLASSIFYING);
        Map<Integer, PartitionSlice> slices = new TreeMap<>();
        int valid = 0;
        for (Parsed p : parsed) {
            ValidationOutcome outcome = p.event() == null
                    ? ValidationOutcome.invalid(null, InvalidReason.MALFORMED_PAYLOAD)
                    : OrderEventValidator.classify(p.event());
            PartitionSlice slice = slices.computeIfAbsent(p.record().partition(), PartitionSlice::new);
            slice.lastOffset = p.record().offset();
            if (outcome instanceof ValidationOutcome.Valid) {
                valid++;
                slice.valid.add(p.record());
                slice.validEvents.add(outcome.event());
            } else {
                ValidationOutcome.Invalid invalid = (ValidationOutcome.Invalid) outcome;
                slice.invalid.add(p.record());
                slice.invalidLines.add(mapper.invalidLine(invalid.event(), invalid.reason(), p.record()));
            }
        }

        moveTo(BatchStage.PERSISTING_VALID);
        Map<Integer, Long> validAdvanced = persist(validSink, validCheckpoint, slices, true);

        moveTo(BatchStage.PERSISTING_INVALID);
        Map<Integer, Long> invalidAdvanced = persist(invalidSink, invalidCheckpoint, slices, false);

        moveTo(BatchStage.COMMITTING_CHECKPOINT);
        runWithRetry("commit valid checkpoint", () -> validCheckpoint.commit(batchId, validAdvanced));
        runWithRetry("commit invalid checkpoint", () -> invalidCheckpoint.commit(batchId, invalidAdvanced));

        BatchResult result = new BatchResult(batchId, records.size(), valid, records.size() - valid);
        stats.record(result);
        log.info("[validator][batch] batch_id={} records={} valid={} invalid={} partitions={}",
                batchId, result.records(), result.valid(), result.invalid(), slices.keySet());
        return result;
    }

    private Parsed parse(ConsumerRecord<String, String> record) {
        try {
            return new Parsed(record, codec.decode(record.value()));
        } catch (MalformedPayloadException e) {
            log.debug("Malformed payload at {}-{}@{}: {}", record.topic(), record.partition(),
                    record.offset(), e.getMessage());
            return new Parsed(record, null);
        }
    }

    /**
     * Writes one sink's slices and returns the partitions whose marker may advance.
     * A sink that is already past the whole slice, after a crash between the two
     * marker writes, leaves that partition untouched.
     */
    private Map<Integer, Long> persist(JsonLinesSinkWriter sink,
                                       FileCheckpointStore checkpoint,
                                       Map<Integer, PartitionSlice> slices,
                                       boolean validSide) {
        Map<Integer, Long> advanced = new HashMap<>();
        long epoch = checkpoint.epoch();
        for (PartitionSlice slice : slices.values()) {
            long sliceStart = checkpoint.offset(slice.partition).orElse(-1) + 1;
            if (slice.lastOffset < sliceStart) {
                continue;
            }
            List<String> lines = validSide ? validLines(slice, sliceStart) : invalidLines(slice, sliceStart);
            runWithRetry("write " + sink.kind().directory() + " slice", () ->
                    sink.writeSlice(epoch, slice.partition, sliceStart, lines));
            advanced.put(slice.partition, slice.lastOffset);
        }
        return advanced;
    }

    private List<String> validLines(PartitionSlice slice, long sliceStart) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < slice.valid.size(); i++) {
            ConsumerRecord<String, String> record = slice.valid.get(i);
            if (record.offset() >= sliceStart) {
                lines.add(mapper.validLine(slice.validEvents.get(i), record));
            }
        }
        return lines;
    }

    private List<String> invalidLines(PartitionSlice slice, long sliceStart) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < slice.invalid.size(); i++) {
            if (slice.invalid.get(i).offset() >= sliceStart) {
                lines.add(slice.invalidLines.get(i));
            }
        }
        return lines;
    }

    private void runWithRetry(String operation, IoAction action) {
        try {
            ioRetry.execute(ctx -> {
                try {
                    action.run();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return null;
            });
        } catch (UncheckedIOException e) {
            throw new CheckpointCommitException("Failed to " + operation + " after retrying", e.getCause());
        }
    }

    private void moveTo(BatchStage next) {
        log.trace("stage {} -> {}", stage, next);
        stage = next;
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    /** event is null when the payload could not be decoded. */
    private record Parsed(ConsumerRecord<String, String> record, OrderEvent event) {
    }

    private static final class PartitionSlice {

        private final int partition;
        private final List<ConsumerRecord<String, String>> valid = new ArrayList<>();
        private final List<OrderEvent> validEvents = new ArrayList<>();
        private final List<ConsumerRecord<String, String>> invalid = new ArrayList<>();
        private final List<String> invalidLines = new ArrayList<>();
        private long lastOffset;

        private PartitionSlice(int partition) {
            this.partition = partition;
        }
    }
}
