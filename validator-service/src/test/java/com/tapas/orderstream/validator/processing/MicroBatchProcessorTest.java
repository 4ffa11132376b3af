package com.tapas.orderstream.validator.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.common.error.CheckpointCommitException;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.common.retry.RetryProperties;
import com.tapas.orderstream.common.retry.RetryTemplates;
import com.tapas.orderstream.validator.ValidatorFixtures;
import com.tapas.orderstream.validator.checkpoint.FileCheckpointStore;
import com.tapas.orderstream.validator.sink.JsonLinesSinkWriter;
import com.tapas.orderstream.validator.sink.SinkKind;
import com.tapas.orderstream.validator.sink.SinkRecordMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.stream.Stream;

import static com.tapas.orderstream.validator.ValidatorFixtures.missingPricePayload;
import static com.tapas.orderstream.validator.ValidatorFixtures.record;
import static com.tapas.orderstream.validator.ValidatorFixtures.validPayload;
import static org.junit.jupiter.api.Assertions.*;

class MicroBatchProcessorTest {

    @TempDir
    Path workDir;

    private final ObjectMapper objectMapper = ValidatorFixtures.objectMapper();

    private Path sinkRoot() {
        return workDir.resolve("sink");
    }

    private Path checkpointRoot() {
        return workDir.resolve("checkpoints");
    }

    private MicroBatchProcessor processor(Path sinkRoot) {
        RetryProperties retry = new RetryProperties();
        retry.setMaxAttempts(2);
        retry.setInitialBackoffMs(1);
        retry.setMaxBackoffMs(2);
        Clock clock = Clock.systemUTC();
        return new MicroBatchProcessor(
                new OrderEventCodec(objectMapper),
                new SinkRecordMapper(objectMapper),
                new JsonLinesSinkWriter(SinkKind.VALID, sinkRoot),
                new JsonLinesSinkWriter(SinkKind.INVALID, sinkRoot),
                new FileCheckpointStore(SinkKind.VALID, ValidatorFixtures.TOPIC, checkpointRoot(), objectMapper, clock),
                new FileCheckpointStore(SinkKind.INVALID, ValidatorFixtures.TOPIC, checkpointRoot(), objectMapper, clock),
                RetryTemplates.exponential("sink io", retry, List.of(UncheckedIOException.class)),
                new ValidatorStats());
    }

    /** Offsets from..to on partition 0; every third record is invalid, offset 7 is garbage. */
    private static List<ConsumerRecord<String, String>> batch(long from, long to) {
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        for (long offset = from; offset <= to; offset++) {
            String payload;
            if (offset == 7) {
                payload = "{\"order_id\": ";
            } else if (offset % 3 == 0) {
                payload = missingPricePayload("o-" + offset);
            } else {
                payload = validPayload("o-" + offset);
            }
            records.add(record(0, offset, payload));
        }
        return records;
    }

    private Map<Path, byte[]> sinkFiles() throws IOException {
        Map<Path, byte[]> files = new TreeMap<>();
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(sinkRoot())) {
            paths = walk.filter(Files::isRegularFile).toList();
        }
        for (Path path : paths) {
            files.put(sinkRoot().relativize(path), Files.readAllBytes(path));
        }
        return files;
    }

    private void snapshotMarkers(Path target) throws IOException {
        for (SinkKind kind : SinkKind.values()) {
            Path marker = checkpointRoot().resolve(kind.directory()).resolve("marker.json");
            Path copy = target.resolve(kind.directory() + ".json");
            Files.createDirectories(target);
            Files.copy(marker, copy, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void restoreMarker(Path snapshot, SinkKind kind) throws IOException {
        Files.copy(snapshot.resolve(kind.directory() + ".json"),
                checkpointRoot().resolve(kind.directory()).resolve("marker.json"),
                StandardCopyOption.REPLACE_EXISTING);
    }

    @Test
    @DisplayName("Records are routed to the valid and invalid sinks with reasons, in log order")
    void routesRecords() throws Exception {
        MicroBatchProcessor processor = processor(sinkRoot());

        BatchResult result = processor.process(batch(0, 9));

        assertEquals(1, result.batchId());
        assertEquals(10, result.records());
        // invalid: 0, 3, 6, 9 (missing price) and 7 (malformed)
        assertEquals(5, result.invalid());
        assertEquals(5, result.valid());
        assertEquals(BatchStage.IDLE, processor.stage());

        Path validSlice = sinkRoot().resolve("valid/partition=0/epoch=0/from-00000000000000000000.jsonl");
        Path invalidSlice = sinkRoot().resolve("invalid/partition=0/epoch=0/from-00000000000000000000.jsonl");
        List<String> validLines = Files.readAllLines(validSlice);
        List<String> invalidLines = Files.readAllLines(invalidSlice);
        assertEquals(5, validLines.size());
        assertEquals(5, invalidLines.size());

        List<Long> validOffsets = new ArrayList<>();
        for (String line : validLines) {
            validOffsets.add(objectMapper.readTree(line).at("/source/offset").asLong());
        }
        assertEquals(List.of(1L, 2L, 4L, 5L, 8L), validOffsets);

        JsonNode malformed = objectMapper.readTree(invalidLines.get(3));
        assertEquals(7, malformed.at("/source/offset").asLong());
        assertEquals("malformed_payload", malformed.get("reason").asText());
        JsonNode missingPrice = objectMapper.readTree(invalidLines.get(0));
        assertEquals("missing_price", missingPrice.get("reason").asText());
        assertEquals("missing_price", missingPrice.get("invalid_mode").asText());
        assertEquals("o-0", missingPrice.get("order_id").asText());

        assertEquals(OptionalLong.of(10), processor.resumeOffset(0));
    }

    @Test
    @DisplayName("Replaying a batch after a crash before its checkpoint rewrites identical files")
    void replayIsIdempotent() throws Exception {
        MicroBatchProcessor first = processor(sinkRoot());
        first.process(batch(0, 4));
        Path afterFirstBatch = workDir.resolve("markers-1");
        snapshotMarkers(afterFirstBatch);
        first.process(batch(5, 9));
        Map<Path, byte[]> expected = sinkFiles();

        // crash after the data was written but before either marker moved
        restoreMarker(afterFirstBatch, SinkKind.VALID);
        restoreMarker(afterFirstBatch, SinkKind.INVALID);
        MicroBatchProcessor restarted = processor(sinkRoot());
        assertEquals(OptionalLong.of(5), restarted.resumeOffset(0));
        BatchResult replay = restarted.process(batch(5, 9));

        assertEquals(2, replay.batchId());
        Map<Path, byte[]> actual = sinkFiles();
        assertEquals(expected.keySet(), actual.keySet());
        expected.forEach((path, bytes) -> assertArrayEquals(bytes, actual.get(path), path.toString()));
    }

    @Test
    @DisplayName("A sink whose marker is ahead skips what it already holds")
    void sinkAheadSkipsItsRecords() throws Exception {
        MicroBatchProcessor first = processor(sinkRoot());
        first.process(batch(0, 4));
        Path afterFirstBatch = workDir.resolve("markers-1");
        snapshotMarkers(afterFirstBatch);
        first.process(batch(5, 9));
        Map<Path, byte[]> expected = sinkFiles();

        // crash between the valid and the invalid marker
        restoreMarker(afterFirstBatch, SinkKind.INVALID);
        MicroBatchProcessor restarted = processor(sinkRoot());
        assertEquals(OptionalLong.of(5), restarted.resumeOffset(0));
        assertEquals(OptionalLong.of(9), restarted.furthestCheckpoint(0));

        BatchResult replay = restarted.process(batch(5, 9));

        assertEquals(3, replay.batchId());
        Map<Path, byte[]> actual = sinkFiles();
        assertEquals(expected.keySet(), actual.keySet());
        expected.forEach((path, bytes) -> assertArrayEquals(bytes, actual.get(path), path.toString()));
        assertEquals(OptionalLong.of(10), restarted.resumeOffset(0));
    }

    @Test
    @DisplayName("A slice with nothing for one sink leaves no file there")
    void emptySliceWritesNothing() throws Exception {
        MicroBatchProcessor processor = processor(sinkRoot());

        processor.process(List.of(record(1, 0, validPayload("a")), record(1, 1, validPayload("b"))));

        assertTrue(Files.exists(sinkRoot().resolve("valid/partition=1/epoch=0/from-00000000000000000000.jsonl")));
        assertFalse(Files.exists(sinkRoot().resolve("invalid/partition=1")));
        assertEquals(OptionalLong.of(2), processor.resumeOffset(1));
    }

    @Test
    @DisplayName("A reset partition starts over in a new epoch directory")
    void resetPartition() throws Exception {
        MicroBatchProcessor processor = processor(sinkRoot());
        processor.process(batch(0, 4));

        processor.resetPartitions(List.of(0));
        assertEquals(OptionalLong.empty(), processor.resumeOffset(0));
        processor.process(batch(0, 2));

        assertTrue(Files.exists(sinkRoot().resolve("valid/partition=0/epoch=1/from-00000000000000000000.jsonl")));
        assertEquals(OptionalLong.of(3), processor.resumeOffset(0));
    }

    @Test
    @DisplayName("Sink I/O that keeps failing ends the batch with a checkpoint error and no marker moves")
    void ioFailureIsFatal() throws Exception {
        Path blocked = workDir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        MicroBatchProcessor processor = processor(blocked);

        CheckpointCommitException error = assertThrows(CheckpointCommitException.class,
                () -> processor.process(batch(0, 4)));

        assertEquals(4, error.getExitCode());
        assertEquals(BatchStage.IDLE, processor.stage());
        assertEquals(OptionalLong.empty(), processor.resumeOffset(0));
        assertFalse(Files.exists(checkpointRoot().resolve("valid/marker.json")));
    }
}
