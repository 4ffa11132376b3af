package com.tapas.orderstream.validator.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.validator.ValidatorFixtures;
import com.tapas.orderstream.validator.sink.SinkKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class FileCheckpointStoreTest {

    @TempDir
    Path checkpointRoot;

    private final ObjectMapper objectMapper = ValidatorFixtures.objectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);

    private FileCheckpointStore open(String topic) {
        return new FileCheckpointStore(SinkKind.VALID, topic, checkpointRoot, objectMapper, clock);
    }

    @Test
    @DisplayName("A fresh store has no marker until the first commit")
    void freshStore() {
        FileCheckpointStore store = open("orders");

        assertNull(store.current());
        assertEquals(0, store.batchId());
        assertEquals(OptionalLong.empty(), store.offset(0));
        assertFalse(Files.exists(checkpointRoot.resolve("valid/marker.json")));
    }

    @Test
    @DisplayName("Committed markers survive a restart")
    void commitAndReload() throws Exception {
        FileCheckpointStore store = open("orders");
        store.commit(1, Map.of(0, 9L, 1, 4L));
        store.commit(2, Map.of(0, 19L));

        FileCheckpointStore reopened = open("orders");

        assertEquals(2, reopened.batchId());
        assertEquals(OptionalLong.of(19), reopened.offset(0));
        assertEquals(OptionalLong.of(4), reopened.offset(1));
        assertEquals(Instant.parse("2026-10-19T10:00:00Z"), reopened.current().committedAt());
    }

    @Test
    @DisplayName("Batch ids must strictly increase")
    void batchIdMonotonic() throws Exception {
        FileCheckpointStore store = open("orders");
        store.commit(3, Map.of(0, 1L));

        assertThrows(IllegalStateException.class, () -> store.commit(3, Map.of(0, 2L)));
        assertThrows(IllegalStateException.class, () -> store.commit(2, Map.of(0, 2L)));
        assertEquals(3, store.batchId());
    }

    @Test
    @DisplayName("Offsets never move back within an epoch")
    void offsetsMonotonic() throws Exception {
        FileCheckpointStore store = open("orders");
        store.commit(1, Map.of(0, 50L));

        assertThrows(IllegalStateException.class, () -> store.commit(2, Map.of(0, 49L)));
        assertEquals(OptionalLong.of(50), open("orders").offset(0));
    }

    @Test
    @DisplayName("Resetting a partition forgets it and opens a new epoch")
    void resetPartition() throws Exception {
        FileCheckpointStore store = open("orders");
        store.commit(1, Map.of(0, 50L, 1, 20L));

        store.resetPartitions(List.of(0));
        store.commit(2, Map.of(0, 3L));

        FileCheckpointStore reopened = open("orders");
        assertEquals(1, reopened.epoch());
        assertEquals(OptionalLong.of(3), reopened.offset(0));
        assertEquals(OptionalLong.of(20), reopened.offset(1));
    }

    @Test
    @DisplayName("Resetting several partitions together moves the epoch once")
    void resetSeveralPartitions() throws Exception {
        FileCheckpointStore store = open("orders");
        store.commit(1, Map.of(0, 50L, 1, 20L, 2, 7L, 3, 9L));

        store.resetPartitions(List.of(0, 1, 2));

        FileCheckpointStore reopened = open("orders");
        assertEquals(1, reopened.epoch());
        assertEquals(1, reopened.batchId());
        assertEquals(OptionalLong.empty(), reopened.offset(0));
        assertEquals(OptionalLong.empty(), reopened.offset(2));
        assertEquals(OptionalLong.of(9), reopened.offset(3));
    }

    @Test
    @DisplayName("A marker written for another topic is refused")
    void topicMismatch() throws Exception {
        open("orders").commit(1, Map.of(0, 1L));

        assertThrows(IllegalStateException.class, () -> open("payments"));
    }
}
