package com.tapas.orderstream.validator.consumer;

import com.tapas.orderstream.validator.processing.MicroBatchProcessor;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CheckpointSeekListenerTest {

    private static final TopicPartition P0 = new TopicPartition("orders", 0);
    private static final TopicPartition P1 = new TopicPartition("orders", 1);

    private MockConsumer<String, String> consumer;
    private MicroBatchProcessor processor;
    private CheckpointSeekListener listener;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.assign(List.of(P0, P1));
        processor = mock(MicroBatchProcessor.class);
        listener = new CheckpointSeekListener(processor);
    }

    private void logRange(long start, long end) {
        consumer.updateBeginningOffsets(Map.of(P0, start));
        consumer.updateEndOffsets(Map.of(P0, end));
    }

    private void checkpoints(long resume, long furthest) {
        when(processor.resumeOffset(0)).thenReturn(OptionalLong.of(resume));
        when(processor.furthestCheckpoint(0)).thenReturn(OptionalLong.of(furthest));
    }

    @Test
    @DisplayName("Without a checkpoint the partition is read from the beginning")
    void noCheckpoint() {
        logRange(12, 40);
        when(processor.resumeOffset(0)).thenReturn(OptionalLong.empty());
        when(processor.furthestCheckpoint(0)).thenReturn(OptionalLong.empty());

        listener.onPartitionsAssigned(consumer, List.of(P0));

        assertEquals(12, consumer.position(P0));
    }

    @Test
    @DisplayName("A checkpoint inside the log resumes just after the lower marker")
    void resumeFromCheckpoint() {
        logRange(0, 100);
        checkpoints(31, 44);

        listener.onPartitionsAssigned(consumer, List.of(P0));

        assertEquals(31, consumer.position(P0));
        verify(processor, never()).resetPartitions(anyCollection());
    }

    @Test
    @DisplayName("A checkpoint past the log end means the topic was reset")
    void logReset() {
        logRange(0, 5);
        checkpoints(80, 99);

        listener.onPartitionsAssigned(consumer, List.of(P0));

        verify(processor).resetPartitions(List.of(0));
        assertEquals(0, consumer.position(P0));
    }

    @Test
    @DisplayName("Offsets removed by retention resume at the log start")
    void retentionGap() {
        logRange(500, 900);
        checkpoints(120, 130);

        listener.onPartitionsAssigned(consumer, List.of(P0));

        verify(processor, never()).resetPartitions(anyCollection());
        assertEquals(500, consumer.position(P0));
    }

    @Test
    @DisplayName("Partitions reset in the same assignment share one new epoch")
    void resetSeveralPartitionsAtOnce() {
        consumer.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
        consumer.updateEndOffsets(Map.of(P0, 3L, P1, 1L));
        checkpoints(80, 99);
        when(processor.resumeOffset(1)).thenReturn(OptionalLong.of(40));
        when(processor.furthestCheckpoint(1)).thenReturn(OptionalLong.of(41));

        listener.onPartitionsAssigned(consumer, List.of(P0, P1));

        verify(processor, times(1)).resetPartitions(anyCollection());
        verify(processor).resetPartitions(List.of(0, 1));
        assertEquals(0, consumer.position(P0));
        assertEquals(0, consumer.position(P1));
    }
}
