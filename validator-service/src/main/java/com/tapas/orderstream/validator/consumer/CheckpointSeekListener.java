package com.tapas.orderstream.validator.consumer;

import com.tapas.orderstream.validator.processing.MicroBatchProcessor;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.ConsumerAwareRebalanceListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Positions newly assigned partitions from the sink checkpoints, not from the group's
 * committed offsets. Also notices a topic that was deleted and recreated: a checkpoint
 * past the log end means the log was reset, so that partition starts over. All partitions
 * reset in one assignment share a single new epoch.
 */
public class CheckpointSeekListener implements ConsumerAwareRebalanceListener {

    private static final Logger log = LoggerFactory.getLogger(CheckpointSeekListener.class);

    private final MicroBatchProcessor processor;

    public CheckpointSeekListener(MicroBatchProcessor processor) {
        this.processor = processor;
    }

    @Override
    public void onPartitionsAssigned(Consumer<?, ?> consumer, Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) {
            return;
        }
        Map<TopicPartition, Long> beginning = consumer.beginningOffsets(partitions);
        Map<TopicPartition, Long> end = consumer.endOffsets(partitions);
        List<TopicPartition> reset = new ArrayList<>();

        for (TopicPartition tp : partitions) {
            long logStart = beginning.getOrDefault(tp, 0L);
            long logEnd = end.getOrDefault(tp, 0L);
            OptionalLong furthest = processor.furthestCheckpoint(tp.partition());
            OptionalLong resume = processor.resumeOffset(tp.partition());

            if (resume.isEmpty()) {
                log.info("{}: no checkpoint, reading from the beginning", tp);
                consumer.seekToBeginning(List.of(tp));
            } else if (furthest.getAsLong() + 1 > logEnd) {
                log.warn("{}: checkpoint at offset {} is past the log end {}, log was reset",
                        tp, furthest.getAsLong(), logEnd);
                reset.add(tp);
            } else if (resume.getAsLong() < logStart) {
                log.warn("{}: offsets {} to {} were removed by retention, resuming at log start",
                        tp, resume.getAsLong(), logStart - 1);
                consumer.seekToBeginning(List.of(tp));
            } else {
                log.info("{}: resuming at offset {}", tp, resume.getAsLong());
                consumer.seek(tp, resume.getAsLong());
            }
        }

        if (!reset.isEmpty()) {
            processor.resetPartitions(reset.stream().map(TopicPartition::partition).toList());
            consumer.seekToBeginning(reset);
        }
    }
}
