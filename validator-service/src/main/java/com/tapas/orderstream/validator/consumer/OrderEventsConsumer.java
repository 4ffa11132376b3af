package com.tapas.orderstream.validator.consumer;

import com.tapas.orderstream.validator.config.ValidatorProperties;
import com.tapas.orderstream.validator.processing.MicroBatchProcessor;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OrderEventsConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(OrderEventsConsumer.class);

    private final MicroBatchProcessor processor;

    public OrderEventsConsumer(MicroBatchProcessor processor, ValidatorProperties properties) {
        this.processor = processor;
        log.info("Validating topic {} as group {}", properties.getTopic(), properties.getGroupId());
    }

    @KafkaListener(
            topics = "${validator.topic}",
            groupId = "${validator.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, String>> records) {
        try {
            processor.process(records);
        } catch (RuntimeException e) {
            log.error("Micro-batch of {} records failed in stage {}", records.size(), processor.stage(), e);
            throw e;
        }
    }
}
