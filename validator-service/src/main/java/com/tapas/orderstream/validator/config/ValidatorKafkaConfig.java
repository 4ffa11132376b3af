package com.tapas.orderstream.validator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.common.retry.RetryTemplates;
import com.tapas.orderstream.validator.checkpoint.FileCheckpointStore;
import com.tapas.orderstream.validator.consumer.CheckpointSeekListener;
import com.tapas.orderstream.validator.processing.MicroBatchProcessor;
import com.tapas.orderstream.validator.processing.ValidatorStats;
import com.tapas.orderstream.validator.runtime.BrokerHandshake;
import com.tapas.orderstream.validator.runtime.StopOnFatalErrorHandler;
import com.tapas.orderstream.validator.runtime.ValidatorTermination;
import com.tapas.orderstream.validator.sink.JsonLinesSinkWriter;
import com.tapas.orderstream.validator.sink.SinkKind;
import com.tapas.orderstream.validator.sink.SinkRecordMapper;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.listener.ContainerProperties;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class ValidatorKafkaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConsumerFactory<String, String> consumerFactory(
            KafkaProperties kafkaProperties, ValidatorProperties properties) {
        Map<String, Object> config = kafkaProperties.buildConsumerProperties();
        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, properties.getMaxBatchRecords());
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            ValidatorProperties properties,
            MicroBatchProcessor processor,
            ValidatorTermination termination) {

        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(1); // one thread owns the sinks and checkpoints
        factory.setBatchListener(true);
        factory.setCommonErrorHandler(new StopOnFatalErrorHandler(termination));
        // started by ValidatorRunner once the broker has answered
        factory.setAutoStartup(false);

        ContainerProperties container = factory.getContainerProperties();
        // group offsets are informational only, positions come from the checkpoints
        container.setAckMode(ContainerProperties.AckMode.BATCH);
        container.setIdleBetweenPolls(properties.getTriggerIntervalMs());
        container.setConsumerRebalanceListener(new CheckpointSeekListener(processor));
        container.setIdleEventInterval(properties.getBrokerCheckIntervalMs());

        return factory;
    }

    @Bean
    public BrokerHandshake brokerHandshake(KafkaAdmin kafkaAdmin, ValidatorProperties properties) {
        Map<String, Object> config = new HashMap<>(kafkaAdmin.getConfigurationProperties());
        int timeoutMs = (int) properties.getBrokerTimeoutMs();
        config.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        config.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
        return new BrokerHandshake(() -> Admin.create(config), Duration.ofMillis(timeoutMs), properties.getRetry());
    }

    @Bean
    public ValidatorTermination validatorTermination() {
        return new ValidatorTermination();
    }

    @Bean
    public OrderEventCodec orderEventCodec(ObjectMapper objectMapper) {
        return new OrderEventCodec(objectMapper);
    }

    @Bean
    public ValidatorStats validatorStats() {
        return new ValidatorStats();
    }

    @Bean
    public MicroBatchProcessor microBatchProcessor(ValidatorProperties properties,
                                                   OrderEventCodec codec,
                                                   ObjectMapper objectMapper,
                                                   ValidatorStats stats,
                                                   Clock clock) {
        return new MicroBatchProcessor(
                codec,
                new SinkRecordMapper(objectMapper),
                new JsonLinesSinkWriter(SinkKind.VALID, properties.getSinkDir()),
                new JsonLinesSinkWriter(SinkKind.INVALID, properties.getSinkDir()),
                new FileCheckpointStore(SinkKind.VALID, properties.getTopic(), properties.getCheckpointDir(),
                        objectMapper, clock),
                new FileCheckpointStore(SinkKind.INVALID, properties.getTopic(), properties.getCheckpointDir(),
                        objectMapper, clock),
                RetryTemplates.exponential("sink io", properties.getRetry(),
                        List.of(UncheckedIOException.class)),
                stats);
    }
}
