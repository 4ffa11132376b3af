package com.tapas.orderstream.publisher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.publisher.events.InvalidOrderGenerator;
import com.tapas.orderstream.publisher.events.OrderEventGenerator;
import com.tapas.orderstream.publisher.events.SyntheticOrderGenerator;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Clock;
import java.util.Random;

@Slf4j
@Configuration
public class PublisherKafkaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsRegistry metricsRegistry(Clock clock) {
        return new MetricsRegistry(clock);
    }

    @Bean
    public OrderEventCodec orderEventCodec(ObjectMapper objectMapper) {
        return new OrderEventCodec(objectMapper);
    }

    @Bean
    public Producer<String, String> orderEventProducer(KafkaProperties kafkaProperties) {
        return new KafkaProducer<>(kafkaProperties.buildProducerProperties());
    }

    @Bean
    public OrderEventGenerator orderEventGenerator(PublisherProperties properties, Clock clock) {
        Random random = new Random();
        SyntheticOrderGenerator synthetic = new SyntheticOrderGenerator(clock, random);
        if (!properties.isInvalidVariant()) {
            return synthetic;
        }
        log.info("Publishing deliberately invalid events, mode={}", properties.selectedInvalidMode().code());
        return new InvalidOrderGenerator(synthetic, properties.selectedInvalidMode(), random);
    }

    /**
     * Picked up by KafkaAdmin, which creates the topic only when it does not exist yet.
     */
    @Bean
    @ConditionalOnProperty(prefix = "publisher", name = "provision-topic", havingValue = "true")
    public NewTopic ordersTopic(PublisherProperties properties) {
        log.info("Provisioning topic {} with {} partitions, replication factor {}",
                properties.getTopic(), properties.getPartitions(), properties.getReplicationFactor());
        return TopicBuilder.name(properties.getTopic())
                .partitions(properties.getPartitions())
                .replicas(properties.getReplicationFactor())
                .build();
    }
}
