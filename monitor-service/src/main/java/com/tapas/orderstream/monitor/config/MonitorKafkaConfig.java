package com.tapas.orderstream.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.common.model.OrderEventCodec;
import com.tapas.orderstream.monitor.tracking.LatencyTrackingMonitor;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.time.Clock;
import java.util.Map;

@Configuration
public class MonitorKafkaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsRegistry metricsRegistry(Clock clock) {
        return new MetricsRegistry(clock);
    }

    @Bean
    public ConsumerFactory<String, String> consumerFactory(
            KafkaProperties kafkaProperties, MonitorProperties properties) {
        Map<String, Object> config = kafkaProperties.buildConsumerProperties();
        config.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getGroupId());
        // offsets are committed only by the monitor
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return new DefaultKafkaConsumerFactory<>(config);
    }

    /**
     * The consumer is owned by the monitor and closed by it, so it is not a bean of its own.
     */
    @Bean
    public LatencyTrackingMonitor latencyTrackingMonitor(ConsumerFactory<String, String> consumerFactory,
                                                         ObjectMapper objectMapper,
                                                         MetricsRegistry metrics,
                                                         MonitorProperties properties,
                                                         Clock clock) {
        return new LatencyTrackingMonitor(consumerFactory.createConsumer(), new OrderEventCodec(objectMapper),
                metrics, properties, clock);
    }
}
