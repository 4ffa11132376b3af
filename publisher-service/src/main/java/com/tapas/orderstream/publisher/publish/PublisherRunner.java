package com.tapas.orderstream.publisher.publish;

import com.tapas.orderstream.publisher.config.PublisherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class PublisherRunner implements ApplicationRunner {

    private final RateGovernedPublisher publisher;
    private final PublisherProperties properties;

    public PublisherRunner(RateGovernedPublisher publisher, PublisherProperties properties) {
        this.publisher = publisher;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        log.info("[{}] publishing to topic={} at {} events/s (duration={}s, max-events={})",
                properties.reportTag(), properties.getTopic(), properties.getEventsPerSecond(),
                properties.getDurationSeconds(), properties.getMaxEvents());
        publisher.run();
    }
}
