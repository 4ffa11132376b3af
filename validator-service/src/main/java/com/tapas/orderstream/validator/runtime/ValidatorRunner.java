package com.tapas.orderstream.validator.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

/**
 * Checks the broker, starts the listener container and then keeps the main thread until
 * the container stops, so that a fatal error becomes the process exit code.
 */
@Component
public class ValidatorRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRunner.class);

    private final ValidatorTermination termination;
    private final BrokerHandshake handshake;
    private final KafkaListenerEndpointRegistry registry;

    public ValidatorRunner(ValidatorTermination termination,
                           BrokerHandshake handshake,
                           KafkaListenerEndpointRegistry registry) {
        this.termination = termination;
        this.handshake = handshake;
        this.registry = registry;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        int nodes = handshake.verify();
        log.info("Broker reachable ({} node(s)), starting the listener", nodes);
        registry.getListenerContainers().forEach(MessageListenerContainer::start);

        termination.await();
        log.info("Validator stopped");
    }
}
