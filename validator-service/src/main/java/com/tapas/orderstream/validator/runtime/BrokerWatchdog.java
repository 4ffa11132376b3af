package com.tapas.orderstream.validator.runtime;

import com.tapas.orderstream.common.error.BrokerConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.event.ListenerContainerIdleEvent;
import org.springframework.stereotype.Component;

/**
 * Re-checks the broker whenever the listener has gone a while without records, and
 * ends the run when it no longer answers.
 */
@Component
public class BrokerWatchdog {

    private static final Logger log = LoggerFactory.getLogger(BrokerWatchdog.class);

    private final BrokerHandshake handshake;
    private final ValidatorTermination termination;

    public BrokerWatchdog(BrokerHandshake handshake, ValidatorTermination termination) {
        this.handshake = handshake;
        this.termination = termination;
    }

    @EventListener(ListenerContainerIdleEvent.class)
    public void onIdle() {
        if (termination.hasFailed()) {
            return;
        }
        try {
            handshake.verify();
        } catch (BrokerConnectionException e) {
            log.error("Listener idle and the broker no longer answers", e);
            termination.fail(e);
        }
    }
}
