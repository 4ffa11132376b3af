package com.tapas.orderstream.validator.runtime;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;

/**
 * Stops the container on any listener error so nothing is acknowledged past a failed
 * batch, and reports the error to the main thread.
 */
public class StopOnFatalErrorHandler extends CommonContainerStoppingErrorHandler {

    private final ValidatorTermination termination;

    public StopOnFatalErrorHandler(ValidatorTermination termination) {
        this.termination = termination;
    }

    @Override
    public void handleBatch(Exception thrownException, ConsumerRecords<?, ?> data, Consumer<?, ?> consumer,
                            MessageListenerContainer container, Runnable invokeListener) {
        termination.fail(thrownException);
        super.handleBatch(thrownException, data, consumer, container, invokeListener);
    }

    @Override
    public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                                     MessageListenerContainer container, boolean batchListener) {
        termination.fail(thrownException);
        super.handleOtherException(thrownException, consumer, container, batchListener);
    }
}
