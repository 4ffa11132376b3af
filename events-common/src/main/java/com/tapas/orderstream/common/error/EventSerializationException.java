package com.tapas.orderstream.common.error;

/**
 * Outbound event could not be written as JSON. Affects a single record only.
 */
public class EventSerializationException extends OrderStreamException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
