package com.tapas.orderstream.common.error;

/**
 * Inbound record could not be decoded into an order event. Affects a single record only.
 */
public class MalformedPayloadException extends OrderStreamException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
