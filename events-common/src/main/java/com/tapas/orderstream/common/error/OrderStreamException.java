package com.tapas.orderstream.common.error;

/**
 * Base type of every error raised by the order stream services.
 */
public abstract class OrderStreamException extends RuntimeException {

    protected OrderStreamException(String message) {
        super(message);
    }

    protected OrderStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
