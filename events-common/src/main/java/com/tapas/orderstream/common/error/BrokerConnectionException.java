package com.tapas.orderstream.common.error;

/**
 * The broker stayed unreachable after the retry budget was spent.
 */
public class BrokerConnectionException extends FatalPipelineException {

    public static final int EXIT_CODE = 3;

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
