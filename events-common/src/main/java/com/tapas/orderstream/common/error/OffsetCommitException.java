package com.tapas.orderstream.common.error;

/**
 * Consumer offsets could not be committed after retrying.
 */
public class OffsetCommitException extends FatalPipelineException {

    public static final int EXIT_CODE = 4;

    public OffsetCommitException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
