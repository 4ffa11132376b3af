package com.tapas.orderstream.common.error;

/**
 * A sink write or checkpoint marker write failed after retrying. The batch it belongs
 * to is not acknowledged, so it is replayed on the next start.
 */
public class CheckpointCommitException extends FatalPipelineException {

    public static final int EXIT_CODE = 4;

    public CheckpointCommitException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
