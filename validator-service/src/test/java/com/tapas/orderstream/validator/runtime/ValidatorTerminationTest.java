package com.tapas.orderstream.validator.runtime;

import com.tapas.orderstream.common.error.CheckpointCommitException;
import com.tapas.orderstream.common.error.FatalPipelineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.listener.ListenerExecutionFailedException;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTerminationTest {

    @Test
    @DisplayName("A fatal error wrapped by the container is rethrown with its exit code")
    void rethrowsFatalCause() {
        ValidatorTermination termination = new ValidatorTermination();
        CheckpointCommitException fatal = new CheckpointCommitException("disk full", new IOException("ENOSPC"));

        termination.fail(new ListenerExecutionFailedException("Listener failed", fatal));

        FatalPipelineException thrown = assertThrows(FatalPipelineException.class, termination::await);
        assertSame(fatal, thrown);
        assertEquals(4, thrown.getExitCode());
    }

    @Test
    @DisplayName("Other listener errors still stop the run")
    void otherErrors() {
        ValidatorTermination termination = new ValidatorTermination();

        termination.fail(new IllegalStateException("checkpoint would move back"));

        assertThrows(IllegalStateException.class, termination::await);
        assertTrue(termination.hasFailed());
    }

    @Test
    @DisplayName("An orderly shutdown releases the runner without an error")
    void orderlyShutdown() {
        ValidatorTermination termination = new ValidatorTermination();

        termination.release();

        assertDoesNotThrow(termination::await);
        assertFalse(termination.hasFailed());
    }
}
