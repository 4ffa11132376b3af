package com.tapas.orderstream.validator.runtime;

import com.tapas.orderstream.common.error.FatalPipelineException;
import jakarta.annotation.PreDestroy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands the first fatal listener error from the container thread to the main thread.
 */
public class ValidatorTermination {

    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    public void fail(Throwable error) {
        failure.compareAndSet(null, error);
        done.countDown();
    }

    @PreDestroy
    public void release() {
        done.countDown();
    }

    /**
     * Blocks until shutdown or a fatal error, rethrowing the error.
     */
    public void await() throws InterruptedException {
        done.await();
        Throwable error = failure.get();
        if (error == null) {
            return;
        }
        FatalPipelineException fatal = findFatal(error);
        if (fatal != null) {
            throw fatal;
        }
        throw new IllegalStateException("Validator stopped: " + error.getMessage(), error);
    }

    public boolean hasFailed() {
        return failure.get() != null;
    }

    static FatalPipelineException findFatal(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof FatalPipelineException) {
                return (FatalPipelineException) current;
            }
            current = current.getCause();
        }
        return null;
    }
}
