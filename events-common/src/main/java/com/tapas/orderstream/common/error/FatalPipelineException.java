package com.tapas.orderstream.common.error;

import org.springframework.boot.ExitCodeGenerator;

/**
 * An error that ends the process. Spring Boot reads the exit code from the exception
 * when it escapes an {@code ApplicationRunner}.
 */
public abstract class FatalPipelineException extends OrderStreamException implements ExitCodeGenerator {

    protected FatalPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
