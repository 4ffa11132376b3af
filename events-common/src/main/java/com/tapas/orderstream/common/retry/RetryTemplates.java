package com.tapas.orderstream.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;

public final class RetryTemplates {

    private static final Logger log = LoggerFactory.getLogger(RetryTemplates.class);

    private RetryTemplates() {
    }

    /**
     * Exponential backoff over the given exception types; anything else fails at once.
     */
    public static RetryTemplate exponential(String operation,
                                            RetryProperties properties,
                                            List<Class<? extends Throwable>> retryOn) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getMaxAttempts())
                .exponentialBackoff(properties.getInitialBackoffMs(),
                        properties.getMultiplier(),
                        properties.getMaxBackoffMs())
                .retryOn(retryOn)
                .withListener(new LoggingRetryListener(operation, properties.getMaxAttempts()))
                .build();
    }

    private static final class LoggingRetryListener implements RetryListener {

        private final String operation;
        private final int maxAttempts;

        private LoggingRetryListener(String operation, int maxAttempts) {
            this.operation = operation;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context,
                                                     RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            log.warn("{} attempt {}/{} failed: {}", operation, context.getRetryCount(),
                    maxAttempts, throwable.getMessage());
        }
    }
}
