package com.tapas.orderstream.common.retry;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

/**
 * Bounded retry budget for connection-level and commit-level failures.
 */
@Getter
@Setter
public class RetryProperties {

    @Min(1)
    private int maxAttempts = 5;

    @Positive
    private long initialBackoffMs = 200;

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    @Positive
    private long maxBackoffMs = 5000;
}
