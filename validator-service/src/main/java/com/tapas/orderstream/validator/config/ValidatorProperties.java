package com.tapas.orderstream.validator.config;

import com.tapas.orderstream.common.retry.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Validator run settings, bound from --topic, --sink-dir, --checkpoint-dir and friends.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "validator")
public class ValidatorProperties {

    @NotBlank
    private String topic;

    @NotBlank
    private String groupId = "order-validator";

    @NotNull
    private Path sinkDir = Path.of("data", "sink");

    @NotNull
    private Path checkpointDir = Path.of("data", "checkpoints");

    /** Upper bound of one micro-batch (max.poll.records). */
    @Positive
    private int maxBatchRecords = 500;

    /** Pause between polls, the micro-batch trigger interval. */
    @PositiveOrZero
    private long triggerIntervalMs = 1000;

    @Positive
    private long reportEverySeconds = 5;

    /** Bound of one cluster describe call when checking that the broker answers. */
    @Positive
    private long brokerTimeoutMs = 10_000;

    /** Listener idle time after which the broker is checked again. */
    @Positive
    private long brokerCheckIntervalMs = 30_000;

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();
}
