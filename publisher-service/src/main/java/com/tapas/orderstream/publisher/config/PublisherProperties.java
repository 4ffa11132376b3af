package com.tapas.orderstream.publisher.config;

import com.tapas.orderstream.common.retry.RetryProperties;
import com.tapas.orderstream.publisher.events.InvalidMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Publisher run settings. application.yml maps the short command-line flags
 * (--topic, --events-per-second, ...) onto these properties.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "publisher")
public class PublisherProperties {

    @NotBlank
    private String topic;

    @Positive
    private double eventsPerSecond = 10.0;

    /** 0 means no duration limit. */
    @PositiveOrZero
    private long durationSeconds;

    /** 0 means no event cap. */
    @PositiveOrZero
    private long maxEvents;

    @Positive
    private long reportEverySeconds = 5;

    @PositiveOrZero
    private long drainTimeoutMs = 10_000;

    /** Runs the invalid variant. An explicit invalid mode implies it. */
    private boolean invalid;

    /** Corruption strategy of the invalid variant, random when not given. */
    private InvalidMode invalidMode;

    private boolean provisionTopic;

    @Positive
    private int partitions = 6;

    @Positive
    @Max(Short.MAX_VALUE)
    private int replicationFactor = 2;

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    public boolean isInvalidVariant() {
        return invalid || invalidMode != null;
    }

    public InvalidMode selectedInvalidMode() {
        return invalidMode == null ? InvalidMode.RANDOM : invalidMode;
    }

    public String reportTag() {
        return isInvalidVariant() ? "producer_invalid" : "producer";
    }
}
