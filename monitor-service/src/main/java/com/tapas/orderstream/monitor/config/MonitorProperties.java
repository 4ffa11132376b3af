package com.tapas.orderstream.monitor.config;

import com.tapas.orderstream.common.retry.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    @NotBlank
    private String topic;

    @NotBlank
    private String groupId = "order-tracker";

    /** Commit after this many processed records; 0 commits only on revocation and shutdown. */
    @PositiveOrZero
    private int commitEvery = 100;

    /** 0 means run until stopped. */
    @PositiveOrZero
    private long maxRecords;

    @Positive
    private long pollTimeoutMs = 1000;

    @Positive
    private long reportEverySeconds = 5;

    /** Bound of one metadata request when checking that the broker answers. */
    @Positive
    private long brokerTimeoutMs = 10_000;

    /** Consecutive empty polls after which the broker is checked again. */
    @Positive
    private int idlePollsBeforeBrokerCheck = 30;

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();
}
