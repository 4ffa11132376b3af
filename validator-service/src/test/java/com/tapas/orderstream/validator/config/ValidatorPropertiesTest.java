package com.tapas.orderstream.validator.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.diagnostics.FailureAnalysis;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ValidatorPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesOnly.class);

    @Test
    void defaults() {
        runner.withPropertyValues("validator.topic=orders")
                .run(context -> {
                    ValidatorProperties properties = context.getBean(ValidatorProperties.class);
                    assertThat(properties.getGroupId()).isEqualTo("order-validator");
                    assertThat(properties.getSinkDir()).isEqualTo(Path.of("data", "sink"));
                    assertThat(properties.getMaxBatchRecords()).isEqualTo(500);
                    assertThat(properties.getBrokerTimeoutMs()).isEqualTo(10_000);
                    assertThat(properties.getBrokerCheckIntervalMs()).isEqualTo(30_000);
                });
    }

    @Test
    void missingTopicAndBadBatchSize() {
        runner.withPropertyValues("validator.topic=", "validator.max-batch-records=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    FailureAnalysis analysis = new ValidatorUsageFailureAnalyzer()
                            .analyze(context.getStartupFailure());
                    assertThat(analysis.getDescription())
                            .contains("--topic")
                            .contains("--max-batch-records");
                    assertThat(analysis.getAction()).startsWith("Usage: validator-service");
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ValidatorProperties.class)
    static class PropertiesOnly {
    }
}
