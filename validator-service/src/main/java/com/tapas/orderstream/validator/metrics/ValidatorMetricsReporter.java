package com.tapas.orderstream.validator.metrics;

import com.tapas.orderstream.validator.processing.MicroBatchProcessor;
import com.tapas.orderstream.validator.processing.ValidatorStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ValidatorMetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(ValidatorMetricsReporter.class);

    private final ValidatorStats stats;
    private final MicroBatchProcessor processor;

    public ValidatorMetricsReporter(ValidatorStats stats, MicroBatchProcessor processor) {
        this.stats = stats;
        this.processor = processor;
    }

    @Scheduled(initialDelayString = "${validator.report-every-seconds:5}",
            fixedDelayString = "${validator.report-every-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void report() {
        log.info("[validator][metrics] {} stage={}", stats.toLine(), processor.stage());
    }
}
