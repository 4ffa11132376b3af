package com.tapas.orderstream.publisher.metrics;

import com.tapas.orderstream.common.metrics.MetricsRegistry;
import com.tapas.orderstream.publisher.config.PublisherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class PublisherMetricsReporter {

    private final MetricsRegistry metrics;
    private final String tag;

    public PublisherMetricsReporter(MetricsRegistry metrics, PublisherProperties properties) {
        this.metrics = metrics;
        this.tag = properties.reportTag();
    }

    @Scheduled(initialDelayString = "${publisher.report-every-seconds:5}",
            fixedDelayString = "${publisher.report-every-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void report() {
        log.info("[{}][metrics] {}", tag, metrics.snapshot().toPublisherLine());
    }
}
