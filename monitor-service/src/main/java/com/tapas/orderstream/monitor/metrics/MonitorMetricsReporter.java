package com.tapas.orderstream.monitor.metrics;

import com.tapas.orderstream.common.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MonitorMetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(MonitorMetricsReporter.class);

    private final MetricsRegistry metrics;

    public MonitorMetricsReporter(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Scheduled(initialDelayString = "${monitor.report-every-seconds:5}",
            fixedDelayString = "${monitor.report-every-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void report() {
        log.info("[consumer][metrics] {}", metrics.snapshot().toMonitorLine());
    }
}
