package com.tapas.orderstream.monitor.tracking;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class MonitorRunner implements ApplicationRunner {

    private final LatencyTrackingMonitor monitor;

    public MonitorRunner(LatencyTrackingMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void run(ApplicationArguments args) {
        monitor.run();
    }
}
