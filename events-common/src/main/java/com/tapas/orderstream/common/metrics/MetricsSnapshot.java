package com.tapas.orderstream.common.metrics;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable point-in-time copy of the registry counters.
 * Publisher side: sentOk, sentError, ack latency. Monitor side: processed, errors, end-to-end latency.
 */
public record MetricsSnapshot(
        long sentOk,
        long sentError,
        double ackLatencyTotalMs,
        long processed,
        long errors,
        long latencySamples,
        double latencyTotalMs,
        long elapsedMs,
        Instant takenAt) {

    private static final double MIN_ELAPSED_SECONDS = 0.001;

    public long sendAttempts() {
        return sentOk + sentError;
    }

    public double elapsedSeconds() {
        return Math.max(elapsedMs / 1000.0, MIN_ELAPSED_SECONDS);
    }

    public double publishThroughputEps() {
        return sentOk / elapsedSeconds();
    }

    public double avgAckMs() {
        return sentOk == 0 ? 0.0 : ackLatencyTotalMs / sentOk;
    }

    public double consumeThroughputEps() {
        return processed / elapsedSeconds();
    }

    public double avgEndToEndLatencyMs() {
        return latencySamples == 0 ? 0.0 : latencyTotalMs / latencySamples;
    }

    public String toPublisherLine() {
        return String.format(Locale.ROOT,
                "sent_ok=%d sent_error=%d throughput_eps=%.2f avg_ack_ms=%.2f",
                sentOk, sentError, publishThroughputEps(), avgAckMs());
    }

    public String toMonitorLine() {
        return String.format(Locale.ROOT,
                "processed=%d errors=%d throughput_eps=%.2f avg_end_to_end_latency_ms=%.2f",
                processed, errors, consumeThroughputEps(), avgEndToEndLatencyMs());
    }

    public String elapsedSuffix() {
        return String.format(Locale.ROOT, "elapsed_s=%.2f", elapsedSeconds());
    }
}
