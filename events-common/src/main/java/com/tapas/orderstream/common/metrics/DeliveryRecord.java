package com.tapas.orderstream.common.metrics;

import java.time.Instant;

/**
 * Outcome of one publish attempt. Folded into {@link MetricsRegistry}, never stored.
 */
public record DeliveryRecord(Outcome outcome, Instant sentAt, double ackLatencyMs) {

    public enum Outcome {
        ACK_OK,
        ACK_ERROR
    }

    public static DeliveryRecord ok(Instant sentAt, double ackLatencyMs) {
        return new DeliveryRecord(Outcome.ACK_OK, sentAt, ackLatencyMs);
    }

    public static DeliveryRecord error(Instant sentAt, double ackLatencyMs) {
        return new DeliveryRecord(Outcome.ACK_ERROR, sentAt, ackLatencyMs);
    }
}
