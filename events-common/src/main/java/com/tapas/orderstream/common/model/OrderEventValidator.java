package com.tapas.orderstream.common.model;

import java.math.BigDecimal;

/**
 * Required-field rule for order events. Checks run in a fixed order and the first
 * violation wins: missing quantity, missing price, non-positive quantity, non-positive price.
 */
public final class OrderEventValidator {

    private OrderEventValidator() {
    }

    public static ValidationOutcome classify(OrderEvent event) {
        if (event == null || event.orderId() == null || event.orderId().isBlank()) {
            return ValidationOutcome.invalid(event, InvalidReason.MALFORMED_PAYLOAD);
        }
        if (event.quantity() == null) {
            return ValidationOutcome.invalid(event, InvalidReason.MISSING_QUANTITY);
        }
        if (event.unitPrice() == null) {
            return ValidationOutcome.invalid(event, InvalidReason.MISSING_PRICE);
        }
        if (event.quantity() <= 0) {
            return ValidationOutcome.invalid(event, InvalidReason.NON_POSITIVE_QUANTITY);
        }
        if (event.unitPrice().compareTo(BigDecimal.ZERO) <= 0) {
            return ValidationOutcome.invalid(event, InvalidReason.NON_POSITIVE_PRICE);
        }
        return ValidationOutcome.valid(event);
    }
}
