package com.tapas.orderstream.common.model;

import java.util.Objects;

/**
 * Result of classifying one inbound record.
 */
public interface ValidationOutcome {

    boolean isValid();

    /**
     * The decoded event, or null when the payload could not be decoded.
     */
    OrderEvent event();

    static ValidationOutcome valid(OrderEvent event) {
        return new Valid(event);
    }

    static ValidationOutcome invalid(OrderEvent event, InvalidReason reason) {
        return new Invalid(event, reason);
    }

    record Valid(OrderEvent event) implements ValidationOutcome {
        public Valid {
            Objects.requireNonNull(event, "event");
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    record Invalid(OrderEvent event, InvalidReason reason) implements ValidationOutcome {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
