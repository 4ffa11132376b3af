package com.tapas.orderstream.publisher.events;

import java.util.List;

/**
 * How the invalid variant corrupts an otherwise valid order.
 */
public enum InvalidMode {
    MISSING_QUANTITY("missing_quantity"),
    MISSING_PRICE("missing_price"),
    MISSING_BOTH("missing_both"),
    NON_POSITIVE("non_positive"),
    NON_POSITIVE_QUANTITY("non_positive_quantity"),
    NON_POSITIVE_PRICE("non_positive_price"),
    /** Picks one of the concrete modes per event. */
    RANDOM("random");

    static final List<InvalidMode> CONCRETE = List.of(
            MISSING_QUANTITY, MISSING_PRICE, MISSING_BOTH,
            NON_POSITIVE, NON_POSITIVE_QUANTITY, NON_POSITIVE_PRICE);

    private final String code;

    InvalidMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
