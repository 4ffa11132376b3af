package com.tapas.orderstream.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an event was routed to the invalid sink. Declaration order is the
 * precedence order used by {@link OrderEventValidator}.
 */
public enum InvalidReason {
    MALFORMED_PAYLOAD("malformed_payload"),
    MISSING_QUANTITY("missing_quantity"),
    MISSING_PRICE("missing_price"),
    NON_POSITIVE_QUANTITY("non_positive_quantity"),
    NON_POSITIVE_PRICE("non_positive_price");

    private final String code;

    InvalidReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
