package com.tapas.orderstream.publisher.events;

import com.tapas.orderstream.common.model.OrderEvent;

import java.math.BigDecimal;
import java.util.Random;

/**
 * Wraps the synthetic generator and breaks one or both required line fields.
 * order_id is left intact so the rejected record can still be traced.
 */
public class InvalidOrderGenerator implements OrderEventGenerator {

    private final OrderEventGenerator delegate;
    private final InvalidMode mode;
    private final Random random;

    public InvalidOrderGenerator(OrderEventGenerator delegate, InvalidMode mode, Random random) {
        this.delegate = delegate;
        this.mode = mode;
        this.random = random;
    }

    @Override
    public OrderEvent next() {
        InvalidMode selected = mode == InvalidMode.RANDOM
                ? InvalidMode.CONCRETE.get(random.nextInt(InvalidMode.CONCRETE.size()))
                : mode;
        return corrupt(delegate.next(), selected);
    }

    static OrderEvent corrupt(OrderEvent order, InvalidMode selected) {
        OrderEvent broken = switch (selected) {
            case MISSING_QUANTITY -> order.withQuantity(null);
            case MISSING_PRICE -> order.withUnitPrice(null);
            case MISSING_BOTH -> order.withQuantity(null).withUnitPrice(null);
            case NON_POSITIVE -> order.withQuantity(0).withUnitPrice(BigDecimal.ZERO);
            case NON_POSITIVE_QUANTITY -> order.withQuantity(0);
            case NON_POSITIVE_PRICE -> order.withUnitPrice(BigDecimal.ZERO);
            case RANDOM -> throw new IllegalArgumentException("RANDOM is resolved before corrupting");
        };
        return broken.corruptedBy(selected.code());
    }
}
