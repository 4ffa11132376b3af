package com.tapas.orderstream.publisher.events;

import com.tapas.orderstream.common.model.OrderEvent;

public interface OrderEventGenerator {

    OrderEvent next();
}
