package com.tapas.orderstream.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tapas.orderstream.common.model.OrderEvent;
import com.tapas.orderstream.common.model.OrderEventCodec;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public final class ValidatorFixtures {

    public static final String TOPIC = "orders";

    private ValidatorFixtures() {
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }

    public static OrderEvent order(String orderId, Integer quantity, BigDecimal unitPrice) {
        return new OrderEvent(orderId, "bread", "bakery", quantity, unitPrice, 0,
                null, "user-0001", "store", "card", "Gdansk",
                LocalDateTime.of(2026, 10, 17, 9, 30), 1_792_400_000_000L, null);
    }

    public static String validPayload(String orderId) {
        return new OrderEventCodec(objectMapper()).encode(order(orderId, 2, new BigDecimal("4.20")));
    }

    public static String missingPricePayload(String orderId) {
        return new OrderEventCodec(objectMapper()).encode(order(orderId, 2, null).corruptedBy("missing_price"));
    }

    public static ConsumerRecord<String, String> record(int partition, long offset, String payload) {
        return new ConsumerRecord<>(TOPIC, partition, offset, "key-" + offset, payload);
    }
}
