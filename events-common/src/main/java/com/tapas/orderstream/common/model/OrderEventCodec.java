package com.tapas.orderstream.common.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.tapas.orderstream.common.error.EventSerializationException;
import com.tapas.orderstream.common.error.MalformedPayloadException;

/**
 * JSON wire format of {@link OrderEvent}.
 */
public class OrderEventCodec {

    private final ObjectMapper objectMapper;
    private final ObjectMapper strictReader;

    public OrderEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = strict(objectMapper);
    }

    /**
     * Copy of the shared mapper that refuses to truncate 2.5 into a quantity or to read
     * numbers out of strings. Such payloads decode as malformed.
     */
    private static ObjectMapper strict(ObjectMapper shared) {
        ObjectMapper strict = shared.copy();
        strict.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        for (LogicalType numeric : new LogicalType[]{LogicalType.Integer, LogicalType.Float}) {
            strict.coercionConfigFor(numeric)
                    .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        }
        return strict;
    }

    public String encode(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize order event " + event.orderId(), e);
        }
    }

    /**
     * Decodes a payload. Anything that is not a JSON object carrying an order_id is malformed.
     */
    public OrderEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedPayloadException("Empty payload");
        }
        try {
            JsonNode tree = strictReader.readTree(payload);
            if (tree == null || !tree.isObject()) {
                throw new MalformedPayloadException("Payload is not a JSON object");
            }
            JsonNode orderId = tree.get("order_id");
            if (orderId == null || !orderId.isTextual() || orderId.asText().isBlank()) {
                throw new MalformedPayloadException("Payload has no order_id");
            }
            return strictReader.treeToValue(tree, OrderEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Undecodable payload: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Undecodable payload: " + e.getMessage(), e);
        }
    }

    public ValidationOutcome classify(String payload) {
        OrderEvent event;
        try {
            event = decode(payload);
        } catch (MalformedPayloadException e) {
            return ValidationOutcome.invalid(null, InvalidReason.MALFORMED_PAYLOAD);
        }
        return OrderEventValidator.classify(event);
    }
}
