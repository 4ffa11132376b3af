package com.tapas.orderstream.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order event published to the orders topic.
 * orderId is the partition key and is present even on deliberately invalid events,
 * so rejected records stay traceable downstream.
 * quantity, unitPrice and totalAmount are nullable: a missing field is omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderEvent(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("product_id") String productId,
        @JsonProperty("category") String category,
        @JsonProperty("quantity") Integer quantity,
        @JsonProperty("unit_price") BigDecimal unitPrice,
        @JsonProperty("discount_pct") Integer discountPct,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("user_id") String userId,
        @JsonProperty("channel") String channel,
        @JsonProperty("payment_method") String paymentMethod,
        @JsonProperty("store_city") String storeCity,
        @JsonProperty("purchase_datetime") LocalDateTime purchaseDateTime,
        @JsonProperty("event_time_ms") Long eventTimeMs,
        @JsonProperty("invalid_mode") String invalidMode) {

    public OrderEvent withQuantity(Integer newQuantity) {
        return new OrderEvent(orderId, productId, category, newQuantity, unitPrice, discountPct,
                totalAmount, userId, channel, paymentMethod, storeCity, purchaseDateTime,
                eventTimeMs, invalidMode);
    }

    public OrderEvent withUnitPrice(BigDecimal newUnitPrice) {
        return new OrderEvent(orderId, productId, category, quantity, newUnitPrice, discountPct,
                totalAmount, userId, channel, paymentMethod, storeCity, purchaseDateTime,
                eventTimeMs, invalidMode);
    }

    /**
     * Marks the event as deliberately corrupted. The total no longer matches the
     * line fields, so it is dropped.
     */
    public OrderEvent corruptedBy(String mode) {
        return new OrderEvent(orderId, productId, category, quantity, unitPrice, discountPct,
                null, userId, channel, paymentMethod, storeCity, purchaseDateTime,
                eventTimeMs, mode);
    }
}
