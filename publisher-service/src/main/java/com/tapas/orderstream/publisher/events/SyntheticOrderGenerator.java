package com.tapas.orderstream.publisher.events;

import com.tapas.orderstream.common.model.OrderEvent;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Builds valid order events. Purchases are spread over the last four weeks at a random
 * time of day; event_time_ms is always the creation instant.
 */
public class SyntheticOrderGenerator implements OrderEventGenerator {

    private static final int MAX_QUANTITY = 20;
    private static final int PURCHASE_WINDOW_DAYS = 28;
    private static final int USER_POOL = 5_000;
    private static final double MIN_PRICE_FACTOR = 0.85;
    private static final double MAX_PRICE_FACTOR = 1.20;

    private final Clock clock;
    private final Random random;

    public SyntheticOrderGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public OrderEvent next() {
        long nowMs = clock.millis();
        LocalDateTime purchaseDateTime = LocalDateTime.ofInstant(clock.instant(), ZoneId.systemDefault())
                .minusDays(random.nextInt(PURCHASE_WINDOW_DAYS))
                .minusHours(random.nextInt(24))
                .minusMinutes(random.nextInt(60))
                .minusSeconds(random.nextInt(60))
                .withNano(0);

        ProductCatalog.Product product = pick(ProductCatalog.PRODUCTS);
        int quantity = 1 + random.nextInt(MAX_QUANTITY);
        BigDecimal unitPrice = priceAround(product.basePrice());
        int discountPct = pick(ProductCatalog.DISCOUNTS);
        BigDecimal totalAmount = unitPrice.multiply(BigDecimal.valueOf(quantity))
                .multiply(BigDecimal.valueOf(100 - discountPct))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);

        return new OrderEvent(
                UUID.randomUUID().toString(),
                product.item(),
                product.category(),
                quantity,
                unitPrice,
                discountPct,
                totalAmount,
                String.format("user-%04d", 1 + random.nextInt(USER_POOL)),
                pick(ProductCatalog.SALES_CHANNELS),
                pick(ProductCatalog.PAYMENT_METHODS),
                pick(ProductCatalog.STORE_CITIES),
                purchaseDateTime,
                nowMs,
                null);
    }

    private BigDecimal priceAround(BigDecimal basePrice) {
        double factor = MIN_PRICE_FACTOR + (MAX_PRICE_FACTOR - MIN_PRICE_FACTOR) * random.nextDouble();
        return basePrice.multiply(BigDecimal.valueOf(factor)).setScale(2, RoundingMode.HALF_UP);
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }
}
