package com.tapas.orderstream.publisher.events;

import java.math.BigDecimal;
import java.util.List;

/**
 * Grocery catalog the synthetic orders are drawn from.
 */
final class ProductCatalog {

    record Product(String item, String category, BigDecimal basePrice) {
    }

    static final List<Product> PRODUCTS = List.of(
            new Product("yogurt", "dairy", new BigDecimal("3.20")),
            new Product("potatoes", "vegetables", new BigDecimal("2.10")),
            new Product("apples", "fruit", new BigDecimal("2.80")),
            new Product("bananas", "fruit", new BigDecimal("3.10")),
            new Product("carrots", "vegetables", new BigDecimal("2.40")),
            new Product("cheese", "dairy", new BigDecimal("8.50")),
            new Product("bread", "bakery", new BigDecimal("4.20")),
            new Product("rice", "grains", new BigDecimal("5.90")),
            new Product("pasta", "grains", new BigDecimal("6.20")),
            new Product("eggs", "dairy", new BigDecimal("7.30")));

    static final List<String> PAYMENT_METHODS = List.of("card", "blik", "cash", "mobile_wallet");

    static final List<String> SALES_CHANNELS = List.of("store", "online", "pickup");

    // discount 0 is three times as likely as any other
    static final List<Integer> DISCOUNTS = List.of(0, 0, 0, 5, 10, 15);

    static final List<String> STORE_CITIES = List.of(
            "Warszawa", "Krakow", "Gdansk", "Wroclaw", "Poznan", "Lodz", "Lublin", "Szczecin");

    private ProductCatalog() {
    }
}
