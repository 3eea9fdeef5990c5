package com.exchangesim.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Order entity with fill tracking. Identity, symbol, side and price are fixed
 * at construction; only the remaining quantity changes, and only downwards,
 * as the order is executed.
 *
 * The side is kept as the normalized code the caller supplied. The order book
 * resolves it to a {@link Side} and rejects anything other than BUY or SELL.
 */
public class Order {

    private final long orderId;
    private final String symbol;
    private final String side;
    private final Price price;
    private final long originalQuantity;
    private long quantity;

    public Order(long orderId, String symbol, String side, Price price, long quantity) {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(price, "price");
        if (symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + quantity);
        }
        this.orderId = orderId;
        this.symbol = symbol.toUpperCase(Locale.ROOT);
        this.side = side.toUpperCase(Locale.ROOT);
        this.price = price;
        this.originalQuantity = quantity;
        this.quantity = quantity;
    }

    public Order(long orderId, String symbol, Side side, Price price, long quantity) {
        this(orderId, symbol, side.name(), price, quantity);
    }

    /**
     * Execute part of this order.
     *
     * @param execQuantity requested quantity, must be positive
     * @return the quantity actually executed, capped at what remains
     * @throws IllegalArgumentException if {@code execQuantity <= 0}
     */
    public long execute(long execQuantity) {
        if (execQuantity <= 0) {
            throw new IllegalArgumentException("Execution quantity must be positive: " + execQuantity);
        }
        long actual = Math.min(execQuantity, quantity);
        quantity -= actual;
        return actual;
    }

    public boolean isFilled() {
        return quantity == 0;
    }

    public long getOrderId() {
        return orderId;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getSide() {
        return side;
    }

    public Price getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public long getOriginalQuantity() {
        return originalQuantity;
    }

    public long getExecutedQuantity() {
        return originalQuantity - quantity;
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", symbol='" + symbol + '\'' +
                ", side='" + side + '\'' +
                ", price=" + price +
                ", quantity=" + quantity +
                '}';
    }
}
