package com.exchangesim.exception;

/**
 * Base class for orders an order book refuses before any matching happens.
 * A rejected submission leaves the book untouched.
 */
public class OrderRejectedException extends RuntimeException {

    private final long orderId;

    public OrderRejectedException(long orderId, String message) {
        super(message);
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }

    /**
     * Short label used for metrics and structured logs.
     */
    public String getReason() {
        return "REJECTED";
    }
}
