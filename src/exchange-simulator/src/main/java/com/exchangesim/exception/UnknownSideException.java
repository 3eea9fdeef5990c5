package com.exchangesim.exception;

/**
 * Order side is neither BUY nor SELL
 */
public class UnknownSideException extends OrderRejectedException {

    private final String side;

    public UnknownSideException(long orderId, String side) {
        super(orderId, "Unknown order side: " + side);
        this.side = side;
    }

    public String getSide() {
        return side;
    }

    @Override
    public String getReason() {
        return "UNKNOWN_SIDE";
    }
}
