package com.exchangesim.domain;

import java.util.List;

/**
 * Trades produced by one incoming order, plus whether it was fully filled
 * (and therefore never rested).
 */
public class MatchResultSet {

    private final List<Trade> trades;
    private final long totalFilledQuantity;
    private final boolean incomingFullyFilled;

    public MatchResultSet(List<Trade> trades, long totalFilledQuantity,
                          boolean incomingFullyFilled) {
        this.trades = List.copyOf(trades);
        this.totalFilledQuantity = totalFilledQuantity;
        this.incomingFullyFilled = incomingFullyFilled;
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public long getTotalFilledQuantity() {
        return totalFilledQuantity;
    }

    public boolean isIncomingFullyFilled() {
        return incomingFullyFilled;
    }

    public int getTradeCount() {
        return trades.size();
    }

    public boolean hasTrades() {
        return !trades.isEmpty();
    }
}
