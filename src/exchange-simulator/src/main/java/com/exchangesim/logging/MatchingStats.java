package com.exchangesim.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Session counters read by {@link SessionSummaryLogger}.
 */
public class MatchingStats {

    public final AtomicLong buyOrdersReceived = new AtomicLong();
    public final AtomicLong sellOrdersReceived = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong ordersRejected = new AtomicLong();

    public long totalOrders() {
        return buyOrdersReceived.get() + sellOrdersReceived.get();
    }
}
