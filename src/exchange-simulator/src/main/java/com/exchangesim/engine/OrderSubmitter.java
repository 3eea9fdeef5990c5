package com.exchangesim.engine;

import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.MatchResultSet;
import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Side;
import com.exchangesim.exception.OrderRejectedException;
import com.exchangesim.logging.MatchingStats;
import com.exchangesim.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Submits orders to order books and records metrics and session statistics
 * around each submission.
 *
 * Processing per order:
 * 1. Count the order by side
 * 2. OrderBook.addOrder (validation, matching, resting)
 * 3. Record trades, match duration and depth gauges
 *
 * A rejection is counted and logged, then rethrown to the caller unchanged.
 */
public class OrderSubmitter {

    private static final Logger logger = LoggerFactory.getLogger(OrderSubmitter.class);

    private final ExchangeSession session;
    private final MetricsRegistry metrics;
    private final MatchingStats stats;
    private final String sessionId;

    public OrderSubmitter(ExchangeSession session, MetricsRegistry metrics,
                          MatchingStats stats, String sessionId) {
        this.session = session;
        this.metrics = metrics;
        this.stats = stats;
        this.sessionId = sessionId;
    }

    public MatchResultSet submit(OrderBook book, Order order) {
        countReceived(order);

        long start = System.nanoTime();
        MatchResultSet resultSet;
        try {
            resultSet = book.addOrder(order);
        } catch (OrderRejectedException e) {
            stats.ordersRejected.incrementAndGet();
            metrics.ordersRejectedTotal.labelValues(sessionId, e.getReason()).inc();
            logger.warn("Rejected order",
                    keyValue("event", "ORDER_REJECTED"),
                    keyValue("session", sessionId),
                    keyValue("orderId", e.getOrderId()),
                    keyValue("book", book.getSymbol()),
                    keyValue("reason", e.getReason()),
                    keyValue("message", e.getMessage()));
            throw e;
        }
        metrics.matchDuration.labelValues(sessionId).observe(nanosToSeconds(System.nanoTime() - start));

        stats.tradesExecuted.addAndGet(resultSet.getTradeCount());
        metrics.tradesTotal.labelValues(sessionId).inc(resultSet.getTradeCount());
        metrics.updateDepth(sessionId, session.getAllBooks());

        logger.debug("Order processed",
                keyValue("event", "ORDER_PROCESSED"),
                keyValue("session", sessionId),
                keyValue("orderId", order.getOrderId()),
                keyValue("book", book.getSymbol()),
                keyValue("trades", resultSet.getTradeCount()),
                keyValue("filled", resultSet.getTotalFilledQuantity()),
                keyValue("rested", !resultSet.isIncomingFullyFilled()));
        return resultSet;
    }

    /**
     * Submit orders one at a time, in list order. Stops at the first rejected
     * order; orders before it stay applied.
     */
    public List<MatchResultSet> sendOrders(OrderBook book, List<Order> orders) {
        List<MatchResultSet> results = new ArrayList<>(orders.size());
        for (Order order : orders) {
            results.add(submit(book, order));
        }
        return results;
    }

    private void countReceived(Order order) {
        String label;
        if (Side.BUY.name().equals(order.getSide())) {
            stats.buyOrdersReceived.incrementAndGet();
            label = "buy";
        } else if (Side.SELL.name().equals(order.getSide())) {
            stats.sellOrdersReceived.incrementAndGet();
            label = "sell";
        } else {
            label = "unknown";
        }
        metrics.ordersReceivedTotal.labelValues(sessionId, label).inc();
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
