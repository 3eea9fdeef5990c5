package com.exchangesim.matching;

import com.exchangesim.domain.MatchResultSet;
import com.exchangesim.domain.Order;
import com.exchangesim.domain.Side;
import com.exchangesim.domain.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Price-time priority matching algorithm.
 *
 * Price priority: best price on the opposite side is matched first
 * (lowest offer for a buy, highest bid for a sell).
 *
 * Time priority: within a price level, the lowest order id is matched first.
 *
 * Trades execute at the resting order's price. Matching stops at the first
 * resting order that does not cross, and after a resting order is only
 * partially filled (the incoming order is exhausted at that point).
 */
public class PriceTimePriorityMatcher implements MatchingAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(PriceTimePriorityMatcher.class);

    @Override
    public MatchResultSet match(MatchingContext book, Order incoming, Side side) {
        Side restingSide = side.opposite();
        List<Trade> trades = new ArrayList<>();
        long totalFilled = 0;

        while (incoming.getQuantity() > 0) {
            Order resting = book.peekBest(restingSide);
            if (resting == null) {
                break;
            }
            if (!side.crosses(incoming.getPrice(), resting.getPrice())) {
                break;
            }

            long tradeQty = Math.min(incoming.getQuantity(), resting.getQuantity());
            // incoming first: its return value fixes the amount applied to the resting order
            long executed = incoming.execute(tradeQty);
            resting.execute(executed);

            Trade trade = book.recordTrade(incoming, side, resting, executed);
            trades.add(trade);
            totalFilled += executed;
            logger.info("Executed: {} {} @ {} between Order {} and {}",
                    side, executed, trade.getPrice(), incoming.getOrderId(), resting.getOrderId());

            if (resting.isFilled()) {
                book.removeBest(restingSide);
            } else {
                break;
            }
        }

        if (!incoming.isFilled()) {
            book.rest(incoming, side);
        }

        return new MatchResultSet(trades, totalFilled, incoming.isFilled());
    }
}
