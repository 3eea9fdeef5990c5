package com.exchangesim.matching;

import com.exchangesim.domain.Order;
import com.exchangesim.domain.Side;
import com.exchangesim.domain.Trade;

/**
 * Mutable view of one order book, handed to a {@link MatchingAlgorithm} for the
 * duration of a single {@code OrderBook.addOrder} call. The book's write lock is
 * held for as long as the context is in use; it must not be kept after
 * {@code match} returns.
 */
public interface MatchingContext {

    String getSymbol();

    /**
     * Best resting order on the given side, or null when that side is empty.
     */
    Order peekBest(Side side);

    /**
     * Evict the best resting order on the given side, dropping its price level
     * once empty.
     */
    Order removeBest(Side side);

    void rest(Order order, Side side);

    /**
     * Append a trade at the resting order's price and apply the aggressor's
     * signed quantity to the book's position.
     */
    Trade recordTrade(Order aggressor, Side aggressorSide, Order resting, long quantity);
}
