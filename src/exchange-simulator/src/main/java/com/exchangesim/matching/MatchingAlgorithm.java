package com.exchangesim.matching;

import com.exchangesim.domain.MatchResultSet;
import com.exchangesim.domain.Order;
import com.exchangesim.domain.Side;

/**
 * Interface for order matching algorithms.
 * Takes the book being matched and an already validated incoming order,
 * matches it against resting liquidity, rests any remainder and returns the trades.
 */
public interface MatchingAlgorithm {
    MatchResultSet match(MatchingContext book, Order incoming, Side side);
}
