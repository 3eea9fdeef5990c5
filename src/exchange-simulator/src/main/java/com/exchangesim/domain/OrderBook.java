package com.exchangesim.domain;

import com.exchangesim.exception.SymbolMismatchException;
import com.exchangesim.matching.MatchingAlgorithm;
import com.exchangesim.matching.MatchingContext;
import com.exchangesim.matching.PriceTimePriorityMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory order book for a single symbol.
 *
 * Bids: TreeMap with Comparator.reverseOrder() so firstKey() = highest bid.
 * Offers: TreeMap with natural ordering so firstKey() = lowest offer.
 * Within a price level, the lowest order id has priority.
 *
 * {@link #addOrder(Order)} is the only entry point that changes the book. It
 * holds the write lock for the whole call: validation, matching, trade and
 * position recording and resting the remainder happen as one unit. The
 * matcher reaches the book's state only through a {@link MatchingContext}
 * passed into that call. Queries take the read lock and return copies.
 */
public class OrderBook {

    private static final Logger logger = LoggerFactory.getLogger(OrderBook.class);

    public static final int DEFAULT_SYMBOL_LENGTH = 3;

    private final String symbol;
    private final TreeMap<Price, PriceLevel> bids;
    private final TreeMap<Price, PriceLevel> offers;
    private final List<Trade> trades;
    private final Map<String, Long> positions;
    private final MatchingAlgorithm matcher;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final MatchingContext context = new LockedContext();
    private long tradeSequence;

    public OrderBook() {
        this(null);
    }

    /**
     * @param symbol instrument symbol, kept as given; a random
     *               {@value #DEFAULT_SYMBOL_LENGTH} character symbol is generated
     *               when null or blank
     */
    public OrderBook(String symbol) {
        this(symbol, new PriceTimePriorityMatcher());
    }

    public OrderBook(String symbol, MatchingAlgorithm matcher) {
        this.symbol = (symbol == null || symbol.isBlank())
                ? randomSymbol(DEFAULT_SYMBOL_LENGTH)
                : symbol;
        this.bids = new TreeMap<>(Comparator.reverseOrder());
        this.offers = new TreeMap<>();
        this.trades = new ArrayList<>();
        this.positions = new LinkedHashMap<>();
        this.matcher = matcher;
    }

    /**
     * Random uppercase hex token, e.g. "3FA".
     */
    public static String randomSymbol(int length) {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return hex.substring(0, Math.min(length, hex.length())).toUpperCase(Locale.ROOT);
    }

    /**
     * Match an incoming order against the opposite side and rest any
     * remainder on its own side.
     *
     * @throws SymbolMismatchException if the order is for another symbol
     * @throws com.exchangesim.exception.UnknownSideException if the side is neither BUY nor SELL
     */
    public MatchResultSet addOrder(Order order) {
        lock.writeLock().lock();
        try {
            if (!symbol.equals(order.getSymbol())) {
                throw new SymbolMismatchException(order.getOrderId(), order.getSymbol(), symbol);
            }
            Side side = Side.fromCode(order.getOrderId(), order.getSide());
            logger.info("Adding order: {}", order);
            return matcher.match(context, order, side);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Only reachable from {@link #addOrder(Order)}, with the write lock held.
     */
    private final class LockedContext implements MatchingContext {

        @Override
        public String getSymbol() {
            return symbol;
        }

        @Override
        public Order peekBest(Side side) {
            Map.Entry<Price, PriceLevel> entry = levels(side).firstEntry();
            return entry != null ? entry.getValue().peekFirst() : null;
        }

        @Override
        public Order removeBest(Side side) {
            TreeMap<Price, PriceLevel> levels = levels(side);
            Map.Entry<Price, PriceLevel> entry = levels.firstEntry();
            if (entry == null) {
                return null;
            }
            Order removed = entry.getValue().pollFirst();
            if (entry.getValue().isEmpty()) {
                levels.pollFirstEntry();
            }
            return removed;
        }

        @Override
        public void rest(Order order, Side side) {
            if (order.getQuantity() <= 0) {
                throw new IllegalStateException("Cannot rest filled order " + order.getOrderId());
            }
            levels(side).computeIfAbsent(order.getPrice(), price -> new PriceLevel()).addOrder(order);
            logger.debug("Rested order {} on {} at {} qty {}",
                    order.getOrderId(), side, order.getPrice(), order.getQuantity());
        }

        @Override
        public Trade recordTrade(Order aggressor, Side aggressorSide, Order resting, long quantity) {
            long buyOrderId = aggressorSide == Side.BUY ? aggressor.getOrderId() : resting.getOrderId();
            long sellOrderId = aggressorSide == Side.BUY ? resting.getOrderId() : aggressor.getOrderId();
            Trade trade = new Trade(nextTradeId(), symbol, buyOrderId, sellOrderId,
                    resting.getPrice(), quantity, aggressorSide);
            trades.add(trade);
            positions.merge(symbol, aggressorSide.positionSign() * quantity, Long::sum);
            return trade;
        }
    }

    private String nextTradeId() {
        return "t-" + String.format("%05d", ++tradeSequence);
    }

    private TreeMap<Price, PriceLevel> levels(Side side) {
        return side == Side.BUY ? bids : offers;
    }

    // ---- Read-only views ----

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resting BUY orders, best first (price descending, then order id ascending).
     */
    public List<Order> getBids() {
        return restingOrders(Side.BUY);
    }

    /**
     * Resting SELL orders, best first (price ascending, then order id ascending).
     */
    public List<Order> getOffers() {
        return restingOrders(Side.SELL);
    }

    private List<Order> restingOrders(Side side) {
        lock.readLock().lock();
        try {
            List<Order> result = new ArrayList<>();
            for (PriceLevel level : levels(side).values()) {
                result.addAll(level.getOrdersInPriority());
            }
            return Collections.unmodifiableList(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Executed trades in the order they happened.
     */
    public List<Trade> getTrades() {
        lock.readLock().lock();
        try {
            return List.copyOf(trades);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Net position per symbol. Empty until the first trade.
     */
    public Map<String, Long> getPositions() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getPosition(String positionSymbol) {
        lock.readLock().lock();
        try {
            return positions.getOrDefault(positionSymbol.toUpperCase(Locale.ROOT), 0L);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getPosition() {
        return getPosition(symbol);
    }

    public Price getBestBid() {
        return bestPrice(bids);
    }

    public Price getBestOffer() {
        return bestPrice(offers);
    }

    private Price bestPrice(TreeMap<Price, PriceLevel> levels) {
        lock.readLock().lock();
        try {
            return levels.isEmpty() ? null : levels.firstKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Total number of resting orders on the bid side across all price levels.
     */
    public int getBidDepth() {
        return depth(bids);
    }

    /**
     * Total number of resting orders on the offer side across all price levels.
     */
    public int getOfferDepth() {
        return depth(offers);
    }

    public int getOrderCount() {
        return getBidDepth() + getOfferDepth();
    }

    private int depth(TreeMap<Price, PriceLevel> levels) {
        lock.readLock().lock();
        try {
            int depth = 0;
            for (PriceLevel level : levels.values()) {
                depth += level.getOrderCount();
            }
            return depth;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getBidLevelCount() {
        lock.readLock().lock();
        try {
            return bids.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getOfferLevelCount() {
        lock.readLock().lock();
        try {
            return offers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
