package com.exchangesim.domain;

import com.exchangesim.matching.PriceTimePriorityMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the order books created in one session and the per-symbol order id
 * sequences. The registry is append-only and only hands out read access to
 * its books for cross-book reporting.
 */
public class ExchangeSession {

    private final List<OrderBook> books = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicLong> orderIdSequences = new ConcurrentHashMap<>();
    private final int randomSymbolLength;

    public ExchangeSession() {
        this(OrderBook.DEFAULT_SYMBOL_LENGTH);
    }

    public ExchangeSession(int randomSymbolLength) {
        if (randomSymbolLength <= 0) {
            throw new IllegalArgumentException("Symbol length must be positive: " + randomSymbolLength);
        }
        this.randomSymbolLength = randomSymbolLength;
    }

    /**
     * Create and register a book with a random symbol.
     */
    public OrderBook createBook() {
        return createBook(null);
    }

    public OrderBook createBook(String symbol) {
        String bookSymbol = (symbol == null || symbol.isBlank())
                ? OrderBook.randomSymbol(randomSymbolLength)
                : symbol;
        return register(new OrderBook(bookSymbol, new PriceTimePriorityMatcher()));
    }

    public OrderBook register(OrderBook book) {
        books.add(book);
        return book;
    }

    /**
     * Create an order with the next id of the symbol's sequence (1, 2, ...).
     */
    public Order newOrder(String symbol, String side, Price price, long quantity) {
        return new Order(nextOrderId(symbol), symbol, side, price, quantity);
    }

    public Order newOrder(String symbol, Side side, Price price, long quantity) {
        return newOrder(symbol, side.name(), price, quantity);
    }

    /**
     * Create an order with a caller-supplied id. The symbol's sequence does
     * not advance.
     */
    public Order newOrder(String symbol, String side, Price price, long quantity, long orderId) {
        return new Order(orderId, symbol, side, price, quantity);
    }

    public long nextOrderId(String symbol) {
        String key = symbol.toUpperCase(Locale.ROOT);
        return orderIdSequences.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * All registered books in registration order.
     */
    public List<OrderBook> getAllBooks() {
        return Collections.unmodifiableList(new ArrayList<>(books));
    }

    /**
     * First registered book for the symbol, if any.
     */
    public Optional<OrderBook> findBook(String symbol) {
        return books.stream().filter(b -> b.getSymbol().equals(symbol)).findFirst();
    }

    /**
     * Trades of every registered book: books in registration order, trades in
     * execution order within each book.
     */
    public List<Trade> allTrades() {
        List<Trade> all = new ArrayList<>();
        for (OrderBook book : books) {
            all.addAll(book.getTrades());
        }
        return all;
    }

    /**
     * Positions of every registered book, keyed by book symbol. Books that
     * never traded map to an empty position map.
     */
    public Map<String, Map<String, Long>> allPositions() {
        Map<String, Map<String, Long>> all = new LinkedHashMap<>();
        for (OrderBook book : books) {
            all.merge(book.getSymbol(), book.getPositions(), ExchangeSession::mergePositions);
        }
        return all;
    }

    private static Map<String, Long> mergePositions(Map<String, Long> left, Map<String, Long> right) {
        Map<String, Long> merged = new LinkedHashMap<>(left);
        right.forEach((symbol, qty) -> merged.merge(symbol, qty, Long::sum));
        return merged;
    }

    public int getBookCount() {
        return books.size();
    }
}
