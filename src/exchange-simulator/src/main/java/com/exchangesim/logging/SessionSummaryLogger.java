package com.exchangesim.logging;

import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.OrderBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs one summary line per registered order book and a session total.
 * Reads state only.
 */
public class SessionSummaryLogger {

    private static final Logger logger = LoggerFactory.getLogger(SessionSummaryLogger.class);

    private final MatchingStats stats;
    private final ExchangeSession session;
    private final String sessionId;

    public SessionSummaryLogger(MatchingStats stats, ExchangeSession session, String sessionId) {
        this.stats = stats;
        this.session = session;
        this.sessionId = sessionId;
    }

    public void logSummary() {
        int bidDepth = 0;
        int offerDepth = 0;
        for (OrderBook book : session.getAllBooks()) {
            bidDepth += book.getBidDepth();
            offerDepth += book.getOfferDepth();
            logger.info("Book summary",
                    keyValue("event", "BOOK_SUMMARY"),
                    keyValue("session", sessionId),
                    keyValue("book", book.getSymbol()),
                    keyValue("bidDepth", book.getBidDepth()),
                    keyValue("offerDepth", book.getOfferDepth()),
                    keyValue("bidLevels", book.getBidLevelCount()),
                    keyValue("offerLevels", book.getOfferLevelCount()),
                    keyValue("trades", book.getTrades().size()),
                    keyValue("position", book.getPosition()));
        }

        long totalOrders = stats.totalOrders();
        long totalTrades = stats.tradesExecuted.get();
        double tradeRate = totalOrders > 0 ? (double) totalTrades / totalOrders : 0.0;

        logger.info("Session summary",
                keyValue("event", "SESSION_SUMMARY"),
                keyValue("session", sessionId),
                keyValue("books", session.getBookCount()),
                keyValue("buyOrders", stats.buyOrdersReceived.get()),
                keyValue("sellOrders", stats.sellOrdersReceived.get()),
                keyValue("totalOrders", totalOrders),
                keyValue("trades", totalTrades),
                keyValue("rejected", stats.ordersRejected.get()),
                keyValue("tradeRate", String.format("%.4f", tradeRate)),
                keyValue("bidDepth", bidDepth),
                keyValue("offerDepth", offerDepth));
    }
}
