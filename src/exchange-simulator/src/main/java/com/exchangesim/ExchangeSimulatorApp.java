package com.exchangesim;

import com.exchangesim.config.ExchangeConfig;
import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Price;
import com.exchangesim.engine.OrderSubmitter;
import com.exchangesim.logging.MatchingStats;
import com.exchangesim.logging.SessionSummaryLogger;
import com.exchangesim.metrics.MetricsRegistry;
import com.exchangesim.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point for the exchange simulator demo.
 *
 * Startup sequence:
 * 1. Parse ExchangeConfig from environment variables
 * 2. Create the session (book registry and order id sequences)
 * 3. Create MetricsRegistry, MatchingStats and the OrderSubmitter
 * 4. Replay the TESLA, TOYOTA and BYD scenarios
 * 5. Print per-book and cross-book trade and position reports
 * 6. Log the session summary
 */
public class ExchangeSimulatorApp {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeSimulatorApp.class);

    private final ExchangeSession session;
    private final OrderSubmitter submitter;
    private final ConsoleReporter reporter;
    private final SessionSummaryLogger summaryLogger;

    public ExchangeSimulatorApp(ExchangeConfig config, ConsoleReporter reporter) {
        this.session = new ExchangeSession(config.getRandomSymbolLength());
        MatchingStats stats = new MatchingStats();
        this.submitter = new OrderSubmitter(session, new MetricsRegistry(), stats, config.getSessionId());
        this.reporter = reporter;
        this.summaryLogger = new SessionSummaryLogger(stats, session, config.getSessionId());
    }

    public static void main(String[] args) {
        ExchangeConfig config = ExchangeConfig.fromEnv();
        logger.info("Starting exchange simulator: {}", config);

        ExchangeSimulatorApp app = new ExchangeSimulatorApp(config,
                new ConsoleReporter(config.getReportFormat(), System.out));
        app.run();

        logger.info("Exchange simulator finished.");
    }

    public void run() {
        OrderBook tesla = session.createBook("TESLA");
        submitter.sendOrders(tesla, List.of(
                order("TESLA", "BUY", "100.00", 35),
                order("TESLA", "SELL", "102.00", 10),
                order("TESLA", "SELL", "101.00", 30)));
        reporter.displayBook(tesla);

        // 10 and 10 partially take the 101.00 offer, the last buy sweeps it and
        // the 102.00 offer and rests 10; the sell then hits the resting bids
        submitter.sendOrders(tesla, List.of(
                order("TESLA", "BUY", "103.00", 10),
                order("TESLA", "BUY", "103.00", 10),
                order("TESLA", "BUY", "103.00", 30),
                order("TESLA", "SELL", "100.00", 60)));

        OrderBook toyota = session.createBook("TOYOTA");
        submitter.sendOrders(toyota, List.of(
                order("TOYOTA", "BUY", "100.00", 10),
                order("TOYOTA", "SELL", "101.00", 10),
                order("TOYOTA", "BUY", "100.00", 10)));
        reporter.displayBook(toyota);

        // takes the first 100.00 bid, then the second
        submitter.sendOrders(toyota, List.of(order("TOYOTA", "SELL", "100.00", 20)));

        // created but never sent
        session.createBook("BYD");
        order("BYD", "BUY", "100.00", 10);

        reporter.showTrades(tesla);
        reporter.showPosition(tesla);
        reporter.showTrades(toyota);
        reporter.showPosition(toyota);
        reporter.showAllTrades(session);
        reporter.showAllPositions(session);
        reporter.flush();

        summaryLogger.logSummary();
    }

    private Order order(String symbol, String side, String price, long quantity) {
        return session.newOrder(symbol, side, Price.of(price), quantity);
    }

    public ExchangeSession getSession() {
        return session;
    }
}
