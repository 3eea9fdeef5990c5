package com.exchangesim.report;

import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.OrderBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints order book reports to a stream in the configured format.
 */
public class ConsoleReporter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReporter.class);

    private final ReportFormatter formatter;
    private final PrintStream out;

    public ConsoleReporter(ReportFormat format, PrintStream out) {
        this(format == ReportFormat.JSON ? new JsonReportFormatter() : new TextReportFormatter(), out);
    }

    public ConsoleReporter(ReportFormatter formatter, PrintStream out) {
        this.formatter = formatter;
        this.out = out;
    }

    public void displayBook(OrderBook book) {
        logger.info("Display Order Book: {} | Total Orders: {}", book.getSymbol(), book.getOrderCount());
        out.print(formatter.formatBook(book));
    }

    public void showTrades(OrderBook book) {
        out.print(formatter.formatTrades(book));
    }

    public void showPosition(OrderBook book) {
        out.print(formatter.formatPosition(book));
    }

    public void showAllTrades(ExchangeSession session) {
        out.print(formatter.formatAllTrades(session.getAllBooks()));
    }

    public void showAllPositions(ExchangeSession session) {
        out.print(formatter.formatAllPositions(session.getAllBooks()));
    }

    public void flush() {
        out.flush();
    }
}
