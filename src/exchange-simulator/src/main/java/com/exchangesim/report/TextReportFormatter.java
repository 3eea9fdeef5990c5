package com.exchangesim.report;

import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Trade;

import java.util.List;
import java.util.Map;

/**
 * Plain console layout: banner lines of '#' around each section.
 */
public class TextReportFormatter implements ReportFormatter {

    private static final String BOOK_RULE = "#".repeat(34);
    private static final String TRADES_RULE = "#".repeat(36);
    private static final String POSITION_RULE = "#".repeat(24);

    @Override
    public String formatBook(OrderBook book) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(BOOK_RULE).append('\n');
        sb.append("#          BUY ORDERS            #").append('\n');
        sb.append(BOOK_RULE).append('\n');
        for (Order order : book.getBids()) {
            sb.append(order).append('\n');
        }
        sb.append(BOOK_RULE).append('\n');
        sb.append("#          SELL ORDERS           #").append('\n');
        sb.append(BOOK_RULE).append('\n');
        for (Order order : book.getOffers()) {
            sb.append(order).append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }

    @Override
    public String formatTrades(OrderBook book) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n########## EXECUTED TRADES ##########\n");
        List<Trade> trades = book.getTrades();
        if (trades.isEmpty()) {
            sb.append("No trades executed.\n");
        }
        for (Trade trade : trades) {
            sb.append(tradeLine(trade)).append('\n');
        }
        sb.append(TRADES_RULE).append('\n');
        return sb.toString();
    }

    @Override
    public String formatPosition(OrderBook book) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n########## POSITION ##########\n");
        for (Map.Entry<String, Long> entry : book.getPositions().entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        sb.append(POSITION_RULE).append('\n');
        return sb.toString();
    }

    @Override
    public String formatAllTrades(List<OrderBook> books) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n########## ALL EXECUTED TRADES ##########\n");
        for (OrderBook book : books) {
            sb.append("[OrderBook: ").append(book.getSymbol()).append("]\n");
            List<Trade> trades = book.getTrades();
            if (trades.isEmpty()) {
                sb.append("  No trades executed.\n");
            }
            for (Trade trade : trades) {
                sb.append("  ").append(tradeLine(trade)).append('\n');
            }
        }
        sb.append(TRADES_RULE).append('\n');
        return sb.toString();
    }

    @Override
    public String formatAllPositions(List<OrderBook> books) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n########## ALL POSITIONS ##########\n");
        for (OrderBook book : books) {
            for (Map.Entry<String, Long> entry : book.getPositions().entrySet()) {
                sb.append("[OrderBook: ").append(book.getSymbol()).append("] ")
                        .append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }
        sb.append(POSITION_RULE).append('\n');
        return sb.toString();
    }

    static String tradeLine(Trade trade) {
        return "Trade: " + trade.getSymbol()
                + " | BUY Order #" + trade.getBuyOrderId()
                + " <-> SELL Order #" + trade.getSellOrderId()
                + " | Qty: " + trade.getQuantity()
                + " @ " + trade.getPrice();
    }
}
