package com.exchangesim.report;

import com.exchangesim.domain.OrderBook;

import java.util.List;

/**
 * Renders read-only views of order books. Implementations never mutate the
 * books they are given.
 */
public interface ReportFormatter {

    String formatBook(OrderBook book);

    String formatTrades(OrderBook book);

    String formatPosition(OrderBook book);

    String formatAllTrades(List<OrderBook> books);

    String formatAllPositions(List<OrderBook> books);
}
