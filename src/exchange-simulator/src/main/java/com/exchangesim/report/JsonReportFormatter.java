package com.exchangesim.report;

import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Trade;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.Map;

/**
 * Renders the report views as single-line JSON documents.
 */
public class JsonReportFormatter implements ReportFormatter {

    private final Gson gson = new Gson();

    @Override
    public String formatBook(OrderBook book) {
        JsonObject json = new JsonObject();
        json.addProperty("type", "ORDER_BOOK");
        json.addProperty("symbol", book.getSymbol());
        json.add("bids", orders(book.getBids()));
        json.add("offers", orders(book.getOffers()));
        return gson.toJson(json) + '\n';
    }

    @Override
    public String formatTrades(OrderBook book) {
        JsonObject json = new JsonObject();
        json.addProperty("type", "TRADES");
        json.addProperty("symbol", book.getSymbol());
        json.add("trades", trades(book.getTrades()));
        return gson.toJson(json) + '\n';
    }

    @Override
    public String formatPosition(OrderBook book) {
        JsonObject json = new JsonObject();
        json.addProperty("type", "POSITION");
        json.addProperty("symbol", book.getSymbol());
        json.add("positions", positions(book.getPositions()));
        return gson.toJson(json) + '\n';
    }

    @Override
    public String formatAllTrades(List<OrderBook> books) {
        JsonArray array = new JsonArray();
        for (OrderBook book : books) {
            JsonObject entry = new JsonObject();
            entry.addProperty("book", book.getSymbol());
            entry.add("trades", trades(book.getTrades()));
            array.add(entry);
        }
        JsonObject json = new JsonObject();
        json.addProperty("type", "ALL_TRADES");
        json.add("books", array);
        return gson.toJson(json) + '\n';
    }

    @Override
    public String formatAllPositions(List<OrderBook> books) {
        JsonArray array = new JsonArray();
        for (OrderBook book : books) {
            JsonObject entry = new JsonObject();
            entry.addProperty("book", book.getSymbol());
            entry.add("positions", positions(book.getPositions()));
            array.add(entry);
        }
        JsonObject json = new JsonObject();
        json.addProperty("type", "ALL_POSITIONS");
        json.add("books", array);
        return gson.toJson(json) + '\n';
    }

    private static JsonArray orders(List<Order> orders) {
        JsonArray array = new JsonArray();
        for (Order order : orders) {
            JsonObject json = new JsonObject();
            json.addProperty("orderId", order.getOrderId());
            json.addProperty("side", order.getSide());
            json.addProperty("price", order.getPrice().value());
            json.addProperty("quantity", order.getQuantity());
            json.addProperty("originalQuantity", order.getOriginalQuantity());
            array.add(json);
        }
        return array;
    }

    private static JsonArray trades(List<Trade> trades) {
        JsonArray array = new JsonArray();
        for (Trade trade : trades) {
            JsonObject json = new JsonObject();
            json.addProperty("tradeId", trade.getTradeId());
            json.addProperty("symbol", trade.getSymbol());
            json.addProperty("buyOrderId", trade.getBuyOrderId());
            json.addProperty("sellOrderId", trade.getSellOrderId());
            json.addProperty("price", trade.getPrice().value());
            json.addProperty("quantity", trade.getQuantity());
            json.addProperty("aggressorSide", trade.getAggressorSide().name());
            array.add(json);
        }
        return array;
    }

    private static JsonObject positions(Map<String, Long> positions) {
        JsonObject json = new JsonObject();
        positions.forEach(json::addProperty);
        return json;
    }
}
