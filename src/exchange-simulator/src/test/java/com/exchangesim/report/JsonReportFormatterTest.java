package com.exchangesim.report;

import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Price;
import com.exchangesim.domain.Side;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportFormatterTest {

    private final JsonReportFormatter formatter = new JsonReportFormatter();
    private OrderBook book;

    @BeforeEach
    void setUp() {
        book = new OrderBook("TOYOTA");
        book.addOrder(new Order(1, "TOYOTA", Side.BUY, Price.of(100), 10));
        book.addOrder(new Order(2, "TOYOTA", Side.SELL, Price.of(101), 10));
        book.addOrder(new Order(3, "TOYOTA", Side.SELL, Price.of(100), 4));
    }

    @Test
    void testFormatBook() {
        JsonObject json = JsonParser.parseString(formatter.formatBook(book)).getAsJsonObject();

        assertEquals("ORDER_BOOK", json.get("type").getAsString());
        assertEquals("TOYOTA", json.get("symbol").getAsString());

        JsonArray bids = json.getAsJsonArray("bids");
        assertEquals(1, bids.size());
        JsonObject bid = bids.get(0).getAsJsonObject();
        assertEquals(1, bid.get("orderId").getAsLong());
        assertEquals(6, bid.get("quantity").getAsLong());
        assertEquals(10, bid.get("originalQuantity").getAsLong());
        assertEquals(new BigDecimal("100.00"), bid.get("price").getAsBigDecimal());

        assertEquals(1, json.getAsJsonArray("offers").size());
    }

    @Test
    void testFormatTradesAndPosition() {
        JsonObject trades = JsonParser.parseString(formatter.formatTrades(book)).getAsJsonObject();
        JsonObject trade = trades.getAsJsonArray("trades").get(0).getAsJsonObject();
        assertEquals("t-00001", trade.get("tradeId").getAsString());
        assertEquals(1, trade.get("buyOrderId").getAsLong());
        assertEquals(3, trade.get("sellOrderId").getAsLong());
        assertEquals(4, trade.get("quantity").getAsLong());
        assertEquals("SELL", trade.get("aggressorSide").getAsString());

        JsonObject position = JsonParser.parseString(formatter.formatPosition(book)).getAsJsonObject();
        assertEquals(-4, position.getAsJsonObject("positions").get("TOYOTA").getAsLong());
    }

    @Test
    void testFormatAcrossBooks() {
        OrderBook empty = new OrderBook("BYD");

        JsonObject all = JsonParser.parseString(formatter.formatAllTrades(List.of(book, empty))).getAsJsonObject();
        JsonArray books = all.getAsJsonArray("books");
        assertEquals(2, books.size());
        assertEquals("BYD", books.get(1).getAsJsonObject().get("book").getAsString());
        assertEquals(0, books.get(1).getAsJsonObject().getAsJsonArray("trades").size());

        JsonObject positions = JsonParser.parseString(formatter.formatAllPositions(List.of(book, empty)))
                .getAsJsonObject();
        assertEquals("ALL_POSITIONS", positions.get("type").getAsString());
        assertEquals(0, positions.getAsJsonArray("books").get(1).getAsJsonObject()
                .getAsJsonObject("positions").size());
    }
}
