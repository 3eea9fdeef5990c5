package com.exchangesim;

import com.exchangesim.config.ExchangeConfig;
import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.Order;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Price;
import com.exchangesim.domain.Trade;
import com.exchangesim.report.ConsoleReporter;
import com.exchangesim.report.ReportFormat;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeSimulatorAppTest {

    @Test
    void testDemoRun() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        ExchangeSimulatorApp app = new ExchangeSimulatorApp(ExchangeConfig.fromMap(Map.of()),
                new ConsoleReporter(ReportFormat.TEXT, out));

        app.run();

        ExchangeSession session = app.getSession();
        assertEquals(List.of("TESLA", "TOYOTA", "BYD"),
                session.getAllBooks().stream().map(OrderBook::getSymbol).toList());

        OrderBook tesla = session.findBook("TESLA").orElseThrow();
        List<Trade> teslaTrades = tesla.getTrades();
        assertEquals(6, teslaTrades.size());
        assertTrade(teslaTrades.get(0), 4, 3, "101.00", 10);
        assertTrade(teslaTrades.get(1), 5, 3, "101.00", 10);
        assertTrade(teslaTrades.get(2), 6, 3, "101.00", 10);
        assertTrade(teslaTrades.get(3), 6, 2, "102.00", 10);
        assertTrade(teslaTrades.get(4), 6, 7, "103.00", 10);
        assertTrade(teslaTrades.get(5), 1, 7, "100.00", 35);
        assertEquals(-5, tesla.getPosition());
        assertTrue(tesla.getBids().isEmpty());
        List<Order> teslaOffers = tesla.getOffers();
        assertEquals(1, teslaOffers.size());
        assertEquals(7, teslaOffers.get(0).getOrderId());
        assertEquals(15, teslaOffers.get(0).getQuantity());

        OrderBook toyota = session.findBook("TOYOTA").orElseThrow();
        assertEquals(2, toyota.getTrades().size());
        assertTrade(toyota.getTrades().get(0), 1, 4, "100.00", 10);
        assertTrade(toyota.getTrades().get(1), 3, 4, "100.00", 10);
        assertEquals(-20, toyota.getPosition());
        assertEquals(1, toyota.getOfferDepth());

        OrderBook byd = session.findBook("BYD").orElseThrow();
        assertEquals(0, byd.getOrderCount());
        assertTrue(byd.getPositions().isEmpty());

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("#          BUY ORDERS            #"));
        assertTrue(printed.contains("TESLA: -5"));
        assertTrue(printed.contains("[OrderBook: TOYOTA] TOYOTA: -20"));
        assertTrue(printed.contains("[OrderBook: BYD]\n  No trades executed."));
    }

    private static void assertTrade(Trade trade, long buyId, long sellId, String price, long qty) {
        assertEquals(buyId, trade.getBuyOrderId());
        assertEquals(sellId, trade.getSellOrderId());
        assertEquals(Price.of(price), trade.getPrice());
        assertEquals(qty, trade.getQuantity());
    }
}
