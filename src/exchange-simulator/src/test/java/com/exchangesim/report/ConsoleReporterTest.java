package com.exchangesim.report;

import com.exchangesim.domain.ExchangeSession;
import com.exchangesim.domain.OrderBook;
import com.exchangesim.domain.Price;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    @Test
    void testJsonFormatWritesOneDocumentPerReport() {
        ExchangeSession session = new ExchangeSession();
        OrderBook book = session.createBook("TESLA");
        book.addOrder(session.newOrder("TESLA", "BUY", Price.of(100), 1));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReporter reporter = new ConsoleReporter(ReportFormat.JSON,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.displayBook(book);
        reporter.showTrades(book);
        reporter.showPosition(book);
        reporter.showAllTrades(session);
        reporter.showAllPositions(session);
        reporter.flush();

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(5, lines.length);
        for (String line : lines) {
            assertTrue(JsonParser.parseString(line).isJsonObject(), line);
        }
    }

    @Test
    void testTextFormatIsDefaultForUnsetFormat() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReporter reporter = new ConsoleReporter((ReportFormat) null,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.showTrades(new OrderBook("BYD"));

        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("No trades executed."));
    }
}
