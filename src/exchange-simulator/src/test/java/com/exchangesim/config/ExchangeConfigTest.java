package com.exchangesim.config;

import com.exchangesim.report.ReportFormat;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeConfigTest {

    @Test
    void testDefaults() {
        ExchangeConfig config = ExchangeConfig.fromMap(Map.of());

        assertEquals("local", config.getSessionId());
        assertEquals(3, config.getRandomSymbolLength());
        assertEquals(ReportFormat.TEXT, config.getReportFormat());
    }

    @Test
    void testOverrides() {
        ExchangeConfig config = ExchangeConfig.fromMap(Map.of(
                "SESSION_ID", "desk-1",
                "RANDOM_SYMBOL_LENGTH", "5",
                "REPORT_FORMAT", "json"));

        assertEquals("desk-1", config.getSessionId());
        assertEquals(5, config.getRandomSymbolLength());
        assertEquals(ReportFormat.JSON, config.getReportFormat());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        assertEquals(3, ExchangeConfig.fromMap(Map.of("RANDOM_SYMBOL_LENGTH", "abc")).getRandomSymbolLength());
        assertEquals(3, ExchangeConfig.fromMap(Map.of("RANDOM_SYMBOL_LENGTH", "0")).getRandomSymbolLength());
        assertEquals(3, ExchangeConfig.fromMap(Map.of("RANDOM_SYMBOL_LENGTH", "33")).getRandomSymbolLength());
        assertEquals(ReportFormat.TEXT, ExchangeConfig.fromMap(Map.of("REPORT_FORMAT", "xml")).getReportFormat());
        assertEquals("local", ExchangeConfig.fromMap(Map.of("SESSION_ID", "")).getSessionId());
    }
}
