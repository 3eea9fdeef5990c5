package com.exchangesim.config;

import com.exchangesim.report.ReportFormat;

import java.util.Locale;
import java.util.Map;

/**
 * Configuration parsed from environment variables.
 */
public class ExchangeConfig {

    static final int MAX_SYMBOL_LENGTH = 32;

    private final String sessionId;
    private final int randomSymbolLength;
    private final ReportFormat reportFormat;

    private ExchangeConfig(String sessionId, int randomSymbolLength, ReportFormat reportFormat) {
        this.sessionId = sessionId;
        this.randomSymbolLength = randomSymbolLength;
        this.reportFormat = reportFormat;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static ExchangeConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static ExchangeConfig fromMap(Map<String, String> env) {
        String sessionId = get(env, "SESSION_ID", "local");
        int symbolLength = getInt(env, "RANDOM_SYMBOL_LENGTH", 3);
        if (symbolLength < 1 || symbolLength > MAX_SYMBOL_LENGTH) {
            symbolLength = 3;
        }
        ReportFormat format = parseFormat(get(env, "REPORT_FORMAT", "TEXT"));
        return new ExchangeConfig(sessionId, symbolLength, format);
    }

    private static ReportFormat parseFormat(String value) {
        try {
            return ReportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ReportFormat.TEXT;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getRandomSymbolLength() {
        return randomSymbolLength;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    @Override
    public String toString() {
        return "ExchangeConfig{" +
                "sessionId='" + sessionId + '\'' +
                ", randomSymbolLength=" + randomSymbolLength +
                ", reportFormat=" + reportFormat +
                '}';
    }
}
