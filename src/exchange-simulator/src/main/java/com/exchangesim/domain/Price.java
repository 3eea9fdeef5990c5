package com.exchangesim.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value object for a limit price, held as a decimal with exactly two
 * fractional digits (HALF_UP).
 * Example: 100.125 becomes 100.13, 99 becomes 99.00.
 */
public record Price(BigDecimal value) implements Comparable<Price> {

    public static final int SCALE = 2;

    public Price {
        Objects.requireNonNull(value, "price");
        value = value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Price of(BigDecimal value) {
        return new Price(value);
    }

    public static Price of(String value) {
        return new Price(new BigDecimal(value));
    }

    /**
     * Rounds the exact binary value of {@code value}, so 1.005 (stored as
     * 1.00499...) becomes 1.00.
     */
    public static Price of(double value) {
        return new Price(new BigDecimal(value));
    }

    public static Price of(long value) {
        return new Price(BigDecimal.valueOf(value));
    }

    @Override
    public int compareTo(Price other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
