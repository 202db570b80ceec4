package com.strategymonitor.domain.model;

import java.util.Objects;

/**
 * Canonical instrument identifier, e.g. {@code SFRH6C 98.00 COMDTY}.
 *
 * <p>Instances are produced by {@link com.strategymonitor.instrument.InstrumentRegistry},
 * which collapses case, whitespace and market-sector synonyms into one canonical string.
 * Two tickers are equal iff their canonical strings are equal.
 */
public record Ticker(String value) {

    public Ticker {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Ticker value must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
