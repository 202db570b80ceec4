package com.strategymonitor.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Latest observed quote fields for one instrument.
 *
 * <p>Every field is nullable: {@code null} means "never observed", which is not the
 * same as zero. Zero is a legitimate traded price for a deep out-of-the-money option.
 * The mid is derived, never stored, and only exists when both bid and ask are known.
 *
 * @param last last traded price, or null
 * @param bid  best bid, or null
 * @param ask  best ask, or null
 */
public record QuoteSnapshot(BigDecimal last, BigDecimal bid, BigDecimal ask) {

    public static final QuoteSnapshot EMPTY = new QuoteSnapshot(null, null, null);

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /** Scale used for mid prices; generous enough for 1/64th strikes. */
    private static final int MID_SCALE = 8;

    /**
     * Builds a snapshot from raw feed values. Negative, NaN and infinite values are
     * the feed's "no value" sentinel and map to an absent field.
     */
    public static QuoteSnapshot fromFeed(double last, double bid, double ask) {
        return new QuoteSnapshot(feedValue(last), feedValue(bid), feedValue(ask));
    }

    public static QuoteSnapshot of(BigDecimal last, BigDecimal bid, BigDecimal ask) {
        return new QuoteSnapshot(last, bid, ask);
    }

    /** (bid + ask) / 2 when both sides are present, otherwise null. */
    public BigDecimal mid() {
        if (bid == null || ask == null) {
            return null;
        }
        return bid.add(ask).divide(TWO, MID_SCALE, RoundingMode.HALF_EVEN).stripTrailingZeros();
    }

    /** The price used for pricing: mid when available, else last, else null. */
    public BigDecimal price() {
        BigDecimal mid = mid();
        return mid != null ? mid : last;
    }

    public boolean hasPrice() {
        return price() != null;
    }

    /**
     * Overlays the fields present in {@code update} on this snapshot. Feeds send partial
     * updates (only the fields that changed), so absent fields keep their previous value.
     */
    public QuoteSnapshot mergedWith(QuoteSnapshot update) {
        return new QuoteSnapshot(
                update.last != null ? update.last : last,
                update.bid != null ? update.bid : bid,
                update.ask != null ? update.ask : ask);
    }

    private static BigDecimal feedValue(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            return null;
        }
        return BigDecimal.valueOf(value);
    }
}
