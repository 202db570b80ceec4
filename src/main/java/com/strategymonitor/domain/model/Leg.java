package com.strategymonitor.domain.model;

import com.strategymonitor.domain.enums.LegSide;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One option position inside a strategy.
 *
 * <p>A leg is owned by exactly one strategy. Its ticker may be unset while the user
 * is still editing, in which case it has no market-data interest and no price.
 * Mutations happen under the owning strategy's lock in
 * {@link com.strategymonitor.core.engine.StrategyMonitorEngine}.
 */
@Data
@Builder
public class Leg {

    private String id;
    private String strategyId;

    /** Canonical ticker, or null when the leg has no instrument yet. */
    private Ticker ticker;

    private LegSide side;

    /** Always positive; direction is carried by {@link #side}. */
    private int quantity;

    /** Latest merged quote. Reset to {@link QuoteSnapshot#EMPTY} when the ticker changes. */
    @Builder.Default
    private QuoteSnapshot quote = QuoteSnapshot.EMPTY;

    /** When the last quote was applied. Null until the first quote. */
    private Instant lastUpdate;
}
