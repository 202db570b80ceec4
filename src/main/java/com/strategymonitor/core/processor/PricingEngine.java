package com.strategymonitor.core.processor;

import com.strategymonitor.domain.model.Leg;
import com.strategymonitor.domain.model.QuoteSnapshot;
import com.strategymonitor.domain.model.Strategy;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Pure strategy pricing.
 *
 * <p>Leg contribution = side multiplier x quantity x price, where price is the mid when
 * bid and ask are both known and the last trade otherwise. A leg that has never been
 * priced has no contribution.
 *
 * <p>The aggregate is always a full recompute over all legs, never a running delta, so a
 * leg losing its price (ticker change) immediately makes the strategy incomplete again.
 * A strategy with no legs has no price.
 *
 * <p>Callers hold the strategy's lock; this class keeps no state.
 */
@Component
public class PricingEngine {

    /** Signed contribution of one leg, or null if the leg has no price. */
    public BigDecimal contribution(Leg leg) {
        BigDecimal price = leg.getQuote().price();
        if (price == null) {
            return null;
        }
        return price.multiply(BigDecimal.valueOf((long) leg.getSide().getMultiplier() * leg.getQuantity()));
    }

    /**
     * Recomputes and stores the aggregate price of {@code strategy}.
     *
     * @return previous and new aggregate
     */
    public PriceUpdate recompute(Strategy strategy) {
        BigDecimal previous = strategy.getAggregatePrice();
        BigDecimal current = aggregate(strategy);
        strategy.setAggregatePrice(current);
        return new PriceUpdate(previous, current);
    }

    /**
     * Merges {@code update} into the leg's snapshot, stamps it, and recomputes the owning
     * strategy.
     */
    public PriceUpdate applyQuote(Strategy strategy, Leg leg, QuoteSnapshot update, Instant receivedAt) {
        leg.setQuote(leg.getQuote().mergedWith(update));
        leg.setLastUpdate(receivedAt);
        return recompute(strategy);
    }

    private BigDecimal aggregate(Strategy strategy) {
        if (strategy.getLegs().isEmpty()) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Leg leg : strategy.getLegs()) {
            BigDecimal contribution = contribution(leg);
            if (contribution == null) {
                return null;
            }
            sum = sum.add(contribution);
        }
        return sum;
    }
}
