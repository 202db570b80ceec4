package com.strategymonitor.domain.model;

import com.strategymonitor.domain.enums.LegSide;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a strategy taken under its lock. Safe to hand to other threads
 * (REST responses, remote sync, STOMP relay).
 */
public record StrategySnapshot(
        String id,
        String name,
        List<LegSnapshot> legs,
        BigDecimal targetPrice,
        TargetCondition targetCondition,
        StrategyStatus status,
        BigDecimal aggregatePrice,
        Instant createdAt,
        Instant updatedAt) {

    public record LegSnapshot(
            String id,
            String ticker,
            LegSide side,
            int quantity,
            BigDecimal last,
            BigDecimal bid,
            BigDecimal ask,
            BigDecimal price,
            Instant lastUpdate) {

        public static LegSnapshot of(Leg leg) {
            QuoteSnapshot quote = leg.getQuote();
            return new LegSnapshot(
                    leg.getId(),
                    leg.getTicker() != null ? leg.getTicker().value() : null,
                    leg.getSide(),
                    leg.getQuantity(),
                    quote.last(),
                    quote.bid(),
                    quote.ask(),
                    quote.price(),
                    leg.getLastUpdate());
        }
    }

    public static StrategySnapshot of(Strategy strategy) {
        List<LegSnapshot> legs =
                strategy.getLegs().stream().map(LegSnapshot::of).toList();
        return new StrategySnapshot(
                strategy.getId(),
                strategy.getName(),
                legs,
                strategy.getTargetPrice(),
                strategy.getTargetCondition(),
                strategy.getStatus(),
                strategy.getAggregatePrice(),
                strategy.getCreatedAt(),
                strategy.getUpdatedAt());
    }
}
