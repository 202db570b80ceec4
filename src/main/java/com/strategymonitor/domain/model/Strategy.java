package com.strategymonitor.domain.model;

import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * A multi-leg option strategy (fly, condor, spread, straddle...) with an optional
 * price target.
 *
 * <p>{@code aggregatePrice} is a cache of the last full recompute done by the
 * {@link com.strategymonitor.core.processor.PricingEngine}; null means "price incomplete"
 * (some leg has no price, or there are no legs). Leg order is display order only.
 */
@Getter
@Setter
@Builder
public class Strategy {

    private String id;
    private String name;

    @Builder.Default
    private List<Leg> legs = new ArrayList<>();

    /** Null when no target is set; the alarm then never arms. */
    private BigDecimal targetPrice;

    @Builder.Default
    private TargetCondition targetCondition = TargetCondition.BELOW;

    @Builder.Default
    private StrategyStatus status = StrategyStatus.ACTIVE;

    private BigDecimal aggregatePrice;

    private Instant createdAt;
    private Instant updatedAt;

    public Optional<Leg> findLeg(String legId) {
        return legs.stream().filter(leg -> leg.getId().equals(legId)).findFirst();
    }

    public boolean isPriceComplete() {
        return aggregatePrice != null;
    }
}
