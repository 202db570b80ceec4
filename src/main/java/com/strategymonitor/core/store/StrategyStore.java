package com.strategymonitor.core.store;

import com.strategymonitor.domain.model.Leg;
import com.strategymonitor.domain.model.Strategy;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory home of all strategies and their legs.
 *
 * <p>Keeps a leg id -> strategy id index so routed quotes find their owning strategy in
 * O(1). The maps are concurrent; mutation of a single {@link Strategy} is serialized by the
 * engine's per-strategy lock, not here.
 */
@Component
public class StrategyStore {

    private final Map<String, Strategy> strategies = new ConcurrentHashMap<>();
    private final Map<String, String> strategyIdByLegId = new ConcurrentHashMap<>();

    public void put(Strategy strategy) {
        strategies.put(strategy.getId(), strategy);
        strategy.getLegs().forEach(leg -> strategyIdByLegId.put(leg.getId(), strategy.getId()));
    }

    public Optional<Strategy> find(String strategyId) {
        return Optional.ofNullable(strategies.get(strategyId));
    }

    /** Removes the strategy and un-indexes its legs. Returns the removed strategy, if any. */
    public Optional<Strategy> remove(String strategyId) {
        Strategy removed = strategies.remove(strategyId);
        if (removed != null) {
            removed.getLegs().forEach(leg -> strategyIdByLegId.remove(leg.getId()));
        }
        return Optional.ofNullable(removed);
    }

    public void indexLeg(Leg leg) {
        strategyIdByLegId.put(leg.getId(), leg.getStrategyId());
    }

    public void unindexLeg(String legId) {
        strategyIdByLegId.remove(legId);
    }

    public Optional<String> findStrategyIdForLeg(String legId) {
        return Optional.ofNullable(strategyIdByLegId.get(legId));
    }

    /** All strategies, oldest first. */
    public List<Strategy> findAll() {
        return strategies.values().stream()
                .sorted(Comparator.comparing(Strategy::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Strategy::getId))
                .toList();
    }

    public int size() {
        return strategies.size();
    }

    public int legCount() {
        return strategyIdByLegId.size();
    }
}
