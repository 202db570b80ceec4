package com.strategymonitor.unit.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.strategymonitor.core.store.StrategyStore;
import com.strategymonitor.domain.enums.LegSide;
import com.strategymonitor.domain.model.Leg;
import com.strategymonitor.domain.model.Strategy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for StrategyStore: leg index maintenance and listing order.
 */
class StrategyStoreTest {

    private StrategyStore strategyStore;

    @BeforeEach
    void setUp() {
        strategyStore = new StrategyStore();
    }

    @Test
    void putIndexesLegsAndRemoveUnindexesThem() {
        Strategy strategy = strategy("S1", Instant.parse("2026-03-02T10:00:00Z"), leg("L1", "S1"), leg("L2", "S1"));

        strategyStore.put(strategy);

        assertThat(strategyStore.findStrategyIdForLeg("L2")).contains("S1");
        assertThat(strategyStore.legCount()).isEqualTo(2);

        strategyStore.remove("S1");

        assertThat(strategyStore.findStrategyIdForLeg("L1")).isEmpty();
        assertThat(strategyStore.legCount()).isZero();
        assertThat(strategyStore.find("S1")).isEmpty();
    }

    @Test
    void indexLegAddsLegsCreatedLater() {
        strategyStore.put(strategy("S1", Instant.now()));

        strategyStore.indexLeg(leg("L9", "S1"));
        assertThat(strategyStore.findStrategyIdForLeg("L9")).contains("S1");

        strategyStore.unindexLeg("L9");
        assertThat(strategyStore.findStrategyIdForLeg("L9")).isEmpty();
    }

    @Test
    void findAllListsOldestFirst() {
        strategyStore.put(strategy("B", Instant.parse("2026-03-02T11:00:00Z")));
        strategyStore.put(strategy("A", Instant.parse("2026-03-02T10:00:00Z")));
        strategyStore.put(strategy("C", Instant.parse("2026-03-02T10:00:00Z")));

        assertThat(strategyStore.findAll()).extracting(Strategy::getId).containsExactly("A", "C", "B");
        assertThat(strategyStore.size()).isEqualTo(3);
    }

    private static Strategy strategy(String id, Instant createdAt, Leg... legs) {
        return Strategy.builder()
                .id(id)
                .name(id)
                .createdAt(createdAt)
                .legs(new ArrayList<>(List.of(legs)))
                .build();
    }

    private static Leg leg(String id, String strategyId) {
        return Leg.builder().id(id).strategyId(strategyId).side(LegSide.LONG).quantity(1).build();
    }
}
