package com.strategymonitor.unit.alarm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.strategymonitor.alarm.AlarmStateMachine;
import com.strategymonitor.domain.enums.AlarmState;
import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import com.strategymonitor.domain.model.Strategy;
import com.strategymonitor.event.EventPublisherHelper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for AlarmStateMachine: edge-triggered REACHED/LEFT transitions, status gating,
 * target edits and manual re-arm.
 */
@ExtendWith(MockitoExtension.class)
class AlarmStateMachineTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private AlarmStateMachine alarmStateMachine;
    private Strategy strategy;

    @BeforeEach
    void setUp() {
        alarmStateMachine = new AlarmStateMachine(eventPublisherHelper);
        strategy = Strategy.builder()
                .id("S1")
                .name("H6 fly")
                .targetPrice(BigDecimal.ZERO)
                .targetCondition(TargetCondition.BELOW)
                .build();
        alarmStateMachine.create("S1");
    }

    @Nested
    @DisplayName("Edge detection")
    class EdgeDetection {

        @Test
        @DisplayName("Price path 0.10, -0.05, -0.10, 0.02, -0.01 emits REACHED, LEFT, REACHED")
        void pricePath() {
            List<Optional<AlarmTransition>> results = new ArrayList<>();
            for (String price : List.of("0.10", "-0.05", "-0.10", "0.02", "-0.01")) {
                results.add(priceAt(price));
            }

            assertThat(results)
                    .containsExactly(
                            Optional.empty(),
                            Optional.of(AlarmTransition.REACHED),
                            Optional.empty(),
                            Optional.of(AlarmTransition.LEFT),
                            Optional.of(AlarmTransition.REACHED));
            verify(eventPublisherHelper, times(2))
                    .publishAlarm(any(), eq(strategy), eq(AlarmTransition.REACHED), any());
            verify(eventPublisherHelper, times(1))
                    .publishAlarm(any(), eq(strategy), eq(AlarmTransition.LEFT), any());
        }

        @Test
        @DisplayName("Equality satisfies the condition")
        void inclusiveComparison() {
            assertThat(priceAt("0")).contains(AlarmTransition.REACHED);
        }

        @Test
        @DisplayName("ABOVE arms when price rises to the target")
        void aboveCondition() {
            strategy.setTargetCondition(TargetCondition.ABOVE);
            strategy.setTargetPrice(new BigDecimal("1.50"));

            assertThat(priceAt("1.49")).isEmpty();
            assertThat(priceAt("1.51")).contains(AlarmTransition.REACHED);
        }

        @Test
        @DisplayName("Price going incomplete while ARMED emits LEFT")
        void incompleteLeaves() {
            priceAt("-0.05");

            strategy.setAggregatePrice(null);

            assertThat(alarmStateMachine.evaluate(strategy)).contains(AlarmTransition.LEFT);
            verify(eventPublisherHelper).publishAlarm(any(), eq(strategy), eq(AlarmTransition.LEFT), eq(null));
        }

        @Test
        @DisplayName("No target never arms")
        void noTarget() {
            strategy.setTargetPrice(null);

            assertThat(priceAt("-5")).isEmpty();
            assertThat(alarmStateMachine.state("S1")).isEqualTo(AlarmState.NOT_ARMED);
            verify(eventPublisherHelper, never()).publishAlarm(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Status gating")
    class StatusGating {

        @Test
        @DisplayName("Non-ACTIVE strategies never arm")
        void inactiveNeverArms() {
            strategy.setStatus(StrategyStatus.DONE);

            assertThat(priceAt("-1")).isEmpty();
            verify(eventPublisherHelper, never()).publishAlarm(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Leaving ACTIVE while ARMED emits LEFT; re-entering arms on the next recompute")
        void statusAwayAndBack() {
            priceAt("-0.05");

            strategy.setStatus(StrategyStatus.CANCELLED);
            assertThat(alarmStateMachine.onStatusChanged(strategy)).contains(AlarmTransition.LEFT);

            strategy.setStatus(StrategyStatus.ACTIVE);
            assertThat(alarmStateMachine.onStatusChanged(strategy)).isEmpty();
            assertThat(alarmStateMachine.state("S1")).isEqualTo(AlarmState.NOT_ARMED);

            assertThat(alarmStateMachine.evaluate(strategy)).contains(AlarmTransition.REACHED);
        }
    }

    @Nested
    @DisplayName("Edits")
    class Edits {

        @Test
        @DisplayName("Target change that still qualifies fires REACHED again")
        void targetChangeStillQualifies() {
            priceAt("-0.05");

            strategy.setTargetPrice(new BigDecimal("0.01"));

            assertThat(alarmStateMachine.onTargetChanged(strategy)).contains(AlarmTransition.REACHED);
            verify(eventPublisherHelper, times(2))
                    .publishAlarm(any(), eq(strategy), eq(AlarmTransition.REACHED), any());
        }

        @Test
        @DisplayName("Target change that no longer qualifies emits LEFT")
        void targetChangeLeaves() {
            priceAt("-0.05");

            strategy.setTargetPrice(new BigDecimal("-0.10"));

            assertThat(alarmStateMachine.onTargetChanged(strategy)).contains(AlarmTransition.LEFT);
            assertThat(alarmStateMachine.state("S1")).isEqualTo(AlarmState.NOT_ARMED);
        }

        @Test
        @DisplayName("Target change on an unarmed alarm that still does not qualify emits nothing")
        void targetChangeWhileUnarmedIsSilent() {
            priceAt("0.10");

            strategy.setTargetPrice(new BigDecimal("-0.10"));

            assertThat(alarmStateMachine.onTargetChanged(strategy)).isEmpty();
            verify(eventPublisherHelper, never()).publishAlarm(any(), any(), any(), any());
        }

        @Test
        @DisplayName("rearm resets silently so the next qualifying price fires again")
        void rearm() {
            priceAt("-0.05");

            alarmStateMachine.rearm("S1");

            assertThat(alarmStateMachine.state("S1")).isEqualTo(AlarmState.NOT_ARMED);
            assertThat(priceAt("-0.06")).contains(AlarmTransition.REACHED);
            verify(eventPublisherHelper, never()).publishAlarm(any(), any(), eq(AlarmTransition.LEFT), any());
        }

        @Test
        @DisplayName("destroy forgets the state")
        void destroy() {
            priceAt("-0.05");

            alarmStateMachine.destroy("S1");

            assertThat(alarmStateMachine.state("S1")).isEqualTo(AlarmState.NOT_ARMED);
        }
    }

    private Optional<AlarmTransition> priceAt(String price) {
        strategy.setAggregatePrice(new BigDecimal(price));
        return alarmStateMachine.evaluate(strategy);
    }
}
