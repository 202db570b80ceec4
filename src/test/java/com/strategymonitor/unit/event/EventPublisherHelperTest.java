package com.strategymonitor.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.ChangeType;
import com.strategymonitor.domain.enums.SubscriptionStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import com.strategymonitor.domain.model.Strategy;
import com.strategymonitor.event.AlarmEvent;
import com.strategymonitor.event.EventPublisherHelper;
import com.strategymonitor.event.PriceChangedEvent;
import com.strategymonitor.event.StrategyChangedEvent;
import com.strategymonitor.event.SubscriptionStatusEvent;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link EventPublisherHelper}.
 *
 * <p>Verifies that each typed publish method creates the correct event type
 * with the expected fields and delegates to Spring's ApplicationEventPublisher.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    private Strategy strategy;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
        strategy = Strategy.builder()
                .id("S1")
                .name("H6 fly")
                .targetPrice(new BigDecimal("-0.50"))
                .targetCondition(TargetCondition.BELOW)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("publishAlarm carries the strategy target next to the price")
    void publishAlarm() {
        eventPublisherHelper.publishAlarm(this, strategy, AlarmTransition.REACHED, new BigDecimal("-0.95"));

        ArgumentCaptor<AlarmEvent> captor = ArgumentCaptor.forClass(AlarmEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        AlarmEvent event = captor.getValue();
        assertThat(event.getStrategyName()).isEqualTo("H6 fly");
        assertThat(event.getTransition()).isEqualTo(AlarmTransition.REACHED);
        assertThat(event.getPrice()).isEqualByComparingTo("-0.95");
        assertThat(event.getTargetPrice()).isEqualByComparingTo("-0.50");
        assertThat(event.getTargetCondition()).isEqualTo(TargetCondition.BELOW);
        assertThat(event.getOccurredAt()).isNotNull();
    }

    @Test
    @DisplayName("publishPriceChanged with null marks the price incomplete")
    void publishPriceChanged() {
        eventPublisherHelper.publishPriceChanged(this, "S1", null);

        ArgumentCaptor<PriceChangedEvent> captor = ArgumentCaptor.forClass(PriceChangedEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().isComplete()).isFalse();
    }

    @Test
    @DisplayName("publishSubscriptionFailed carries ticker and reason")
    void publishSubscriptionFailed() {
        eventPublisherHelper.publishSubscriptionFailed(this, "SFRH6C 96.5 COMDTY", "unknown security");

        ArgumentCaptor<SubscriptionStatusEvent> captor = ArgumentCaptor.forClass(SubscriptionStatusEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(SubscriptionStatus.FAILED);
        assertThat(captor.getValue().getReason()).isEqualTo("unknown security");
    }

    @Test
    @DisplayName("publishStrategyChanged snapshots the strategy; deletes carry no snapshot")
    void publishStrategyChanged() {
        eventPublisherHelper.publishStrategyChanged(this, strategy, ChangeType.UPDATED);
        strategy.setName("renamed later");

        ArgumentCaptor<StrategyChangedEvent> captor = ArgumentCaptor.forClass(StrategyChangedEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getSnapshot().name()).isEqualTo("H6 fly");

        eventPublisherHelper.publishStrategyDeleted(this, "S1");
        verify(applicationEventPublisher, times(2)).publishEvent(captor.capture());
        assertThat(captor.getValue().getChangeType()).isEqualTo(ChangeType.DELETED);
        assertThat(captor.getValue().getSnapshot()).isNull();
    }
}
