package com.strategymonitor.api.dto.response;

import com.strategymonitor.domain.enums.AlarmState;
import com.strategymonitor.domain.model.StrategySnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Strategy as shown to clients. {@code price} is null while any leg is unpriced;
 * {@code priceComplete} says so explicitly.
 */
@Data
@Builder
public class StrategyResponse {

    private String id;
    private String name;
    private List<LegResponse> legs;
    private BigDecimal targetPrice;
    private String targetCondition;
    private String status;
    private BigDecimal price;
    private boolean priceComplete;
    private String alarmState;
    private Instant createdAt;
    private Instant updatedAt;

    public static StrategyResponse from(StrategySnapshot snapshot) {
        return from(snapshot, null);
    }

    public static StrategyResponse from(StrategySnapshot snapshot, AlarmState alarmState) {
        return StrategyResponse.builder()
                .id(snapshot.id())
                .name(snapshot.name())
                .legs(snapshot.legs().stream().map(LegResponse::from).toList())
                .targetPrice(snapshot.targetPrice())
                .targetCondition(snapshot.targetCondition().name())
                .status(snapshot.status().name())
                .price(snapshot.aggregatePrice())
                .priceComplete(snapshot.aggregatePrice() != null)
                .alarmState(alarmState != null ? alarmState.name() : null)
                .createdAt(snapshot.createdAt())
                .updatedAt(snapshot.updatedAt())
                .build();
    }
}
