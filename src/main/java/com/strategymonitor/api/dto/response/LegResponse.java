package com.strategymonitor.api.dto.response;

import com.strategymonitor.domain.model.StrategySnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LegResponse {

    private String id;
    private String ticker;
    private String side;
    private int quantity;
    private BigDecimal last;
    private BigDecimal bid;
    private BigDecimal ask;

    /** Mid when bid and ask are known, else last; null if never quoted. */
    private BigDecimal price;

    private Instant lastUpdate;

    public static LegResponse from(StrategySnapshot.LegSnapshot leg) {
        return LegResponse.builder()
                .id(leg.id())
                .ticker(leg.ticker())
                .side(leg.side().name())
                .quantity(leg.quantity())
                .last(leg.last())
                .bid(leg.bid())
                .ask(leg.ask())
                .price(leg.price())
                .lastUpdate(leg.lastUpdate())
                .build();
    }
}
