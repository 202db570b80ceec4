package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.LegSide;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A leg to add. Ticker may be blank for a placeholder leg. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegRequest {

    /** Free-form ticker text, e.g. "sfrh6c 96.5 comdty". Normalized server-side. */
    private String ticker;

    /** Defaults to LONG. */
    private LegSide side;

    /** Defaults to 1. */
    @Min(1)
    private Integer quantity;
}
