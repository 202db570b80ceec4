package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.TargetCondition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateStrategyRequest {

    @NotBlank
    private String name;

    /** Optional; without it the alarm never arms. */
    private BigDecimal targetPrice;

    /** Defaults to BELOW. */
    private TargetCondition targetCondition;

    @Valid
    private List<LegRequest> legs;
}
