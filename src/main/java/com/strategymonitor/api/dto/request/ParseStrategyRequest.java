package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.TargetCondition;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-text strategy description, e.g. {@code "SFRF6 96.50/96.625/96.75 Call Fly"}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseStrategyRequest {

    @NotBlank
    private String description;

    private BigDecimal targetPrice;

    private TargetCondition targetCondition;
}
