package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.TargetCondition;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A null target price clears the target. A null condition keeps the current one. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTargetRequest {

    private BigDecimal targetPrice;

    private TargetCondition targetCondition;
}
