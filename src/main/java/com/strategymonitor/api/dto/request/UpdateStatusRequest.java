package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.StrategyStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatusRequest {

    @NotNull
    private StrategyStatus status;
}
