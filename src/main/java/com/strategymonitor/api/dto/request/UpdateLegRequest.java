package com.strategymonitor.api.dto.request;

import com.strategymonitor.domain.enums.LegSide;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Null fields are left unchanged. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLegRequest {

    private LegSide side;

    @Min(1)
    private Integer quantity;
}
