package com.strategymonitor.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Blank or null ticker clears the leg's instrument. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLegTickerRequest {

    private String ticker;
}
