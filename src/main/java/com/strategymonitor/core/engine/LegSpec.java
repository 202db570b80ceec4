package com.strategymonitor.core.engine;

import com.strategymonitor.domain.enums.LegSide;

/**
 * Input for a new leg.
 *
 * @param ticker   raw ticker text; null or blank creates a leg without an instrument
 * @param side     null defaults to LONG
 * @param quantity must be positive
 */
public record LegSpec(String ticker, LegSide side, int quantity) {}
