package com.strategymonitor.parser;

import com.strategymonitor.domain.enums.LegSide;
import java.util.List;

/**
 * Output of {@link StrategyDescriptionParser}: the strategy text split into its parts plus
 * the ordered legs.
 *
 * @param client free text before the strategy (may be empty)
 * @param name   the strategy part of the description, used as display name
 * @param action free text after the strategy, e.g. "buy to open" (may be empty)
 * @param legs   legs in description order; legs after "vs" are already inverted
 */
public record ParsedStrategy(String client, String name, String action, List<ParsedLeg> legs) {

    public record ParsedLeg(String ticker, LegSide side, int quantity) {}
}
