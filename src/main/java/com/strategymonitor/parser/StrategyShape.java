package com.strategymonitor.parser;

import com.strategymonitor.domain.enums.LegSide;
import java.util.List;

/**
 * Recognized strategy shapes and their leg layout over strikes sorted ascending.
 *
 * <p>Straddle and strangle mix calls and puts; every other shape uses a single option
 * type. Spreads and ladders are mirrored for puts so the long leg sits at the high strike.
 */
public enum StrategyShape {
    OUTRIGHT(1),
    SPREAD(2),
    FLY(3),
    BROKEN_FLY(3),
    CONDOR(4),
    LADDER(3),
    STRADDLE(1),
    STRANGLE(2);

    private final int strikeCount;

    StrategyShape(int strikeCount) {
        this.strikeCount = strikeCount;
    }

    /** Number of distinct strikes the description must carry for this shape. */
    public int getStrikeCount() {
        return strikeCount;
    }

    /**
     * Side and quantity per strike position for single-type shapes. Not used for
     * straddles and strangles.
     */
    public List<Position> positions(OptionType optionType) {
        boolean put = optionType == OptionType.PUT;
        return switch (this) {
            case OUTRIGHT -> List.of(new Position(LegSide.LONG, 1));
            case SPREAD -> put
                    ? List.of(new Position(LegSide.SHORT, 1), new Position(LegSide.LONG, 1))
                    : List.of(new Position(LegSide.LONG, 1), new Position(LegSide.SHORT, 1));
            case FLY, BROKEN_FLY -> List.of(
                    new Position(LegSide.LONG, 1), new Position(LegSide.SHORT, 2), new Position(LegSide.LONG, 1));
            case CONDOR -> List.of(
                    new Position(LegSide.LONG, 1),
                    new Position(LegSide.SHORT, 1),
                    new Position(LegSide.SHORT, 1),
                    new Position(LegSide.LONG, 1));
            case LADDER -> put
                    ? List.of(
                            new Position(LegSide.SHORT, 1),
                            new Position(LegSide.SHORT, 1),
                            new Position(LegSide.LONG, 1))
                    : List.of(
                            new Position(LegSide.LONG, 1),
                            new Position(LegSide.SHORT, 1),
                            new Position(LegSide.SHORT, 1));
            case STRADDLE, STRANGLE -> List.of(new Position(LegSide.LONG, 1), new Position(LegSide.LONG, 1));
        };
    }

    public record Position(LegSide side, int quantity) {}
}
