package com.strategymonitor.exception;

import java.util.Map;

/**
 * Thrown when a free-text strategy description cannot be mapped to a known shape.
 * The caller gets the offending text back instead of a silently guessed leg list.
 */
public class UnrecognizedStrategyException extends BaseException {

    public UnrecognizedStrategyException(String description, String reason) {
        super(
                ErrorCode.UNRECOGNIZED_STRATEGY,
                "Cannot build legs from '" + description + "': " + reason,
                Map.of("description", description, "reason", reason));
    }
}
