package com.strategymonitor.exception;

import java.util.Map;

/** Contract violation: the engine was used after shutdown. */
public class EngineStoppedException extends BaseException {

    public EngineStoppedException(String operation) {
        super(
                ErrorCode.ENGINE_STOPPED,
                "Engine is stopped, rejected operation: " + operation,
                Map.of("operation", operation));
    }
}
