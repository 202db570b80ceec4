package com.strategymonitor.sync;

import com.strategymonitor.domain.model.StrategySnapshot;

/**
 * Outbound side of remote synchronization. Implementations own transport, reconnection
 * and retries; the engine expects no return value and never retries.
 */
public interface RemoteSyncClient {

    void strategyCreated(StrategySnapshot snapshot);

    void strategyUpdated(StrategySnapshot snapshot);

    void strategyDeleted(String strategyId);
}
