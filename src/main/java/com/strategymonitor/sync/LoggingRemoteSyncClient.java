package com.strategymonitor.sync;

import com.strategymonitor.domain.model.StrategySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default client when no remote server is configured: records what would be sent. */
public class LoggingRemoteSyncClient implements RemoteSyncClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingRemoteSyncClient.class);

    @Override
    public void strategyCreated(StrategySnapshot snapshot) {
        log.info("Sync create {} '{}' ({} legs)", snapshot.id(), snapshot.name(), snapshot.legs().size());
    }

    @Override
    public void strategyUpdated(StrategySnapshot snapshot) {
        log.info(
                "Sync update {} '{}' status={} target={} {}",
                snapshot.id(),
                snapshot.name(),
                snapshot.status(),
                snapshot.targetCondition(),
                snapshot.targetPrice());
    }

    @Override
    public void strategyDeleted(String strategyId) {
        log.info("Sync delete {}", strategyId);
    }
}
