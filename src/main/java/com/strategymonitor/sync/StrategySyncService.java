package com.strategymonitor.sync;

import com.strategymonitor.config.MonitorProperties;
import com.strategymonitor.domain.model.StrategySnapshot;
import com.strategymonitor.event.StrategyChangedEvent;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Forwards structural strategy edits to the {@link RemoteSyncClient}.
 *
 * <ul>
 *   <li>CREATED is sent at once</li>
 *   <li>UPDATED is debounced per strategy; a burst of edits sends only the last snapshot</li>
 *   <li>DELETED cancels any pending update, then is sent at once</li>
 * </ul>
 *
 * <p>Sends run on the event executor so the editing thread never waits on the network.
 * Sends for one strategy are chained: each starts after the previous one for the same id
 * finished, so the remote always sees create, updates, delete in that order. Sends for
 * different strategies run in parallel. Client failures are logged here and not retried.
 */
@Service
public class StrategySyncService {

    private static final Logger log = LoggerFactory.getLogger(StrategySyncService.class);

    private final RemoteSyncClient remoteSyncClient;
    private final ChangeDebouncer changeDebouncer;
    private final Executor sendExecutor;
    private final boolean enabled;

    /** Strategies created and not yet deleted; late debounced updates for others are dropped. */
    private final Set<String> liveStrategyIds = ConcurrentHashMap.newKeySet();

    /** Strategy id -> last queued send. Entries leave once their tail completes. */
    private final Map<String, CompletableFuture<Void>> sendChains = new ConcurrentHashMap<>();

    public StrategySyncService(
            RemoteSyncClient remoteSyncClient,
            ChangeDebouncer changeDebouncer,
            @Qualifier("eventExecutor") Executor sendExecutor,
            MonitorProperties monitorProperties) {
        this.remoteSyncClient = remoteSyncClient;
        this.changeDebouncer = changeDebouncer;
        this.sendExecutor = sendExecutor;
        this.enabled = monitorProperties.getSync().isEnabled();
    }

    @EventListener
    public void onStrategyChanged(StrategyChangedEvent event) {
        if (!enabled) {
            return;
        }
        String strategyId = event.getStrategyId();
        switch (event.getChangeType()) {
            case CREATED -> {
                liveStrategyIds.add(strategyId);
                StrategySnapshot snapshot = event.getSnapshot();
                send(strategyId, "create", () -> remoteSyncClient.strategyCreated(snapshot));
            }
            case UPDATED -> {
                StrategySnapshot snapshot = event.getSnapshot();
                changeDebouncer.schedule(strategyId, () -> pushUpdate(snapshot));
            }
            case DELETED -> {
                liveStrategyIds.remove(strategyId);
                changeDebouncer.cancel(strategyId);
                send(strategyId, "delete", () -> remoteSyncClient.strategyDeleted(strategyId));
            }
        }
    }

    /** Cancels pending debounced updates. Called by the engine on shutdown. */
    public void shutdown() {
        changeDebouncer.shutdown();
    }

    /** Number of strategies with a send queued or in flight. */
    public int pendingSendCount() {
        return sendChains.size();
    }

    private void pushUpdate(StrategySnapshot snapshot) {
        if (!liveStrategyIds.contains(snapshot.id())) {
            log.debug("Skipping update for deleted strategy {}", snapshot.id());
            return;
        }
        send(snapshot.id(), "update", () -> {
            // re-checked: a delete may have been queued while this update waited
            if (liveStrategyIds.contains(snapshot.id())) {
                remoteSyncClient.strategyUpdated(snapshot);
            }
        });
    }

    private void send(String strategyId, String operation, Runnable call) {
        Runnable task = () -> {
            try {
                call.run();
            } catch (RuntimeException e) {
                log.error("Remote sync {} failed for {}: {}", operation, strategyId, e.getMessage(), e);
            }
        };
        CompletableFuture<Void> tail = sendChains.compute(strategyId, (id, previous) -> previous == null
                ? CompletableFuture.runAsync(task, sendExecutor)
                : previous.thenRunAsync(task, sendExecutor));
        tail.whenComplete((ignored, error) -> sendChains.remove(strategyId, tail));
    }
}
