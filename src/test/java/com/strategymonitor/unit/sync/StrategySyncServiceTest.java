package com.strategymonitor.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.strategymonitor.config.MonitorProperties;
import com.strategymonitor.domain.enums.ChangeType;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import com.strategymonitor.domain.model.StrategySnapshot;
import com.strategymonitor.event.StrategyChangedEvent;
import com.strategymonitor.sync.ChangeDebouncer;
import com.strategymonitor.sync.RemoteSyncClient;
import com.strategymonitor.sync.StrategySyncService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for StrategySyncService: immediate create/delete, debounced updates,
 * late updates after delete, and the disabled switch.
 */
@ExtendWith(MockitoExtension.class)
class StrategySyncServiceTest {

    @Mock
    private RemoteSyncClient remoteSyncClient;

    @Mock
    private ChangeDebouncer changeDebouncer;

    private MonitorProperties monitorProperties;
    private StrategySyncService syncService;

    @BeforeEach
    void setUp() {
        monitorProperties = new MonitorProperties();
        syncService = new StrategySyncService(remoteSyncClient, changeDebouncer, Runnable::run, monitorProperties);
    }

    @Test
    @DisplayName("CREATED is sent immediately")
    void createdSentImmediately() {
        StrategySnapshot snapshot = snapshot("S1", "fly");

        syncService.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot));

        verify(remoteSyncClient).strategyCreated(snapshot);
        verifyNoInteractions(changeDebouncer);
    }

    @Test
    @DisplayName("UPDATED is debounced and sends the captured snapshot when the timer fires")
    void updatedIsDebounced() {
        syncService.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot("S1", "fly")));
        StrategySnapshot renamed = snapshot("S1", "H6 fly");

        syncService.onStrategyChanged(event("S1", ChangeType.UPDATED, renamed));

        ArgumentCaptor<Runnable> action = ArgumentCaptor.forClass(Runnable.class);
        verify(changeDebouncer).schedule(eq("S1"), action.capture());
        verify(remoteSyncClient, never()).strategyUpdated(any());

        action.getValue().run();
        verify(remoteSyncClient).strategyUpdated(renamed);
    }

    @Test
    @DisplayName("DELETED cancels the pending update and is sent immediately")
    void deletedCancelsPending() {
        syncService.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot("S1", "fly")));
        syncService.onStrategyChanged(event("S1", ChangeType.UPDATED, snapshot("S1", "fly 2")));
        ArgumentCaptor<Runnable> action = ArgumentCaptor.forClass(Runnable.class);
        verify(changeDebouncer).schedule(eq("S1"), action.capture());

        syncService.onStrategyChanged(event("S1", ChangeType.DELETED, null));

        verify(changeDebouncer).cancel("S1");
        verify(remoteSyncClient).strategyDeleted("S1");

        // a timer that already fired must not resurrect the strategy remotely
        action.getValue().run();
        verify(remoteSyncClient, never()).strategyUpdated(any());
    }

    @Test
    @DisplayName("A delete waits for a slow create of the same strategy on a multi-threaded executor")
    void deleteWaitsForSlowCreate() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            StrategySyncService pooled =
                    new StrategySyncService(remoteSyncClient, changeDebouncer, pool, monitorProperties);
            StrategySnapshot snapshot = snapshot("S1", "fly");
            List<String> calls = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch releaseCreate = new CountDownLatch(1);
            CountDownLatch deleted = new CountDownLatch(1);
            doAnswer(invocation -> {
                        releaseCreate.await(5, TimeUnit.SECONDS);
                        calls.add("create");
                        return null;
                    })
                    .when(remoteSyncClient)
                    .strategyCreated(snapshot);
            doAnswer(invocation -> {
                        calls.add("delete");
                        deleted.countDown();
                        return null;
                    })
                    .when(remoteSyncClient)
                    .strategyDeleted("S1");

            pooled.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot));
            pooled.onStrategyChanged(event("S1", ChangeType.DELETED, null));

            verify(remoteSyncClient, after(200).never()).strategyDeleted("S1");
            releaseCreate.countDown();

            assertThat(deleted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(calls).containsExactly("create", "delete");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Sends for different strategies do not wait on each other")
    void otherStrategiesNotBlocked() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            StrategySyncService pooled =
                    new StrategySyncService(remoteSyncClient, changeDebouncer, pool, monitorProperties);
            StrategySnapshot slow = snapshot("S1", "slow");
            StrategySnapshot fast = snapshot("S2", "fast");
            CountDownLatch releaseSlow = new CountDownLatch(1);
            CountDownLatch fastSent = new CountDownLatch(1);
            doAnswer(invocation -> {
                        StrategySnapshot sent = invocation.getArgument(0);
                        if (sent.id().equals("S1")) {
                            releaseSlow.await(5, TimeUnit.SECONDS);
                        } else {
                            fastSent.countDown();
                        }
                        return null;
                    })
                    .when(remoteSyncClient)
                    .strategyCreated(any());

            pooled.onStrategyChanged(event("S1", ChangeType.CREATED, slow));
            pooled.onStrategyChanged(event("S2", ChangeType.CREATED, fast));

            assertThat(fastSent.await(5, TimeUnit.SECONDS)).isTrue();
            releaseSlow.countDown();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Finished sends leave no per-strategy chain behind")
    void chainsReleased() {
        syncService.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot("S1", "fly")));
        syncService.onStrategyChanged(event("S1", ChangeType.DELETED, null));

        assertThat(syncService.pendingSendCount()).isZero();
    }

    @Test
    @DisplayName("Client failures are logged, not propagated")
    void clientFailureContained() {
        StrategySnapshot snapshot = snapshot("S1", "fly");
        doThrow(new IllegalStateException("offline")).when(remoteSyncClient).strategyCreated(snapshot);

        syncService.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot));

        verify(remoteSyncClient).strategyCreated(snapshot);
    }

    @Test
    @DisplayName("Disabled sync ignores every change")
    void disabled() {
        monitorProperties.getSync().setEnabled(false);
        StrategySyncService disabled =
                new StrategySyncService(remoteSyncClient, changeDebouncer, Runnable::run, monitorProperties);

        disabled.onStrategyChanged(event("S1", ChangeType.CREATED, snapshot("S1", "fly")));

        verifyNoInteractions(remoteSyncClient, changeDebouncer);
    }

    @Test
    @DisplayName("shutdown stops the debouncer")
    void shutdown() {
        syncService.shutdown();

        verify(changeDebouncer).shutdown();
    }

    private StrategyChangedEvent event(String id, ChangeType type, StrategySnapshot snapshot) {
        return new StrategyChangedEvent(this, id, type, snapshot);
    }

    private static StrategySnapshot snapshot(String id, String name) {
        Instant now = Instant.parse("2026-03-02T10:00:00Z");
        return new StrategySnapshot(
                id, name, List.of(), BigDecimal.ZERO, TargetCondition.BELOW, StrategyStatus.ACTIVE, null, now, now);
    }
}
