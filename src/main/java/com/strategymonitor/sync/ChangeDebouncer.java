package com.strategymonitor.sync;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces bursts of calls per entity id into one action after a quiet period.
 *
 * <p>{@link #schedule} replaces any pending action for the id and restarts its timer; when
 * the timer elapses with no further call, the latest action runs exactly once.
 * {@link #cancel} drops a pending action without running it.
 *
 * <p>Timers live on one scheduler thread but actions run on {@code actionExecutor}, so a
 * slow action for one entity never delays the timers of others. Rescheduling, cancelling
 * and firing for the same id are atomic with respect to each other: an action only runs if
 * its own {@link Pending} entry is still the mapped one when the timer fires.
 */
public class ChangeDebouncer {

    private static final Logger log = LoggerFactory.getLogger(ChangeDebouncer.class);

    private final Duration quietPeriod;
    private final Executor actionExecutor;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "change-debouncer");
        thread.setDaemon(true);
        return thread;
    });

    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private volatile boolean shutdown;

    public ChangeDebouncer(Duration quietPeriod, Executor actionExecutor) {
        this.quietPeriod = quietPeriod;
        this.actionExecutor = actionExecutor;
    }

    /** (Re)starts the quiet-period timer for {@code entityId} with {@code action} as its payload. */
    public void schedule(String entityId, Runnable action) {
        if (shutdown) {
            log.debug("Debouncer is shut down, dropping action for {}", entityId);
            return;
        }
        pending.compute(entityId, (id, previous) -> {
            if (previous != null) {
                previous.future.cancel(false);
            }
            Pending next = new Pending(action);
            next.future = scheduler.schedule(() -> fire(id, next), quietPeriod.toMillis(), TimeUnit.MILLISECONDS);
            return next;
        });
    }

    /**
     * Drops the pending action for {@code entityId}. Returns true if one was pending.
     */
    public boolean cancel(String entityId) {
        Pending removed = pending.remove(entityId);
        if (removed == null) {
            return false;
        }
        removed.future.cancel(false);
        log.debug("Cancelled pending action for {}", entityId);
        return true;
    }

    public boolean isPending(String entityId) {
        return pending.containsKey(entityId);
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Cancels every outstanding timer. Pending actions are not run. */
    public void shutdown() {
        shutdown = true;
        int cancelled = pending.size();
        pending.values().forEach(p -> p.future.cancel(false));
        pending.clear();
        scheduler.shutdownNow();
        log.info("Change debouncer stopped, {} pending actions cancelled", cancelled);
    }

    private void fire(String entityId, Pending self) {
        // Only the entry that is still mapped may run; a reschedule or cancel replaced it otherwise
        if (!pending.remove(entityId, self)) {
            return;
        }
        try {
            actionExecutor.execute(() -> runSafely(entityId, self.action));
        } catch (RejectedExecutionException e) {
            log.warn("Action for {} rejected by executor: {}", entityId, e.getMessage());
        }
    }

    private void runSafely(String entityId, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Debounced action for {} failed: {}", entityId, e.getMessage(), e);
        }
    }

    private static final class Pending {

        private final Runnable action;
        private volatile ScheduledFuture<?> future;

        private Pending(Runnable action) {
            this.action = action;
        }
    }
}
