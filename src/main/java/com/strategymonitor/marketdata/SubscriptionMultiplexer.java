package com.strategymonitor.marketdata;

import com.strategymonitor.domain.model.QuoteSnapshot;
import com.strategymonitor.domain.model.Ticker;
import com.strategymonitor.event.EventPublisherHelper;
import com.strategymonitor.exception.EngineStoppedException;
import com.strategymonitor.exception.ValidationException;
import com.strategymonitor.instrument.InstrumentRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reference-counted fan-out between legs and the single market-data session.
 *
 * <p>Many legs (across many strategies) can reference the same instrument. The multiplexer
 * keeps one interest set of leg ids per canonical {@link Ticker}; the session is asked to
 * subscribe when a ticker gains its first interested leg and to unsubscribe when it loses
 * its last one. Incoming quotes are routed to every interested leg through the bound
 * {@link QuoteConsumer}.
 *
 * <p>Subscribe/unsubscribe requests are not sent inline. {@link #register} and
 * {@link #unregister} only record pending adds and removes, then hand a flush to the
 * single-threaded dispatch executor. Everything queued before the flush runs goes out as one
 * subscribe list and one unsubscribe list. A ticker added and removed before the flush
 * cancels out and is never sent.
 *
 * <p>Resubscription depends on whether the session reported a loss. After
 * {@link #onSessionTerminated()} every issued subscription is gone, so each ticker with
 * interest is subscribed afresh. On a live session each issued subscription is refreshed
 * with an unsubscribe followed by a subscribe in the same batch, and queued unsubscribes
 * still go out. Either way every ticker ends with one outstanding subscription exactly
 * when its refcount is positive.
 *
 * <p>Thread-safety: {@code lock} guards the interest map, the pending batches and the set of
 * issued subscriptions. Session calls happen outside the lock, serialized by
 * {@code flushMonitor}. Callers on the editing path never wait on the session.
 */
@Component
public class SubscriptionMultiplexer implements MarketDataListener {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionMultiplexer.class);

    private final MarketDataSession marketDataSession;
    private final InstrumentRegistry instrumentRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor dispatcher;

    private final ReentrantLock lock = new ReentrantLock();
    private final Object flushMonitor = new Object();

    // ---- State guarded by lock ----

    private final Map<Ticker, Set<String>> interest = new LinkedHashMap<>();
    private final Set<Ticker> pendingAdds = new LinkedHashSet<>();
    private final Set<Ticker> pendingRemoves = new LinkedHashSet<>();

    /** Issued subscriptions to re-send as unsubscribe then subscribe on the next flush. */
    private final Set<Ticker> pendingRefresh = new LinkedHashSet<>();

    /** Tickers for which a subscribe has been issued and no unsubscribe since. */
    private final Set<Ticker> activeSubscriptions = new LinkedHashSet<>();

    private boolean sessionLost;
    private boolean closed;

    // ---- Unguarded ----

    private final Set<String> failedTickers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);
    private final AtomicLong routedQuotes = new AtomicLong();
    private final AtomicLong droppedQuotes = new AtomicLong();

    private volatile QuoteConsumer quoteConsumer = (legId, snapshot) -> {};

    @Autowired
    public SubscriptionMultiplexer(
            MarketDataSession marketDataSession,
            InstrumentRegistry instrumentRegistry,
            EventPublisherHelper eventPublisherHelper) {
        this(marketDataSession, instrumentRegistry, eventPublisherHelper, Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "subscription-dispatch");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public SubscriptionMultiplexer(
            MarketDataSession marketDataSession,
            InstrumentRegistry instrumentRegistry,
            EventPublisherHelper eventPublisherHelper,
            Executor dispatcher) {
        this.marketDataSession = marketDataSession;
        this.instrumentRegistry = instrumentRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.dispatcher = dispatcher;
    }

    /** Sets the target for routed quotes. Called once by the engine at construction. */
    public void bindQuoteConsumer(QuoteConsumer quoteConsumer) {
        this.quoteConsumer = quoteConsumer;
    }

    /** Opens the session and queues a subscribe for every ticker that already has interest. */
    public void start() {
        if (isStopped()) {
            throw new EngineStoppedException("start");
        }
        marketDataSession.start(this);
        log.info("Market data session started");
        resubscribeAll();
    }

    // ==== Registration ====

    /**
     * Adds {@code legId} to the interest set of {@code ticker}. The first interested leg
     * queues a subscribe. Registering the same pair twice is a no-op.
     *
     * @throws EngineStoppedException after {@link #stop()}
     */
    public void register(String legId, Ticker ticker) {
        boolean queued = false;
        lock.lock();
        try {
            ensureOpen("register");
            Set<String> legs = interest.computeIfAbsent(ticker, t -> new LinkedHashSet<>());
            if (legs.add(legId) && legs.size() == 1) {
                if (!pendingRemoves.remove(ticker) && !activeSubscriptions.contains(ticker)) {
                    pendingAdds.add(ticker);
                    queued = true;
                }
            }
        } finally {
            lock.unlock();
        }
        if (queued) {
            log.debug("Queued subscribe for {} (first leg {})", ticker, legId);
            scheduleFlush();
        }
    }

    /**
     * Removes {@code legId} from the interest set of {@code ticker}. Removing the last leg
     * queues an unsubscribe. Unknown pairs are ignored: they happen legitimately when edits
     * race with in-flight callbacks.
     *
     * @throws EngineStoppedException after {@link #stop()}
     */
    public void unregister(String legId, Ticker ticker) {
        boolean queued = false;
        lock.lock();
        try {
            ensureOpen("unregister");
            Set<String> legs = interest.get(ticker);
            if (legs == null || !legs.remove(legId)) {
                log.debug("Ignoring unregister of unknown leg {} for {}", legId, ticker);
                return;
            }
            if (legs.isEmpty()) {
                interest.remove(ticker);
                pendingRefresh.remove(ticker);
                if (!pendingAdds.remove(ticker) && activeSubscriptions.contains(ticker)) {
                    pendingRemoves.add(ticker);
                    queued = true;
                }
            }
        } finally {
            lock.unlock();
        }
        if (queued) {
            log.debug("Queued unsubscribe for {} (last leg {})", ticker, legId);
            scheduleFlush();
        }
    }

    /**
     * Queues a subscribe for each ticker with interest. After a session loss the tickers are
     * subscribed afresh; on a live session issued subscriptions are refreshed and pending
     * unsubscribes are kept. Used after the session is (re)started.
     */
    public void resubscribeAll() {
        int queued;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (sessionLost) {
                activeSubscriptions.clear();
                pendingRemoves.clear();
                pendingRefresh.clear();
                pendingAdds.addAll(interest.keySet());
                sessionLost = false;
            } else {
                for (Ticker ticker : activeSubscriptions) {
                    if (interest.containsKey(ticker)) {
                        pendingRefresh.add(ticker);
                    }
                }
            }
            queued = pendingAdds.size() + pendingRefresh.size();
        } finally {
            lock.unlock();
        }
        if (queued > 0) {
            log.info("Re-queued {} subscriptions", queued);
            scheduleFlush();
        }
    }

    // ==== Flush ====

    private void scheduleFlush() {
        if (flushScheduled.compareAndSet(false, true)) {
            dispatcher.execute(() -> {
                flushScheduled.set(false);
                flush();
            });
        }
    }

    /**
     * Sends the pending batches to the session: at most one unsubscribe list and one
     * subscribe list. Safe to call at any time; does nothing when no work is pending.
     */
    public void flush() {
        synchronized (flushMonitor) {
            List<String> adds;
            List<String> removes;
            lock.lock();
            try {
                if (closed || (pendingAdds.isEmpty() && pendingRemoves.isEmpty() && pendingRefresh.isEmpty())) {
                    return;
                }
                removes = names(pendingRemoves);
                removes.addAll(names(pendingRefresh));
                adds = names(pendingAdds);
                adds.addAll(names(pendingRefresh));
                // refreshed tickers stay active
                activeSubscriptions.addAll(pendingAdds);
                activeSubscriptions.removeAll(pendingRemoves);
                pendingAdds.clear();
                pendingRemoves.clear();
                pendingRefresh.clear();
            } finally {
                lock.unlock();
            }

            if (!removes.isEmpty()) {
                try {
                    marketDataSession.unsubscribe(removes);
                    removes.forEach(failedTickers::remove);
                    log.debug("Unsubscribed {}", removes);
                } catch (RuntimeException e) {
                    log.warn("Unsubscribe of {} tickers failed: {}", removes.size(), e.getMessage());
                }
            }
            if (!adds.isEmpty()) {
                try {
                    marketDataSession.subscribe(adds);
                    log.debug("Subscribed {}", adds);
                } catch (RuntimeException e) {
                    log.warn("Subscribe of {} tickers failed: {}", adds.size(), e.getMessage());
                    adds.forEach(ticker -> onSubscriptionFailed(ticker, e.getMessage()));
                }
            }
        }
    }

    // ==== Session callbacks ====

    @Override
    public void onQuote(String rawTicker, double last, double bid, double ask) {
        Optional<Ticker> ticker = toTicker(rawTicker);
        List<String> legIds;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            Set<String> legs = ticker.map(interest::get).orElse(null);
            legIds = legs == null ? Collections.emptyList() : new ArrayList<>(legs);
        } finally {
            lock.unlock();
        }

        if (legIds.isEmpty()) {
            droppedQuotes.incrementAndGet();
            log.debug("Dropped quote for {}: no interested legs", rawTicker);
            return;
        }

        QuoteSnapshot snapshot = QuoteSnapshot.fromFeed(last, bid, ask);
        QuoteConsumer consumer = this.quoteConsumer;
        for (String legId : legIds) {
            try {
                consumer.accept(legId, snapshot);
                routedQuotes.incrementAndGet();
            } catch (RuntimeException e) {
                log.error("Quote consumer failed for leg {} on {}: {}", legId, rawTicker, e.getMessage(), e);
            }
        }
    }

    @Override
    public void onSubscriptionStarted(String rawTicker) {
        String ticker = displayName(rawTicker);
        failedTickers.remove(ticker);
        log.debug("Subscription started for {}", ticker);
        eventPublisherHelper.publishSubscriptionStarted(this, ticker);
    }

    @Override
    public void onSubscriptionFailed(String rawTicker, String reason) {
        String ticker = displayName(rawTicker);
        failedTickers.add(ticker);
        log.warn("Subscription failed for {}: {}", ticker, reason);
        eventPublisherHelper.publishSubscriptionFailed(this, ticker, reason);
    }

    @Override
    public void onSessionTerminated() {
        lock.lock();
        try {
            activeSubscriptions.clear();
            pendingRemoves.clear();
            pendingRefresh.clear();
            sessionLost = true;
        } finally {
            lock.unlock();
        }
        log.warn("Market data session terminated; all subscriptions lost");
        eventPublisherHelper.publishSessionTerminated(this);
    }

    // ==== Shutdown ====

    /**
     * Stops quote routing, discards pending subscribes, releases issued subscriptions and
     * closes the session. Registration calls afterwards throw {@link EngineStoppedException}.
     */
    public void stop() {
        synchronized (flushMonitor) {
            List<String> toRelease;
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                closed = true;
                int discarded = pendingAdds.size();
                pendingAdds.clear();
                pendingRemoves.clear();
                pendingRefresh.clear();
                toRelease = names(activeSubscriptions);
                activeSubscriptions.clear();
                interest.clear();
                log.info("Stopping multiplexer: discarded {} pending subscribes, releasing {}", discarded, toRelease.size());
            } finally {
                lock.unlock();
            }

            try {
                if (!toRelease.isEmpty() && marketDataSession.isConnected()) {
                    marketDataSession.unsubscribe(toRelease);
                }
            } catch (RuntimeException e) {
                log.warn("Release of subscriptions on shutdown failed: {}", e.getMessage());
            } finally {
                marketDataSession.close();
            }
        }

        if (dispatcher instanceof ExecutorService executorService) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(2, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ==== Diagnostics ====

    /** Number of legs interested in {@code ticker}. */
    public int refCount(Ticker ticker) {
        lock.lock();
        try {
            Set<String> legs = interest.get(ticker);
            return legs == null ? 0 : legs.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeSubscriptionCount() {
        lock.lock();
        try {
            return activeSubscriptions.size();
        } finally {
            lock.unlock();
        }
    }

    public long routedQuoteCount() {
        return routedQuotes.get();
    }

    public long droppedQuoteCount() {
        return droppedQuotes.get();
    }

    public SubscriptionDiagnostics diagnostics() {
        Map<String, Integer> refCounts = new LinkedHashMap<>();
        List<String> active;
        int pendingAddCount;
        int pendingRemoveCount;
        lock.lock();
        try {
            interest.forEach((ticker, legs) -> refCounts.put(ticker.value(), legs.size()));
            active = names(activeSubscriptions);
            pendingAddCount = pendingAdds.size();
            pendingRemoveCount = pendingRemoves.size();
        } finally {
            lock.unlock();
        }
        return new SubscriptionDiagnostics(
                refCounts,
                active,
                new TreeSet<>(failedTickers),
                pendingAddCount,
                pendingRemoveCount,
                routedQuotes.get(),
                droppedQuotes.get(),
                marketDataSession.isConnected());
    }

    // ==== Helpers ====

    private void ensureOpen(String operation) {
        if (closed) {
            throw new EngineStoppedException(operation);
        }
    }

    private Optional<Ticker> toTicker(String raw) {
        try {
            return instrumentRegistry.normalize(raw);
        } catch (ValidationException e) {
            return Optional.empty();
        }
    }

    private String displayName(String raw) {
        return toTicker(raw).map(Ticker::value).orElse(String.valueOf(raw));
    }

    private static List<String> names(Set<Ticker> tickers) {
        List<String> result = new ArrayList<>(tickers.size());
        tickers.forEach(ticker -> result.add(ticker.value()));
        return result;
    }
}
