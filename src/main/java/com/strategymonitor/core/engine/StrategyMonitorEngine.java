package com.strategymonitor.core.engine;

import com.strategymonitor.alarm.AlarmStateMachine;
import com.strategymonitor.core.processor.PriceUpdate;
import com.strategymonitor.core.processor.PricingEngine;
import com.strategymonitor.core.store.StrategyStore;
import com.strategymonitor.domain.enums.ChangeType;
import com.strategymonitor.domain.enums.LegSide;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import com.strategymonitor.domain.model.Leg;
import com.strategymonitor.domain.model.QuoteSnapshot;
import com.strategymonitor.domain.model.Strategy;
import com.strategymonitor.domain.model.StrategySnapshot;
import com.strategymonitor.domain.model.Ticker;
import com.strategymonitor.event.EventPublisherHelper;
import com.strategymonitor.exception.EngineStoppedException;
import com.strategymonitor.exception.ResourceNotFoundException;
import com.strategymonitor.exception.ValidationException;
import com.strategymonitor.instrument.InstrumentRegistry;
import com.strategymonitor.marketdata.SubscriptionMultiplexer;
import com.strategymonitor.parser.ParsedStrategy;
import com.strategymonitor.parser.StrategyDescriptionParser;
import com.strategymonitor.sync.StrategySyncService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything that mutates strategies: user edits and routed quotes.
 *
 * <p>Data flow for a quote: {@link SubscriptionMultiplexer} -> {@link #applyQuote} ->
 * {@link PricingEngine} full recompute -> {@link AlarmStateMachine} evaluation -> events.
 * Structural edits additionally publish a {@code StrategyChangedEvent}, which the
 * {@link StrategySyncService} forwards (creates and deletes at once, updates debounced).
 *
 * <p><b>Concurrency:</b> each strategy has its own {@link ReadWriteLock}. Edits and quotes
 * take the write lock, snapshots the read lock. Pricing, alarm evaluation and event
 * publication for one strategy therefore happen in a single critical section, so listeners
 * see events for a strategy in the order they happened. Different strategies never contend.
 * Lock order is strategy lock, then multiplexer lock; the multiplexer never calls back into
 * the engine while holding its own lock.
 *
 * <p><b>Lifecycle:</b> {@link #start()} opens the market-data session. {@link #stop()} stops
 * quote intake, discards pending subscribes, cancels debounce timers and releases the
 * session. Any edit after that throws {@link EngineStoppedException}.
 */
@Service
public class StrategyMonitorEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StrategyMonitorEngine.class);

    private final StrategyStore strategyStore;
    private final PricingEngine pricingEngine;
    private final AlarmStateMachine alarmStateMachine;
    private final SubscriptionMultiplexer subscriptionMultiplexer;
    private final InstrumentRegistry instrumentRegistry;
    private final StrategyDescriptionParser strategyDescriptionParser;
    private final StrategySyncService strategySyncService;
    private final EventPublisherHelper eventPublisherHelper;

    /** Per-strategy locks: write for edits and quotes, read for snapshots. */
    private final ConcurrentHashMap<String, ReadWriteLock> strategyLocks = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopped;

    public StrategyMonitorEngine(
            StrategyStore strategyStore,
            PricingEngine pricingEngine,
            AlarmStateMachine alarmStateMachine,
            SubscriptionMultiplexer subscriptionMultiplexer,
            InstrumentRegistry instrumentRegistry,
            StrategyDescriptionParser strategyDescriptionParser,
            StrategySyncService strategySyncService,
            EventPublisherHelper eventPublisherHelper) {
        this.strategyStore = strategyStore;
        this.pricingEngine = pricingEngine;
        this.alarmStateMachine = alarmStateMachine;
        this.subscriptionMultiplexer = subscriptionMultiplexer;
        this.instrumentRegistry = instrumentRegistry;
        this.strategyDescriptionParser = strategyDescriptionParser;
        this.strategySyncService = strategySyncService;
        this.eventPublisherHelper = eventPublisherHelper;
        subscriptionMultiplexer.bindQuoteConsumer(this::applyQuote);
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        subscriptionMultiplexer.start();
        running.set(true);
        log.info("Strategy monitor engine started");
    }

    @Override
    public void stop() {
        log.info("Stopping strategy monitor engine...");
        stopped = true;
        try {
            subscriptionMultiplexer.stop();
            strategySyncService.shutdown();
            log.info("Strategy monitor engine stopped ({} strategies in memory)", strategyStore.size());
        } catch (Exception e) {
            log.error("Error while stopping strategy monitor engine", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    // ========================
    // STRATEGIES
    // ========================

    /**
     * Creates a strategy with optional initial legs. Legs with a ticker are registered with
     * the multiplexer; the strategy starts price-incomplete.
     */
    public StrategySnapshot createStrategy(
            String name, BigDecimal targetPrice, TargetCondition targetCondition, List<LegSpec> legSpecs) {
        ensureRunning("createStrategy");
        if (name == null || name.isBlank()) {
            throw new ValidationException("Strategy name must not be blank");
        }
        List<LegSpec> specs = legSpecs != null ? legSpecs : List.of();
        List<Optional<Ticker>> tickers = new ArrayList<>(specs.size());
        for (LegSpec spec : specs) {
            validateQuantity(spec.quantity());
            tickers.add(instrumentRegistry.normalize(spec.ticker()));
        }

        Instant now = Instant.now();
        Strategy strategy = Strategy.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .targetPrice(targetPrice)
                .targetCondition(targetCondition != null ? targetCondition : TargetCondition.BELOW)
                .createdAt(now)
                .updatedAt(now)
                .build();

        ReadWriteLock lock = new ReentrantReadWriteLock();
        strategyLocks.put(strategy.getId(), lock);
        lock.writeLock().lock();
        try {
            for (int i = 0; i < specs.size(); i++) {
                LegSpec spec = specs.get(i);
                strategy.getLegs().add(newLeg(strategy.getId(), tickers.get(i).orElse(null), spec.side(), spec.quantity()));
            }
            strategyStore.put(strategy);
            strategy.getLegs().forEach(this::registerLeg);
            alarmStateMachine.create(strategy.getId());
            pricingEngine.recompute(strategy);

            log.info("Created strategy '{}' ({}) with {} legs", strategy.getName(), strategy.getId(), specs.size());
            eventPublisherHelper.publishStrategyChanged(this, strategy, ChangeType.CREATED);
            return StrategySnapshot.of(strategy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Parses a free-text description and creates the strategy through the same path as
     * manual creation. The description's strategy column becomes the name.
     */
    public StrategySnapshot createStrategyFromDescription(
            String description, BigDecimal targetPrice, TargetCondition targetCondition) {
        ensureRunning("createStrategyFromDescription");
        ParsedStrategy parsed = strategyDescriptionParser.parse(description);
        List<LegSpec> specs = parsed.legs().stream()
                .map(leg -> new LegSpec(leg.ticker(), leg.side(), leg.quantity()))
                .toList();
        return createStrategy(parsed.name(), targetPrice, targetCondition, specs);
    }

    public StrategySnapshot renameStrategy(String strategyId, String name) {
        ensureRunning("renameStrategy");
        if (name == null || name.isBlank()) {
            throw new ValidationException("Strategy name must not be blank");
        }
        return withWriteLock(strategyId, strategy -> {
            strategy.setName(name.trim());
            return structuralChange(strategy);
        });
    }

    /**
     * Sets the target price and condition. A null condition keeps the current one; a null
     * price clears the target, which disarms the alarm.
     */
    public StrategySnapshot updateTarget(String strategyId, BigDecimal targetPrice, TargetCondition targetCondition) {
        ensureRunning("updateTarget");
        return withWriteLock(strategyId, strategy -> {
            strategy.setTargetPrice(targetPrice);
            if (targetCondition != null) {
                strategy.setTargetCondition(targetCondition);
            }
            alarmStateMachine.onTargetChanged(strategy);
            return structuralChange(strategy);
        });
    }

    public StrategySnapshot updateStatus(String strategyId, StrategyStatus status) {
        ensureRunning("updateStatus");
        if (status == null) {
            throw new ValidationException("Status must not be null");
        }
        return withWriteLock(strategyId, strategy -> {
            if (strategy.getStatus() == status) {
                return StrategySnapshot.of(strategy);
            }
            StrategyStatus previous = strategy.getStatus();
            strategy.setStatus(status);
            alarmStateMachine.onStatusChanged(strategy);
            log.info("Strategy '{}' status {} -> {}", strategy.getName(), previous, status);
            return structuralChange(strategy);
        });
    }

    /** Re-arms the alarm after it fired. The next qualifying recompute fires REACHED again. */
    public StrategySnapshot continueAlarm(String strategyId) {
        ensureRunning("continueAlarm");
        return withWriteLock(strategyId, strategy -> {
            alarmStateMachine.rearm(strategyId);
            log.debug("Alarm re-armed for strategy '{}'", strategy.getName());
            return StrategySnapshot.of(strategy);
        });
    }

    /** Removes the strategy, releasing every leg's subscription interest. */
    public void removeStrategy(String strategyId) {
        ensureRunning("removeStrategy");
        withWriteLock(strategyId, strategy -> {
            strategy.getLegs().forEach(this::unregisterLeg);
            strategyStore.remove(strategyId);
            alarmStateMachine.destroy(strategyId);
            log.info("Removed strategy '{}' ({})", strategy.getName(), strategyId);
            eventPublisherHelper.publishStrategyDeleted(this, strategyId);
            return null;
        });
        strategyLocks.remove(strategyId);
    }

    // ========================
    // LEGS
    // ========================

    public StrategySnapshot.LegSnapshot createLeg(String strategyId, LegSpec spec) {
        ensureRunning("createLeg");
        validateQuantity(spec.quantity());
        Ticker ticker = instrumentRegistry.normalize(spec.ticker()).orElse(null);
        return withWriteLock(strategyId, strategy -> {
            Leg leg = newLeg(strategyId, ticker, spec.side(), spec.quantity());
            strategy.getLegs().add(leg);
            strategyStore.indexLeg(leg);
            registerLeg(leg);
            reprice(strategy);
            structuralChange(strategy);
            return StrategySnapshot.LegSnapshot.of(leg);
        });
    }

    /**
     * Points a leg at a different instrument. Blank text clears the ticker. The old
     * snapshot is discarded, so the strategy is incomplete until the new ticker quotes.
     */
    public StrategySnapshot updateLegTicker(String strategyId, String legId, String rawTicker) {
        ensureRunning("updateLegTicker");
        Ticker ticker = instrumentRegistry.normalize(rawTicker).orElse(null);
        return withWriteLock(strategyId, strategy -> {
            Leg leg = findLeg(strategy, legId);
            if (ticker != null && ticker.equals(leg.getTicker())) {
                return StrategySnapshot.of(strategy);
            }
            unregisterLeg(leg);
            leg.setTicker(ticker);
            leg.setQuote(QuoteSnapshot.EMPTY);
            leg.setLastUpdate(null);
            registerLeg(leg);
            reprice(strategy);
            return structuralChange(strategy);
        });
    }

    /** Changes side and/or quantity; null arguments keep the current value. */
    public StrategySnapshot updateLeg(String strategyId, String legId, LegSide side, Integer quantity) {
        ensureRunning("updateLeg");
        if (quantity != null) {
            validateQuantity(quantity);
        }
        return withWriteLock(strategyId, strategy -> {
            Leg leg = findLeg(strategy, legId);
            if (side != null) {
                leg.setSide(side);
            }
            if (quantity != null) {
                leg.setQuantity(quantity);
            }
            reprice(strategy);
            return structuralChange(strategy);
        });
    }

    public StrategySnapshot removeLeg(String strategyId, String legId) {
        ensureRunning("removeLeg");
        return withWriteLock(strategyId, strategy -> {
            Leg leg = findLeg(strategy, legId);
            unregisterLeg(leg);
            strategy.getLegs().remove(leg);
            strategyStore.unindexLeg(legId);
            reprice(strategy);
            return structuralChange(strategy);
        });
    }

    // ========================
    // QUOTES
    // ========================

    /**
     * Merges a routed quote into the leg, recomputes its strategy and evaluates the alarm.
     * Quotes for legs that no longer exist are dropped; this happens when a leg is removed
     * while its quote is in flight.
     *
     * @return the price change, or empty if the quote was dropped
     */
    public Optional<PriceUpdate> applyQuote(String legId, QuoteSnapshot snapshot) {
        if (stopped) {
            return Optional.empty();
        }
        Optional<String> strategyId = strategyStore.findStrategyIdForLeg(legId);
        if (strategyId.isEmpty()) {
            log.debug("Dropping quote for unknown leg {}", legId);
            return Optional.empty();
        }
        ReadWriteLock lock = strategyLocks.get(strategyId.get());
        if (lock == null) {
            return Optional.empty();
        }

        lock.writeLock().lock();
        try {
            Optional<Strategy> strategy = strategyStore.find(strategyId.get());
            Optional<Leg> leg = strategy.flatMap(s -> s.findLeg(legId));
            if (leg.isEmpty()) {
                log.debug("Dropping quote for leg {} removed in flight", legId);
                return Optional.empty();
            }
            PriceUpdate update = pricingEngine.applyQuote(strategy.get(), leg.get(), snapshot, Instant.now());
            afterRecompute(strategy.get(), update);
            return Optional.of(update);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public StrategySnapshot getStrategy(String strategyId) {
        ReadWriteLock lock = lockFor(strategyId);
        lock.readLock().lock();
        try {
            return StrategySnapshot.of(getOrThrow(strategyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshots of all strategies, oldest first. */
    public List<StrategySnapshot> listStrategies() {
        List<StrategySnapshot> result = new ArrayList<>();
        for (Strategy strategy : strategyStore.findAll()) {
            ReadWriteLock lock = strategyLocks.get(strategy.getId());
            if (lock == null) {
                continue;
            }
            lock.readLock().lock();
            try {
                if (strategyStore.find(strategy.getId()).isPresent()) {
                    result.add(StrategySnapshot.of(strategy));
                }
            } finally {
                lock.readLock().unlock();
            }
        }
        return result;
    }

    public int strategyCount() {
        return strategyStore.size();
    }

    // ========================
    // INTERNALS
    // ========================

    private Leg newLeg(String strategyId, Ticker ticker, LegSide side, int quantity) {
        return Leg.builder()
                .id(UUID.randomUUID().toString())
                .strategyId(strategyId)
                .ticker(ticker)
                .side(side != null ? side : LegSide.LONG)
                .quantity(quantity)
                .build();
    }

    private void registerLeg(Leg leg) {
        if (leg.getTicker() != null) {
            subscriptionMultiplexer.register(leg.getId(), leg.getTicker());
        }
    }

    private void unregisterLeg(Leg leg) {
        if (leg.getTicker() != null) {
            subscriptionMultiplexer.unregister(leg.getId(), leg.getTicker());
        }
    }

    private void reprice(Strategy strategy) {
        afterRecompute(strategy, pricingEngine.recompute(strategy));
    }

    private void afterRecompute(Strategy strategy, PriceUpdate update) {
        if (update.changed()) {
            eventPublisherHelper.publishPriceChanged(this, strategy.getId(), update.current());
        }
        alarmStateMachine.evaluate(strategy);
    }

    private StrategySnapshot structuralChange(Strategy strategy) {
        strategy.setUpdatedAt(Instant.now());
        eventPublisherHelper.publishStrategyChanged(this, strategy, ChangeType.UPDATED);
        return StrategySnapshot.of(strategy);
    }

    private <T> T withWriteLock(String strategyId, Function<Strategy, T> action) {
        ReadWriteLock lock = lockFor(strategyId);
        lock.writeLock().lock();
        try {
            // Re-read under the lock: a concurrent removal may have won the race
            return action.apply(getOrThrow(strategyId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ReadWriteLock lockFor(String strategyId) {
        ReadWriteLock lock = strategyLocks.get(strategyId);
        if (lock == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        return lock;
    }

    private Strategy getOrThrow(String strategyId) {
        return strategyStore.find(strategyId).orElseThrow(() -> new ResourceNotFoundException("Strategy", strategyId));
    }

    private Leg findLeg(Strategy strategy, String legId) {
        return strategy.findLeg(legId).orElseThrow(() -> new ResourceNotFoundException("Leg", legId));
    }

    private void validateQuantity(int quantity) {
        if (quantity < 1) {
            throw new ValidationException("Leg quantity must be positive, got " + quantity);
        }
    }

    private void ensureRunning(String operation) {
        if (stopped) {
            throw new EngineStoppedException(operation);
        }
    }
}
