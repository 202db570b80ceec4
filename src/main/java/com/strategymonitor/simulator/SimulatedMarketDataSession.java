package com.strategymonitor.simulator;

import com.strategymonitor.config.MonitorProperties;
import com.strategymonitor.marketdata.MarketDataListener;
import com.strategymonitor.marketdata.MarketDataSession;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Market-data session that needs no vendor terminal.
 *
 * <p>Each subscribed ticker gets a base price drawn from [90, 110]. Every interval the
 * session walks every price by up to +/-0.5 and emits last with a bid/ask 0.01-0.05
 * either side. Subscriptions are acknowledged on the session thread before the next
 * burst, so listeners see callbacks from a thread other than the caller's, like a real
 * provider.
 */
@Component
@ConditionalOnProperty(
        prefix = "strategy-monitor.market-data",
        name = "provider",
        havingValue = "simulated",
        matchIfMissing = true)
public class SimulatedMarketDataSession implements MarketDataSession {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataSession.class);

    private static final double MIN_BASE = 90.0;
    private static final double MAX_BASE = 110.0;
    private static final double MAX_STEP = 0.5;
    private static final double MIN_HALF_SPREAD = 0.01;
    private static final double MAX_HALF_SPREAD = 0.05;

    private final long intervalMs;

    /** Ticker -> current simulated last price. */
    private final Map<String, Double> prices = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> burstTask;
    private volatile MarketDataListener listener;

    public SimulatedMarketDataSession(MonitorProperties monitorProperties) {
        this.intervalMs = monitorProperties.getMarketData().getSimulatedIntervalMs();
    }

    @Override
    public synchronized void start(MarketDataListener listener) {
        if (scheduler != null) {
            log.debug("Simulated session already running");
            this.listener = listener;
            return;
        }
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "simulated-market-data");
            thread.setDaemon(true);
            return thread;
        });
        this.burstTask = scheduler.scheduleAtFixedRate(this::emitBurst, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Simulated market data session started (interval {} ms)", intervalMs);
    }

    @Override
    public void subscribe(Collection<String> tickers) {
        ScheduledExecutorService current = requireRunning();
        List<String> copy = new ArrayList<>(tickers);
        current.execute(() -> {
            for (String ticker : copy) {
                prices.computeIfAbsent(ticker, t -> ThreadLocalRandom.current().nextDouble(MIN_BASE, MAX_BASE));
                listener.onSubscriptionStarted(ticker);
            }
        });
    }

    @Override
    public void unsubscribe(Collection<String> tickers) {
        ScheduledExecutorService current = requireRunning();
        List<String> copy = new ArrayList<>(tickers);
        current.execute(() -> copy.forEach(prices::remove));
    }

    @Override
    public boolean isConnected() {
        ScheduledExecutorService current = scheduler;
        return current != null && !current.isShutdown();
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        if (burstTask != null) {
            burstTask.cancel(false);
        }
        scheduler.shutdownNow();
        scheduler = null;
        prices.clear();
        log.info("Simulated market data session closed");
    }

    /** Number of tickers currently being simulated. */
    public int simulatedTickerCount() {
        return prices.size();
    }

    private void emitBurst() {
        MarketDataListener current = listener;
        if (current == null) {
            return;
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (Map.Entry<String, Double> entry : prices.entrySet()) {
            double last = Math.max(0.0, entry.getValue() + random.nextDouble(-MAX_STEP, MAX_STEP));
            double bid = Math.max(0.0, last - random.nextDouble(MIN_HALF_SPREAD, MAX_HALF_SPREAD));
            double ask = last + random.nextDouble(MIN_HALF_SPREAD, MAX_HALF_SPREAD);
            entry.setValue(last);
            try {
                current.onQuote(entry.getKey(), last, bid, ask);
            } catch (RuntimeException e) {
                log.error("Listener failed on simulated quote for {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
    }

    private ScheduledExecutorService requireRunning() {
        ScheduledExecutorService current = scheduler;
        if (current == null) {
            throw new IllegalStateException("Simulated session is not started");
        }
        return current;
    }
}
