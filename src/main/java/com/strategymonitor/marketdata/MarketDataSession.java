package com.strategymonitor.marketdata;

import java.util.Collection;

/**
 * Connection to an external market-data provider.
 *
 * <p>Implementations deliver all callbacks to the {@link MarketDataListener} on their own
 * thread. {@link #subscribe} and {@link #unsubscribe} must not block on the provider's
 * round-trip for long; results come back through the listener.
 */
public interface MarketDataSession {

    /** Opens the session. Callbacks go to {@code listener} from now on. */
    void start(MarketDataListener listener);

    /** Requests streaming quotes for the given canonical ticker strings. */
    void subscribe(Collection<String> tickers);

    void unsubscribe(Collection<String> tickers);

    boolean isConnected();

    /** Releases the session handle. No callbacks are delivered afterwards. */
    void close();
}
