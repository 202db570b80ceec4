package com.strategymonitor.marketdata;

/**
 * Callbacks from a {@link MarketDataSession}. No ordering is guaranteed between
 * {@link #onSubscriptionStarted} and the first {@link #onQuote} for the same ticker.
 */
public interface MarketDataListener {

    /**
     * A quote update. Fields the provider did not send (or sent as "no value") are
     * negative or NaN.
     */
    void onQuote(String ticker, double last, double bid, double ask);

    void onSubscriptionStarted(String ticker);

    void onSubscriptionFailed(String ticker, String reason);

    /** The provider dropped the session; every outstanding subscription is gone. */
    void onSessionTerminated();
}
