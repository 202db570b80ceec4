package com.strategymonitor.marketdata;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of the multiplexer for the diagnostics endpoint.
 *
 * @param refCounts          canonical ticker -> number of interested legs
 * @param activeTickers      tickers with an issued subscription
 * @param failedTickers      tickers whose last subscription attempt failed
 * @param pendingAdds        subscribes waiting for the next flush
 * @param pendingRemoves     unsubscribes waiting for the next flush
 * @param routedQuotes       quotes delivered to legs since start
 * @param droppedQuotes      quotes for tickers with no interested leg
 * @param connected          whether the session reports a live connection
 */
public record SubscriptionDiagnostics(
        Map<String, Integer> refCounts,
        List<String> activeTickers,
        Set<String> failedTickers,
        int pendingAdds,
        int pendingRemoves,
        long routedQuotes,
        long droppedQuotes,
        boolean connected) {}
