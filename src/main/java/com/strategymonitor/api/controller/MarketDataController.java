package com.strategymonitor.api.controller;

import com.strategymonitor.instrument.InstrumentRegistry;
import com.strategymonitor.marketdata.SubscriptionDiagnostics;
import com.strategymonitor.marketdata.SubscriptionMultiplexer;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Market-data diagnostics.
 *
 * <ul>
 *   <li>GET /api/market-data/subscriptions -- refcounts, issued and failed subscriptions, quote counters</li>
 *   <li>GET /api/market-data/normalize?ticker=... -- canonical form of a ticker</li>
 *   <li>POST /api/market-data/resubscribe -- re-issue every subscription after a session loss</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final SubscriptionMultiplexer subscriptionMultiplexer;
    private final InstrumentRegistry instrumentRegistry;

    public MarketDataController(
            SubscriptionMultiplexer subscriptionMultiplexer, InstrumentRegistry instrumentRegistry) {
        this.subscriptionMultiplexer = subscriptionMultiplexer;
        this.instrumentRegistry = instrumentRegistry;
    }

    @GetMapping("/subscriptions")
    public ResponseEntity<SubscriptionDiagnostics> getSubscriptions() {
        return ResponseEntity.ok(subscriptionMultiplexer.diagnostics());
    }

    @GetMapping("/normalize")
    public ResponseEntity<Map<String, String>> normalize(@RequestParam String ticker) {
        return ResponseEntity.ok(Map.of("input", ticker, "ticker", instrumentRegistry.canonical(ticker).value()));
    }

    @PostMapping("/resubscribe")
    public ResponseEntity<Map<String, Object>> resubscribe() {
        subscriptionMultiplexer.start();
        return ResponseEntity.ok(Map.of(
                "message", "Resubscription queued", "tickers", subscriptionMultiplexer.diagnostics().refCounts().size()));
    }
}
