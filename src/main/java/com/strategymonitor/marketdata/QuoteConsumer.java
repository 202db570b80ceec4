package com.strategymonitor.marketdata;

import com.strategymonitor.domain.model.QuoteSnapshot;

/** Receives one routed quote per interested leg. */
@FunctionalInterface
public interface QuoteConsumer {

    void accept(String legId, QuoteSnapshot snapshot);
}
