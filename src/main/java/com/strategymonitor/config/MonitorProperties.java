package com.strategymonitor.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties under the {@code strategy-monitor} prefix.
 *
 * <ul>
 *   <li>{@code market-data} -- which session implementation feeds quotes</li>
 *   <li>{@code instruments} -- ticker normalization rules</li>
 *   <li>{@code sync} -- quiet period for the remote-sync debouncer</li>
 *   <li>{@code async} -- pool sizing for the event executor</li>
 *   <li>{@code cors} -- allowed origin for the STOMP endpoint</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "strategy-monitor")
public class MonitorProperties {

    private MarketData marketData = new MarketData();
    private Instruments instruments = new Instruments();
    private Sync sync = new Sync();
    private Async async = new Async();
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class MarketData {

        /** Session implementation. Only {@code simulated} ships with the service. */
        private String provider = "simulated";

        /** Interval between simulated quote bursts. */
        private long simulatedIntervalMs = 1000;
    }

    @Getter
    @Setter
    public static class Instruments {

        /** Market sector appended when a ticker has none, e.g. "SFRH6C 98.00" -> "... COMDTY". */
        private String defaultMarketSector = "COMDTY";

        /** Canonical sector -> accepted spellings (compared upper-case). */
        private Map<String, List<String>> sectorSynonyms = defaultSynonyms();

        /** Upper bound on cached raw spellings and on cached canonical tickers. */
        private long cacheMaximumSize = 10_000;

        private static Map<String, List<String>> defaultSynonyms() {
            Map<String, List<String>> synonyms = new LinkedHashMap<>();
            synonyms.put("COMDTY", List.of("COMDTY", "CMDTY", "COMDITY", "COMMODITY"));
            synonyms.put("EQUITY", List.of("EQUITY", "EQY", "EQ"));
            synonyms.put("INDEX", List.of("INDEX", "IDX", "INDX"));
            synonyms.put("CURNCY", List.of("CURNCY", "CURRENCY", "CCY"));
            synonyms.put("GOVT", List.of("GOVT", "GOV"));
            return synonyms;
        }
    }

    @Getter
    @Setter
    public static class Sync {

        private boolean enabled = true;

        /** Quiet period before a burst of edits to one strategy is forwarded. */
        private long quietPeriodMs = 500;
    }

    @Getter
    @Setter
    public static class Async {

        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Cors {

        private String allowedOrigin = "*";
    }
}
