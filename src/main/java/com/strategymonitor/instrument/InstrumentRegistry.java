package com.strategymonitor.instrument;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.strategymonitor.config.MonitorProperties;
import com.strategymonitor.domain.model.Ticker;
import com.strategymonitor.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Identity and normalization of instrument ticker strings.
 *
 * <p>Normalization rules, applied in order:
 * <ol>
 *   <li>trim and collapse internal whitespace runs to one space</li>
 *   <li>upper-case</li>
 *   <li>if the last token is a known market-sector spelling ("Comdty", "CMDTY", "commodity"),
 *       replace it with the canonical sector</li>
 *   <li>otherwise append the default sector</li>
 * </ol>
 *
 * <p>So {@code "  sfrh6c  98.00 comdty"}, {@code "SFRH6C 98.00 Commodity"} and
 * {@code "sfrh6c 98.00"} all normalize to {@code SFRH6C 98.00 COMDTY}.
 *
 * <p>Two Caffeine caches give O(1) lookups after the first sighting of a raw string:
 * <ul>
 *   <li>{@code rawCache} -- raw input -> canonical ticker (feed callbacks repeat the same strings)</li>
 *   <li>{@code canonicalCache} -- canonical string -> the shared {@link Ticker} instance</li>
 * </ul>
 * Both are bounded by {@code strategy-monitor.instruments.cache-maximum-size}, since raw
 * strings come from the feed and from REST callers. An evicted ticker is rebuilt on its
 * next sighting; tickers compare by value, so an evicted instance stays valid.
 */
@Service
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final String defaultSector;

    /** Upper-case spelling -> canonical sector. */
    private final Map<String, String> sectorBySpelling = new ConcurrentHashMap<>();

    private final Cache<String, Ticker> rawCache;
    private final Cache<String, Ticker> canonicalCache;

    public InstrumentRegistry(MonitorProperties monitorProperties) {
        MonitorProperties.Instruments instruments = monitorProperties.getInstruments();
        this.defaultSector = upper(instruments.getDefaultMarketSector());
        instruments.getSectorSynonyms().forEach((sector, spellings) -> {
            String canonical = upper(sector);
            sectorBySpelling.put(canonical, canonical);
            spellings.forEach(spelling -> sectorBySpelling.put(upper(spelling), canonical));
        });
        long maximumSize = instruments.getCacheMaximumSize();
        this.rawCache = Caffeine.newBuilder().maximumSize(maximumSize).build();
        this.canonicalCache = Caffeine.newBuilder().maximumSize(maximumSize).build();
        log.info(
                "Instrument registry ready: defaultSector={}, {} sector spellings, cache size {}",
                defaultSector,
                sectorBySpelling.size(),
                maximumSize);
    }

    /**
     * Returns the canonical ticker for {@code raw}.
     *
     * @throws ValidationException if the text is blank or consists only of a sector token
     */
    public Ticker canonical(String raw) {
        return normalize(raw).orElseThrow(() -> new ValidationException("Ticker must not be blank"));
    }

    /**
     * Lenient form of {@link #canonical(String)}: blank or null input yields empty.
     * Used where a leg legitimately has no instrument yet.
     */
    public Optional<Ticker> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Ticker cached = rawCache.getIfPresent(raw);
        if (cached != null) {
            return Optional.of(cached);
        }

        String canonical = canonicalString(raw);
        Ticker ticker = canonicalCache.get(canonical, Ticker::new);
        rawCache.put(raw, ticker);
        return Optional.of(ticker);
    }

    /** True if the two strings denote the same instrument. Blank strings equal nothing. */
    public boolean sameInstrument(String first, String second) {
        Optional<Ticker> a = normalize(first);
        return a.isPresent() && a.equals(normalize(second));
    }

    /** Number of canonical tickers currently cached. Never exceeds the configured maximum. */
    public long knownInstrumentCount() {
        canonicalCache.cleanUp();
        return canonicalCache.estimatedSize();
    }

    /** Number of raw spellings currently cached. */
    public long cachedSpellingCount() {
        rawCache.cleanUp();
        return rawCache.estimatedSize();
    }

    private String canonicalString(String raw) {
        List<String> tokens =
                new ArrayList<>(Arrays.asList(raw.trim().toUpperCase(Locale.ROOT).split("\\s+")));

        String last = tokens.get(tokens.size() - 1);
        String sector = sectorBySpelling.get(last);
        if (sector != null) {
            if (tokens.size() == 1) {
                throw new ValidationException("Ticker '" + raw + "' has a market sector but no instrument");
            }
            tokens.set(tokens.size() - 1, sector);
        } else if (!defaultSector.isEmpty()) {
            tokens.add(defaultSector);
        }
        return String.join(" ", tokens);
    }

    private static String upper(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}
