package com.strategymonitor.unit.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.strategymonitor.config.MonitorProperties;
import com.strategymonitor.domain.model.Ticker;
import com.strategymonitor.exception.ValidationException;
import com.strategymonitor.instrument.InstrumentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for InstrumentRegistry: case and whitespace folding, sector synonyms,
 * default sector, and the shared canonical instances.
 */
class InstrumentRegistryTest {

    private InstrumentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InstrumentRegistry(new MonitorProperties());
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Case, whitespace and sector spelling collapse to one canonical ticker")
        void spellingsCollapse() {
            Ticker a = registry.canonical("  sfrh6c  98.00 comdty");
            Ticker b = registry.canonical("SFRH6C 98.00 Commodity");
            Ticker c = registry.canonical("sfrh6c 98.00");

            assertThat(a.value()).isEqualTo("SFRH6C 98.00 COMDTY");
            assertThat(b).isEqualTo(a);
            assertThat(c).isEqualTo(a);
        }

        @Test
        @DisplayName("Non-default sector is kept and canonicalized")
        void otherSectorKept() {
            assertThat(registry.canonical("aapl us eqy").value()).isEqualTo("AAPL US EQUITY");
        }

        @Test
        @DisplayName("Equal canonical strings share one instance")
        void sharedInstance() {
            Ticker a = registry.canonical("SFRH6C 98.00 COMDTY");
            Ticker b = registry.canonical("sfrh6c   98.00   cmdty");

            assertThat(b).isSameAs(a);
            assertThat(registry.knownInstrumentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Blank input normalizes to empty")
        void blankIsEmpty() {
            assertThat(registry.normalize(null)).isEmpty();
            assertThat(registry.normalize("   ")).isEmpty();
        }

        @Test
        @DisplayName("canonical rejects blank input")
        void canonicalRejectsBlank() {
            assertThatThrownBy(() -> registry.canonical(" "))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("A lone sector token is not an instrument")
        void sectorOnlyRejected() {
            assertThatThrownBy(() -> registry.canonical("Comdty"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("no instrument");
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Empty default sector leaves bare tickers untouched")
        void noDefaultSector() {
            MonitorProperties properties = new MonitorProperties();
            properties.getInstruments().setDefaultMarketSector("");
            InstrumentRegistry bare = new InstrumentRegistry(properties);

            assertThat(bare.canonical("sfrh6c 98.00").value()).isEqualTo("SFRH6C 98.00");
        }

        @Test
        @DisplayName("Caches stay within the configured size under many distinct spellings")
        void cachesBounded() {
            MonitorProperties properties = new MonitorProperties();
            properties.getInstruments().setCacheMaximumSize(100);
            InstrumentRegistry bounded = new InstrumentRegistry(properties);

            for (int i = 0; i < 5_000; i++) {
                bounded.normalize("JUNK" + i);
            }

            assertThat(bounded.knownInstrumentCount()).isLessThanOrEqualTo(100);
            assertThat(bounded.cachedSpellingCount()).isLessThanOrEqualTo(100);
            assertThat(bounded.canonical("junk4999").value()).isEqualTo("JUNK4999 COMDTY");
        }
    }

    @Test
    @DisplayName("sameInstrument compares canonical forms; blank equals nothing")
    void sameInstrument() {
        assertThat(registry.sameInstrument("SFRH6C 98.00", "sfrh6c 98.00 comdty")).isTrue();
        assertThat(registry.sameInstrument("SFRH6C 98.00", "SFRH6C 98.25")).isFalse();
        assertThat(registry.sameInstrument("", "")).isFalse();
    }
}
