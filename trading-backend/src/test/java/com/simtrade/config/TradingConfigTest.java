package com.simtrade.config;

import com.simtrade.core.config.ConfigSource;
import com.simtrade.trading.TradeLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TradingConfig Tests")
class TradingConfigTest {

    private static final double DELTA = 0.0001;

    @Test
    @DisplayName("Defaults match the game's trading rules")
    void testDefaults() {
        var config = new TradingConfig(ConfigSource.of(new Properties()));

        assertEquals(1000.0, config.initialCash(), DELTA);
        assertEquals(TradeLimits.DEFAULTS, config.tradeLimits());
        assertEquals(8080, config.serverPort());
        assertTrue(config.backendSyncEnabled());
        assertFalse(config.auditEnabled());
        assertEquals(Duration.ofSeconds(1), config.syncBackoff());
        assertNotNull(config.marketData());
    }

    @Test
    @DisplayName("Environment overrides the file")
    void testOverrides() {
        var props = new Properties();
        props.setProperty("INITIAL_CASH", "5000");
        props.setProperty("TRADE_FEE_RATE", "0.002");

        var config = new TradingConfig(new ConfigSource(props, Map.of("INITIAL_CASH", "250")));

        assertEquals(250.0, config.initialCash(), DELTA);
        assertEquals(0.002, config.tradeLimits().feeRate(), DELTA);
    }

    @Test
    @DisplayName("Negative cash fails validation")
    void testNegativeCash() {
        var props = new Properties();
        props.setProperty("INITIAL_CASH", "-1");

        var ex = assertThrows(IllegalStateException.class, () -> new TradingConfig(ConfigSource.of(props)));
        assertTrue(ex.getMessage().contains("Initial cash cannot be negative"));
    }

    @Test
    @DisplayName("Audit recorder needs a URL when enabled")
    void testAuditRequiresUrl() {
        var props = new Properties();
        props.setProperty("AUDIT_RECORDER_ENABLED", "true");

        assertThrows(IllegalStateException.class, () -> new TradingConfig(ConfigSource.of(props)));

        props.setProperty("AUDIT_RECORDER_URL", "http://audit.local");
        assertTrue(new TradingConfig(ConfigSource.of(props)).auditEnabled());
    }

    @Test
    @DisplayName("Maximum below minimum is rejected")
    void testLimitOrdering() {
        var props = new Properties();
        props.setProperty("TRADE_MIN_SHARES", "10");
        props.setProperty("TRADE_MAX_SHARES", "5");

        assertThrows(IllegalStateException.class, () -> new TradingConfig(ConfigSource.of(props)));
    }
}
