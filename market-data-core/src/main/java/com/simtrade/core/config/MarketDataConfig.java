package com.simtrade.core.config;

import com.simtrade.core.api.AlphaVantageQuoteProvider;
import com.simtrade.core.api.CoinGeckoQuoteProvider;
import com.simtrade.core.api.KrakenTickerQuoteProvider;
import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.api.ResilienceSettings;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Market data settings: cache lifetimes, rate budgets, retry policy and upstream endpoints.
 *
 * Per-provider rate budgets are read from {@code RATE_LIMIT_<PROVIDER>_CALLS} and
 * {@code RATE_LIMIT_<PROVIDER>_SPACING_MS}, falling back to the defaults.
 */
public final class MarketDataConfig {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataConfig.class);

    public static final List<String> DEFAULT_PROVIDER_ORDER =
        List.of(CoinGeckoQuoteProvider.ID, KrakenTickerQuoteProvider.ID, AlphaVantageQuoteProvider.ID);

    @Positive(message = "Memory cache TTL must be positive")
    private final long memoryTtlSeconds;

    @Positive(message = "Snapshot cache TTL must be positive")
    private final long snapshotTtlSeconds;

    @Positive(message = "Store cache TTL must be positive")
    private final long storeTtlSeconds;

    @Positive
    private final long sweepIntervalSeconds;

    @Positive
    private final long rateWindowSeconds;

    @Min(value = 0, message = "Calls per window cannot be negative")
    private final int defaultCallsPerWindow;

    @Min(value = 0, message = "Minimum call spacing cannot be negative")
    private final long defaultMinSpacingMs;

    private final Map<String, RateGovernor.Limits> providerLimits;

    @Positive
    private final long adapterCacheTtlSeconds;

    @Positive(message = "Request timeout must be positive")
    private final long requestTimeoutSeconds;

    @Min(1)
    @Max(10)
    private final int retryMaxAttempts;

    @Positive
    private final long retryInitialBackoffMs;

    @DecimalMin("1.0")
    private final double retryMultiplier;

    @Positive
    private final long retryMaxBackoffMs;

    @DecimalMin("0.0")
    @DecimalMax("0.99")
    private final double retryJitter;

    @Positive
    private final long breakerWaitSeconds;

    @Min(1)
    @Max(250)
    private final int maxSymbolsPerBatch;

    @NotEmpty(message = "At least one quote provider is required")
    private final List<String> providerOrder;

    @NotBlank
    private final String coinGeckoBaseUrl;

    @NotBlank
    private final String krakenBaseUrl;

    @NotBlank
    private final String alphaVantageBaseUrl;

    private final String alphaVantageApiKey;

    @NotBlank
    private final String snapshotFile;

    @NotBlank
    private final String storeFile;

    public MarketDataConfig(ConfigSource source) {
        this.memoryTtlSeconds = source.getLong("MARKET_MEMORY_TTL_SECONDS", 5 * 60);
        this.snapshotTtlSeconds = source.getLong("MARKET_SNAPSHOT_TTL_SECONDS", 30 * 60);
        this.storeTtlSeconds = source.getLong("MARKET_STORE_TTL_SECONDS", 60 * 60);
        this.sweepIntervalSeconds = source.getLong("MARKET_SWEEP_INTERVAL_SECONDS", 60);

        this.rateWindowSeconds = source.getLong("RATE_WINDOW_SECONDS", 60);
        this.defaultCallsPerWindow = source.getInt("RATE_LIMIT_CALLS_PER_WINDOW", 5);
        this.defaultMinSpacingMs = source.getLong("RATE_LIMIT_MIN_SPACING_MS", 2000);

        this.adapterCacheTtlSeconds = source.getLong("PROVIDER_CACHE_TTL_SECONDS", 30);
        this.requestTimeoutSeconds = source.getLong("PROVIDER_REQUEST_TIMEOUT_SECONDS", 10);
        this.retryMaxAttempts = source.getInt("PROVIDER_RETRY_MAX_ATTEMPTS", 3);
        this.retryInitialBackoffMs = source.getLong("PROVIDER_RETRY_INITIAL_BACKOFF_MS", 1000);
        this.retryMultiplier = source.getDouble("PROVIDER_RETRY_MULTIPLIER", 2.0);
        this.retryMaxBackoffMs = source.getLong("PROVIDER_RETRY_MAX_BACKOFF_MS", 8000);
        this.retryJitter = source.getDouble("PROVIDER_RETRY_JITTER", 0.2);
        this.breakerWaitSeconds = source.getLong("PROVIDER_BREAKER_WAIT_SECONDS", 30);
        this.maxSymbolsPerBatch = source.getInt("MARKET_MAX_SYMBOLS_PER_BATCH", 20);

        this.providerOrder = source.getList("MARKET_PROVIDERS", DEFAULT_PROVIDER_ORDER).stream()
            .map(id -> id.toLowerCase(Locale.ROOT))
            .toList();
        this.coinGeckoBaseUrl = source.getString("COINGECKO_BASE_URL", CoinGeckoQuoteProvider.DEFAULT_BASE_URL);
        this.krakenBaseUrl = source.getString("KRAKEN_BASE_URL", KrakenTickerQuoteProvider.DEFAULT_BASE_URL);
        this.alphaVantageBaseUrl = source.getString("ALPHA_VANTAGE_BASE_URL", AlphaVantageQuoteProvider.DEFAULT_BASE_URL);
        this.alphaVantageApiKey = source.getString("ALPHA_VANTAGE_API_KEY", "");

        this.snapshotFile = source.getString("MARKET_SNAPSHOT_FILE", "data/quote-snapshot.json");
        this.storeFile = source.getString("MARKET_STORE_FILE", "data/quotes.db");

        var limits = new HashMap<String, RateGovernor.Limits>();
        for (String providerId : providerOrder) {
            String prefix = "RATE_LIMIT_" + providerId.toUpperCase(Locale.ROOT);
            if (source.get(prefix + "_CALLS").isPresent() || source.get(prefix + "_SPACING_MS").isPresent()) {
                limits.put(providerId, new RateGovernor.Limits(
                    Math.max(0, source.getInt(prefix + "_CALLS", defaultCallsPerWindow)),
                    Duration.ofMillis(Math.max(0, source.getLong(prefix + "_SPACING_MS", defaultMinSpacingMs)))));
            }
        }
        this.providerLimits = Map.copyOf(limits);

        validate();

        logger.info("📈 Market Data Configuration Loaded:");
        logger.info("   Providers: {}", providerOrder);
        logger.info("   Cache TTLs: memory {}s, snapshot {}s, store {}s",
            memoryTtlSeconds, snapshotTtlSeconds, storeTtlSeconds);
        logger.info("   Rate budget: {} calls / {}s, {}ms spacing ({} overrides)",
            defaultCallsPerWindow, rateWindowSeconds, defaultMinSpacingMs, providerLimits.size());
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    private void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
            throw new IllegalStateException(
                "Market data configuration validation failed: " + String.join(", ", errorMessages));
        }
        if (retryMaxBackoffMs < retryInitialBackoffMs) {
            throw new IllegalStateException(
                "Market data configuration validation failed: retryMaxBackoffMs must be >= retryInitialBackoffMs");
        }
    }

    public Duration memoryTtl() {
        return Duration.ofSeconds(memoryTtlSeconds);
    }

    public Duration snapshotTtl() {
        return Duration.ofSeconds(snapshotTtlSeconds);
    }

    public Duration storeTtl() {
        return Duration.ofSeconds(storeTtlSeconds);
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }

    public Duration rateWindow() {
        return Duration.ofSeconds(rateWindowSeconds);
    }

    public RateGovernor.Limits defaultLimits() {
        return new RateGovernor.Limits(defaultCallsPerWindow, Duration.ofMillis(defaultMinSpacingMs));
    }

    public Map<String, RateGovernor.Limits> providerLimits() {
        return providerLimits;
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public ResilienceSettings resilienceSettings() {
        return new ResilienceSettings(
            retryMaxAttempts,
            Duration.ofMillis(retryInitialBackoffMs),
            retryMultiplier,
            Duration.ofMillis(retryMaxBackoffMs),
            retryJitter,
            Duration.ofSeconds(adapterCacheTtlSeconds),
            Duration.ofSeconds(breakerWaitSeconds));
    }

    public int maxSymbolsPerBatch() {
        return maxSymbolsPerBatch;
    }

    public List<String> providerOrder() {
        return providerOrder;
    }

    public String coinGeckoBaseUrl() {
        return coinGeckoBaseUrl;
    }

    public String krakenBaseUrl() {
        return krakenBaseUrl;
    }

    public String alphaVantageBaseUrl() {
        return alphaVantageBaseUrl;
    }

    public String alphaVantageApiKey() {
        return alphaVantageApiKey;
    }

    public Path snapshotFile() {
        return Path.of(snapshotFile);
    }

    public String storeFile() {
        return storeFile;
    }
}
