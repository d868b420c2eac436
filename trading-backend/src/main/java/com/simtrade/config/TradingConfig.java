package com.simtrade.config;

import com.simtrade.core.config.ConfigSource;
import com.simtrade.core.config.MarketDataConfig;
import com.simtrade.trading.TradeLimits;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Trading engine and server settings, loaded from {@code simtrade.properties}
 * and the environment. All trading parameters should be accessed through this class.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);

    @PositiveOrZero(message = "Initial cash cannot be negative")
    private final double initialCash;

    @Min(value = 1, message = "Minimum shares must be at least 1")
    private final int minShares;

    @Positive
    private final int maxShares;

    @PositiveOrZero
    private final double minAmount;

    @Positive
    private final double maxAmount;

    @Positive
    private final double largeTradeWarning;

    @DecimalMin("0.0")
    @DecimalMax(value = "0.1", message = "Fee rate cannot exceed 10%")
    private final double feeRate;

    @PositiveOrZero
    private final double minFee;

    @NotBlank(message = "Backend base URL is required")
    private final String backendBaseUrl;

    private final boolean backendSyncEnabled;

    private final boolean auditEnabled;

    private final String auditBaseUrl;

    @Min(1)
    @Max(10_000)
    private final int syncQueueCapacity;

    @Min(1)
    @Max(10)
    private final int syncMaxAttempts;

    @Positive
    private final long syncBackoffMs;

    @Positive
    private final long syncTimeoutSeconds;

    @Min(0)
    @Max(65_535)
    private final int serverPort;

    @NotBlank
    private final String journalFile;

    private final MarketDataConfig marketData;

    public TradingConfig(ConfigSource source) {
        this.initialCash = source.getDouble("INITIAL_CASH", 1000.0);
        this.minShares = source.getInt("TRADE_MIN_SHARES", TradeLimits.DEFAULTS.minShares());
        this.maxShares = source.getInt("TRADE_MAX_SHARES", TradeLimits.DEFAULTS.maxShares());
        this.minAmount = source.getDouble("TRADE_MIN_AMOUNT", TradeLimits.DEFAULTS.minAmount());
        this.maxAmount = source.getDouble("TRADE_MAX_AMOUNT", TradeLimits.DEFAULTS.maxAmount());
        this.largeTradeWarning = source.getDouble("TRADE_LARGE_WARNING_AMOUNT", TradeLimits.DEFAULTS.largeTradeWarning());
        this.feeRate = source.getDouble("TRADE_FEE_RATE", TradeLimits.DEFAULTS.feeRate());
        this.minFee = source.getDouble("TRADE_MIN_FEE", TradeLimits.DEFAULTS.minFee());

        this.backendBaseUrl = source.getString("BACKEND_BASE_URL", "http://localhost:8000");
        this.backendSyncEnabled = source.getBoolean("BACKEND_SYNC_ENABLED", true);
        this.auditEnabled = source.getBoolean("AUDIT_RECORDER_ENABLED", false);
        this.auditBaseUrl = source.getString("AUDIT_RECORDER_URL", "");
        this.syncQueueCapacity = source.getInt("SYNC_QUEUE_CAPACITY", 100);
        this.syncMaxAttempts = source.getInt("SYNC_RETRY_MAX_ATTEMPTS", 3);
        this.syncBackoffMs = source.getLong("SYNC_RETRY_BACKOFF_MS", 1000);
        this.syncTimeoutSeconds = source.getLong("SYNC_TIMEOUT_SECONDS", 10);

        this.serverPort = source.getInt("SERVER_PORT", 8080);
        this.journalFile = source.getString("JOURNAL_FILE", "data/journal.db");

        validate();
        this.marketData = new MarketDataConfig(source);

        logger.info("📋 Trading Configuration Loaded:");
        logger.info("   Initial cash: {}", initialCash);
        logger.info("   Shares per order: {}-{}, amount {}-{}", minShares, maxShares, minAmount, maxAmount);
        logger.info("   Fee: {}% (min {})", feeRate * 100, minFee);
        logger.info("   Backend sync: {} ({}), audit: {}", backendSyncEnabled, backendBaseUrl, auditEnabled);
    }

    public static TradingConfig load() {
        return new TradingConfig(ConfigSource.load());
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
                "Trading configuration validation failed: " + String.join(", ", errorMessages));
        }
        if (maxShares < minShares || maxAmount < minAmount) {
            throw new IllegalStateException(
                "Trading configuration validation failed: maximum limits must not be below minimums");
        }
        if (auditEnabled && auditBaseUrl.isBlank()) {
            throw new IllegalStateException(
                "Trading configuration validation failed: AUDIT_RECORDER_URL is required when the audit recorder is enabled");
        }
    }

    public TradeLimits tradeLimits() {
        return new TradeLimits(minShares, maxShares, minAmount, maxAmount, largeTradeWarning, feeRate, minFee);
    }

    public double initialCash() {
        return initialCash;
    }

    public String backendBaseUrl() {
        return backendBaseUrl;
    }

    public boolean backendSyncEnabled() {
        return backendSyncEnabled;
    }

    public boolean auditEnabled() {
        return auditEnabled;
    }

    public String auditBaseUrl() {
        return auditBaseUrl;
    }

    public int syncQueueCapacity() {
        return syncQueueCapacity;
    }

    public int syncMaxAttempts() {
        return syncMaxAttempts;
    }

    public Duration syncBackoff() {
        return Duration.ofMillis(syncBackoffMs);
    }

    public Duration syncTimeout() {
        return Duration.ofSeconds(syncTimeoutSeconds);
    }

    public int serverPort() {
        return serverPort;
    }

    public String journalFile() {
        return journalFile;
    }

    public MarketDataConfig marketData() {
        return marketData;
    }
}
