package com.simtrade.core.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.core.api.AlphaVantageQuoteProvider;
import com.simtrade.core.api.CoinGeckoQuoteProvider;
import com.simtrade.core.api.KrakenTickerQuoteProvider;
import com.simtrade.core.api.QuoteProvider;
import com.simtrade.core.api.RateGovernor;
import com.simtrade.core.api.ResilientQuoteProvider;
import com.simtrade.core.cache.MemoryQuoteCache;
import com.simtrade.core.cache.SnapshotFileCache;
import com.simtrade.core.cache.TieredQuoteCache;
import com.simtrade.core.config.MarketDataConfig;
import com.simtrade.core.model.InstrumentCatalog;
import com.simtrade.core.persistence.QuoteStoreDatabase;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the market data components from configuration and owns their lifecycle.
 */
public final class MarketDataEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataEngine.class);

    private final PriceResolver resolver;
    private final RateGovernor governor;
    private final TieredQuoteCache cache;
    private final List<ResilientQuoteProvider> providers;
    private final InstrumentCatalog catalog;
    private final ExecutorService executor;

    private MarketDataEngine(PriceResolver resolver, RateGovernor governor, TieredQuoteCache cache,
                             List<ResilientQuoteProvider> providers, InstrumentCatalog catalog,
                             ExecutorService executor) {
        this.resolver = resolver;
        this.governor = governor;
        this.cache = cache;
        this.providers = providers;
        this.catalog = catalog;
        this.executor = executor;
    }

    public static MarketDataEngine create(MarketDataConfig config, ObjectMapper objectMapper,
                                          MeterRegistry meterRegistry, Clock clock) {
        var catalog = InstrumentCatalog.defaultCatalog();

        var httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        var okHttpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .callTimeout(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();

        var governor = new RateGovernor(config.defaultLimits(), config.providerLimits(), clock);
        governor.start(config.rateWindow());

        var providers = new ArrayList<ResilientQuoteProvider>();
        for (String providerId : config.providerOrder()) {
            QuoteProvider raw = switch (providerId) {
                case CoinGeckoQuoteProvider.ID -> new CoinGeckoQuoteProvider(httpClient, objectMapper,
                    config.coinGeckoBaseUrl(), config.requestTimeout(), clock);
                case KrakenTickerQuoteProvider.ID -> new KrakenTickerQuoteProvider(httpClient, objectMapper,
                    config.krakenBaseUrl(), config.requestTimeout(), clock);
                case AlphaVantageQuoteProvider.ID -> new AlphaVantageQuoteProvider(okHttpClient, objectMapper,
                    config.alphaVantageBaseUrl(), config.alphaVantageApiKey(), catalog, clock);
                default -> throw new IllegalStateException("Unknown quote provider: " + providerId);
            };
            providers.add(new ResilientQuoteProvider(raw, config.resilienceSettings(), meterRegistry, clock,
                () -> governor.tryAcquire(raw.id())));
        }

        ensureParentDirectory(config.snapshotFile());
        ensureParentDirectory(Path.of(config.storeFile()));
        var cache = new TieredQuoteCache(List.of(
            new MemoryQuoteCache(config.memoryTtl()),
            new SnapshotFileCache(config.snapshotFile(), config.snapshotTtl(), objectMapper),
            new QuoteStoreDatabase(config.storeFile(), config.storeTtl())
        ), clock);
        cache.startSweeper(config.sweepInterval());

        var threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4, r -> {
            var thread = new Thread(r, "quote-resolver-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        var resolver = new PriceResolver(cache, governor, List.copyOf(providers),
            config.maxSymbolsPerBatch(), meterRegistry, executor);

        logger.info("✅ Market data engine ready with {} providers", providers.size());
        return new MarketDataEngine(resolver, governor, cache, List.copyOf(providers), catalog, executor);
    }

    private static void ensureParentDirectory(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Cannot create data directory " + parent, e);
        }
    }

    public PriceResolver resolver() {
        return resolver;
    }

    public RateGovernor governor() {
        return governor;
    }

    public TieredQuoteCache cache() {
        return cache;
    }

    public List<ResilientQuoteProvider> providers() {
        return providers;
    }

    public InstrumentCatalog catalog() {
        return catalog;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        governor.close();
        cache.close();
        logger.info("Market data engine stopped");
    }
}
