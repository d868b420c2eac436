package com.simtrade;

import com.simtrade.api.controller.MarketDataController;
import com.simtrade.api.controller.TradingController;
import com.simtrade.balance.InMemoryCashBalance;
import com.simtrade.config.JsonSupport;
import com.simtrade.config.TradingConfig;
import com.simtrade.core.market.MarketDataEngine;
import com.simtrade.core.model.InstrumentInfo;
import com.simtrade.dashboard.DashboardServer;
import com.simtrade.health.HealthCheckService;
import com.simtrade.metrics.MetricsService;
import com.simtrade.persistence.TransactionJournal;
import com.simtrade.portfolio.PortfolioLedger;
import com.simtrade.sync.HttpAuditRecorder;
import com.simtrade.sync.HttpTransactionSync;
import com.simtrade.sync.SyncDispatcher;
import com.simtrade.sync.SyncTarget;
import com.simtrade.trading.TradingEngine;
import com.simtrade.trading.TransactionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point: wires market data, the trading engine and the HTTP server.
 */
public final class TradingApplication {
    private static final Logger logger = LoggerFactory.getLogger(TradingApplication.class);

    private TradingApplication() {
    }

    public static void main(String[] args) throws IOException {
        logger.info("🎮 Starting simulated trading platform");

        var config = TradingConfig.load();
        var clock = Clock.systemUTC();
        var objectMapper = JsonSupport.objectMapper();
        var metrics = MetricsService.prometheus();

        var marketData = MarketDataEngine.create(config.marketData(), objectMapper, metrics.getRegistry(), clock);

        Path journalPath = Path.of(config.journalFile()).toAbsolutePath();
        if (journalPath.getParent() != null) {
            Files.createDirectories(journalPath.getParent());
        }
        var journal = new TransactionJournal(journalPath.toString());

        var ledger = new PortfolioLedger(clock);
        ledger.restore(journal.loadHoldings());
        var transactionLog = new TransactionLog();
        transactionLog.restore(journal.loadTransactions());
        double startingCash = journal.lastBalance().orElse(config.initialCash());
        var cashBalance = new InMemoryCashBalance(startingCash);

        var httpClient = HttpClient.newHttpClient();
        var targets = new ArrayList<SyncTarget>();
        if (config.backendSyncEnabled()) {
            targets.add(SyncTarget.backend(new HttpTransactionSync(httpClient, objectMapper,
                config.backendBaseUrl(), config.syncTimeout())));
        }
        if (config.auditEnabled()) {
            targets.add(SyncTarget.audit(new HttpAuditRecorder(httpClient, objectMapper,
                config.auditBaseUrl(), config.syncTimeout())));
        }
        var syncDispatcher = new SyncDispatcher(targets, config.syncQueueCapacity(),
            config.syncMaxAttempts(), config.syncBackoff(), metrics);

        ExecutorService tradeExecutor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "trade-executor");
            thread.setDaemon(true);
            return thread;
        });

        var engine = new TradingEngine(marketData.resolver(), ledger, transactionLog, cashBalance,
            syncDispatcher, journal, config.tradeLimits(), metrics, tradeExecutor, clock);

        var healthCheckService = new HealthCheckService(marketData.providers(), journal, syncDispatcher, clock);
        var server = new DashboardServer(objectMapper,
            new TradingController(engine, cashBalance),
            new MarketDataController(marketData.resolver(), marketData.governor(), marketData.catalog()),
            healthCheckService, metrics);
        server.start(config.serverPort());

        // Warm the cache for the instruments shown on screen
        marketData.resolver().prefetch(marketData.catalog().all().stream().map(InstrumentInfo::symbol).toList());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("🛑 Shutting down...");
            server.stop();
            tradeExecutor.shutdown();
            syncDispatcher.close();
            marketData.close();
            journal.close();
            logger.info("Shutdown complete");
        }, "shutdown-hook"));
    }
}
