package com.simtrade.dashboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.api.controller.MarketDataController;
import com.simtrade.api.controller.TradingController;
import com.simtrade.health.HealthCheckService;
import com.simtrade.metrics.MetricsService;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server for the trading game: REST API, health and Prometheus metrics.
 */
public final class DashboardServer {
    private static final Logger logger = LoggerFactory.getLogger(DashboardServer.class);

    private final Javalin app;

    public DashboardServer(ObjectMapper objectMapper, TradingController tradingController,
                           MarketDataController marketDataController, HealthCheckService healthCheckService,
                           MetricsService metricsService) {

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));

            // Enable CORS for a separately deployed game client
            javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(it -> {
                it.reflectClientOrigin = true;
                it.allowCredentials = true;
            }));
        });

        tradingController.registerRoutes(app);
        marketDataController.registerRoutes(app);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metricsService.scrape());
        });

        app.get("/health", ctx -> {
            var health = healthCheckService.getHealth();
            ctx.status(switch (health.status()) {
                case UP -> 200;
                case DEGRADED -> 200; // Still operational
                case DOWN -> 503;
            });
            ctx.json(health);
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(java.util.Map.of(
                "error", "Internal server error",
                "message", String.valueOf(e.getMessage())
            ));
        });
    }

    public void start(int port) {
        app.start(port);
        logger.info("🚀 Trading server started at http://localhost:{}", app.port());
        logger.info("   REST API: http://localhost:{}/api/*", app.port());
        logger.info("   Health: http://localhost:{}/health", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Trading server stopped");
    }
}
