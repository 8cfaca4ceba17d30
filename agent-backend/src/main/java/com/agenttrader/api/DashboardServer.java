package com.agenttrader.api;

import com.agenttrader.api.controller.TradingController;
import com.agenttrader.core.coordinator.TradingCoordinator;
import com.agenttrader.metrics.MetricsService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * HTTP shell: the trading REST API plus {@code /metrics} and {@code /health}.
 */
public final class DashboardServer {
    private static final Logger logger = LoggerFactory.getLogger(DashboardServer.class);

    private final Javalin app;
    private final int port;

    public DashboardServer(TradingController controller, TradingCoordinator coordinator, MetricsService metrics,
                           int port) {
        this.port = port;
        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;

            // Records and java.time values as ISO strings
            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
        });

        controller.registerRoutes(app);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metrics.scrape());
        });

        app.get("/health", ctx -> ctx.json(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString(),
            "modelTrained", coordinator.forecaster().isTrained(),
            "decisionMode", coordinator.decisions().mode().name()
        )));

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(Map.of("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
        });
    }

    public void start() {
        app.start(port);
        logger.info("🚀 Dashboard Server started at http://localhost:{}", port);
        logger.info("   REST API: http://localhost:{}/api/*", port);
        logger.info("   Health: http://localhost:{}/health", port);
        logger.info("   Metrics: http://localhost:{}/metrics", port);
    }

    public void stop() {
        app.stop();
        logger.info("Dashboard stopped");
    }
}
