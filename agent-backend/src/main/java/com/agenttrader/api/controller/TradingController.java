package com.agenttrader.api.controller;

import com.agenttrader.api.model.CycleCommand;
import com.agenttrader.api.model.TrainCommand;
import com.agenttrader.bot.CycleRunner;
import com.agenttrader.config.TradingConfig;
import com.agenttrader.core.coordinator.TradingCoordinator;
import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.model.CycleRequest;
import com.agenttrader.core.model.CycleSummary;
import io.javalin.Javalin;
import io.javalin.http.Context;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * REST endpoints over the trading coordinator: run a cycle, train, and inspect state.
 */
public final class TradingController {
    private static final Logger logger = LoggerFactory.getLogger(TradingController.class);
    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
    private static final int DEFAULT_CYCLE_LIMIT = 10;

    private final CycleRunner runner;
    private final TradingCoordinator coordinator;
    private final TradingConfig config;

    public TradingController(CycleRunner runner, TradingConfig config) {
        this.runner = runner;
        this.coordinator = runner.coordinator();
        this.config = config;
    }

    public void registerRoutes(Javalin app) {
        app.post("/api/cycle", this::runCycle);
        app.post("/api/train", this::train);
        app.get("/api/status", this::getStatus);
        app.get("/api/portfolio/{userId}", this::getPortfolio);
        app.get("/api/cycles", this::getCycles);
    }

    void runCycle(Context ctx) {
        CycleCommand command;
        try {
            command = ctx.bodyAsClass(CycleCommand.class);
        } catch (RuntimeException e) {
            ctx.status(400).json(Map.of("error", "Malformed request body: " + e.getMessage()));
            return;
        }
        if (command == null) {
            ctx.status(400).json(Map.of("error", "Request body is required"));
            return;
        }
        if (rejectInvalid(ctx, validator.validate(command))) {
            return;
        }

        List<String> symbols = command.symbols() == null || command.symbols().isEmpty()
            ? config.getSymbols()
            : command.symbols();
        double risk = command.riskTolerance() != null ? command.riskTolerance() : config.getRiskTolerance();

        try {
            CycleSummary summary = runner.run(new CycleRequest(command.userId(), symbols, risk));
            ctx.json(summary);
        } catch (ConfigurationException e) {
            ctx.status(400).json(Map.of("error", e.getMessage()));
        }
    }

    void train(Context ctx) {
        List<String> symbols = config.getSymbols();
        String body = ctx.body();
        if (body != null && !body.isBlank()) {
            TrainCommand command;
            try {
                command = ctx.bodyAsClass(TrainCommand.class);
            } catch (RuntimeException e) {
                ctx.status(400).json(Map.of("error", "Malformed request body: " + e.getMessage()));
                return;
            }
            if (rejectInvalid(ctx, validator.validate(command))) {
                return;
            }
            if (command.symbols() != null && !command.symbols().isEmpty()) {
                symbols = command.symbols();
            }
        }
        if (symbols.isEmpty()) {
            ctx.status(400).json(Map.of("error", "No symbols to train on"));
            return;
        }

        List<String> trainOn = symbols;
        ctx.future(() -> coordinator.trainAllAsync(trainOn)
            .thenAccept(ctx::json)
            .exceptionally(e -> {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                if (cause instanceof InsufficientDataException) {
                    logger.warn("Training rejected: {}", cause.getMessage());
                    ctx.status(422).json(Map.of("error", cause.getMessage()));
                } else {
                    logger.error("Training failed", cause);
                    ctx.status(500).json(Map.of("error", "Training failed: " + cause.getMessage()));
                }
                return null;
            }));
    }

    void getStatus(Context ctx) {
        ctx.json(coordinator.status());
    }

    void getPortfolio(Context ctx) {
        String userId = ctx.pathParam("userId");
        Optional<PortfolioLedger> ledger = coordinator.ledgers().find(userId);
        if (ledger.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Unknown user: " + userId));
            return;
        }
        var response = new LinkedHashMap<String, Object>();
        response.put("portfolio", ledger.get().snapshot());
        response.put("performance", ledger.get().performance());
        response.put("transactions", ledger.get().transactions());
        ctx.json(response);
    }

    void getCycles(Context ctx) {
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(DEFAULT_CYCLE_LIMIT);
        List<CycleSummary> cycles = coordinator.recentCycles();
        ctx.json(cycles.subList(0, Math.min(Math.max(limit, 0), cycles.size())));
    }

    private static <T> boolean rejectInvalid(Context ctx, Set<ConstraintViolation<T>> violations) {
        if (violations.isEmpty()) {
            return false;
        }
        var errors = violations.stream()
            .map(v -> Map.of(
                "field", v.getPropertyPath().toString(),
                "message", v.getMessage()
            ))
            .toList();
        ctx.status(400).json(Map.of(
            "valid", false,
            "errors", errors
        ));
        return true;
    }
}
