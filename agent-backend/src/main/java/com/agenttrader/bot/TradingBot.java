package com.agenttrader.bot;

import com.agenttrader.api.DashboardServer;
import com.agenttrader.api.controller.TradingController;
import com.agenttrader.config.TradingConfig;
import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.coordinator.TradingCoordinator;
import com.agenttrader.core.coordinator.TrainingSummary;
import com.agenttrader.core.data.BarSource;
import com.agenttrader.core.data.ResilientBarSource;
import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.exception.LedgerCorruptionException;
import com.agenttrader.core.ledger.LedgerRegistry;
import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.model.CycleRequest;
import com.agenttrader.core.model.CycleSummary;
import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.Transaction;
import com.agenttrader.data.CsvBarSource;
import com.agenttrader.metrics.MetricsService;
import com.agenttrader.persistence.ModelStore;
import com.agenttrader.persistence.TradeJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: wires the pipeline to CSV data, the journal and the model store, then runs one
 * cycle or a cycle every {@code CYCLE_INTERVAL_SECONDS}.
 */
public final class TradingBot {
    private static final Logger logger = LoggerFactory.getLogger(TradingBot.class);

    private final TradingConfig config;
    private final TradeJournal journal;
    private final ModelStore modelStore;
    private final TradingCoordinator coordinator;
    private final CycleRunner runner;
    private final MetricsService metrics;

    TradingBot(TradingConfig config, PipelineConfig pipeline, BarSource bars, MetricsService metrics) {
        this.config = config;
        this.metrics = metrics;
        this.journal = new TradeJournal(config.getJournalDbPath().toString());
        this.modelStore = new ModelStore(config.getModelPath());

        LedgerRegistry ledgers = restoreLedgers(journal, config.getInitialCash());
        this.coordinator = TradingCoordinator.create(pipeline, bars, ledgers, metrics.getRegistry());
        this.coordinator.setFitListener(model -> {
            try {
                modelStore.save(model);
            } catch (IOException e) {
                logger.error("Failed to save model to {}: {}", modelStore.path(), e.getMessage());
            }
        });
        this.runner = new CycleRunner(coordinator, journal, metrics);

        List<Feedback> feedback = journal.feedback();
        if (!feedback.isEmpty()) {
            coordinator.replayFeedback(feedback);
        }
    }

    public static void main(String[] args) {
        TradingConfig config = TradingConfig.getInstance();
        PipelineConfig pipeline;
        try {
            pipeline = config.pipelineConfig();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        var metrics = MetricsService.getInstance();
        var bars = new ResilientBarSource(new CsvBarSource(config.getDataDir()), metrics.getRegistry());
        var bot = new TradingBot(config, pipeline, bars, metrics);

        List<String> symbols;
        try {
            symbols = bot.universe(bars);
        } catch (IOException e) {
            logger.error("Cannot list symbols in {}: {}", config.getDataDir(), e.getMessage());
            System.exit(1);
            return;
        }
        if (symbols.isEmpty()) {
            logger.error("No symbols configured and no CSV files in {}", config.getDataDir().toAbsolutePath());
            System.exit(1);
            return;
        }

        if (!bot.ensureModel(symbols)) {
            logger.error("No forecasting model available, exiting");
            System.exit(1);
            return;
        }

        DashboardServer dashboard = null;
        if (config.isDashboardEnabled()) {
            dashboard = new DashboardServer(new TradingController(bot.runner, config), bot.coordinator, metrics,
                config.getDashboardPort());
            dashboard.start();
        }

        int status;
        if (config.getCycleIntervalSeconds() > 0) {
            bot.runScheduled(symbols, dashboard);
            status = 0;
        } else {
            status = bot.runOnce(symbols);
        }
        if (dashboard != null && config.getCycleIntervalSeconds() <= 0 && status == 0) {
            logger.info("Dashboard still serving on port {}; stop the process to exit", config.getDashboardPort());
            return;
        }
        bot.close();
        System.exit(status);
    }

    List<String> universe(BarSource bars) throws IOException {
        return config.getSymbols().isEmpty() ? bars.symbols() : config.getSymbols();
    }

    /**
     * Restore the saved model, or train one on {@code symbols}.
     *
     * @return whether a model is live afterwards
     */
    boolean ensureModel(List<String> symbols) {
        try {
            var saved = modelStore.load();
            if (saved.isPresent()) {
                coordinator.forecaster().restore(saved.get());
                return true;
            }
        } catch (IOException e) {
            logger.warn("⚠️ Saved model unreadable, retraining: {}", e.getMessage());
        }

        try {
            TrainingSummary summary = coordinator.trainAll(symbols);
            logger.info("🧠 Forecaster trained on {} symbols: RMSE {}, MAE {} ({} train / {} test)",
                summary.symbols().size() - summary.skipped().size(),
                String.format("%.3f", summary.forecast().rmse()), String.format("%.3f", summary.forecast().mae()),
                summary.forecast().trainSize(), summary.forecast().testSize());
            return true;
        } catch (InsufficientDataException e) {
            logger.error("Training failed: {}", e.getMessage());
            return false;
        }
    }

    /** @return process exit status */
    int runOnce(List<String> symbols) {
        try {
            CycleSummary summary = runner.run(new CycleRequest(config.getDefaultUser(), symbols, config.getRiskTolerance()));
            logSummary(summary);
            return 0;
        } catch (ConfigurationException e) {
            logger.error("Cycle rejected: {}", e.getMessage());
            return 1;
        } catch (LedgerCorruptionException e) {
            logger.error("💥 Ledger corrupted, stopping: {}", e.getMessage());
            return 2;
        }
    }

    /**
     * Run a cycle every interval until the process is stopped or a ledger breaks.
     */
    void runScheduled(List<String> symbols, DashboardServer dashboard) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cycle-scheduler");
            t.setDaemon(true);
            return t;
        });
        var stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping scheduler...");
            scheduler.shutdown();
            if (dashboard != null) {
                dashboard.stop();
            }
            stopped.countDown();
        }, "shutdown-hook"));

        scheduler.scheduleWithFixedDelay(() -> {
            if (runOnce(symbols) == 2) {
                scheduler.shutdown();
                stopped.countDown();
            }
        }, 0, config.getCycleIntervalSeconds(), TimeUnit.SECONDS);
        logger.info("⏰ Running a cycle every {}s for {} symbols", config.getCycleIntervalSeconds(), symbols.size());

        try {
            stopped.await();
        } catch (InterruptedException e) {
            logger.info("Bot interrupted during execution");
            Thread.currentThread().interrupt();
        }
    }

    private void logSummary(CycleSummary summary) {
        logger.info("📈 {}: value ${} (return ${}), cash ${}, {} positions, decision mode {}",
            summary.userId(),
            String.format("%.2f", summary.portfolio().totalValue()),
            String.format("%+.2f", summary.portfolio().totalReturn()),
            String.format("%.2f", summary.portfolio().cash()),
            summary.portfolio().positions().size(),
            summary.decisionMode());
        summary.results().forEach(r -> logger.info("   {} {} -> {}", r.symbol(), r.prediction().status(),
            r.decisionOpt().map(d -> d.action() + " (" + String.format("%.0f%%", d.confidence() * 100) + ")")
                .orElse(r.prediction().message())));
    }

    void close() {
        coordinator.close();
        journal.close();
    }

    TradingCoordinator coordinator() {
        return coordinator;
    }

    /** Rebuild every journaled user's ledger from its transaction log. */
    static LedgerRegistry restoreLedgers(TradeJournal journal, double initialCash) {
        var ledgers = new LedgerRegistry(initialCash);
        for (String userId : journal.users()) {
            List<Transaction> history = journal.transactions(userId);
            ledgers.register(PortfolioLedger.replay(userId, initialCash, history));
        }
        return ledgers;
    }
}
