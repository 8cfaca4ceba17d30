package com.agenttrader.core.coordinator;

import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.data.BarSource;
import com.agenttrader.core.decision.DecisionEngine;
import com.agenttrader.core.decision.RiskThresholds;
import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.exception.LedgerCorruptionException;
import com.agenttrader.core.exception.ModelNotTrainedException;
import com.agenttrader.core.execution.ExecutionAgent;
import com.agenttrader.core.execution.SizingContext;
import com.agenttrader.core.forecast.FitReport;
import com.agenttrader.core.forecast.ForecastResult;
import com.agenttrader.core.forecast.ForecastingModel;
import com.agenttrader.core.forecast.TrainingSample;
import com.agenttrader.core.forecast.TrainingSetBuilder;
import com.agenttrader.core.indicator.IndicatorEngine;
import com.agenttrader.core.ledger.LedgerRegistry;
import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.model.Bar;
import com.agenttrader.core.model.CycleRequest;
import com.agenttrader.core.model.CycleState;
import com.agenttrader.core.model.CycleSummary;
import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.ExecutionResult;
import com.agenttrader.core.model.ExecutionStatus;
import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.FeatureVector;
import com.agenttrader.core.model.PortfolioSnapshot;
import com.agenttrader.core.model.Prediction;
import com.agenttrader.core.model.SymbolResult;
import com.agenttrader.core.model.TradeAction;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs trading cycles: STARTED → PREDICTING → DECIDING → EXECUTING → FEEDBACK → COMPLETE.
 * <p>
 * Stages talk only through immutable {@link SymbolResult}s:
 * <ul>
 *   <li>PREDICTING fans out over a bounded pool and settles every symbol before DECIDING starts.</li>
 *   <li>EXECUTING holds the user's ledger lock for the whole stage, so cycles of one user never
 *   interleave their orders while different users run in parallel.</li>
 *   <li>A stage with nothing to act on jumps straight to COMPLETE.</li>
 * </ul>
 * Per-symbol and per-order failures are recorded in the results. Only a {@link ConfigurationException}
 * (raised before any stage runs) or a {@link LedgerCorruptionException} escapes {@link #runCycle}.
 * When the time budget runs out no further stage is started and no further order is placed; feedback
 * from orders already executed is still forwarded, and the cycle returns what it has.
 */
public final class TradingCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TradingCoordinator.class);
    private static final int RECENT_CYCLES = 50;

    private final PipelineConfig config;
    private final BarSource barSource;
    private final IndicatorEngine indicators;
    private final ForecastingModel forecaster;
    private final DecisionEngine decisions;
    private final ExecutionAgent executor;
    private final LedgerRegistry ledgers;
    private final MeterRegistry meterRegistry;

    private final ExecutorService predictionPool;
    private final ExecutorService fitPool;
    private final AtomicLong cycleCounter = new AtomicLong();
    private final Deque<CycleSummary> recent = new ArrayDeque<>();
    private final AtomicReference<List<String>> trainingUniverse = new AtomicReference<>(List.of());
    private final AtomicReference<FitReport> refitHandled = new AtomicReference<>();
    private final AtomicReference<Future<FitReport>> pendingRefit = new AtomicReference<>();
    private volatile Consumer<ForecastingModel.TrainedModel> fitListener = model -> { };

    public TradingCoordinator(PipelineConfig config, BarSource barSource, IndicatorEngine indicators,
                              ForecastingModel forecaster, DecisionEngine decisions, ExecutionAgent executor,
                              LedgerRegistry ledgers, MeterRegistry meterRegistry) {
        this.config = config;
        this.barSource = barSource;
        this.indicators = indicators;
        this.forecaster = forecaster;
        this.decisions = decisions;
        this.executor = executor;
        this.ledgers = ledgers;
        this.meterRegistry = meterRegistry;
        this.predictionPool = Executors.newFixedThreadPool(config.getPredictionParallelism(), namedDaemon("predict"));
        this.fitPool = Executors.newSingleThreadExecutor(namedDaemon("model-fit"));
        logger.info("TradingCoordinator initialized: parallelism={}, budget={}ms",
            config.getPredictionParallelism(), config.getCycleTimeBudgetMs());
    }

    /**
     * Wire a coordinator with default engines built from {@code config}.
     */
    public static TradingCoordinator create(PipelineConfig config, BarSource barSource, LedgerRegistry ledgers,
                                            MeterRegistry meterRegistry) {
        return new TradingCoordinator(config, barSource, new IndicatorEngine(), new ForecastingModel(config),
            new DecisionEngine(config), new ExecutionAgent(config.getSellPolicy()), ledgers, meterRegistry);
    }

    /** Called with every model a refit publishes, e.g. to persist it. */
    public void setFitListener(Consumer<ForecastingModel.TrainedModel> listener) {
        this.fitListener = listener == null ? model -> { } : listener;
    }

    // ========== Cycle ==========

    /**
     * Run one cycle for a user over a batch of symbols.
     *
     * @throws ConfigurationException    when the request is malformed (blank user, risk outside [0, 1])
     * @throws LedgerCorruptionException when a ledger invariant breaks during execution
     */
    public CycleSummary runCycle(CycleRequest request) {
        if (request == null) {
            throw new ConfigurationException("cycle request is required");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            throw new ConfigurationException("userId is required");
        }
        RiskThresholds thresholds = RiskThresholds.forRisk(request.riskTolerance());

        var run = new CycleRun(request, thresholds);
        logger.info("🚀 Cycle {} started for {}: {} symbols, risk {}", run.cycleId, request.userId(),
            run.symbols.size(), String.format("%.2f", request.riskTolerance()));

        try {
            if (!run.symbols.isEmpty()) {
                predict(run);
            }
            if (!run.timedOut && run.hasActionablePredictions()) {
                decide(run);
            }
            if (!run.timedOut && run.hasDecisions()) {
                execute(run);
            }
            feedback(run);
        } catch (LedgerCorruptionException e) {
            logger.error("💥 Cycle {} aborted, ledger invariant violated: {}", run.cycleId, e.getMessage());
            meterRegistry.counter("agent.cycle.aborted").increment();
            throw e;
        }
        return complete(run);
    }

    private void predict(CycleRun run) {
        run.enter(CycleState.PREDICTING);
        Map<String, Future<Prediction>> futures = new LinkedHashMap<>();
        for (String symbol : run.symbols) {
            futures.put(symbol, predictionPool.submit(() -> predictSymbol(symbol)));
        }

        for (var entry : futures.entrySet()) {
            String symbol = entry.getKey();
            Future<Prediction> future = entry.getValue();
            Prediction prediction;
            try {
                prediction = future.get(Math.max(0, run.remainingNanos()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                run.timedOut = true;
                future.cancel(true);
                prediction = Prediction.error(symbol, 0.0, null, "Cycle time budget exhausted before prediction");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.timedOut = true;
                future.cancel(true);
                prediction = Prediction.error(symbol, 0.0, null, "Interrupted before prediction");
            } catch (ExecutionException | CancellationException e) {
                prediction = Prediction.error(symbol, 0.0, null, "Prediction failed: " + e.getMessage());
            }
            run.results.put(symbol, SymbolResult.of(prediction));
            if (!prediction.isActionable()) {
                meterRegistry.counter("agent.degraded.symbols", "status", prediction.status().name()).increment();
            }
        }
        if (run.timedOut) {
            logger.warn("⏱️ Cycle {} ran out of time while predicting", run.cycleId);
        }
    }

    /**
     * Indicator engine plus forecaster for one symbol. Never throws; failures become degraded
     * predictions.
     */
    Prediction predictSymbol(String symbol) {
        try {
            List<Bar> bars = barSource.history(symbol);
            FeatureVector features = indicators.computeFeatures(bars);
            try {
                ForecastResult forecast = forecaster.predict(features);
                return Prediction.predicted(symbol, features.close(), forecast.predictedChangePct(),
                    forecast.confidence(), features.snapshot(), features.date());
            } catch (ModelNotTrainedException e) {
                logger.warn("{}: {}", symbol, e.getMessage());
                return Prediction.error(symbol, features.close(), features.snapshot(), e.getMessage());
            }
        } catch (InsufficientDataException e) {
            logger.warn("⚠️ {}: insufficient data ({} bars, need {})", symbol, e.getAvailable(), e.getRequired());
            return Prediction.insufficientData(symbol, e.getMessage());
        } catch (InvalidSymbolException e) {
            logger.warn("⚠️ {}: {}", symbol, e.getMessage());
            return Prediction.error(symbol, 0.0, null, e.getMessage());
        } catch (IOException e) {
            logger.warn("⚠️ {}: could not load bars: {}", symbol, e.getMessage());
            return Prediction.error(symbol, 0.0, null, "Bar history unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("⚠️ {}: prediction error", symbol, e);
            return Prediction.error(symbol, 0.0, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void decide(CycleRun run) {
        run.enter(CycleState.DECIDING);
        for (var entry : run.results.entrySet()) {
            SymbolResult result = entry.getValue();
            if (!result.prediction().isActionable()) {
                continue;
            }
            Decision decision = decisions.decide(result.prediction(), run.thresholds);
            entry.setValue(result.withDecision(decision));
            run.decisionCounts.merge(decision.action(), 1, Integer::sum);
            meterRegistry.counter("agent.decisions", "action", decision.action().name(),
                "method", decision.method().name()).increment();
        }
        logger.info("Cycle {} decisions: BUY={}, SELL={}, HOLD={}", run.cycleId,
            run.decisionCounts.getOrDefault(TradeAction.BUY, 0),
            run.decisionCounts.getOrDefault(TradeAction.SELL, 0),
            run.decisionCounts.getOrDefault(TradeAction.HOLD, 0));
        run.checkBudget("deciding");
    }

    private void execute(CycleRun run) {
        run.enter(CycleState.EXECUTING);
        ledgers.withLedger(run.request.userId(), ledger -> {
            Map<String, Double> marks = new LinkedHashMap<>();
            run.results.values().stream()
                .filter(r -> r.prediction().isActionable())
                .forEach(r -> marks.put(r.symbol(), r.prediction().currentPrice()));
            ledger.markToMarket(marks);

            for (var entry : run.results.entrySet()) {
                SymbolResult result = entry.getValue();
                if (result.decision() == null) {
                    continue;
                }
                if (run.checkBudget("executing")) {
                    break;
                }
                Decision decision = result.decision();
                var sizing = new SizingContext(decision.currentPrice(), ledger.totalValue());
                ExecutionResult execution = executor.execute(decision, sizing, ledger);
                entry.setValue(result.withExecution(execution));
                run.feedback.addAll(execution.feedback());
                meterRegistry.counter("agent.executions", "status", execution.status().name()).increment();
            }
            return null;
        });
    }

    /**
     * Outcomes of orders that already executed are always forwarded, even on a timed-out cycle;
     * only the refit waits for a cycle that finished in time.
     */
    private void feedback(CycleRun run) {
        FitReport report = forecaster.lastReport().orElse(null);
        run.driftDetected = report != null && report.driftDetected();
        boolean refitDue = !run.timedOut && run.driftDetected && config.isRefitOnDrift()
            && refitHandled.get() != report;
        if (run.feedback.isEmpty() && !refitDue) {
            return;
        }
        run.enter(CycleState.FEEDBACK);
        if (!run.feedback.isEmpty()) {
            long accurate = run.feedback.stream().filter(Feedback::accurate).count();
            logger.info("Cycle {} feedback: {} outcomes, {} accurate", run.cycleId, run.feedback.size(), accurate);
            decisions.adapt(run.feedback);
        }
        if (refitDue && claimRefit(report)) {
            run.refitTriggered = triggerRefit();
        }
    }

    /** One refit per drifting report, however many cycles observe it. */
    private boolean claimRefit(FitReport report) {
        FitReport previous = refitHandled.get();
        return previous != report && refitHandled.compareAndSet(previous, report);
    }

    private CycleSummary complete(CycleRun run) {
        run.enter(CycleState.COMPLETE);
        PortfolioLedger ledger = ledgers.ledgerFor(run.request.userId());
        PortfolioSnapshot portfolio = ledger.snapshot();

        int executed = 0;
        int failed = 0;
        int degraded = 0;
        for (SymbolResult r : run.results.values()) {
            if (r.degraded()) {
                degraded++;
            }
            if (r.execution() != null) {
                if (r.execution().status() == ExecutionStatus.EXECUTED) {
                    executed++;
                } else if (r.execution().status() == ExecutionStatus.FAILED) {
                    failed++;
                }
            }
        }

        Instant completedAt = Instant.now();
        long durationMs = Duration.between(run.startedAt, completedAt).toMillis();
        var summary = new CycleSummary(run.cycleId, run.request.userId(), run.request.riskTolerance(),
            run.startedAt, completedAt, durationMs, run.trail, new ArrayList<>(run.results.values()),
            run.decisionCounts, executed, failed, degraded, run.feedback, portfolio, decisions.mode(),
            run.driftDetected, run.refitTriggered, run.timedOut);

        meterRegistry.timer("agent.cycle.duration").record(Duration.ofMillis(durationMs));
        if (run.timedOut) {
            meterRegistry.counter("agent.cycle.timeouts").increment();
        }
        synchronized (recent) {
            recent.addFirst(summary);
            while (recent.size() > RECENT_CYCLES) {
                recent.removeLast();
            }
        }
        logger.info("✅ Cycle {} complete in {}ms: {} trades, {} failed, {} degraded, value ${}{}",
            run.cycleId, durationMs, executed, failed, degraded,
            String.format("%.2f", portfolio.totalValue()), run.timedOut ? " (partial, timed out)" : "");
        return summary;
    }

    // ========== Training ==========

    /**
     * Fit the forecaster on the full histories of {@code symbols} and remember them as the
     * universe used for drift refits. Blocks the caller; see {@link #trainAllAsync}.
     *
     * @throws InsufficientDataException when the histories yield too few samples
     */
    public TrainingSummary trainAll(Collection<String> symbols) throws InsufficientDataException {
        List<String> universe = List.copyOf(new LinkedHashSet<>(symbols));
        trainingUniverse.set(universe);
        List<String> skipped = new ArrayList<>();
        List<TrainingSample> samples = buildTrainingSet(universe, skipped);
        FitReport report = forecaster.fit(samples);
        forecaster.current().ifPresent(fitListener);
        return new TrainingSummary(report, decisions.mode(), decisions.feedbackSamples(), universe, skipped);
    }

    /**
     * {@link #trainAll} on the coordinator's single fit thread, so concurrent requests queue up
     * behind each other instead of fitting in parallel. An {@link InsufficientDataException}
     * completes the future exceptionally, wrapped in a {@link CompletionException}.
     */
    public CompletableFuture<TrainingSummary> trainAllAsync(Collection<String> symbols) {
        List<String> copy = List.copyOf(symbols);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return trainAll(copy);
            } catch (InsufficientDataException e) {
                throw new CompletionException(e);
            }
        }, fitPool);
    }

    /** Replay stored outcomes into the decision policy, e.g. at startup. */
    public DecisionSource replayFeedback(List<Feedback> feedback) {
        logger.info("Replaying {} stored feedback records", feedback.size());
        return decisions.adapt(feedback);
    }

    private boolean triggerRefit() {
        List<String> universe = trainingUniverse.get();
        if (universe.isEmpty()) {
            logger.warn("Drift flagged but no training universe known, skipping refit");
            return false;
        }
        if (forecaster.isFitting()) {
            logger.info("Drift flagged but a fit is already running");
            return false;
        }
        meterRegistry.counter("agent.model.drift").increment();
        logger.warn("🔁 Drift flagged, refitting forecaster on {} symbols in background", universe.size());
        Future<FitReport> future = fitPool.submit(() -> {
            List<TrainingSample> samples = buildTrainingSet(universe, new ArrayList<>());
            FitReport report = forecaster.fit(samples);
            forecaster.current().ifPresent(fitListener);
            return report;
        });
        pendingRefit.set(future);
        return true;
    }

    private List<TrainingSample> buildTrainingSet(List<String> universe, List<String> skipped) {
        Map<String, List<Bar>> histories = new LinkedHashMap<>();
        for (String symbol : universe) {
            try {
                histories.put(symbol, barSource.history(symbol));
            } catch (InvalidSymbolException | IOException e) {
                logger.warn("Skipping {} for training: {}", symbol, e.getMessage());
                skipped.add(symbol);
            }
        }
        return new TrainingSetBuilder(indicators, config.getForecastHorizon()).build(histories);
    }

    // ========== Status ==========

    public SystemStatus status() {
        Map<String, SystemStatus.UserStatus> users = new LinkedHashMap<>();
        for (String userId : ledgers.users()) {
            PortfolioLedger ledger = ledgers.ledgerFor(userId);
            users.put(userId, new SystemStatus.UserStatus(ledger.snapshot(), ledger.performance()));
        }
        Instant lastCycleAt;
        synchronized (recent) {
            lastCycleAt = recent.isEmpty() ? null : recent.peekFirst().completedAt();
        }
        return new SystemStatus(forecaster.isTrained(), forecaster.isFitting(),
            forecaster.lastReport().orElse(null), decisions.mode(), decisions.feedbackSamples(),
            cycleCounter.get(), lastCycleAt, users);
    }

    /** Most recent cycles, newest first. */
    public List<CycleSummary> recentCycles() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    /** The latest background refit started by drift, if any. */
    public Future<FitReport> pendingRefit() {
        return pendingRefit.get();
    }

    public ForecastingModel forecaster() {
        return forecaster;
    }

    public DecisionEngine decisions() {
        return decisions;
    }

    public LedgerRegistry ledgers() {
        return ledgers;
    }

    @Override
    public void close() {
        predictionPool.shutdownNow();
        fitPool.shutdownNow();
        logger.info("TradingCoordinator shut down");
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Mutable working state of one cycle, confined to the thread running it.
     */
    private final class CycleRun {
        final String cycleId;
        final CycleRequest request;
        final RiskThresholds thresholds;
        final List<String> symbols;
        final Instant startedAt = Instant.now();
        final long deadlineNanos;
        final List<CycleState> trail = new ArrayList<>();
        final Map<String, SymbolResult> results = new LinkedHashMap<>();
        final Map<TradeAction, Integer> decisionCounts = new EnumMap<>(TradeAction.class);
        final List<Feedback> feedback = new ArrayList<>();
        boolean timedOut;
        boolean driftDetected;
        boolean refitTriggered;

        CycleRun(CycleRequest request, RiskThresholds thresholds) {
            this.cycleId = "cycle-" + cycleCounter.incrementAndGet();
            this.request = request;
            this.thresholds = thresholds;
            this.symbols = List.copyOf(new LinkedHashSet<>(request.symbols()));
            this.deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getCycleTimeBudgetMs());
            for (TradeAction action : TradeAction.values()) {
                decisionCounts.put(action, 0);
            }
            trail.add(CycleState.STARTED);
        }

        void enter(CycleState state) {
            trail.add(state);
            logger.info("Cycle {} -> {}", cycleId, state);
        }

        long remainingNanos() {
            return deadlineNanos - System.nanoTime();
        }

        /** Marks the cycle timed out when the budget is spent; returns whether it is. */
        boolean checkBudget(String stage) {
            if (!timedOut && remainingNanos() <= 0) {
                timedOut = true;
                logger.warn("⏱️ Cycle {} ran out of time while {}", cycleId, stage);
            }
            return timedOut;
        }

        boolean hasActionablePredictions() {
            return results.values().stream().anyMatch(r -> r.prediction().isActionable());
        }

        boolean hasDecisions() {
            return results.values().stream().anyMatch(r -> r.decision() != null);
        }
    }
}
