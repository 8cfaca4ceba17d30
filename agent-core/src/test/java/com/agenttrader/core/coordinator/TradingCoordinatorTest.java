package com.agenttrader.core.coordinator;

import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.data.BarSource;
import com.agenttrader.core.data.InMemoryBarSource;
import com.agenttrader.core.decision.DecisionEngine;
import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.execution.ExecutionAgent;
import com.agenttrader.core.forecast.ForecastResult;
import com.agenttrader.core.forecast.ForecastingModel;
import com.agenttrader.core.indicator.IndicatorEngine;
import com.agenttrader.core.ledger.LedgerRegistry;
import com.agenttrader.core.model.Bar;
import com.agenttrader.core.model.CycleRequest;
import com.agenttrader.core.model.CycleState;
import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.CycleSummary;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.ExecutionStatus;
import com.agenttrader.core.model.PredictionStatus;
import com.agenttrader.core.model.SymbolResult;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.support.TestBars;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@DisplayName("TradingCoordinator Tests")
class TradingCoordinatorTest {

    private TradingCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private static PipelineConfig config(String... pairs) {
        Properties p = new Properties();
        p.setProperty("FORECAST_TREES", "10");
        p.setProperty("FORECAST_MAX_DEPTH", "6");
        for (int i = 0; i < pairs.length; i += 2) {
            p.setProperty(pairs[i], pairs[i + 1]);
        }
        return PipelineConfig.fromProperties(p);
    }

    private static InMemoryBarSource market() {
        return new InMemoryBarSource()
            .put("AAA", TestBars.randomWalk("AAA", 200, 100.0, 1L))
            .put("BBB", TestBars.randomWalk("BBB", 200, 50.0, 2L))
            .put("SHORT", TestBars.randomWalk("SHORT", 30, 20.0, 3L));
    }

    private TradingCoordinator coordinator(PipelineConfig config, BarSource source) {
        coordinator = TradingCoordinator.create(config, source, new LedgerRegistry(10_000.0), new SimpleMeterRegistry());
        return coordinator;
    }

    private static List<PredictionStatus> statuses(CycleSummary summary) {
        return summary.results().stream().map(r -> r.prediction().status()).toList();
    }

    // ==================== Validation ====================

    @Nested
    @DisplayName("Request validation")
    class Validation {

        @Test
        @DisplayName("Risk tolerance outside [0, 1] is rejected before any stage runs")
        void testBadRisk() {
            var c = coordinator(config(), market());

            assertThatThrownBy(() -> c.runCycle(new CycleRequest("alice", List.of("AAA"), 1.5)))
                .isInstanceOf(ConfigurationException.class);
            assertThat(c.recentCycles()).isEmpty();
        }

        @Test
        @DisplayName("A blank user is rejected")
        void testBlankUser() {
            var c = coordinator(config(), market());

            assertThatThrownBy(() -> c.runCycle(new CycleRequest(" ", List.of("AAA"), 0.5)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("userId");
        }
    }

    // ==================== Degraded paths ====================

    @Test
    @DisplayName("An empty batch goes straight to COMPLETE")
    void testEmptyBatch() {
        CycleSummary summary = coordinator(config(), market()).runCycle(new CycleRequest("alice", List.of(), 0.5));

        assertThat(summary.stateTrail()).containsExactly(CycleState.STARTED, CycleState.COMPLETE);
        assertThat(summary.results()).isEmpty();
        assertThat(summary.portfolio().cash()).isEqualTo(10_000.0);
    }

    @Test
    @DisplayName("Without a trained model every symbol degrades and the cycle ends after PREDICTING")
    void testUntrainedModel() {
        CycleSummary summary = coordinator(config(), market())
            .runCycle(new CycleRequest("alice", List.of("AAA", "BBB"), 0.5));

        assertThat(summary.stateTrail())
            .containsExactly(CycleState.STARTED, CycleState.PREDICTING, CycleState.COMPLETE);
        assertThat(statuses(summary)).containsOnly(PredictionStatus.ERROR);
        assertThat(summary.degradedSymbols()).isEqualTo(2);
        assertThat(summary.results().get(0).prediction().currentPrice()).isPositive();
        assertThat(summary.tradesExecuted()).isZero();
    }

    @Test
    @DisplayName("Short and unknown symbols degrade while the others are predicted")
    void testShortHistoryDegrades() throws Exception {
        var c = coordinator(config(), market());
        c.trainAll(List.of("AAA", "BBB"));

        CycleSummary summary = c.runCycle(new CycleRequest("alice", List.of("AAA", "SHORT", "NOPE"), 0.5));

        assertThat(summary.results()).extracting(SymbolResult::symbol).containsExactly("AAA", "SHORT", "NOPE");
        assertThat(statuses(summary)).containsExactly(
            PredictionStatus.PREDICTED, PredictionStatus.INSUFFICIENT_DATA, PredictionStatus.ERROR);
        assertThat(summary.degradedSymbols()).isEqualTo(2);
        assertThat(summary.results().get(1).decision()).isNull();
        assertThat(summary.results().get(0).decision()).isNotNull();
        assertThat(summary.stateTrail()).startsWith(CycleState.STARTED, CycleState.PREDICTING, CycleState.DECIDING)
            .endsWith(CycleState.COMPLETE);
    }

    @Test
    @DisplayName("Duplicate symbols are predicted once, in first-seen order")
    void testDuplicatesCollapsed() {
        CycleSummary summary = coordinator(config(), market())
            .runCycle(new CycleRequest("alice", List.of("BBB", "AAA", "BBB"), 0.5));

        assertThat(summary.results()).extracting(SymbolResult::symbol).containsExactly("BBB", "AAA");
    }

    @Test
    @DisplayName("A spent time budget returns partial results")
    void testTimeBudget() {
        BarSource slow = new BarSource() {
            @Override
            public List<Bar> history(String symbol) throws IOException {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted while loading " + symbol, e);
                }
                return TestBars.flat(symbol, 60, 10.0);
            }

            @Override
            public List<String> symbols() {
                return List.of();
            }
        };

        CycleSummary summary = coordinator(config("CYCLE_TIME_BUDGET_MS", "1"), slow)
            .runCycle(new CycleRequest("alice", List.of("AAA", "BBB"), 0.5));

        assertThat(summary.timedOut()).isTrue();
        assertThat(summary.stateTrail())
            .containsExactly(CycleState.STARTED, CycleState.PREDICTING, CycleState.COMPLETE);
        assertThat(statuses(summary)).containsOnly(PredictionStatus.ERROR);
        assertThat(summary.results().get(0).prediction().message()).contains("time budget");
    }

    // ==================== Full loop ====================

    @Test
    @DisplayName("BUY then SELL closes a lot and feeds the outcome back")
    void testBuyThenSellFeedsBack() throws Exception {
        PipelineConfig config = config("SELL_POLICY", "CLIP_TO_AVAILABLE");
        ForecastingModel forecaster = mock(ForecastingModel.class);
        when(forecaster.predict(any()))
            .thenReturn(new ForecastResult(105.0, 5.0, 0.9, 1.0))
            .thenReturn(new ForecastResult(95.0, -5.0, 0.9, 1.0));
        var source = new InMemoryBarSource().put("ZIG", TestBars.zigzag("ZIG", 80, 100.0));
        var decisions = new DecisionEngine(config);
        coordinator = new TradingCoordinator(config, source, new IndicatorEngine(), forecaster, decisions,
            new ExecutionAgent(config.getSellPolicy()), new LedgerRegistry(10_000.0), new SimpleMeterRegistry());

        CycleSummary first = coordinator.runCycle(new CycleRequest("alice", List.of("ZIG"), 0.5));

        assertThat(first.count(TradeAction.BUY)).isEqualTo(1);
        assertThat(first.tradesExecuted()).isEqualTo(1);
        assertThat(first.stateTrail()).containsExactly(CycleState.STARTED, CycleState.PREDICTING,
            CycleState.DECIDING, CycleState.EXECUTING, CycleState.COMPLETE);
        assertThat(first.portfolio().positions()).hasSize(1);

        CycleSummary second = coordinator.runCycle(new CycleRequest("alice", List.of("ZIG"), 0.5));

        assertThat(second.count(TradeAction.SELL)).isEqualTo(1);
        assertThat(second.results().get(0).execution().status()).isEqualTo(ExecutionStatus.EXECUTED);
        assertThat(second.stateTrail()).containsExactly(CycleState.STARTED, CycleState.PREDICTING,
            CycleState.DECIDING, CycleState.EXECUTING, CycleState.FEEDBACK, CycleState.COMPLETE);
        assertThat(second.feedback()).isNotEmpty();
        assertThat(second.feedback().get(0).signal().predictedChangePct()).isEqualTo(5.0);
        assertThat(decisions.feedbackSamples()).isEqualTo(second.feedback().size());
        assertThat(second.decisionMode()).isEqualTo(DecisionSource.RULE_BASED);
    }

    @Test
    @DisplayName("Feedback from a SELL executed before the time budget ran out still adapts the policy")
    void testFeedbackSurvivesTimeout() throws Exception {
        PipelineConfig config = config("SELL_POLICY", "CLIP_TO_AVAILABLE", "CYCLE_TIME_BUDGET_MS", "1000");
        ForecastingModel forecaster = mock(ForecastingModel.class);
        when(forecaster.predict(any()))
            .thenReturn(new ForecastResult(105.0, 5.0, 0.9, 1.0))
            .thenReturn(new ForecastResult(105.0, 5.0, 0.9, 1.0))
            .thenReturn(new ForecastResult(95.0, -5.0, 0.9, 1.0))
            .thenReturn(new ForecastResult(95.0, -5.0, 0.9, 1.0));
        var source = new InMemoryBarSource()
            .put("ZIG", TestBars.zigzag("ZIG", 80, 100.0))
            .put("ZAG", TestBars.zigzag("ZAG", 80, 100.0));
        var decisions = new DecisionEngine(config);
        ExecutionAgent executor = spy(new ExecutionAgent(config.getSellPolicy()));
        doAnswer(invocation -> {
            Object result = invocation.callRealMethod();
            Decision decision = invocation.getArgument(0);
            if (decision.action() == TradeAction.SELL) {
                Thread.sleep(1_500);
            }
            return result;
        }).when(executor).execute(any(), any(), any());
        coordinator = new TradingCoordinator(config, source, new IndicatorEngine(), forecaster, decisions,
            executor, new LedgerRegistry(10_000.0), new SimpleMeterRegistry());

        CycleSummary buying = coordinator.runCycle(new CycleRequest("alice", List.of("ZIG", "ZAG"), 0.5));
        assertThat(buying.tradesExecuted()).isEqualTo(2);

        CycleSummary selling = coordinator.runCycle(new CycleRequest("alice", List.of("ZIG", "ZAG"), 0.5));

        assertThat(selling.timedOut()).isTrue();
        assertThat(selling.tradesExecuted()).isEqualTo(1);
        assertThat(selling.feedback()).isNotEmpty();
        assertThat(selling.stateTrail()).containsExactly(CycleState.STARTED, CycleState.PREDICTING,
            CycleState.DECIDING, CycleState.EXECUTING, CycleState.FEEDBACK, CycleState.COMPLETE);
        assertThat(decisions.feedbackSamples()).isEqualTo(selling.feedback().size());
    }

    @Test
    @DisplayName("Asynchronous training completes on the fit thread")
    void testTrainAsync() throws Exception {
        var c = coordinator(config(), market());

        TrainingSummary training = c.trainAllAsync(List.of("AAA")).get(60, TimeUnit.SECONDS);

        assertThat(training.symbols()).containsExactly("AAA");
        assertThat(c.forecaster().isTrained()).isTrue();
    }

    @Test
    @DisplayName("Asynchronous training on too little history fails the future")
    void testTrainAsyncInsufficientData() {
        var c = coordinator(config(), market());

        assertThatThrownBy(() -> c.trainAllAsync(List.of("SHORT")).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(InsufficientDataException.class);
        assertThat(c.forecaster().isTrained()).isFalse();
    }

    @Test
    @DisplayName("Training end to end reports the fit and status reflects cycles")
    void testTrainAndStatus() throws Exception {
        var c = coordinator(config(), market());

        TrainingSummary training = c.trainAll(List.of("AAA", "BBB", "MISSING"));

        assertThat(training.skipped()).containsExactly("MISSING");
        assertThat(training.forecast().trainSize() + training.forecast().testSize()).isEqualTo(300);
        assertThat(training.decisionMode()).isEqualTo(DecisionSource.RULE_BASED);

        c.runCycle(new CycleRequest("alice", List.of("AAA"), 0.8));
        SystemStatus status = c.status();

        assertThat(status.modelTrained()).isTrue();
        assertThat(status.cyclesRun()).isEqualTo(1);
        assertThat(status.lastCycleAt()).isNotNull();
        assertThat(status.users()).containsKey("alice");
        assertThat(c.recentCycles()).hasSize(1);
    }
}
