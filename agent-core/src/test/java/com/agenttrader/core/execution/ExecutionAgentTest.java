package com.agenttrader.core.execution;

import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.ExecutionResult;
import com.agenttrader.core.model.ExecutionStatus;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.TradeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ExecutionAgent Tests")
class ExecutionAgentTest {

    private static final double DELTA = 1e-9;
    private static final TradeSignal SIGNAL = new TradeSignal(2.0, 0.8, 50, 0.1, 0.5, 0.5);

    private PortfolioLedger ledger;
    private ExecutionAgent agent;

    @BeforeEach
    void setUp() {
        ledger = new PortfolioLedger("alice", 1000.0);
        agent = new ExecutionAgent(SellPolicy.HARD_FAIL);
    }

    private static Decision decision(TradeAction action, double size, double price) {
        return new Decision("AAPL", action, 0.8, List.of("test"), size, null, null,
            DecisionSource.RULE_BASED, price, SIGNAL);
    }

    // ==================== BUY ====================

    @Nested
    @DisplayName("Buy orders")
    class BuyOrders {

        @Test
        @DisplayName("Half the portfolio at $100 buys five shares")
        void testSizing() {
            ExecutionResult r = agent.execute(decision(TradeAction.BUY, 0.5, 100), new SizingContext(100, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.EXECUTED);
            assertThat(r.quantity()).isEqualTo(5);
            assertThat(r.total()).isCloseTo(500.0, within(DELTA));
            assertThat(r.transaction()).isNotNull();
            assertThat(r.feedback()).isEmpty();
            assertThat(ledger.cash()).isCloseTo(500.0, within(DELTA));
        }

        @Test
        @DisplayName("Fractional share counts round down")
        void testFloor() {
            ExecutionResult r = agent.execute(decision(TradeAction.BUY, 0.1, 33), new SizingContext(33, 1000), ledger);

            assertThat(r.quantity()).isEqualTo(3);
        }

        @Test
        @DisplayName("A size worth less than one share is skipped")
        void testSkipped() {
            ExecutionResult r = agent.execute(decision(TradeAction.BUY, 0.05, 100), new SizingContext(100, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.SKIPPED);
            assertThat(r.reason()).contains("0 shares");
            assertThat(ledger.transactions()).isEmpty();
        }

        @Test
        @DisplayName("Lack of cash is a failed result, not an exception")
        void testInsufficientFunds() {
            ExecutionResult r = agent.execute(decision(TradeAction.BUY, 1.0, 100), new SizingContext(100, 5000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(r.reason()).contains("Insufficient funds");
            assertThat(ledger.cash()).isCloseTo(1000.0, within(DELTA));
            assertThat(ledger.positions()).isEmpty();
        }

        @Test
        @DisplayName("A missing price fails the order")
        void testBadPrice() {
            ExecutionResult r = agent.execute(decision(TradeAction.BUY, 0.5, 0), new SizingContext(0, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.FAILED);
        }
    }

    // ==================== SELL ====================

    @Nested
    @DisplayName("Sell orders")
    class SellOrders {

        @BeforeEach
        void holdShares() throws Exception {
            ledger.buy("AAPL", 3, 100.0, SIGNAL);
        }

        @Test
        @DisplayName("Selling more than held fails under the hard-fail policy")
        void testHardFail() {
            ExecutionResult r = agent.execute(decision(TradeAction.SELL, 0.5, 100), new SizingContext(100, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(ledger.position("AAPL").orElseThrow().quantity()).isEqualTo(3);
        }

        @Test
        @DisplayName("Clip policy sells what is held")
        void testClip() {
            var clipping = new ExecutionAgent(SellPolicy.CLIP_TO_AVAILABLE);

            ExecutionResult r = clipping.execute(decision(TradeAction.SELL, 0.5, 110), new SizingContext(110, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.EXECUTED);
            assertThat(r.quantity()).isEqualTo(3);
            assertThat(r.profitLoss()).isCloseTo(30.0, within(DELTA));
            assertThat(ledger.position("AAPL")).isEmpty();
        }

        @Test
        @DisplayName("Clip policy still fails with nothing held")
        void testClipNothingHeld() {
            var clipping = new ExecutionAgent(SellPolicy.CLIP_TO_AVAILABLE);
            Decision d = new Decision("MSFT", TradeAction.SELL, 0.8, List.of("test"), 0.5, null, null,
                DecisionSource.RULE_BASED, 100, SIGNAL);

            ExecutionResult r = clipping.execute(d, new SizingContext(100, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        @DisplayName("A successful sell carries feedback for the closed lot")
        void testSellFeedback() {
            ExecutionResult r = agent.execute(decision(TradeAction.SELL, 0.2, 100), new SizingContext(100, 1000), ledger);

            assertThat(r.status()).isEqualTo(ExecutionStatus.EXECUTED);
            assertThat(r.quantity()).isEqualTo(2);
            assertThat(r.feedback()).hasSize(1);
            assertThat(r.feedback().get(0).signal()).isEqualTo(SIGNAL);
        }
    }

    @Test
    @DisplayName("HOLD never touches the ledger")
    void testHold() {
        Decision hold = Decision.hold("AAPL", 0.3, List.of("flat"), DecisionSource.RULE_BASED, 100, SIGNAL);

        ExecutionResult r = agent.execute(hold, new SizingContext(100, 1000), ledger);

        assertThat(r.status()).isEqualTo(ExecutionStatus.HELD);
        assertThat(r.action()).isEqualTo(TradeAction.HOLD);
        assertThat(ledger.transactions()).isEmpty();
    }
}
