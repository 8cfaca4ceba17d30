package com.agenttrader.core.execution;

import com.agenttrader.core.exception.InsufficientFundsException;
import com.agenttrader.core.exception.InsufficientSharesException;
import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.ledger.SaleResult;
import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.ExecutionResult;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a decision into an order against a ledger.
 * <p>
 * Quantity is {@code floor(suggested_position_size * total_value / price)} for both sides.
 * Business failures (funds, shares, zero size) come back as FAILED or SKIPPED results and are
 * never thrown.
 */
public final class ExecutionAgent {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionAgent.class);

    private final SellPolicy sellPolicy;

    public ExecutionAgent(SellPolicy sellPolicy) {
        this.sellPolicy = sellPolicy;
    }

    public ExecutionResult execute(Decision decision, SizingContext sizing, PortfolioLedger ledger) {
        String symbol = decision.symbol();
        double price = sizing.currentPrice();

        if (decision.action() == TradeAction.HOLD) {
            return ExecutionResult.held(symbol, price);
        }
        if (!(price > 0) || !Double.isFinite(price)) {
            return ExecutionResult.failed(symbol, decision.action(), price, "No valid price for " + symbol);
        }

        double notional = decision.suggestedPositionSize() * sizing.totalValue();
        long quantity = (long) Math.floor(notional / price);

        if (decision.action() == TradeAction.BUY) {
            return buy(decision, symbol, quantity, price, notional, ledger);
        }
        return sell(decision, symbol, quantity, price, notional, ledger);
    }

    private ExecutionResult buy(Decision decision, String symbol, long quantity, double price, double notional,
                                PortfolioLedger ledger) {
        if (quantity <= 0) {
            logger.info("⏭️ {} BUY skipped: ${} buys 0 shares at ${}", symbol,
                String.format("%.2f", notional), String.format("%.2f", price));
            return ExecutionResult.skipped(symbol, TradeAction.BUY, price, "Position size rounds to 0 shares");
        }
        try {
            Transaction tx = ledger.buy(symbol, quantity, price, decision.signal());
            return ExecutionResult.executed(tx, TradeAction.BUY, List.of());
        } catch (InsufficientFundsException e) {
            logger.warn("❌ {} BUY failed: {}", symbol, e.getMessage());
            return ExecutionResult.failed(symbol, TradeAction.BUY, price, e.getMessage());
        }
    }

    private ExecutionResult sell(Decision decision, String symbol, long quantity, double price, double notional,
                                 PortfolioLedger ledger) {
        if (quantity <= 0) {
            logger.info("⏭️ {} SELL skipped: ${} sells 0 shares at ${}", symbol,
                String.format("%.2f", notional), String.format("%.2f", price));
            return ExecutionResult.skipped(symbol, TradeAction.SELL, price, "Position size rounds to 0 shares");
        }
        long held = ledger.position(symbol).map(p -> p.quantity()).orElse(0L);
        long toSell = quantity;
        if (sellPolicy == SellPolicy.CLIP_TO_AVAILABLE && held > 0 && quantity > held) {
            logger.info("{} SELL clipped from {} to held {} shares", symbol, quantity, held);
            toSell = held;
        }
        try {
            SaleResult sale = ledger.sell(symbol, toSell, price);
            return ExecutionResult.executed(sale.transaction(), TradeAction.SELL, sale.feedback());
        } catch (InsufficientSharesException e) {
            logger.warn("❌ {} SELL failed: {}", symbol, e.getMessage());
            return ExecutionResult.failed(symbol, TradeAction.SELL, price, e.getMessage());
        }
    }
}
