package com.agenttrader.core.ledger;

import com.agenttrader.core.exception.InsufficientFundsException;
import com.agenttrader.core.exception.InsufficientSharesException;
import com.agenttrader.core.exception.LedgerCorruptionException;
import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.PerformanceStats;
import com.agenttrader.core.model.PortfolioSnapshot;
import com.agenttrader.core.model.Position;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.TradeSignal;
import com.agenttrader.core.model.Transaction;
import com.agenttrader.core.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Cash, positions and the transaction log of one user.
 * <p>
 * Every operation runs under the ledger's own reentrant lock, and every mutation validates
 * before it changes anything, so a failed buy or sell leaves the ledger exactly as it was.
 * After each mutation the invariants are re-checked:
 * <ul>
 *   <li>{@code cash >= 0}</li>
 *   <li>every position has {@code quantity > 0} and its lots add up to it</li>
 *   <li>{@code cash + Σ avg_buy_price * quantity == initial_cash + realised P&L}</li>
 * </ul>
 * A violation raises {@link LedgerCorruptionException}. Total value is always derived as
 * {@code cash + Σ current_value} in {@link #snapshot()}, so it holds by construction.
 * <p>
 * Positions are kept as FIFO lots so a SELL can be compared with the signal that opened each lot.
 */
public final class PortfolioLedger {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioLedger.class);
    private static final double TOLERANCE = 1e-6;

    private final String userId;
    private final double initialCash;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double cash;
    private double realisedPnl;
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();

    private static final class Lot {
        long quantity;
        final double price;
        final TradeSignal signal;

        Lot(long quantity, double price, TradeSignal signal) {
            this.quantity = quantity;
            this.price = price;
            this.signal = signal;
        }
    }

    private static final class Holding {
        final Deque<Lot> lots = new ArrayDeque<>();
        long quantity;
        double avgBuyPrice;
        double lastPrice;
    }

    public PortfolioLedger(String userId, double initialCash) {
        this(userId, initialCash, Clock.systemUTC());
    }

    public PortfolioLedger(String userId, double initialCash, Clock clock) {
        if (!(initialCash >= 0) || !Double.isFinite(initialCash)) {
            throw new IllegalArgumentException("initial cash must be finite and non-negative: " + initialCash);
        }
        this.userId = userId;
        this.initialCash = initialCash;
        this.cash = initialCash;
        this.clock = clock;
    }

    /**
     * Run {@code work} while holding this ledger's lock, so a sequence of operations is seen
     * by other writers as one unit.
     */
    public <T> T withLock(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public Transaction buy(String symbol, long quantity, double price) throws InsufficientFundsException {
        return buy(symbol, quantity, price, null);
    }

    /**
     * Buy shares, opening a lot tagged with the signal that motivated it.
     *
     * @param signal inputs of the opening decision, may be {@code null}
     * @throws InsufficientFundsException when {@code quantity * price} exceeds cash
     */
    public Transaction buy(String symbol, long quantity, double price, TradeSignal signal)
        throws InsufficientFundsException {
        return applyBuy(symbol, quantity, price, signal, null);
    }

    /**
     * @param recorded journaled transaction being replayed; appended as is instead of a new one
     */
    private Transaction applyBuy(String symbol, long quantity, double price, TradeSignal signal, Transaction recorded)
        throws InsufficientFundsException {
        requireOrder(symbol, quantity, price);
        lock.lock();
        try {
            double total = quantity * price;
            if (total > cash) {
                throw new InsufficientFundsException(symbol, total, cash);
            }

            Holding h = holdings.computeIfAbsent(symbol, s -> new Holding());
            long newQuantity = h.quantity + quantity;
            h.avgBuyPrice = (h.avgBuyPrice * h.quantity + price * quantity) / newQuantity;
            h.quantity = newQuantity;
            h.lastPrice = price;
            h.lots.addLast(new Lot(quantity, price, signal));
            cash -= total;

            var tx = recorded != null ? recorded
                : new Transaction(userId, symbol, TransactionType.BUY, quantity, price, total, null, clock.instant());
            transactions.add(tx);
            checkInvariants();
            if (recorded != null) {
                return tx;
            }
            logger.info("[{}] BUY {} x {} @ ${} (cash ${})", userId, quantity, symbol,
                String.format("%.2f", price), String.format("%.2f", cash));
            return tx;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sell shares. Realised P&L is measured against the position's average buy price; feedback
     * is emitted per closed lot, oldest lots first.
     *
     * @throws InsufficientSharesException when the position holds fewer than {@code quantity} shares
     */
    public SaleResult sell(String symbol, long quantity, double price) throws InsufficientSharesException {
        return applySell(symbol, quantity, price, null);
    }

    private SaleResult applySell(String symbol, long quantity, double price, Transaction recorded)
        throws InsufficientSharesException {
        requireOrder(symbol, quantity, price);
        lock.lock();
        try {
            Holding h = holdings.get(symbol);
            long held = h == null ? 0 : h.quantity;
            if (quantity > held) {
                throw new InsufficientSharesException(symbol, quantity, held);
            }

            Instant now = recorded != null ? recorded.timestamp() : clock.instant();
            double total = quantity * price;
            double profitLoss = (price - h.avgBuyPrice) * quantity;
            List<Feedback> feedback = new ArrayList<>();

            long remaining = quantity;
            while (remaining > 0) {
                Lot lot = h.lots.peekFirst();
                long take = Math.min(remaining, lot.quantity);
                feedback.add(Feedback.closed(userId, symbol, TradeAction.BUY, take, lot.price, price, lot.signal, now));
                lot.quantity -= take;
                remaining -= take;
                if (lot.quantity == 0) {
                    h.lots.removeFirst();
                }
            }

            h.quantity -= quantity;
            h.lastPrice = price;
            if (h.quantity == 0) {
                holdings.remove(symbol);
            }
            cash += total;
            realisedPnl += profitLoss;

            var tx = recorded != null ? recorded
                : new Transaction(userId, symbol, TransactionType.SELL, quantity, price, total, profitLoss, now);
            transactions.add(tx);
            checkInvariants();
            if (recorded != null) {
                return new SaleResult(tx, feedback);
            }
            logger.info("[{}] SELL {} x {} @ ${} P&L ${}", userId, quantity, symbol,
                String.format("%.2f", price), String.format("%+.2f", profitLoss));
            return new SaleResult(tx, feedback);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Revalue positions at the given prices. Symbols not in {@code prices} keep their last price.
     * Cash is never touched.
     */
    public PortfolioSnapshot markToMarket(Map<String, Double> prices) {
        lock.lock();
        try {
            for (var entry : prices.entrySet()) {
                Holding h = holdings.get(entry.getKey());
                Double p = entry.getValue();
                if (h == null) {
                    continue;
                }
                if (p == null || !(p > 0) || !Double.isFinite(p)) {
                    logger.warn("[{}] Ignoring unusable mark for {}: {}", userId, entry.getKey(), p);
                    continue;
                }
                h.lastPrice = p;
            }
            checkInvariants();
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    public PortfolioSnapshot snapshot() {
        lock.lock();
        try {
            List<Position> positions = positions();
            double total = cash;
            for (Position p : positions) {
                total += p.currentValue();
            }
            return new PortfolioSnapshot(userId, cash, positions, total, initialCash, total - initialCash, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public double totalValue() {
        return snapshot().totalValue();
    }

    public double cash() {
        lock.lock();
        try {
            return cash;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Position> position(String symbol) {
        lock.lock();
        try {
            Holding h = holdings.get(symbol);
            return h == null ? Optional.empty() : Optional.of(toPosition(symbol, h));
        } finally {
            lock.unlock();
        }
    }

    public List<Position> positions() {
        lock.lock();
        try {
            List<Position> out = new ArrayList<>(holdings.size());
            holdings.forEach((symbol, h) -> out.add(toPosition(symbol, h)));
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<Transaction> transactions() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(transactions));
        } finally {
            lock.unlock();
        }
    }

    public PerformanceStats performance() {
        List<Transaction> log = transactions();
        if (log.isEmpty()) {
            return PerformanceStats.EMPTY;
        }
        int buys = 0;
        int sells = 0;
        int wins = 0;
        int losses = 0;
        double realised = 0.0;
        for (Transaction tx : log) {
            if (tx.type() == TransactionType.BUY) {
                buys++;
                continue;
            }
            sells++;
            double pnl = tx.profitLoss() == null ? 0.0 : tx.profitLoss();
            realised += pnl;
            if (pnl > 0) {
                wins++;
            } else if (pnl < 0) {
                losses++;
            }
        }
        double winRate = sells == 0 ? 0.0 : (double) wins / sells;
        return new PerformanceStats(log.size(), buys, sells, wins, losses, winRate, realised);
    }

    public String userId() {
        return userId;
    }

    public double initialCash() {
        return initialCash;
    }

    /**
     * Rebuild a ledger by replaying a stored transaction log in order. The stored transactions are
     * kept unchanged in the rebuilt log. Replayed lots carry no signal, so closing them produces
     * unlabelled feedback.
     *
     * @throws LedgerCorruptionException when the log does not replay cleanly
     */
    public static PortfolioLedger replay(String userId, double initialCash, List<Transaction> history) {
        var ledger = new PortfolioLedger(userId, initialCash);
        for (Transaction tx : history) {
            try {
                if (tx.type() == TransactionType.BUY) {
                    ledger.applyBuy(tx.symbol(), tx.quantity(), tx.price(), null, tx);
                } else {
                    ledger.applySell(tx.symbol(), tx.quantity(), tx.price(), tx);
                }
            } catch (InsufficientFundsException | InsufficientSharesException e) {
                throw new LedgerCorruptionException("Stored history for " + userId + " does not replay: " + e.getMessage());
            }
        }
        logger.info("[{}] Ledger replayed from {} transactions", userId, history.size());
        return ledger;
    }

    private Position toPosition(String symbol, Holding h) {
        double value = h.quantity * h.lastPrice;
        return new Position(symbol, h.quantity, h.avgBuyPrice, h.lastPrice, value,
            (h.lastPrice - h.avgBuyPrice) * h.quantity);
    }

    private void checkInvariants() {
        if (cash < 0 || !Double.isFinite(cash)) {
            throw new LedgerCorruptionException("[" + userId + "] cash went negative: " + cash);
        }
        double costBasis = 0.0;
        for (var entry : holdings.entrySet()) {
            Holding h = entry.getValue();
            if (h.quantity <= 0) {
                throw new LedgerCorruptionException("[" + userId + "] non-positive position in " + entry.getKey());
            }
            long lotTotal = 0;
            for (Lot lot : h.lots) {
                lotTotal += lot.quantity;
            }
            if (lotTotal != h.quantity) {
                throw new LedgerCorruptionException("[" + userId + "] lots of " + entry.getKey()
                    + " sum to " + lotTotal + " but position holds " + h.quantity);
            }
            costBasis += h.quantity * h.avgBuyPrice;
        }
        double expected = initialCash + realisedPnl;
        if (Math.abs(cash + costBasis - expected) > TOLERANCE * Math.max(1.0, Math.abs(expected))) {
            throw new LedgerCorruptionException("[" + userId + "] cash + cost basis " + (cash + costBasis)
                + " != initial cash + realised P&L " + expected);
        }
    }

    private static void requireOrder(String symbol, long quantity, double price) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        if (!(price > 0) || !Double.isFinite(price)) {
            throw new IllegalArgumentException("price must be positive and finite: " + price);
        }
    }
}
