package com.agenttrader.core.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One ledger per user, created on first use.
 * <p>
 * {@link #withLedger} is the single-writer entry point: work for the same user is serialised on
 * that user's ledger lock, while different users proceed in parallel.
 */
public final class LedgerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LedgerRegistry.class);

    private final Map<String, PortfolioLedger> ledgers = new ConcurrentHashMap<>();
    private final double initialCash;

    public LedgerRegistry(double initialCash) {
        this.initialCash = initialCash;
    }

    public PortfolioLedger ledgerFor(String userId) {
        return ledgers.computeIfAbsent(userId, id -> {
            logger.info("Opening ledger for {} with ${}", id, String.format("%.2f", initialCash));
            return new PortfolioLedger(id, initialCash);
        });
    }

    public <T> T withLedger(String userId, Function<PortfolioLedger, T> work) {
        PortfolioLedger ledger = ledgerFor(userId);
        return ledger.withLock(() -> work.apply(ledger));
    }

    /** Install a ledger rebuilt elsewhere, e.g. from a journal. Replaces any existing one. */
    public void register(PortfolioLedger ledger) {
        ledgers.put(ledger.userId(), ledger);
    }

    public Optional<PortfolioLedger> find(String userId) {
        return Optional.ofNullable(ledgers.get(userId));
    }

    public List<String> users() {
        return ledgers.keySet().stream().sorted().toList();
    }

    public double initialCash() {
        return initialCash;
    }
}
