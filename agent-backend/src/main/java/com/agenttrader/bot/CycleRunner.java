package com.agenttrader.bot;

import com.agenttrader.core.coordinator.TradingCoordinator;
import com.agenttrader.core.model.CycleRequest;
import com.agenttrader.core.model.CycleSummary;
import com.agenttrader.core.model.ExecutionStatus;
import com.agenttrader.core.model.SymbolResult;
import com.agenttrader.metrics.MetricsService;
import com.agenttrader.persistence.TradeJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a cycle and journals what it executed.
 * <p>
 * Cycles of the same user are serialised here so the journal receives their transactions in
 * ledger order; otherwise a replay could see a SELL before the BUY that opened it.
 */
public final class CycleRunner {
    private static final Logger logger = LoggerFactory.getLogger(CycleRunner.class);

    private final TradingCoordinator coordinator;
    private final TradeJournal journal;
    private final MetricsService metrics;
    private final Map<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public CycleRunner(TradingCoordinator coordinator, TradeJournal journal, MetricsService metrics) {
        this.coordinator = coordinator;
        this.journal = journal;
        this.metrics = metrics;
    }

    /**
     * @throws com.agenttrader.core.exception.ConfigurationException when the request is malformed
     */
    public CycleSummary run(CycleRequest request) {
        ReentrantLock lock = userLocks.computeIfAbsent(String.valueOf(request.userId()), id -> new ReentrantLock());
        lock.lock();
        try {
            CycleSummary summary = coordinator.runCycle(request);
            journal(summary);
            metrics.recordCycle(summary);
            return summary;
        } finally {
            lock.unlock();
        }
    }

    private void journal(CycleSummary summary) {
        int journaled = 0;
        for (SymbolResult result : summary.results()) {
            var execution = result.execution();
            if (execution != null && execution.status() == ExecutionStatus.EXECUTED && execution.transaction() != null) {
                journal.recordTransaction(execution.transaction());
                journaled++;
            }
        }
        journal.recordFeedback(summary.feedback());
        if (journaled > 0) {
            logger.info("Cycle {}: journaled {} transactions, {} feedback records", summary.cycleId(), journaled,
                summary.feedback().size());
        }
    }

    public TradingCoordinator coordinator() {
        return coordinator;
    }
}
