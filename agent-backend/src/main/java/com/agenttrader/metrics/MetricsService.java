package com.agenttrader.metrics;

import com.agenttrader.core.model.CycleSummary;
import com.agenttrader.core.model.PortfolioSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide Prometheus registry. The coordinator records its own meters into
 * {@link #getRegistry()}; this class adds portfolio gauges fed from cycle summaries.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;
    private final Map<String, AtomicReference<Double>> portfolioValues = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<Double>> portfolioCash = new ConcurrentHashMap<>();

    private MetricsService() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        logger.info("MetricsService initialized with Prometheus registry");
    }

    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /** Prometheus text exposition of every registered meter. */
    public String scrape() {
        return registry.scrape();
    }

    public void recordCycle(CycleSummary summary) {
        recordPortfolio(summary.portfolio());
        registry.counter("agent.trades.executed", "user", summary.userId()).increment(summary.tradesExecuted());
        registry.summary("agent.cycle.symbols").record(summary.results().size());
    }

    public void recordPortfolio(PortfolioSnapshot snapshot) {
        gauge(portfolioValues, "agent.portfolio.value", snapshot.userId()).set(snapshot.totalValue());
        gauge(portfolioCash, "agent.portfolio.cash", snapshot.userId()).set(snapshot.cash());
    }

    private AtomicReference<Double> gauge(Map<String, AtomicReference<Double>> holders, String name, String userId) {
        return holders.computeIfAbsent(userId, id -> {
            var holder = new AtomicReference<>(0.0);
            registry.gauge(name, Tags.of("user", id), holder, AtomicReference::get);
            return holder;
        });
    }
}
