package com.agenttrader.core.data;

import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.model.Bar;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates a {@link BarSource} with retry and a circuit breaker.
 * <p>
 * I/O failures are retried; unknown symbols are not retried and do not count against the breaker.
 * Chain: Retry -> CircuitBreaker -> delegate.
 */
public final class ResilientBarSource implements BarSource {
    private static final Logger logger = LoggerFactory.getLogger(ResilientBarSource.class);

    private final BarSource delegate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final MeterRegistry meterRegistry;

    public ResilientBarSource(BarSource delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, 3, Duration.ofMillis(500));
    }

    public ResilientBarSource(BarSource delegate, MeterRegistry meterRegistry, int maxAttempts, Duration retryWait) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;

        // Open after 50% failures in 10 calls, probe again after 30s
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreExceptions(UnknownSymbol.class)
            .build();
        this.circuitBreaker = CircuitBreaker.of("bar-source", cbConfig);

        var retryConfig = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(retryWait)
            .retryExceptions(UncheckedIOException.class)
            .ignoreExceptions(UnknownSymbol.class, CallNotPermittedException.class)
            .build();
        this.retry = Retry.of("bar-source", retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> logger.warn("Bar source circuit breaker: {}", event.getStateTransition()));
        retry.getEventPublisher()
            .onRetry(event -> logger.info("🔄 Retrying bar load (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    public List<Bar> history(String symbol) throws InvalidSymbolException, IOException {
        try {
            return executeResilient("history", () -> {
                try {
                    return delegate.history(symbol);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                } catch (InvalidSymbolException e) {
                    throw new UnknownSymbol(e);
                }
            });
        } catch (UnknownSymbol e) {
            throw e.original;
        }
    }

    @Override
    public List<String> symbols() throws IOException {
        return executeResilient("symbols", () -> {
            try {
                return delegate.symbols();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private <T> T executeResilient(String operation, Supplier<T> supplier) throws IOException {
        var timer = Timer.builder("bar.source.call")
            .tag("operation", operation)
            .register(meterRegistry);
        try {
            var decorated = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, supplier));
            T result = timer.record(decorated);
            meterRegistry.counter("bar.source.success", "operation", operation).increment();
            return result;
        } catch (UncheckedIOException e) {
            meterRegistry.counter("bar.source.failure", "operation", operation, "error", "io").increment();
            logger.error("Bar source {} failed after retries: {}", operation, e.getCause().getMessage());
            throw e.getCause();
        } catch (CallNotPermittedException e) {
            meterRegistry.counter("bar.source.failure", "operation", operation, "error", "circuit_open").increment();
            throw new IOException("Bar source unavailable (circuit open)", e);
        }
    }

    /** Carries an InvalidSymbolException through the Supplier-based decorators. */
    private static final class UnknownSymbol extends RuntimeException {
        private final InvalidSymbolException original;

        UnknownSymbol(InvalidSymbolException original) {
            super(original.getMessage(), original, false, false);
            this.original = original;
        }
    }
}
