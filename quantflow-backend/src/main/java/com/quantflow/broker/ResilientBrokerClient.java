package com.quantflow.broker;

import com.quantflow.core.model.Bar;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates a {@link BrokerClient} with resilience patterns.
 *
 * Features:
 * - Circuit Breaker: stops calling a broker that keeps failing
 * - Rate Limiter: respects Alpaca's 200 req/min limit
 * - Retry: retries transient failures (429, 5xx, I/O) with backoff
 * - Metrics: call latency and success/failure counts per operation
 */
public final class ResilientBrokerClient implements BrokerClient {
    private static final Logger logger = LoggerFactory.getLogger(ResilientBrokerClient.class);

    private final BrokerClient delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final MeterRegistry meterRegistry;

    public ResilientBrokerClient(BrokerClient delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, Duration.ofMillis(500));
    }

    ResilientBrokerClient(BrokerClient delegate, MeterRegistry meterRegistry, Duration retryWait) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;

        // Open after 50% failures in 10 calls, retry after 30s half-open
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(5)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreException(e -> e instanceof BrokerException broker && !broker.isRetryable())
            .build();
        this.circuitBreaker = CircuitBreaker.of("broker-api", cbConfig);

        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(200)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofSeconds(5))
            .build();
        this.rateLimiter = RateLimiter.of("broker-api", rlConfig);

        var retryConfig = RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(retryWait)
            .retryOnException(e -> e instanceof BrokerException broker && broker.isRetryable())
            .build();
        this.retry = Retry.of("broker-api", retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Circuit breaker state changed: {}", event.getStateTransition()));

        logger.info("ResilientBrokerClient initialized with circuit breaker, rate limiter, and retry");
    }

    /**
     * Manually reset the circuit breaker, e.g. once the broker is known to be back.
     */
    public void resetCircuitBreaker() {
        logger.info("Manual circuit breaker reset requested");
        circuitBreaker.reset();
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Execute a call with full resilience: rate limit -> retry -> circuit breaker -> metrics
     */
    private <T> T executeResilient(String operation, Supplier<T> supplier) {
        var timer = Timer.builder("broker.api.call")
            .tag("operation", operation)
            .register(meterRegistry);

        return timer.record(() -> {
            try {
                var decoratedSupplier = RateLimiter.decorateSupplier(rateLimiter,
                    Retry.decorateSupplier(retry,
                        CircuitBreaker.decorateSupplier(circuitBreaker, supplier)));

                T result = decoratedSupplier.get();

                meterRegistry.counter("broker.api.success",
                    "operation", operation).increment();
                return result;

            } catch (RuntimeException e) {
                meterRegistry.counter("broker.api.failure",
                    "operation", operation,
                    "error", e.getClass().getSimpleName()).increment();

                logger.error("Broker call failed after retries: {}: {}", operation, e.getMessage());
                if (e instanceof BrokerException) {
                    throw e;
                }
                // Circuit open or rate limit wait exceeded
                throw new BrokerException("Broker call not permitted: " + operation, e, false);
            }
        });
    }

    @Override
    public List<Bar> getBars(String instrument, Instant start, Instant end) {
        return executeResilient("getBars", () -> delegate.getBars(instrument, start, end));
    }

    @Override
    public BrokerOrder submitOrder(OrderRequest request) {
        return executeResilient("submitOrder", () -> delegate.submitOrder(request));
    }

    @Override
    public BrokerOrder getOrder(String orderId) {
        return executeResilient("getOrder", () -> delegate.getOrder(orderId));
    }

    @Override
    public void cancelOrder(String orderId) {
        executeResilient("cancelOrder", () -> {
            delegate.cancelOrder(orderId);
            return null;
        });
    }

    @Override
    public long getPositionQuantity(String instrument) {
        return executeResilient("getPositionQuantity", () -> delegate.getPositionQuantity(instrument));
    }
}
