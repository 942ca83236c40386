package com.quantflow.live;

import com.quantflow.broker.BrokerClient;
import com.quantflow.broker.BrokerException;
import com.quantflow.broker.BrokerOrder;
import com.quantflow.broker.OrderRequest;
import com.quantflow.core.config.ExecutionSettings;
import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.execution.CommissionModel;
import com.quantflow.core.execution.ExecutionAdapter;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends approved intents to the broker and waits, bounded by the order timeout, for the order to
 * reach a final state.
 *
 * <p>A filled order, or a cancelled one with a partial fill, becomes a {@link Fill} at the broker's
 * average price. Rejection, broker failure and timeout raise {@link OrderExecutionException}. On
 * timeout the order is cancelled so that it cannot fill behind the pipeline's back, and whatever
 * filled before the cancel is still returned as a fill.
 */
public final class LiveExecutionAdapter implements ExecutionAdapter, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LiveExecutionAdapter.class);

    private final BrokerClient broker;
    private final CommissionModel commissions;
    private final Duration pollInterval;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public LiveExecutionAdapter(BrokerClient broker, ExecutionSettings settings, Duration orderTimeout,
                                Duration pollInterval) {
        this.broker = broker;
        this.commissions = new CommissionModel(settings);
        this.pollInterval = pollInterval;
        this.timeLimiter = TimeLimiter.of("order-execution", TimeLimiterConfig.custom()
            .timeoutDuration(orderTimeout)
            .cancelRunningFuture(true)
            .build());
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "order-execution");
            t.setDaemon(true);
            return t;
        });
        logger.info("Live execution: order timeout {}ms, fill poll {}ms", orderTimeout.toMillis(), pollInterval.toMillis());
    }

    @Override
    public Fill execute(OrderIntent intent, Bar bar) throws OrderExecutionException {
        var request = OrderRequest.from(intent, UUID.randomUUID().toString());
        var orderId = new AtomicReference<String>();

        BrokerOrder order;
        try {
            order = timeLimiter.executeFutureSupplier(
                () -> executor.submit(() -> submitAndAwait(request, orderId)));
        } catch (TimeoutException e) {
            String timedOut = String.format("%s %d %s not filled within %dms", intent.direction(),
                intent.quantity(), intent.instrument(), timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
            order = cancelAfterTimeout(orderId.get())
                .filter(BrokerOrder::hasFills)
                .orElseThrow(() -> OrderExecutionException.timedOut(timedOut, e));
            logger.warn("{}: {}, keeping the {} shares filled before cancel", intent.instrument(), timedOut,
                order.filledQuantity());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OrderExecutionException("Broker order failed: " + cause.getMessage(), cause);
        } catch (BrokerException e) {
            throw new OrderExecutionException("Broker order failed: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new OrderExecutionException("Order execution failed: " + e.getMessage(), e);
        }

        if (!order.hasFills()) {
            throw new OrderExecutionException(String.format("Order %s ended %s without a fill", order.id(), order.status()));
        }
        long quantity = Math.min(order.filledQuantity(), intent.quantity());
        if (quantity < intent.quantity()) {
            logger.warn("{}: order {} partially filled {}/{}", intent.instrument(), order.id(), quantity, intent.quantity());
        }
        var commission = commissions.commissionFor(order.filledAveragePrice().multiply(BigDecimal.valueOf(quantity)));
        return new Fill(intent, order.filledAveragePrice(), quantity, commission, bar.timestamp());
    }

    private BrokerOrder submitAndAwait(OrderRequest request, AtomicReference<String> orderId) throws InterruptedException {
        BrokerOrder order = broker.submitOrder(request);
        orderId.set(order.id());
        logger.info("{}: order {} submitted ({} {} {})", request.instrument(), order.id(), request.side(),
            request.quantity(), request.type());
        while (!order.isTerminal()) {
            Thread.sleep(pollInterval.toMillis());
            order = broker.getOrder(order.id());
        }
        return order;
    }

    // Final broker view of a cancelled order; empty when the order was never acknowledged or cannot be read
    private Optional<BrokerOrder> cancelAfterTimeout(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        try {
            broker.cancelOrder(orderId);
        } catch (BrokerException e) {
            logger.error("Failed to cancel timed out order {}: {}", orderId, e.getMessage());
        }
        try {
            return Optional.of(broker.getOrder(orderId));
        } catch (BrokerException e) {
            logger.error("Failed to read timed out order {}: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String mode() {
        return "live";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
