package com.quantflow.live;

import com.quantflow.broker.BrokerClient;
import com.quantflow.broker.BrokerException;
import com.quantflow.core.engine.BarSource;
import com.quantflow.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Live bar feed that polls the broker until a new completed bar is available.
 *
 * <p>{@link #next()} blocks between polls. Bars are emitted once each, in timestamp order, only
 * after they have closed and only when they fall inside the trading session. A failed poll is
 * logged and retried on the next interval; malformed bars propagate. {@link #close()} may be
 * called from any thread and makes a blocked {@code next()} return end of stream.
 */
public final class PollingBarSource implements BarSource {
    private static final Logger logger = LoggerFactory.getLogger(PollingBarSource.class);
    private static final int INITIAL_LOOKBACK_BARS = 5;

    private final BrokerClient broker;
    private final String instrument;
    private final TradingSessionFilter session;
    private final Duration pollInterval;
    private final Clock clock;
    private final Deque<Bar> pending = new ArrayDeque<>();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private Instant lastSeen;

    /**
     * @param after only bars strictly later than this are emitted; null starts from the most recent bars
     */
    public PollingBarSource(BrokerClient broker, String instrument, TradingSessionFilter session,
                            Duration pollInterval, Instant after, Clock clock) {
        this.broker = broker;
        this.instrument = instrument;
        this.session = session;
        this.pollInterval = pollInterval;
        this.lastSeen = after;
        this.clock = clock;
    }

    @Override
    public Optional<Bar> next() {
        try {
            while (stopped.getCount() > 0) {
                if (!pending.isEmpty()) {
                    return Optional.of(pending.removeFirst());
                }
                poll();
                if (pending.isEmpty() && stopped.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("{}: bar polling interrupted", instrument);
        }
        return Optional.empty();
    }

    private void poll() {
        Instant now = clock.instant();
        Instant from = lastSeen != null
            ? lastSeen
            : now.minus(session.barDuration().multipliedBy(INITIAL_LOOKBACK_BARS));

        List<Bar> bars;
        try {
            bars = broker.getBars(instrument, from, now);
        } catch (BrokerException e) {
            logger.warn("{}: bar poll failed, retrying in {}s: {}", instrument, pollInterval.toSeconds(), e.getMessage());
            return;
        }

        bars.stream()
            .sorted(Comparator.comparing(Bar::timestamp))
            .filter(bar -> lastSeen == null || bar.timestamp().isAfter(lastSeen))
            .filter(bar -> session.isComplete(bar.timestamp(), now))
            .filter(session::accepts)
            .forEach(bar -> {
                pending.addLast(bar);
                lastSeen = bar.timestamp();
            });
        if (!pending.isEmpty()) {
            logger.debug("{}: {} new bar(s), latest {}", instrument, pending.size(), lastSeen);
        }
    }

    /** Timestamp of the most recent bar queued or emitted. */
    public Optional<Instant> lastSeen() {
        return Optional.ofNullable(lastSeen);
    }

    @Override
    public void close() {
        if (stopped.getCount() > 0) {
            stopped.countDown();
            logger.info("{}: bar polling stopped", instrument);
        }
    }
}
