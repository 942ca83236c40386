package com.quantflow.core.portfolio;

import com.quantflow.core.model.Direction;
import com.quantflow.core.model.Fill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cash, position and P&amp;L for one instrument.
 *
 * <p>Cash, position and cost basis change only through {@link #apply(Fill)}.
 * {@link #markToMarket(Instant, BigDecimal)} revalues the position at a new price and extends the
 * equity curve, which drives peak equity and drawdown. Owned by a single pipeline instance.
 */
public final class PortfolioState {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioState.class);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final String instrument;
    private final BigDecimal initialCapital;

    private BigDecimal cash;
    private long position;
    private BigDecimal averageCost = BigDecimal.ZERO;
    private BigDecimal openCommission = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal totalCommission = BigDecimal.ZERO;
    private Instant positionOpenedAt;

    private BigDecimal lastPrice;
    private Instant lastTimestamp;
    private BigDecimal peakEquity;
    private BigDecimal currentDrawdown = BigDecimal.ZERO;
    private BigDecimal maxDrawdown = BigDecimal.ZERO;

    private final List<EquityPoint> equityCurve = new ArrayList<>();
    private final List<Fill> fills = new ArrayList<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();

    public PortfolioState(String instrument, BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive: " + initialCapital);
        }
        this.instrument = instrument;
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
        this.peakEquity = initialCapital;
    }

    /**
     * Apply a confirmed fill.
     *
     * @return realized profit or loss of the fill (zero for buys)
     * @throws IllegalStateException if the fill would overdraw cash or sell more than is held
     */
    public BigDecimal apply(Fill fill) {
        if (!instrument.equals(fill.instrument())) {
            throw new IllegalArgumentException("Fill for " + fill.instrument() + " applied to " + instrument + " portfolio");
        }
        if (lastTimestamp != null && fill.timestamp().isBefore(lastTimestamp)) {
            throw new IllegalStateException("Fill at " + fill.timestamp() + " precedes portfolio time " + lastTimestamp);
        }

        BigDecimal notional = fill.notional();
        BigDecimal commission = fill.commission();
        long quantity = fill.quantity();
        BigDecimal realized = BigDecimal.ZERO;

        if (fill.direction() == Direction.BUY) {
            BigDecimal cost = notional.add(commission);
            if (cost.compareTo(cash) > 0) {
                throw new IllegalStateException("Buy of " + quantity + " costs " + cost + " but cash is " + cash);
            }
            long newPosition = position + quantity;
            averageCost = averageCost.multiply(BigDecimal.valueOf(position))
                .add(notional)
                .divide(BigDecimal.valueOf(newPosition), MC);
            if (position == 0) {
                positionOpenedAt = fill.timestamp();
            }
            position = newPosition;
            cash = cash.subtract(cost);
            openCommission = openCommission.add(commission);
        } else {
            if (quantity > position) {
                throw new IllegalStateException("Sell of " + quantity + " exceeds holding of " + position);
            }
            BigDecimal entryCommission = openCommission.multiply(BigDecimal.valueOf(quantity))
                .divide(BigDecimal.valueOf(position), MC);
            realized = fill.price().subtract(averageCost).multiply(BigDecimal.valueOf(quantity), MC)
                .subtract(commission)
                .subtract(entryCommission);
            closedTrades.add(new ClosedTrade(positionOpenedAt, fill.timestamp(), quantity, averageCost,
                fill.price(), realized, fill.intent().exitTrigger()));

            cash = cash.add(notional).subtract(commission);
            openCommission = openCommission.subtract(entryCommission);
            position -= quantity;
            if (position == 0) {
                averageCost = BigDecimal.ZERO;
                openCommission = BigDecimal.ZERO;
                positionOpenedAt = null;
            }
        }

        realizedPnl = realizedPnl.add(realized);
        totalCommission = totalCommission.add(commission);
        fills.add(fill);
        revalue(fill.timestamp(), fill.price());

        logger.debug("{} {} {} @ {} -> cash={}, position={}, avgCost={}", instrument, fill.direction(),
            quantity, fill.price(), String.format("%.2f", cash), position, String.format("%.4f", averageCost));
        return realized;
    }

    /**
     * Revalue the holding at {@code price} and append an equity point.
     */
    public void markToMarket(Instant timestamp, BigDecimal price) {
        if (lastTimestamp != null && timestamp.isBefore(lastTimestamp)) {
            throw new IllegalArgumentException("Mark at " + timestamp + " precedes portfolio time " + lastTimestamp);
        }
        revalue(timestamp, price);
    }

    private void revalue(Instant timestamp, BigDecimal price) {
        lastPrice = price;
        lastTimestamp = timestamp;
        BigDecimal equity = equity();
        equityCurve.add(new EquityPoint(timestamp, equity));
        if (equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }
        currentDrawdown = peakEquity.subtract(equity).divide(peakEquity, MC);
        if (currentDrawdown.compareTo(maxDrawdown) > 0) {
            maxDrawdown = currentDrawdown;
        }
    }

    public String instrument() {
        return instrument;
    }

    public BigDecimal initialCapital() {
        return initialCapital;
    }

    public BigDecimal cash() {
        return cash;
    }

    public long position() {
        return position;
    }

    public boolean hasPosition() {
        return position > 0;
    }

    public BigDecimal averageCost() {
        return averageCost;
    }

    public BigDecimal realizedPnl() {
        return realizedPnl;
    }

    public BigDecimal totalCommission() {
        return totalCommission;
    }

    public BigDecimal unrealizedPnl() {
        if (position == 0 || lastPrice == null) {
            return BigDecimal.ZERO;
        }
        return lastPrice.subtract(averageCost).multiply(BigDecimal.valueOf(position), MC);
    }

    /** Cash plus the position valued at the last known price. */
    public BigDecimal equity() {
        if (position == 0 || lastPrice == null) {
            return cash;
        }
        return cash.add(lastPrice.multiply(BigDecimal.valueOf(position)));
    }

    public BigDecimal positionValue() {
        return equity().subtract(cash);
    }

    public BigDecimal peakEquity() {
        return peakEquity;
    }

    public BigDecimal currentDrawdown() {
        return currentDrawdown;
    }

    public BigDecimal maxDrawdown() {
        return maxDrawdown;
    }

    public BigDecimal lastPrice() {
        return lastPrice;
    }

    public List<EquityPoint> equityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public List<Fill> fills() {
        return Collections.unmodifiableList(fills);
    }

    public List<ClosedTrade> closedTrades() {
        return Collections.unmodifiableList(closedTrades);
    }

    public PortfolioSnapshot snapshot() {
        return new PortfolioSnapshot(lastTimestamp, instrument, cash, position, averageCost, lastPrice,
            equity(), peakEquity, currentDrawdown, realizedPnl);
    }
}
