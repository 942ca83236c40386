package com.quantflow.core.risk;

import com.quantflow.core.config.ExecutionSettings;
import com.quantflow.core.config.RiskSettings;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.ExitTrigger;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.OrderType;
import com.quantflow.core.model.PriceReference;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Converts signals into order intents or vetoes.
 *
 * <p>On every bar with an open position the stop-loss, trailing stop and take-profit levels are
 * checked first; a hit forces a sell of the full holding whatever the strategy said. A sell with
 * nothing held is no action. Otherwise the checks run in a fixed order and the first failing one
 * names the veto:
 * <ol>
 *   <li>trades today at the daily maximum</li>
 *   <li>drawdown at or above the maximum (buys only)</li>
 *   <li>today's realized loss at or above the daily maximum (buys only)</li>
 *   <li>sized notional outside the allowed trade amount range (buys only)</li>
 *   <li>resulting position above the single-position cap (buys only)</li>
 * </ol>
 * Sells are capped at the current holding.
 */
public final class RiskController {
    private static final Logger logger = LoggerFactory.getLogger(RiskController.class);

    private final RiskSettings risk;
    private final ExecutionSettings execution;
    private final PositionSizer sizer;
    private final String instrument;
    private final ZoneId zone;

    // Highest close since the current position was opened, for the trailing stop
    private BigDecimal highestClose;

    public RiskController(RiskSettings risk, ExecutionSettings execution, String instrument, ZoneId zone) {
        this.risk = risk;
        this.execution = execution;
        this.sizer = new PositionSizer(risk, execution);
        this.instrument = instrument;
        this.zone = zone;
    }

    /**
     * Roll the daily counters when {@code bar} starts a new trading day.
     */
    public void startBar(Bar bar, PortfolioState portfolio, RiskLimitState limits) {
        LocalDate day = bar.timestamp().atZone(zone).toLocalDate();
        if (limits.rollTo(day, portfolio.equity())) {
            logger.debug("{}: trading day {} starts with equity {}", instrument, day,
                String.format("%.2f", portfolio.equity()));
        }
    }

    public RiskDecision evaluate(Signal signal, Bar bar, Optional<IndicatorSnapshot> snapshot,
                                 PortfolioState portfolio, RiskLimitState limits) {
        BigDecimal price = bar.close();
        limits.observeDrawdown(portfolio.currentDrawdown());

        if (portfolio.hasPosition()) {
            Optional<ExitTrigger> exit = checkExit(portfolio, price);
            if (exit.isPresent()) {
                OrderIntent intent = intent(Direction.SELL, portfolio.position(), price, signal, exit.get());
                logger.info("{}: {} at {} (avg cost {}), forcing sell of {}", instrument, exit.get().tag(),
                    String.format("%.2f", price), String.format("%.2f", portfolio.averageCost()), portfolio.position());
                return new RiskDecision.Approved(signal, intent);
            }
        }

        if (signal.direction() == Direction.HOLD) {
            return new RiskDecision.NoAction(signal, "hold");
        }

        if (signal.direction() == Direction.SELL && !portfolio.hasPosition()) {
            return new RiskDecision.NoAction(signal, "no position to sell");
        }

        if (limits.dailyTradeCount() >= risk.maxTradesPerDay()) {
            return veto(signal, VetoReason.FREQUENCY_CAP,
                limits.dailyTradeCount() + " trades today, limit " + risk.maxTradesPerDay());
        }

        if (signal.direction() == Direction.SELL) {
            return new RiskDecision.Approved(signal, intent(Direction.SELL, portfolio.position(), price, signal, null));
        }

        BigDecimal drawdown = portfolio.currentDrawdown();
        if (drawdown.compareTo(risk.maxDrawdown()) >= 0) {
            return veto(signal, VetoReason.DRAWDOWN_BREAKER,
                String.format("drawdown %.4f >= %.4f", drawdown, risk.maxDrawdown()));
        }

        BigDecimal lossLimit = limits.dayStartEquity().multiply(risk.maxDailyLoss());
        BigDecimal dailyLoss = limits.dailyRealizedLoss();
        if (dailyLoss.signum() > 0 && dailyLoss.compareTo(lossLimit) >= 0) {
            return veto(signal, VetoReason.DAILY_LOSS_BREAKER,
                String.format("realized loss today %.2f >= %.2f", dailyLoss, lossLimit));
        }

        SizingResult size = sizer.size(price, signal.strength(), portfolio,
            snapshot.flatMap(IndicatorSnapshot::atr));
        if (!size.accepted()) {
            return veto(signal, VetoReason.SIZE_OUT_OF_RANGE, size.detail());
        }

        BigDecimal resulting = price.multiply(BigDecimal.valueOf(portfolio.position() + size.quantity()));
        BigDecimal positionLimit = portfolio.equity().multiply(risk.maxPositionFraction());
        if (resulting.compareTo(positionLimit) > 0) {
            return veto(signal, VetoReason.POSITION_CAP,
                String.format("position value %.2f would exceed %.2f", resulting, positionLimit));
        }

        return new RiskDecision.Approved(signal, intent(Direction.BUY, size.quantity(), price, signal, null));
    }

    /**
     * Update daily counters and trailing state after a confirmed fill.
     */
    public void recordFill(Fill fill, BigDecimal realizedPnl, PortfolioState portfolio, RiskLimitState limits) {
        limits.recordTrade(realizedPnl);
        if (!portfolio.hasPosition()) {
            highestClose = null;
        } else if (fill.direction() == Direction.BUY && highestClose == null) {
            highestClose = fill.price();
        }
    }

    /**
     * Protective exit hit at {@code price}, if any. Stops are checked before take-profit.
     */
    Optional<ExitTrigger> checkExit(PortfolioState portfolio, BigDecimal price) {
        BigDecimal cost = portfolio.averageCost();
        if (highestClose == null || price.compareTo(highestClose) > 0) {
            highestClose = highestClose == null ? cost.max(price) : price;
        }

        BigDecimal fixedStop = cost.multiply(BigDecimal.ONE.subtract(risk.stopLoss()));
        BigDecimal stop = fixedStop;
        boolean trailing = false;
        if (risk.trailingStopEnabled()) {
            BigDecimal trailingStop = highestClose.multiply(BigDecimal.ONE.subtract(risk.trailingStop()));
            if (trailingStop.compareTo(fixedStop) > 0) {
                stop = trailingStop;
                trailing = true;
            }
        }
        if (price.compareTo(stop) <= 0) {
            return Optional.of(trailing ? ExitTrigger.TRAILING_STOP : ExitTrigger.STOP_LOSS);
        }

        BigDecimal target = cost.multiply(BigDecimal.ONE.add(risk.takeProfit()));
        if (price.compareTo(target) >= 0) {
            return Optional.of(ExitTrigger.TAKE_PROFIT);
        }
        return Optional.empty();
    }

    private OrderIntent intent(Direction direction, long quantity, BigDecimal price, Signal signal, ExitTrigger exit) {
        PriceReference reference = execution.orderType() == OrderType.LIMIT && exit == null
            ? PriceReference.limit(price)
            : PriceReference.market();
        return new OrderIntent(instrument, direction, quantity, reference, price, signal, exit);
    }

    private RiskDecision veto(Signal signal, VetoReason reason, String detail) {
        logger.warn("{}: {} signal vetoed [{}] {}", instrument, signal.direction(), reason.tag(), detail);
        return new RiskDecision.Vetoed(signal, reason, detail);
    }
}
