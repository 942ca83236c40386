package com.quantflow.core.risk;

import com.quantflow.core.config.ExecutionSettings;
import com.quantflow.core.config.RiskSettings;
import com.quantflow.core.portfolio.ClosedTrade;
import com.quantflow.core.portfolio.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Buy quantity for the configured sizing method, rounded down to whole lots.
 *
 * <p>The target notional may be reduced to respect the maximum trade amount and the cash on hand.
 * A result below the minimum trade amount is rejected, never rounded up.
 */
public final class PositionSizer {
    private static final Logger logger = LoggerFactory.getLogger(PositionSizer.class);
    private static final MathContext MC = MathContext.DECIMAL64;

    // Used until enough closed trades exist to estimate the edge
    static final double DEFAULT_WIN_RATE = 0.55;
    static final double DEFAULT_PAYOFF = 1.5;

    private final RiskSettings risk;
    private final ExecutionSettings execution;

    public PositionSizer(RiskSettings risk, ExecutionSettings execution) {
        this.risk = risk;
        this.execution = execution;
    }

    public SizingResult size(BigDecimal price, double strength, PortfolioState portfolio, Optional<BigDecimal> atr) {
        BigDecimal equity = portfolio.equity();
        BigDecimal target;
        switch (risk.sizingMethod()) {
            case FIXED_AMOUNT -> target = risk.tradeAmount();
            case FIXED_FRACTION -> target = equity.multiply(risk.positionRatio())
                .multiply(BigDecimal.valueOf(strength), MC);
            case KELLY -> {
                double fraction = kellyFraction(portfolio.closedTrades());
                if (fraction <= 0.0) {
                    return SizingResult.rejected("Kelly estimate has no positive edge");
                }
                target = equity.multiply(BigDecimal.valueOf(fraction), MC);
            }
            case ATR -> {
                if (atr.isEmpty() || atr.get().signum() == 0) {
                    return SizingResult.rejected("ATR not available for sizing");
                }
                BigDecimal stopDistance = atr.get().multiply(risk.atrMultiplier(), MC);
                BigDecimal shares = equity.multiply(risk.riskPerTrade()).divide(stopDistance, MC);
                target = shares.multiply(price, MC);
            }
            default -> throw new IllegalStateException("Unknown sizing method " + risk.sizingMethod());
        }

        long quantity = lots(target, price);
        if (notional(quantity, price).compareTo(risk.maxTradeAmount()) > 0) {
            quantity = lots(risk.maxTradeAmount(), price);
        }
        BigDecimal unitCost = price.multiply(BigDecimal.ONE.add(execution.commissionRate()).add(execution.slippage()), MC);
        BigDecimal spendable = portfolio.cash().subtract(execution.minCommission());
        long affordable = lots(spendable.max(BigDecimal.ZERO), unitCost);
        if (quantity > affordable) {
            logger.debug("Size reduced from {} to {} shares by available cash {}", quantity, affordable,
                String.format("%.2f", portfolio.cash()));
            quantity = affordable;
        }

        BigDecimal notional = notional(quantity, price);
        if (quantity <= 0 || notional.compareTo(risk.minTradeAmount()) < 0) {
            return SizingResult.rejected(String.format("%s size %.2f outside [%.2f, %.2f]",
                risk.sizingMethod(), notional, risk.minTradeAmount(), risk.maxTradeAmount()));
        }
        return new SizingResult(quantity, notional, risk.sizingMethod() + " target " + String.format("%.2f", target));
    }

    /**
     * Fractional Kelly from the most recent closed trades: f = (p * b - q) / b,
     * scaled by the configured fraction and capped at the single-position limit.
     */
    double kellyFraction(List<ClosedTrade> closedTrades) {
        int from = Math.max(0, closedTrades.size() - risk.kellyLookbackTrades());
        List<ClosedTrade> recent = closedTrades.subList(from, closedTrades.size());

        double winRate = DEFAULT_WIN_RATE;
        double payoff = DEFAULT_PAYOFF;
        if (recent.size() >= risk.kellyMinTrades() && !recent.isEmpty()) {
            double wins = 0;
            double winSum = 0;
            double lossSum = 0;
            for (ClosedTrade trade : recent) {
                if (trade.isWin()) {
                    wins++;
                    winSum += trade.returnRatio();
                } else {
                    lossSum += Math.abs(trade.returnRatio());
                }
            }
            double losses = recent.size() - wins;
            winRate = wins / recent.size();
            if (wins == 0) {
                return 0.0;
            }
            payoff = losses == 0 || lossSum == 0 ? DEFAULT_PAYOFF : (winSum / wins) / (lossSum / losses);
        }
        double kelly = (winRate * payoff - (1.0 - winRate)) / payoff;
        double scaled = kelly * risk.kellyFraction().doubleValue();
        double capped = Math.min(scaled, risk.maxPositionFraction().doubleValue());
        logger.debug("Kelly sizing: winRate={}, payoff={}, kelly={}, applied={}",
            String.format("%.3f", winRate), String.format("%.3f", payoff),
            String.format("%.4f", kelly), String.format("%.4f", capped));
        return capped;
    }

    private long lots(BigDecimal amount, BigDecimal unitPrice) {
        long lotSize = execution.lotSize();
        BigDecimal shares = amount.divide(unitPrice, 0, RoundingMode.DOWN);
        return shares.longValue() / lotSize * lotSize;
    }

    private static BigDecimal notional(long quantity, BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
