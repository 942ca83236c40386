package com.quantflow.core.risk;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-day counters the risk controller gates on. Mutated only by {@link RiskController}.
 */
public final class RiskLimitState {

    private LocalDate tradingDay;
    private int dailyTradeCount;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private BigDecimal dayStartEquity;
    private BigDecimal maxDrawdownObserved = BigDecimal.ZERO;

    public RiskLimitState(BigDecimal startingEquity) {
        this.dayStartEquity = startingEquity;
    }

    /**
     * Start a new trading day if {@code day} differs from the current one.
     *
     * @return true if the counters were reset
     */
    boolean rollTo(LocalDate day, BigDecimal equity) {
        if (day.equals(tradingDay)) {
            return false;
        }
        tradingDay = day;
        dailyTradeCount = 0;
        dailyRealizedPnl = BigDecimal.ZERO;
        dayStartEquity = equity;
        return true;
    }

    void recordTrade(BigDecimal realizedPnl) {
        dailyTradeCount++;
        dailyRealizedPnl = dailyRealizedPnl.add(realizedPnl);
    }

    void observeDrawdown(BigDecimal drawdown) {
        if (drawdown.compareTo(maxDrawdownObserved) > 0) {
            maxDrawdownObserved = drawdown;
        }
    }

    public LocalDate tradingDay() {
        return tradingDay;
    }

    public int dailyTradeCount() {
        return dailyTradeCount;
    }

    public BigDecimal dailyRealizedPnl() {
        return dailyRealizedPnl;
    }

    /** Today's net realized loss as a positive amount, zero when today is flat or profitable. */
    public BigDecimal dailyRealizedLoss() {
        return dailyRealizedPnl.signum() < 0 ? dailyRealizedPnl.negate() : BigDecimal.ZERO;
    }

    public BigDecimal dayStartEquity() {
        return dayStartEquity;
    }

    public BigDecimal maxDrawdownObserved() {
        return maxDrawdownObserved;
    }
}
