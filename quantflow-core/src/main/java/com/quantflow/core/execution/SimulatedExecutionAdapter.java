package com.quantflow.core.execution;

import com.quantflow.core.config.ExecutionSettings;
import com.quantflow.core.config.FillTiming;
import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.portfolio.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic fills for replay.
 *
 * <p>Prices off the open of the bar it is given when fills are at the next bar's open, otherwise
 * off its close, adjusted by the configured slippage against the trader. Orders are always filled
 * in full unless that would overdraw cash or oversell the holding.
 */
public final class SimulatedExecutionAdapter implements ExecutionAdapter {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedExecutionAdapter.class);

    private final ExecutionSettings settings;
    private final CommissionModel commissions;
    private final PortfolioState portfolio;

    public SimulatedExecutionAdapter(ExecutionSettings settings, PortfolioState portfolio) {
        this.settings = settings;
        this.commissions = new CommissionModel(settings);
        this.portfolio = portfolio;
    }

    @Override
    public Fill execute(OrderIntent intent, Bar bar) throws OrderExecutionException {
        BigDecimal base = settings.fillTiming() == FillTiming.NEXT_BAR_OPEN ? bar.open() : bar.close();
        BigDecimal price = applySlippage(base, intent.direction());

        if (intent.priceReference().isLimit()) {
            BigDecimal limit = intent.priceReference().limitPrice();
            boolean reachable = intent.direction() == Direction.BUY
                ? price.compareTo(limit) <= 0
                : price.compareTo(limit) >= 0;
            if (!reachable) {
                throw new OrderExecutionException(String.format("%s limit %.4f not reached at %.4f",
                    intent.direction(), limit, price));
            }
        }

        long quantity = intent.quantity();
        if (intent.direction() == Direction.SELL) {
            quantity = Math.min(quantity, portfolio.position());
            if (quantity == 0) {
                throw new OrderExecutionException("No holding to sell for " + intent.instrument());
            }
        }

        BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal commission = commissions.commissionFor(notional);
        if (intent.direction() == Direction.BUY && notional.add(commission).compareTo(portfolio.cash()) > 0) {
            throw new OrderExecutionException(String.format("Insufficient cash: need %.2f, have %.2f",
                notional.add(commission), portfolio.cash()));
        }

        Fill fill = new Fill(intent, price, quantity, commission, bar.timestamp());
        logger.debug("Simulated {} {} {} @ {} commission {}", intent.direction(), quantity,
            intent.instrument(), price, commission);
        return fill;
    }

    @Override
    public String mode() {
        return "simulated";
    }

    private BigDecimal applySlippage(BigDecimal base, Direction direction) {
        if (settings.slippage().signum() == 0) {
            return base;
        }
        BigDecimal factor = direction == Direction.BUY
            ? BigDecimal.ONE.add(settings.slippage())
            : BigDecimal.ONE.subtract(settings.slippage());
        return base.multiply(factor).setScale(Math.max(base.scale(), 4), RoundingMode.HALF_UP);
    }
}
