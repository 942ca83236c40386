package com.quantflow.core.config;

import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.model.OrderType;
import com.quantflow.core.strategy.TechnicalCondition;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of one pipeline instance.
 * Built once at startup, validated in {@link Builder#build()}, and handed to every component.
 */
public final class PipelineConfig {

    private final String instrument;
    private final BigDecimal initialCapital;
    private final ZoneId zone;
    private final IndicatorSettings indicators;
    private final StrategySettings strategy;
    private final RiskSettings risk;
    private final ExecutionSettings execution;

    private PipelineConfig(Builder b) {
        this.instrument = b.instrument;
        this.initialCapital = b.initialCapital;
        this.zone = b.zone;
        this.indicators = new IndicatorSettings(b.shortMa, b.longMa, b.rsiPeriod, b.macdFast, b.macdSlow,
            b.macdSignal, b.bollingerPeriod, b.bollingerK, b.volumeMa, b.atrPeriod, b.momentumPeriod, b.window);
        this.strategy = new StrategySettings(b.strategyType, b.rsiOverbought, b.rsiOversold, b.buyRequires,
            b.sellRequires, b.sellOnOverbought, b.volumeSurgeRatio, b.momentumThreshold,
            b.strongMomentumThreshold, b.volumeChangeThreshold);
        this.risk = new RiskSettings(b.sizingMethod, b.tradeAmount, b.minTradeAmount, b.maxTradeAmount,
            b.positionRatio, b.maxPositionFraction, b.kellyFraction, b.kellyMinTrades, b.kellyLookbackTrades,
            b.riskPerTrade, b.atrMultiplier, b.stopLoss, b.takeProfit, b.trailingStop, b.maxDrawdown,
            b.maxDailyLoss, b.maxTradesPerDay);
        this.execution = new ExecutionSettings(b.fillTiming, b.orderType, b.commissionRate, b.minCommission,
            b.slippage, b.lotSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /** Copy of this configuration for another instrument. */
    public PipelineConfig forInstrument(String otherInstrument) {
        return toBuilder().instrument(otherInstrument).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
            .instrument(instrument)
            .initialCapital(initialCapital)
            .zone(zone)
            .movingAverages(indicators.shortMa(), indicators.longMa())
            .rsiPeriod(indicators.rsiPeriod())
            .macd(indicators.macdFast(), indicators.macdSlow(), indicators.macdSignal())
            .bollinger(indicators.bollingerPeriod(), indicators.bollingerK())
            .volumeMa(indicators.volumeMa())
            .atrPeriod(indicators.atrPeriod())
            .momentumPeriod(indicators.momentumPeriod())
            .window(indicators.window())
            .strategyType(strategy.type())
            .rsiBands(strategy.rsiOversold(), strategy.rsiOverbought())
            .buyRequires(strategy.buyRequires())
            .sellRequires(strategy.sellRequires())
            .sellOnOverbought(strategy.sellOnOverbought())
            .volumeSurgeRatio(strategy.volumeSurgeRatio())
            .momentumThresholds(strategy.momentumThreshold(), strategy.strongMomentumThreshold())
            .volumeChangeThreshold(strategy.volumeChangeThreshold())
            .sizingMethod(risk.sizingMethod())
            .tradeAmount(risk.tradeAmount())
            .tradeAmountRange(risk.minTradeAmount(), risk.maxTradeAmount())
            .positionRatio(risk.positionRatio())
            .maxPositionFraction(risk.maxPositionFraction())
            .kelly(risk.kellyFraction(), risk.kellyMinTrades(), risk.kellyLookbackTrades())
            .atrSizing(risk.riskPerTrade(), risk.atrMultiplier())
            .stopLoss(risk.stopLoss())
            .takeProfit(risk.takeProfit())
            .trailingStop(risk.trailingStop())
            .maxDrawdown(risk.maxDrawdown())
            .maxDailyLoss(risk.maxDailyLoss())
            .maxTradesPerDay(risk.maxTradesPerDay())
            .fillTiming(execution.fillTiming())
            .orderType(execution.orderType())
            .commission(execution.commissionRate(), execution.minCommission())
            .slippage(execution.slippage())
            .lotSize(execution.lotSize());
        return b;
    }

    public String instrument() {
        return instrument;
    }

    public BigDecimal initialCapital() {
        return initialCapital;
    }

    public ZoneId zone() {
        return zone;
    }

    public IndicatorSettings indicators() {
        return indicators;
    }

    public StrategySettings strategy() {
        return strategy;
    }

    public RiskSettings risk() {
        return risk;
    }

    public ExecutionSettings execution() {
        return execution;
    }

    @Override
    public String toString() {
        return "PipelineConfig{instrument=" + instrument + ", capital=" + initialCapital
            + ", strategy=" + strategy.type() + ", sizing=" + risk.sizingMethod()
            + ", stopLoss=" + risk.stopLoss() + ", takeProfit=" + risk.takeProfit()
            + ", fillTiming=" + execution.fillTiming() + "}";
    }

    public static final class Builder {
        private String instrument = "SPY";
        private BigDecimal initialCapital = new BigDecimal("100000");
        private ZoneId zone = ZoneId.of("America/New_York");

        private int shortMa = 5;
        private int longMa = 20;
        private int rsiPeriod = 14;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int bollingerPeriod = 20;
        private BigDecimal bollingerK = new BigDecimal("2");
        private int volumeMa = 20;
        private int atrPeriod = 14;
        private int momentumPeriod = 10;
        private int window = 60;

        private StrategyType strategyType = StrategyType.TECHNICAL;
        private BigDecimal rsiOverbought = new BigDecimal("70");
        private BigDecimal rsiOversold = new BigDecimal("30");
        private Set<TechnicalCondition> buyRequires = EnumSet.of(TechnicalCondition.MA_CROSS, TechnicalCondition.RSI);
        private Set<TechnicalCondition> sellRequires = EnumSet.of(TechnicalCondition.MA_CROSS);
        private boolean sellOnOverbought = true;
        private BigDecimal volumeSurgeRatio = new BigDecimal("1.5");
        private BigDecimal momentumThreshold = new BigDecimal("0.02");
        private BigDecimal strongMomentumThreshold = new BigDecimal("0.05");
        private BigDecimal volumeChangeThreshold = new BigDecimal("0.2");

        private SizingMethod sizingMethod = SizingMethod.FIXED_AMOUNT;
        private BigDecimal tradeAmount = new BigDecimal("10000");
        private BigDecimal minTradeAmount = new BigDecimal("5000");
        private BigDecimal maxTradeAmount = new BigDecimal("50000");
        private BigDecimal positionRatio = new BigDecimal("0.1");
        private BigDecimal maxPositionFraction = new BigDecimal("0.3");
        private BigDecimal kellyFraction = new BigDecimal("0.5");
        private int kellyMinTrades = 10;
        private int kellyLookbackTrades = 50;
        private BigDecimal riskPerTrade = new BigDecimal("0.01");
        private BigDecimal atrMultiplier = new BigDecimal("2");
        private BigDecimal stopLoss = new BigDecimal("0.05");
        private BigDecimal takeProfit = new BigDecimal("0.10");
        private BigDecimal trailingStop = BigDecimal.ZERO;
        private BigDecimal maxDrawdown = new BigDecimal("0.10");
        private BigDecimal maxDailyLoss = new BigDecimal("0.02");
        private int maxTradesPerDay = 10;

        private FillTiming fillTiming = FillTiming.NEXT_BAR_OPEN;
        private OrderType orderType = OrderType.MARKET;
        private BigDecimal commissionRate = new BigDecimal("0.0003");
        private BigDecimal minCommission = BigDecimal.ZERO;
        private BigDecimal slippage = BigDecimal.ZERO;
        private int lotSize = 100;

        private Builder() {
        }

        public Builder instrument(String instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder initialCapital(BigDecimal initialCapital) {
            this.initialCapital = initialCapital;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder movingAverages(int shortPeriod, int longPeriod) {
            this.shortMa = shortPeriod;
            this.longMa = longPeriod;
            return this;
        }

        public Builder rsiPeriod(int period) {
            this.rsiPeriod = period;
            return this;
        }

        public Builder macd(int fast, int slow, int signal) {
            this.macdFast = fast;
            this.macdSlow = slow;
            this.macdSignal = signal;
            return this;
        }

        public Builder bollinger(int period, BigDecimal k) {
            this.bollingerPeriod = period;
            this.bollingerK = k;
            return this;
        }

        public Builder volumeMa(int period) {
            this.volumeMa = period;
            return this;
        }

        public Builder atrPeriod(int period) {
            this.atrPeriod = period;
            return this;
        }

        public Builder momentumPeriod(int period) {
            this.momentumPeriod = period;
            return this;
        }

        public Builder window(int bars) {
            this.window = bars;
            return this;
        }

        public Builder strategyType(StrategyType type) {
            this.strategyType = type;
            return this;
        }

        public Builder rsiBands(BigDecimal oversold, BigDecimal overbought) {
            this.rsiOversold = oversold;
            this.rsiOverbought = overbought;
            return this;
        }

        public Builder buyRequires(Set<TechnicalCondition> conditions) {
            this.buyRequires = conditions;
            return this;
        }

        public Builder sellRequires(Set<TechnicalCondition> conditions) {
            this.sellRequires = conditions;
            return this;
        }

        public Builder sellOnOverbought(boolean enabled) {
            this.sellOnOverbought = enabled;
            return this;
        }

        public Builder volumeSurgeRatio(BigDecimal ratio) {
            this.volumeSurgeRatio = ratio;
            return this;
        }

        public Builder momentumThresholds(BigDecimal threshold, BigDecimal strongThreshold) {
            this.momentumThreshold = threshold;
            this.strongMomentumThreshold = strongThreshold;
            return this;
        }

        public Builder volumeChangeThreshold(BigDecimal threshold) {
            this.volumeChangeThreshold = threshold;
            return this;
        }

        public Builder sizingMethod(SizingMethod method) {
            this.sizingMethod = method;
            return this;
        }

        public Builder tradeAmount(BigDecimal amount) {
            this.tradeAmount = amount;
            return this;
        }

        public Builder tradeAmountRange(BigDecimal min, BigDecimal max) {
            this.minTradeAmount = min;
            this.maxTradeAmount = max;
            return this;
        }

        public Builder positionRatio(BigDecimal ratio) {
            this.positionRatio = ratio;
            return this;
        }

        public Builder maxPositionFraction(BigDecimal fraction) {
            this.maxPositionFraction = fraction;
            return this;
        }

        public Builder kelly(BigDecimal fraction, int minTrades, int lookbackTrades) {
            this.kellyFraction = fraction;
            this.kellyMinTrades = minTrades;
            this.kellyLookbackTrades = lookbackTrades;
            return this;
        }

        public Builder atrSizing(BigDecimal riskPerTrade, BigDecimal multiplier) {
            this.riskPerTrade = riskPerTrade;
            this.atrMultiplier = multiplier;
            return this;
        }

        public Builder stopLoss(BigDecimal ratio) {
            this.stopLoss = ratio;
            return this;
        }

        public Builder takeProfit(BigDecimal ratio) {
            this.takeProfit = ratio;
            return this;
        }

        public Builder trailingStop(BigDecimal ratio) {
            this.trailingStop = ratio;
            return this;
        }

        public Builder maxDrawdown(BigDecimal ratio) {
            this.maxDrawdown = ratio;
            return this;
        }

        public Builder maxDailyLoss(BigDecimal ratio) {
            this.maxDailyLoss = ratio;
            return this;
        }

        public Builder maxTradesPerDay(int trades) {
            this.maxTradesPerDay = trades;
            return this;
        }

        public Builder fillTiming(FillTiming timing) {
            this.fillTiming = timing;
            return this;
        }

        public Builder orderType(OrderType type) {
            this.orderType = type;
            return this;
        }

        public Builder commission(BigDecimal rate, BigDecimal minimum) {
            this.commissionRate = rate;
            this.minCommission = minimum;
            return this;
        }

        public Builder slippage(BigDecimal ratio) {
            this.slippage = ratio;
            return this;
        }

        public Builder lotSize(int shares) {
            this.lotSize = shares;
            return this;
        }

        public PipelineConfig build() {
            validate();
            return new PipelineConfig(this);
        }

        private void validate() {
            require(instrument != null && !instrument.isBlank(), "instrument must be set");
            requireNonNull(zone, "zone");
            requirePositive(initialCapital, "initial capital");

            require(shortMa > 0 && longMa > 0, "moving average periods must be positive");
            require(shortMa < longMa, "short MA period (" + shortMa + ") must be below long MA period (" + longMa + ")");
            require(rsiPeriod > 0, "RSI period must be positive");
            require(macdFast > 0 && macdSlow > 0 && macdSignal > 0, "MACD periods must be positive");
            require(macdFast < macdSlow, "MACD fast period (" + macdFast + ") must be below slow period (" + macdSlow + ")");
            require(bollingerPeriod > 1, "Bollinger period must be greater than 1");
            requirePositive(bollingerK, "Bollinger width");
            require(volumeMa > 0 && atrPeriod > 0 && momentumPeriod > 0, "indicator periods must be positive");

            requireNonNull(strategyType, "strategy type");
            requireNonNull(rsiOversold, "RSI oversold");
            requireNonNull(rsiOverbought, "RSI overbought");
            require(rsiOversold.signum() > 0 && rsiOversold.compareTo(rsiOverbought) < 0
                    && rsiOverbought.compareTo(BigDecimal.valueOf(100)) < 0,
                "RSI bands must satisfy 0 < oversold < overbought < 100");
            requireNonNull(buyRequires, "buy conditions");
            requireNonNull(sellRequires, "sell conditions");
            require(!buyRequires.isEmpty(), "at least one buy condition is required");
            require(!sellRequires.isEmpty() || sellOnOverbought, "no sell rule configured");
            requirePositive(volumeSurgeRatio, "volume surge ratio");
            requirePositive(momentumThreshold, "momentum threshold");
            requireNonNull(strongMomentumThreshold, "strong momentum threshold");
            require(strongMomentumThreshold.compareTo(momentumThreshold) >= 0,
                "strong momentum threshold must not be below the momentum threshold");
            requireNonNull(volumeChangeThreshold, "volume change threshold");

            requireNonNull(sizingMethod, "sizing method");
            requirePositive(tradeAmount, "trade amount");
            requirePositive(minTradeAmount, "min trade amount");
            requirePositive(maxTradeAmount, "max trade amount");
            require(minTradeAmount.compareTo(maxTradeAmount) <= 0,
                "min trade amount " + minTradeAmount + " exceeds max trade amount " + maxTradeAmount);
            requireFraction(positionRatio, "position ratio");
            requireFraction(maxPositionFraction, "max position fraction");
            requireFraction(kellyFraction, "Kelly fraction");
            require(kellyMinTrades >= 0 && kellyLookbackTrades > 0, "Kelly trade counts must be non-negative");
            requireFraction(riskPerTrade, "risk per trade");
            requirePositive(atrMultiplier, "ATR multiplier");
            requireNonNull(stopLoss, "stop-loss");
            require(stopLoss.signum() > 0 && stopLoss.compareTo(BigDecimal.ONE) < 0, "stop-loss must be within (0,1)");
            requirePositive(takeProfit, "take-profit");
            requireNonNull(trailingStop, "trailing stop");
            require(trailingStop.signum() >= 0 && trailingStop.compareTo(BigDecimal.ONE) < 0,
                "trailing stop must be within [0,1)");
            requireFraction(maxDrawdown, "max drawdown");
            requireFraction(maxDailyLoss, "max daily loss");
            require(maxTradesPerDay > 0, "max trades per day must be positive");

            requireNonNull(fillTiming, "fill timing");
            requireNonNull(orderType, "order type");
            requireNonNull(commissionRate, "commission rate");
            require(commissionRate.signum() >= 0 && commissionRate.compareTo(new BigDecimal("0.1")) < 0,
                "commission rate must be within [0,0.1)");
            requireNonNull(minCommission, "min commission");
            require(minCommission.signum() >= 0, "min commission cannot be negative");
            requireNonNull(slippage, "slippage");
            require(slippage.signum() >= 0 && slippage.compareTo(new BigDecimal("0.1")) < 0,
                "slippage must be within [0,0.1)");
            require(lotSize >= 1, "lot size must be at least 1");

            int maxLookback = new IndicatorSettings(shortMa, longMa, rsiPeriod, macdFast, macdSlow, macdSignal,
                bollingerPeriod, bollingerK, volumeMa, atrPeriod, momentumPeriod, window).maxLookback();
            require(window >= maxLookback,
                "indicator window " + window + " is shorter than the longest lookback " + maxLookback);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new ConfigurationException("Invalid configuration: " + message);
            }
        }

        private static void requireNonNull(Object value, String name) {
            require(Objects.nonNull(value), name + " must be set");
        }

        private static void requirePositive(BigDecimal value, String name) {
            requireNonNull(value, name);
            require(value.signum() > 0, name + " must be positive");
        }

        private static void requireFraction(BigDecimal value, String name) {
            requireNonNull(value, name);
            require(value.signum() > 0 && value.compareTo(BigDecimal.ONE) <= 0, name + " must be within (0,1]");
        }
    }
}
