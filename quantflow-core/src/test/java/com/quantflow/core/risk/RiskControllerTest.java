package com.quantflow.core.risk;

import com.quantflow.core.TestBars;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.ExitTrigger;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.OrderType;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static com.quantflow.core.TestOrders.fill;
import static com.quantflow.core.TestOrders.signal;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Risk gating: forced exits, veto order and sizing into intents.
 */
@DisplayName("Risk Controller Tests")
class RiskControllerTest {

    private static final String SPY = "SPY";

    private PipelineConfig config;
    private RiskController controller;
    private PortfolioState portfolio;
    private RiskLimitState limits;

    private void setUp(PipelineConfig.Builder builder) {
        config = builder.instrument(SPY).build();
        controller = new RiskController(config.risk(), config.execution(), SPY, config.zone());
        portfolio = new PortfolioState(SPY, config.initialCapital());
        limits = new RiskLimitState(portfolio.equity());
    }

    private Bar startBar(int day, String close) {
        Bar bar = TestBars.flat(day, close);
        controller.startBar(bar, portfolio, limits);
        return bar;
    }

    /** Apply a fill the way the driver does: portfolio first, then the risk counters. */
    private void applyFill(Direction direction, long quantity, String price, int day) {
        Fill fill = fill(SPY, direction, quantity, price, "0", TestBars.day(day));
        BigDecimal realized = portfolio.apply(fill);
        controller.recordFill(fill, realized, portfolio, limits);
    }

    private RiskDecision evaluate(Direction direction, Bar bar) {
        portfolio.markToMarket(bar.timestamp(), bar.close());
        Signal signal = signal(direction, bar.timestamp());
        return controller.evaluate(signal, bar, Optional.empty(), portfolio, limits);
    }

    private static VetoReason vetoReason(RiskDecision decision) {
        assertThat(decision).isInstanceOf(RiskDecision.Vetoed.class);
        return ((RiskDecision.Vetoed) decision).reason();
    }

    @Nested
    @DisplayName("Plain Signals")
    class PlainSignalTests {

        @Test
        @DisplayName("Hold is no action")
        void testHold() {
            setUp(PipelineConfig.builder());
            RiskDecision decision = evaluate(Direction.HOLD, startBar(0, "10"));

            assertThat(decision).isInstanceOf(RiskDecision.NoAction.class);
            assertThat(decision.intent()).isEmpty();
        }

        @Test
        @DisplayName("Buy is sized into a market intent at the bar close")
        void testBuyApproved() {
            setUp(PipelineConfig.builder());
            RiskDecision decision = evaluate(Direction.BUY, startBar(0, "10"));

            OrderIntent intent = decision.intent().orElseThrow();
            assertThat(decision.isApproved()).isTrue();
            assertThat(intent.direction()).isEqualTo(Direction.BUY);
            assertThat(intent.quantity()).isEqualTo(1000);
            assertThat(intent.priceReference().isLimit()).isFalse();
            assertThat(intent.referencePrice()).isEqualByComparingTo("10");
            assertThat(intent.isForcedExit()).isFalse();
        }

        @Test
        @DisplayName("Limit orders reference the decision bar's close")
        void testLimitOrder() {
            setUp(PipelineConfig.builder().orderType(OrderType.LIMIT));
            OrderIntent intent = evaluate(Direction.BUY, startBar(0, "10")).intent().orElseThrow();

            assertThat(intent.priceReference().isLimit()).isTrue();
            assertThat(intent.priceReference().limitPrice()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Sell without a holding is no action; with one it sells everything")
        void testSell() {
            setUp(PipelineConfig.builder());
            assertThat(evaluate(Direction.SELL, startBar(0, "10"))).isInstanceOf(RiskDecision.NoAction.class);

            applyFill(Direction.BUY, 700, "10", 0);
            OrderIntent intent = evaluate(Direction.SELL, startBar(1, "10.2")).intent().orElseThrow();
            assertThat(intent.direction()).isEqualTo(Direction.SELL);
            assertThat(intent.quantity()).isEqualTo(700);
        }
    }

    @Nested
    @DisplayName("Vetoes")
    class VetoTests {

        @Test
        @DisplayName("Drawdown at the limit blocks buys but not sells")
        void testDrawdownBreaker() {
            setUp(PipelineConfig.builder()
                .stopLoss(new BigDecimal("0.30"))
                .maxPositionFraction(new BigDecimal("0.6"))
                .commission(BigDecimal.ZERO, BigDecimal.ZERO));
            startBar(0, "10");
            applyFill(Direction.BUY, 5000, "10", 0);

            Bar bar = startBar(1, "7.8");
            RiskDecision buy = evaluate(Direction.BUY, bar);
            assertThat(portfolio.currentDrawdown()).isEqualByComparingTo("0.11");
            assertThat(vetoReason(buy)).isEqualTo(VetoReason.DRAWDOWN_BREAKER);
            assertThat(limits.maxDrawdownObserved()).isEqualByComparingTo("0.11");

            RiskDecision sell = evaluate(Direction.SELL, bar);
            assertThat(sell.intent().orElseThrow().quantity()).isEqualTo(5000);
        }

        @Test
        @DisplayName("Frequency cap is checked before every other limit")
        void testFrequencyCapFirst() {
            setUp(PipelineConfig.builder()
                .stopLoss(new BigDecimal("0.30"))
                .maxPositionFraction(new BigDecimal("0.6"))
                .maxTradesPerDay(1));
            startBar(0, "10");
            applyFill(Direction.BUY, 5000, "10", 0);

            // same day, drawdown also breached
            Bar bar = new Bar(TestBars.day(0).plusSeconds(60), new BigDecimal("7.8"), new BigDecimal("7.8"),
                new BigDecimal("7.8"), new BigDecimal("7.8"), 1000);
            controller.startBar(bar, portfolio, limits);
            assertThat(vetoReason(evaluate(Direction.BUY, bar))).isEqualTo(VetoReason.FREQUENCY_CAP);
            assertThat(vetoReason(evaluate(Direction.SELL, bar))).isEqualTo(VetoReason.FREQUENCY_CAP);
        }

        @Test
        @DisplayName("A sell with nothing held is no action even at the frequency cap")
        void testFlatSellAtFrequencyCap() {
            setUp(PipelineConfig.builder().maxTradesPerDay(1));
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);
            applyFill(Direction.SELL, 1000, "10", 0);

            Bar bar = new Bar(TestBars.day(0).plusSeconds(60), BigDecimal.TEN, BigDecimal.TEN,
                BigDecimal.TEN, BigDecimal.TEN, 1000);
            controller.startBar(bar, portfolio, limits);

            assertThat(evaluate(Direction.SELL, bar)).isInstanceOf(RiskDecision.NoAction.class);
            assertThat(vetoReason(evaluate(Direction.BUY, bar))).isEqualTo(VetoReason.FREQUENCY_CAP);
        }

        @Test
        @DisplayName("Realized loss at the daily limit blocks buys until the next day")
        void testDailyLossBreaker() {
            setUp(PipelineConfig.builder().stopLoss(new BigDecimal("0.30")));
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);
            Bar day1 = startBar(1, "7.5");
            applyFill(Direction.SELL, 1000, "7.5", 1);

            assertThat(limits.dailyRealizedLoss()).isEqualByComparingTo("2500");
            assertThat(vetoReason(evaluate(Direction.BUY, day1))).isEqualTo(VetoReason.DAILY_LOSS_BREAKER);

            RiskDecision nextDay = evaluate(Direction.BUY, startBar(2, "7.5"));
            assertThat(nextDay.isApproved()).isTrue();
            assertThat(limits.dailyTradeCount()).isZero();
        }

        @Test
        @DisplayName("Unaffordable lot is out of range")
        void testSizeOutOfRange() {
            setUp(PipelineConfig.builder());
            assertThat(vetoReason(evaluate(Direction.BUY, startBar(0, "120")))).isEqualTo(VetoReason.SIZE_OUT_OF_RANGE);
        }

        @Test
        @DisplayName("Resulting position above the cap is vetoed")
        void testPositionCap() {
            setUp(PipelineConfig.builder().maxPositionFraction(new BigDecimal("0.05")));
            RiskDecision decision = evaluate(Direction.BUY, startBar(0, "10"));

            assertThat(vetoReason(decision)).isEqualTo(VetoReason.POSITION_CAP);
            assertThat(((RiskDecision.Vetoed) decision).detail()).contains("would exceed");
        }
    }

    @Nested
    @DisplayName("Protective Exits")
    class ExitTests {

        @Test
        @DisplayName("Stop-loss overrides a buy signal and ignores the frequency cap")
        void testStopLossPriority() {
            setUp(PipelineConfig.builder().maxTradesPerDay(1));
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);

            Bar bar = new Bar(TestBars.day(0).plusSeconds(60), new BigDecimal("9.4"), new BigDecimal("9.4"),
                new BigDecimal("9.4"), new BigDecimal("9.4"), 1000);
            controller.startBar(bar, portfolio, limits);
            RiskDecision decision = evaluate(Direction.BUY, bar);

            OrderIntent intent = decision.intent().orElseThrow();
            assertThat(intent.direction()).isEqualTo(Direction.SELL);
            assertThat(intent.quantity()).isEqualTo(1000);
            assertThat(intent.exit()).contains(ExitTrigger.STOP_LOSS);
            assertThat(intent.priceReference().isLimit()).isFalse();
        }

        @Test
        @DisplayName("Take-profit fires at the target")
        void testTakeProfit() {
            setUp(PipelineConfig.builder());
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);

            RiskDecision decision = evaluate(Direction.HOLD, startBar(1, "11.0"));
            assertThat(decision.intent().orElseThrow().exit()).contains(ExitTrigger.TAKE_PROFIT);
        }

        @Test
        @DisplayName("Trailing stop follows the highest close")
        void testTrailingStop() {
            setUp(PipelineConfig.builder()
                .stopLoss(new BigDecimal("0.20"))
                .takeProfit(new BigDecimal("0.50"))
                .trailingStop(new BigDecimal("0.05")));
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);

            assertThat(evaluate(Direction.HOLD, startBar(1, "12")).intent()).isEmpty();
            assertThat(evaluate(Direction.HOLD, startBar(2, "11.5")).intent()).isEmpty();
            RiskDecision decision = evaluate(Direction.HOLD, startBar(3, "11.3"));

            assertThat(decision.intent().orElseThrow().exit()).contains(ExitTrigger.TRAILING_STOP);
        }

        @Test
        @DisplayName("No exit while price stays inside the band")
        void testInsideBand() {
            setUp(PipelineConfig.builder());
            startBar(0, "10");
            applyFill(Direction.BUY, 1000, "10", 0);

            assertThat(controller.checkExit(portfolio, new BigDecimal("9.6"))).isEmpty();
            assertThat(controller.checkExit(portfolio, new BigDecimal("10.9"))).isEmpty();
            assertThat(controller.checkExit(portfolio, new BigDecimal("9.5"))).contains(ExitTrigger.STOP_LOSS);
        }
    }
}
