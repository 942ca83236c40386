package com.quantflow.core.config;

import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.model.OrderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pipeline Config Tests")
class PipelineConfigTest {

    @Test
    @DisplayName("Defaults are valid")
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertThat(config.instrument()).isEqualTo("SPY");
        assertThat(config.zone()).isEqualTo(ZoneId.of("America/New_York"));
        assertThat(config.indicators().shortMa()).isEqualTo(5);
        assertThat(config.indicators().longMa()).isEqualTo(20);
        assertThat(config.indicators().maxLookback()).isEqualTo(34);
        assertThat(config.risk().sizingMethod()).isEqualTo(SizingMethod.FIXED_AMOUNT);
        assertThat(config.risk().trailingStopEnabled()).isFalse();
        assertThat(config.execution().fillTiming()).isEqualTo(FillTiming.NEXT_BAR_OPEN);
        assertThat(config.execution().orderType()).isEqualTo(OrderType.MARKET);
        assertThat(config.execution().lotSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("Short MA period at or above the long period fails fast")
    void testMovingAveragePeriods() {
        assertThatThrownBy(() -> PipelineConfig.builder().movingAverages(20, 20).build())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("short MA period");
        assertThatThrownBy(() -> PipelineConfig.builder().movingAverages(30, 10).build())
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Invalid combinations are rejected, never corrected")
    void testInvalidCombinations() {
        assertThatThrownBy(() -> PipelineConfig.builder().macd(26, 12, 9).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> PipelineConfig.builder()
                .tradeAmountRange(new BigDecimal("60000"), new BigDecimal("50000")).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> PipelineConfig.builder().window(20).build())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("window");
        assertThatThrownBy(() -> PipelineConfig.builder().stopLoss(BigDecimal.ONE).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> PipelineConfig.builder()
                .rsiBands(new BigDecimal("70"), new BigDecimal("30")).build())
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Builder copy keeps every setting")
    void testToBuilder() {
        PipelineConfig original = PipelineConfig.builder()
            .instrument("QQQ")
            .movingAverages(10, 30)
            .strategyType(StrategyType.MOMENTUM)
            .trailingStop(new BigDecimal("0.03"))
            .fillTiming(FillTiming.SAME_BAR_CLOSE)
            .build();
        PipelineConfig copy = original.forInstrument("IWM");

        assertThat(copy.instrument()).isEqualTo("IWM");
        assertThat(copy.indicators()).isEqualTo(original.indicators());
        assertThat(copy.strategy()).isEqualTo(original.strategy());
        assertThat(copy.risk()).isEqualTo(original.risk());
        assertThat(copy.execution()).isEqualTo(original.execution());
    }
}
