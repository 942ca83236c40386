package com.quantflow.config;

import com.quantflow.core.config.FillTiming;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.config.SizingMethod;
import com.quantflow.core.config.StrategyType;
import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.strategy.TechnicalCondition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

import static com.quantflow.TestFixtures.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Trading Config Tests")
class TradingConfigTest {

    @AfterEach
    void tearDown() {
        TradingConfig.reset();
    }

    @Nested
    @DisplayName("Pipeline Mapping")
    class PipelineMappingTests {

        @Test
        @DisplayName("Empty properties give the documented defaults")
        void testDefaults() {
            PipelineConfig pipeline = config().toPipelineConfig();

            assertThat(pipeline.instrument()).isEqualTo("SPY");
            assertThat(pipeline.initialCapital()).isEqualByComparingTo("100000");
            assertThat(pipeline.zone()).isEqualTo(ZoneId.of("America/New_York"));
            assertThat(pipeline.indicators().shortMa()).isEqualTo(5);
            assertThat(pipeline.indicators().longMa()).isEqualTo(20);
            assertThat(pipeline.risk().stopLoss()).isEqualByComparingTo("0.05");
            assertThat(pipeline.risk().maxTradesPerDay()).isEqualTo(10);
            assertThat(pipeline.execution().fillTiming()).isEqualTo(FillTiming.NEXT_BAR_OPEN);
            assertThat(pipeline.execution().lotSize()).isEqualTo(100);
        }

        @Test
        @DisplayName("Dotted keys override defaults, hyphenated enum values are accepted")
        void testOverrides() {
            PipelineConfig pipeline = config(
                "instrument", "aapl",
                "initial-capital", "25000",
                "ma.short", "3",
                "ma.long", "8",
                "strategy.type", "momentum",
                "sizing.method", "fixed-fraction",
                "risk.trailing-stop", "0.03",
                "execution.fill-timing", "same-bar-close",
                "strategy.buy-requires", "ma-cross, macd-cross"
            ).toPipelineConfig();

            assertThat(pipeline.instrument()).isEqualTo("AAPL");
            assertThat(pipeline.initialCapital()).isEqualByComparingTo("25000");
            assertThat(pipeline.indicators().shortMa()).isEqualTo(3);
            assertThat(pipeline.indicators().longMa()).isEqualTo(8);
            assertThat(pipeline.strategy().type()).isEqualTo(StrategyType.MOMENTUM);
            assertThat(pipeline.risk().sizingMethod()).isEqualTo(SizingMethod.FIXED_FRACTION);
            assertThat(pipeline.risk().trailingStop()).isEqualByComparingTo("0.03");
            assertThat(pipeline.execution().fillTiming()).isEqualTo(FillTiming.SAME_BAR_CLOSE);
            assertThat(pipeline.strategy().buyRequires())
                .containsExactlyInAnyOrder(TechnicalCondition.MA_CROSS, TechnicalCondition.MACD_CROSS);
        }

        @Test
        @DisplayName("Malformed numbers fall back to the default")
        void testMalformedFallsBack() {
            PipelineConfig pipeline = config(
                "rsi.period", "fourteen",
                "risk.stop-loss", "5%",
                "sizing.method", "martingale"
            ).toPipelineConfig();

            assertThat(pipeline.indicators().rsiPeriod()).isEqualTo(14);
            assertThat(pipeline.risk().stopLoss()).isEqualByComparingTo("0.05");
            assertThat(pipeline.risk().sizingMethod()).isEqualTo(SizingMethod.FIXED_AMOUNT);
        }

        @Test
        @DisplayName("Short MA not below long MA fails fast")
        void testInvalidCombination() {
            TradingConfig config = config("ma.short", "20", "ma.long", "5");

            assertThatThrownBy(config::toPipelineConfig).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Unknown strategy condition is rejected")
        void testUnknownCondition() {
            TradingConfig config = config("strategy.sell-requires", "ma-cross,astrology");

            assertThatThrownBy(config::toPipelineConfig)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("astrology");
        }

        @Test
        @DisplayName("Unknown zone is rejected")
        void testInvalidZone() {
            assertThatThrownBy(() -> config("zone", "Mars/Olympus").toPipelineConfig())
                .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Backend Settings")
    class BackendSettingsTests {

        @Test
        @DisplayName("Broker, store and session settings have defaults")
        void testBackendDefaults() {
            TradingConfig config = config();

            assertThat(config.getDatabasePath()).isEqualTo("quantflow.db");
            assertThat(config.getBrokerBaseUrl()).isEqualTo("https://paper-api.alpaca.markets");
            assertThat(config.getBarTimeframe()).isEqualTo("1Day");
            assertThat(config.getOrderTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(config.getSessionOpen()).isEqualTo(LocalTime.of(9, 30));
            assertThat(config.getSessionClose()).isEqualTo(LocalTime.of(16, 0));
        }

        @Test
        @DisplayName("Credentials in the file win over the environment")
        void testCredentialsFromFile() {
            TradingConfig config = config("broker.api-key", "key-1", "broker.api-secret", "secret-1");

            assertThat(config.getApiKey()).isEqualTo("key-1");
            assertThat(config.getApiSecret()).isEqualTo("secret-1");
        }

        @Test
        @DisplayName("Malformed session time falls back to the default")
        void testMalformedTime() {
            assertThat(config("session.open", "half past nine").getSessionOpen()).isEqualTo(LocalTime.of(9, 30));
        }
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("A file on disk takes precedence over the classpath")
        void testLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("config.properties");
            Files.writeString(file, "instrument=QQQ\ndatabase.path=/tmp/q.db\n");

            TradingConfig config = TradingConfig.load(file);

            assertThat(config.toPipelineConfig().instrument()).isEqualTo("QQQ");
            assertThat(config.getDatabasePath()).isEqualTo("/tmp/q.db");
        }

        @Test
        @DisplayName("Missing file falls back to the bundled config.properties")
        void testLoadFromClasspath(@TempDir Path dir) {
            TradingConfig config = TradingConfig.load(dir.resolve("absent.properties"));

            assertThat(config.toPipelineConfig().instrument()).isEqualTo("SPY");
            assertThat(config.getReportDirectory()).isEqualTo("reports");
        }

        @Test
        @DisplayName("getInstance returns the same object until reset")
        void testSingleton() {
            TradingConfig first = TradingConfig.getInstance();

            assertThat(TradingConfig.getInstance()).isSameAs(first);
            TradingConfig.reset();
            assertThat(TradingConfig.getInstance()).isNotSameAs(first);
        }
    }
}
