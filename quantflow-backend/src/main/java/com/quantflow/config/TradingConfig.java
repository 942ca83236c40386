package com.quantflow.config;

import com.quantflow.core.config.FillTiming;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.config.SizingMethod;
import com.quantflow.core.config.StrategyType;
import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.model.OrderType;
import com.quantflow.core.strategy.TechnicalCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process configuration loaded from {@code config.properties}.
 *
 * <p>Pipeline settings are turned into an immutable {@link PipelineConfig} by {@link #toPipelineConfig()};
 * the remaining keys configure the store, the broker connection and the live session.
 * Malformed values log a warning and fall back to the default. Invalid combinations are rejected
 * by {@link PipelineConfig} validation.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);

    private static final AtomicReference<TradingConfig> instanceRef = new AtomicReference<>();
    private static final PipelineConfig DEFAULTS = PipelineConfig.defaults();

    private final Properties properties;

    private TradingConfig(Properties props) {
        this.properties = props;
    }

    /**
     * Get the shared instance, loading it from config.properties on first use.
     */
    public static TradingConfig getInstance() {
        return instanceRef.updateAndGet(existing ->
            existing != null ? existing : load()
        );
    }

    /**
     * Load config.properties from the working directory, falling back to the classpath.
     */
    public static TradingConfig load() {
        return load(Path.of("config.properties"));
    }

    public static TradingConfig load(Path configPath) {
        Properties props = new Properties();

        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", configPath, e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new TradingConfig(props);
    }

    public static TradingConfig forTest(Properties testProps) {
        return new TradingConfig(testProps);
    }

    public static void reset() {
        instanceRef.set(null);
    }

    /**
     * Build and validate the pipeline configuration.
     *
     * @throws ConfigurationException if the combination of values is invalid
     */
    public PipelineConfig toPipelineConfig() {
        var indicators = DEFAULTS.indicators();
        var strategy = DEFAULTS.strategy();
        var risk = DEFAULTS.risk();
        var execution = DEFAULTS.execution();

        PipelineConfig config = PipelineConfig.builder()
            .instrument(getString("instrument", DEFAULTS.instrument()).toUpperCase(Locale.ROOT))
            .initialCapital(getDecimal("initial-capital", DEFAULTS.initialCapital()))
            .zone(getZone())
            .movingAverages(getInt("ma.short", indicators.shortMa()), getInt("ma.long", indicators.longMa()))
            .rsiPeriod(getInt("rsi.period", indicators.rsiPeriod()))
            .macd(getInt("macd.fast", indicators.macdFast()), getInt("macd.slow", indicators.macdSlow()),
                getInt("macd.signal", indicators.macdSignal()))
            .bollinger(getInt("bollinger.period", indicators.bollingerPeriod()),
                getDecimal("bollinger.k", indicators.bollingerK()))
            .volumeMa(getInt("volume.ma", indicators.volumeMa()))
            .atrPeriod(getInt("atr.period", indicators.atrPeriod()))
            .momentumPeriod(getInt("momentum.period", indicators.momentumPeriod()))
            .window(getInt("indicator.window", indicators.window()))
            .strategyType(getEnum("strategy.type", StrategyType.class, strategy.type()))
            .rsiBands(getDecimal("rsi.oversold", strategy.rsiOversold()),
                getDecimal("rsi.overbought", strategy.rsiOverbought()))
            .buyRequires(getConditions("strategy.buy-requires", strategy.buyRequires()))
            .sellRequires(getConditions("strategy.sell-requires", strategy.sellRequires()))
            .sellOnOverbought(getBoolean("strategy.sell-on-overbought", strategy.sellOnOverbought()))
            .volumeSurgeRatio(getDecimal("strategy.volume-surge-ratio", strategy.volumeSurgeRatio()))
            .momentumThresholds(getDecimal("momentum.threshold", strategy.momentumThreshold()),
                getDecimal("momentum.strong-threshold", strategy.strongMomentumThreshold()))
            .volumeChangeThreshold(getDecimal("momentum.volume-change", strategy.volumeChangeThreshold()))
            .sizingMethod(getEnum("sizing.method", SizingMethod.class, risk.sizingMethod()))
            .tradeAmount(getDecimal("sizing.trade-amount", risk.tradeAmount()))
            .tradeAmountRange(getDecimal("sizing.min-trade-amount", risk.minTradeAmount()),
                getDecimal("sizing.max-trade-amount", risk.maxTradeAmount()))
            .positionRatio(getDecimal("sizing.position-ratio", risk.positionRatio()))
            .maxPositionFraction(getDecimal("risk.max-position-fraction", risk.maxPositionFraction()))
            .kelly(getDecimal("kelly.fraction", risk.kellyFraction()), getInt("kelly.min-trades", risk.kellyMinTrades()),
                getInt("kelly.lookback-trades", risk.kellyLookbackTrades()))
            .atrSizing(getDecimal("sizing.risk-per-trade", risk.riskPerTrade()),
                getDecimal("sizing.atr-multiplier", risk.atrMultiplier()))
            .stopLoss(getDecimal("risk.stop-loss", risk.stopLoss()))
            .takeProfit(getDecimal("risk.take-profit", risk.takeProfit()))
            .trailingStop(getDecimal("risk.trailing-stop", risk.trailingStop()))
            .maxDrawdown(getDecimal("risk.max-drawdown", risk.maxDrawdown()))
            .maxDailyLoss(getDecimal("risk.max-daily-loss", risk.maxDailyLoss()))
            .maxTradesPerDay(getInt("risk.max-trades-per-day", risk.maxTradesPerDay()))
            .fillTiming(getEnum("execution.fill-timing", FillTiming.class, execution.fillTiming()))
            .orderType(getEnum("execution.order-type", OrderType.class, execution.orderType()))
            .commission(getDecimal("execution.commission-rate", execution.commissionRate()),
                getDecimal("execution.min-commission", execution.minCommission()))
            .slippage(getDecimal("execution.slippage", execution.slippage()))
            .lotSize(getInt("execution.lot-size", execution.lotSize()))
            .build();

        logger.info("Pipeline configuration loaded:");
        logger.info("   Instrument: {} ({} strategy)", config.instrument(), config.strategy().type());
        logger.info("   Initial capital: {}", String.format("%.2f", config.initialCapital()));
        logger.info("   Stop-Loss: {}%", String.format("%.2f", config.risk().stopLoss().movePointRight(2)));
        logger.info("   Take-Profit: {}%", String.format("%.2f", config.risk().takeProfit().movePointRight(2)));
        logger.info("   Max Drawdown: {}%", String.format("%.2f", config.risk().maxDrawdown().movePointRight(2)));
        logger.info("   Sizing: {}, fills at {}", config.risk().sizingMethod(), config.execution().fillTiming());
        return config;
    }

    // ========== Store, broker and session ==========

    public String getDatabasePath() {
        return getString("database.path", "quantflow.db");
    }

    public String getBrokerBaseUrl() {
        return getString("broker.base-url", "https://paper-api.alpaca.markets");
    }

    public String getMarketDataUrl() {
        return getString("broker.data-url", "https://data.alpaca.markets");
    }

    /** API key id, from the environment when not set in the file. */
    public String getApiKey() {
        return getString("broker.api-key", envOrEmpty("APCA_API_KEY_ID"));
    }

    public String getApiSecret() {
        return getString("broker.api-secret", envOrEmpty("APCA_API_SECRET_KEY"));
    }

    public String getBarTimeframe() {
        return getString("broker.timeframe", "1Day");
    }

    public Duration getOrderTimeout() {
        return Duration.ofMillis(getLong("broker.order-timeout-ms", 10_000));
    }

    public Duration getFillPollInterval() {
        return Duration.ofMillis(getLong("broker.fill-poll-ms", 500));
    }

    public Duration getBarPollInterval() {
        return Duration.ofMillis(getLong("live.poll-interval-ms", 60_000));
    }

    public LocalTime getSessionOpen() {
        return getTime("session.open", LocalTime.of(9, 30));
    }

    public LocalTime getSessionClose() {
        return getTime("session.close", LocalTime.of(16, 0));
    }

    public String getReportDirectory() {
        return getString("report.directory", "reports");
    }

    // ========== Parsing ==========

    private String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(String key, int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    private long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Set<TechnicalCondition> getConditions(String key, Set<TechnicalCondition> defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        Set<TechnicalCondition> conditions = EnumSet.noneOf(TechnicalCondition.class);
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                conditions.add(TechnicalCondition.valueOf(part.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown condition '" + part.trim() + "' in " + key, e);
            }
        }
        return conditions;
    }

    private ZoneId getZone() {
        String value = getString("zone", DEFAULTS.zone().getId());
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid zone '" + value + "'", e);
        }
    }

    private LocalTime getTime(String key, LocalTime defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String envOrEmpty(String name) {
        String value = System.getenv(name);
        return value == null ? "" : value;
    }
}
