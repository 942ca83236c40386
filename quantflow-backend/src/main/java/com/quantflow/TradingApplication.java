package com.quantflow;

import com.quantflow.broker.AlpacaBrokerClient;
import com.quantflow.broker.BrokerClient;
import com.quantflow.broker.ResilientBrokerClient;
import com.quantflow.cli.CsvBarLoader;
import com.quantflow.config.TradingConfig;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.engine.BacktestEngine;
import com.quantflow.core.engine.BacktestEngine.BacktestReport;
import com.quantflow.core.engine.BacktestEngine.BacktestRequest;
import com.quantflow.core.engine.ReplayResult;
import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.error.MarketDataException;
import com.quantflow.core.metrics.PerformanceReport;
import com.quantflow.core.model.Bar;
import com.quantflow.live.LiveTrader;
import com.quantflow.metrics.PipelineMetrics;
import com.quantflow.persistence.AuditTrailListener;
import com.quantflow.persistence.MarketDataStore;
import com.quantflow.report.ReportExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Command-line entry point.
 *
 * <pre>
 *   import   SYMBOL FILE.csv              load bars from CSV into the store
 *   fetch    SYMBOL FROM TO               download bars from the broker into the store
 *   backtest SYMBOL FROM TO [CAPITAL]     replay stored bars and write a JSON report
 *   live                                  trade the configured instrument until interrupted
 * </pre>
 * Dates are ISO ({@code 2024-01-31}); FROM and TO are inclusive.
 */
public final class TradingApplication {
    private static final Logger logger = LoggerFactory.getLogger(TradingApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    // Time beyond the order timeout for the last fill to be applied and recorded
    private static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(5);

    private final TradingConfig config;
    private final MeterRegistry registry;

    TradingApplication(TradingConfig config, MeterRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public static void main(String[] args) {
        var app = new TradingApplication(TradingConfig.getInstance(), new SimpleMeterRegistry());
        System.exit(app.run(args));
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        try {
            return switch (command) {
                case "import" -> importCsv(args);
                case "fetch" -> fetch(args);
                case "backtest" -> backtest(args);
                case "live" -> live();
                default -> {
                    logger.error("Unknown command: {}", command);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            logger.error(e.getMessage());
            printUsage();
            return EXIT_USAGE;
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (MarketDataException e) {
            logger.error("Market data error: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("{} failed", command, e);
            return EXIT_FAILURE;
        }
    }

    private int importCsv(String[] args) {
        requireArgs(args, 3, "import SYMBOL FILE.csv");
        String instrument = args[1].toUpperCase(Locale.ROOT);
        PipelineConfig pipeline = config.toPipelineConfig();
        List<Bar> bars = new CsvBarLoader(pipeline.zone()).load(Path.of(args[2]));
        try (var store = new MarketDataStore(config.getDatabasePath())) {
            int inserted = store.saveBars(instrument, bars);
            logger.info("Imported {} new bars for {} ({} already stored)", inserted, instrument, bars.size() - inserted);
        }
        return EXIT_OK;
    }

    private int fetch(String[] args) {
        requireArgs(args, 4, "fetch SYMBOL FROM TO");
        String instrument = args[1].toUpperCase(Locale.ROOT);
        PipelineConfig pipeline = config.toPipelineConfig();
        LocalDate from = parseDate(args[2]);
        LocalDate to = parseDate(args[3]);
        BrokerClient broker = brokerClient();
        List<Bar> bars = broker.getBars(instrument, from.atStartOfDay(pipeline.zone()).toInstant(),
            to.plusDays(1).atStartOfDay(pipeline.zone()).toInstant());
        try (var store = new MarketDataStore(config.getDatabasePath())) {
            int inserted = store.saveBars(instrument, bars);
            logger.info("Fetched {} bars for {}, {} new", bars.size(), instrument, inserted);
        }
        return EXIT_OK;
    }

    private int backtest(String[] args) {
        requireArgs(args, 4, "backtest SYMBOL FROM TO [CAPITAL]");
        BigDecimal capital = null;
        if (args.length > 4) {
            try {
                capital = new BigDecimal(args[4]);
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid capital: " + args[4]);
            }
        }
        BacktestRequest request;
        try {
            request = new BacktestRequest(args[1].toUpperCase(Locale.ROOT), parseDate(args[2]), parseDate(args[3]), capital);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }

        PipelineConfig pipeline = config.toPipelineConfig();
        String runId = UUID.randomUUID().toString();
        try (var store = new MarketDataStore(config.getDatabasePath())) {
            var engine = new BacktestEngine(pipeline, store)
                .addListener(new AuditTrailListener(store, runId, request.instrument()))
                .addListener(new PipelineMetrics(registry, request.instrument()));
            BacktestReport report = engine.run(request);
            logSummary(report);
            new ReportExporter().export(report, Path.of(config.getReportDirectory()));
        }
        return EXIT_OK;
    }

    private int live() {
        BrokerClient broker = brokerClient();
        try (var store = new MarketDataStore(config.getDatabasePath())) {
            var trader = new LiveTrader(config, broker, Clock.systemUTC());
            String instrument = trader.pipelineConfig().instrument();
            trader.addListener(new AuditTrailListener(store, UUID.randomUUID().toString(), instrument))
                .addListener(new PipelineMetrics(registry, instrument));

            Duration grace = config.getOrderTimeout().plus(SHUTDOWN_MARGIN);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received, stopping live trading...");
                trader.stop();
                try {
                    if (!trader.awaitTermination(grace)) {
                        logger.warn("Bar in flight did not finish within {}ms", grace.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting for the bar in flight");
                }
            }, "shutdown-hook"));

            ReplayResult result = trader.run();
            logger.info("Live session ended: {} bars, {} fills, {} execution failures, equity {}",
                result.barsProcessed(), result.fills().size(), result.executionFailures(),
                String.format("%.2f", result.finalPortfolio().equity()));
        }
        return EXIT_OK;
    }

    private BrokerClient brokerClient() {
        if (config.getApiKey().isBlank() || config.getApiSecret().isBlank()) {
            throw new ConfigurationException("Broker credentials missing: set broker.api-key/broker.api-secret "
                + "or APCA_API_KEY_ID/APCA_API_SECRET_KEY");
        }
        return new ResilientBrokerClient(new AlpacaBrokerClient(config), registry);
    }

    private static void logSummary(BacktestReport report) {
        PerformanceReport p = report.result().performance();
        logger.info("═══════════════════════════════════════════════════════");
        logger.info("Backtest {} {} .. {}", report.request().instrument(), report.request().from(), report.request().to());
        logger.info("═══════════════════════════════════════════════════════");
        logger.info("Final equity:      ${}", String.format("%.2f", p.finalEquity()));
        logger.info("Total return:      {}%", String.format("%.2f", p.totalReturn() * 100));
        logger.info("Buy & hold:        {}%", String.format("%.2f", report.buyAndHoldReturn() * 100));
        logger.info("Max drawdown:      {}%", String.format("%.2f", p.maxDrawdown() * 100));
        logger.info("Sharpe ratio:      {}", String.format("%.2f", p.sharpeRatio()));
        logger.info("Win rate:          {}% of {} closed trades", String.format("%.1f", p.winRate() * 100), p.closedTrades());
        logger.info("Vetoes:            {}", report.result().vetoes());
        logger.info("═══════════════════════════════════════════════════════");
    }

    private static void requireArgs(String[] args, int count, String usage) {
        if (args.length < count) {
            throw new UsageException("Usage: " + usage);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new UsageException("Invalid date: " + value);
        }
    }

    private static void printUsage() {
        System.err.println("""
            Usage: quantflow <command> [args]
              import   SYMBOL FILE.csv              load bars from CSV into the store
              fetch    SYMBOL FROM TO               download bars from the broker into the store
              backtest SYMBOL FROM TO [CAPITAL]     replay stored bars and write a JSON report
              live                                  trade the configured instrument until interrupted""");
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
