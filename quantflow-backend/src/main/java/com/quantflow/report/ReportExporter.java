package com.quantflow.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantflow.core.engine.BacktestEngine.BacktestReport;
import com.quantflow.core.metrics.PerformanceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes backtest reports as pretty-printed JSON. Dates and instants are ISO strings and decimals
 * are written in plain notation.
 */
public final class ReportExporter {
    private static final Logger logger = LoggerFactory.getLogger(ReportExporter.class);

    private final ObjectMapper objectMapper;

    public ReportExporter() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public String toJson(BacktestReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Report serialization failed", e);
        }
    }

    /**
     * Write {@code report} into {@code directory}, creating it if needed.
     *
     * @return the written file, named after the instrument and date range
     */
    public Path export(BacktestReport report, Path directory) {
        var request = report.request();
        Path file = directory.resolve(String.format("backtest-%s-%s-%s.json",
            request.instrument(), request.from(), request.to()));
        try {
            Files.createDirectories(directory);
            Files.writeString(file, toJson(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Report write failed: " + file, e);
        }

        PerformanceReport performance = report.result().performance();
        logger.atInfo()
            .addKeyValue("instrument", request.instrument())
            .addKeyValue("totalReturn", String.format("%.4f", performance.totalReturn()))
            .addKeyValue("trades", performance.totalTrades())
            .log("Backtest report written to {}", file);
        return file;
    }
}
