package com.quantflow.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantflow.TestFixtures;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.engine.BacktestEngine;
import com.quantflow.core.engine.BacktestEngine.BacktestReport;
import com.quantflow.core.engine.BacktestEngine.BacktestRequest;
import com.quantflow.core.model.Bar;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Report Exporter Tests")
class ReportExporterTest {

    private static BacktestReport report;

    private final ReportExporter exporter = new ReportExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void runBacktest() {
        List<Bar> bars = TestFixtures.goldenCross();
        report = new BacktestEngine(PipelineConfig.defaults(), (instrument, from, to) -> bars.stream()
            .filter(bar -> !bar.timestamp().isBefore(from) && bar.timestamp().isBefore(to))
            .toList())
            .run(new BacktestRequest("SPY", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 31), null));
    }

    @Test
    @DisplayName("Report file is named after instrument and date range")
    void testExportFileName(@TempDir Path dir) throws Exception {
        Path file = exporter.export(report, dir.resolve("reports"));

        assertThat(file.getFileName().toString()).isEqualTo("backtest-SPY-2024-01-02-2024-01-31.json");
        assertThat(Files.readString(file)).isEqualTo(exporter.toJson(report));
    }

    @Test
    @DisplayName("Dates, instants and decimals are written as readable values")
    void testJsonShape() throws Exception {
        JsonNode json = mapper.readTree(exporter.toJson(report));

        assertThat(json.path("request").path("from").asText()).isEqualTo("2024-01-02");
        assertThat(json.path("result").path("barsProcessed").asLong()).isEqualTo(30);

        JsonNode fill = json.path("result").path("fills").get(0);
        assertThat(fill.path("timestamp").isTextual()).isTrue();
        assertThat(fill.path("timestamp").asText()).isEqualTo("2024-01-24T21:00:00Z");
        assertThat(fill.path("quantity").asLong()).isEqualTo(900);
        assertThat(fill.path("price").decimalValue()).isEqualByComparingTo("10.30");
        assertThat(json.path("equityCurve").size()).isEqualTo(30);
    }
}
