package com.quantflow.persistence;

import com.quantflow.TestFixtures;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.engine.BacktestEngine;
import com.quantflow.core.engine.BacktestEngine.BacktestReport;
import com.quantflow.core.engine.BacktestEngine.BacktestRequest;
import com.quantflow.core.model.Bar;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static com.quantflow.TestFixtures.day;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * SQLite store: bar storage and range reads, and the audit trail written during a backtest.
 */
@DisplayName("Market Data Store Tests")
class MarketDataStoreTest {

    @TempDir
    Path dir;

    private MarketDataStore store;

    @BeforeEach
    void setUp() {
        store = new MarketDataStore(dir.resolve("test.db").toString());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Bars")
    class BarTests {

        @Test
        @DisplayName("Bars round-trip with exact decimals, in timestamp order")
        void testSaveAndFind() {
            List<Bar> bars = TestFixtures.goldenCross();
            store.saveBars("SPY", List.of(bars.get(2), bars.get(0), bars.get(1)));

            List<Bar> found = store.findBars("SPY", day(0), day(3));

            assertThat(found).containsExactly(bars.get(0), bars.get(1), bars.get(2));
            assertThat(found.get(1).close()).isEqualByComparingTo("10.50");
        }

        @Test
        @DisplayName("Re-importing a bar for the same instrument and timestamp is ignored")
        void testDuplicateIgnored() {
            List<Bar> bars = TestFixtures.goldenCross();

            assertThat(store.saveBars("SPY", bars.subList(0, 10))).isEqualTo(10);
            assertThat(store.saveBars("SPY", bars.subList(5, 15))).isEqualTo(5);
            assertThat(store.saveBars("QQQ", bars.subList(0, 3))).isEqualTo(3);

            assertThat(store.findBars("SPY", day(0), day(30))).hasSize(15);
            assertThat(store.findBars("QQQ", day(0), day(30))).hasSize(3);
        }

        @Test
        @DisplayName("Range start is inclusive, end exclusive")
        void testRangeBounds() {
            store.saveBars("SPY", TestFixtures.goldenCross());

            List<Bar> found = store.findBars("SPY", day(5), day(10));

            assertThat(found).hasSize(5);
            assertThat(found.get(0).timestamp()).isEqualTo(day(5));
            assertThat(found.get(4).timestamp()).isEqualTo(day(9));
        }

        @Test
        @DisplayName("Latest bar time per instrument")
        void testLatestBarTime() {
            assertThat(store.latestBarTime("SPY")).isEmpty();

            store.saveBars("SPY", TestFixtures.goldenCross().subList(0, 7));

            assertThat(store.latestBarTime("SPY")).contains(day(6));
        }

        @Test
        @DisplayName("Bars survive reopening the database")
        void testPersistent() {
            store.saveBars("SPY", TestFixtures.goldenCross().subList(0, 4));
            store.close();

            store = new MarketDataStore(dir.resolve("test.db").toString());

            assertThat(store.findBars("SPY", day(0), day(30))).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Audit Trail")
    class AuditTrailTests {

        @Test
        @DisplayName("Backtest over stored bars records its signal, fill and a snapshot per bar")
        void testBacktestAudit() {
            store.saveBars("SPY", TestFixtures.goldenCross());
            var engine = new BacktestEngine(PipelineConfig.defaults(), store)
                .addListener(new AuditTrailListener(store, "run-1", "SPY"));

            BacktestReport report = engine.run(new BacktestRequest("SPY",
                LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 31), null));

            assertThat(report.result().barsProcessed()).isEqualTo(30);
            assertThat(store.countSignals("run-1")).isEqualTo(1);
            assertThat(store.countSnapshots("run-1")).isEqualTo(30);

            List<MarketDataStore.FillRecord> fills = store.getFills("run-1");
            assertThat(fills).hasSize(1);
            assertThat(fills.get(0).side()).isEqualTo("buy");
            assertThat(fills.get(0).quantity()).isEqualTo(900);
            assertThat(fills.get(0).price()).isEqualByComparingTo("10.30");
            assertThat(fills.get(0).commission()).isEqualByComparingTo("2.78");
            assertThat(fills.get(0).timestamp()).isEqualTo(day(22));
            assertThat(fills.get(0).exitTrigger()).isNull();
        }

        @Test
        @DisplayName("Vetoes are stored under their reason tag")
        void testVetoRecorded() {
            store.saveBars("SPY", TestFixtures.goldenCross());
            // 900 shares at 10.30 exceed the 30% cap of 9000
            PipelineConfig config = PipelineConfig.builder()
                .initialCapital(new BigDecimal("30000"))
                .build();
            var engine = new BacktestEngine(config, store)
                .addListener(new AuditTrailListener(store, "run-2", "SPY"));

            BacktestReport report = engine.run(new BacktestRequest("SPY",
                LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 31), null));

            assertThat(report.result().fills()).isEmpty();
            assertThat(store.countRiskEvents("run-2", "position-cap")).isEqualTo(1);
            assertThat(store.getFills("run-2")).isEmpty();
        }

        @Test
        @DisplayName("Runs are kept apart by run id")
        void testRunsSeparated() {
            store.saveBars("SPY", TestFixtures.goldenCross());
            var request = new BacktestRequest("SPY", LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 31), null);

            new BacktestEngine(PipelineConfig.defaults(), store)
                .addListener(new AuditTrailListener(store, "a", "SPY")).run(request);
            new BacktestEngine(PipelineConfig.defaults(), store)
                .addListener(new AuditTrailListener(store, "b", "SPY")).run(request);

            assertThat(store.getFills("a")).hasSize(1);
            assertThat(store.getFills("b")).hasSize(1);
            assertThat(store.countSnapshots("a")).isEqualTo(30);
        }
    }
}
