package com.quantflow.persistence;

import com.quantflow.core.engine.BarRepository;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite store for historical bars and the audit trail of pipeline runs.
 *
 * <p>Bars are unique per instrument and timestamp; re-importing a bar is a no-op. Prices are stored
 * as decimal text so replays read back exactly what was written.
 *
 * <p>Thread-safety: a StampedLock guards the single connection, write lock for mutations and
 * read lock for queries.
 */
public final class MarketDataStore implements BarRepository, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataStore.class);

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public MarketDataStore(String dbPath) {
        String dbUrl = "jdbc:sqlite:" + dbPath;
        try {
            connection = DriverManager.getConnection(dbUrl);
            createTables();
            logger.info("Market data store initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String barsSql = """
            CREATE TABLE IF NOT EXISTS bars (
                instrument TEXT NOT NULL,
                ts TEXT NOT NULL,
                open TEXT NOT NULL,
                high TEXT NOT NULL,
                low TEXT NOT NULL,
                close TEXT NOT NULL,
                volume INTEGER NOT NULL,
                UNIQUE (instrument, ts)
            )
            """;

        String fillsSql = """
            CREATE TABLE IF NOT EXISTS fills (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id TEXT NOT NULL,
                instrument TEXT NOT NULL,
                ts TEXT NOT NULL,
                side TEXT NOT NULL,
                quantity INTEGER NOT NULL,
                price TEXT NOT NULL,
                commission TEXT NOT NULL,
                exit_trigger TEXT,
                strategy TEXT,
                reason TEXT,
                created_at TEXT DEFAULT CURRENT_TIMESTAMP
            )
            """;

        String snapshotsSql = """
            CREATE TABLE IF NOT EXISTS portfolio_snapshots (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id TEXT NOT NULL,
                instrument TEXT NOT NULL,
                ts TEXT NOT NULL,
                cash TEXT NOT NULL,
                position INTEGER NOT NULL,
                average_cost TEXT NOT NULL,
                equity TEXT NOT NULL,
                drawdown TEXT NOT NULL,
                realized_pnl TEXT NOT NULL
            )
            """;

        String signalsSql = """
            CREATE TABLE IF NOT EXISTS signals (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id TEXT NOT NULL,
                instrument TEXT NOT NULL,
                ts TEXT NOT NULL,
                direction TEXT NOT NULL,
                strength REAL NOT NULL,
                strategy TEXT NOT NULL,
                reason TEXT
            )
            """;

        String riskEventsSql = """
            CREATE TABLE IF NOT EXISTS risk_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id TEXT NOT NULL,
                instrument TEXT NOT NULL,
                ts TEXT NOT NULL,
                event TEXT NOT NULL,
                detail TEXT
            )
            """;

        String indexSql = """
            CREATE INDEX IF NOT EXISTS idx_fills_run
            ON fills(run_id, instrument)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(barsSql);
            stmt.execute(fillsSql);
            stmt.execute(snapshotsSql);
            stmt.execute(signalsSql);
            stmt.execute(riskEventsSql);
            stmt.execute(indexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ========== Bars ==========

    /**
     * Insert bars, skipping any whose instrument and timestamp are already stored.
     *
     * @return number of bars actually inserted
     */
    public int saveBars(String instrument, List<Bar> bars) {
        String sql = """
            INSERT OR IGNORE INTO bars (instrument, ts, open, high, low, close, volume)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try {
            connection.setAutoCommit(false);
            int inserted = 0;
            try (var stmt = connection.prepareStatement(sql)) {
                for (Bar bar : bars) {
                    stmt.setString(1, instrument);
                    stmt.setString(2, bar.timestamp().toString());
                    stmt.setString(3, bar.open().toPlainString());
                    stmt.setString(4, bar.high().toPlainString());
                    stmt.setString(5, bar.low().toPlainString());
                    stmt.setString(6, bar.close().toPlainString());
                    stmt.setLong(7, bar.volume());
                    inserted += stmt.executeUpdate();
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            logger.atInfo()
                .addKeyValue("instrument", instrument)
                .addKeyValue("received", bars.size())
                .addKeyValue("inserted", inserted)
                .log("Bars stored");
            return inserted;
        } catch (SQLException e) {
            logger.error("Failed to store bars for {}", instrument, e);
            throw new StoreException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<Bar> findBars(String instrument, Instant from, Instant to) {
        String sql = """
            SELECT ts, open, high, low, close, volume FROM bars
            WHERE instrument = ? AND ts >= ? AND ts < ?
            ORDER BY ts
            """;

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            stmt.setString(2, from.toString());
            stmt.setString(3, to.toString());
            List<Bar> bars = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    bars.add(new Bar(Instant.parse(rs.getString("ts")),
                        new BigDecimal(rs.getString("open")),
                        new BigDecimal(rs.getString("high")),
                        new BigDecimal(rs.getString("low")),
                        new BigDecimal(rs.getString("close")),
                        rs.getLong("volume")));
                }
            }
            logger.debug("Loaded {} bars for {} in [{}, {})", bars.size(), instrument, from, to);
            return bars;
        } catch (SQLException e) {
            throw new StoreException("Failed to read bars for " + instrument, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public Optional<Instant> latestBarTime(String instrument) {
        String sql = "SELECT MAX(ts) AS latest FROM bars WHERE instrument = ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next() && rs.getString("latest") != null) {
                    return Optional.of(Instant.parse(rs.getString("latest")));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read latest bar for " + instrument, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    // ========== Audit trail ==========

    public void recordFill(String runId, Fill fill) {
        String sql = """
            INSERT INTO fills (run_id, instrument, ts, side, quantity, price, commission, exit_trigger, strategy, reason)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, fill.instrument());
            stmt.setString(3, fill.timestamp().toString());
            stmt.setString(4, fill.direction().side());
            stmt.setLong(5, fill.quantity());
            stmt.setString(6, fill.price().toPlainString());
            stmt.setString(7, fill.commission().toPlainString());
            stmt.setString(8, fill.intent().exit().map(t -> t.tag()).orElse(null));
            stmt.setString(9, fill.intent().signal().strategy());
            stmt.setString(10, fill.intent().signal().reason());
            stmt.executeUpdate();

            logger.atInfo()
                .addKeyValue("instrument", fill.instrument())
                .addKeyValue("side", fill.direction().side())
                .addKeyValue("price", fill.price())
                .addKeyValue("quantity", fill.quantity())
                .log("Fill recorded");
        } catch (SQLException e) {
            logger.error("Failed to record fill for {}", fill.instrument(), e);
            throw new StoreException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void recordSnapshot(String runId, PortfolioSnapshot snapshot) {
        String sql = """
            INSERT INTO portfolio_snapshots (run_id, instrument, ts, cash, position, average_cost, equity, drawdown, realized_pnl)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, snapshot.instrument());
            stmt.setString(3, String.valueOf(snapshot.timestamp()));
            stmt.setString(4, snapshot.cash().toPlainString());
            stmt.setLong(5, snapshot.position());
            stmt.setString(6, snapshot.averageCost().toPlainString());
            stmt.setString(7, snapshot.equity().toPlainString());
            stmt.setString(8, snapshot.drawdown().toPlainString());
            stmt.setString(9, snapshot.realizedPnl().toPlainString());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void recordSignal(String runId, String instrument, Signal signal) {
        String sql = """
            INSERT INTO signals (run_id, instrument, ts, direction, strength, strategy, reason)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, instrument);
            stmt.setString(3, signal.timestamp().toString());
            stmt.setString(4, signal.direction().side());
            stmt.setDouble(5, signal.strength());
            stmt.setString(6, signal.strategy());
            stmt.setString(7, signal.reason());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * @param event veto reason tag or forced exit tag
     */
    public void recordRiskEvent(String runId, String instrument, Instant timestamp, String event, String detail) {
        String sql = """
            INSERT INTO risk_events (run_id, instrument, ts, event, detail)
            VALUES (?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, runId);
            stmt.setString(2, instrument);
            stmt.setString(3, timestamp.toString());
            stmt.setString(4, event);
            stmt.setString(5, detail);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ========== Queries ==========

    public record FillRecord(Instant timestamp, String side, long quantity, BigDecimal price,
                             BigDecimal commission, String exitTrigger) {}

    public List<FillRecord> getFills(String runId) {
        String sql = """
            SELECT ts, side, quantity, price, commission, exit_trigger FROM fills
            WHERE run_id = ? ORDER BY id
            """;

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, runId);
            List<FillRecord> fills = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    fills.add(new FillRecord(Instant.parse(rs.getString("ts")), rs.getString("side"),
                        rs.getLong("quantity"), new BigDecimal(rs.getString("price")),
                        new BigDecimal(rs.getString("commission")), rs.getString("exit_trigger")));
                }
            }
            return fills;
        } catch (SQLException e) {
            throw new StoreException("Failed to read fills for run " + runId, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** Risk events of a run by event tag. */
    public int countRiskEvents(String runId, String event) {
        return count("SELECT COUNT(*) AS count FROM risk_events WHERE run_id = ? AND event = ?", runId, event);
    }

    public int countSignals(String runId) {
        return count("SELECT COUNT(*) AS count FROM signals WHERE run_id = ?", runId);
    }

    public int countSnapshots(String runId) {
        return count("SELECT COUNT(*) AS count FROM portfolio_snapshots WHERE run_id = ?", runId);
    }

    private int count(String sql, String... params) {
        long stamp = lock.readLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt("count") : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + sql, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("Market data store closed");
            }
        } catch (SQLException e) {
            logger.error("Error closing database", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }
}
