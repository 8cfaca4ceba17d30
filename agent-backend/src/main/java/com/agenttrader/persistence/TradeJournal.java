package com.agenttrader.persistence;

import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.TradeSignal;
import com.agenttrader.core.model.Transaction;
import com.agenttrader.core.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite journal of executed transactions and closed-lot feedback.
 * <p>
 * Ledgers are rebuilt from the transaction log at startup and the feedback table is replayed
 * into the decision policy. Writes take the write lock; reads take the read lock, since a JDBC
 * connection cannot be read optimistically.
 */
public final class TradeJournal implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TradeJournal.class);

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public TradeJournal(String dbPath) {
        String dbUrl = "jdbc:sqlite:" + dbPath;
        try {
            connection = DriverManager.getConnection(dbUrl);
            createTables();
            logger.info("Trade journal initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new JournalException("Failed to initialize trade journal at " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String transactionsSql = """
            CREATE TABLE IF NOT EXISTS transactions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                symbol TEXT NOT NULL,
                type TEXT NOT NULL,
                quantity INTEGER NOT NULL,
                price REAL NOT NULL,
                total REAL NOT NULL,
                profit_loss REAL,
                timestamp TEXT NOT NULL
            )
            """;

        String feedbackSql = """
            CREATE TABLE IF NOT EXISTS feedback (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                symbol TEXT NOT NULL,
                trade_type TEXT NOT NULL,
                quantity INTEGER NOT NULL,
                entry_price REAL NOT NULL,
                exit_price REAL,
                profit_loss REAL,
                was_correct INTEGER NOT NULL,
                predicted_change_pct REAL NOT NULL,
                realised_change_pct REAL NOT NULL,
                prediction_error REAL NOT NULL,
                sig_predicted_change_pct REAL,
                sig_confidence REAL,
                sig_rsi REAL,
                sig_macd_percent REAL,
                sig_bb_position REAL,
                sig_risk_tolerance REAL,
                timestamp TEXT NOT NULL
            )
            """;

        String indexSql = """
            CREATE INDEX IF NOT EXISTS idx_transactions_user
            ON transactions(user_id, id)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(transactionsSql);
            stmt.execute(feedbackSql);
            stmt.execute(indexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void recordTransaction(Transaction tx) {
        String sql = """
            INSERT INTO transactions (user_id, symbol, type, quantity, price, total, profit_loss, timestamp)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, tx.userId());
            stmt.setString(2, tx.symbol());
            stmt.setString(3, tx.type().name());
            stmt.setLong(4, tx.quantity());
            stmt.setDouble(5, tx.price());
            stmt.setDouble(6, tx.total());
            setNullable(stmt, 7, tx.profitLoss());
            stmt.setString(8, tx.timestamp().toString());
            stmt.executeUpdate();

            logger.atInfo()
                .addKeyValue("user", tx.userId())
                .addKeyValue("symbol", tx.symbol())
                .addKeyValue("type", tx.type())
                .addKeyValue("quantity", tx.quantity())
                .log("Transaction journaled");
        } catch (SQLException e) {
            logger.error("Failed to journal {} {} for {}", tx.type(), tx.symbol(), tx.userId(), e);
            throw new JournalException("Journal write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /** Insert feedback records in one transaction. */
    public void recordFeedback(List<Feedback> feedback) {
        if (feedback.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO feedback (user_id, symbol, trade_type, quantity, entry_price, exit_price, profit_loss,
                was_correct, predicted_change_pct, realised_change_pct, prediction_error,
                sig_predicted_change_pct, sig_confidence, sig_rsi, sig_macd_percent, sig_bb_position,
                sig_risk_tolerance, timestamp)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try {
            connection.setAutoCommit(false);
            try (var stmt = connection.prepareStatement(sql)) {
                for (Feedback f : feedback) {
                    bindFeedback(stmt, f);
                    stmt.addBatch();
                }
                stmt.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            logger.info("Journaled {} feedback records", feedback.size());
        } catch (SQLException e) {
            logger.error("Failed to journal {} feedback records", feedback.size(), e);
            throw new JournalException("Journal write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /** A user's transactions in execution order. */
    public List<Transaction> transactions(String userId) {
        String sql = """
            SELECT user_id, symbol, type, quantity, price, total, profit_loss, timestamp
            FROM transactions WHERE user_id = ? ORDER BY id
            """;

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            List<Transaction> out = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    out.add(new Transaction(
                        rs.getString("user_id"),
                        rs.getString("symbol"),
                        TransactionType.valueOf(rs.getString("type")),
                        rs.getLong("quantity"),
                        rs.getDouble("price"),
                        rs.getDouble("total"),
                        nullableDouble(rs, "profit_loss"),
                        Instant.parse(rs.getString("timestamp"))));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JournalException("Journal read failed for " + userId, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** Users with at least one journaled transaction, sorted. */
    public List<String> users() {
        String sql = "SELECT DISTINCT user_id FROM transactions ORDER BY user_id";

        long stamp = lock.readLock();
        try (var stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            List<String> out = new ArrayList<>();
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new JournalException("Journal read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** All feedback in insertion order. */
    public List<Feedback> feedback() {
        String sql = "SELECT * FROM feedback ORDER BY id";

        long stamp = lock.readLock();
        try (var stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            List<Feedback> out = new ArrayList<>();
            while (rs.next()) {
                out.add(readFeedback(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new JournalException("Journal read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            connection.close();
            logger.info("Trade journal closed");
        } catch (SQLException e) {
            logger.warn("Failed to close trade journal: {}", e.getMessage());
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private static void bindFeedback(PreparedStatement stmt, Feedback f) throws SQLException {
        stmt.setString(1, f.userId());
        stmt.setString(2, f.symbol());
        stmt.setString(3, f.tradeType().name());
        stmt.setLong(4, f.quantity());
        stmt.setDouble(5, f.entryPrice());
        setNullable(stmt, 6, f.exitPrice());
        setNullable(stmt, 7, f.profitLoss());
        stmt.setInt(8, f.wasCorrect() ? 1 : 0);
        stmt.setDouble(9, f.predictedChangePct());
        stmt.setDouble(10, f.realisedChangePct());
        stmt.setDouble(11, f.predictionError());
        TradeSignal s = f.signal();
        setNullable(stmt, 12, s == null ? null : s.predictedChangePct());
        setNullable(stmt, 13, s == null ? null : s.confidence());
        setNullable(stmt, 14, s == null ? null : s.rsi());
        setNullable(stmt, 15, s == null ? null : s.macdPercent());
        setNullable(stmt, 16, s == null ? null : s.bbPosition());
        setNullable(stmt, 17, s == null ? null : s.riskTolerance());
        stmt.setString(18, f.timestamp().toString());
    }

    private static Feedback readFeedback(ResultSet rs) throws SQLException {
        Double sigChange = nullableDouble(rs, "sig_predicted_change_pct");
        TradeSignal signal = sigChange == null ? null : new TradeSignal(
            sigChange,
            rs.getDouble("sig_confidence"),
            rs.getDouble("sig_rsi"),
            rs.getDouble("sig_macd_percent"),
            rs.getDouble("sig_bb_position"),
            rs.getDouble("sig_risk_tolerance"));
        return new Feedback(
            rs.getString("user_id"),
            rs.getString("symbol"),
            TradeAction.valueOf(rs.getString("trade_type")),
            rs.getLong("quantity"),
            rs.getDouble("entry_price"),
            nullableDouble(rs, "exit_price"),
            nullableDouble(rs, "profit_loss"),
            rs.getInt("was_correct") == 1,
            rs.getDouble("predicted_change_pct"),
            rs.getDouble("realised_change_pct"),
            rs.getDouble("prediction_error"),
            signal,
            Instant.parse(rs.getString("timestamp")));
    }

    private static void setNullable(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
