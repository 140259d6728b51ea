package com.entity.datamining.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection backing the entity store.
 *
 * <p>All access goes through {@link #execute} or {@link #executeInTransaction}, which serialize on
 * one lock. The request thread and the background enrichment worker therefore never interleave
 * statements, and a transaction is never observed half-applied.</p>
 */
public class SqliteConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final File dbFile;
    private final Object lock = new Object();
    private Connection connection;

    public SqliteConnection(Path dbPath) {
        this.dbFile = dbPath.toFile();
    }

    public File getDbFile() {
        return dbFile;
    }

    private Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = createConnection();
        }
        return connection;
    }

    private Connection createConnection() throws SQLException {
        File parentDir = dbFile.getAbsoluteFile().getParentFile();
        if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
            log.warn("Could not create database directory {}", parentDir);
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA foreign_keys=ON");
        }
        log.debug("Created SQLite connection at {}", dbFile.getAbsolutePath());
        return conn;
    }

    /**
     * Runs a function against the connection in auto-commit mode.
     */
    public <T> T execute(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            return function.apply(getConnection());
        }
    }

    /**
     * Runs a function within a transaction.
     * Commits on success, rolls back on any failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            Connection conn = getConnection();
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbFile.getAbsolutePath());
                } catch (SQLException e) {
                    log.warn("Error closing connection: {}", e.getMessage());
                }
                connection = null;
            }
        }
    }

    /**
     * Function over a live connection.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }
}
