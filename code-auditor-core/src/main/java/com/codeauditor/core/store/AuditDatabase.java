package com.codeauditor.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Explicit handle on the SQLite audit database, scoped to one command invocation.
 *
 * <p>Opens a single JDBC connection with foreign keys enforced and WAL journaling.
 * The handle is not thread-safe; callers use it from one thread only. When echo
 * is enabled every statement is logged at INFO on the {@code com.codeauditor.sql} logger.
 */
public class AuditDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditDatabase.class);
    private static final Logger sqlLog = LoggerFactory.getLogger("com.codeauditor.sql");

    private final Path path;
    private final Connection connection;
    private final boolean echo;

    private AuditDatabase(Path path, Connection connection, boolean echo) {
        this.path = path;
        this.connection = connection;
        this.echo = echo;
    }

    /**
     * Opens (creating if needed) the database file.
     *
     * @param path SQLite file location; parent directories are created
     * @param echo log every SQL statement
     * @return open database handle
     * @throws PersistenceException if the file cannot be created or opened
     */
    public static AuditDatabase open(Path path, boolean echo) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot create database directory for " + absolute, e);
        }

        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + absolute);
            AuditDatabase database = new AuditDatabase(absolute, connection, echo);
            database.execute("PRAGMA foreign_keys=ON");
            database.execute("PRAGMA journal_mode=WAL");
            database.execute("PRAGMA busy_timeout=5000");
            log.debug("Opened database {}", absolute);
            return database;
        } catch (SQLException e) {
            throw new PersistenceException("Cannot open database " + absolute, e);
        }
    }

    /**
     * Creates the scan table and every result table if they do not exist.
     *
     * @throws PersistenceException if a DDL statement fails
     */
    public void initializeSchema() {
        try {
            for (String statement : Schema.statements()) {
                execute(statement);
            }
            log.info("Schema ready at {}", path);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize schema at " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    Connection connection() {
        return connection;
    }

    PreparedStatement prepare(String sql) throws SQLException {
        echo(sql);
        return connection.prepareStatement(sql);
    }

    void execute(String sql) throws SQLException {
        echo(sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private void echo(String sql) {
        if (echo) {
            sqlLog.info("{}", sql);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close database {}: {}", path, e.getMessage());
        }
    }
}
