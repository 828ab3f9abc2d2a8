package com.codeauditor.core.store;

import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.PersistOutcome;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one scan row and its findings in a single transaction.
 *
 * <p>Each finding is keyed by {@link DeterministicKeys}; inserting a key that
 * already exists is skipped, so re-persisting an unchanged scan adds a scan row
 * but no findings. Any other failure rolls the whole transaction back, leaving
 * neither the scan row nor any of its findings visible.
 */
public class PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private final AuditDatabase database;
    private final ObjectMapper objectMapper;

    public PersistenceGateway(AuditDatabase database) {
        this(database, new ObjectMapper());
    }

    public PersistenceGateway(AuditDatabase database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
    }

    /**
     * Persists a scan and its findings atomically.
     *
     * @param scan scan metadata
     * @param rows findings produced by the scan
     * @return submitted and newly inserted counts
     * @throws PersistenceException if anything other than a key collision fails
     */
    public PersistOutcome persist(ScanMetadata scan, List<FindingRow> rows) {
        Connection connection = database.connection();
        Map<ToolKind, PreparedStatement> statements = new EnumMap<>(ToolKind.class);
        try {
            connection.setAutoCommit(false);

            long scanId = insertScan(scan);
            int inserted = 0;
            for (FindingRow row : rows) {
                PreparedStatement statement = statements.get(row.kind());
                if (statement == null) {
                    statement = database.prepare(Schema.insertFinding(row.kind()));
                    statements.put(row.kind(), statement);
                }
                bindFinding(statement, scanId, row);
                inserted += statement.executeUpdate();
            }

            connection.commit();
            log.debug("Persisted scan {} for {}: {} submitted, {} new", scanId, scan.toolId(), rows.size(), inserted);
            return new PersistOutcome(scanId, rows.size(), inserted);
        } catch (SQLException | JsonProcessingException e) {
            rollback(connection, e);
            throw new PersistenceException("Failed to persist " + scan.toolId() + " scan: " + e.getMessage(), e);
        } finally {
            closeAll(statements);
            restoreAutoCommit(connection);
        }
    }

    private long insertScan(ScanMetadata scan) throws SQLException, JsonProcessingException {
        try (PreparedStatement statement = database.prepare(Schema.insertScan())) {
            statement.setString(1, scan.toolId());
            statement.setString(2, scan.kind().label());
            statement.setString(3, scan.projectRoot());
            statement.setString(4, scan.scanTimestamp().toString());
            statement.setString(5, objectMapper.writeValueAsString(scan.command()));
            statement.setString(6, scan.workingDirectory());
            statement.setInt(7, scan.exitCode());
            statement.setLong(8, scan.durationMs());
            statement.setString(9, scan.status().name());
            statement.setInt(10, scan.skippedRecords());
            statement.setString(11, scan.failureSummary());
            statement.executeUpdate();
        }
        return lastInsertId();
    }

    private long lastInsertId() throws SQLException {
        try (PreparedStatement statement = database.prepare("SELECT last_insert_rowid()");
             ResultSet rs = statement.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("No id generated for scan row");
            }
            return rs.getLong(1);
        }
    }

    private void bindFinding(PreparedStatement statement, long scanId, FindingRow row)
            throws SQLException, JsonProcessingException {
        statement.setString(1, DeterministicKeys.compute(row));
        statement.setLong(2, scanId);
        statement.setString(3, row.root());
        statement.setString(4, row.filePath());
        setInteger(statement, 5, row.lineNumber());
        setInteger(statement, 6, row.endLineNumber());
        setInteger(statement, 7, row.colOffset());
        setInteger(statement, 8, row.endColOffset());
        statement.setString(9, row.message());
        statement.setString(10, row.ruleId());
        statement.setString(11, row.severity());
        statement.setString(12, row.extra().isEmpty() ? null : objectMapper.writeValueAsString(row.extra()));
    }

    private static void setInteger(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void closeAll(Map<ToolKind, PreparedStatement> statements) {
        for (PreparedStatement statement : statements.values()) {
            try {
                statement.close();
            } catch (SQLException e) {
                log.debug("Failed to close statement: {}", e.getMessage());
            }
        }
    }

    private static void restoreAutoCommit(Connection connection) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }
}
