package com.codeauditor.core.store;

import com.codeauditor.core.model.ToolKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-side queries over the audit database.
 */
public class FindingQueries {

    private static final TypeReference<Map<String, Object>> EXTRA_TYPE = new TypeReference<>() {
    };

    private final AuditDatabase database;
    private final ObjectMapper objectMapper;

    public FindingQueries(AuditDatabase database) {
        this.database = database;
        this.objectMapper = new ObjectMapper();
    }

    public long countScans() {
        return count("SELECT COUNT(*) FROM " + Schema.SCAN_TABLE);
    }

    public long countFindings(ToolKind kind) {
        return count("SELECT COUNT(*) FROM " + kind.tableName());
    }

    /**
     * Returns the distinct project roots that have at least one finding, sorted.
     *
     * @return root labels
     */
    public List<String> roots() {
        TreeSet<String> roots = new TreeSet<>();
        for (ToolKind kind : ToolKind.values()) {
            String sql = "SELECT DISTINCT root FROM " + kind.tableName();
            try (PreparedStatement statement = database.prepare(sql);
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    roots.add(rs.getString(1));
                }
            } catch (SQLException e) {
                throw new PersistenceException("Failed to list roots: " + e.getMessage(), e);
            }
        }
        return new ArrayList<>(roots);
    }

    /**
     * Returns stored findings of one kind, ordered by file and line.
     *
     * @param kind tool kind
     * @param root root label to filter on, or {@code null} for all roots
     * @return findings
     */
    public List<StoredFinding> findings(ToolKind kind, String root) {
        String sql = """
            SELECT f.id, f.scan_id, s.tool, f.root, f.file_path, f.line_number, f.end_line_number,
                   f.col_offset, f.end_col_offset, f.message, f.rule_id, f.severity, f.extra_json
            FROM %s f JOIN scan_metadata s ON s.id = f.scan_id
            %s
            ORDER BY f.root, f.file_path, f.line_number, f.id
            """.formatted(kind.tableName(), root == null ? "" : "WHERE f.root = ?");

        List<StoredFinding> findings = new ArrayList<>();
        try (PreparedStatement statement = database.prepare(sql)) {
            if (root != null) {
                statement.setString(1, root);
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    findings.add(new StoredFinding(
                        rs.getString("id"),
                        rs.getLong("scan_id"),
                        rs.getString("tool"),
                        kind,
                        rs.getString("root"),
                        rs.getString("file_path"),
                        nullableInt(rs, "line_number"),
                        nullableInt(rs, "end_line_number"),
                        nullableInt(rs, "col_offset"),
                        nullableInt(rs, "end_col_offset"),
                        rs.getString("message"),
                        rs.getString("rule_id"),
                        rs.getString("severity"),
                        readExtra(rs.getString("extra_json"))
                    ));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read " + kind.tableName() + ": " + e.getMessage(), e);
        }
        return findings;
    }

    private long count(String sql) {
        try (PreparedStatement statement = database.prepare(sql);
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new PersistenceException("Query failed: " + e.getMessage(), e);
        }
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Map<String, Object> readExtra(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, EXTRA_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt extra_json: " + e.getOriginalMessage(), e);
        }
    }
}
