package com.codeauditor.core.store;

import com.codeauditor.core.model.ToolKind;

import java.util.ArrayList;
import java.util.List;

/**
 * DDL for the audit database: {@code scan_metadata} plus one result table per tool kind.
 *
 * <p>All result tables share one column layout. Finding ids are deterministic
 * SHA-256 keys, never autoincrement counters.
 */
final class Schema {

    static final String SCAN_TABLE = "scan_metadata";

    private static final String CREATE_SCAN_TABLE = """
        CREATE TABLE IF NOT EXISTS scan_metadata (
            id              INTEGER PRIMARY KEY AUTOINCREMENT,
            tool            TEXT    NOT NULL,
            tool_kind       TEXT    NOT NULL,
            project_root    TEXT    NOT NULL,
            scan_timestamp  TEXT    NOT NULL,
            command         TEXT    NOT NULL,
            working_dir     TEXT    NOT NULL,
            exit_code       INTEGER NOT NULL,
            duration_ms     INTEGER NOT NULL,
            status          TEXT    NOT NULL,
            skipped_records INTEGER NOT NULL DEFAULT 0,
            failure_summary TEXT
        )
        """;

    private static final String CREATE_FINDING_TABLE = """
        CREATE TABLE IF NOT EXISTS %1$s (
            id              TEXT    PRIMARY KEY,
            scan_id         INTEGER NOT NULL REFERENCES scan_metadata(id),
            root            TEXT    NOT NULL,
            file_path       TEXT    NOT NULL,
            line_number     INTEGER,
            end_line_number INTEGER,
            col_offset      INTEGER,
            end_col_offset  INTEGER,
            message         TEXT,
            rule_id         TEXT,
            severity        TEXT,
            extra_json      TEXT
        )
        """;

    private static final String CREATE_FINDING_INDEXES = """
        CREATE INDEX IF NOT EXISTS idx_%1$s_scan ON %1$s(scan_id);
        CREATE INDEX IF NOT EXISTS idx_%1$s_root_file ON %1$s(root, file_path)
        """;

    private Schema() {
    }

    /**
     * Returns every DDL statement, in creation order.
     *
     * @return statements without trailing semicolons
     */
    static List<String> statements() {
        List<String> statements = new ArrayList<>();
        statements.add(CREATE_SCAN_TABLE.strip());
        for (ToolKind kind : ToolKind.values()) {
            statements.add(String.format(CREATE_FINDING_TABLE, kind.tableName()).strip());
            for (String index : String.format(CREATE_FINDING_INDEXES, kind.tableName()).split(";")) {
                statements.add(index.strip());
            }
        }
        return statements;
    }

    static String insertScan() {
        return """
            INSERT INTO scan_metadata (tool, tool_kind, project_root, scan_timestamp, command, working_dir,
                                       exit_code, duration_ms, status, skipped_records, failure_summary)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.strip();
    }

    static String insertFinding(ToolKind kind) {
        return ("INSERT INTO " + kind.tableName() + """
             (id, scan_id, root, file_path, line_number, end_line_number, col_offset, end_col_offset,
             message, rule_id, severity, extra_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO NOTHING
            """).strip();
    }
}
