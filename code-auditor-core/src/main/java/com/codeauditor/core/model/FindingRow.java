package com.codeauditor.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized issue or metric reported by an analyzer.
 *
 * <p>Location fields are nullable: project-level and per-file metrics have no line.
 * Tool-specific values that have no dedicated column (confidence, complexity
 * aggregates, CWE ids) travel in {@code extra} and are stored as JSON.
 *
 * @param kind tool kind, selects the result table
 * @param root project root label (the analyzed directory's name)
 * @param filePath project-relative file path
 * @param lineNumber first line, or {@code null}
 * @param endLineNumber last line, or {@code null}
 * @param colOffset first column, or {@code null}
 * @param endColOffset last column, or {@code null}
 * @param message finding message
 * @param ruleId tool-specific rule or category identifier
 * @param severity tool-reported severity, or {@code null}
 * @param extra tool-specific fields
 */
public record FindingRow(
    ToolKind kind,
    String root,
    String filePath,
    Integer lineNumber,
    Integer endLineNumber,
    Integer colOffset,
    Integer endColOffset,
    String message,
    String ruleId,
    String severity,
    Map<String, Object> extra
) {
    public FindingRow {
        Objects.requireNonNull(kind, "kind must not be null");
        if (root == null) {
            root = "";
        }
        extra = extra == null || extra.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Starts a builder for a row of the given kind.
     *
     * @param kind tool kind
     * @return new builder
     */
    public static Builder builder(ToolKind kind) {
        return new Builder(kind);
    }

    /**
     * Fluent builder, since most parsers only fill a subset of the columns.
     */
    public static final class Builder {
        private final ToolKind kind;
        private String root;
        private String filePath;
        private Integer lineNumber;
        private Integer endLineNumber;
        private Integer colOffset;
        private Integer endColOffset;
        private String message;
        private String ruleId;
        private String severity;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder(ToolKind kind) {
            this.kind = kind;
        }

        public Builder root(String root) {
            this.root = root;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder line(Integer lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder endLine(Integer endLineNumber) {
            this.endLineNumber = endLineNumber;
            return this;
        }

        public Builder column(Integer colOffset) {
            this.colOffset = colOffset;
            return this;
        }

        public Builder endColumn(Integer endColOffset) {
            this.endColOffset = endColOffset;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        /**
         * Adds a tool-specific field; {@code null} values are dropped.
         */
        public Builder extra(String key, Object value) {
            if (value != null) {
                this.extra.put(key, value);
            }
            return this;
        }

        public FindingRow build() {
            return new FindingRow(kind, root, filePath, lineNumber, endLineNumber, colOffset,
                endColOffset, message, ruleId, severity, extra);
        }
    }
}
