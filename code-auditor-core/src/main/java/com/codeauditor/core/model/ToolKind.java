package com.codeauditor.core.model;

/**
 * Closed set of analyzer categories.
 *
 * <p>Every finding is tagged with exactly one kind, and each kind is persisted in
 * its own result table.
 */
public enum ToolKind {
    SECURITY("security", "security_findings"),
    TYPE_CHECK("type-check", "type_check_findings"),
    COMPLEXITY("complexity", "complexity_findings"),
    DEAD_CODE("dead-code", "dead_code_findings"),
    LINT("lint", "lint_findings");

    private final String label;
    private final String tableName;

    ToolKind(String label, String tableName) {
        this.label = label;
        this.tableName = tableName;
    }

    /**
     * Returns the kebab-case label used in logs and exports.
     *
     * @return kind label
     */
    public String label() {
        return label;
    }

    /**
     * Returns the result table that stores findings of this kind.
     *
     * @return SQL table name
     */
    public String tableName() {
        return tableName;
    }

    /**
     * Returns true for kinds whose rows are measurements rather than issues.
     *
     * @return true for complexity metrics
     */
    public boolean isMetric() {
        return this == COMPLEXITY;
    }
}
