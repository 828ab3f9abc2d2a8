package com.codeauditor.core.audit;

import java.util.List;

/**
 * Per-tool outcomes of an audit plus issue totals.
 *
 * @param outcomes outcomes in completion order, grouped by project
 * @param stopped whether stop-on-error cancelled any remaining work
 * @param countMetricsAsIssues whether complexity rows count toward {@link #issueTotal()}
 */
public record AuditSummary(List<ToolOutcome> outcomes, boolean stopped, boolean countMetricsAsIssues) {

    public AuditSummary {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Returns the number of findings submitted by all tools that count as issues.
     *
     * @return issue total
     */
    public int issueTotal() {
        return outcomes.stream()
            .filter(o -> countMetricsAsIssues || !o.kind().isMetric())
            .mapToInt(ToolOutcome::submitted)
            .sum();
    }

    public int newlyPersistedTotal() {
        return outcomes.stream().mapToInt(ToolOutcome::newlyPersisted).sum();
    }

    public List<ToolOutcome> failures() {
        return outcomes.stream().filter(ToolOutcome::failed).toList();
    }

    public List<ToolOutcome> cancelled() {
        return outcomes.stream().filter(o -> o.state() == InvocationState.CANCELLED).toList();
    }
}
