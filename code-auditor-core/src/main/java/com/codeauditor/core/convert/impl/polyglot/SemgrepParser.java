package com.codeauditor.core.convert.impl.polyglot;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.convert.MalformedOutputException;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.polyglot.SemgrepTool;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts semgrep's JSON report into security findings.
 *
 * <p>One row per element of {@code results}; the rule id is the {@code check_id}.
 * Entries of the top-level {@code errors} array are noted on the scan row.
 */
public class SemgrepParser extends AbstractFindingParser {

    private static final List<String> METADATA_FIELDS = List.of(
        "category", "subcategory", "confidence", "likelihood", "impact", "shortlink");

    private static final List<String> METADATA_LISTS = List.of("cwe", "owasp", "technology");

    @Override
    public String getToolId() {
        return SemgrepTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SECURITY;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) throws MalformedOutputException {
        JsonNode payload = jsonPayload(run);
        JsonNode results = payload.get("results");
        if (results == null || !results.isArray()) {
            throw new MalformedOutputException("missing 'results' array");
        }

        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (JsonNode result : results) {
            String path = text(result, "path");
            if (path == null) {
                skipped++;
                continue;
            }
            JsonNode start = result.path("start");
            JsonNode end = result.path("end");
            JsonNode extra = result.path("extra");
            JsonNode metadata = extra.path("metadata");

            FindingRow.Builder row = FindingRow.builder(ToolKind.SECURITY)
                .root(root)
                .filePath(relativize(run, path))
                .line(integer(start, "line"))
                .endLine(integer(end, "line"))
                .column(integer(start, "col"))
                .endColumn(integer(end, "col"))
                .message(text(extra, "message"))
                .ruleId(text(result, "check_id"))
                .severity(text(extra, "severity"))
                .extra("fingerprint", text(extra, "fingerprint"))
                .extra("fix", text(extra, "fix"))
                .extra("engine_kind", text(extra, "engine_kind"));
            for (String field : METADATA_FIELDS) {
                row.extra(field, text(metadata, field));
            }
            for (String field : METADATA_LISTS) {
                row.extra(field, strings(metadata.get(field)));
            }
            rows.add(row.build());
        }

        ScanMetadata annotated = scan.withSkippedRecords(skipped);
        JsonNode errors = payload.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            String first = text(errors.get(0), "message");
            log.warn("semgrep reported {} errors", errors.size());
            annotated = annotated.withFailure("semgrep reported " + errors.size() + " errors"
                + (first != null ? ": " + first.strip().lines().findFirst().orElse("") : ""));
        }
        return new ConversionResult(annotated, rows);
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(value -> values.add(value.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }
}
