package com.codeauditor.core.convert.impl.python;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.convert.MalformedOutputException;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.python.BanditTool;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Bandit's JSON report into security findings.
 *
 * <p>Reads the {@code results} array, one row per element:
 * <pre>{@code
 * {
 *   "results": [{
 *     "filename": "./app/db.py", "line_number": 12, "line_range": [12, 13],
 *     "col_offset": 4, "end_col_offset": 30,
 *     "issue_text": "Possible SQL injection", "issue_severity": "MEDIUM",
 *     "issue_confidence": "LOW", "test_id": "B608", "test_name": "hardcoded_sql_expressions",
 *     "issue_cwe": {"id": 89, "link": "..."}, "code": "...", "more_info": "..."
 *   }]
 * }
 * }</pre>
 * A bare results array is accepted as well.
 */
public class BanditParser extends AbstractFindingParser {

    @Override
    public String getToolId() {
        return BanditTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SECURITY;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) throws MalformedOutputException {
        JsonNode payload = jsonPayload(run);
        JsonNode results = payload.isArray() ? payload : payload.get("results");
        if (results == null || !results.isArray()) {
            throw new MalformedOutputException("missing 'results' array");
        }

        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (JsonNode result : results) {
            String filename = text(result, "filename");
            if (filename == null) {
                skipped++;
                continue;
            }

            Integer line = integer(result, "line_number");
            FindingRow.Builder row = FindingRow.builder(ToolKind.SECURITY)
                .root(root)
                .filePath(relativize(run, filename))
                .line(line)
                .endLine(endLine(result.get("line_range"), line))
                .column(integer(result, "col_offset"))
                .endColumn(integer(result, "end_col_offset"))
                .message(text(result, "issue_text"))
                .ruleId(rule(text(result, "test_id"), text(result, "test_name")))
                .severity(text(result, "issue_severity"))
                .extra("confidence", text(result, "issue_confidence"))
                .extra("code", text(result, "code"))
                .extra("more_info", text(result, "more_info"));

            JsonNode cwe = result.get("issue_cwe");
            if (cwe != null && cwe.isObject()) {
                row.extra("cwe", integer(cwe, "id"));
            }
            rows.add(row.build());
        }

        return new ConversionResult(scan.withSkippedRecords(skipped), rows);
    }

    private static Integer endLine(JsonNode lineRange, Integer line) {
        if (lineRange == null || !lineRange.isArray() || lineRange.isEmpty()) {
            return line;
        }
        Integer max = null;
        for (JsonNode value : lineRange) {
            if (value.isNumber() && (max == null || value.intValue() > max)) {
                max = value.intValue();
            }
        }
        return max != null ? max : line;
    }

    private static String rule(String testId, String testName) {
        if (testId == null) {
            return testName;
        }
        return testName == null ? testId : testId + ":" + testName;
    }
}
