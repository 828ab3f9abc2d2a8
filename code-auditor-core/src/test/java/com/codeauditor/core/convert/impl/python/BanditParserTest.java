package com.codeauditor.core.convert.impl.python;

import com.codeauditor.core.convert.ParserTestBase;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ToolKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BanditParser}.
 */
class BanditParserTest extends ParserTestBase {

    private final BanditParser parser = new BanditParser();

    @Test
    void convert_banditReport_mapsEveryResult() {
        // Given: a bandit report with two results
        String report = """
            {
              "errors": [],
              "generated_at": "2024-05-01T10:00:00Z",
              "results": [
                {
                  "code": "12 query = \\"SELECT * FROM users WHERE id = %s\\" % user_id\\n",
                  "col_offset": 12,
                  "end_col_offset": 58,
                  "filename": "/work/projects/billing-service/app/db.py",
                  "issue_confidence": "LOW",
                  "issue_cwe": {"id": 89, "link": "https://cwe.mitre.org/data/definitions/89.html"},
                  "issue_severity": "MEDIUM",
                  "issue_text": "Possible SQL injection vector through string-based query construction.",
                  "line_number": 12,
                  "line_range": [12, 13],
                  "more_info": "https://bandit.readthedocs.io/en/latest/plugins/b608_hardcoded_sql_expressions.html",
                  "test_id": "B608",
                  "test_name": "hardcoded_sql_expressions"
                },
                {
                  "filename": "./app/util.py",
                  "issue_severity": "LOW",
                  "issue_text": "Consider possible security implications associated with pickle module.",
                  "line_number": 3,
                  "test_id": "B403",
                  "test_name": "blacklist"
                }
              ]
            }
            """;

        // When
        ConversionResult result = parser.convert(jsonRun("bandit", 1, report));

        // Then
        assertThat(result.rows()).hasSize(2);
        assertThat(result.scan().hasFailure()).isFalse();
        assertThat(result.scan().kind()).isEqualTo(ToolKind.SECURITY);

        FindingRow sql = result.rows().get(0);
        assertThat(sql.kind()).isEqualTo(ToolKind.SECURITY);
        assertThat(sql.root()).isEqualTo(ROOT);
        assertThat(sql.filePath()).isEqualTo("app/db.py");
        assertThat(sql.lineNumber()).isEqualTo(12);
        assertThat(sql.endLineNumber()).isEqualTo(13);
        assertThat(sql.colOffset()).isEqualTo(12);
        assertThat(sql.endColOffset()).isEqualTo(58);
        assertThat(sql.ruleId()).isEqualTo("B608:hardcoded_sql_expressions");
        assertThat(sql.severity()).isEqualTo("MEDIUM");
        assertThat(sql.message()).startsWith("Possible SQL injection");
        assertThat(sql.extra()).containsEntry("confidence", "LOW").containsEntry("cwe", 89).containsKey("more_info");

        FindingRow pickle = result.rows().get(1);
        assertThat(pickle.filePath()).isEqualTo("app/util.py");
        assertThat(pickle.endLineNumber()).isEqualTo(3);
        assertThat(pickle.colOffset()).isNull();
    }

    @Test
    void convert_missingResultsKey_yieldsNoRowsAndParseNote() {
        ConversionResult result = parser.convert(jsonRun("bandit", 0, "{\"errors\": []}"));

        assertThat(result.rows()).isEmpty();
        assertThat(result.scan().failureSummary()).contains("parse error").contains("results");
    }

    @Test
    void convert_nonJsonOutput_yieldsNoRowsAndParseNote() {
        ConversionResult result = parser.convert(textRun("bandit", 2, "Traceback (most recent call last):"));

        assertThat(result.rows()).isEmpty();
        assertThat(result.scan().failureSummary()).contains("not JSON");
    }

    @Test
    void convert_resultWithoutFilename_isCountedAsSkipped() {
        ConversionResult result = parser.convert(jsonRun("bandit", 1, """
            {"results": [{"issue_text": "orphan"}, {"filename": "a.py", "issue_text": "ok", "line_number": 1}]}
            """));

        assertThat(result.rows()).hasSize(1);
        assertThat(result.scan().skippedRecords()).isEqualTo(1);
    }
}
