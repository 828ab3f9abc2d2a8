package com.codeauditor.core.convert.impl.javascript;

import com.codeauditor.core.convert.ParserTestBase;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ToolKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EslintParser}.
 */
class EslintParserTest extends ParserTestBase {

    private final EslintParser parser = new EslintParser();

    @Test
    void convert_eslintJson_emitsOneRowPerMessage() {
        String output = """
            [
              {
                "filePath": "/work/projects/billing-service/web/src/cart.js",
                "messages": [
                  {"ruleId": "no-unused-vars", "severity": 2, "message": "'total' is assigned a value but never used.",
                   "line": 4, "column": 7, "endLine": 4, "endColumn": 12},
                  {"ruleId": "eqeqeq", "severity": 1, "message": "Expected '===' and instead saw '=='.",
                   "line": 9, "column": 13, "endLine": 9, "endColumn": 15,
                   "fix": {"range": [120, 122], "text": "==="}}
                ],
                "errorCount": 1,
                "warningCount": 1
              },
              {
                "filePath": "/work/projects/billing-service/web/src/legacy.js",
                "messages": [
                  {"ruleId": null, "fatal": true, "severity": 2, "message": "Parsing error: Unexpected token )", "line": 2, "column": 5}
                ]
              },
              {"filePath": "/work/projects/billing-service/web/src/clean.js", "messages": []}
            ]
            """;

        ConversionResult result = parser.convert(jsonRun("eslint", 1, output));

        assertThat(result.rows()).hasSize(3);

        FindingRow unused = result.rows().get(0);
        assertThat(unused.kind()).isEqualTo(ToolKind.LINT);
        assertThat(unused.root()).isEqualTo(ROOT);
        assertThat(unused.filePath()).isEqualTo("web/src/cart.js");
        assertThat(unused.lineNumber()).isEqualTo(4);
        assertThat(unused.colOffset()).isEqualTo(7);
        assertThat(unused.endColOffset()).isEqualTo(12);
        assertThat(unused.ruleId()).isEqualTo("no-unused-vars");
        assertThat(unused.severity()).isEqualTo("error");
        assertThat(unused.extra()).isEmpty();

        FindingRow eqeqeq = result.rows().get(1);
        assertThat(eqeqeq.severity()).isEqualTo("warning");
        assertThat(eqeqeq.extra()).containsEntry("fixable", true);

        FindingRow fatal = result.rows().get(2);
        assertThat(fatal.ruleId()).isNull();
        assertThat(fatal.extra()).containsEntry("fatal", true);
        assertThat(fatal.endLineNumber()).isNull();
    }

    @Test
    void convert_objectInsteadOfArray_yieldsParseNote() {
        ConversionResult result = parser.convert(jsonRun("eslint", 2, "{\"message\": \"No ESLint configuration found\"}"));

        assertThat(result.rows()).isEmpty();
        assertThat(result.scan().failureSummary()).contains("expected an array");
    }
}
