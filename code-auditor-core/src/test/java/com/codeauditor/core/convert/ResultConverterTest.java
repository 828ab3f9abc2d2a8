package com.codeauditor.core.convert;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.RunStatus;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.registry.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResultConverter} dispatch and failure notes.
 */
class ResultConverterTest extends ParserTestBase {

    private final ResultConverter converter = new ResultConverter(ToolRegistry.defaults(AuditorConfig.defaults()));

    @Test
    void convert_dispatchesToRegisteredParser() {
        ConversionResult result = converter.convert("eslint", jsonRun("eslint", 1, """
            [{"filePath": "a.js", "messages": [{"ruleId": "semi", "severity": 2, "message": "Missing semicolon.", "line": 1, "column": 9}]}]
            """));

        assertThat(result.scan().toolId()).isEqualTo("eslint");
        assertThat(result.scan().kind()).isEqualTo(ToolKind.LINT);
        assertThat(result.rows()).hasSize(1);
        assertThat(result.scan().hasFailure()).isFalse();
    }

    @Test
    void convert_failureExitCode_keepsRowsAndNotesExit() {
        ToolRunResult run = ToolRunResult.completed("bandit", List.of("bandit"), WORKING_DIR, 2, 50,
            "{\"results\": []}", "ERROR: unrecognized arguments: --bogus\nusage: bandit ...", null);

        ConversionResult result = converter.convert("bandit", run);

        assertThat(result.rows()).isEmpty();
        assertThat(result.scan().failureSummary()).isEqualTo("exit 2: ERROR: unrecognized arguments: --bogus");
    }

    @Test
    void convert_timedOutRun_bypassesParser() {
        ToolRunResult run = ToolRunResult.timedOut("mypy", List.of("mypy", "."), WORKING_DIR, 300_000, "", "");

        ConversionResult result = converter.convert("mypy", run);

        assertThat(result.rows()).isEmpty();
        assertThat(result.scan().status()).isEqualTo(RunStatus.TIMED_OUT);
        assertThat(result.scan().exitCode()).isEqualTo(ToolRunResult.TIMED_OUT_EXIT_CODE);
        assertThat(result.scan().failureSummary()).isEqualTo("timed out after 300000 ms");
    }

    @Test
    void convert_launchFailedRun_recordsOsError() {
        ToolRunResult run = ToolRunResult.launchFailed("vulture", List.of("vulture", "."), WORKING_DIR, 3,
            "Cannot run program \"vulture\": error=2, No such file or directory");

        ConversionResult result = converter.convert("vulture", run);

        assertThat(result.scan().kind()).isEqualTo(ToolKind.DEAD_CODE);
        assertThat(result.scan().failureSummary()).startsWith("launch failed: Cannot run program");
    }

    @Test
    void convert_unknownTool_throwsConfigurationException() {
        assertThatThrownBy(() -> converter.convert("semgrep", textRun("semgrep", 0, "")))
            .isInstanceOf(ConfigurationException.class);
    }
}
