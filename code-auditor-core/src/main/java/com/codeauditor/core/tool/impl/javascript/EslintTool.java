package com.codeauditor.core.tool.impl.javascript;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.AbstractAnalyzerTool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lint wrapper around {@code eslint -f json}.
 *
 * <p>ESLint exits with 1 when lint errors are reported and with 2 on configuration
 * or internal errors. Unresolved-import rules are switched off since the target's
 * dependencies are usually not installed.
 */
public class EslintTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "eslint";

    private static final List<String> SUPPRESSED_RULES = List.of(
        "import/no-unresolved",
        "n/no-missing-import",
        "n/no-missing-require",
        "node/no-missing-import",
        "node/no-missing-require"
    );

    public EslintTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "ESLint";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.LINT;
    }

    @Override
    protected String defaultExecutable() {
        return "eslint";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        List<String> args = new ArrayList<>(List.of(
            "-f", "json",
            "--no-error-on-unmatched-pattern",
            "--report-unused-disable-directives"
        ));
        for (String rule : SUPPRESSED_RULES) {
            args.add("--rule");
            args.add(rule + ":off");
        }
        args.add(target.equals(workingDirectory) ? "." : target.toString());
        return args;
    }

    @Override
    protected boolean producesJson() {
        return true;
    }

    @Override
    public boolean isFailureExit(int exitCode) {
        return exitCode >= 2;
    }
}
