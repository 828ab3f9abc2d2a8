package com.codeauditor.core.tool.impl.python;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.AbstractAnalyzerTool;

import java.nio.file.Path;
import java.util.List;

/**
 * Type checker wrapper around {@code mypy . --output json}.
 *
 * <p>Output is newline-delimited JSON, one diagnostic per line, so it is left for
 * the converter rather than parsed as a single document. Exit code 1 means type
 * errors were found; 2 means mypy itself failed.
 */
public class MypyTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "mypy";

    public MypyTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "Mypy Type Checker";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.TYPE_CHECK;
    }

    @Override
    protected String defaultExecutable() {
        return "mypy";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        String scope = target.equals(workingDirectory) ? "." : target.toString();
        return List.of(
            scope,
            "--output", "json",
            "--show-column-numbers",
            "--show-error-end",
            "--no-site-packages",
            "--explicit-package-bases",
            "--ignore-missing-imports",
            "--follow-imports", "silent"
        );
    }

    @Override
    protected boolean producesJson() {
        return false;
    }

    @Override
    public boolean isFailureExit(int exitCode) {
        return exitCode > 1;
    }
}
