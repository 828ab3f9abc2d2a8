package com.codeauditor.core.tool.impl.python;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.AbstractAnalyzerTool;

import java.nio.file.Path;
import java.util.List;

/**
 * Security scanner wrapper around {@code bandit -r <target> --format json}.
 *
 * <p>Bandit exits with 1 when it reports issues, so only codes above 1 are failures.
 */
public class BanditTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "bandit";

    private static final String EXCLUDES = String.join(",",
        ".git", ".hg", ".mypy_cache", ".ruff_cache", ".venv", "venv",
        "build", "dist", "site-packages", "__pycache__");

    public BanditTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "Bandit Security Scanner";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SECURITY;
    }

    @Override
    protected String defaultExecutable() {
        return "bandit";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        return List.of("-r", target.toString(), "--format", "json", "--exclude", EXCLUDES, "-q");
    }

    @Override
    protected boolean producesJson() {
        return true;
    }

    @Override
    public boolean isFailureExit(int exitCode) {
        return exitCode > 1;
    }
}
