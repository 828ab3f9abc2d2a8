package com.codeauditor.core.tool.impl.python;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.AbstractAnalyzerTool;

import java.nio.file.Path;
import java.util.List;

/**
 * Dead-code detector wrapper around {@code vulture}.
 *
 * <p>Vulture prints plain text and exits with 3 when it found dead code; 1 and 2
 * mean invalid input or arguments. Confidence filtering happens in the converter so
 * the threshold stays configurable without rerunning the tool.
 */
public class VultureTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "vulture";

    private static final String EXCLUDES = String.join(",",
        "*/.venv/*", "*/venv/*", "*/.git/*", "*/.hg/*", "*/.svn/*", "*/.tox/*",
        "*/.mypy_cache/*", "*/__pycache__/*", "*/node_modules/*", "*/build/*", "*/dist/*");

    public VultureTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "Vulture Dead Code Detector";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.DEAD_CODE;
    }

    @Override
    protected String defaultExecutable() {
        return "vulture";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        String scope = target.equals(workingDirectory) ? "." : target.toString();
        return List.of("--exclude", EXCLUDES, scope);
    }

    @Override
    protected boolean producesJson() {
        return false;
    }

    @Override
    public boolean isFailureExit(int exitCode) {
        return exitCode == 1 || exitCode == 2;
    }
}
