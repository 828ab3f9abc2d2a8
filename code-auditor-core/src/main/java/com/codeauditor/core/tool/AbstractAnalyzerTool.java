package com.codeauditor.core.tool;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.util.FileUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for analyzers that run a single command.
 *
 * <p>Subclasses supply the default executable name and their arguments; the
 * configured executable override and extra arguments are applied here.
 */
public abstract class AbstractAnalyzerTool implements AnalyzerTool {

    protected final ToolSettings settings;

    protected AbstractAnalyzerTool(ToolSettings settings) {
        this.settings = settings != null ? settings : ToolSettings.empty();
    }

    /**
     * Returns the executable used when no override is configured.
     *
     * @return default executable name
     */
    protected abstract String defaultExecutable();

    /**
     * Returns the tool arguments for a target, excluding the executable.
     *
     * @param target absolute target path
     * @param workingDirectory directory the process runs in
     * @return arguments
     */
    protected abstract List<String> arguments(Path target, Path workingDirectory);

    /**
     * Returns true if the tool writes JSON that should be parsed.
     *
     * @return true for JSON-producing tools
     */
    protected abstract boolean producesJson();

    /**
     * Returns extra environment variables for the child process.
     *
     * @return environment overrides, empty by default
     */
    protected Map<String, String> environment() {
        return Map.of();
    }

    protected String executable() {
        return settings.executableOr(defaultExecutable());
    }

    /**
     * Builds the invocation for a target.
     *
     * @param target file or directory to analyze
     * @return ready-to-launch invocation
     */
    public ToolInvocation buildInvocation(Path target) {
        Path absoluteTarget = target.toAbsolutePath().normalize();
        Path workingDirectory = FileUtils.workingDirectoryFor(absoluteTarget);

        List<String> command = new ArrayList<>();
        command.add(executable());
        command.addAll(arguments(absoluteTarget, workingDirectory));
        command.addAll(settings.extraArgs());
        return new ToolInvocation(command, workingDirectory, producesJson(), null, environment());
    }

    @Override
    public ToolRunResult run(ProcessExecutor executor, Path target, Duration timeout) {
        return executor.execute(getId(), buildInvocation(target), timeout);
    }
}
