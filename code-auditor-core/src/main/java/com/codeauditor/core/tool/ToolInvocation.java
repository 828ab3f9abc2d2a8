package com.codeauditor.core.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully built command line ready to be launched.
 *
 * @param command program and arguments
 * @param workingDirectory directory the process starts in
 * @param expectsJson whether the tool's output should be parsed as JSON
 * @param jsonOutputFile file the tool writes its JSON to instead of stdout, or {@code null}
 * @param environment extra environment variables for the child process
 */
public record ToolInvocation(
    List<String> command,
    Path workingDirectory,
    boolean expectsJson,
    Path jsonOutputFile,
    Map<String, String> environment
) {
    public ToolInvocation {
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /**
     * Creates an invocation whose JSON output, if any, is read from stdout.
     */
    public static ToolInvocation of(List<String> command, Path workingDirectory, boolean expectsJson) {
        return new ToolInvocation(command, workingDirectory, expectsJson, null, Map.of());
    }
}
