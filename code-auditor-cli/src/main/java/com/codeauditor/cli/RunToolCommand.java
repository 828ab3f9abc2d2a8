package com.codeauditor.cli;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.registry.ToolRegistry;
import com.codeauditor.core.tool.ProcessExecutor;
import com.codeauditor.core.tool.ToolRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command to run a single analyzer and emit its raw result as JSON.
 *
 * <p>Nothing is persisted. The analyzer's own exit code is part of the output;
 * the command itself only fails on invalid input.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-auditor run-tool bandit ./my-service
 * code-auditor run-tool eslint ./web --json-out eslint-run.json --timeout 60
 * }</pre>
 */
@Command(
    name = "run-tool",
    description = "Run one analyzer and print its result as JSON",
    mixinStandardHelpOptions = true
)
public class RunToolCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunToolCommand.class);

    @Parameters(index = "0", description = "Tool identifier (see 'list')")
    private String toolId;

    @Parameters(index = "1", description = "File or directory to analyze", defaultValue = ".")
    private Path target;

    @Option(names = {"--json-out"}, description = "Write the result to this file instead of stdout")
    private Path jsonOut;

    @Option(names = {"--timeout"}, description = "Timeout in seconds (default: from configuration)")
    private Integer timeoutSeconds;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: auditor.yaml)"
    )
    private Path configPath = Paths.get(CommandSupport.DEFAULT_CONFIG);

    @Override
    public Integer call() {
        AuditorConfig config = CommandSupport.loadConfiguration(configPath, log);
        try {
            ToolRegistry registry = ToolRegistry.defaults(config);
            registry.binding(toolId);
            if (!Files.exists(target)) {
                throw new ConfigurationException("Target does not exist: " + target.toAbsolutePath());
            }

            Duration timeout = timeoutSeconds != null && timeoutSeconds > 0
                ? Duration.ofSeconds(timeoutSeconds)
                : config.audit().effectiveTimeout();

            ToolRunResult result = new ToolRunner(registry, new ProcessExecutor()).run(toolId, target, timeout);
            writeResult(result);
            return 0;
        } catch (ConfigurationException e) {
            return CommandSupport.fail(log, "run-tool", e);
        } catch (IOException e) {
            return CommandSupport.fail(log, "Writing result", e);
        }
    }

    private void writeResult(ToolRunResult result) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        if (jsonOut == null) {
            System.out.println(mapper.writeValueAsString(result));
            return;
        }
        Path parent = jsonOut.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(jsonOut.toFile(), result);
        System.out.println("✓ " + result.toolId() + " " + result.status()
            + " (exit " + result.exitCode() + ", " + result.durationMs() + " ms) -> " + jsonOut);
    }
}
