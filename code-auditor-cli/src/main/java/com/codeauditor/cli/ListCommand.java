package com.codeauditor.cli;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.registry.ToolBinding;
import com.codeauditor.core.registry.ToolRegistry;
import com.codeauditor.core.tool.AnalyzerTool;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to list the registered analyzers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-auditor list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available analyzers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: auditor.yaml)"
    )
    private Path configPath = Paths.get(CommandSupport.DEFAULT_CONFIG);

    @Override
    public Integer call() {
        AuditorConfig config = CommandSupport.loadConfiguration(configPath, log);
        ToolRegistry registry = ToolRegistry.defaults(config);

        System.out.println("Available Tools:");
        System.out.println();

        for (ToolBinding binding : registry.bindings()) {
            AnalyzerTool tool = binding.tool();
            System.out.printf("  • %s (ID: %s)%n", tool.getDisplayName(), tool.getId());
            System.out.printf("    Kind: %s%n", tool.getKind().label());
            String override = config.toolSettings(tool.getId()).executable();
            if (override != null && !override.isBlank()) {
                System.out.printf("    Executable: %s%n", override);
            }
            System.out.println();
        }
        return 0;
    }
}
