package com.codeauditor.core.tool.impl.polyglot;

import com.codeauditor.core.config.AuditorConfig.ToolSettings;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.AbstractAnalyzerTool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pattern-based security scanner wrapper around {@code semgrep scan --json}.
 *
 * <p>Rules come from the public registry packs below. With {@code --error} semgrep
 * exits with 1 when it reports findings; codes above 1 are fatal errors.
 */
public class SemgrepTool extends AbstractAnalyzerTool {

    public static final String TOOL_ID = "semgrep";

    static final List<String> RULE_PACKS = List.of(
        "p/python",
        "p/javascript",
        "p/typescript",
        "p/react",
        "p/owasp-top-ten",
        "p/secrets"
    );

    private static final List<String> EXCLUDES = List.of(
        "node_modules", ".next", "dist", "build", "coverage",
        ".git", ".cache", ".turbo", ".venv", "__pycache__"
    );

    private static final int RULE_TIMEOUT_SECONDS = 30;

    public SemgrepTool(ToolSettings settings) {
        super(settings);
    }

    @Override
    public String getId() {
        return TOOL_ID;
    }

    @Override
    public String getDisplayName() {
        return "Semgrep";
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SECURITY;
    }

    @Override
    protected String defaultExecutable() {
        return "semgrep";
    }

    @Override
    protected List<String> arguments(Path target, Path workingDirectory) {
        List<String> args = new ArrayList<>(List.of(
            "scan",
            "--json",
            "--metrics", "off",
            "--timeout", String.valueOf(RULE_TIMEOUT_SECONDS),
            "--error"
        ));
        for (String exclude : EXCLUDES) {
            args.add("--exclude");
            args.add(exclude);
        }
        for (String pack : RULE_PACKS) {
            args.add("--config");
            args.add(pack);
        }
        args.add(target.equals(workingDirectory) ? "." : target.toString());
        return args;
    }

    @Override
    protected Map<String, String> environment() {
        return Map.of(
            "SEMGREP_SEND_METRICS", "0",
            "SEMGREP_ENABLE_VERSION_CHECK", "0"
        );
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
