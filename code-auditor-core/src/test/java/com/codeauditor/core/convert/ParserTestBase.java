package com.codeauditor.core.convert;

import com.codeauditor.core.model.ToolRunResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Base class for parser tests: builds completed runs from text-block fixtures.
 *
 * <p>Runs use {@link #WORKING_DIR} as their working directory so that tests can
 * feed absolute tool paths and check the relativized result.
 */
public abstract class ParserTestBase {

    protected static final String WORKING_DIR = "/work/projects/billing-service";
    protected static final String ROOT = "billing-service";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Creates a completed run whose stdout was parsed as JSON by the runner.
     */
    protected ToolRunResult jsonRun(String toolId, int exitCode, String json) {
        try {
            JsonNode parsed = MAPPER.readTree(json);
            return ToolRunResult.completed(toolId, List.of(toolId), WORKING_DIR, exitCode, 100, json, "", parsed);
        } catch (Exception e) {
            throw new IllegalArgumentException("Fixture is not JSON", e);
        }
    }

    /**
     * Creates a completed run with raw stdout and no parsed payload.
     */
    protected ToolRunResult textRun(String toolId, int exitCode, String stdout) {
        return ToolRunResult.completed(toolId, List.of(toolId), WORKING_DIR, exitCode, 100, stdout, "", null);
    }
}
