package com.codeauditor.core.convert;

import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.util.FileUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for parsers providing common functionality.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per parser class)</li>
 *   <li>Parse-failure handling: {@link MalformedOutputException} becomes a note on the scan row</li>
 *   <li>Payload access ({@link #jsonPayload(ToolRunResult)}) falling back to stdout</li>
 *   <li>Type-safe JsonNode getters that return {@code null} for absent values</li>
 *   <li>Path helpers relative to the run's working directory</li>
 * </ul>
 *
 * @see FindingParser
 */
public abstract class AbstractFindingParser implements FindingParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    /**
     * JSON mapper for re-reading stdout when the runner did not parse it.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractFindingParser() {
        this.log = LoggerFactory.getLogger(getClass());
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public final ConversionResult convert(ToolRunResult run) {
        ScanMetadata scan = ScanMetadata.fromRun(run, getKind());
        try {
            ConversionResult result = parse(run, scan);
            log.debug("{}: converted {} rows ({} skipped)",
                getToolId(), result.rows().size(), result.scan().skippedRecords());
            return result;
        } catch (MalformedOutputException e) {
            log.warn("{}: unexpected output shape: {}", getToolId(), e.getMessage());
            return ConversionResult.withoutFindings(scan.withFailure("parse error: " + e.getMessage()));
        }
    }

    /**
     * Parses the run's output.
     *
     * @param run completed tool run
     * @param scan scan row built from the run
     * @return scan row (possibly annotated) and findings
     * @throws MalformedOutputException if the output's top-level shape is unexpected
     */
    protected abstract ConversionResult parse(ToolRunResult run, ScanMetadata scan)
        throws MalformedOutputException;

    // ==================== Payload Access ====================

    /**
     * Returns the run's parsed JSON, parsing stdout if the runner did not.
     *
     * @param run tool run
     * @return JSON payload
     * @throws MalformedOutputException if stdout is empty or not JSON
     */
    protected JsonNode jsonPayload(ToolRunResult run) throws MalformedOutputException {
        if (run.parsedJson() != null) {
            return run.parsedJson();
        }
        String stdout = run.stdout().trim();
        if (stdout.isEmpty()) {
            throw new MalformedOutputException("no JSON output");
        }
        try {
            return objectMapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException("output is not JSON: " + e.getOriginalMessage());
        }
    }

    // ==================== JsonNode Getters ====================

    protected static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    protected static Integer integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.intValue();
    }

    protected static Double number(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.doubleValue();
    }

    protected static Boolean bool(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isBoolean()) {
            return null;
        }
        return value.booleanValue();
    }

    // ==================== Path Helpers ====================

    protected static String relativize(ToolRunResult run, String reportedPath) {
        return FileUtils.relativize(reportedPath, run.workingDirectory());
    }

    protected static String root(ToolRunResult run) {
        return FileUtils.rootLabel(run.workingDirectory());
    }
}
