package com.codeauditor.core.convert.impl.javascript;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.convert.MalformedOutputException;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.javascript.EslintTool;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts ESLint's JSON formatter output into lint findings.
 *
 * <p>The payload is an array of per-file results, each with a {@code messages}
 * array. One row is emitted per message; numeric severity 1 maps to
 * {@code warning} and 2 to {@code error}.
 */
public class EslintParser extends AbstractFindingParser {

    @Override
    public String getToolId() {
        return EslintTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.LINT;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) throws MalformedOutputException {
        JsonNode payload = jsonPayload(run);
        if (!payload.isArray()) {
            throw new MalformedOutputException("expected an array of file results");
        }

        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (JsonNode fileResult : payload) {
            String filePath = text(fileResult, "filePath");
            JsonNode messages = fileResult.get("messages");
            if (filePath == null || messages == null || !messages.isArray()) {
                skipped++;
                continue;
            }

            String relativePath = relativize(run, filePath);
            for (JsonNode message : messages) {
                rows.add(FindingRow.builder(ToolKind.LINT)
                    .root(root)
                    .filePath(relativePath)
                    .line(integer(message, "line"))
                    .endLine(integer(message, "endLine"))
                    .column(integer(message, "column"))
                    .endColumn(integer(message, "endColumn"))
                    .message(text(message, "message"))
                    .ruleId(text(message, "ruleId"))
                    .severity(severity(integer(message, "severity")))
                    .extra("fatal", bool(message, "fatal"))
                    .extra("fixable", message.has("fix") ? Boolean.TRUE : null)
                    .build());
            }
        }

        return new ConversionResult(scan.withSkippedRecords(skipped), rows);
    }

    static String severity(Integer level) {
        if (level == null) {
            return null;
        }
        return switch (level) {
            case 2 -> "error";
            case 1 -> "warning";
            default -> "off";
        };
    }
}
