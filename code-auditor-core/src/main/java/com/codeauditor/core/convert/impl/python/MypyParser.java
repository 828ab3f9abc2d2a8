package com.codeauditor.core.convert.impl.python;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.python.MypyTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts mypy's newline-delimited JSON into type-check findings.
 *
 * <p>Each non-blank stdout line is parsed on its own. Lines that are not JSON
 * objects with {@code file}, {@code line} and {@code message} are counted as
 * skipped; mypy mixes plain-text notes into its output.
 */
public class MypyParser extends AbstractFindingParser {

    @Override
    public String getToolId() {
        return MypyTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.TYPE_CHECK;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) {
        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (String line : run.stdout().split("\\R")) {
            String text = line.strip();
            if (text.isEmpty()) {
                continue;
            }

            JsonNode item = readLine(text);
            if (item == null || !item.isObject()
                || text(item, "file") == null || integer(item, "line") == null || text(item, "message") == null) {
                skipped++;
                continue;
            }

            Integer lineNumber = integer(item, "line");
            rows.add(FindingRow.builder(ToolKind.TYPE_CHECK)
                .root(root)
                .filePath(relativize(run, text(item, "file")))
                .line(lineNumber)
                .endLine(lineNumber)
                .column(integer(item, "column"))
                .message(text(item, "message"))
                .ruleId(text(item, "code"))
                .severity(text(item, "severity"))
                .extra("hint", text(item, "hint"))
                .build());
        }

        if (skipped > 0) {
            log.debug("mypy: skipped {} non-diagnostic lines", skipped);
        }
        return new ConversionResult(scan.withSkippedRecords(skipped), rows);
    }

    private JsonNode readLine(String text) {
        if (!text.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
