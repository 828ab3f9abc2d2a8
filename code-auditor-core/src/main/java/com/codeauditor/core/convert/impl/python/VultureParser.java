package com.codeauditor.core.convert.impl.python;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.python.VultureTool;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts vulture's text report into dead-code findings.
 *
 * <p>Expected line format:
 * <pre>{@code
 * app/models.py:42: unused function 'legacy_export' (60% confidence)
 * }</pre>
 * Findings below the minimum confidence are dropped. The rule id is derived
 * from the message prefix, e.g. {@code unused-function}. Lines whose line
 * number or confidence overflows an {@code int} are skipped and counted.
 */
public class VultureParser extends AbstractFindingParser {

    private static final Pattern LINE_PATTERN = Pattern.compile(
        "^(?<file>.+?):(?<line>\\d+):\\s*(?<message>.*?)(?:\\s*\\((?<conf>\\d+)%\\s+confidence\\))?\\s*$");

    private static final Pattern KIND_PATTERN = Pattern.compile("^(?<kind>[A-Za-z _/-]+?)\\s*(?='|$)");

    private final int minConfidence;

    public VultureParser(int minConfidence) {
        this.minConfidence = minConfidence;
    }

    @Override
    public String getToolId() {
        return VultureTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.DEAD_CODE;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) {
        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int belowThreshold = 0;
        int skipped = 0;

        for (String line : run.stdout().split("\\R")) {
            Matcher matcher = LINE_PATTERN.matcher(line.strip());
            if (!matcher.matches()) {
                continue;
            }

            String conf = matcher.group("conf");
            Integer confidence;
            int lineNumber;
            try {
                confidence = conf != null ? Integer.valueOf(conf) : null;
                lineNumber = Integer.parseInt(matcher.group("line"));
            } catch (NumberFormatException e) {
                skipped++;
                continue;
            }
            if (confidence != null && confidence < minConfidence) {
                belowThreshold++;
                continue;
            }

            String message = matcher.group("message").strip();
            rows.add(FindingRow.builder(ToolKind.DEAD_CODE)
                .root(root)
                .filePath(relativize(run, matcher.group("file")))
                .line(lineNumber)
                .endLine(lineNumber)
                .message(message)
                .ruleId(kindOf(message))
                .extra("confidence", confidence)
                .build());
        }

        if (belowThreshold > 0) {
            log.debug("vulture: dropped {} findings below {}% confidence", belowThreshold, minConfidence);
        }
        if (skipped > 0) {
            log.debug("vulture: skipped {} lines with out-of-range numbers", skipped);
        }
        return new ConversionResult(scan.withSkippedRecords(skipped), rows);
    }

    static String kindOf(String message) {
        Matcher matcher = KIND_PATTERN.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group("kind").strip().toLowerCase(Locale.ROOT).replace(' ', '-').replace('/', '-');
    }
}
