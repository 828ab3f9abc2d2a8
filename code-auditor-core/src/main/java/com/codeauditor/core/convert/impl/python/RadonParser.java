package com.codeauditor.core.convert.impl.python;

import com.codeauditor.core.convert.AbstractFindingParser;
import com.codeauditor.core.convert.MalformedOutputException;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.tool.impl.python.RadonTool;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts the combined radon bundle into complexity metric rows.
 *
 * <p>Produces one row per file per category; the category is the rule id:
 * <ul>
 *   <li>{@code cc}: block list aggregated into count, total, max, average and worst rank</li>
 *   <li>{@code mi}: maintainability index and rank</li>
 *   <li>{@code hal}: the file's {@code total} Halstead section</li>
 *   <li>{@code raw}: line counts</li>
 * </ul>
 * Files radon reports with an {@code error} entry are counted as skipped. A
 * missing or non-object category is noted on the scan row as a parse error while
 * the categories that are present still produce rows.
 */
public class RadonParser extends AbstractFindingParser {

    private static final String RANKS = "ABCDEF";

    private static final List<String> HALSTEAD_FIELDS = List.of("volume", "difficulty", "effort", "time", "bugs");

    private static final List<String> RAW_FIELDS = List.of(
        "loc", "sloc", "lloc", "comments", "multi", "blank", "single_comments");

    @Override
    public String getToolId() {
        return RadonTool.TOOL_ID;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.COMPLEXITY;
    }

    @Override
    protected ConversionResult parse(ToolRunResult run, ScanMetadata scan) throws MalformedOutputException {
        JsonNode bundle = jsonPayload(run);
        if (!bundle.isObject()) {
            throw new MalformedOutputException("radon bundle is not an object");
        }

        for (String category : RadonTool.CATEGORIES) {
            JsonNode section = bundle.get(category);
            if (section == null || !section.isObject()) {
                log.warn("radon: {} section missing or not an object", category);
                scan = scan.withFailure("parse error: radon " + category + " output is not JSON");
            }
        }

        String root = root(run);
        List<FindingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (Map.Entry<String, JsonNode> file : entries(bundle.get("cc"))) {
            if (!file.getValue().isArray()) {
                skipped++;
                continue;
            }
            rows.add(complexityRow(root, relativize(run, file.getKey()), file.getValue()));
        }

        for (Map.Entry<String, JsonNode> file : entries(bundle.get("mi"))) {
            Double mi = number(file.getValue(), "mi");
            if (mi == null) {
                skipped++;
                continue;
            }
            String rank = text(file.getValue(), "rank");
            rows.add(metric(root, relativize(run, file.getKey()), "mi")
                .message(String.format(Locale.ROOT, "maintainability index %.2f", mi))
                .severity(rank)
                .extra("mi", mi)
                .extra("mi_rank", rank)
                .build());
        }

        for (Map.Entry<String, JsonNode> file : entries(bundle.get("hal"))) {
            JsonNode total = file.getValue().get("total");
            if (total == null || !total.isObject()) {
                skipped++;
                continue;
            }
            FindingRow.Builder row = metric(root, relativize(run, file.getKey()), "hal");
            for (String field : HALSTEAD_FIELDS) {
                row.extra("halstead_" + field, number(total, field));
            }
            Double volume = number(total, "volume");
            rows.add(row.message(String.format(Locale.ROOT, "halstead volume %.2f", volume != null ? volume : 0.0)).build());
        }

        for (Map.Entry<String, JsonNode> file : entries(bundle.get("raw"))) {
            Integer loc = integer(file.getValue(), "loc");
            if (loc == null) {
                skipped++;
                continue;
            }
            FindingRow.Builder row = metric(root, relativize(run, file.getKey()), "raw");
            for (String field : RAW_FIELDS) {
                row.extra(field, integer(file.getValue(), field));
            }
            rows.add(row.message(loc + " lines").build());
        }

        return new ConversionResult(scan.withSkippedRecords(skipped), rows);
    }

    private static FindingRow complexityRow(String root, String filePath, JsonNode blocks) {
        double total = 0;
        double max = 0;
        String worst = "A";
        Map<String, Integer> rankCounts = new TreeMap<>();

        for (JsonNode block : blocks) {
            double complexity = block.path("complexity").asDouble(0);
            String rank = block.path("rank").asText("A");
            total += complexity;
            max = Math.max(max, complexity);
            rankCounts.merge(rank, 1, Integer::sum);
            worst = worseRank(worst, rank);
        }

        int count = blocks.size();
        double avg = total / Math.max(count, 1);
        return metric(root, filePath, "cc")
            .message(String.format(Locale.ROOT, "%d blocks, worst rank %s", count, worst))
            .severity(worst)
            .extra("cc_blocks", count)
            .extra("cc_total", total)
            .extra("cc_max", max)
            .extra("cc_avg", avg)
            .extra("cc_worst_rank", worst)
            .extra("cc_rank_counts", new LinkedHashMap<>(rankCounts))
            .build();
    }

    static String worseRank(String a, String b) {
        return RANKS.indexOf(b) > RANKS.indexOf(a) ? b : a;
    }

    private static FindingRow.Builder metric(String root, String filePath, String category) {
        return FindingRow.builder(ToolKind.COMPLEXITY)
            .root(root)
            .filePath(filePath)
            .ruleId(category);
    }

    private static List<Map.Entry<String, JsonNode>> entries(JsonNode category) {
        List<Map.Entry<String, JsonNode>> result = new ArrayList<>();
        if (category == null || !category.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = category.fields();
        while (fields.hasNext()) {
            result.add(fields.next());
        }
        return result;
    }
}
