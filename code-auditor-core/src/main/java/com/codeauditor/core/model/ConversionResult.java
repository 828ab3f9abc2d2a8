package com.codeauditor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of converting one tool run: the scan row plus its ordered findings.
 *
 * @param scan scan metadata
 * @param rows findings in the order the tool reported them
 */
public record ConversionResult(ScanMetadata scan, List<FindingRow> rows) {

    public ConversionResult {
        Objects.requireNonNull(scan, "scan must not be null");
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * Creates a result carrying only the scan row.
     *
     * @param scan scan metadata
     * @return result with no findings
     */
    public static ConversionResult withoutFindings(ScanMetadata scan) {
        return new ConversionResult(scan, List.of());
    }
}
