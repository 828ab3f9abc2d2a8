package com.codeauditor.core.store;

import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.RunStatus;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;

import java.time.Instant;
import java.util.List;

/**
 * Shared rows and scans for storage tests.
 */
final class StoreFixtures {

    private StoreFixtures() {
    }

    static ScanMetadata scan(String toolId, ToolKind kind) {
        return new ScanMetadata(toolId, kind, "/work/billing-service", Instant.parse("2024-05-01T10:00:00Z"),
            List.of(toolId, "."), "/work/billing-service", 0, 1200, RunStatus.COMPLETED, 0, null);
    }

    static FindingRow securityRow(String file, int line, String message) {
        return FindingRow.builder(ToolKind.SECURITY)
            .root("billing-service")
            .filePath(file)
            .line(line)
            .endLine(line)
            .column(4)
            .message(message)
            .ruleId("B608:hardcoded_sql_expressions")
            .severity("MEDIUM")
            .extra("confidence", "LOW")
            .build();
    }
}
