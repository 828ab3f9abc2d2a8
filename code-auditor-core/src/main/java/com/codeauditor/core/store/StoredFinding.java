package com.codeauditor.core.store;

import com.codeauditor.core.model.ToolKind;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * A finding as read back from its result table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredFinding(
    String id,
    long scanId,
    String tool,
    ToolKind kind,
    String root,
    String filePath,
    Integer lineNumber,
    Integer endLineNumber,
    Integer colOffset,
    Integer endColOffset,
    String message,
    String ruleId,
    String severity,
    Map<String, Object> extra
) {
}
