package com.codeauditor.core.convert;

import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;

/**
 * Normalizes one tool's raw output into a scan row and finding rows.
 *
 * <p>Implementations never throw on malformed tool output. An unexpected shape
 * yields zero rows and a parse note on the scan row.
 *
 * @see ResultConverter
 */
public interface FindingParser {

    /**
     * Returns the identifier of the tool whose output this parser understands.
     *
     * @return tool identifier
     */
    String getToolId();

    /**
     * Returns the kind of rows this parser produces.
     *
     * @return tool kind
     */
    ToolKind getKind();

    /**
     * Converts a completed run.
     *
     * @param run completed tool run
     * @return scan row and findings
     */
    ConversionResult convert(ToolRunResult run);
}
