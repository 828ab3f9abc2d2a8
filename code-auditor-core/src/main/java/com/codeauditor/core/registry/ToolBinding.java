package com.codeauditor.core.registry;

import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.convert.FindingParser;
import com.codeauditor.core.tool.AnalyzerTool;

/**
 * Pairs an analyzer with the parser for its output.
 *
 * @param tool analyzer that produces runs
 * @param parser parser that converts them
 */
public record ToolBinding(AnalyzerTool tool, FindingParser parser) {

    public ToolBinding {
        if (tool == null || parser == null) {
            throw new ConfigurationException("Tool binding requires both an analyzer and a parser");
        }
        if (!tool.getId().equals(parser.getToolId())) {
            throw new ConfigurationException(
                "Parser for '" + parser.getToolId() + "' bound to tool '" + tool.getId() + "'");
        }
        if (tool.getKind() != parser.getKind()) {
            throw new ConfigurationException(
                "Tool '" + tool.getId() + "' is " + tool.getKind() + " but its parser produces " + parser.getKind());
        }
    }

    public String id() {
        return tool.getId();
    }
}
