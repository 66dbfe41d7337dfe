package com.purchasingpower.researchflow.agent;

/**
 * Textual outcome of a tool execution.
 *
 * @param success whether the tool did what was asked
 * @param output  text handed back to the model
 * @param source  source identifier to record, or null
 */
public record ToolResult(boolean success, String output, String source) {

    public static ToolResult success(String output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult success(String output, String source) {
        return new ToolResult(true, output, source);
    }

    public static ToolResult failure(String message) {
        return new ToolResult(false, message, null);
    }
}
