package com.awsmcp.mcp.api;

import com.awsmcp.mcp.model.ToolResult;

/**
 * Executes one tool against already validated arguments.
 */
@FunctionalInterface
public interface ToolHandler {
    ToolResult handle(ToolArguments arguments);
}
