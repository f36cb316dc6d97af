package com.awsmcp.mcp.api;

/**
 * A tool name was registered twice. This is a wiring bug, not a runtime condition.
 */
public class DuplicateToolException extends RuntimeException {

    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
    }
}
