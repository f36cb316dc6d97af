package com.awsmcp.mcp.api;

/**
 * A required argument was absent or null.
 */
public class MissingArgumentException extends ArgumentException {

    public MissingArgumentException(String argumentName) {
        super(argumentName, "Missing required argument: " + argumentName);
    }
}
