package com.awsmcp.mcp.api;

/**
 * An argument was present but structurally wrong (e.g. a scalar where a mapping is expected).
 */
public class InvalidArgumentException extends ArgumentException {

    public InvalidArgumentException(String argumentName, String message) {
        super(argumentName, message);
    }

    public InvalidArgumentException(String argumentName, String message, Throwable cause) {
        super(argumentName, message, cause);
    }
}
