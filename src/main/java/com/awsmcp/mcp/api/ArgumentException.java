package com.awsmcp.mcp.api;

/**
 * Raised when tool arguments are missing or malformed. Always detected before any provider
 * call and always correctable by the caller.
 */
public class ArgumentException extends RuntimeException {
    private final String argumentName;

    public ArgumentException(String argumentName, String message) {
        super(message);
        this.argumentName = argumentName;
    }

    public ArgumentException(String argumentName, String message, Throwable cause) {
        super(message, cause);
        this.argumentName = argumentName;
    }

    public String getArgumentName() {
        return argumentName;
    }
}
