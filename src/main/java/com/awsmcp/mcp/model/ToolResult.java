package com.awsmcp.mcp.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sealed outcome of one tool handler invocation.
 * Failures travel as values; only {@link Success} produces a result envelope.
 */
public sealed interface ToolResult
    permits ToolResult.Success, ToolResult.NotFound, ToolResult.ValidationError,
            ToolResult.ProviderError, ToolResult.TransportError {

    static ToolResult success(Object payload) {
        return new Success(payload);
    }

    static ToolResult notFound(String message) {
        return new NotFound(message);
    }

    static ToolResult validationError(String message) {
        return new ValidationError(message);
    }

    static ToolResult transportError(String message, Throwable cause) {
        return new TransportError(message, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Successful call carrying the shaped provider payload. */
    record Success(Object payload) implements ToolResult {}

    /** Describe-by-id matched nothing. */
    record NotFound(String message) implements ToolResult {}

    /** Arguments rejected before any provider call. */
    record ValidationError(String message) implements ToolResult {}

    /**
     * Provider answered with an error. {@code diagnostic} mirrors the provider's error response
     * and is reported to the caller verbatim.
     */
    record ProviderError(String code, String message, Map<String, Object> diagnostic, Throwable cause)
        implements ToolResult {

        /** Copy of this error with an extra top-level diagnostic entry. */
        public ProviderError withContext(String key, Object value) {
            Map<String, Object> extended = new LinkedHashMap<>();
            if (diagnostic != null) {
                extended.putAll(diagnostic);
            }
            extended.put(key, value);
            return new ProviderError(code, message, extended, cause);
        }
    }

    /** Provider could not be reached, or the call failed outside the provider's error model. */
    record TransportError(String message, Throwable cause) implements ToolResult {

        public TransportError withNote(String note) {
            return new TransportError(message + " (" + note + ")", cause);
        }
    }
}
