package com.awsmcp.mcp.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synthesized {"message": ...} payload for operations whose provider response carries nothing useful.
 */
public record StatusMessage(String message) {

    public static StatusMessage of(String message) {
        return new StatusMessage(message);
    }

    /** Message plus extra fields, in insertion order. */
    public static Map<String, Object> with(String message, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.putAll(extra);
        return payload;
    }
}
