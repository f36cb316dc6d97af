package com.awsmcp.mcp.model;

/**
 * Uniform success wrapper: {"type": "application/json", "data": payload}.
 */
public record ResultEnvelope(String type, Object data) {
    public static final String TYPE = "application/json";

    public static ResultEnvelope wrap(Object payload) {
        return new ResultEnvelope(TYPE, payload);
    }
}
