package com.awsmcp.mcp.model;

import java.util.List;

/**
 * Caller-facing answer of one tool call: either a one-element content list or exactly one error.
 */
public record ToolResponse(List<ResultEnvelope> content, NormalizedError error) {

    public static ToolResponse of(ResultEnvelope envelope) {
        return new ToolResponse(List.of(envelope), null);
    }

    public static ToolResponse failed(NormalizedError error) {
        return new ToolResponse(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
