package com.awsmcp.mcp.model;

/**
 * The single error a failed invocation reports to its caller.
 */
public record NormalizedError(String message) {}
