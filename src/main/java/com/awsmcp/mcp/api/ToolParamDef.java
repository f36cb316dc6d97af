package com.awsmcp.mcp.api;

/**
 * Definition of a single tool parameter, built from @Param annotation + reflection or declared
 * directly through {@link ToolDef.Builder}.
 */
public record ToolParamDef(
    String name,           // snake_case argument name
    ParamType type,        // inferred from Java type
    boolean required,      // true if no defaultValue specified
    Object defaultValue,   // parsed default, or null
    String description     // from @Param.value()
) {}
