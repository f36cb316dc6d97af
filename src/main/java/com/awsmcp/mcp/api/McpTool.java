package com.awsmcp.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a service method as an MCP tool.
 * {@link ToolRegistry#registerAnnotated(Object)} discovers annotated methods at startup,
 * converts camelCase method names to snake_case tool names and binds each one to a handler.
 * Annotated methods must return {@link com.awsmcp.mcp.model.ToolResult}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {
    /** Override tool name (empty = derive from method name via Json.toSnakeCase). */
    String name() default "";

    /** Tool description text. A Parameters: section is auto-appended from @Param annotations. */
    String description();
}
