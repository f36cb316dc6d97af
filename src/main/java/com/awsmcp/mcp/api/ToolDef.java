package com.awsmcp.mcp.api;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.awsmcp.mcp.model.ToolResult;
import com.awsmcp.mcp.utils.Json;

/**
 * Immutable tool descriptor: name, description and ordered parameter schema.
 * Built from an @McpTool-annotated method via reflection, or declared directly with {@link #builder}.
 */
public class ToolDef {
    private final String name;              // snake_case tool name
    private final String description;       // full description including auto-generated Parameters section
    private final List<ToolParamDef> params;

    private ToolDef(final String name, final String rawDescription, final List<ToolParamDef> params) {
        this.name = name;
        this.params = List.copyOf(params);
        this.description = buildFullDescription(rawDescription, this.params);
    }

    /**
     * Build a ToolDef from an annotated method using reflection.
     *
     * @throws IllegalArgumentException if the method cannot be exposed as a tool
     */
    public static ToolDef fromMethod(final Method method, final McpTool annotation) {
        final String toolName = annotation.name().isEmpty()
            ? Json.toSnakeCase(method.getName())
            : annotation.name();

        if (method.getReturnType() != ToolResult.class) {
            throw new IllegalArgumentException("Tool method " + method.getName() + " must return ToolResult");
        }

        final Parameter[] javaParams = method.getParameters();
        final java.lang.reflect.Type[] genericTypes = method.getGenericParameterTypes();

        final List<ToolParamDef> paramDefs = new ArrayList<>();
        for (int i = 0; i < javaParams.length; i++) {
            final Param paramAnn = javaParams[i].getAnnotation(Param.class);
            if (paramAnn == null) {
                throw new IllegalArgumentException("Parameter " + javaParams[i].getName() + " of tool "
                    + toolName + " is missing @Param");
            }

            final String paramName = paramAnn.name().isEmpty()
                ? Json.toSnakeCase(javaParams[i].getName())
                : paramAnn.name();
            final ParamType paramType = ParamType.inferFrom(genericTypes[i]);
            final boolean required = paramAnn.defaultValue().equals(Param.REQUIRED);
            final Object defaultValue = required ? null : paramType.parseDefault(paramAnn.defaultValue());

            // a primitive cannot carry the absent sentinel
            if (javaParams[i].getType().isPrimitive() && !required && defaultValue == null) {
                throw new IllegalArgumentException("Optional primitive parameter " + paramName + " of tool "
                    + toolName + " needs a default value or a boxed type");
            }

            paramDefs.add(new ToolParamDef(paramName, paramType, required, defaultValue, paramAnn.value()));
        }

        return new ToolDef(toolName, annotation.description(), paramDefs);
    }

    public static Builder builder(final String name, final String description) {
        return new Builder(name, description);
    }

    /**
     * Validate raw caller arguments against this schema.
     * Required arguments must be present and non-null; optional arguments fall back to their default.
     * Arguments the schema does not declare are ignored.
     *
     * @throws MissingArgumentException if a required argument is absent
     * @throws InvalidArgumentException if an argument has the wrong shape
     */
    public ToolArguments bind(final Map<String, Object> arguments) {
        final Map<String, Object> source = arguments != null ? arguments : Map.of();
        final Map<String, Object> bound = new LinkedHashMap<>();

        for (final ToolParamDef p : params) {
            final Object raw = source.get(p.name());
            if (raw != null) {
                bound.put(p.name(), p.type().coerce(p.name(), raw));
            } else if (p.required()) {
                throw new MissingArgumentException(p.name());
            } else if (p.defaultValue() != null) {
                bound.put(p.name(), p.defaultValue());
            }
        }
        return new ToolArguments(bound);
    }

    /**
     * Tool listing entry: name, description and JSON Schema of the input.
     */
    public Map<String, Object> toToolMap() {
        final Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", buildInputSchemaMap());
        return tool;
    }

    /**
     * Build the input schema as a Map for Jackson serialization.
     */
    private Map<String, Object> buildInputSchemaMap() {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");

        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final ToolParamDef p : params) {
            properties.put(p.name(), p.type().toJsonSchemaMap(p.description(), p.defaultValue()));
        }
        schema.put("properties", properties);

        final List<String> required = params.stream()
            .filter(ToolParamDef::required)
            .map(ToolParamDef::name)
            .toList();
        if (!required.isEmpty()) {
            schema.put("required", required);
        }

        return schema;
    }

    /**
     * Generate JSON Schema for this tool's input parameters.
     */
    public String toInputSchemaJson() {
        return Json.serialize(buildInputSchemaMap());
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<ToolParamDef> getParams() { return params; }

    private static String buildFullDescription(final String rawDescription, final List<ToolParamDef> params) {
        final String base = rawDescription.strip();
        if (params.isEmpty()) return base;

        final StringBuilder sb = new StringBuilder(base);
        sb.append("\n\n    Parameters:\n");
        for (final ToolParamDef p : params) {
            sb.append("        ").append(p.name()).append(": ").append(p.description());
            if (!p.required() && p.defaultValue() != null) {
                sb.append(" (default: ").append(p.defaultValue()).append(")");
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Declares a tool without an annotated method, for handlers registered as lambdas.
     */
    public static final class Builder {
        private final String name;
        private final String description;
        private final List<ToolParamDef> params = new ArrayList<>();

        private Builder(final String name, final String description) {
            this.name = name;
            this.description = description;
        }

        public Builder required(final String paramName, final ParamType type, final String paramDescription) {
            params.add(new ToolParamDef(paramName, type, true, null, paramDescription));
            return this;
        }

        public Builder optional(final String paramName, final ParamType type, final Object defaultValue,
                                final String paramDescription) {
            params.add(new ToolParamDef(paramName, type, false, defaultValue, paramDescription));
            return this;
        }

        public ToolDef build() {
            return new ToolDef(name, description, params);
        }
    }
}
