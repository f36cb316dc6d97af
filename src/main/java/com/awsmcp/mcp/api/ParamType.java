package com.awsmcp.mcp.api;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Java parameter types to JSON Schema types for MCP tool definitions and coerces
 * JSON-decoded argument values into the Java type a handler expects.
 */
public enum ParamType {
    STRING("string"),
    INTEGER("integer"),
    LONG("integer"),
    BOOLEAN("boolean"),
    STRING_LIST("array"),
    STRING_MAP("object"),
    OBJECT("object"),
    OBJECT_LIST("array");

    private final String jsonSchemaType;

    ParamType(String jsonSchemaType) {
        this.jsonSchemaType = jsonSchemaType;
    }

    public String jsonSchemaType() {
        return jsonSchemaType;
    }

    /**
     * Infer ParamType from a Java reflection Type.
     *
     * @throws IllegalArgumentException if the type cannot be expressed as a tool parameter
     */
    public static ParamType inferFrom(Type javaType) {
        if (javaType == String.class) return STRING;
        if (javaType == int.class || javaType == Integer.class) return INTEGER;
        if (javaType == long.class || javaType == Long.class) return LONG;
        if (javaType == boolean.class || javaType == Boolean.class) return BOOLEAN;

        if (javaType instanceof ParameterizedType pt) {
            Type raw = pt.getRawType();
            Type[] args = pt.getActualTypeArguments();

            if (raw == Map.class && args.length == 2) {
                return args[1] == String.class ? STRING_MAP : OBJECT;
            }
            if (raw == List.class && args.length == 1) {
                if (args[0] == String.class) return STRING_LIST;
                // List<Map<String, Object>> -> OBJECT_LIST
                if (args[0] instanceof ParameterizedType element && element.getRawType() == Map.class) {
                    return OBJECT_LIST;
                }
            }
        }

        throw new IllegalArgumentException("Unsupported tool parameter type: " + javaType.getTypeName());
    }

    /**
     * Generate a JSON Schema fragment for this parameter type.
     */
    public Map<String, Object> toJsonSchemaMap(String description, Object defaultValue) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", jsonSchemaType);

        if (description != null && !description.isEmpty()) {
            schema.put("description", description);
        }

        // Add nested type info for maps and arrays
        switch (this) {
            case STRING_LIST -> schema.put("items", Map.of("type", "string"));
            case STRING_MAP -> schema.put("additionalProperties", Map.of("type", "string"));
            case OBJECT_LIST -> schema.put("items", Map.of("type", "object"));
            default -> { }
        }

        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }

    /**
     * Parse a default value declared on {@link Param#defaultValue()}.
     * An empty string means "optional, no default" and yields null.
     */
    public Object parseDefault(String defaultStr) {
        if (defaultStr == null || defaultStr.equals(Param.REQUIRED) || defaultStr.isEmpty()) return null;
        return switch (this) {
            case STRING -> defaultStr;
            case INTEGER -> Integer.parseInt(defaultStr);
            case LONG -> Long.parseLong(defaultStr);
            case BOOLEAN -> Boolean.parseBoolean(defaultStr);
            default -> throw new IllegalArgumentException(
                "Defaults are only supported for scalar parameters, got " + this);
        };
    }

    /**
     * Convert a JSON-decoded argument value into the Java value for this type.
     * Null is never passed here; absence is handled by {@link ToolDef#bind(Map)}.
     *
     * @throws InvalidArgumentException if the value has the wrong shape
     */
    public Object coerce(String name, Object raw) {
        return switch (this) {
            case STRING -> asString(name, raw);
            case INTEGER -> {
                long value = asLong(name, raw);
                if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    throw new InvalidArgumentException(name, "Argument '" + name + "' is out of range: " + raw);
                }
                yield (int) value;
            }
            case LONG -> asLong(name, raw);
            case BOOLEAN -> asBoolean(name, raw);
            case STRING_LIST -> {
                List<String> values = new ArrayList<>();
                for (Object element : asList(name, raw)) {
                    values.add(asString(name, element));
                }
                yield values;
            }
            case STRING_MAP -> {
                Map<String, String> values = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : asMap(name, raw).entrySet()) {
                    values.put(String.valueOf(entry.getKey()), asString(name, entry.getValue()));
                }
                yield values;
            }
            case OBJECT -> copyObject(name, raw);
            case OBJECT_LIST -> {
                List<Map<String, Object>> values = new ArrayList<>();
                for (Object element : asList(name, raw)) {
                    values.add(copyObject(name, element));
                }
                yield values;
            }
        };
    }

    private static String asString(String name, Object raw) {
        if (raw instanceof String s) return s;
        if (raw instanceof Number || raw instanceof Boolean) return String.valueOf(raw);
        throw invalid(name, "a string", raw);
    }

    private static long asLong(String name, Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number n) {
            try {
                return new BigDecimal(n.toString()).longValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw invalid(name, "an integer", raw);
            }
        }
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw invalid(name, "an integer", raw);
            }
        }
        throw invalid(name, "an integer", raw);
    }

    private static boolean asBoolean(String name, Object raw) {
        if (raw instanceof Boolean b) return b;
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) return true;
            if ("false".equalsIgnoreCase(s.trim())) return false;
        }
        throw invalid(name, "a boolean", raw);
    }

    private static List<?> asList(String name, Object raw) {
        if (raw instanceof List<?> list) return list;
        throw invalid(name, "an array", raw);
    }

    private static Map<?, ?> asMap(String name, Object raw) {
        if (raw instanceof Map<?, ?> map) return map;
        throw invalid(name, "an object", raw);
    }

    private static Map<String, Object> copyObject(String name, Object raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : asMap(name, raw).entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    private static InvalidArgumentException invalid(String name, String expected, Object raw) {
        String actual = raw == null ? "null" : raw.getClass().getSimpleName();
        return new InvalidArgumentException(name, "Argument '" + name + "' must be " + expected + ", got " + actual);
    }
}
