package com.awsmcp.mcp.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Validated, typed arguments of one tool invocation. Produced by {@link ToolDef#bind(Map)}:
 * required arguments are guaranteed present, optional ones carry their default, and an optional
 * argument without default that the caller left out is simply absent.
 */
public final class ToolArguments {
    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    /** True when the argument was supplied (or defaulted); false, 0 and "" count as present. */
    public boolean isPresent(String name) {
        return values.get(name) != null;
    }

    /**
     * Value of an argument, or null when absent.
     *
     * @throws InvalidArgumentException if the value is not of the requested type
     */
    public <T> T get(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null) return null;
        if (!type.isInstance(value)) {
            throw new InvalidArgumentException(name, "Argument '" + name + "' must be of type "
                + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * Value of an argument that must be present.
     *
     * @throws MissingArgumentException if the argument is absent
     */
    public <T> T require(String name, Class<T> type) {
        T value = get(name, type);
        if (value == null) {
            throw new MissingArgumentException(name);
        }
        return value;
    }

    public <T> Optional<T> optional(String name, Class<T> type) {
        return Optional.ofNullable(get(name, type));
    }

    /** Pass the argument to {@code setter} only when it is present. */
    public <T> ToolArguments ifPresent(String name, Class<T> type, Consumer<? super T> setter) {
        T value = get(name, type);
        if (value != null) {
            setter.accept(value);
        }
        return this;
    }

    /** Raw value by name, null when absent. */
    public Object raw(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ToolArguments" + values;
    }
}
