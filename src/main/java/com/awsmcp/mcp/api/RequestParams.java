package com.awsmcp.mcp.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Helpers for building provider requests from partially supplied arguments.
 * A value is present when it is not null; false, 0 and the empty string are present and get sent.
 */
public final class RequestParams {

    private RequestParams() {}

    /** Apply {@code value} to the request only when it is present. */
    public static <T> void ifPresent(T value, Consumer<? super T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    /**
     * Build a composite structure from {@code value} and apply it, only when {@code value} is present,
     * e.g. an instance profile name becoming {@code {Name: value}}.
     */
    public static <S, T> void composite(S value, Function<? super S, ? extends T> factory,
                                        Consumer<? super T> setter) {
        if (value != null) {
            setter.accept(factory.apply(value));
        }
    }

    /**
     * Turn a mapping into a list of key/value structures, in the mapping's iteration order.
     */
    public static <T> List<T> keyValuePairs(Map<String, String> mapping,
                                            BiFunction<String, String, ? extends T> pair) {
        List<T> pairs = new ArrayList<>(mapping.size());
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            pairs.add(pair.apply(entry.getKey(), entry.getValue()));
        }
        return pairs;
    }

    /**
     * @throws MissingArgumentException if {@code value} is absent
     */
    public static <T> T require(T value, String name) {
        if (value == null) {
            throw new MissingArgumentException(name);
        }
        return value;
    }

    public static boolean anyPresent(Object... values) {
        for (Object value : values) {
            if (value != null) return true;
        }
        return false;
    }

    /** True when a collection or mapping argument is present and has content. */
    public static boolean hasEntries(Map<?, ?> mapping) {
        return mapping != null && !mapping.isEmpty();
    }
}
