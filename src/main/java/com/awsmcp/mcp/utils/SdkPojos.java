package com.awsmcp.mcp.utils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.awsmcp.mcp.api.InvalidArgumentException;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.SdkField;
import software.amazon.awssdk.core.SdkPojo;
import software.amazon.awssdk.core.protocol.MarshallingType;
import software.amazon.awssdk.core.traits.ListTrait;
import software.amazon.awssdk.core.traits.MapTrait;
import software.amazon.awssdk.core.util.SdkAutoConstructList;
import software.amazon.awssdk.core.util.SdkAutoConstructMap;
import software.amazon.awssdk.utils.builder.SdkBuilder;

/**
 * Converts between provider model objects and plain JSON-compatible values,
 * using the member metadata every generated SDK model carries.
 * Keys are the provider's own member names ({@code InstanceId}, {@code VpcId}, ...).
 */
public final class SdkPojos {

    private SdkPojos() {}

    /**
     * Convert a provider value into maps, lists and scalars. Unset members are skipped,
     * timestamps become ISO-8601 strings and binary blobs base64 strings. Other values pass through.
     */
    public static Object toPlain(Object value) {
        if (value == null) return null;
        if (value instanceof SdkPojo pojo) return toMap(pojo);
        if (value instanceof Instant instant) return instant.toString();
        if (value instanceof SdkBytes bytes) return Base64.getEncoder().encodeToString(bytes.asByteArray());
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                plain.put(String.valueOf(entry.getKey()), toPlain(entry.getValue()));
            }
            return plain;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> plain = new ArrayList<>(collection.size());
            for (Object element : collection) {
                plain.add(toPlain(element));
            }
            return plain;
        }
        if (value instanceof Enum<?>) return value.toString();
        return value;
    }

    public static Map<String, Object> toMap(SdkPojo pojo) {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (SdkField<?> field : pojo.sdkFields()) {
            Object value = field.getValueOrDefault(pojo);
            if (value == null || value instanceof SdkAutoConstructList || value instanceof SdkAutoConstructMap) {
                continue;
            }
            plain.put(field.memberName(), toPlain(value));
        }
        return plain;
    }

    /**
     * Build a provider structure from a JSON object keyed by the structure's member names.
     *
     * @param argument tool argument the object came from, used in error messages
     * @param source JSON object
     * @param builderFactory builder of the target structure, e.g. {@code TargetDescription::builder}
     * @throws InvalidArgumentException on unknown members or wrongly typed values
     */
    public static <T> T fromMap(String argument, Map<String, ?> source,
                                Supplier<? extends SdkBuilder<?, T>> builderFactory) {
        SdkBuilder<?, T> builder = builderFactory.get();
        populate(argument, source, asPojo(builder));
        return builder.build();
    }

    public static <T> List<T> fromMaps(String argument, List<? extends Map<String, ?>> sources,
                                       Supplier<? extends SdkBuilder<?, T>> builderFactory) {
        List<T> built = new ArrayList<>(sources.size());
        for (Map<String, ?> source : sources) {
            built.add(fromMap(argument, source, builderFactory));
        }
        return built;
    }

    private static SdkPojo asPojo(Object builder) {
        if (builder instanceof SdkPojo pojo) return pojo;
        throw new IllegalArgumentException(builder.getClass().getName() + " does not expose SDK field metadata");
    }

    private static void populate(String argument, Map<?, ?> source, SdkPojo builder) {
        Map<String, SdkField<?>> fields = new HashMap<>();
        for (SdkField<?> field : builder.sdkFields()) {
            fields.put(field.memberName(), field);
        }

        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String member = String.valueOf(entry.getKey());
            SdkField<?> field = fields.get(member);
            if (field == null) {
                throw new InvalidArgumentException(argument,
                    "Argument '" + argument + "' has unknown field '" + member + "'");
            }
            if (entry.getValue() != null) {
                field.set(builder, coerce(argument, member, field, entry.getValue()));
            }
        }
    }

    private static Object coerce(String argument, String member, SdkField<?> field, Object raw) {
        MarshallingType<?> type = field.marshallingType();

        if (type == MarshallingType.STRING) {
            if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) return String.valueOf(raw);
            throw invalid(argument, member, "a string", raw);
        }
        if (type == MarshallingType.INTEGER) {
            long value = integral(argument, member, raw);
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw invalid(argument, member, "a 32-bit integer", raw);
            }
            return (int) value;
        }
        if (type == MarshallingType.LONG) return integral(argument, member, raw);
        if (type == MarshallingType.BOOLEAN) {
            if (raw instanceof Boolean b) return b;
            throw invalid(argument, member, "a boolean", raw);
        }
        if (type == MarshallingType.DOUBLE) return number(argument, member, raw).doubleValue();
        if (type == MarshallingType.FLOAT) return number(argument, member, raw).floatValue();
        if (type == MarshallingType.INSTANT) {
            try {
                return Instant.parse(String.valueOf(raw));
            } catch (DateTimeParseException e) {
                throw invalid(argument, member, "an ISO-8601 timestamp", raw);
            }
        }
        if (type == MarshallingType.LIST) {
            if (!(raw instanceof List<?> list)) throw invalid(argument, member, "an array", raw);
            SdkField<?> memberField = field.getTrait(ListTrait.class).memberFieldInfo();
            List<Object> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(element == null ? null : coerce(argument, member, memberField, element));
            }
            return values;
        }
        if (type == MarshallingType.MAP) {
            if (!(raw instanceof Map<?, ?> map)) throw invalid(argument, member, "an object", raw);
            SdkField<?> valueField = field.getTrait(MapTrait.class).valueFieldInfo();
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object value = entry.getValue();
                values.put(String.valueOf(entry.getKey()),
                    value == null ? null : coerce(argument, member, valueField, value));
            }
            return values;
        }
        if (type == MarshallingType.SDK_POJO) {
            if (!(raw instanceof Map<?, ?> map)) throw invalid(argument, member, "an object", raw);
            SdkPojo nested = field.constructor().get();
            populate(argument, map, nested);
            return ((SdkBuilder<?, ?>) nested).build();
        }
        throw new InvalidArgumentException(argument,
            "Argument '" + argument + "' field '" + member + "' has an unsupported type");
    }

    private static BigDecimal number(String argument, String member, Object raw) {
        if (raw instanceof Number n) {
            try {
                return new BigDecimal(n.toString());
            } catch (NumberFormatException e) {
                throw invalid(argument, member, "a number", raw);
            }
        }
        throw invalid(argument, member, "a number", raw);
    }

    private static long integral(String argument, String member, Object raw) {
        try {
            return number(argument, member, raw).longValueExact();
        } catch (ArithmeticException e) {
            throw invalid(argument, member, "an integer", raw);
        }
    }

    private static InvalidArgumentException invalid(String argument, String member, String expected, Object raw) {
        return new InvalidArgumentException(argument, "Argument '" + argument + "' field '" + member
            + "' must be " + expected + ", got " + raw.getClass().getSimpleName());
    }
}
