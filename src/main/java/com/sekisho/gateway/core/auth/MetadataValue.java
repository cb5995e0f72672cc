package com.sekisho.gateway.core.auth;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON-compatible value carried in the {@code metadata} claim.
 * <p>
 * Numbers compare by numeric value, so {@code 1}, {@code 1L} and {@code 1.0}
 * are equal. A metadata bag therefore compares equal after a sign and parse
 * cycle even though the JSON reader may pick a different numeric type.
 */
public final class MetadataValue {

    /**
     * Kinds of metadata values.
     */
    public enum Type {
        STRING, NUMBER, BOOLEAN, LIST, MAP
    }

    private final Type type;
    private final Object value;

    private MetadataValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static MetadataValue of(String value) {
        return new MetadataValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static MetadataValue of(Number value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())
                || value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new IllegalArgumentException("Metadata numbers must be finite: " + value);
        }
        return new MetadataValue(Type.NUMBER, value);
    }

    public static MetadataValue of(boolean value) {
        return new MetadataValue(Type.BOOLEAN, value);
    }

    public static MetadataValue ofList(List<MetadataValue> values) {
        return new MetadataValue(Type.LIST, List.copyOf(values));
    }

    public static MetadataValue ofMap(Map<String, MetadataValue> values) {
        return new MetadataValue(Type.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Converts a plain Java value (as produced by a JSON reader) into a metadata
     * value.
     *
     * @param raw a String, Number, Boolean, List or Map with String keys.
     * @return the converted value.
     * @throws IllegalArgumentException for null or unsupported types.
     */
    public static MetadataValue fromObject(Object raw) {
        if (raw instanceof MetadataValue mv) {
            return mv;
        }
        if (raw instanceof String s) {
            return of(s);
        }
        if (raw instanceof Number n) {
            return of(n);
        }
        if (raw instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (raw instanceof List<?> list) {
            List<MetadataValue> values = new ArrayList<>(list.size());
            for (Object item : list) {
                values.add(fromObject(item));
            }
            return ofList(values);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, MetadataValue> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Metadata map keys must be strings: " + entry.getKey());
                }
                values.put(key, fromObject(entry.getValue()));
            }
            return ofMap(values);
        }
        throw new IllegalArgumentException("Unsupported metadata value: "
                + (raw == null ? "null" : raw.getClass().getName()));
    }

    /**
     * Converts a map of plain Java values.
     *
     * @param raw metadata as read from JSON; may be null.
     * @return converted map, empty when {@code raw} is null.
     */
    public static Map<String, MetadataValue> fromMap(Map<String, ?> raw) {
        Map<String, MetadataValue> result = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> result.put(k, fromObject(v)));
        }
        return result;
    }

    /**
     * Converts this value back into plain Java objects suitable for JSON
     * serialization.
     *
     * @return String, Number, Boolean, List or Map.
     */
    public Object toObject() {
        return switch (type) {
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (MetadataValue item : asList()) {
                    out.add(item.toObject());
                }
                yield out;
            }
            case MAP -> {
                Map<String, Object> out = new LinkedHashMap<>();
                asMap().forEach((k, v) -> out.put(k, v.toObject()));
                yield out;
            }
            default -> value;
        };
    }

    public Type getType() {
        return type;
    }

    public String asString() {
        expect(Type.STRING);
        return (String) value;
    }

    public Number asNumber() {
        expect(Type.NUMBER);
        return (Number) value;
    }

    public boolean asBoolean() {
        expect(Type.BOOLEAN);
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<MetadataValue> asList() {
        expect(Type.LIST);
        return (List<MetadataValue>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, MetadataValue> asMap() {
        expect(Type.MAP);
        return (Map<String, MetadataValue>) value;
    }

    private void expect(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Metadata value is " + type + ", not " + expected);
        }
    }

    private static BigDecimal decimal(Object number) {
        return new BigDecimal(number.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetadataValue other) || type != other.type) {
            return false;
        }
        if (type == Type.NUMBER) {
            return decimal(value).compareTo(decimal(other.value)) == 0;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            return decimal(value).stripTrailingZeros().hashCode();
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return String.valueOf(toObject());
    }
}
