package io.surfworks.opforge.core.proto;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named operator argument holding one typed value.
 *
 * <p>Values are integers ({@code long}), floats ({@code double}), strings, or
 * lists of integers. Use the factory methods; the typed accessors throw
 * {@link IllegalStateException} when the stored value is of another kind.
 *
 * @param name  argument name
 * @param value the value, never null
 */
public record Argument(String name, Object value) {

    public Argument {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static Argument of(String name, long value) {
        return new Argument(name, value);
    }

    public static Argument of(String name, double value) {
        return new Argument(name, value);
    }

    public static Argument of(String name, String value) {
        return new Argument(name, value);
    }

    public static Argument ofInts(String name, long... values) {
        return new Argument(name, Arrays.stream(values).boxed().toList());
    }

    public long asLong() {
        if (value instanceof Long l) {
            return l;
        }
        throw wrongKind("integer");
    }

    /**
     * Float value; integer arguments are widened.
     */
    public double asDouble() {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Long l) {
            return l;
        }
        throw wrongKind("float");
    }

    public String asString() {
        if (value instanceof String s) {
            return s;
        }
        throw wrongKind("string");
    }

    /**
     * List value. Scalars are not wrapped.
     */
    public List<?> asList() {
        if (value instanceof List<?> list) {
            return list;
        }
        throw wrongKind("list");
    }

    private IllegalStateException wrongKind(String expected) {
        return new IllegalStateException(
            "Argument '" + name + "' is not a " + expected + ": " + value);
    }
}
