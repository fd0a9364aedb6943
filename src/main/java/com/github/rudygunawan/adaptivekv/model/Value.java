package com.github.rudygunawan.adaptivekv.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable cached value. Values form a closed tree of six kinds: string, number, boolean,
 * null, list and map. Quantization and size estimation operate over this tree instead of over
 * arbitrary Java objects.
 *
 * <p>Usage example:
 * <pre>{@code
 * Value result = Value.of(Map.of(
 *     "summary", "3 hotspots found",
 *     "score", 0.87,
 *     "suggestions", List.of("inline loop", "cache lookup")));
 *
 * cache.set(fingerprint, result);
 * }</pre>
 */
public abstract class Value {

    /**
     * The kind of a {@link Value} node.
     */
    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        LIST,
        MAP
    }

    private Value() {
    }

    /**
     * Returns the kind of this node.
     */
    public abstract Kind kind();

    /**
     * Returns the estimated in-memory size of this value in bytes. Strings count two bytes per
     * character, numbers eight, booleans one and null zero. Containers sum their children, and
     * maps also count two bytes per key character.
     */
    public abstract long estimatedSize();

    /**
     * Converts this value back to plain Java objects: {@code String}, {@code Double},
     * {@code Boolean}, {@code null}, {@code List} or {@code Map}.
     */
    public abstract Object toJava();

    public static Value of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    public static Value of(double value) {
        return new NumberValue(value);
    }

    public static Value of(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    public static Value nullValue() {
        return NullValue.INSTANCE;
    }

    public static Value list(List<Value> items) {
        return new ListValue(items);
    }

    public static Value map(Map<String, Value> fields) {
        return new MapValue(fields);
    }

    /**
     * Converts a plain Java object tree into a {@code Value}.
     *
     * @param object a {@code String}, {@code Number}, {@code Boolean}, {@code null}, {@code List},
     *               {@code Map} with string keys, or an existing {@code Value}
     * @return the converted value
     * @throws IllegalArgumentException if the object, or anything nested in it, is of another type
     */
    public static Value of(Object object) {
        if (object == null) {
            return NullValue.INSTANCE;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof String) {
            return new StringValue((String) object);
        }
        if (object instanceof Number) {
            return new NumberValue(((Number) object).doubleValue());
        }
        if (object instanceof Boolean) {
            return of(((Boolean) object).booleanValue());
        }
        if (object instanceof List) {
            List<?> list = (List<?>) object;
            List<Value> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (object instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) object;
            Map<String, Value> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("map keys must be strings, got: " + entry.getKey());
                }
                fields.put((String) entry.getKey(), of(entry.getValue()));
            }
            return new MapValue(fields);
        }
        throw new IllegalArgumentException("unsupported value type: " + object.getClass().getName());
    }

    /**
     * A string leaf.
     */
    public static final class StringValue extends Value {
        private final String value;

        StringValue(String value) {
            this.value = Objects.requireNonNull(value);
        }

        public String getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public long estimatedSize() {
            return value.length() * 2L;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof StringValue)) {
                return false;
            }
            StringValue other = (StringValue) obj;
            return value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * A numeric leaf. All numbers are held as {@code double}.
     */
    public static final class NumberValue extends Value {
        private final double value;

        NumberValue(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public long estimatedSize() {
            return 8;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof NumberValue)) {
                return false;
            }
            NumberValue other = (NumberValue) obj;
            return Double.compare(value, other.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * A boolean leaf.
     */
    public static final class BooleanValue extends Value {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        private final boolean value;

        private BooleanValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public long estimatedSize() {
            return 1;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof BooleanValue)) {
                return false;
            }
            BooleanValue other = (BooleanValue) obj;
            return value == other.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * The null leaf.
     */
    public static final class NullValue extends Value {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public long estimatedSize() {
            return 0;
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof NullValue;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    /**
     * An ordered list of values.
     */
    public static final class ListValue extends Value {
        private final List<Value> items;

        ListValue(List<Value> items) {
            List<Value> copy = new ArrayList<>(items.size());
            for (Value item : items) {
                copy.add(Objects.requireNonNull(item, "list items cannot be null, use Value.nullValue()"));
            }
            this.items = Collections.unmodifiableList(copy);
        }

        public List<Value> getItems() {
            return items;
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public long estimatedSize() {
            long size = 0;
            for (Value item : items) {
                size += item.estimatedSize();
            }
            return size;
        }

        @Override
        public Object toJava() {
            List<Object> result = new ArrayList<>(items.size());
            for (Value item : items) {
                result.add(item.toJava());
            }
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof ListValue)) {
                return false;
            }
            ListValue other = (ListValue) obj;
            return items.equals(other.items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    /**
     * A map of string keys to values. Iteration follows insertion order.
     */
    public static final class MapValue extends Value {
        private final Map<String, Value> fields;

        MapValue(Map<String, Value> fields) {
            Map<String, Value> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Value> field : fields.entrySet()) {
                copy.put(Objects.requireNonNull(field.getKey(), "map keys cannot be null"),
                        Objects.requireNonNull(field.getValue(), "map values cannot be null, use Value.nullValue()"));
            }
            this.fields = Collections.unmodifiableMap(copy);
        }

        public Map<String, Value> getFields() {
            return fields;
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public long estimatedSize() {
            long size = 0;
            for (Map.Entry<String, Value> field : fields.entrySet()) {
                size += field.getKey().length() * 2L + field.getValue().estimatedSize();
            }
            return size;
        }

        @Override
        public Object toJava() {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Value> field : fields.entrySet()) {
                result.put(field.getKey(), field.getValue().toJava());
            }
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof MapValue)) {
                return false;
            }
            MapValue other = (MapValue) obj;
            return fields.equals(other.fields);
        }

        @Override
        public int hashCode() {
            return fields.hashCode();
        }

        @Override
        public String toString() {
            return fields.toString();
        }
    }
}
