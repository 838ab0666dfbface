package com.rollupquery.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Value inside a query descriptor.
 *
 * Closed set of three shapes:
 * - Scalar: text, number, boolean or null
 * - ListValue: ordered elements, order is significant
 * - MapValue: entries kept sorted by key
 *
 * The canonical key builder relies on these rules, so there is no
 * other subclass and no runtime type probing.
 */
public abstract class DescriptorValue {

    public enum Kind {
        SCALAR,
        LIST,
        MAP
    }

    private DescriptorValue() {
    }

    public abstract Kind getKind();

    public static Scalar text(String value) {
        return new Scalar(Objects.requireNonNull(value, "value"));
    }

    public static Scalar number(Number value) {
        Objects.requireNonNull(value, "value");
        // widen so that 42 and 42L are the same value
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Scalar(value.longValue());
        }
        if (value instanceof Float) {
            return new Scalar(value.doubleValue());
        }
        return new Scalar(value);
    }

    public static Scalar bool(boolean value) {
        return new Scalar(value);
    }

    public static Scalar nullValue() {
        return Scalar.NULL;
    }

    public static ListValue list(List<? extends DescriptorValue> elements) {
        return new ListValue(elements);
    }

    public static MapValue map(Map<String, ? extends DescriptorValue> entries) {
        return new MapValue(entries);
    }

    public boolean isScalar() {
        return getKind() == Kind.SCALAR;
    }

    public boolean isList() {
        return getKind() == Kind.LIST;
    }

    public Scalar asScalar() {
        if (!isScalar()) {
            throw new IllegalStateException("Not a scalar: " + getKind());
        }
        return (Scalar) this;
    }

    public ListValue asList() {
        if (!isList()) {
            throw new IllegalStateException("Not a list: " + getKind());
        }
        return (ListValue) this;
    }

    public MapValue asMap() {
        if (getKind() != Kind.MAP) {
            throw new IllegalStateException("Not a map: " + getKind());
        }
        return (MapValue) this;
    }

    public static final class Scalar extends DescriptorValue {

        private static final Scalar NULL = new Scalar(null);

        private final Object value;

        private Scalar(Object value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.SCALAR;
        }

        /**
         * String, Number, Boolean or null.
         */
        public Object getValue() {
            return value;
        }

        public boolean isNull() {
            return value == null;
        }

        public boolean isNumber() {
            return value instanceof Number;
        }

        public boolean isText() {
            return value instanceof String;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Scalar)) {
                return false;
            }
            return Objects.equals(value, ((Scalar) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class ListValue extends DescriptorValue {

        private final List<DescriptorValue> elements;

        private ListValue(List<? extends DescriptorValue> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Kind getKind() {
            return Kind.LIST;
        }

        public List<DescriptorValue> getElements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ListValue)) {
                return false;
            }
            return elements.equals(((ListValue) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    public static final class MapValue extends DescriptorValue {

        private final Map<String, DescriptorValue> entries;

        private MapValue(Map<String, ? extends DescriptorValue> entries) {
            this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        }

        @Override
        public Kind getKind() {
            return Kind.MAP;
        }

        /**
         * Entries in lexicographic key order.
         */
        public Map<String, DescriptorValue> getEntries() {
            return entries;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof MapValue)) {
                return false;
            }
            return entries.equals(((MapValue) o).entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }
}
