package io.datamap.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value stored in a row field.
 * <p>
 * Raw Java values are converted with {@link #of(Object)} and converted back
 * with {@link #toRaw()}. Mapping keys keep their insertion order. Conversion
 * never drops data: numbers that do not fit a {@code long} or {@code double}
 * exactly, and map keys that collide once rendered as text, are rejected.
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Integral, FieldValue.Decimal,
        FieldValue.Bool, FieldValue.Mapping, FieldValue.Sequence, FieldValue.Null {

    /**
     * Plain Java rendition: String, Long, Double, Boolean, LinkedHashMap, ArrayList or null.
     */
    Object toRaw();

    static FieldValue of(Object raw) {
        if (raw == null) {
            return Null.INSTANCE;
        }
        if (raw instanceof FieldValue value) {
            return value;
        }
        if (raw instanceof String text) {
            return new Text(text);
        }
        if (raw instanceof Character ch) {
            return new Text(String.valueOf(ch));
        }
        if (raw instanceof Boolean bool) {
            return new Bool(bool);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return new Integral(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            if (big.bitLength() > 63) {
                throw new IllegalArgumentException("integer out of range: " + big);
            }
            return new Integral(big.longValue());
        }
        if (raw instanceof Float f) {
            // widen through the decimal text so 0.1f stays 0.1
            return new Decimal(Double.parseDouble(Float.toString(f)));
        }
        if (raw instanceof Double d) {
            return new Decimal(d);
        }
        if (raw instanceof BigDecimal big) {
            double value = big.doubleValue();
            if (Double.isInfinite(value) || BigDecimal.valueOf(value).compareTo(big) != 0) {
                throw new IllegalArgumentException("decimal not representable as double: " + big);
            }
            return new Decimal(value);
        }
        if (raw instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, FieldValue>(Math.max(4, map.size() * 2));
            for (var entry : map.entrySet()) {
                var key = String.valueOf(entry.getKey());
                if (entries.containsKey(key)) {
                    throw new IllegalArgumentException("mapping keys collide when rendered as text: '" + key + "'");
                }
                entries.put(key, of(entry.getValue()));
            }
            return new Mapping(entries);
        }
        if (raw instanceof Iterable<?> iterable) {
            var items = new ArrayList<FieldValue>();
            for (Object item : iterable) {
                items.add(of(item));
            }
            return new Sequence(items);
        }
        if (raw instanceof Object[] array) {
            var items = new ArrayList<FieldValue>(array.length);
            for (Object item : array) {
                items.add(of(item));
            }
            return new Sequence(items);
        }
        throw new IllegalArgumentException("unsupported field value type: " + raw.getClass().getName());
    }

    static FieldValue text(String value) {
        return new Text(value);
    }

    static FieldValue nothing() {
        return Null.INSTANCE;
    }

    record Text(String value) implements FieldValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value required");
            }
        }

        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Integral(long value) implements FieldValue {
        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Decimal(double value) implements FieldValue {
        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Bool(boolean value) implements FieldValue {
        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Mapping(Map<String, FieldValue> entries) implements FieldValue {
        public Mapping {
            if (entries == null) {
                throw new IllegalArgumentException("entries required");
            }
            var copy = new LinkedHashMap<String, FieldValue>(Math.max(4, entries.size() * 2));
            for (var entry : entries.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new IllegalArgumentException("mapping keys and values must be non-null");
                }
                copy.put(entry.getKey(), entry.getValue());
            }
            entries = Collections.unmodifiableMap(copy);
        }

        public FieldValue get(String key) {
            var value = entries.get(key);
            if (value == null) {
                throw new KeyNotFoundException(key, "No entry '" + key + "' in mapping");
            }
            return value;
        }

        @Override
        public Object toRaw() {
            var raw = new LinkedHashMap<String, Object>();
            entries.forEach((key, value) -> raw.put(key, value.toRaw()));
            return raw;
        }
    }

    record Sequence(List<FieldValue> items) implements FieldValue {
        public Sequence {
            if (items == null) {
                throw new IllegalArgumentException("items required");
            }
            for (var item : items) {
                if (item == null) {
                    throw new IllegalArgumentException("sequence items must be non-null");
                }
            }
            items = List.copyOf(items);
        }

        @Override
        public Object toRaw() {
            var raw = new ArrayList<Object>(items.size());
            items.forEach(item -> raw.add(item.toRaw()));
            return raw;
        }
    }

    final class Null implements FieldValue {
        static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public Object toRaw() {
            return null;
        }

        @Override
        public String toString() {
            return "Null";
        }
    }
}
