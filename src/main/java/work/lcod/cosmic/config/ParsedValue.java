package work.lcod.cosmic.config;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree produced by every {@link ConfigParser}: a scalar, an ordered sequence, or an ordered mapping.
 */
public sealed interface ParsedValue permits ParsedValue.Scalar, ParsedValue.Sequence, ParsedValue.Mapping {

    /**
     * Converts the tree into plain Java collections ({@link LinkedHashMap}, {@link ArrayList}, boxed scalars).
     */
    Object toPlainObject();

    /**
     * Short name of the case, used in error messages.
     */
    String kind();

    /**
     * Boolean, integer ({@link Long} or {@link BigInteger}), {@link Double}, {@link String} or {@code null}.
     */
    record Scalar(Object value) implements ParsedValue {
        public static final Scalar NULL = new Scalar(null);

        public Scalar {
            if (value != null
                && !(value instanceof Boolean
                    || value instanceof Long
                    || value instanceof BigInteger
                    || value instanceof Double
                    || value instanceof String)) {
                throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
            }
        }

        public static Scalar of(Object value) {
            return value == null ? NULL : new Scalar(value);
        }

        public boolean isNull() {
            return value == null;
        }

        /**
         * Text form of the scalar, or {@code null} for the null scalar.
         */
        public String asText() {
            return value == null ? null : String.valueOf(value);
        }

        @Override
        public Object toPlainObject() {
            return value;
        }

        @Override
        public String kind() {
            return "scalar";
        }
    }

    record Sequence(List<ParsedValue> items) implements ParsedValue {
        public Sequence {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        @Override
        public Object toPlainObject() {
            var list = new ArrayList<Object>(items.size());
            for (var item : items) {
                list.add(item.toPlainObject());
            }
            return list;
        }

        @Override
        public String kind() {
            return "list";
        }
    }

    record Mapping(Map<String, ParsedValue> entries) implements ParsedValue {
        public Mapping {
            Objects.requireNonNull(entries, "entries");
            var copy = new LinkedHashMap<String, ParsedValue>();
            for (var entry : entries.entrySet()) {
                copy.put(
                    Objects.requireNonNull(entry.getKey(), "mapping key"),
                    Objects.requireNonNull(entry.getValue(), "mapping value")
                );
            }
            entries = Collections.unmodifiableMap(copy);
        }

        public static Mapping empty() {
            return new Mapping(Map.of());
        }

        public ParsedValue get(String key) {
            return entries.get(key);
        }

        public int size() {
            return entries.size();
        }

        @Override
        public Object toPlainObject() {
            var map = new LinkedHashMap<String, Object>();
            for (var entry : entries.entrySet()) {
                map.put(entry.getKey(), entry.getValue().toPlainObject());
            }
            return map;
        }

        @Override
        public String kind() {
            return "mapping";
        }
    }
}
