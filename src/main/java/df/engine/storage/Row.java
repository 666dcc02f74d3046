package df.engine.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row is the storage unit of a DataFrame: an insertion-ordered mapping of column name to Value.
 * Rows are immutable, so frames derived from one another can share them safely.
 * Equality compares the mappings and ignores key order.
 */
public final class Row {
    private static final Row EMPTY = new Row(new LinkedHashMap<>());

    private final Map<String, Value> cells;

    private Row(LinkedHashMap<String, Value> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static Row empty() { return EMPTY; }

    /**
     * Builds a row from alternating key/value arguments, e.g. {@code Row.of("id", 1, "name", "Alice")}.
     */
    public static Row of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs but got " + keysAndValues.length + " arguments");
        }
        Builder b = builder();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object key = keysAndValues[i];
            if (!(key instanceof String name)) {
                throw new IllegalArgumentException("Column name must be a String: " + key);
            }
            b.put(name, keysAndValues[i + 1]);
        }
        return b.build();
    }

    public static Row fromMap(Map<String, ?> values) {
        Builder b = builder();
        for (Map.Entry<String, ?> e : values.entrySet()) b.put(e.getKey(), e.getValue());
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    /** Cell for {@code key}, or {@link Value#UNDEFINED} when the row has no such column. */
    public Value get(String key) {
        Value v = cells.get(key);
        return v == null ? Value.UNDEFINED : v;
    }

    public boolean has(String key) { return cells.containsKey(key); }

    public List<String> keys() { return new ArrayList<>(cells.keySet()); }

    public int size() { return cells.size(); }

    public Map<String, Value> asMap() { return cells; }

    /** Copy of this row with {@code key} set; an existing key keeps its position. */
    public Row with(String key, Object value) {
        return toBuilder().put(key, value).build();
    }

    public Builder toBuilder() {
        Builder b = builder();
        b.cells.putAll(cells);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row other)) return false;
        return cells.equals(other.cells);
    }

    @Override
    public int hashCode() { return cells.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Value> e : cells.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append('=');
            Value v = e.getValue();
            if (v.isText()) sb.append('"').append(v.asText()).append('"');
            else sb.append(v);
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, Value> cells = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, Object value) {
            if (key == null) throw new IllegalArgumentException("Column name must not be null");
            cells.put(key, Value.from(value));
            return this;
        }

        public Row build() {
            return new Row(new LinkedHashMap<>(cells));
        }
    }
}
