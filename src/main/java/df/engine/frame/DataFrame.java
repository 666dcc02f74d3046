package df.engine.frame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import df.engine.catalog.TableSchema;
import df.engine.exec.HashJoin;
import df.engine.exec.Projections;
import df.engine.exec.RowSelection;
import df.engine.exec.Slice;
import df.engine.series.Series;
import df.engine.storage.RecordCodec;
import df.engine.storage.Row;
import df.engine.storage.Value;

/**
 * Ordered collection of rows sharing one schema.
 *
 * <p>The schema is inferred from the first row (or given explicitly) and every row is checked
 * against it, so {@link #shape()}, {@link #columns()} and {@link #drop} agree for all rows.
 * Every operation returns a new DataFrame over a new row list except {@link #pushRow}, which
 * appends in place. Rows are immutable and shared between a frame and the frames derived from it.
 */
public class DataFrame {
    private TableSchema schema; // replaced only when pushRow seeds an empty, schemaless frame
    private final List<Row> rows;

    public DataFrame() {
        this(TableSchema.empty(), List.of());
    }

    public DataFrame(List<Row> rows) {
        this(TableSchema.inferFrom(rows), rows);
    }

    public DataFrame(TableSchema schema, List<Row> rows) {
        List<Row> copy = new ArrayList<>(rows);
        schema.validateAll(copy);
        this.schema = schema;
        this.rows = copy;
    }

    public static DataFrame of(Row... rows) {
        return new DataFrame(Arrays.asList(rows));
    }

    /** Frame from plain maps; values go through {@link Value#from(Object)}. */
    public static DataFrame fromRecords(List<? extends Map<String, ?>> records) {
        List<Row> rows = new ArrayList<>(records.size());
        for (Map<String, ?> m : records) rows.add(Row.fromMap(m));
        return new DataFrame(rows);
    }

    /** Frame from a JSON array of flat objects. */
    public static DataFrame fromJson(String json) {
        return new DataFrame(RecordCodec.decode(json));
    }

    public String toJson() {
        return RecordCodec.encode(rows);
    }

    // ---- accessors ----

    public TableSchema schema() { return schema; }

    public List<String> columns() { return schema.columns(); }

    public Shape shape() { return new Shape(rows.size(), schema.size()); }

    public int size() { return rows.size(); }

    public boolean isEmpty() { return rows.isEmpty(); }

    /** Shallow copy of the row list. */
    public List<Row> toArray() { return new ArrayList<>(rows); }

    public List<Row> head() { return head(5); }

    public List<Row> head(int n) {
        requireCount(n);
        return new ArrayList<>(rows.subList(0, Math.min(n, rows.size())));
    }

    public List<Row> tail() { return tail(5); }

    public List<Row> tail(int n) {
        requireCount(n);
        return new ArrayList<>(rows.subList(Math.max(0, rows.size() - n), rows.size()));
    }

    // ---- projection ----

    /** Column {@code key} of every row as a Series named {@code key}. */
    public Series col(String key) {
        List<Value> values = new ArrayList<>(rows.size());
        for (Row r : rows) values.add(r.get(key));
        return new Series(values, key);
    }

    public DataFrame select(String... keys) {
        return select(Arrays.asList(keys));
    }

    public DataFrame select(List<String> keys) {
        for (String k : keys) {
            if (!schema.contains(k)) throw new IllegalArgumentException("Column not found: " + k);
        }
        List<Row> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(Projections.pick(r, keys));
        return new DataFrame(new TableSchema(keys), out);
    }

    /** Removes {@code keys}; columns come from this frame's schema. Unknown keys are ignored. */
    public DataFrame drop(String... keys) {
        Set<String> exclude = new LinkedHashSet<>(Arrays.asList(keys));
        List<String> all = columns();
        List<Row> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(Projections.omit(r, all, exclude));
        List<String> remaining = new ArrayList<>(all);
        remaining.removeAll(exclude);
        return new DataFrame(new TableSchema(remaining), out);
    }

    // ---- row transforms ----

    /**
     * Adds or replaces columns computed from each row. Every function sees the original row,
     * never a sibling's new value. Iteration order of {@code map} decides the order of new columns,
     * so pass a LinkedHashMap when it matters.
     */
    public DataFrame assign(Map<String, ? extends Function<? super Row, ?>> map) {
        List<Row> out = new ArrayList<>(rows.size());
        for (Row r : rows) {
            Map<String, Value> computed = new LinkedHashMap<>();
            for (Map.Entry<String, ? extends Function<? super Row, ?>> e : map.entrySet()) {
                computed.put(e.getKey(), Value.from(e.getValue().apply(r)));
            }
            Row.Builder b = r.toBuilder();
            computed.forEach(b::put);
            out.add(b.build());
        }
        return new DataFrame(extendedSchema(map.keySet()), out);
    }

    /**
     * Adds (or overwrites) column {@code key}. The cells come from a constant or from a per-row
     * generator, as chosen by the caller through {@link ColumnFill}.
     */
    public DataFrame addColumn(String key, ColumnFill fill) {
        List<Row> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Row r = rows.get(i);
            out.add(r.with(key, fill.valueFor(r, i)));
        }
        return new DataFrame(extendedSchema(List.of(key)), out);
    }

    /** Reshapes every row; the new schema comes from the first mapped row. */
    public DataFrame mapRows(RowFunction<Row> fn) {
        List<Row> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) out.add(fn.apply(rows.get(i), i));
        return new DataFrame(out);
    }

    /**
     * For each target key, hands the same-named source column to the function and zips the
     * returned Series back into rows. All returned Series must have the same length.
     */
    public DataFrame mapColumns(Map<String, ? extends UnaryOperator<Series>> fnMap) {
        List<String> keys = new ArrayList<>(fnMap.keySet());
        List<Series> results = new ArrayList<>(keys.size());
        int length = -1;
        for (String key : keys) {
            Series s = fnMap.get(key).apply(col(key));
            if (length >= 0 && s.size() != length) {
                throw new IllegalArgumentException("Column '" + key + "' has " + s.size()
                    + " value(s) but previous columns have " + length);
            }
            length = s.size();
            results.add(s);
        }
        List<Row> out = new ArrayList<>(Math.max(length, 0));
        for (int i = 0; i < length; i++) {
            Row.Builder b = Row.builder();
            for (int c = 0; c < keys.size(); c++) b.put(keys.get(c), results.get(c).get(i));
            out.add(b.build());
        }
        return new DataFrame(new TableSchema(keys), out);
    }

    public DataFrame filterRows(RowPredicate predicate) {
        List<Row> out = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Row r = rows.get(i);
            if (predicate.test(r, i)) out.add(r);
        }
        return new DataFrame(schema, out);
    }

    /**
     * Appends in place. The only mutating operation. An empty frame without a schema takes the
     * row's columns as its schema.
     */
    public void pushRow(Row row) {
        if (rows.isEmpty() && schema.isEmpty()) {
            schema = new TableSchema(row.keys());
        }
        schema.validate(row, rows.size());
        rows.add(row);
    }

    // ---- positional selection ----

    public DataFrame iloc(int index) {
        return pickRows(RowSelection.index(index, rows.size()));
    }

    public DataFrame iloc(List<Integer> indices) {
        return pickRows(RowSelection.indices(indices, rows.size()));
    }

    public DataFrame iloc(Slice slice) {
        return pickRows(RowSelection.slice(slice, rows.size()));
    }

    private DataFrame pickRows(List<Integer> positions) {
        List<Row> out = new ArrayList<>(positions.size());
        for (int p : positions) out.add(rows.get(p));
        return new DataFrame(schema, out);
    }

    // ---- joins ----

    /** One output row per row of this frame; see {@link HashJoin} for the matching policy. */
    public DataFrame leftJoin(DataFrame other, JoinKeys on) {
        HashJoin join = new HashJoin(HashJoin.Type.LEFT, on.thisKey(), on.otherKey());
        List<Row> out = join.execute(rows, schema, other.rows, other.schema);
        Set<String> cols = new LinkedHashSet<>(columns());
        for (String c : other.columns()) {
            if (!c.equals(on.otherKey())) cols.add(c);
        }
        return new DataFrame(new TableSchema(new ArrayList<>(cols)), out);
    }

    /** One output row per row of {@code other}; see {@link HashJoin} for the matching policy. */
    public DataFrame rightJoin(DataFrame other, JoinKeys on) {
        HashJoin join = new HashJoin(HashJoin.Type.RIGHT, on.thisKey(), on.otherKey());
        List<Row> out = join.execute(rows, schema, other.rows, other.schema);
        Set<String> cols = new LinkedHashSet<>();
        for (String c : columns()) {
            if (!c.equals(on.thisKey())) cols.add(c);
        }
        for (String c : other.columns()) {
            if (!c.equals(on.otherKey())) cols.add(c);
        }
        if (other.schema.contains(on.otherKey())) cols.add(on.otherKey());
        return new DataFrame(new TableSchema(new ArrayList<>(cols)), out);
    }

    private TableSchema extendedSchema(Iterable<String> added) {
        Set<String> cols = new LinkedHashSet<>(columns());
        for (String a : added) cols.add(a);
        return new TableSchema(new ArrayList<>(cols));
    }

    private static void requireCount(int n) {
        if (n < 0) throw new IllegalArgumentException("Count must be non-negative but was " + n);
    }

    @Override
    public String toString() {
        return "DataFrame" + shape() + " columns=" + columns();
    }
}
