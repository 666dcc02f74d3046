package df.engine.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import df.engine.catalog.TableSchema;
import df.engine.storage.Row;
import df.engine.storage.Value;

/**
 * Hash equi-join that keeps every anchor row (LEFT anchors on this side, RIGHT on the other).
 * The non-anchor side is materialized into a hash index keyed by its join column, then each
 * anchor row probes it once: O(n + m).
 *
 * <p>First-match-only: when several non-anchor rows share a key, only the first one inserted
 * is indexed; the rest are never joined. There is no fan-out, so the output has exactly one
 * row per anchor row.
 *
 * <p>A matched row contributes all its fields except its join key, overriding same-named anchor
 * fields. An unmatched anchor row gets {@link Value#NULL} for every column the other side would
 * have contributed (its schema columns minus its join key).
 */
public class HashJoin {
    public enum Type { LEFT, RIGHT }

    private final Type type;
    private final String thisKey;
    private final String otherKey;

    public HashJoin(Type type, String thisKey, String otherKey) {
        if (thisKey == null || otherKey == null) throw new IllegalArgumentException("Join keys must not be null");
        this.type = type;
        this.thisKey = thisKey;
        this.otherKey = otherKey;
    }

    public List<Row> execute(List<Row> thisRows, TableSchema thisSchema, List<Row> otherRows, TableSchema otherSchema) {
        return switch (type) {
            case LEFT -> probeLeft(thisRows, buildIndex(otherRows, otherKey), otherSchema);
            case RIGHT -> probeRight(otherRows, buildIndex(thisRows, thisKey), thisSchema);
        };
    }

    // First row seen for a key wins; later duplicates are unreachable.
    static Map<Value, Row> buildIndex(List<Row> rows, String keyColumn) {
        Map<Value, Row> index = new HashMap<>();
        for (Row r : rows) {
            index.putIfAbsent(r.get(keyColumn), r);
        }
        return index;
    }

    // Anchor fields first, matched (or null-filled) fields layered on top.
    private List<Row> probeLeft(List<Row> anchors, Map<Value, Row> index, TableSchema otherSchema) {
        List<Row> out = new ArrayList<>(anchors.size());
        for (Row anchor : anchors) {
            Row match = index.get(anchor.get(thisKey));
            Row.Builder b = anchor.toBuilder();
            if (match != null) {
                copyExcept(match, otherKey, b);
            } else {
                fillNulls(otherSchema, otherKey, b);
            }
            out.add(b.build());
        }
        return out;
    }

    // Matched (or null-filled) fields first, then the anchor's other fields, then its join key.
    // Contributed fields win over same-named anchor fields.
    private List<Row> probeRight(List<Row> anchors, Map<Value, Row> index, TableSchema thisSchema) {
        List<Row> out = new ArrayList<>(anchors.size());
        for (Row anchor : anchors) {
            Row match = index.get(anchor.get(otherKey));
            Row.Builder b = Row.builder();
            if (match != null) {
                copyExcept(match, thisKey, b);
            } else {
                fillNulls(thisSchema, thisKey, b);
            }
            Row contributed = b.build();
            for (Map.Entry<String, Value> e : anchor.asMap().entrySet()) {
                String key = e.getKey();
                if (!key.equals(otherKey) && !contributed.has(key)) b.put(key, e.getValue());
            }
            if (anchor.has(otherKey) && !contributed.has(otherKey)) b.put(otherKey, anchor.get(otherKey));
            out.add(b.build());
        }
        return out;
    }

    private static void copyExcept(Row source, String skip, Row.Builder target) {
        for (Map.Entry<String, Value> e : source.asMap().entrySet()) {
            if (!e.getKey().equals(skip)) target.put(e.getKey(), e.getValue());
        }
    }

    private static void fillNulls(TableSchema schema, String skip, Row.Builder target) {
        for (String c : schema.columns()) {
            if (!c.equals(skip)) target.put(c, Value.NULL);
        }
    }

    @Override
    public String toString() {
        return type + " JOIN ON " + thisKey + " = " + otherKey;
    }
}
