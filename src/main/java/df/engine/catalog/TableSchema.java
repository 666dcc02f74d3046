package df.engine.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import df.engine.storage.Row;

// Immutable ordered column list of a DataFrame, checked against every row it admits.
public record TableSchema(List<String> columns) {
    private static final TableSchema EMPTY = new TableSchema(List.of());

    public TableSchema {
        columns = List.copyOf(columns);
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
    }

    public static TableSchema empty() { return EMPTY; }

    public static TableSchema of(String... columns) { return new TableSchema(List.of(columns)); }

    /** Schema taken from the first row, or the empty schema when there are no rows. */
    public static TableSchema inferFrom(List<Row> rows) {
        if (rows.isEmpty()) return EMPTY;
        return new TableSchema(rows.get(0).keys());
    }

    public int size() { return columns.size(); }

    public boolean isEmpty() { return columns.isEmpty(); }

    public boolean contains(String column) { return columns.contains(column); }

    /** A row matches when its key set equals the column set; key order is free. */
    public boolean matches(Row row) {
        if (row.size() != columns.size()) return false;
        for (String c : columns) {
            if (!row.has(c)) return false;
        }
        return true;
    }

    public void validate(Row row, int index) {
        if (!matches(row)) {
            Set<String> keys = new HashSet<>(row.keys());
            throw new SchemaMismatchException("Row " + index + " has columns " + row.keys()
                + " but the schema is " + columns
                + (keys.containsAll(columns) ? " (extra columns)" : " (missing columns)"));
        }
    }

    public void validateAll(List<Row> rows) {
        for (int i = 0; i < rows.size(); i++) validate(rows.get(i), i);
    }
}
