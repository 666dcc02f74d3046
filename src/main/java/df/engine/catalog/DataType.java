package df.engine.catalog;

/**
 * Runtime kinds a cell can hold. A single column may mix any of them.
 */
public enum DataType {
    NUMBER,
    TEXT,
    BOOLEAN,
    NULL,      // explicit null sentinel (join fills, JSON null)
    UNDEFINED; // key absent from the row

    public boolean isMissing() {
        return this == NULL || this == UNDEFINED;
    }
}
