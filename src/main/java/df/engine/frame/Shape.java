package df.engine.frame;

// [rows, columns] of a DataFrame; columns is the schema width.
public record Shape(int rows, int columns) {
    @Override
    public String toString() { return "[" + rows + ", " + columns + "]"; }
}
