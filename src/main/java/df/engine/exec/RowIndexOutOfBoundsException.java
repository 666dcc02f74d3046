package df.engine.exec;

public class RowIndexOutOfBoundsException extends IndexOutOfBoundsException {
    private final int index;
    private final int size;

    public RowIndexOutOfBoundsException(int index, int size) {
        super("Index " + index + " out of bounds for " + size + " row(s)");
        this.index = index;
        this.size = size;
    }

    public int index() { return index; }
    public int size() { return size; }
}
