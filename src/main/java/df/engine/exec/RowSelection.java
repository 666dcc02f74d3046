package df.engine.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves positional selectors (single index, index list, slice) into row positions,
 * validating every position against the row count before anything is returned.
 */
public final class RowSelection {
    private RowSelection() {}

    public static List<Integer> index(int index, int size) {
        requireRows(size);
        checkIndex(index, size);
        return List.of(index);
    }

    /** Positions in the order given; duplicates are kept. */
    public static List<Integer> indices(List<Integer> indices, int size) {
        requireRows(size);
        List<Integer> out = new ArrayList<>(indices.size());
        for (Integer i : indices) {
            if (i == null) throw new IllegalArgumentException("Row index must not be null");
            checkIndex(i, size);
            out.add(i);
        }
        return out;
    }

    /** Ascending positions start, start + step, ... below end. */
    public static List<Integer> slice(Slice slice, int size) {
        requireRows(size);
        int start = slice.start() != null ? slice.start() : 0;
        int end = slice.end() != null ? slice.end() : size;
        int step = slice.step() != null ? slice.step() : 1;
        if (start < 0 || end > size || step <= 0) {
            throw new InvalidSliceException("Invalid slice parameters: start=" + start + ", end=" + end
                + ", step=" + step + " for " + size + " row(s)");
        }
        List<Integer> out = new ArrayList<>();
        // long counter: start + step can exceed Integer.MAX_VALUE
        for (long i = start; i < end; i += step) out.add((int) i);
        return out;
    }

    private static void requireRows(int size) {
        if (size == 0) throw new EmptyFrameException("Cannot select rows from an empty DataFrame");
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) throw new RowIndexOutOfBoundsException(index, size);
    }
}
