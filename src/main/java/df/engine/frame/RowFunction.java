package df.engine.frame;

import df.engine.storage.Row;

/**
 * Function of a row and its position in the frame.
 */
@FunctionalInterface
public interface RowFunction<T> {
    T apply(Row row, int index);
}
