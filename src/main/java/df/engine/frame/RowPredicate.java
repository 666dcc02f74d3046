package df.engine.frame;

import df.engine.storage.Row;

/**
 * Row filter evaluated with the row's position in the frame.
 */
@FunctionalInterface
public interface RowPredicate {
    boolean test(Row row, int index);
}
