package df.engine.exec;

import java.util.List;
import java.util.Set;

import df.engine.storage.Row;

/**
 * Record subsetting used by select/drop.
 */
public final class Projections {
    private Projections() {}

    /**
     * New row holding exactly {@code keys}, in the given order, with values taken from {@code row}.
     * A key the row lacks comes out as UNDEFINED.
     */
    public static Row pick(Row row, List<String> keys) {
        Row.Builder b = Row.builder();
        for (String k : keys) b.put(k, row.get(k));
        return b.build();
    }

    /**
     * New row holding {@code allKeys} minus {@code exclude}, in {@code allKeys} order.
     * {@code allKeys} comes from the caller (the frame's columns), never from the row itself.
     */
    public static Row omit(Row row, List<String> allKeys, Set<String> exclude) {
        Row.Builder b = Row.builder();
        for (String k : allKeys) {
            if (!exclude.contains(k)) b.put(k, row.get(k));
        }
        return b.build();
    }
}
