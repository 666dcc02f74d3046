package df.engine.exec;

/**
 * Half-open row range {@code [start, end)} walked with {@code step}.
 * Null fields take the defaults 0, row count and 1.
 */
public record Slice(Integer start, Integer end, Integer step) {

    public static Slice all() { return new Slice(null, null, null); }

    public static Slice of(int start, int end) { return new Slice(start, end, null); }

    public static Slice of(int start, int end, int step) { return new Slice(start, end, step); }

    public static Slice from(int start) { return new Slice(start, null, null); }

    public static Slice to(int end) { return new Slice(null, end, null); }

    public Slice withStep(int newStep) { return new Slice(start, end, newStep); }
}
