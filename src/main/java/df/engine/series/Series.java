package df.engine.series;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Predicate;

import df.engine.storage.Value;

/**
 * Named, ordered sequence of cells. A single Series may mix numbers, text, booleans, NULL and UNDEFINED.
 * Every transform returns a new Series; instances are never modified.
 *
 * <p>Statistics other than {@link #sum()} work on the valid numeric subset: finite, non-NaN numbers.
 */
public final class Series {
    private static final Value ZERO = Value.of(0);
    private static final Value EMPTY_TEXT = Value.of("");

    private final List<Value> items;
    private final String name;

    public Series(List<?> items, String name) {
        List<Value> copy = new ArrayList<>(items.size());
        for (Object o : items) copy.add(Value.from(o));
        this.items = Collections.unmodifiableList(copy);
        this.name = name;
    }

    public static Series of(String name, Object... items) {
        return new Series(Arrays.asList(items), name);
    }

    public String name() { return name; }

    public int size() { return items.size(); }

    public boolean isEmpty() { return items.isEmpty(); }

    public Value get(int index) { return items.get(index); }

    /** Read-only view of the cells. */
    public List<Value> items() { return items; }

    /** Mutable copy of the cells. */
    public List<Value> toArray() { return new ArrayList<>(items); }

    // ---- transforms ----

    public Series lambda(ValueFunction fn) {
        return lambda(fn, name);
    }

    public Series lambda(ValueFunction fn, String newName) {
        List<Object> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) out.add(fn.apply(items.get(i), i));
        return new Series(out, newName);
    }

    public Series concat(List<?> newItems) {
        return concat(newItems, name);
    }

    public Series concat(List<?> newItems, String newName) {
        List<Object> out = new ArrayList<>(items.size() + newItems.size());
        out.addAll(items);
        out.addAll(newItems);
        return new Series(out, newName);
    }

    public Series toUpper() {
        return lambda((v, i) -> v.isText() ? Value.of(v.asText().toUpperCase(Locale.ROOT)) : v);
    }

    public Series toLower() {
        return lambda((v, i) -> v.isText() ? Value.of(v.asText().toLowerCase(Locale.ROOT)) : v);
    }

    // ---- statistics ----

    /** Sum of all number cells (including infinities and NaN); other cells count as 0. Empty gives 0. */
    public double sum() {
        double acc = 0.0;
        for (Value v : items) {
            if (v.isNumber()) acc += v.asDouble();
        }
        return acc;
    }

    public OptionalDouble max() {
        double best = Double.NEGATIVE_INFINITY;
        for (Value v : items) {
            double d = v.isValidNumber() ? v.asDouble() : Double.NEGATIVE_INFINITY;
            if (d > best) best = d;
        }
        return Double.isFinite(best) ? OptionalDouble.of(best) : OptionalDouble.empty();
    }

    public OptionalDouble min() {
        double best = Double.POSITIVE_INFINITY;
        for (Value v : items) {
            double d = v.isValidNumber() ? v.asDouble() : Double.POSITIVE_INFINITY;
            if (d < best) best = d;
        }
        return Double.isFinite(best) ? OptionalDouble.of(best) : OptionalDouble.empty();
    }

    /**
     * Mean of the valid numeric subset. Empty Series has no mean; a zero total gives 0
     * even when no cell is numeric.
     */
    public OptionalDouble mean() {
        if (items.isEmpty()) return OptionalDouble.empty();
        double[] valid = validNumbers();
        double total = 0.0;
        for (double d : valid) total += d;
        if (total == 0.0) return OptionalDouble.of(0.0);
        return OptionalDouble.of(total / valid.length);
    }

    public OptionalDouble median() {
        return orderStatistic(validNumbers(), 0.5);
    }

    /**
     * Linear-interpolated quantile of the valid numeric subset at rank {@code p * (n - 1)}.
     * {@code quantile(0)} is the minimum, {@code quantile(1)} the maximum, {@code quantile(0.5)} the median.
     */
    public OptionalDouble quantile(double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Quantile must be within [0, 1] but was " + p);
        }
        return orderStatistic(validNumbers(), p);
    }

    private static OptionalDouble orderStatistic(double[] sorted, double p) {
        int n = sorted.length;
        if (n == 0) return OptionalDouble.empty();
        if (n == 1) return OptionalDouble.of(sorted[0]);
        double rank = p * (n - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double frac = rank - lo;
        if (lo == hi || frac == 0.0) return OptionalDouble.of(sorted[lo]);
        // at frac == 0.5 this is exactly (a + b) / 2
        return OptionalDouble.of(sorted[lo] * (1.0 - frac) + sorted[hi] * frac);
    }

    /** Valid numeric subset, ascending. */
    private double[] validNumbers() {
        double[] buf = new double[items.size()];
        int n = 0;
        for (Value v : items) {
            if (v.isValidNumber()) buf[n++] = v.asDouble();
        }
        double[] sorted = Arrays.copyOf(buf, n);
        Arrays.sort(sorted);
        return sorted;
    }

    // ---- fill family ----

    /**
     * Replaces every cell equal to one of {@code findValues} with {@code fillValue}.
     * NaN matches NaN. A {@code null} array stands for a single {@code null} target, so it finds NULL cells.
     */
    public Series fill(Object fillValue, Object... findValues) {
        Object[] wanted = findValues != null ? findValues : new Object[] { null };
        Value replacement = Value.from(fillValue);
        Set<Value> targets = new HashSet<>();
        for (Object f : wanted) targets.add(Value.from(f));
        return lambda((v, i) -> targets.contains(v) ? replacement : v);
    }

    /** Replaces UNDEFINED, NULL and NaN. */
    public Series fillNullish(Object fillValue) {
        return fill(fillValue, Value.UNDEFINED, Value.NULL, Value.NaN);
    }

    /** Replaces UNDEFINED, NULL, NaN, 0, "" and false. */
    public Series fillFalsey(Object fillValue) {
        return fill(fillValue, Value.UNDEFINED, Value.NULL, Value.NaN, ZERO, EMPTY_TEXT, Value.FALSE);
    }

    public Series forwardFill() {
        return forwardFill(Value::isTruthy);
    }

    /**
     * Carries the last valid cell forward over invalid ones. A leading run of invalid
     * cells has nothing to copy and stays as is.
     */
    public Series forwardFill(Predicate<Value> isValid) {
        List<Value> out = new ArrayList<>(items);
        Value last = null;
        for (int i = 0; i < out.size(); i++) {
            Value v = out.get(i);
            if (isValid.test(v)) last = v;
            else if (last != null) out.set(i, last);
        }
        return new Series(out, name);
    }

    public Series backwardFill() {
        return backwardFill(Value::isTruthy);
    }

    /**
     * Carries the next valid cell backward over invalid ones. A trailing run of invalid
     * cells stays as is.
     */
    public Series backwardFill(Predicate<Value> isValid) {
        List<Value> out = new ArrayList<>(items);
        Value next = null;
        for (int i = out.size() - 1; i >= 0; i--) {
            Value v = out.get(i);
            if (isValid.test(v)) next = v;
            else if (next != null) out.set(i, next);
        }
        return new Series(out, name);
    }

    // ---- head / tail ----

    public Optional<List<Value>> head() { return head(1); }

    /** First {@code n} cells, or empty when the Series has none. */
    public Optional<List<Value>> head(int n) {
        requireCount(n);
        if (items.isEmpty()) return Optional.empty();
        return Optional.of(new ArrayList<>(items.subList(0, Math.min(n, items.size()))));
    }

    public Optional<List<Value>> tail() { return tail(1); }

    /**
     * Last {@code n} cells, or empty when the Series has none. Any {@code n > size - 1}
     * returns every cell.
     */
    public Optional<List<Value>> tail(int n) {
        requireCount(n);
        if (items.isEmpty()) return Optional.empty();
        if (n > items.size() - 1) return Optional.of(toArray());
        return Optional.of(new ArrayList<>(items.subList(items.size() - n, items.size())));
    }

    private static void requireCount(int n) {
        if (n < 0) throw new IllegalArgumentException("Count must be non-negative but was " + n);
    }

    @Override
    public String toString() {
        return "Series(" + name + ")" + items;
    }
}
