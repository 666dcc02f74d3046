package df.engine.storage;

import java.util.Objects;

import df.engine.catalog.DataType;

/**
 * A single cell: NUMBER (double), TEXT, BOOLEAN, NULL or UNDEFINED.
 * Immutable. Equality treats NaN as equal to NaN and 0 as equal to -0.
 */
public final class Value {
    public static final Value NULL = new Value(DataType.NULL, null);
    public static final Value UNDEFINED = new Value(DataType.UNDEFINED, null);
    public static final Value NaN = new Value(DataType.NUMBER, Double.NaN);
    public static final Value TRUE = new Value(DataType.BOOLEAN, Boolean.TRUE);
    public static final Value FALSE = new Value(DataType.BOOLEAN, Boolean.FALSE);

    private final DataType type;
    private final Object payload; // Double, String, Boolean or null

    private Value(DataType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value of(double number) {
        return new Value(DataType.NUMBER, number);
    }

    public static Value of(String text) {
        if (text == null) return NULL;
        return new Value(DataType.TEXT, text);
    }

    public static Value of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    /**
     * Converts a plain Java object into a cell. Values pass through unchanged.
     */
    public static Value from(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof Value v) return v;
        if (raw instanceof Number n) return of(n.doubleValue());
        if (raw instanceof Boolean b) return of(b.booleanValue());
        if (raw instanceof CharSequence || raw instanceof Character) return of(raw.toString());
        throw new IllegalArgumentException("Unsupported cell value of type " + raw.getClass().getName());
    }

    public DataType type() { return type; }

    public boolean isNumber() { return type == DataType.NUMBER; }
    public boolean isText() { return type == DataType.TEXT; }
    public boolean isBoolean() { return type == DataType.BOOLEAN; }
    public boolean isUndefined() { return type == DataType.UNDEFINED; }

    /** Finite, non-NaN number. */
    public boolean isValidNumber() {
        return isNumber() && Double.isFinite((Double) payload);
    }

    public double asDouble() {
        if (!isNumber()) throw new IllegalStateException("Not a number: " + this);
        return (Double) payload;
    }

    public String asText() {
        if (!isText()) throw new IllegalStateException("Not text: " + this);
        return (String) payload;
    }

    public boolean asBoolean() {
        if (!isBoolean()) throw new IllegalStateException("Not a boolean: " + this);
        return (Boolean) payload;
    }

    /**
     * Falsey cells are false, 0, NaN, "", NULL and UNDEFINED.
     */
    public boolean isTruthy() {
        return switch (type) {
            case NUMBER -> {
                double d = (Double) payload;
                yield d != 0.0 && !Double.isNaN(d);
            }
            case TEXT -> !((String) payload).isEmpty();
            case BOOLEAN -> (Boolean) payload;
            case NULL, UNDEFINED -> false;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        if (type != other.type) return false;
        if (type == DataType.NUMBER) {
            double a = (Double) payload;
            double b = (Double) other.payload;
            return a == b || (Double.isNaN(a) && Double.isNaN(b));
        }
        return Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        if (type == DataType.NUMBER) {
            double d = (Double) payload;
            return Double.hashCode(d == 0.0 ? 0.0 : d); // -0 hashes like 0
        }
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> formatNumber((Double) payload);
            case TEXT -> (String) payload;
            case BOOLEAN -> payload.toString();
            case NULL -> "null";
            case UNDEFINED -> "undefined";
        };
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
