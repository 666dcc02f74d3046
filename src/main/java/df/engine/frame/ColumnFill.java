package df.engine.frame;

import df.engine.storage.Row;
import df.engine.storage.Value;

/**
 * Source of the cells for {@link DataFrame#addColumn}: either one constant for every row or a
 * generator called per row. The caller picks the variant explicitly, so a constant is never
 * mistaken for a generator.
 */
public abstract class ColumnFill {

    private ColumnFill() {}

    public abstract Value valueFor(Row row, int index);

    public static ColumnFill constant(Object value) {
        return new Constant(Value.from(value));
    }

    /** The generator may return a Value or any plain object accepted by {@link Value#from(Object)}. */
    public static ColumnFill generator(RowFunction<?> fn) {
        if (fn == null) throw new IllegalArgumentException("Generator must not be null");
        return new Generator(fn);
    }

    public static final class Constant extends ColumnFill {
        private final Value value;

        private Constant(Value value) { this.value = value; }

        public Value value() { return value; }

        @Override
        public Value valueFor(Row row, int index) { return value; }

        @Override
        public String toString() { return "Constant(" + value + ")"; }
    }

    public static final class Generator extends ColumnFill {
        private final RowFunction<?> fn;

        private Generator(RowFunction<?> fn) { this.fn = fn; }

        @Override
        public Value valueFor(Row row, int index) { return Value.from(fn.apply(row, index)); }

        @Override
        public String toString() { return "Generator"; }
    }
}
