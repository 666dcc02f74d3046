package df.engine.exec;

/**
 * Slice with a negative start, an end past the last row, or a non-positive step.
 */
public class InvalidSliceException extends IllegalArgumentException {
    public InvalidSliceException(String message) {
        super(message);
    }
}
