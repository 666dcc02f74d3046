package df.engine.exec;

/**
 * Positional selection was attempted on a frame with zero rows.
 */
public class EmptyFrameException extends IllegalStateException {
    public EmptyFrameException(String message) {
        super(message);
    }
}
