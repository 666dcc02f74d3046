package df.engine.catalog;

/**
 * Raised when a row's key set disagrees with the schema of the frame it is added to.
 */
public class SchemaMismatchException extends IllegalArgumentException {
    public SchemaMismatchException(String message) {
        super(message);
    }
}
