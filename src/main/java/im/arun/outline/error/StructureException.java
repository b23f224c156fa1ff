package im.arun.outline.error;

/**
 * Raised when text cannot be turned into a forest at all.
 */
public class StructureException extends Exception {
    private final StructureError error;

    public StructureException(StructureError error, String message) {
        super(message);
        this.error = error;
    }

    public StructureError getError() {
        return error;
    }
}
