package io.schemadrift.core.error;

/**
 * Abstract parent for load-time errors: thrown while reading a schema document or statistics
 * snapshot, or by {@code SchemaEngine.init()}. Carries an additional {@code source} field
 * identifying the file or resource that caused the error.
 */
public abstract class SchemaLoadException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String featureName, String source) {
        super(message, featureName, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String featureName, String source) {
        super(message, cause, featureName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
