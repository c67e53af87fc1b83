package io.schemadrift.core.error;

/**
 * Abstract base for all schema-drift exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SchemaLoadException} or {@link SchemaUpdateException}.
 *
 * <p>Detected data discrepancies are never reported through exceptions. They surface as
 * {@code Description}s on the update result; exceptions are reserved for structural
 * preconditions that abort the whole call.
 */
public abstract class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        UPDATE
    }

    private final String featureName;
    private final Phase phase;

    protected SchemaException(String message, String featureName, Phase phase) {
        super(message);
        this.featureName = featureName;
        this.phase = phase;
    }

    protected SchemaException(String message, Throwable cause, String featureName, Phase phase) {
        super(message, cause);
        this.featureName = featureName;
        this.phase = phase;
    }

    /** The feature or column that triggered the error, or {@code null} if not attributable. */
    public String featureName() {
        return featureName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
