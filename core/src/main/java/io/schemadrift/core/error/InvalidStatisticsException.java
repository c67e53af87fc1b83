package io.schemadrift.core.error;

/** Thrown when a statistics snapshot is structurally unusable (blank or duplicate column names). */
public final class InvalidStatisticsException extends SchemaUpdateException {

    private static final long serialVersionUID = 1L;

    public InvalidStatisticsException(String message, String featureName) {
        super(message, featureName);
    }
}
