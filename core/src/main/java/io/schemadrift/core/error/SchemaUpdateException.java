package io.schemadrift.core.error;

/**
 * Abstract parent for update-time errors. Thrown by {@code SchemaEngine.update()} before any
 * mutation takes place, so a failed update never leaves a partially updated schema behind.
 */
public abstract class SchemaUpdateException extends SchemaException {

    private static final long serialVersionUID = 1L;

    protected SchemaUpdateException(String message, String featureName) {
        super(message, featureName, Phase.UPDATE);
    }
}
