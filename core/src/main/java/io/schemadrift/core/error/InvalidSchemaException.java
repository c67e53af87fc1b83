package io.schemadrift.core.error;

/**
 * Thrown by {@code SchemaEngine.init()} when the target schema is not empty, or when the supplied
 * document contradicts itself in a way that cannot be repaired (duplicate names, blank names,
 * sparse features referencing unknown features). The target schema is left unchanged.
 */
public final class InvalidSchemaException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public InvalidSchemaException(String message, String featureName, String source) {
        super(message, featureName, source);
    }
}
