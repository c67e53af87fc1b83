package io.schemadrift.core.error;

/** Thrown when a YAML/JSON document is unreadable, malformed, or violates its JSON Schema. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String featureName, String source) {
        super(message, featureName, source);
    }

    public SchemaParseException(String message, Throwable cause, String featureName, String source) {
        super(message, cause, featureName, source);
    }
}
