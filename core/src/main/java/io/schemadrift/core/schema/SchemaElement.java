package io.schemadrift.core.schema;

/**
 * Common identity of the schema's column-level entries. Elements are never removed once created;
 * they are soft-deleted through {@link #deprecate()} so schema evolution stays auditable.
 */
public sealed interface SchemaElement permits Feature, SparseFeature {

    /** Unique name within the schema. */
    String name();

    boolean isDeprecated();

    /** Marks the element deprecated. Idempotent. */
    void deprecate();
}
