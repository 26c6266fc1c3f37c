package com.repograph.core.model;

import java.util.Objects;

/**
 * A directed, typed edge between two indexed files.
 *
 * <p>Both endpoints are paths present in the {@code FileIndex} the relationship was
 * resolved against; the builder never creates an edge to an unresolved target.
 *
 * @param fromFile path of the referencing file
 * @param toFile path of the referenced file
 * @param kind relationship kind
 * @param lineNumber 1-based line of the reference, may be null
 * @param identifier raw reference text or type name that produced the edge, may be null
 */
public record Relationship(
    String fromFile,
    String toFile,
    RelationshipKind kind,
    Integer lineNumber,
    String identifier
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(fromFile, "fromFile must not be null");
        Objects.requireNonNull(toFile, "toFile must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates an import relationship.
     *
     * @param fromFile referencing file
     * @param toFile referenced file
     * @param lineNumber 1-based line number
     * @param identifier raw reference text
     * @return import relationship
     */
    public static Relationship importOf(String fromFile, String toFile, int lineNumber, String identifier) {
        return new Relationship(fromFile, toFile, RelationshipKind.IMPORT, lineNumber, identifier);
    }
}
