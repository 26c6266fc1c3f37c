package com.repograph.core.model;

import java.util.Objects;

/**
 * An unresolved textual reference extracted from one file.
 *
 * @param text raw reference text, e.g. {@code ./utils} or {@code app.config}
 * @param lineNumber 1-based line of the statement
 * @param kind syntactic form of the reference
 * @param sourceFile path of the file the reference was extracted from
 */
public record RawReference(
    String text,
    int lineNumber,
    ReferenceKind kind,
    String sourceFile
) {
    /**
     * Compact constructor with validation.
     */
    public RawReference {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
    }
}
