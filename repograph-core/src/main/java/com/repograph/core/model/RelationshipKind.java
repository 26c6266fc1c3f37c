package com.repograph.core.model;

/**
 * Types of relationships between two files of the repository.
 */
public enum RelationshipKind {
    /** The source file imports, includes or uses the target file. */
    IMPORT("import"),

    /** The source file re-exports symbols of the target file. */
    EXPORT("export"),

    /** The source file calls a function defined in the target file. */
    FUNCTION_CALL("function-call"),

    /** The source file reads or writes a variable defined in the target file. */
    VARIABLE_REF("variable-ref");

    private final String id;

    RelationshipKind(String id) {
        this.id = id;
    }

    /**
     * Returns the lower-case identifier used in exported graphs.
     *
     * @return kind identifier
     */
    public String id() {
        return id;
    }
}
