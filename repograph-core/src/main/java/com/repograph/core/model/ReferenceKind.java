package com.repograph.core.model;

/**
 * Syntactic form of an extracted raw reference.
 */
public enum ReferenceKind {
    /** {@code import} statements (JS/TS, Python, Java, Go). */
    IMPORT,

    /** JS/TS {@code export ... from} re-export statements. */
    EXPORT,

    /** C/C++ {@code #include} directives. */
    INCLUDE,

    /** Rust {@code use} declarations. */
    USE,

    /** Rust {@code mod} declarations. */
    MODULE,

    /** Swift top-level type declarations, matched against usages in other files. */
    DECLARATION
}
