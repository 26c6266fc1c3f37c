package com.repograph.core.resolver.impl.swift;

import java.util.Objects;

/**
 * A Swift type declared in an indexed file.
 *
 * @param name type name
 * @param file path of the declaring file
 * @param lineNumber 1-based declaration line
 */
public record TypeDeclaration(String name, String file, int lineNumber) {

    public TypeDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }
}
