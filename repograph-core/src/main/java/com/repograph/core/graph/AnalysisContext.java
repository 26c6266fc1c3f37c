package com.repograph.core.graph;

import com.repograph.core.index.FileIndex;
import com.repograph.core.resolver.impl.swift.TypeDeclarationIndex;

import java.util.Objects;

/**
 * Read-only state shared by every file analysis of one run.
 *
 * @param index file index of the repository snapshot
 * @param typeDeclarations Swift type declarations of the same snapshot
 */
public record AnalysisContext(FileIndex index, TypeDeclarationIndex typeDeclarations) {

    public AnalysisContext {
        Objects.requireNonNull(index, "index must not be null");
        if (typeDeclarations == null) {
            typeDeclarations = TypeDeclarationIndex.empty();
        }
    }
}
