package com.repograph.core.graph;

import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipKind;
import com.repograph.core.resolver.impl.swift.TypeDeclaration;

import java.util.List;

/**
 * Analyzer for Swift, where files reference each other's types without imports.
 *
 * <p>A file depends on every other Swift file declaring a type whose name occurs in it as a
 * whole word. The edge points from the using file to the declaring file; its line number is
 * the declaration's line and its identifier the type name. A file declaring a type is never
 * linked to the files that use it, only the reverse.
 */
public class SwiftUsageAnalyzer implements LanguageAnalyzer {

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.SWIFT;
    }

    @Override
    public FileAnalysis analyze(FileRecord file, AnalysisContext context) {
        List<TypeDeclaration> used = context.typeDeclarations().usedBy(file);
        List<Relationship> relationships = used.stream()
            .map(declaration -> new Relationship(
                file.path(),
                declaration.file(),
                RelationshipKind.IMPORT,
                declaration.lineNumber(),
                declaration.name()))
            .toList();
        return new FileAnalysis(relationships, relationships.size());
    }
}
