package com.repograph.core.graph;

import com.repograph.core.model.Relationship;

import java.util.List;

/**
 * Result of analyzing one file.
 *
 * @param relationships resolved relationships, in extraction order
 * @param referencesExtracted raw references the file produced, resolved or not
 */
public record FileAnalysis(List<Relationship> relationships, int referencesExtracted) {

    public FileAnalysis {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        referencesExtracted = Math.max(0, referencesExtracted);
    }

    /**
     * Returns an analysis with no references.
     *
     * @return empty analysis
     */
    public static FileAnalysis empty() {
        return new FileAnalysis(List.of(), 0);
    }
}
