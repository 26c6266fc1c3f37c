package com.repograph.core.export.impl;

import com.repograph.core.model.GraphStatistics;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.model.RelationshipKind;

import java.util.List;

/**
 * Shared graph fixtures for exporter tests.
 */
abstract class ExporterTestBase {

    protected static RelationshipGraph sampleGraph() {
        GraphStatistics statistics = new GraphStatistics.Builder()
            .filesIndexed(3)
            .incrementFilesAnalyzed()
            .incrementFilesAnalyzed()
            .incrementFilesAnalyzed()
            .addReferencesExtracted(3)
            .addReferencesResolved(2)
            .build();
        return new RelationshipGraph(List.of(
            Relationship.importOf("src/index.ts", "src/utils.ts", 1, "./utils"),
            new Relationship("src/index.ts", "src/api/client.ts", RelationshipKind.EXPORT, 2, "./api/client")
        ), statistics);
    }
}
