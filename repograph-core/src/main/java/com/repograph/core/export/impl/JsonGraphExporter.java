package com.repograph.core.export.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repograph.core.export.GraphExporter;
import com.repograph.core.model.GraphStatistics;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.model.RelationshipKind;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Exports the graph as pretty-printed JSON.
 *
 * <p><b>Output shape:</b>
 * <pre>{@code
 * {
 *   "relationships" : [ {
 *     "fromFile" : "src/index.ts",
 *     "toFile" : "src/utils.ts",
 *     "kind" : "import",
 *     "lineNumber" : 1,
 *     "identifier" : "./utils"
 *   } ],
 *   "statistics" : { "filesIndexed" : 2, ..., "byKind" : { "import" : 1, ... } }
 * }
 * }</pre>
 *
 * <p>Absent line numbers and identifiers are omitted.
 */
public class JsonGraphExporter implements GraphExporter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Exporter";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String export(RelationshipGraph graph) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode relationships = root.putArray("relationships");
        for (Relationship rel : graph.relationships()) {
            ObjectNode node = relationships.addObject();
            node.put("fromFile", rel.fromFile());
            node.put("toFile", rel.toFile());
            node.put("kind", rel.kind().id());
            if (rel.lineNumber() != null) {
                node.put("lineNumber", rel.lineNumber());
            }
            if (rel.identifier() != null) {
                node.put("identifier", rel.identifier());
            }
        }
        root.set("statistics", statistics(graph));

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize relationship graph", e);
        }
    }

    private ObjectNode statistics(RelationshipGraph graph) {
        GraphStatistics stats = graph.statistics();
        ObjectNode node = MAPPER.createObjectNode();
        node.put("filesIndexed", stats.filesIndexed());
        node.put("filesAnalyzed", stats.filesAnalyzed());
        node.put("filesSkipped", stats.filesSkipped());
        node.put("filesFailed", stats.filesFailed());
        node.put("referencesExtracted", stats.referencesExtracted());
        node.put("referencesResolved", stats.referencesResolved());
        node.put("unresolvedReferences", stats.unresolvedReferences());
        node.put("resolutionRate", Math.round(stats.getResolutionRate() * 10.0) / 10.0);
        node.put("cancelled", stats.cancelled());

        ObjectNode byKind = node.putObject("byKind");
        for (Map.Entry<RelationshipKind, Integer> entry : graph.countsByKind().entrySet()) {
            byKind.put(entry.getKey().id(), entry.getValue());
        }
        if (!stats.topErrors().isEmpty()) {
            ArrayNode errors = node.putArray("errors");
            stats.topErrors().forEach(errors::add);
        }
        return node;
    }
}
