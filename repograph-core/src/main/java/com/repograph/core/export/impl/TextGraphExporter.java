package com.repograph.core.export.impl;

import com.repograph.core.export.GraphExporter;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;

/**
 * Exports one line per relationship followed by the run summary.
 *
 * <pre>
 * src/index.ts -> src/utils.ts [import] line 1 (./utils)
 * </pre>
 */
public class TextGraphExporter implements GraphExporter {

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Exporter";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String export(RelationshipGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (Relationship rel : graph.relationships()) {
            sb.append(format(rel)).append("\n");
        }
        sb.append(graph.statistics().getSummary()).append("\n");
        return sb.toString();
    }

    /**
     * Formats a single relationship.
     *
     * @param rel relationship
     * @return line without terminator
     */
    public static String format(Relationship rel) {
        StringBuilder line = new StringBuilder()
            .append(rel.fromFile()).append(" -> ").append(rel.toFile())
            .append(" [").append(rel.kind().id()).append("]");
        if (rel.lineNumber() != null) {
            line.append(" line ").append(rel.lineNumber());
        }
        if (rel.identifier() != null) {
            line.append(" (").append(rel.identifier()).append(")");
        }
        return line.toString();
    }
}
