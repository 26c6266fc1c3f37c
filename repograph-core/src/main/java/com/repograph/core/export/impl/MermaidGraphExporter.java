package com.repograph.core.export.impl;

import com.repograph.core.export.GraphExporter;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.model.RelationshipKind;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Exports the graph as a Mermaid flowchart inside a Markdown document.
 *
 * <p>Every connected file becomes a node labelled with its path; every relationship an edge
 * labelled with the reference text. Imports are drawn as solid arrows, other kinds as dotted
 * arrows.
 *
 * <p><b>Example output:</b>
 * <pre>
 * # Relationship Graph
 *
 * ```mermaid
 * graph LR
 *   src_index_ts["src/index.ts"]
 *   src_utils_ts["src/utils.ts"]
 *   src_index_ts -->|"./utils"| src_utils_ts
 * ```
 * </pre>
 */
public class MermaidGraphExporter implements GraphExporter {

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_LR = "graph LR\n";
    private static final String NO_RELATIONSHIPS_NODE = "  empty[\"No relationships found\"]\n";

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public String getDisplayName() {
        return "Mermaid Flowchart Exporter";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String export(RelationshipGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Relationship Graph\n\n");
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_LR);

        if (graph.isEmpty()) {
            sb.append(NO_RELATIONSHIPS_NODE);
        } else {
            Map<String, String> nodeIds = assignNodeIds(graph);
            appendNodes(sb, nodeIds);
            appendEdges(sb, graph, nodeIds);
        }

        sb.append(CODE_BLOCK_END);
        sb.append("\n").append(graph.statistics().getSummary()).append("\n");
        return sb.toString();
    }

    private Map<String, String> assignNodeIds(RelationshipGraph graph) {
        Map<String, String> nodeIds = new LinkedHashMap<>();
        Set<String> usedIds = new HashSet<>();
        for (String path : graph.connectedFiles()) {
            String base = sanitizeId(path);
            String id = base;
            int suffix = 2;
            while (!usedIds.add(id)) {
                id = base + "_" + suffix++;
            }
            nodeIds.put(path, id);
        }
        return nodeIds;
    }

    private void appendNodes(StringBuilder sb, Map<String, String> nodeIds) {
        for (Map.Entry<String, String> entry : nodeIds.entrySet()) {
            sb.append("  ").append(entry.getValue()).append("[\"").append(escape(entry.getKey())).append("\"]\n");
        }
    }

    private void appendEdges(StringBuilder sb, RelationshipGraph graph, Map<String, String> nodeIds) {
        for (Relationship rel : graph.relationships()) {
            String arrow = rel.kind() == RelationshipKind.IMPORT ? " -->" : " -.->";
            sb.append("  ").append(nodeIds.get(rel.fromFile())).append(arrow);
            if (rel.identifier() != null && !rel.identifier().isBlank()) {
                sb.append("|\"").append(escape(rel.identifier())).append("\"|");
            }
            sb.append(" ").append(nodeIds.get(rel.toFile())).append("\n");
        }
    }

    private String sanitizeId(String id) {
        if (id == null || id.isEmpty()) {
            return "unknown";
        }
        String sanitized = id.replaceAll(ID_SANITIZATION_PATTERN, "_");
        return Character.isDigit(sanitized.charAt(0)) ? "f_" + sanitized : sanitized;
    }

    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
