package com.repograph.core.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The edge list produced by one analysis run.
 *
 * <p>Relationships are kept in insertion order and never mutated. The graph is a directed
 * multigraph: cycles and repeated edges between the same pair of files are allowed, since
 * every import statement yields its own relationship. Consumers that want one edge per
 * {@code (fromFile, toFile, kind)} call {@link #distinct()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RelationshipGraph graph = new RelationshipGraphBuilder().analyze(index);
 * for (Relationship rel : graph.outgoing("src/index.ts")) {
 *     drawConnection(positions.get(rel.fromFile()), positions.get(rel.toFile()));
 * }
 * }</pre>
 *
 * @param relationships relationships in insertion order
 * @param statistics statistics of the run that produced the graph
 */
public record RelationshipGraph(
    List<Relationship> relationships,
    GraphStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public RelationshipGraph {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        if (statistics == null) {
            statistics = GraphStatistics.empty();
        }
    }

    /**
     * Creates an empty graph.
     *
     * @return graph without relationships
     */
    public static RelationshipGraph empty() {
        return new RelationshipGraph(List.of(), GraphStatistics.empty());
    }

    public int size() {
        return relationships.size();
    }

    public boolean isEmpty() {
        return relationships.isEmpty();
    }

    /**
     * Returns the relationships whose source is the given file.
     *
     * @param path file path
     * @return outgoing relationships in insertion order
     */
    public List<Relationship> outgoing(String path) {
        return filter(rel -> rel.fromFile().equals(path));
    }

    /**
     * Returns the relationships whose target is the given file.
     *
     * @param path file path
     * @return incoming relationships in insertion order
     */
    public List<Relationship> incoming(String path) {
        return filter(rel -> rel.toFile().equals(path));
    }

    /**
     * Returns the relationships touching the given file on either end.
     *
     * @param path file path
     * @return incoming and outgoing relationships in insertion order
     */
    public List<Relationship> connectedTo(String path) {
        return filter(rel -> rel.fromFile().equals(path) || rel.toFile().equals(path));
    }

    /**
     * Returns the relationships from one file to another.
     *
     * @param fromFile source path
     * @param toFile target path
     * @return matching relationships in insertion order
     */
    public List<Relationship> between(String fromFile, String toFile) {
        return filter(rel -> rel.fromFile().equals(fromFile) && rel.toFile().equals(toFile));
    }

    /**
     * Returns the relationships of one kind.
     *
     * @param kind relationship kind
     * @return matching relationships in insertion order
     */
    public List<Relationship> ofKind(RelationshipKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return filter(rel -> rel.kind() == kind);
    }

    /**
     * Counts relationships per kind. Kinds without relationships are reported as zero.
     *
     * @return counts keyed by kind, in enum order
     */
    public Map<RelationshipKind, Integer> countsByKind() {
        Map<RelationshipKind, Integer> counts = new EnumMap<>(RelationshipKind.class);
        for (RelationshipKind kind : RelationshipKind.values()) {
            counts.put(kind, 0);
        }
        for (Relationship rel : relationships) {
            counts.merge(rel.kind(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Returns every file path that appears as a source or target, in first-seen order.
     *
     * @return connected file paths
     */
    public Set<String> connectedFiles() {
        Set<String> files = new LinkedHashSet<>();
        for (Relationship rel : relationships) {
            files.add(rel.fromFile());
            files.add(rel.toFile());
        }
        return files;
    }

    /**
     * Returns a copy of this graph with one relationship per {@code (fromFile, toFile, kind)},
     * keeping the first occurrence of each.
     *
     * @return merged graph with the same statistics
     */
    public RelationshipGraph distinct() {
        Set<List<Object>> seen = new LinkedHashSet<>();
        List<Relationship> merged = new ArrayList<>();
        for (Relationship rel : relationships) {
            if (seen.add(List.of(rel.fromFile(), rel.toFile(), rel.kind()))) {
                merged.add(rel);
            }
        }
        return new RelationshipGraph(merged, statistics);
    }

    private List<Relationship> filter(Predicate<Relationship> predicate) {
        return relationships.stream().filter(predicate).toList();
    }
}
