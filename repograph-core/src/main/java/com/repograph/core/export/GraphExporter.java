package com.repograph.core.export;

import com.repograph.core.model.RelationshipGraph;

/**
 * Interface for exporters that serialize a relationship graph into a text format.
 *
 * <p>Exporters are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.repograph.core.export.GraphExporter}
 */
public interface GraphExporter {

    /**
     * Returns unique identifier for this exporter.
     *
     * <p>Used for referencing the exporter in configuration. Lowercase, e.g. "json".
     *
     * @return unique exporter identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this exporter.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension of the exported document, without dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Serializes the graph.
     *
     * @param graph relationship graph
     * @return exported document
     */
    String export(RelationshipGraph graph);
}
