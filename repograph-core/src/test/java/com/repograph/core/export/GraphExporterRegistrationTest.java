package com.repograph.core.export;

import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that every bundled exporter is discoverable through {@link ServiceLoader}.
 */
class GraphExporterRegistrationTest {

    @Test
    void serviceLoader_findsBundledExporters() {
        assertThat(ServiceLoader.load(GraphExporter.class))
            .extracting(GraphExporter::getId)
            .containsExactlyInAnyOrder("json", "mermaid", "text");
    }
}
