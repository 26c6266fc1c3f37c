package com.repograph.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest extends CliTestBase {

    @Test
    void list_languages_showsFamiliesAndExtensions() {
        int exitCode = execute("list", "languages");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Supported Languages:")
            .contains("  • c-family")
            .contains("    C++ (.cc, .cpp, .cxx)")
            .contains("    C++ Header (.hpp)")
            .contains("  • swift")
            .doesNotContain("• none");
    }

    @Test
    void list_exporters_showsRegisteredExporters() {
        int exitCode = execute("list", "exporters");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Exporters:")
            .contains("JSON Exporter (ID: json)")
            .contains("Mermaid Flowchart Exporter (ID: mermaid)")
            .contains("Plain Text Exporter (ID: text)");
    }

    @Test
    void list_unknownType_fails() {
        int exitCode = execute("list", "scanners");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown type: scanners");
    }
}
