package com.repograph.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Language} and {@link LanguageFamily}.
 */
class LanguageTest {

    @Test
    void detect_knownExtensions_ignoresCase() {
        assertThat(Language.detect("src/App.TSX")).isEqualTo(Language.TYPESCRIPT_REACT);
        assertThat(Language.detect("main.go")).isEqualTo(Language.GO);
        assertThat(Language.detect("lib/widget.hpp")).isEqualTo(Language.CPP_HEADER);
        assertThat(Language.detect("lib/widget.cc")).isEqualTo(Language.CPP);
    }

    @Test
    void detect_unknownOrMissingExtension_returnsOther() {
        assertThat(Language.detect("Makefile")).isEqualTo(Language.OTHER);
        assertThat(Language.detect("notes.")).isEqualTo(Language.OTHER);
        assertThat(Language.detect("styles.css")).isEqualTo(Language.OTHER);
        assertThat(Language.detect(null)).isEqualTo(Language.OTHER);
    }

    @Test
    void fromDisplayName_acceptsScannerAndLegacyTags() {
        assertThat(Language.fromDisplayName("TypeScript React")).isEqualTo(Language.TYPESCRIPT_REACT);
        assertThat(Language.fromDisplayName("TSX")).isEqualTo(Language.TYPESCRIPT_REACT);
        assertThat(Language.fromDisplayName("JSX")).isEqualTo(Language.JAVASCRIPT_REACT);
        assertThat(Language.fromDisplayName("C++ Header")).isEqualTo(Language.CPP_HEADER);
        assertThat(Language.fromDisplayName("Kotlin")).isEqualTo(Language.OTHER);
    }

    @Test
    void family_cHeadersDispatchToCFamily() {
        assertThat(Language.C_HEADER.family()).isEqualTo(LanguageFamily.C_FAMILY);
        assertThat(Language.CPP_HEADER.family()).isEqualTo(LanguageFamily.C_FAMILY);
        assertThat(Language.OTHER.family()).isEqualTo(LanguageFamily.NONE);
    }

    @Test
    void fromId_acceptsIdsAndEnumNames() {
        assertThat(LanguageFamily.fromId("c-family")).isEqualTo(LanguageFamily.C_FAMILY);
        assertThat(LanguageFamily.fromId("PYTHON")).isEqualTo(LanguageFamily.PYTHON);
        assertThatThrownBy(() -> LanguageFamily.fromId("cobol"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cobol");
    }
}
