package com.repograph.core.graph;

import com.repograph.core.model.LanguageFamily;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LanguageStrategies} and {@link ImportAnalyzer}.
 */
class LanguageStrategiesTest {

    @Test
    void standard_hasAnalyzerForEveryFamily() {
        LanguageStrategies strategies = LanguageStrategies.standard();

        assertThat(Arrays.asList(LanguageFamily.values()))
            .allSatisfy(family -> assertThat(strategies.forFamily(family).getFamily()).isEqualTo(family));
        assertThat(strategies.forFamily(null).getFamily()).isEqualTo(LanguageFamily.NONE);
    }

    @Test
    void standard_pairsExtractorAndResolverOfSameFamily() {
        LanguageAnalyzer analyzer = LanguageStrategies.standard().forFamily(LanguageFamily.C_FAMILY);

        assertThat(analyzer).isInstanceOf(ImportAnalyzer.class);
        ImportAnalyzer imports = (ImportAnalyzer) analyzer;
        assertThat(imports.getExtractor().getFamily()).isEqualTo(LanguageFamily.C_FAMILY);
        assertThat(imports.getResolver().getFamily()).isEqualTo(LanguageFamily.C_FAMILY);
        assertThat(LanguageStrategies.standard().forFamily(LanguageFamily.SWIFT)).isInstanceOf(SwiftUsageAnalyzer.class);
    }

    @Test
    void with_replacesOnlyOneFamily() {
        LanguageStrategies standard = LanguageStrategies.standard();
        LanguageAnalyzer silent = LanguageAnalyzer.none(LanguageFamily.GO);

        LanguageStrategies custom = standard.with(LanguageFamily.GO, silent);

        assertThat(custom.forFamily(LanguageFamily.GO)).isSameAs(silent);
        assertThat(standard.forFamily(LanguageFamily.GO)).isNotSameAs(silent);
        assertThat(custom.forFamily(LanguageFamily.JAVA)).isInstanceOf(ImportAnalyzer.class);
    }

    @Test
    void importAnalyzer_rejectsMismatchedFamilies() {
        ImportAnalyzer go = (ImportAnalyzer) LanguageStrategies.standard().forFamily(LanguageFamily.GO);
        ImportAnalyzer rust = (ImportAnalyzer) LanguageStrategies.standard().forFamily(LanguageFamily.RUST);

        assertThatThrownBy(() -> new ImportAnalyzer(go.getExtractor(), rust.getResolver()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
