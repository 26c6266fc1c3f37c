package com.repograph.core.graph;

import com.repograph.core.extractor.impl.cfamily.IncludeReferenceExtractor;
import com.repograph.core.extractor.impl.go.GoReferenceExtractor;
import com.repograph.core.extractor.impl.java.JavaReferenceExtractor;
import com.repograph.core.extractor.impl.javascript.JavaScriptReferenceExtractor;
import com.repograph.core.extractor.impl.python.PythonReferenceExtractor;
import com.repograph.core.extractor.impl.rust.RustReferenceExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.resolver.impl.cfamily.IncludeReferenceResolver;
import com.repograph.core.resolver.impl.go.GoReferenceResolver;
import com.repograph.core.resolver.impl.java.JavaReferenceResolver;
import com.repograph.core.resolver.impl.javascript.JavaScriptReferenceResolver;
import com.repograph.core.resolver.impl.python.PythonReferenceResolver;
import com.repograph.core.resolver.impl.rust.RustReferenceResolver;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch table from language family to analyzer.
 *
 * <p>The table is filled by an exhaustive switch over {@link LanguageFamily}, so adding a
 * family without deciding how to analyze it does not compile.
 *
 * <pre>{@code
 * LanguageAnalyzer analyzer = LanguageStrategies.standard().forFamily(file.language().family());
 * FileAnalysis analysis = analyzer.analyze(file, context);
 * }</pre>
 */
public final class LanguageStrategies {

    private final Map<LanguageFamily, LanguageAnalyzer> analyzers;

    private LanguageStrategies(Map<LanguageFamily, LanguageAnalyzer> analyzers) {
        this.analyzers = analyzers;
    }

    /**
     * Returns the standard table covering every supported language.
     *
     * @return dispatch table
     */
    public static LanguageStrategies standard() {
        Map<LanguageFamily, LanguageAnalyzer> analyzers = new EnumMap<>(LanguageFamily.class);
        for (LanguageFamily family : LanguageFamily.values()) {
            analyzers.put(family, createAnalyzer(family));
        }
        return new LanguageStrategies(analyzers);
    }

    private static LanguageAnalyzer createAnalyzer(LanguageFamily family) {
        return switch (family) {
            case JAVASCRIPT -> new ImportAnalyzer(new JavaScriptReferenceExtractor(), new JavaScriptReferenceResolver());
            case PYTHON -> new ImportAnalyzer(new PythonReferenceExtractor(), new PythonReferenceResolver());
            case JAVA -> new ImportAnalyzer(new JavaReferenceExtractor(), new JavaReferenceResolver());
            case GO -> new ImportAnalyzer(new GoReferenceExtractor(), new GoReferenceResolver());
            case C_FAMILY -> new ImportAnalyzer(new IncludeReferenceExtractor(), new IncludeReferenceResolver());
            case RUST -> new ImportAnalyzer(new RustReferenceExtractor(), new RustReferenceResolver());
            case SWIFT -> new SwiftUsageAnalyzer();
            case NONE -> LanguageAnalyzer.none(LanguageFamily.NONE);
        };
    }

    /**
     * Returns a copy of this table with the analyzer of one family replaced.
     *
     * @param family family to replace
     * @param analyzer analyzer to use for it
     * @return new dispatch table
     */
    public LanguageStrategies with(LanguageFamily family, LanguageAnalyzer analyzer) {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Map<LanguageFamily, LanguageAnalyzer> copy = new EnumMap<>(analyzers);
        copy.put(family, analyzer);
        return new LanguageStrategies(copy);
    }

    /**
     * Returns the analyzer for a family.
     *
     * @param family language family, null treated as {@link LanguageFamily#NONE}
     * @return analyzer, never null
     */
    public LanguageAnalyzer forFamily(LanguageFamily family) {
        return analyzers.get(family == null ? LanguageFamily.NONE : family);
    }
}
