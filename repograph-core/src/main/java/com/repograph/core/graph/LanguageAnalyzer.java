package com.repograph.core.graph;

import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;

/**
 * Strategy that turns one file into relationships for a single language family.
 *
 * <p>Implementations must be stateless and total: any content yields a (possibly empty)
 * analysis. They may be called concurrently for different files of the same run.
 */
public interface LanguageAnalyzer {

    /**
     * Returns the language family this analyzer handles.
     *
     * @return language family
     */
    LanguageFamily getFamily();

    /**
     * Analyzes one file.
     *
     * @param file file with content
     * @param context shared read-only state of the run
     * @return relationships from the file plus the number of references considered
     */
    FileAnalysis analyze(FileRecord file, AnalysisContext context);

    /**
     * Analyzer that never produces relationships.
     *
     * @param family family it stands in for
     * @return no-op analyzer
     */
    static LanguageAnalyzer none(LanguageFamily family) {
        return new LanguageAnalyzer() {
            @Override
            public LanguageFamily getFamily() {
                return family;
            }

            @Override
            public FileAnalysis analyze(FileRecord file, AnalysisContext context) {
                return FileAnalysis.empty();
            }
        };
    }
}
