package com.repograph.core.graph;

import com.repograph.core.model.LanguageFamily;

import java.util.EnumSet;
import java.util.Set;

/**
 * Options for one analysis run.
 *
 * @param parallelism number of worker threads; 1 analyzes on the calling thread
 * @param enabledFamilies language families to analyze; empty means all
 */
public record AnalysisOptions(int parallelism, Set<LanguageFamily> enabledFamilies) {

    public AnalysisOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        enabledFamilies = enabledFamilies == null || enabledFamilies.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(enabledFamilies));
    }

    /**
     * Single-threaded analysis of every language.
     *
     * @return default options
     */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(1, Set.of());
    }

    /**
     * Returns options with the given parallelism and the same language filter.
     *
     * @param threads worker threads
     * @return new options
     */
    public AnalysisOptions withParallelism(int threads) {
        return new AnalysisOptions(threads, enabledFamilies);
    }

    /**
     * Returns options restricted to the given families.
     *
     * @param families families to analyze; empty means all
     * @return new options
     */
    public AnalysisOptions withFamilies(Set<LanguageFamily> families) {
        return new AnalysisOptions(parallelism, families);
    }

    /**
     * Returns true if files of the family should be analyzed.
     *
     * @param family language family
     * @return true when enabled
     */
    public boolean isEnabled(LanguageFamily family) {
        if (family == null || family == LanguageFamily.NONE) {
            return false;
        }
        return enabledFamilies.isEmpty() || enabledFamilies.contains(family);
    }
}
