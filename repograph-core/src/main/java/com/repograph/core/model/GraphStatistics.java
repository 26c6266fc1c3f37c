package com.repograph.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Statistics collected while building a relationship graph.
 *
 * <p>Gives transparency into how much of the repository was analyzed and how many raw
 * references could be resolved to indexed files. Unresolved references are expected: they
 * are imports of external packages that are not part of the scanned tree.
 *
 * @param filesIndexed files present in the index
 * @param filesAnalyzed files whose content was extracted and resolved
 * @param filesSkipped files without content or without a supported language
 * @param filesFailed files whose analysis raised an unexpected error
 * @param referencesExtracted raw references produced by extractors
 * @param referencesResolved relationships emitted
 * @param cancelled true if the run was cancelled before every file was analyzed
 * @param topErrors sample error messages (max 10)
 */
public record GraphStatistics(
    int filesIndexed,
    int filesAnalyzed,
    int filesSkipped,
    int filesFailed,
    int referencesExtracted,
    int referencesResolved,
    boolean cancelled,
    List<String> topErrors
) {
    private static final int MAX_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public GraphStatistics {
        filesIndexed = Math.max(0, filesIndexed);
        filesAnalyzed = Math.max(0, filesAnalyzed);
        filesSkipped = Math.max(0, filesSkipped);
        filesFailed = Math.max(0, filesFailed);
        referencesExtracted = Math.max(0, referencesExtracted);
        referencesResolved = Math.max(0, referencesResolved);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    /**
     * Creates an empty statistics instance (nothing analyzed).
     *
     * @return empty statistics
     */
    public static GraphStatistics empty() {
        return new GraphStatistics(0, 0, 0, 0, 0, 0, false, List.of());
    }

    /**
     * Returns the number of extracted references that did not resolve to an indexed file.
     *
     * <p>Swift files count each used type declaration as both extracted and resolved, so
     * they never add to this number.
     *
     * @return unresolved reference count
     */
    public int unresolvedReferences() {
        return Math.max(0, referencesExtracted - referencesResolved);
    }

    /**
     * Calculates the share of extracted references that resolved.
     *
     * @return resolution rate as percentage (0.0 to 100.0), or 0 if nothing was extracted
     */
    public double getResolutionRate() {
        if (referencesExtracted == 0) {
            return 0.0;
        }
        return Math.min(100.0, (referencesResolved * 100.0) / referencesExtracted);
    }

    /**
     * Returns true if any file failed to analyze.
     *
     * @return true if at least one file failed
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
            "Indexed: %d, Analyzed: %d, Skipped: %d, Failed: %d, References: %d, Resolved: %d (%.1f%%)%s",
            filesIndexed,
            filesAnalyzed,
            filesSkipped,
            filesFailed,
            referencesExtracted,
            referencesResolved,
            getResolutionRate(),
            cancelled ? " [cancelled]" : ""
        );
    }

    /**
     * Builder for accumulating statistics file by file.
     *
     * <p>Not thread-safe; the graph builder merges per-file results on a single thread.
     */
    public static class Builder {
        private int filesIndexed = 0;
        private int filesAnalyzed = 0;
        private int filesSkipped = 0;
        private int filesFailed = 0;
        private int referencesExtracted = 0;
        private int referencesResolved = 0;
        private boolean cancelled = false;
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesIndexed(int count) {
            this.filesIndexed = count;
            return this;
        }

        public Builder incrementFilesAnalyzed() {
            this.filesAnalyzed++;
            return this;
        }

        public Builder incrementFilesSkipped() {
            this.filesSkipped++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder addReferencesExtracted(int count) {
            this.referencesExtracted += count;
            return this;
        }

        public Builder addReferencesResolved(int count) {
            this.referencesResolved += count;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder addError(String errorDetail) {
            if (topErrors.size() < MAX_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public GraphStatistics build() {
            return new GraphStatistics(
                filesIndexed,
                filesAnalyzed,
                filesSkipped,
                filesFailed,
                referencesExtracted,
                referencesResolved,
                cancelled,
                topErrors
            );
        }
    }
}
