package com.repograph.core.graph;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.DirectoryNode;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.GraphStatistics;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.resolver.impl.swift.TypeDeclarationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the relationship graph of a repository snapshot.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Sort the index's files by path so output is deterministic</li>
 *   <li>Pre-index Swift type declarations once, if Swift is enabled</li>
 *   <li>Dispatch every file with content to its family's {@link LanguageAnalyzer}</li>
 *   <li>Concatenate per-file relationships in path order and collect statistics</li>
 * </ol>
 *
 * <p>The index is read-only, so files are analyzed independently. With a parallelism above
 * one they are spread over a fixed thread pool; the merged result is identical to a
 * single-threaded run.
 *
 * <p>{@code analyze} never throws for a well-formed index. An unexpected error while
 * analyzing a file is logged, counted as a failure and the run continues with the next file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FileIndex index = FileIndex.build(scanner.scan(root));
 * RelationshipGraph graph = new RelationshipGraphBuilder()
 *     .analyze(index, AnalysisOptions.defaults().withParallelism(4));
 * }</pre>
 */
public class RelationshipGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(RelationshipGraphBuilder.class);

    private final LanguageStrategies strategies;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RelationshipGraphBuilder() {
        this(LanguageStrategies.standard());
    }

    public RelationshipGraphBuilder(LanguageStrategies strategies) {
        this.strategies = strategies;
    }

    /**
     * Builds an index from the tree and analyzes it with default options.
     *
     * @param root root directory of the scanned tree
     * @return relationship graph
     */
    public RelationshipGraph analyze(DirectoryNode root) {
        return analyze(FileIndex.build(root), AnalysisOptions.defaults());
    }

    /**
     * Analyzes every file of the index on the calling thread.
     *
     * @param index file index
     * @return relationship graph
     */
    public RelationshipGraph analyze(FileIndex index) {
        return analyze(index, AnalysisOptions.defaults());
    }

    /**
     * Analyzes the index with the given options.
     *
     * @param index file index
     * @param options parallelism and language filter
     * @return relationship graph, partial if the run was cancelled
     */
    public RelationshipGraph analyze(FileIndex index, AnalysisOptions options) {
        if (index == null || index.isEmpty()) {
            return RelationshipGraph.empty();
        }
        AnalysisOptions effective = options == null ? AnalysisOptions.defaults() : options;

        List<FileRecord> files = new ArrayList<>(index.records());
        files.sort(Comparator.comparing(FileRecord::path));

        TypeDeclarationIndex typeDeclarations = effective.isEnabled(LanguageFamily.SWIFT)
            ? TypeDeclarationIndex.build(index)
            : TypeDeclarationIndex.empty();
        AnalysisContext context = new AnalysisContext(index, typeDeclarations);

        log.info("Analyzing {} files (parallelism {})", files.size(), effective.parallelism());

        List<FileOutcome> outcomes = effective.parallelism() > 1 && files.size() > 1
            ? analyzeParallel(files, context, effective)
            : analyzeSequential(files, context, effective);

        RelationshipGraph graph = merge(outcomes, index.size());
        log.info("Analysis complete: {} relationships. {}", graph.size(), graph.statistics().getSummary());
        return graph;
    }

    /**
     * Stops the current or next run from analyzing further files.
     *
     * <p>Files already being analyzed complete; the returned graph holds every relationship
     * accumulated so far and its statistics are marked cancelled. A cancelled builder stays
     * cancelled.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Analysis cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ==================== Execution ====================

    private List<FileOutcome> analyzeSequential(List<FileRecord> files, AnalysisContext context, AnalysisOptions options) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (FileRecord file : files) {
            if (cancelled.get()) {
                break;
            }
            outcomes.add(analyzeFile(file, context, options));
        }
        return outcomes;
    }

    private List<FileOutcome> analyzeParallel(List<FileRecord> files, AnalysisContext context, AnalysisOptions options) {
        int threads = Math.min(options.parallelism(), files.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new AnalysisThreadFactory());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (FileRecord file : files) {
                futures.add(executor.submit(() -> cancelled.get() ? FileOutcome.NOT_RUN : analyzeFile(file, context, options)));
            }

            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome await(Future<FileOutcome> future, FileRecord file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return FileOutcome.NOT_RUN;
        } catch (ExecutionException e) {
            log.warn("Failed to analyze {}: {}", file.path(), e.getCause().getMessage(), e.getCause());
            return FileOutcome.failed(file.path() + ": " + e.getCause().getMessage());
        }
    }

    private FileOutcome analyzeFile(FileRecord file, AnalysisContext context, AnalysisOptions options) {
        LanguageFamily family = file.language().family();
        if (!file.hasContent() || !options.isEnabled(family)) {
            log.debug("Skipping {} ({})", file.path(), file.hasContent() ? family.id() : "no content");
            return FileOutcome.SKIPPED;
        }

        try {
            FileAnalysis analysis = strategies.forFamily(family).analyze(file, context);
            log.debug("Analyzed {}: {} references, {} relationships",
                file.path(), analysis.referencesExtracted(), analysis.relationships().size());
            return FileOutcome.analyzed(analysis);
        } catch (RuntimeException e) {
            log.warn("Failed to analyze {}: {}", file.path(), e.getMessage(), e);
            return FileOutcome.failed(file.path() + ": " + e.getMessage());
        }
    }

    private RelationshipGraph merge(List<FileOutcome> outcomes, int filesIndexed) {
        GraphStatistics.Builder statistics = new GraphStatistics.Builder().filesIndexed(filesIndexed);
        List<Relationship> relationships = new ArrayList<>();

        for (FileOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case ANALYZED -> {
                    relationships.addAll(outcome.analysis().relationships());
                    statistics.incrementFilesAnalyzed()
                        .addReferencesExtracted(outcome.analysis().referencesExtracted())
                        .addReferencesResolved(outcome.analysis().relationships().size());
                }
                case SKIPPED -> statistics.incrementFilesSkipped();
                case FAILED -> statistics.incrementFilesFailed().addError(outcome.error());
                case NOT_RUN -> {
                    // cancelled before start
                }
            }
        }

        boolean wasCancelled = cancelled.get();
        if (wasCancelled) {
            log.info("Analysis cancelled after {} relationships", relationships.size());
        }
        return new RelationshipGraph(relationships, statistics.cancelled(wasCancelled).build());
    }

    // ==================== Internals ====================

    private enum Status { ANALYZED, SKIPPED, FAILED, NOT_RUN }

    private record FileOutcome(Status status, FileAnalysis analysis, String error) {

        static final FileOutcome SKIPPED = new FileOutcome(Status.SKIPPED, FileAnalysis.empty(), null);
        static final FileOutcome NOT_RUN = new FileOutcome(Status.NOT_RUN, FileAnalysis.empty(), null);

        static FileOutcome analyzed(FileAnalysis analysis) {
            return new FileOutcome(Status.ANALYZED, analysis, null);
        }

        static FileOutcome failed(String error) {
            return new FileOutcome(Status.FAILED, FileAnalysis.empty(), error);
        }
    }

    private static final class AnalysisThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "repograph-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
