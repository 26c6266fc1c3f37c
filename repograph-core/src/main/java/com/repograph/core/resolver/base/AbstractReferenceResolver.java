package com.repograph.core.resolver.base;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Abstract base class for resolvers providing the shared lookup steps.
 *
 * <p>Each step returns as soon as it finds a file, so concrete resolvers express their
 * fallback order as a chain:
 * <pre>{@code
 * return exact(index, candidate)
 *     .or(() -> withExtensions(index, candidate, EXTENSIONS))
 *     .or(() -> bySuffix(index, candidate, SUFFIX_EXTENSIONS));
 * }</pre>
 *
 * <p>Suffix and file-name steps take the first match in index traversal order when several
 * files qualify. A match may be the referencing file itself; such self-edges are kept.
 */
public abstract class AbstractReferenceResolver implements ReferenceResolver {

    /**
     * Logger instance for this resolver.
     * Automatically initialized with the concrete resolver class name.
     */
    protected final Logger log;

    protected AbstractReferenceResolver() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final Optional<FileRecord> resolve(RawReference reference, FileIndex index) {
        if (reference == null || index == null || reference.text().isBlank()) {
            return Optional.empty();
        }
        Optional<FileRecord> resolved = doResolve(reference, index);
        if (resolved.isPresent()) {
            log.debug("Resolved '{}' in {} -> {}", reference.text(), reference.sourceFile(), resolved.get().path());
        } else {
            log.debug("Unresolved '{}' in {}", reference.text(), reference.sourceFile());
        }
        return resolved;
    }

    /**
     * Applies the language-specific ladder.
     *
     * @param reference reference with non-blank text
     * @param index file index
     * @return resolved file or empty
     */
    protected abstract Optional<FileRecord> doResolve(RawReference reference, FileIndex index);

    // ==================== Lookup Steps ====================

    /**
     * Exact lookup by path or alias.
     *
     * @param index file index
     * @param candidate candidate path
     * @return matching file or empty
     */
    protected Optional<FileRecord> exact(FileIndex index, String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return Optional.empty();
        }
        return index.get(candidate);
    }

    /**
     * Exact lookup of the candidate with each suffix appended, in order.
     *
     * @param index file index
     * @param candidate candidate path without extension
     * @param extensions suffixes such as {@code .ts} or {@code /index.ts}
     * @return first matching file or empty
     */
    protected Optional<FileRecord> withExtensions(FileIndex index, String candidate, List<String> extensions) {
        if (candidate == null || candidate.isEmpty()) {
            return Optional.empty();
        }
        for (String extension : extensions) {
            Optional<FileRecord> match = index.get(candidate + extension);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Suffix lookup of the candidate as-is and then with each extension appended.
     *
     * @param index file index
     * @param candidate candidate path
     * @param extensions extensions to try after the bare candidate
     * @return first matching file or empty
     */
    protected Optional<FileRecord> bySuffix(FileIndex index, String candidate, List<String> extensions) {
        if (candidate == null || candidate.isEmpty()) {
            return Optional.empty();
        }
        Optional<FileRecord> match = index.findBySuffix(candidate);
        if (match.isPresent()) {
            return match;
        }
        for (String extension : extensions) {
            match = index.findBySuffix(candidate + extension);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * File-name lookup across the whole index.
     *
     * @param index file index
     * @param fileName simple file name such as {@code User.java}
     * @return first file with that name or empty
     */
    protected Optional<FileRecord> byFileName(FileIndex index, String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return Optional.empty();
        }
        return index.findByName(fileName);
    }
}
