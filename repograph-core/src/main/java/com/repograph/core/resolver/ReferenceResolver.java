package com.repograph.core.resolver;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;

import java.util.Optional;

/**
 * Maps a raw reference to the single best-matching file of the repository.
 *
 * <p>Resolvers apply a per-language ladder of lookups, stopping at the first success:
 * relative-path arithmetic, exact lookup, extension-augmented lookup, package-root
 * stripping, segment-aware suffix match and file-name match, in whatever subset suits the
 * language. An empty result is the normal outcome for references to external packages and
 * is not an error.
 *
 * <p>Resolvers only read the {@link FileIndex}; they are stateless and thread-safe.
 */
public interface ReferenceResolver {

    /**
     * Returns the language family whose references this resolver understands.
     *
     * @return language family
     */
    LanguageFamily getFamily();

    /**
     * Resolves a reference against the index.
     *
     * @param reference raw reference, with the referencing file's path
     * @param index file index of the repository snapshot
     * @return the matched file, or empty when the reference points outside the repository
     */
    Optional<FileRecord> resolve(RawReference reference, FileIndex index);
}
