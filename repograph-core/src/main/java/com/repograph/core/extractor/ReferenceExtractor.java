package com.repograph.core.extractor;

import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;

import java.util.List;

/**
 * Extracts raw inter-file references from the text of one source file.
 *
 * <p>Each extractor owns the syntax rules of one {@link LanguageFamily}. Extractors are
 * stateless and pure: they read only the text handed to them, never resolve paths and never
 * look at other files. They are selected by the file's language tag, not by sniffing content.
 *
 * <p>Extraction is total. Empty, {@code null} or malformed content yields an empty list, and
 * a statement the patterns do not recognize is simply skipped. No comment stripping is
 * performed, so a reference-shaped string inside a comment is reported like a real one.
 *
 * @see com.repograph.core.resolver.ReferenceResolver
 */
public interface ReferenceExtractor {

    /**
     * Returns unique identifier for this extractor.
     *
     * <p>Kebab-case, e.g. {@code "javascript-imports"}, {@code "c-includes"}.
     *
     * @return extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this extractor.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the language family whose syntax this extractor understands.
     *
     * @return language family
     */
    LanguageFamily getFamily();

    /**
     * Extracts the references of one file, in source order.
     *
     * @param sourceFile path of the file, copied into every reference
     * @param content raw file text, may be {@code null}
     * @return ordered references, empty if none
     */
    List<RawReference> extract(String sourceFile, String content);
}
