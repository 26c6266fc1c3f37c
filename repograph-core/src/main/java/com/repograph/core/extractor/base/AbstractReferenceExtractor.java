package com.repograph.core.extractor.base;

import com.repograph.core.extractor.ReferenceExtractor;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for extractor implementations providing common functionality.
 *
 * <p>This class reduces code duplication across extractors by providing:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>The null/blank content guard, so subclasses only see real text</li>
 *   <li>A failing subclass is logged at WARN and yields no references</li>
 *   <li>Line splitting that tolerates {@code \r\n} line endings</li>
 *   <li>A {@link #reference(String, int, ReferenceKind, String)} factory</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #extractReferences(String, List)} and receive the file's
 * lines; line numbers handed to {@code reference(...)} are 1-based.
 */
public abstract class AbstractReferenceExtractor implements ReferenceExtractor {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractReferenceExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final List<RawReference> extract(String sourceFile, String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        try {
            List<RawReference> references = extractReferences(sourceFile, splitLines(content));
            if (!references.isEmpty()) {
                log.debug("Extracted {} references from {}", references.size(), sourceFile);
            }
            return List.copyOf(references);
        } catch (RuntimeException e) {
            log.warn("Failed to extract references from {}: {}", sourceFile, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Extracts references from the lines of a file with non-blank content.
     *
     * @param sourceFile path of the file
     * @param lines file lines, index 0 is line 1
     * @return references in source order
     */
    protected abstract List<RawReference> extractReferences(String sourceFile, List<String> lines);

    /**
     * Splits text on {@code \n}, dropping a trailing {@code \r} from every line.
     *
     * @param content file text
     * @return lines, including a final empty line if the text ends with a newline
     */
    protected List<String> splitLines(String content) {
        String[] parts = content.split("\n", -1);
        List<String> lines = new ArrayList<>(parts.length);
        for (String part : parts) {
            lines.add(part.endsWith("\r") ? part.substring(0, part.length() - 1) : part);
        }
        return lines;
    }

    /**
     * Creates a reference, ignoring blank reference text.
     *
     * @param text raw reference text
     * @param lineNumber 1-based line number
     * @param kind reference kind
     * @param sourceFile path of the referencing file
     * @return reference, or {@code null} when the text is blank
     */
    protected RawReference reference(String text, int lineNumber, ReferenceKind kind, String sourceFile) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return new RawReference(text.trim(), lineNumber, kind, sourceFile);
    }

    /**
     * Adds a reference to the list when it is not {@code null}.
     *
     * @param references target list
     * @param reference reference to add, may be null
     */
    protected void addIfPresent(List<RawReference> references, RawReference reference) {
        if (reference != null) {
            references.add(reference);
        }
    }
}
