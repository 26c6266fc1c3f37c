package com.repograph.core.extractor.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that recognize reference statements with regular
 * expressions.
 *
 * <p>Patterns are compiled once as constants in the subclasses; every helper here creates a
 * fresh {@link Matcher} per call, so no scan position leaks from one line (or one file,
 * or one thread) to the next. Multi-match helpers return detached {@link MatchResult}
 * snapshots rather than the live matcher.
 *
 * <h3>When to Use This Base Class</h3>
 * <ul>
 *   <li>The reference statement fits on one line (imports, includes, use declarations)</li>
 *   <li>Full parsing would be overkill for the information needed</li>
 * </ul>
 *
 * @see AbstractReferenceExtractor
 */
public abstract class AbstractRegexExtractor extends AbstractReferenceExtractor {

    protected AbstractRegexExtractor() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return one snapshot per match, in order
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher positioned on the first match, or null if none
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Extracts a numbered group from a match.
     *
     * @param match match result
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if the group did not participate
     */
    protected String extractGroup(MatchResult match, int groupIndex) {
        if (match == null || groupIndex > match.groupCount()) {
            return null;
        }
        return match.group(groupIndex);
    }
}
