package com.repograph.core.extractor.impl.javascript;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for JavaScript and TypeScript module references (including JSX/TSX).
 *
 * <p><b>Recognized statements:</b>
 * <ul>
 *   <li>{@code import X from './x'}, {@code import { a, b } from '../y'}, {@code import type T from 't'}</li>
 *   <li>{@code import './side-effect'}</li>
 *   <li>{@code const x = require('./x')}</li>
 *   <li>{@code await import('./lazy')}</li>
 *   <li>{@code export { a } from './a'}, {@code export * from './b'} (reported as {@link ReferenceKind#EXPORT})</li>
 * </ul>
 *
 * <p>Every pattern is applied to every line, so a line holding several statements yields
 * several references. Only the first capture group of a match is the reference text.
 */
public class JavaScriptReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "javascript-imports";
    private static final String EXTRACTOR_DISPLAY_NAME = "JavaScript/TypeScript Import Extractor";

    /** import X from 'Y' */
    private static final Pattern IMPORT_FROM = Pattern.compile("import\\s+.*\\s+from\\s+['\"](.+?)['\"]");

    /** import 'Y' */
    private static final Pattern SIDE_EFFECT_IMPORT = Pattern.compile("import\\s+['\"](.+?)['\"]");

    /** require('Y') */
    private static final Pattern REQUIRE = Pattern.compile("require\\s*\\(\\s*['\"](.+?)['\"]\\s*\\)");

    /** import('Y') */
    private static final Pattern DYNAMIC_IMPORT = Pattern.compile("import\\s*\\(\\s*['\"](.+?)['\"]\\s*\\)");

    /** export { a } from 'Y', export * from 'Y', export * as ns from 'Y' */
    private static final Pattern EXPORT_FROM = Pattern.compile(
        "export\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+\\w+)?|\\{[^}]*\\})\\s*from\\s+['\"](.+?)['\"]"
    );

    private static final List<Pattern> IMPORT_PATTERNS = List.of(
        IMPORT_FROM,
        SIDE_EFFECT_IMPORT,
        REQUIRE,
        DYNAMIC_IMPORT
    );

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.JAVASCRIPT;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            for (Pattern pattern : IMPORT_PATTERNS) {
                for (MatchResult match : findMatches(pattern, line)) {
                    addIfPresent(references, reference(extractGroup(match, 1), lineNumber, ReferenceKind.IMPORT, sourceFile));
                }
            }
            for (MatchResult match : findMatches(EXPORT_FROM, line)) {
                addIfPresent(references, reference(extractGroup(match, 1), lineNumber, ReferenceKind.EXPORT, sourceFile));
            }
        }

        return references;
    }
}
