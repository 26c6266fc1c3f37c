package com.repograph.core.extractor.impl.swift;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Swift type declarations.
 *
 * <p>Swift files in one module see each other's types without import statements, so there
 * is nothing to extract from the referencing side. Instead this extractor reports what a
 * file <em>declares</em>: every {@code class}, {@code struct}, {@code protocol}, {@code enum}
 * or {@code actor} name, optionally preceded by access or {@code final} modifiers. The
 * resolver then looks for those names in the other Swift files.
 *
 * <p>{@code class func} and {@code class var} members are not type declarations and are
 * skipped.
 */
public class SwiftDeclarationExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "swift-declarations";
    private static final String EXTRACTOR_DISPLAY_NAME = "Swift Type Declaration Extractor";

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
        "^\\s*(?:(?:public|private|internal|open|fileprivate|final)\\s+)*"
            + "(?:class|struct|protocol|enum|actor)\\s+(?!(?:func|var|let)\\b)([a-zA-Z0-9_]+)"
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
        return LanguageFamily.SWIFT;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> declarations = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher match = findFirst(TYPE_DECLARATION, lines.get(i));
            if (match != null) {
                addIfPresent(declarations, reference(match.group(1), i + 1, ReferenceKind.DECLARATION, sourceFile));
            }
        }
        return declarations;
    }
}
