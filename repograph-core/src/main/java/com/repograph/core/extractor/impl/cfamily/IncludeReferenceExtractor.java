package com.repograph.core.extractor.impl.cfamily;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for C and C++ {@code #include} directives.
 *
 * <p>{@code #include "local.h"} and {@code #include <system.h>} are treated identically: the
 * header name is reported either way and the resolver decides whether the repository
 * contains it.
 */
public class IncludeReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "c-includes";
    private static final String EXTRACTOR_DISPLAY_NAME = "C/C++ Include Extractor";

    private static final Pattern QUOTED_INCLUDE = Pattern.compile("^#\\s*include\\s*\"([^\"]+)\"");

    private static final Pattern ANGLE_INCLUDE = Pattern.compile("^#\\s*include\\s*<([^>]+)>");

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
        return LanguageFamily.C_FAMILY;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            Matcher match = findFirst(QUOTED_INCLUDE, trimmed);
            if (match == null) {
                match = findFirst(ANGLE_INCLUDE, trimmed);
            }
            if (match != null) {
                addIfPresent(references, reference(match.group(1), i + 1, ReferenceKind.INCLUDE, sourceFile));
            }
        }
        return references;
    }
}
