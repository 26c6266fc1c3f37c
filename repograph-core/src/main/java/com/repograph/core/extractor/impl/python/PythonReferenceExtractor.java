package com.repograph.core.extractor.impl.python;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Python import statements.
 *
 * <p><b>Recognized statements</b> (matched on the trimmed line):
 * <pre>{@code
 * import os, sys as s, json            -> "os", "sys", "json"
 * import pandas as pd                  -> "pandas"
 * from app.config import settings      -> "app.config"
 * from . import views                  -> "."
 * from ..models.user import User       -> "..models.user"
 * }</pre>
 *
 * <p>Aliases are stripped. Relative references keep their leading dots; the dot count tells
 * the resolver how many directories to climb.
 */
public class PythonReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "python-imports";
    private static final String EXTRACTOR_DISPLAY_NAME = "Python Import Extractor";

    /** import a, b as c */
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)");

    /** One comma-separated module entry, with optional alias. */
    private static final Pattern MODULE_ENTRY = Pattern.compile("^([a-zA-Z0-9_.]+)(?:\\s+as\\s+\\w+)?");

    /** from pkg.mod import X (absolute only, no leading dot) */
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+([a-zA-Z0-9_][a-zA-Z0-9_.]*)\\s+import\\b");

    /** from . import x, from ..pkg.mod import y */
    private static final Pattern RELATIVE_FROM_IMPORT = Pattern.compile("^from\\s+(\\.+)([\\w.]*)\\s+import\\b");

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
        return LanguageFamily.PYTHON;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            int lineNumber = i + 1;

            Matcher importMatch = findFirst(IMPORT, trimmed);
            if (importMatch != null) {
                extractModuleList(importMatch.group(1), lineNumber, sourceFile, references);
                continue;
            }

            Matcher fromMatch = findFirst(FROM_IMPORT, trimmed);
            if (fromMatch != null) {
                addIfPresent(references, reference(fromMatch.group(1), lineNumber, ReferenceKind.IMPORT, sourceFile));
                continue;
            }

            Matcher relativeMatch = findFirst(RELATIVE_FROM_IMPORT, trimmed);
            if (relativeMatch != null) {
                String dots = relativeMatch.group(1);
                String module = relativeMatch.group(2) == null ? "" : relativeMatch.group(2);
                addIfPresent(references, reference(dots + module, lineNumber, ReferenceKind.IMPORT, sourceFile));
            }
        }

        return references;
    }

    private void extractModuleList(String moduleList, int lineNumber, String sourceFile, List<RawReference> references) {
        for (String entry : moduleList.split(",")) {
            Matcher entryMatch = findFirst(MODULE_ENTRY, entry.trim());
            if (entryMatch != null) {
                addIfPresent(references, reference(entryMatch.group(1), lineNumber, ReferenceKind.IMPORT, sourceFile));
            }
        }
    }
}
