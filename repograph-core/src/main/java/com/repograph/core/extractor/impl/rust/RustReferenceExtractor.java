package com.repograph.core.extractor.impl.rust;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Rust {@code use} and {@code mod} declarations.
 *
 * <p>Reports the module path as written ({@code use config::Settings;} yields
 * {@code config::Settings}); visibility modifiers such as {@code pub} or {@code pub(crate)}
 * are accepted in front of either keyword. Grouped imports ({@code use a::{b, c}}) report
 * the path up to the brace.
 */
public class RustReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "rust-modules";
    private static final String EXTRACTOR_DISPLAY_NAME = "Rust Use/Mod Extractor";

    private static final String VISIBILITY = "(?:pub(?:\\s*\\([^)]*\\))?\\s+)?";

    private static final Pattern USE = Pattern.compile("^" + VISIBILITY + "use\\s+([a-zA-Z0-9_:]+)");

    private static final Pattern MOD = Pattern.compile("^" + VISIBILITY + "mod\\s+([a-zA-Z0-9_]+)");

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
        return LanguageFamily.RUST;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            int lineNumber = i + 1;

            Matcher use = findFirst(USE, trimmed);
            if (use != null) {
                addIfPresent(references, reference(trimTrailingSeparator(use.group(1)), lineNumber, ReferenceKind.USE, sourceFile));
                continue;
            }
            Matcher mod = findFirst(MOD, trimmed);
            if (mod != null) {
                addIfPresent(references, reference(mod.group(1), lineNumber, ReferenceKind.MODULE, sourceFile));
            }
        }
        return references;
    }

    private String trimTrailingSeparator(String path) {
        return path.endsWith("::") ? path.substring(0, path.length() - 2) : path;
    }
}
