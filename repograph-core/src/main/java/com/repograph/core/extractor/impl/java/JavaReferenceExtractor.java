package com.repograph.core.extractor.impl.java;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Java {@code import} declarations.
 *
 * <p>Matches {@code import com.example.User;} and {@code import static com.example.Util.helper;}
 * on trimmed lines and reports the fully qualified name. On-demand imports
 * ({@code import com.example.*;}) name a package rather than a file and are not reported.
 */
public class JavaReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "java-imports";
    private static final String EXTRACTOR_DISPLAY_NAME = "Java Import Extractor";

    private static final Pattern IMPORT = Pattern.compile("^import\\s+(static\\s+)?([a-zA-Z0-9_.]+)\\s*;");

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
        return LanguageFamily.JAVA;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher match = findFirst(IMPORT, lines.get(i).trim());
            if (match != null) {
                addIfPresent(references, reference(match.group(2), i + 1, ReferenceKind.IMPORT, sourceFile));
            }
        }
        return references;
    }
}
