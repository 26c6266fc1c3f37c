package com.repograph.core.extractor.impl.go;

import com.repograph.core.extractor.base.AbstractRegexExtractor;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Go import declarations.
 *
 * <p><b>Recognized forms:</b>
 * <pre>{@code
 * import "fmt"
 * import cfg "github.com/acme/app/config"
 *
 * import (
 *     "net/http"
 *     log "github.com/acme/app/internal/logging"
 *     _ "github.com/lib/pq"
 * )
 * }</pre>
 *
 * <p>Bare quoted lines are only read inside an {@code import ( ... )} block, which the
 * extractor tracks line by line.
 */
public class GoReferenceExtractor extends AbstractRegexExtractor {

    private static final String EXTRACTOR_ID = "go-imports";
    private static final String EXTRACTOR_DISPLAY_NAME = "Go Import Extractor";

    private static final Pattern SINGLE_IMPORT = Pattern.compile("^import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"");

    private static final Pattern BLOCK_START = Pattern.compile("^import\\s*\\(");

    private static final Pattern BLOCK_ENTRY = Pattern.compile("^(?:[\\w.]+\\s+)?\"([^\"]+)\"");

    /** import ( "fmt" ) on a single line */
    private static final Pattern INLINE_BLOCK_ENTRY = Pattern.compile("\\(\\s*(?:[\\w.]+\\s+)?\"([^\"]+)\"");

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
        return LanguageFamily.GO;
    }

    @Override
    protected List<RawReference> extractReferences(String sourceFile, List<String> lines) {
        List<RawReference> references = new ArrayList<>();
        boolean inImportBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            int lineNumber = i + 1;

            if (inImportBlock) {
                if (trimmed.startsWith(")")) {
                    inImportBlock = false;
                    continue;
                }
                Matcher entry = findFirst(BLOCK_ENTRY, trimmed);
                if (entry != null) {
                    addIfPresent(references, reference(entry.group(1), lineNumber, ReferenceKind.IMPORT, sourceFile));
                }
                continue;
            }

            Matcher single = findFirst(SINGLE_IMPORT, trimmed);
            if (single != null) {
                addIfPresent(references, reference(single.group(1), lineNumber, ReferenceKind.IMPORT, sourceFile));
            } else if (matches(BLOCK_START, trimmed)) {
                inImportBlock = !trimmed.endsWith(")");
                Matcher inline = findFirst(INLINE_BLOCK_ENTRY, trimmed);
                if (inline != null) {
                    addIfPresent(references, reference(inline.group(1), lineNumber, ReferenceKind.IMPORT, sourceFile));
                }
            }
        }

        return references;
    }
}
