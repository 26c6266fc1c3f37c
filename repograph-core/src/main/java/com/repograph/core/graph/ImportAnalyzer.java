package com.repograph.core.graph;

import com.repograph.core.extractor.ReferenceExtractor;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipKind;
import com.repograph.core.resolver.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Analyzer pairing an extractor with a resolver: every extracted reference that resolves
 * becomes one relationship.
 *
 * <p>No deduplication is applied; two statements naming the same target give two
 * relationships. Re-exports become {@link RelationshipKind#EXPORT} edges, everything else
 * {@link RelationshipKind#IMPORT}.
 */
public class ImportAnalyzer implements LanguageAnalyzer {

    private final ReferenceExtractor extractor;
    private final ReferenceResolver resolver;

    public ImportAnalyzer(ReferenceExtractor extractor, ReferenceResolver resolver) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        if (extractor.getFamily() != resolver.getFamily()) {
            throw new IllegalArgumentException("Extractor " + extractor.getId() + " (" + extractor.getFamily()
                + ") does not match resolver family " + resolver.getFamily());
        }
    }

    @Override
    public LanguageFamily getFamily() {
        return extractor.getFamily();
    }

    @Override
    public FileAnalysis analyze(FileRecord file, AnalysisContext context) {
        List<RawReference> references = extractor.extract(file.path(), file.content());
        List<Relationship> relationships = new ArrayList<>();

        for (RawReference reference : references) {
            resolver.resolve(reference, context.index()).ifPresent(target -> relationships.add(new Relationship(
                file.path(),
                target.path(),
                reference.kind() == ReferenceKind.EXPORT ? RelationshipKind.EXPORT : RelationshipKind.IMPORT,
                reference.lineNumber(),
                reference.text()
            )));
        }
        return new FileAnalysis(relationships, references.size());
    }

    public ReferenceExtractor getExtractor() {
        return extractor;
    }

    public ReferenceResolver getResolver() {
        return resolver;
    }
}
