package com.repograph.core.resolver.impl.swift;

import com.repograph.core.extractor.impl.swift.SwiftDeclarationExtractor;
import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Declarations of every Swift type in a repository snapshot.
 *
 * <p>Built once per analysis so that each Swift file is scanned for declarations a single
 * time, instead of once per referencing file. Lookups are read-only; the per-name usage
 * patterns are cached in a concurrent map, so one index can serve parallel analysis.
 *
 * <p>Usage is a whole-word, case-sensitive occurrence of the type name anywhere in the
 * referencing file, comments and strings included.
 */
public final class TypeDeclarationIndex {

    private static final Logger log = LoggerFactory.getLogger(TypeDeclarationIndex.class);

    private static final TypeDeclarationIndex EMPTY = new TypeDeclarationIndex(List.of());

    private final List<TypeDeclaration> declarations;
    private final Map<String, Pattern> usagePatterns = new ConcurrentHashMap<>();

    private TypeDeclarationIndex(List<TypeDeclaration> declarations) {
        this.declarations = List.copyOf(declarations);
    }

    /**
     * Scans every Swift file of the index for type declarations.
     *
     * @param index file index
     * @return declaration index, in index traversal then line order
     */
    public static TypeDeclarationIndex build(FileIndex index) {
        SwiftDeclarationExtractor extractor = new SwiftDeclarationExtractor();
        List<TypeDeclaration> declarations = new ArrayList<>();
        for (FileRecord record : index.records()) {
            if (record.language().family() != LanguageFamily.SWIFT || !record.hasContent()) {
                continue;
            }
            for (RawReference declaration : extractor.extract(record.path(), record.content())) {
                declarations.add(new TypeDeclaration(declaration.text(), record.path(), declaration.lineNumber()));
            }
        }
        log.debug("Indexed {} Swift type declarations", declarations.size());
        return new TypeDeclarationIndex(declarations);
    }

    /**
     * Returns an index with no declarations.
     *
     * @return empty index
     */
    public static TypeDeclarationIndex empty() {
        return EMPTY;
    }

    /**
     * Returns the declarations from other files whose type name occurs in the given file.
     *
     * @param file referencing Swift file
     * @return used declarations, one entry per declaration, in index order
     */
    public List<TypeDeclaration> usedBy(FileRecord file) {
        if (file == null || !file.hasContent()) {
            return List.of();
        }
        List<TypeDeclaration> used = new ArrayList<>();
        for (TypeDeclaration declaration : declarations) {
            if (declaration.file().equals(file.path())) {
                continue;
            }
            if (usagePattern(declaration.name()).matcher(file.content()).find()) {
                used.add(declaration);
            }
        }
        return used;
    }

    /**
     * Returns all declarations.
     *
     * @return unmodifiable list of declarations
     */
    public List<TypeDeclaration> declarations() {
        return declarations;
    }

    /**
     * Returns the number of declarations.
     *
     * @return declaration count
     */
    public int size() {
        return declarations.size();
    }

    private Pattern usagePattern(String typeName) {
        return usagePatterns.computeIfAbsent(typeName, name -> Pattern.compile("\\b" + Pattern.quote(name) + "\\b"));
    }
}
