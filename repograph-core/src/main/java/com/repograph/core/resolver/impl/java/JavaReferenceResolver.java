package com.repograph.core.resolver.impl.java;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;

import java.util.Optional;

/**
 * Resolver for Java fully qualified class names.
 *
 * <p>For {@code com.example.model.User} the resolver tries the package path
 * {@code com/example/model/User.java} by suffix, then any file named {@code User.java}.
 * When the last segment is a member (static imports) or a nested class, the same two
 * lookups are repeated for the enclosing segment if it looks like a class name.
 */
public class JavaReferenceResolver extends AbstractReferenceResolver {

    private static final String JAVA = ".java";

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.JAVA;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String qualifiedName = reference.text();
        Optional<FileRecord> direct = lookupClass(qualifiedName, index);
        if (direct.isPresent()) {
            return direct;
        }

        int lastDot = qualifiedName.lastIndexOf('.');
        if (lastDot <= 0) {
            return Optional.empty();
        }
        String enclosing = qualifiedName.substring(0, lastDot);
        String enclosingSimpleName = simpleName(enclosing);
        if (enclosingSimpleName.isEmpty() || !Character.isUpperCase(enclosingSimpleName.charAt(0))) {
            return Optional.empty();
        }
        return lookupClass(enclosing, index);
    }

    private Optional<FileRecord> lookupClass(String qualifiedName, FileIndex index) {
        String simpleName = simpleName(qualifiedName);
        if (simpleName.isEmpty()) {
            return Optional.empty();
        }
        return index.findBySuffix(qualifiedName.replace('.', '/') + JAVA)
            .or(() -> byFileName(index, simpleName + JAVA));
    }

    private String simpleName(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
    }
}
