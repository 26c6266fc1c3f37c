package com.repograph.core.resolver.impl.go;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;
import com.repograph.core.util.PathUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * Resolver for Go import paths.
 *
 * <p>The package name is the last path segment. Resolution first looks for a file named
 * {@code <package>.go}, then for the first Go file whose directory is the import path or a
 * trailing part of it: {@code github.com/acme/app/internal/util} matches files under
 * {@code internal/util/} in a repository rooted at {@code app}. Trailing parts shorter than
 * two segments are only tried for single-segment imports, so {@code net/http} does not
 * match an unrelated {@code http/} directory.
 */
public class GoReferenceResolver extends AbstractReferenceResolver {

    private static final String GO = ".go";

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.GO;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String importPath = trimSlashes(reference.text());
        if (importPath.isEmpty()) {
            return Optional.empty();
        }
        String packageName = PathUtils.lastSegment(importPath);

        return byFileName(index, packageName + GO)
            .or(() -> byPackageDirectory(importPath, index));
    }

    private Optional<FileRecord> byPackageDirectory(String importPath, FileIndex index) {
        String[] segments = importPath.split("/");
        int minimumSegments = Math.min(2, segments.length);

        for (int start = 0; start <= segments.length - minimumSegments; start++) {
            String directory = String.join("/", Arrays.copyOfRange(segments, start, segments.length));
            Optional<FileRecord> match = index.findFirst(record ->
                record.path().endsWith(GO) && isDirectoryOrSubPath(record.directory(), directory));
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private boolean isDirectoryOrSubPath(String recordDirectory, String directory) {
        return recordDirectory.equals(directory) || recordDirectory.endsWith("/" + directory);
    }

    private String trimSlashes(String path) {
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
