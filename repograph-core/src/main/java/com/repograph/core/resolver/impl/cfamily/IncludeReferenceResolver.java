package com.repograph.core.resolver.impl.cfamily;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;
import com.repograph.core.util.PathUtils;

import java.util.List;
import java.util.Optional;

/**
 * Resolver for C and C++ header names.
 *
 * <p>Tries, in order: the header relative to the including file's directory, the header as
 * a repository path, a segment-aware suffix match (for include roots such as
 * {@code include/}), and finally the header's file name anywhere in the index.
 */
public class IncludeReferenceResolver extends AbstractReferenceResolver {

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.C_FAMILY;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String header = reference.text();
        String besideSource = PathUtils.resolveFrom(reference.sourceFile(), header);

        return exact(index, besideSource)
            .or(() -> exact(index, header))
            .or(() -> bySuffix(index, PathUtils.resolve("", header), List.of()))
            .or(() -> byFileName(index, PathUtils.lastSegment(header)));
    }
}
