package com.repograph.core.resolver.impl.rust;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;
import com.repograph.core.util.PathUtils;

import java.util.Optional;
import java.util.Set;

/**
 * Resolver for Rust module paths.
 *
 * <p>Only the first module segment before {@code ::} is the target: {@code use config::Settings}
 * resolves the module {@code config}. The path keywords {@code crate}, {@code self} and
 * {@code super} are skipped before picking that segment, and the standard library roots
 * ({@code std}, {@code core}, {@code alloc}) never resolve.
 *
 * <p>The module is looked up as a sibling of the referencing file ({@code config.rs} or
 * {@code config/mod.rs}), then as any file named {@code config.rs}, then as any
 * {@code config/mod.rs}.
 */
public class RustReferenceResolver extends AbstractReferenceResolver {

    private static final String RS = ".rs";
    private static final String MOD_FILE = "/mod.rs";
    private static final Set<String> PATH_KEYWORDS = Set.of("crate", "self", "super");
    private static final Set<String> STANDARD_ROOTS = Set.of("std", "core", "alloc");

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.RUST;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String module = firstModuleSegment(reference.text());
        if (module.isEmpty() || STANDARD_ROOTS.contains(module)) {
            return Optional.empty();
        }

        String directory = PathUtils.parent(reference.sourceFile());
        return exact(index, PathUtils.join(directory, module + RS))
            .or(() -> exact(index, PathUtils.join(directory, module + MOD_FILE)))
            .or(() -> byFileName(index, module + RS))
            .or(() -> index.findBySuffix(module + MOD_FILE));
    }

    private String firstModuleSegment(String path) {
        for (String segment : path.split("::")) {
            String trimmed = segment.trim();
            if (!trimmed.isEmpty() && !PATH_KEYWORDS.contains(trimmed)) {
                return trimmed;
            }
        }
        return "";
    }
}
