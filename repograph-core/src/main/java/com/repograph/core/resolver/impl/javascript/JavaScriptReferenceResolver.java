package com.repograph.core.resolver.impl.javascript;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;
import com.repograph.core.util.PathUtils;

import java.util.List;
import java.util.Optional;

/**
 * Resolver for JavaScript and TypeScript module specifiers.
 *
 * <p><b>Resolution ladder:</b>
 * <ol>
 *   <li>{@code ./} and {@code ../} specifiers are resolved against the importing file's
 *       directory; bare specifiers are used as-is</li>
 *   <li>exact lookup of the candidate</li>
 *   <li>candidate plus {@code .ts .tsx .js .jsx .mjs .cjs} or an {@code index} file; a
 *       {@code .js}/{@code .jsx} specifier also tries its TypeScript twin</li>
 *   <li>segment-aware suffix match of the candidate, bare or with {@code .ts .tsx .js .jsx}</li>
 * </ol>
 *
 * <p>Bare package names such as {@code react} resolve only when the repository itself holds
 * a file at that path, so imports of npm packages produce no relationship.
 */
public class JavaScriptReferenceResolver extends AbstractReferenceResolver {

    private static final List<String> EXTENSIONS = List.of(
        ".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs",
        "/index.ts", "/index.tsx", "/index.js", "/index.jsx"
    );

    private static final List<String> SUFFIX_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.JAVASCRIPT;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String specifier = reference.text();
        String candidate = PathUtils.isRelative(specifier)
            ? PathUtils.resolveFrom(reference.sourceFile(), specifier)
            : specifier;

        return exact(index, candidate)
            .or(() -> withExtensions(index, candidate, EXTENSIONS))
            .or(() -> typeScriptTwin(index, candidate))
            .or(() -> bySuffix(index, candidate, SUFFIX_EXTENSIONS));
    }

    private Optional<FileRecord> typeScriptTwin(FileIndex index, String candidate) {
        if (candidate.endsWith(".js")) {
            return exact(index, candidate.substring(0, candidate.length() - 3) + ".ts");
        }
        if (candidate.endsWith(".jsx")) {
            return exact(index, candidate.substring(0, candidate.length() - 4) + ".tsx");
        }
        return Optional.empty();
    }
}
