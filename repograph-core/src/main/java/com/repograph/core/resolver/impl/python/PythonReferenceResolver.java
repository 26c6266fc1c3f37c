package com.repograph.core.resolver.impl.python;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.RawReference;
import com.repograph.core.resolver.base.AbstractReferenceResolver;
import com.repograph.core.util.PathUtils;

import java.util.Optional;

/**
 * Resolver for Python module names.
 *
 * <p><b>Relative imports</b> ({@code from . import x}, {@code from ..pkg import y}): one dot
 * is the importing file's directory and each further dot climbs one level. A bare dot run
 * resolves to that directory's {@code __init__.py}; a module name resolves to
 * {@code dir/mod.py} or {@code dir/mod/__init__.py}. No fuzzy fallback is applied.
 *
 * <p><b>Absolute imports</b> ({@code import app.config}, {@code from app.config import x}):
 * <ol>
 *   <li>exact {@code app/config.py}, then {@code app/config/__init__.py}</li>
 *   <li>suffix match of the same two paths</li>
 *   <li>with the first package dropped, {@code config.py} / {@code config/__init__.py} by
 *       suffix, for imports that name the project's own top-level package</li>
 *   <li>file name {@code config.py} anywhere in the index</li>
 * </ol>
 */
public class PythonReferenceResolver extends AbstractReferenceResolver {

    private static final String PY = ".py";
    private static final String PACKAGE_INIT = "/__init__.py";
    private static final String INIT_FILE = "__init__.py";

    @Override
    public LanguageFamily getFamily() {
        return LanguageFamily.PYTHON;
    }

    @Override
    protected Optional<FileRecord> doResolve(RawReference reference, FileIndex index) {
        String module = reference.text();
        if (module.startsWith(".")) {
            return resolveRelative(reference.sourceFile(), module, index);
        }
        return resolveAbsolute(module, index);
    }

    private Optional<FileRecord> resolveRelative(String sourceFile, String module, FileIndex index) {
        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        String directory = PathUtils.ancestor(PathUtils.parent(sourceFile), dots - 1);
        String name = module.substring(dots);

        if (name.isEmpty()) {
            return exact(index, PathUtils.join(directory, INIT_FILE));
        }

        String base = PathUtils.join(directory, toPath(name));
        return exact(index, base + PY)
            .or(() -> exact(index, base + PACKAGE_INIT));
    }

    private Optional<FileRecord> resolveAbsolute(String module, FileIndex index) {
        String modulePath = toPath(module);

        return exact(index, modulePath + PY)
            .or(() -> exact(index, modulePath + PACKAGE_INIT))
            .or(() -> index.findBySuffix(modulePath + PY))
            .or(() -> index.findBySuffix(modulePath + PACKAGE_INIT))
            .or(() -> withoutRootPackage(modulePath, index))
            .or(() -> byFileName(index, PathUtils.lastSegment(modulePath) + PY));
    }

    private Optional<FileRecord> withoutRootPackage(String modulePath, FileIndex index) {
        int slash = modulePath.indexOf('/');
        if (slash < 0 || slash == modulePath.length() - 1) {
            return Optional.empty();
        }
        String withoutRoot = modulePath.substring(slash + 1);
        return index.findBySuffix(withoutRoot + PY)
            .or(() -> index.findBySuffix(withoutRoot + PACKAGE_INIT));
    }

    private String toPath(String dottedName) {
        return dottedName.replace('.', '/');
    }
}
