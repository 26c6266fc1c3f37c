package com.repograph.core.index;

import com.repograph.core.model.DirectoryNode;
import com.repograph.core.model.FileNode;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-only lookup structure over one scanned repository snapshot.
 *
 * <p>The index holds three views, all built once by {@link #build(TreeNode)} and never
 * modified afterwards:
 * <ul>
 *   <li>a primary map from path to {@link FileRecord}, in traversal order, plus aliases for
 *       records that carry a distinct {@code relativePath}</li>
 *   <li>a name index from file name to the records carrying that name</li>
 *   <li>suffix search over all keys for "path ends with X" fallbacks</li>
 * </ul>
 *
 * <p>Suffix and name lookups return the first match in traversal order. With duplicate base
 * names in different directories the winner is whichever file the scanner visited first.
 *
 * <p>Instances are immutable and safe to share between analysis threads.
 */
public final class FileIndex {

    private static final Logger log = LoggerFactory.getLogger(FileIndex.class);

    private final Map<String, FileRecord> byPath;
    private final Map<String, FileRecord> byAlias;
    private final Map<String, List<FileRecord>> byName;

    private FileIndex(Map<String, FileRecord> byPath,
                      Map<String, FileRecord> byAlias,
                      Map<String, List<FileRecord>> byName) {
        this.byPath = Collections.unmodifiableMap(byPath);
        this.byAlias = Collections.unmodifiableMap(byAlias);
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds an index by traversing the tree depth-first once.
     *
     * @param root root of the scanned tree, usually a {@link DirectoryNode}
     * @return immutable index
     */
    public static FileIndex build(TreeNode root) {
        Objects.requireNonNull(root, "root must not be null");
        Map<String, FileRecord> byPath = new LinkedHashMap<>();
        Map<String, FileRecord> byAlias = new LinkedHashMap<>();
        Map<String, List<FileRecord>> byName = new LinkedHashMap<>();

        collect(root, byPath, byAlias, byName);

        byName.replaceAll((name, records) -> List.copyOf(records));
        log.debug("Indexed {} files ({} aliases)", byPath.size(), byAlias.size());
        return new FileIndex(byPath, byAlias, byName);
    }

    /**
     * Builds an index from a flat list of file nodes, in the given order.
     *
     * @param files file nodes
     * @return immutable index
     */
    public static FileIndex of(List<FileNode> files) {
        return build(new DirectoryNode("", "", new ArrayList<>(files)));
    }

    /**
     * Returns an index without files.
     *
     * @return empty index
     */
    public static FileIndex empty() {
        return new FileIndex(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private static void collect(TreeNode node,
                                Map<String, FileRecord> byPath,
                                Map<String, FileRecord> byAlias,
                                Map<String, List<FileRecord>> byName) {
        if (node instanceof FileNode file) {
            FileRecord record = FileRecord.from(file);
            if (byPath.putIfAbsent(record.path(), record) != null) {
                log.debug("Duplicate path in tree, keeping first occurrence: {}", record.path());
                return;
            }
            String alias = record.relativePath();
            if (alias != null && !alias.isEmpty() && !alias.equals(record.path())) {
                byAlias.putIfAbsent(alias, record);
            }
            byName.computeIfAbsent(record.name(), name -> new ArrayList<>()).add(record);
        } else if (node instanceof DirectoryNode directory) {
            for (TreeNode child : directory.children()) {
                collect(child, byPath, byAlias, byName);
            }
        }
    }

    /**
     * Looks up a file by path or by relative-path alias.
     *
     * @param key path or alias
     * @return matching record, or empty
     */
    public Optional<FileRecord> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        FileRecord record = byPath.get(key);
        if (record == null) {
            record = byAlias.get(key);
        }
        return Optional.ofNullable(record);
    }

    /**
     * Returns true if the key is a path or alias of an indexed file.
     *
     * @param key path or alias
     * @return true if indexed
     */
    public boolean contains(String key) {
        return key != null && (byPath.containsKey(key) || byAlias.containsKey(key));
    }

    /**
     * Returns true if the path is a primary key of the index.
     *
     * @param path file path
     * @return true if a record has exactly this path
     */
    public boolean containsPath(String path) {
        return path != null && byPath.containsKey(path);
    }

    /**
     * Returns all files named {@code fileName}, in traversal order.
     *
     * @param fileName simple file name such as {@code User.java}
     * @return matching records, possibly empty
     */
    public List<FileRecord> findAllByName(String fileName) {
        return byName.getOrDefault(fileName, List.of());
    }

    /**
     * Returns the first file named {@code fileName} in traversal order.
     *
     * @param fileName simple file name
     * @return first matching record, or empty
     */
    public Optional<FileRecord> findByName(String fileName) {
        List<FileRecord> matches = findAllByName(fileName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Returns the first file whose path or alias ends with the given suffix at a segment
     * boundary: the key equals the suffix or ends with {@code "/" + suffix}.
     *
     * <p>{@code findBySuffix("config/settings.py")} matches {@code app/config/settings.py} but
     * not {@code app/myconfig/settings.py}.
     *
     * @param suffix path suffix
     * @return first matching record in traversal order, or empty
     */
    public Optional<FileRecord> findBySuffix(String suffix) {
        if (suffix == null || suffix.isEmpty() || suffix.equals("/")) {
            return Optional.empty();
        }
        String bounded = suffix.startsWith("/") ? suffix : "/" + suffix;
        return findFirstKey(key -> key.equals(suffix) || key.endsWith(bounded));
    }

    /**
     * Returns the first record in traversal order that satisfies the predicate.
     *
     * @param predicate record filter
     * @return first matching record, or empty
     */
    public Optional<FileRecord> findFirst(Predicate<FileRecord> predicate) {
        for (FileRecord record : byPath.values()) {
            if (predicate.test(record)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private Optional<FileRecord> findFirstKey(Predicate<String> keyMatcher) {
        for (Map.Entry<String, FileRecord> entry : byPath.entrySet()) {
            if (keyMatcher.test(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        for (Map.Entry<String, FileRecord> entry : byAlias.entrySet()) {
            if (keyMatcher.test(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every indexed record exactly once, in traversal order.
     *
     * @return indexed records
     */
    public Collection<FileRecord> records() {
        return byPath.values();
    }

    public int size() {
        return byPath.size();
    }

    public boolean isEmpty() {
        return byPath.isEmpty();
    }
}
