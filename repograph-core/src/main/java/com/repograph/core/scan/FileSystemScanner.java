package com.repograph.core.scan;

import com.repograph.core.config.RepoGraphConfig.ScanConfig;
import com.repograph.core.model.DirectoryNode;
import com.repograph.core.model.FileNode;
import com.repograph.core.model.Language;
import com.repograph.core.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scans a directory into the tree consumed by the file index.
 *
 * <p>Paths in the tree are relative to the scanned root and use {@code /} separators, so
 * {@code <root>/src/index.ts} becomes {@code src/index.ts}. Children are sorted by name,
 * which makes the tree, and therefore the index traversal order, independent of the file
 * system.
 *
 * <p>Ignored directories are not descended into and ignored files are left out. Content is
 * read as UTF-8 for files with a known text extension up to the configured size limit;
 * larger, binary or unreadable files are kept in the tree without content. Symbolic links
 * are not followed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FileSystemScanner scanner = new FileSystemScanner(config.scan());
 * DirectoryNode root = scanner.scan(Path.of("."));
 * FileIndex index = FileIndex.build(root);
 * }</pre>
 */
public class FileSystemScanner {

    private static final Logger log = LoggerFactory.getLogger(FileSystemScanner.class);

    private static final Set<String> TEXT_EXTENSIONS = Set.of(
        "ts", "tsx", "js", "jsx", "mjs", "cjs", "py", "java", "c", "cc", "cxx", "cpp", "h", "hpp",
        "cs", "go", "rs", "rb", "php", "swift", "kt", "scala", "sh",
        "html", "css", "scss", "sass", "less", "json", "xml", "yaml", "yml",
        "md", "txt", "sql", "graphql", "vue", "svelte"
    );

    private final long maxFileSize;
    private final Set<String> ignoredDirectories;
    private final Set<String> ignoredFiles;

    private int filesScanned;
    private int directoriesScanned;
    private int filesWithoutContent;

    public FileSystemScanner() {
        this(ScanConfig.defaults());
    }

    public FileSystemScanner(ScanConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.maxFileSize = config.maxFileSize();
        this.ignoredDirectories = new HashSet<>(config.ignoredDirectories());
        this.ignoredFiles = new HashSet<>(config.ignoredFiles());
    }

    /**
     * Scans the directory tree below {@code root}.
     *
     * @param root directory to scan
     * @return root directory node with path {@code ""}
     * @throws IOException if {@code root} is not a readable directory
     */
    public DirectoryNode scan(Path root) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IOException("Not a directory: " + normalizedRoot);
        }

        filesScanned = 0;
        directoriesScanned = 0;
        filesWithoutContent = 0;

        log.info("Scanning {}", normalizedRoot);
        Path fileName = normalizedRoot.getFileName();
        String rootName = fileName == null ? normalizedRoot.toString() : fileName.toString();
        DirectoryNode tree = new DirectoryNode(rootName, "", scanChildren(normalizedRoot, normalizedRoot));
        log.info("Scanned {} files in {} directories ({} without content)",
            filesScanned, directoriesScanned, filesWithoutContent);
        return tree;
    }

    public int getFilesScanned() {
        return filesScanned;
    }

    /**
     * Returns true if the scanner reads the content of files with this name.
     *
     * @param fileName file name
     * @return true for known text extensions
     */
    public static boolean isTextFile(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot < 0) {
            return false;
        }
        return TEXT_EXTENSIONS.contains(fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT));
    }

    private List<TreeNode> scanChildren(Path root, Path directory) throws IOException {
        directoriesScanned++;
        List<Path> entries;
        try (Stream<Path> stream = Files.list(directory)) {
            entries = stream.sorted(Comparator.comparing(path -> path.getFileName().toString())).toList();
        }

        List<TreeNode> children = new ArrayList<>();
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                if (ignoredDirectories.contains(name)) {
                    log.debug("Skipping ignored directory {}", entry);
                    continue;
                }
                List<TreeNode> nested = scanDirectorySafely(root, entry);
                children.add(new DirectoryNode(name, relativePath(root, entry), nested));
            } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                if (ignoredFiles.contains(name)) {
                    continue;
                }
                children.add(scanFile(root, entry, name));
            }
        }
        return children;
    }

    private List<TreeNode> scanDirectorySafely(Path root, Path directory) {
        try {
            return scanChildren(root, directory);
        } catch (IOException e) {
            log.warn("Could not list directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private FileNode scanFile(Path root, Path file, String name) {
        filesScanned++;
        String path = relativePath(root, file);
        long size = 0;
        Instant lastModified = null;
        try {
            size = Files.size(file);
            lastModified = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            log.warn("Could not read attributes of {}: {}", file, e.getMessage());
        }

        String content = readContent(file, name, size);
        if (content == null) {
            filesWithoutContent++;
        }
        return new FileNode(name, path, null, Language.detect(name), content, size, lastModified);
    }

    private String readContent(Path file, String name, long size) {
        if (!isTextFile(name)) {
            return null;
        }
        if (size > maxFileSize) {
            log.warn("Skipping content of large file: {} ({} bytes)", file, size);
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.debug("Skipping content of non UTF-8 file {}", file);
            return null;
        } catch (IOException e) {
            log.warn("Could not read content of {}: {}", file, e.getMessage());
            return null;
        }
    }

    private String relativePath(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
