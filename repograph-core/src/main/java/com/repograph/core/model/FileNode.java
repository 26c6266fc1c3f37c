package com.repograph.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A file leaf in the scanned repository tree.
 *
 * <p>Only {@code path}, {@code language}, {@code content} and {@code relativePath} are consumed
 * by the resolver; size and modification time are carried for the visualization layer.
 *
 * @param name file name
 * @param path repository-relative path (unique key)
 * @param relativePath optional alternate lookup key, may be null
 * @param language language tag assigned by the scanner
 * @param content raw text content, null for binary, oversized or unread files
 * @param size file size in bytes
 * @param lastModified last modification time, may be null
 */
public record FileNode(
    String name,
    String path,
    String relativePath,
    Language language,
    String content,
    long size,
    Instant lastModified
) implements TreeNode {

    /**
     * Compact constructor with validation and defaults.
     */
    public FileNode {
        Objects.requireNonNull(path, "path must not be null");
        if (name == null) {
            name = DirectoryNode.lastSegment(path);
        }
        if (language == null) {
            language = Language.OTHER;
        }
        if (size < 0) {
            size = 0;
        }
    }

    /**
     * Creates a file node with content and a detected name.
     *
     * @param path repository-relative path
     * @param language language tag
     * @param content file content, may be null
     * @return file node
     */
    public static FileNode of(String path, Language language, String content) {
        long size = content == null ? 0 : content.length();
        return new FileNode(null, path, null, language, content, size, null);
    }

    /**
     * Creates a file node whose language is detected from the path's extension.
     *
     * @param path repository-relative path
     * @param content file content, may be null
     * @return file node
     */
    public static FileNode of(String path, String content) {
        return of(path, Language.detect(path), content);
    }
}
