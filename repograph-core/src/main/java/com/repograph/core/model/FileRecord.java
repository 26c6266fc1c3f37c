package com.repograph.core.model;

import java.util.Objects;

/**
 * An indexed file: the part of a {@link FileNode} the resolver works with.
 *
 * @param path repository-relative path (unique key in the index)
 * @param name file name
 * @param language language tag
 * @param content raw text content, null when absent
 * @param relativePath optional alternate lookup key
 */
public record FileRecord(
    String path,
    String name,
    Language language,
    String content,
    String relativePath
) {
    /**
     * Compact constructor with validation.
     */
    public FileRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (language == null) {
            language = Language.OTHER;
        }
    }

    /**
     * Builds a record from a scanned file node.
     *
     * @param node file node
     * @return file record
     */
    public static FileRecord from(FileNode node) {
        return new FileRecord(node.path(), node.name(), node.language(), node.content(), node.relativePath());
    }

    /**
     * Returns true if the file carries non-empty text content.
     *
     * @return true when content is present and not empty
     */
    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    /**
     * Returns the directory part of the path, without trailing slash.
     *
     * @return parent directory, empty string for root-level files
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }
}
