package com.repograph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A directory in the scanned repository tree.
 *
 * @param name directory name
 * @param path repository-relative directory path
 * @param children child directories and files, in scan order
 */
public record DirectoryNode(
    String name,
    String path,
    List<TreeNode> children
) implements TreeNode {

    /**
     * Compact constructor with validation.
     */
    public DirectoryNode {
        Objects.requireNonNull(path, "path must not be null");
        if (name == null) {
            name = path;
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a directory whose name is derived from the last segment of its path.
     *
     * @param path repository-relative directory path
     * @param children child nodes
     * @return directory node
     */
    public static DirectoryNode of(String path, TreeNode... children) {
        return new DirectoryNode(lastSegment(path), path, List.of(children));
    }

    static String lastSegment(String path) {
        String trimmed = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
