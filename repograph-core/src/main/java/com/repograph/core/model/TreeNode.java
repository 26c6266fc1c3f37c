package com.repograph.core.model;

/**
 * A node of the scanned repository tree handed to the resolver.
 *
 * <p>A node is either a {@link DirectoryNode} with ordered children or a {@link FileNode}
 * leaf. Paths are repository-relative and use {@code /} as separator.
 */
public interface TreeNode {

    /**
     * Returns the node's own name (last path segment).
     *
     * @return node name
     */
    String name();

    /**
     * Returns the repository-relative path of the node.
     *
     * @return node path
     */
    String path();
}
