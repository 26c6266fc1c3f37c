package com.repograph.core.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Utility methods for {@code /}-separated repository paths.
 */
public final class PathUtils {

    private PathUtils() {
        // Utility class
    }

    /**
     * Returns true if the reference starts with {@code ./} or {@code ../}.
     *
     * @param reference raw reference
     * @return true for relative references
     */
    public static boolean isRelative(String reference) {
        return reference != null && (reference.startsWith("./") || reference.startsWith("../"));
    }

    /**
     * Returns the directory part of a path, without trailing slash.
     *
     * @param path file path
     * @return parent directory, empty string if the path has no directory part
     */
    public static String parent(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }

    /**
     * Returns the last segment of a path.
     *
     * @param path path or reference, may use {@code /} separators
     * @return last segment
     */
    public static String lastSegment(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Resolves a reference against a base directory.
     *
     * <p>{@code ..} pops one segment (never above the root), {@code .} and empty segments are
     * ignored, anything else is appended. A leading {@code /} on the base is preserved.
     *
     * <pre>{@code
     * PathUtils.resolve("src/a", "../c")      // "src/c"
     * PathUtils.resolve("src/a", "./b/./d")   // "src/a/b/d"
     * PathUtils.resolve("/src", "../../x")    // "/x"
     * }</pre>
     *
     * @param baseDirectory directory to resolve from
     * @param reference relative reference
     * @return normalized path
     */
    public static String resolve(String baseDirectory, String reference) {
        String base = baseDirectory == null ? "" : baseDirectory;
        boolean absolute = base.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        push(segments, base);
        push(segments, reference == null ? "" : reference);
        String joined = String.join("/", segments);
        return absolute ? "/" + joined : joined;
    }

    /**
     * Resolves a relative reference against the directory of the referencing file.
     *
     * @param fromFile path of the referencing file
     * @param reference relative reference such as {@code ../utils}
     * @return normalized candidate path
     */
    public static String resolveFrom(String fromFile, String reference) {
        return resolve(parent(fromFile), reference);
    }

    /**
     * Climbs {@code levels} directories up from a directory.
     *
     * @param directory starting directory
     * @param levels number of segments to drop
     * @return ancestor directory, never above the root
     */
    public static String ancestor(String directory, int levels) {
        String current = directory == null ? "" : directory;
        for (int i = 0; i < levels && !current.isEmpty(); i++) {
            int slash = current.lastIndexOf('/');
            current = slash >= 0 ? current.substring(0, slash) : "";
        }
        return current;
    }

    /**
     * Joins a directory and a child path with exactly one separator.
     *
     * @param directory directory, may be empty
     * @param child child path
     * @return joined path
     */
    public static String join(String directory, String child) {
        if (directory == null || directory.isEmpty()) {
            return child;
        }
        if (directory.endsWith("/")) {
            return directory + child;
        }
        return directory + "/" + child;
    }

    private static void push(Deque<String> segments, String path) {
        for (String part : path.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(part);
            }
        }
    }
}
