package com.adlanda.codexai.content;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds the source path key shared by the index, context filters and retrieval exclusions.
 *
 * A source path is {@code <projectId>/<relative path>} with forward slashes.
 */
public final class SourcePaths {

    private SourcePaths() {
    }

    public static String of(String projectId, String relativePath) {
        return projectId + "/" + normalize(relativePath);
    }

    /**
     * Canonical relative path: forward slashes, no empty or {@code .} segments, and each
     * {@code ..} folded into the segment before it. A {@code ..} that climbs above the
     * project root is kept so callers can reject the path.
     */
    public static String normalize(String relativePath) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : relativePath.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..") && !segments.isEmpty() && !segments.peekLast().equals("..")) {
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    public static String projectOf(String sourcePath) {
        int slash = sourcePath.indexOf('/');
        return slash < 0 ? sourcePath : sourcePath.substring(0, slash);
    }
}
