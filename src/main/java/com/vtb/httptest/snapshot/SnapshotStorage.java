package com.vtb.httptest.snapshot;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Byte-level persistence for snapshots and variable files, keyed by {@code /}-separated path strings.
 */
public interface SnapshotStorage {

    /**
     * @throws java.nio.file.NoSuchFileException when nothing is stored under the path
     */
    byte[] read(String path) throws IOException;

    /**
     * Writes the data, creating parent directories as needed.
     */
    void write(String path, byte[] data) throws IOException;

    boolean exists(String path) throws IOException;

    /**
     * All stored paths under the directory, recursively. Empty when the directory does not exist.
     */
    List<String> list(String directory) throws IOException;

    /**
     * @return {@code false} when nothing was stored under the path
     */
    boolean delete(String path) throws IOException;

    /**
     * Canonical form of a storage path: {@code /} separators, no {@code .} or empty segments, {@code ..}
     * folded where a parent exists, no trailing slash. {@code ./snaps/}, {@code snaps} and
     * {@code snaps//x/..} all name {@code snaps}.
     */
    static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        String unified = path.replace('\\', '/');
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..") && !segments.isEmpty() && !segments.peekLast().equals("..")) {
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        String joined = String.join("/", segments);
        return unified.startsWith("/") ? "/" + joined : joined;
    }
}
