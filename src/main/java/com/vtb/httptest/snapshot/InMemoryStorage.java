package com.vtb.httptest.snapshot;

import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed storage for tests and dry runs.
 */
public class InMemoryStorage implements SnapshotStorage {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();

    @Override
    public byte[] read(String path) throws NoSuchFileException {
        byte[] data = files.get(normalize(path));
        if (data == null) {
            throw new NoSuchFileException(path);
        }
        return data.clone();
    }

    @Override
    public void write(String path, byte[] data) {
        files.put(normalize(path), data.clone());
    }

    @Override
    public boolean exists(String path) {
        return files.containsKey(normalize(path));
    }

    @Override
    public List<String> list(String directory) {
        String dir = normalize(directory);
        String prefix = dir.isEmpty() ? "" : dir + "/";
        return files.keySet().stream()
            .filter(path -> path.startsWith(prefix))
            .sorted()
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String path) {
        return files.remove(normalize(path)) != null;
    }

    private static String normalize(String path) {
        return SnapshotStorage.normalizePath(path);
    }
}
