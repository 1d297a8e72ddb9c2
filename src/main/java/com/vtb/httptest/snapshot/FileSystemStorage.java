package com.vtb.httptest.snapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileSystemStorage implements SnapshotStorage {

    private final Path root;

    /**
     * @param root base for relative paths; absolute paths are used as they are
     */
    public FileSystemStorage(Path root) {
        this.root = root;
    }

    public FileSystemStorage() {
        this(Paths.get(""));
    }

    @Override
    public byte[] read(String path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public void write(String path, byte[] data) throws IOException {
        Path target = resolve(path);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, data);
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public List<String> list(String directory) throws IOException {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files
                .filter(Files::isRegularFile)
                .map(file -> join(directory, dir.relativize(file)))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public boolean delete(String path) throws IOException {
        return Files.deleteIfExists(resolve(path));
    }

    private Path resolve(String path) {
        return root.resolve(path);
    }

    private static String join(String directory, Path relative) {
        String dir = SnapshotStorage.normalizePath(directory);
        String rel = relative.toString().replace('\\', '/');
        if (dir.isEmpty()) {
            return rel;
        }
        return dir.endsWith("/") ? dir + rel : dir + "/" + rel;
    }
}
