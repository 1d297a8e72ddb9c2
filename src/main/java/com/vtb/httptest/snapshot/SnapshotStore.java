package com.vtb.httptest.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.httptest.exceptions.SnapshotCorruptException;
import com.vtb.httptest.exceptions.SnapshotMissingException;
import com.vtb.httptest.models.BodyDiff;
import com.vtb.httptest.models.HeaderDiff;
import com.vtb.httptest.models.HeaderValueDiff;
import com.vtb.httptest.models.HttpRequest;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.SnapshotData;
import com.vtb.httptest.models.SnapshotDiff;
import com.vtb.httptest.models.SnapshotMetadata;
import com.vtb.httptest.models.SnapshotResult;
import com.vtb.httptest.models.SnapshotStats;
import com.vtb.httptest.models.StatusDiff;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Saves responses as snapshots and diffs new responses against them.
 * <p>
 * Snapshot path: {@code <snapshotDir>/<collection>/<identifier>_<method>.snap.json}. The collection is the
 * base name of the collection file without extension, the identifier is the request path template
 * (falling back to the request name, then the URL path). All three parts are sanitised
 * ({@code [a-z0-9_-]} kept, everything else replaced by {@code _}) and lower-cased; the identifier is cut
 * at 100 characters. Existing snapshot trees depend on this layout, so collection files that share a base
 * name in different directories also share a snapshot directory.
 * <p>
 * The snapshot directory and every tracked path are kept in {@link SnapshotStorage#normalizePath} form.
 * <p>
 * Distinct paths may be written concurrently; writers of the same path are not arbitrated.
 */
@Slf4j
public class SnapshotStore {

    public static final String SNAPSHOT_EXTENSION = ".snap.json";
    static final int MAX_IDENTIFIER_LENGTH = 100;

    private final SnapshotStorage storage;
    private final FormatterRegistry formatters;
    private final String snapshotDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    private final ReentrantLock statsLock = new ReentrantLock();
    private SnapshotStats stats;
    private final Set<String> usedSnapshots = ConcurrentHashMap.newKeySet();

    public SnapshotStore(SnapshotStorage storage, FormatterRegistry formatters, String snapshotDir, Clock clock) {
        this.storage = storage;
        this.formatters = formatters;
        this.snapshotDir = SnapshotStorage.normalizePath(snapshotDir);
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.stats = emptyStats();
    }

    public String getSnapshotDir() {
        return snapshotDir;
    }

    public FormatterRegistry getFormatters() {
        return formatters;
    }

    public String snapshotPath(String collectionId, HttpRequest request) {
        String collection = sanitize(baseName(collectionId));
        if (collection.isEmpty()) {
            collection = "default";
        }
        String identifier = sanitize(identifierOf(request));
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            identifier = identifier.substring(0, MAX_IDENTIFIER_LENGTH);
        }
        String method = sanitize(request.getMethod() != null ? request.getMethod() : "GET");
        String fileName = identifier + "_" + method + SNAPSHOT_EXTENSION;
        String relative = collection + "/" + fileName;
        if (snapshotDir.isEmpty()) {
            return relative;
        }
        return snapshotDir.endsWith("/") ? snapshotDir + relative : snapshotDir + "/" + relative;
    }

    /**
     * Saves the response under the path derived from the collection and its request.
     *
     * @return the snapshot path
     */
    public String save(HttpResponse response, String collectionId) throws IOException {
        String path = snapshotPath(collectionId, requestOf(response));
        saveTo(response, path);
        return path;
    }

    public void saveTo(HttpResponse response, String path) throws IOException {
        ResponseFormatter formatter = formatters.forContentType(response.getContentType());
        HttpRequest request = requestOf(response);
        SnapshotData data = SnapshotData.builder()
            .metadata(SnapshotMetadata.builder()
                .requestPath(request.getPath() != null ? request.getPath() : request.getUrl())
                .requestMethod(request.getMethod())
                .contentType(response.getContentType())
                .statusCode(response.getStatusCode())
                .headers(copyHeaders(response.getHeaders()))
                .createdAt(clock.instant())
                .build())
            .content(formatter.format(response.getBody()))
            .build();
        storage.write(path, mapper.writeValueAsBytes(data));
        markUsed(path);
        log.debug("Snapshot written: {}", path);
    }

    /**
     * Reads a stored snapshot.
     *
     * @throws SnapshotMissingException when nothing is stored under the path
     * @throws SnapshotCorruptException when the stored data cannot be parsed
     * @throws IOException              when the storage itself fails
     */
    public SnapshotData load(String path) throws SnapshotMissingException, SnapshotCorruptException, IOException {
        byte[] raw;
        try {
            raw = storage.read(path);
        } catch (NoSuchFileException e) {
            throw new SnapshotMissingException("Snapshot not found: " + path, e);
        }
        SnapshotData data;
        try {
            data = mapper.readValue(raw, SnapshotData.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotCorruptException("Snapshot cannot be parsed: " + path + " (" + e.getOriginalMessage() + ")", e);
        }
        if (data == null || data.getMetadata() == null) {
            throw new SnapshotCorruptException("Snapshot has no metadata: " + path);
        }
        return data;
    }

    /**
     * Rebuilds a response from a stored snapshot.
     */
    public HttpResponse loadResponse(String path) throws SnapshotMissingException, SnapshotCorruptException, IOException {
        SnapshotData data = load(path);
        SnapshotMetadata metadata = data.getMetadata();
        byte[] body = formatters.forContentType(metadata.getContentType()).restore(data.getContent());
        return HttpResponse.builder()
            .statusCode(metadata.getStatusCode())
            .headers(copyHeaders(metadata.getHeaders()))
            .body(body)
            .contentType(metadata.getContentType() != null ? metadata.getContentType() : HttpResponse.DEFAULT_CONTENT_TYPE)
            .contentLength(body.length)
            .timestamp(metadata.getCreatedAt())
            .request(HttpRequest.builder()
                .method(metadata.getRequestMethod())
                .path(metadata.getRequestPath())
                .build())
            .build();
    }

    public boolean exists(String path) throws IOException {
        return storage.exists(path);
    }

    public SnapshotDiff compare(HttpResponse response, String path)
        throws SnapshotMissingException, SnapshotCorruptException, IOException {
        return compare(response, path, Collections.emptyList());
    }

    /**
     * Diffs the response against the stored snapshot. Ignored headers are matched case-insensitively.
     */
    public SnapshotDiff compare(HttpResponse response, String path, Collection<String> ignoredHeaders)
        throws SnapshotMissingException, SnapshotCorruptException, IOException {
        SnapshotData snapshot = load(path);
        markUsed(path);
        SnapshotMetadata metadata = snapshot.getMetadata();

        StatusDiff statusDiff = new StatusDiff(metadata.getStatusCode(), response.getStatusCode(),
            metadata.getStatusCode() == response.getStatusCode());
        HeaderDiff headerDiff = compareHeaders(metadata.getHeaders(), response.getHeaders(), ignoredHeaders);

        ResponseFormatter formatter = formatters.forContentType(response.getContentType());
        BodyDiff bodyDiff = formatter.compare(snapshot.getContent(), formatter.format(response.getBody()));

        return SnapshotDiff.builder()
            .statusDiff(statusDiff)
            .headerDiff(headerDiff)
            .bodyDiff(bodyDiff)
            .equal(statusDiff.isEqual() && headerDiff.isEqual() && bodyDiff.isEqual())
            .build();
    }

    /**
     * Header comparison by lower-cased name. Value lists are compared regardless of order.
     */
    public HeaderDiff compareHeaders(Map<String, List<String>> expected, Map<String, List<String>> actual,
                                     Collection<String> ignoredHeaders) {
        Set<String> ignored = new HashSet<>();
        if (ignoredHeaders != null) {
            ignoredHeaders.forEach(h -> ignored.add(h.toLowerCase(Locale.ROOT)));
        }
        Map<String, List<String>> exp = lowerCaseKeys(expected, ignored);
        Map<String, List<String>> act = lowerCaseKeys(actual, ignored);

        HeaderDiff diff = HeaderDiff.builder().build();
        for (Map.Entry<String, List<String>> entry : exp.entrySet()) {
            List<String> actualValues = act.get(entry.getKey());
            if (actualValues == null) {
                diff.getMissing().put(entry.getKey(), entry.getValue());
            } else if (!sorted(entry.getValue()).equals(sorted(actualValues))) {
                diff.getDifferentValues().put(entry.getKey(), new HeaderValueDiff(entry.getValue(), actualValues));
            }
        }
        for (Map.Entry<String, List<String>> entry : act.entrySet()) {
            if (!exp.containsKey(entry.getKey())) {
                diff.getExtra().put(entry.getKey(), entry.getValue());
            }
        }
        diff.setEqual(diff.getMissing().isEmpty() && diff.getExtra().isEmpty() && diff.getDifferentValues().isEmpty());
        return diff;
    }

    // --- stats ---

    /**
     * Adds the outcome of one snapshot check to the session counters.
     */
    public void record(SnapshotResult result, boolean passed) {
        statsLock.lock();
        try {
            stats.setTotal(stats.getTotal() + 1);
            if (passed) {
                stats.setPassed(stats.getPassed() + 1);
            } else {
                stats.setFailed(stats.getFailed() + 1);
            }
            if (result.isCreated()) {
                stats.setCreated(stats.getCreated() + 1);
            }
            if (result.isUpdated()) {
                stats.setUpdated(stats.getUpdated() + 1);
            }
        } finally {
            statsLock.unlock();
        }
    }

    public void recordError() {
        statsLock.lock();
        try {
            stats.setErrors(stats.getErrors() + 1);
        } finally {
            statsLock.unlock();
        }
    }

    public SnapshotStats getStats() {
        statsLock.lock();
        try {
            return stats.toBuilder().build();
        } finally {
            statsLock.unlock();
        }
    }

    public void resetStats() {
        statsLock.lock();
        try {
            stats = emptyStats();
        } finally {
            statsLock.unlock();
        }
    }

    // --- cleanup ---

    public void markUsed(String path) {
        usedSnapshots.add(SnapshotStorage.normalizePath(path));
    }

    public Set<String> getUsedSnapshots() {
        return new HashSet<>(usedSnapshots);
    }

    /**
     * Deletes stored snapshots under the directory that are not in the used set. Paths on both sides are
     * compared in {@link SnapshotStorage#normalizePath normalized} form.
     *
     * @return deleted paths, as listed by the storage
     */
    public List<String> cleanup(String directory, Set<String> used) throws IOException {
        Set<String> keep = new HashSet<>();
        used.forEach(path -> keep.add(SnapshotStorage.normalizePath(path)));
        List<String> deleted = new ArrayList<>();
        for (String path : storage.list(directory)) {
            if (path.endsWith(SNAPSHOT_EXTENSION) && !keep.contains(SnapshotStorage.normalizePath(path))
                && storage.delete(path)) {
                deleted.add(path);
            }
        }
        if (!deleted.isEmpty()) {
            log.info("Removed {} unused snapshot(s) from {}", deleted.size(), directory);
        }
        return deleted;
    }

    /**
     * {@link #cleanup(String, Set)} with the paths saved or compared through this store.
     */
    public List<String> cleanupUnused(String directory) throws IOException {
        return cleanup(directory, getUsedSnapshots());
    }

    // --- helpers ---

    static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static String identifierOf(HttpRequest request) {
        if (request.getPath() != null && !request.getPath().isBlank()) {
            return request.getPath();
        }
        if (request.getName() != null && !request.getName().isBlank()) {
            return request.getName();
        }
        HttpUrl url = request.getUrl() != null ? HttpUrl.parse(request.getUrl()) : null;
        if (url != null) {
            return url.encodedPath();
        }
        return request.getUrl() != null ? request.getUrl() : "request";
    }

    private static String baseName(String collectionId) {
        if (collectionId == null) {
            return "";
        }
        String normalized = collectionId.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static HttpRequest requestOf(HttpResponse response) {
        if (response.getRequest() == null) {
            throw new IllegalArgumentException("Response has no originating request");
        }
        return response.getRequest();
    }

    private static Map<String, List<String>> lowerCaseKeys(Map<String, List<String>> headers, Set<String> ignored) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (headers == null) {
            return result;
        }
        headers.forEach((name, values) -> {
            String key = name.toLowerCase(Locale.ROOT);
            if (!ignored.contains(key)) {
                result.computeIfAbsent(key, k -> new ArrayList<>()).addAll(values != null ? values : List.of());
            }
        });
        return result;
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, values != null ? new ArrayList<>(values) : new ArrayList<>()));
        }
        return copy;
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }

    private SnapshotStats emptyStats() {
        return SnapshotStats.builder().startTime(clock.instant()).build();
    }
}
