package com.vtb.httptest.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vtb.httptest.snapshot.SnapshotStorage;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Saves and loads variable scopes as flat JSON objects ({@code {"name": "value"}}).
 */
public class VariableFileStore {

    private static final TypeReference<LinkedHashMap<String, String>> VARIABLES = new TypeReference<>() {
    };

    private final SnapshotStorage storage;
    private final ObjectMapper mapper;

    public VariableFileStore(SnapshotStorage storage) {
        this.storage = storage;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(Map<String, String> variables, String path) throws IOException {
        storage.write(path, mapper.writeValueAsBytes(new LinkedHashMap<>(variables)));
    }

    /**
     * @return stored variables, empty when nothing is stored under the path
     */
    public Map<String, String> load(String path) throws IOException {
        byte[] raw;
        try {
            raw = storage.read(path);
        } catch (NoSuchFileException e) {
            return new LinkedHashMap<>();
        }
        if (raw.length == 0) {
            return new LinkedHashMap<>();
        }
        Map<String, String> variables = mapper.readValue(raw, VARIABLES);
        return variables != null ? variables : new LinkedHashMap<>();
    }
}
