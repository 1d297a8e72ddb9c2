package com.vtb.httptest.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.httptest.models.TestFilter;
import com.vtb.httptest.models.TestSequence;
import com.vtb.httptest.models.TestStep;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads sequence definitions from JSON files.
 */
@Slf4j
public class SequenceFileLoader {

    private final ObjectMapper mapper;

    public SequenceFileLoader() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public TestSequence load(Path file) throws IOException {
        TestSequence sequence = mapper.readValue(file.toFile(), TestSequence.class);
        if (sequence == null) {
            throw new IOException("Sequence file is empty: " + file);
        }
        sequence.setFilePath(file.toString());
        applyDefaults(sequence);
        return sequence;
    }

    /**
     * Loads every {@code .json} file among the given files and directories (searched recursively) and keeps
     * the sequences matching the filter. Files that cannot be parsed are logged and skipped.
     */
    public List<TestSequence> findSequences(List<Path> locations, TestFilter filter) throws IOException {
        List<TestSequence> sequences = new ArrayList<>();
        for (Path location : locations) {
            for (Path file : jsonFiles(location)) {
                TestSequence sequence;
                try {
                    sequence = load(file);
                } catch (IOException e) {
                    log.warn("Skipping sequence file {}: {}", file, e.getMessage());
                    continue;
                }
                if (matches(sequence, filter)) {
                    sequences.add(sequence);
                }
            }
        }
        return sequences;
    }

    /**
     * Tags: any filter tag present on the sequence. Names: substring of the sequence name. Metadata: every
     * pair must match exactly. Methods and paths apply to requests and are ignored here.
     */
    static boolean matches(TestSequence sequence, TestFilter filter) {
        if (filter == null) {
            return true;
        }
        if (!filter.getTags().isEmpty() && filter.getTags().stream().noneMatch(sequence.getTags()::contains)) {
            return false;
        }
        if (!filter.getNames().isEmpty()
            && (sequence.getName() == null || filter.getNames().stream().noneMatch(sequence.getName()::contains))) {
            return false;
        }
        for (Map.Entry<String, String> entry : filter.getMetadata().entrySet()) {
            if (!entry.getValue().equals(sequence.getMetadata().get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static List<Path> jsonFiles(Path location) throws IOException {
        if (Files.isRegularFile(location)) {
            return location.toString().endsWith(".json") ? List.of(location) : List.of();
        }
        if (!Files.isDirectory(location)) {
            log.warn("Sequence location does not exist: {}", location);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(location)) {
            return walk.filter(Files::isRegularFile)
                .filter(p -> p.toString().endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static void applyDefaults(TestSequence sequence) {
        if (sequence.getSteps() == null) {
            sequence.setSteps(new ArrayList<>());
        }
        if (sequence.getVariables() == null) {
            sequence.setVariables(new LinkedHashMap<>());
        }
        if (sequence.getTags() == null) {
            sequence.setTags(new ArrayList<>());
        }
        if (sequence.getMetadata() == null) {
            sequence.setMetadata(new LinkedHashMap<>());
        }
        for (TestStep step : sequence.getSteps()) {
            if (step.getVariables() == null) {
                step.setVariables(new ArrayList<>());
            }
            if (step.getAssertions() == null) {
                step.setAssertions(new ArrayList<>());
            }
        }
    }
}
