package com.vtb.httptest.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.httptest.execution.RetryPolicy;
import com.vtb.httptest.models.RunOptions;
import com.vtb.httptest.models.UpdateMode;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Engine settings read from YAML. Every section is optional; missing values fall back to defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    public static final String DEFAULT_RESOURCE = "httptest-config.yaml";

    private Http http;
    private Retry retry;
    private Runner runner;
    private OAuth oauth;
    private Variables variables;

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath. Each call returns a new instance.
     */
    public static EngineConfig load() {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " not found on the classpath");
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration: " + e.getMessage(), e);
        }
    }

    public static EngineConfig load(InputStream yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        String text = new String(yaml.readAllBytes(), StandardCharsets.UTF_8);
        EngineConfig config = text.isBlank() ? null : mapper.readValue(text, EngineConfig.class);
        if (config == null) {
            config = new EngineConfig();
        }
        config.ensureDefaults();
        return config;
    }

    /**
     * Configuration with every default applied, for callers without a YAML file.
     */
    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (http == null) {
            http = new Http();
        }
        http.ensureDefaults();
        if (retry == null) {
            retry = new Retry();
        }
        retry.ensureDefaults();
        if (runner == null) {
            runner = new Runner();
        }
        runner.ensureDefaults();
        if (oauth == null) {
            oauth = new OAuth();
        }
        oauth.ensureDefaults();
        if (variables == null) {
            variables = new Variables();
        }
        variables.ensureDefaults();
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
            .maxRetries(retry.getMaxRetries())
            .initialBackoff(Duration.ofMillis(retry.getInitialBackoffMs()))
            .maxBackoff(Duration.ofMillis(retry.getMaxBackoffMs()))
            .backoffFactor(retry.getBackoffFactor())
            .jitter(retry.getJitter())
            .retryableStatusCodes(Set.copyOf(retry.getRetryableStatusCodes()))
            .idempotentOnly(Boolean.TRUE.equals(retry.getIdempotentOnly()))
            .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Http {
        private Long connectTimeoutMs;
        private Long readTimeoutMs;
        private Long writeTimeoutMs;
        private Boolean followRedirects;
        private String userAgent;

        public void ensureDefaults() {
            if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
                connectTimeoutMs = 10_000L;
            }
            if (readTimeoutMs == null || readTimeoutMs <= 0) {
                readTimeoutMs = 30_000L;
            }
            if (writeTimeoutMs == null || writeTimeoutMs <= 0) {
                writeTimeoutMs = 30_000L;
            }
            if (followRedirects == null) {
                followRedirects = Boolean.TRUE;
            }
            if (userAgent == null || userAgent.isBlank()) {
                userAgent = "VTB-HttpTest/1.0";
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retry {
        private Integer maxRetries;
        private Long initialBackoffMs;
        private Long maxBackoffMs;
        private Double backoffFactor;
        private Double jitter;
        private List<Integer> retryableStatusCodes;
        private Boolean idempotentOnly;

        public void ensureDefaults() {
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 3;
            }
            if (initialBackoffMs == null || initialBackoffMs < 0) {
                initialBackoffMs = 500L;
            }
            if (maxBackoffMs == null || maxBackoffMs < initialBackoffMs) {
                maxBackoffMs = Math.max(30_000L, initialBackoffMs);
            }
            if (backoffFactor == null || backoffFactor < 1.0) {
                backoffFactor = 2.0;
            }
            if (jitter == null || jitter < 0.0 || jitter > 1.0) {
                jitter = 0.2;
            }
            if (retryableStatusCodes == null || retryableStatusCodes.isEmpty()) {
                retryableStatusCodes = new ArrayList<>(RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES);
            }
            if (idempotentOnly == null) {
                idempotentOnly = Boolean.FALSE;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Runner {
        private String snapshotDir;
        private Integer maxConcurrency;
        private String updateMode;
        private Boolean failOnMissing;
        private List<String> ignoredHeaders;

        public void ensureDefaults() {
            if (snapshotDir == null || snapshotDir.isBlank()) {
                snapshotDir = "__snapshots__";
            }
            if (maxConcurrency == null || maxConcurrency <= 0) {
                maxConcurrency = 4;
            }
            if (updateMode == null || updateMode.isBlank()) {
                updateMode = "none";
            }
            if (failOnMissing == null) {
                failOnMissing = Boolean.FALSE;
            }
            if (ignoredHeaders == null) {
                ignoredHeaders = new ArrayList<>(RunOptions.DEFAULT_IGNORED_HEADERS);
            } else {
                ignoredHeaders = new ArrayList<>(new LinkedHashSet<>(ignoredHeaders));
            }
        }

        public UpdateMode updateModeValue() {
            return UpdateMode.fromString(updateMode);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OAuth {
        private Long refreshMarginSec;

        public void ensureDefaults() {
            if (refreshMarginSec == null || refreshMarginSec < 0) {
                refreshMarginSec = 60L;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Variables {
        private String envPrefix;

        public void ensureDefaults() {
            if (envPrefix == null) {
                envPrefix = "HTTPTEST_";
            }
        }
    }
}
