package com.vtb.httptest.config;

import com.vtb.httptest.execution.RetryPolicy;
import com.vtb.httptest.models.RunOptions;
import com.vtb.httptest.models.UpdateMode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsBundledConfiguration() {
        EngineConfig config = EngineConfig.load();

        assertEquals(10_000L, config.getHttp().getConnectTimeoutMs());
        assertEquals("VTB-HttpTest/1.0", config.getHttp().getUserAgent());
        assertEquals(3, config.getRetry().getMaxRetries());
        assertEquals("__snapshots__", config.getRunner().getSnapshotDir());
        assertEquals(UpdateMode.NONE, config.getRunner().updateModeValue());
        assertTrue(config.getRunner().getIgnoredHeaders().contains("Date"));
        assertEquals(60L, config.getOauth().getRefreshMarginSec());
        assertEquals("HTTPTEST_", config.getVariables().getEnvPrefix());
    }

    @Test
    void missingSectionsFallBackToDefaults() throws Exception {
        EngineConfig config = EngineConfig.load(yaml("""
            runner:
              updateMode: missing
              ignoredHeaders: [Date, Date, ETag]
            unknownSection:
              value: 1
            """));

        assertEquals(UpdateMode.MISSING, config.getRunner().updateModeValue());
        assertEquals(List.of("Date", "ETag"), config.getRunner().getIgnoredHeaders());
        assertEquals(4, config.getRunner().getMaxConcurrency());
        assertEquals(30_000L, config.getHttp().getReadTimeoutMs());
        assertTrue(config.getHttp().getFollowRedirects());
        assertFalse(config.getRetry().getIdempotentOnly());
    }

    @Test
    void invalidValuesAreReplaced() throws Exception {
        EngineConfig config = EngineConfig.load(yaml("""
            http:
              connectTimeoutMs: -5
            retry:
              maxRetries: -1
              backoffFactor: 0.5
              jitter: 3.0
              initialBackoffMs: 40000
            oauth:
              refreshMarginSec: -10
            """));

        assertEquals(10_000L, config.getHttp().getConnectTimeoutMs());
        assertEquals(3, config.getRetry().getMaxRetries());
        assertEquals(2.0, config.getRetry().getBackoffFactor());
        assertEquals(0.2, config.getRetry().getJitter());
        assertEquals(40_000L, config.getRetry().getMaxBackoffMs());
        assertEquals(60L, config.getOauth().getRefreshMarginSec());
    }

    @Test
    void emptyDocumentGivesDefaults() throws Exception {
        EngineConfig config = EngineConfig.load(yaml(""));

        assertNotNull(config.getRunner());
        assertEquals(EngineConfig.defaults().getRetry(), config.getRetry());
    }

    @Test
    void convertsRetrySection() throws Exception {
        EngineConfig config = EngineConfig.load(yaml("""
            retry:
              maxRetries: 5
              initialBackoffMs: 100
              maxBackoffMs: 2000
              backoffFactor: 3
              jitter: 0
              retryableStatusCodes: [503]
              idempotentOnly: true
            """));

        RetryPolicy policy = config.toRetryPolicy();

        assertEquals(5, policy.getMaxRetries());
        assertEquals(Duration.ofMillis(100), policy.getInitialBackoff());
        assertEquals(Duration.ofSeconds(2), policy.getMaxBackoff());
        assertEquals(3.0, policy.getBackoffFactor());
        assertEquals(0.0, policy.getJitter());
        assertEquals(Set.of(503), policy.getRetryableStatusCodes());
        assertTrue(policy.isIdempotentOnly());
        assertEquals(RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES, EngineConfig.defaults().toRetryPolicy().getRetryableStatusCodes());
    }

    @Test
    void unknownUpdateModeIsRejected() {
        EngineConfig config = EngineConfig.defaults();
        config.getRunner().setUpdateMode("sometimes");

        assertThrows(IllegalArgumentException.class, () -> config.getRunner().updateModeValue());
    }

    @Test
    void defaultIgnoredHeadersMatchRunOptions() {
        assertEquals(RunOptions.DEFAULT_IGNORED_HEADERS, EngineConfig.defaults().getRunner().getIgnoredHeaders());
        assertEquals(RunOptions.DEFAULT_IGNORED_HEADERS, RunOptions.builder().build().getIgnoredHeaders());
        assertEquals(RunOptions.DEFAULT_IGNORED_HEADERS, EngineConfig.load().getRunner().getIgnoredHeaders());
    }
}
