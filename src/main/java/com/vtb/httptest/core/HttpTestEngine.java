package com.vtb.httptest.core;

import com.vtb.httptest.config.EngineConfig;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.execution.HttpClientFactory;
import com.vtb.httptest.execution.HttpExecutor;
import com.vtb.httptest.execution.InMemorySessionStore;
import com.vtb.httptest.execution.RetryingTransport;
import com.vtb.httptest.execution.VariableStore;
import com.vtb.httptest.execution.VariableSubstitutor;
import com.vtb.httptest.execution.auth.AuthProvider;
import com.vtb.httptest.execution.auth.OAuth2Config;
import com.vtb.httptest.execution.auth.OAuth2Provider;
import com.vtb.httptest.models.HttpFile;
import com.vtb.httptest.models.RunOptions;
import com.vtb.httptest.models.TestFilter;
import com.vtb.httptest.models.TestReport;
import com.vtb.httptest.models.TestSequence;
import com.vtb.httptest.runner.AssertionEvaluator;
import com.vtb.httptest.runner.SequenceFileLoader;
import com.vtb.httptest.runner.SequenceRunner;
import com.vtb.httptest.runner.TestOrchestrator;
import com.vtb.httptest.runner.VariableExtractor;
import com.vtb.httptest.runner.VariableFileStore;
import com.vtb.httptest.snapshot.FileSystemStorage;
import com.vtb.httptest.snapshot.FormatterRegistry;
import com.vtb.httptest.snapshot.SnapshotStorage;
import com.vtb.httptest.snapshot.SnapshotStore;
import com.vtb.httptest.validation.SchemaValidator;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Wires the engine from an {@link EngineConfig}: HTTP client, retrying transport, executor, snapshot
 * store, sequence runner and orchestrator.
 */
@Slf4j
public class HttpTestEngine {

    private final EngineConfig config;
    private final OkHttpClient httpClient;
    private final HttpExecutor executor;
    private final SnapshotStore snapshots;
    private final SequenceRunner sequenceRunner;
    private final TestOrchestrator orchestrator;
    private final SequenceFileLoader sequenceLoader = new SequenceFileLoader();

    private HttpTestEngine(Builder builder) {
        this.config = builder.config;
        this.httpClient = HttpClientFactory.create(
            Duration.ofMillis(config.getHttp().getConnectTimeoutMs()),
            Duration.ofMillis(config.getHttp().getReadTimeoutMs()),
            Duration.ofMillis(config.getHttp().getWriteTimeoutMs()),
            config.getHttp().getFollowRedirects(),
            config.getHttp().getUserAgent());

        VariableStore variables = new VariableStore();
        int loaded = variables.loadFromEnvironment(config.getVariables().getEnvPrefix(), builder.environment);
        if (loaded > 0) {
            log.debug("Loaded {} variable(s) from the environment", loaded);
        }

        AuthProvider auth = builder.authProvider;
        if (auth == null && builder.oauth2 != null) {
            auth = new OAuth2Provider(builder.oauth2, httpClient, builder.clock);
        }

        RetryingTransport transport = new RetryingTransport(
            request -> httpClient.newCall(request).execute(), config.toRetryPolicy(), builder.random);
        this.executor = new HttpExecutor(transport, new InMemorySessionStore(), variables, new VariableSubstitutor(),
            auth, builder.clock);

        SnapshotStorage storage = builder.storage != null ? builder.storage : new FileSystemStorage();
        this.snapshots = new SnapshotStore(storage, FormatterRegistry.withDefaults(),
            config.getRunner().getSnapshotDir(), builder.clock);

        VariableFileStore variableFiles = new VariableFileStore(storage);
        VariableExtractor extractor = new VariableExtractor();
        AssertionEvaluator assertions = new AssertionEvaluator();
        this.sequenceRunner = new SequenceRunner(executor, builder.schemaValidator, extractor, assertions,
            variableFiles, builder.clock);
        this.orchestrator = new TestOrchestrator(executor, snapshots, builder.schemaValidator, extractor, assertions,
            sequenceRunner, variableFiles, builder.clock);
    }

    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    public static HttpTestEngine create() {
        return builder(EngineConfig.load()).build();
    }

    /**
     * Run options pre-filled from the {@code runner} section.
     */
    public RunOptions defaultRunOptions() {
        EngineConfig.Runner runner = config.getRunner();
        return RunOptions.builder()
            .updateMode(runner.updateModeValue())
            .failOnMissing(Boolean.TRUE.equals(runner.getFailOnMissing()))
            .ignoredHeaders(new ArrayList<>(runner.getIgnoredHeaders()))
            .maxConcurrency(runner.getMaxConcurrency())
            .build();
    }

    /**
     * An OAuth2 settings builder carrying the configured refresh margin.
     */
    public static OAuth2Config.OAuth2ConfigBuilder oauth2Settings(EngineConfig config) {
        return OAuth2Config.builder().refreshMargin(Duration.ofSeconds(config.getOauth().getRefreshMarginSec()));
    }

    public TestReport runTests(List<HttpFile> files, RunOptions options, CancellationSignal cancellation)
        throws IOException {
        return orchestrator.runTests(files, options, cancellation);
    }

    /**
     * Loads the sequences found under the given files or directories, filters them and runs them.
     */
    public TestReport runSequences(List<Path> locations, TestFilter filter, RunOptions options,
                                   CancellationSignal cancellation) throws IOException {
        List<TestSequence> sequences = sequenceLoader.findSequences(locations, filter);
        log.info("Found {} sequence(s)", sequences.size());
        return orchestrator.runSequences(sequences, options, cancellation);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public HttpExecutor getExecutor() {
        return executor;
    }

    public SnapshotStore getSnapshots() {
        return snapshots;
    }

    public SequenceRunner getSequenceRunner() {
        return sequenceRunner;
    }

    public TestOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SequenceFileLoader getSequenceLoader() {
        return sequenceLoader;
    }

    public static final class Builder {
        private final EngineConfig config;
        private SnapshotStorage storage;
        private SchemaValidator schemaValidator;
        private AuthProvider authProvider;
        private OAuth2Config oauth2;
        private Clock clock = Clock.systemUTC();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private Map<String, String> environment = System.getenv();

        private Builder(EngineConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config is required");
            }
            config.ensureDefaults();
            this.config = config;
        }

        /** Snapshot and variable file storage; the working directory by default. */
        public Builder storage(SnapshotStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder schemaValidator(SchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        /** Default auth for requests without their own descriptor. Takes priority over {@link #oauth2}. */
        public Builder authProvider(AuthProvider authProvider) {
            this.authProvider = authProvider;
            return this;
        }

        public Builder oauth2(OAuth2Config oauth2) {
            this.oauth2 = oauth2;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public HttpTestEngine build() {
            return new HttpTestEngine(this);
        }
    }
}
