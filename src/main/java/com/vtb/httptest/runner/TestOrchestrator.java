package com.vtb.httptest.runner;

import com.vtb.httptest.exceptions.AssertionEvaluationException;
import com.vtb.httptest.exceptions.HttpTestException;
import com.vtb.httptest.exceptions.SchemaValidationException;
import com.vtb.httptest.exceptions.SnapshotCorruptException;
import com.vtb.httptest.exceptions.SnapshotMissingException;
import com.vtb.httptest.exceptions.VariableExtractionException;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.execution.HttpExecutor;
import com.vtb.httptest.execution.VariableStore;
import com.vtb.httptest.models.AssertionResult;
import com.vtb.httptest.models.HttpFile;
import com.vtb.httptest.models.HttpRequest;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.OperationDescriptor;
import com.vtb.httptest.models.RunOptions;
import com.vtb.httptest.models.SchemaValidationResult;
import com.vtb.httptest.models.SequenceResult;
import com.vtb.httptest.models.SnapshotDiff;
import com.vtb.httptest.models.SnapshotResult;
import com.vtb.httptest.models.StepResult;
import com.vtb.httptest.models.TestReport;
import com.vtb.httptest.models.TestResult;
import com.vtb.httptest.models.TestSequence;
import com.vtb.httptest.models.TestStatus;
import com.vtb.httptest.models.TestSummary;
import com.vtb.httptest.models.UpdateMode;
import com.vtb.httptest.snapshot.SnapshotStore;
import com.vtb.httptest.validation.SchemaValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs collections of requests as snapshot tests and sequences of steps, and aggregates a {@link TestReport}.
 * <p>
 * Sequential runs keep file-then-request order. Parallel runs return results in completion order;
 * {@link TestResult#getOrdinal()} restores the original order. Storage failures are not test failures:
 * they abort the run as {@link IOException}.
 */
@Slf4j
public class TestOrchestrator {

    private final HttpExecutor executor;
    private final SnapshotStore snapshots;
    private final SchemaValidator schemaValidator;
    private final VariableExtractor extractor;
    private final AssertionEvaluator assertions;
    private final SequenceRunner sequenceRunner;
    private final VariableFileStore variableFiles;
    private final Clock clock;

    private final AtomicInteger workerCounter = new AtomicInteger();

    private record WorkItem(int ordinal, HttpRequest request, String collectionId) {
    }

    /**
     * @param schemaValidator may be {@code null}; runs asking for schema validation then fail fast
     * @param variableFiles   may be {@code null}; variable files are then neither loaded nor saved
     */
    public TestOrchestrator(HttpExecutor executor,
                            SnapshotStore snapshots,
                            SchemaValidator schemaValidator,
                            VariableExtractor extractor,
                            AssertionEvaluator assertions,
                            SequenceRunner sequenceRunner,
                            VariableFileStore variableFiles,
                            Clock clock) {
        this.executor = executor;
        this.snapshots = snapshots;
        this.schemaValidator = schemaValidator;
        this.extractor = extractor;
        this.assertions = assertions;
        this.sequenceRunner = sequenceRunner;
        this.variableFiles = variableFiles;
        this.clock = clock;
    }

    public SnapshotStore getSnapshots() {
        return snapshots;
    }

    // --- collections ---

    public TestReport runTests(List<HttpFile> files, RunOptions options, CancellationSignal cancellation)
        throws IOException {
        requireValidator(options);
        TestReport report = new TestReport();
        report.setStartTime(clock.instant());
        long started = System.nanoTime();

        List<WorkItem> work = collectWork(files, options);
        Map<String, String> runScope = new ConcurrentHashMap<>(VariableStore.layer(options.getVariables()));
        log.info("Running {} test(s) from {} file(s){}", work.size(), files.size(),
            options.isParallel() ? " in parallel" : "");

        List<TestResult> results = options.isParallel() && work.size() > 1
            ? runParallel(work, runScope, options, cancellation)
            : runSequential(work, runScope, options, cancellation);

        report.setResults(results);
        report.setCancelled(cancellation.isCancelled());
        finish(report, started);
        return report;
    }

    /**
     * Executes one request and checks it against its snapshot.
     */
    public TestResult runOneTest(HttpRequest request, String collectionId, RunOptions options,
                                 CancellationSignal cancellation) throws IOException {
        requireValidator(options);
        return runOneTest(request, collectionId, 0, new LinkedHashMap<>(VariableStore.layer(options.getVariables())),
            options, cancellation);
    }

    private List<WorkItem> collectWork(List<HttpFile> files, RunOptions options) {
        List<WorkItem> work = new ArrayList<>();
        for (HttpFile file : files) {
            List<HttpRequest> matching = file.getRequests().stream()
                .filter(r -> RequestFilter.matches(r, options.getFilter()))
                .toList();
            if (matching.isEmpty()) {
                log.debug("Skipping {}: no matching requests", file.getPath());
                continue;
            }
            for (HttpRequest request : matching) {
                work.add(new WorkItem(work.size(), request, file.getPath()));
            }
        }
        return work;
    }

    private List<TestResult> runSequential(List<WorkItem> work, Map<String, String> runScope, RunOptions options,
                                           CancellationSignal cancellation) throws IOException {
        List<TestResult> results = new ArrayList<>();
        for (WorkItem item : work) {
            if (cancellation.isCancelled()) {
                log.info("Run cancelled after {} of {} test(s)", results.size(), work.size());
                break;
            }
            TestResult result = runOneTest(item.request(), item.collectionId(), item.ordinal(), runScope, options,
                cancellation);
            results.add(result);
            if (options.isStopOnFailure() && result.getStatus().isFailure()) {
                log.info("Stopping after failed test '{}'", result.getName());
                break;
            }
        }
        return results;
    }

    private List<TestResult> runParallel(List<WorkItem> work, Map<String, String> runScope, RunOptions options,
                                         CancellationSignal cancellation) throws IOException {
        int workers = Math.min(Math.max(1, options.getMaxConcurrency()), work.size());
        BlockingQueue<WorkItem> queue = new ArrayBlockingQueue<>(work.size());
        queue.addAll(work);

        List<TestResult> results = new ArrayList<>(work.size());
        ReentrantLock resultsLock = new ReentrantLock();
        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicReference<IOException> infrastructureFailure = new AtomicReference<>();

        Callable<Void> worker = () -> {
            WorkItem item;
            while (!stop.get() && !cancellation.isCancelled() && (item = queue.poll()) != null) {
                TestResult result;
                try {
                    result = runOneTest(item.request(), item.collectionId(), item.ordinal(), runScope, options,
                        cancellation);
                } catch (IOException e) {
                    infrastructureFailure.compareAndSet(null, e);
                    stop.set(true);
                    break;
                }
                resultsLock.lock();
                try {
                    results.add(result);
                } finally {
                    resultsLock.unlock();
                }
                if (options.isStopOnFailure() && result.getStatus().isFailure()) {
                    stop.set(true);
                }
            }
            return null;
        };

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                tasks.add(worker);
            }
            for (Future<Void> future : pool.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Worker failed", cause);
        } finally {
            pool.shutdownNow();
        }

        if (infrastructureFailure.get() != null) {
            throw infrastructureFailure.get();
        }
        resultsLock.lock();
        try {
            return new ArrayList<>(results);
        } finally {
            resultsLock.unlock();
        }
    }

    private ThreadFactory workerThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "httptest-worker-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private TestResult runOneTest(HttpRequest request, String collectionId, int ordinal, Map<String, String> scope,
                                  RunOptions options, CancellationSignal cancellation) throws IOException {
        long started = System.nanoTime();
        TestResult result = TestResult.builder()
            .name(request.displayName())
            .filePath(collectionId)
            .ordinal(ordinal)
            .request(request)
            .tags(request.getTag() != null ? new ArrayList<>(List.of(request.getTag())) : new ArrayList<>())
            .build();

        HttpResponse response;
        try {
            response = executor.execute(request, new LinkedHashMap<>(scope), options.getTimeout(), cancellation);
        } catch (HttpTestException e) {
            snapshots.recordError();
            result.setStatus(TestStatus.ERROR);
            result.setError(e.getMessage());
            result.setDuration(elapsed(started));
            log.debug("Test '{}' errored: {}", result.getName(), e.getMessage());
            return result;
        }
        result.setResponse(response);
        result.setRequest(response.getRequest());

        checkSnapshot(result, response, collectionId, options);
        if (result.getStatus() == TestStatus.PASSED) {
            runChecks(result, response, request, scope, options);
        }
        result.setDuration(elapsed(started));
        return result;
    }

    private void checkSnapshot(TestResult result, HttpResponse response, String collectionId, RunOptions options)
        throws IOException {
        String path = snapshots.snapshotPath(collectionId, response.getRequest());
        SnapshotResult.SnapshotResultBuilder snapshot = SnapshotResult.builder().snapshotPath(path);

        if (options.getUpdateMode() == UpdateMode.ALL) {
            boolean existed = snapshots.exists(path);
            snapshots.saveTo(response, path);
            log.info("Snapshot updated: {}", path);
            pass(result, snapshot.exists(existed).equal(true).updated(true).message("Snapshot updated").build());
            return;
        }

        SnapshotDiff diff;
        try {
            diff = snapshots.compare(response, path, options.getIgnoredHeaders());
        } catch (SnapshotMissingException e) {
            snapshot.exists(false);
            if (options.getUpdateMode() == UpdateMode.MISSING) {
                snapshots.saveTo(response, path);
                log.info("Snapshot created: {}", path);
                pass(result, snapshot.created(true).message("Snapshot created").build());
            } else if (options.isFailOnMissing()) {
                fail(result, snapshot.message("Snapshot missing").build(), "Snapshot missing: " + path);
            } else {
                pass(result, snapshot.message("No snapshot stored at " + path
                    + "; run with update mode 'missing' to create it").build());
            }
            return;
        } catch (SnapshotCorruptException e) {
            snapshots.recordError();
            result.setSnapshotResult(snapshot.exists(true).message(e.getMessage()).build());
            result.setStatus(TestStatus.ERROR);
            result.setError(e.getMessage());
            return;
        }

        snapshot.exists(true).diff(diff).equal(diff.isEqual());
        if (diff.isEqual()) {
            pass(result, snapshot.message("Snapshot matches").build());
        } else if (options.getUpdateMode() == UpdateMode.FAILED) {
            snapshots.saveTo(response, path);
            log.info("Snapshot updated after mismatch: {}", path);
            pass(result, snapshot.updated(true).message("Snapshot updated after mismatch").build());
        } else {
            fail(result, snapshot.message("Snapshot mismatch").build(), diff.describe());
        }
    }

    /**
     * Schema validation, assertions and variable extraction; each may downgrade a passed result.
     */
    private void runChecks(TestResult result, HttpResponse response, HttpRequest template, Map<String, String> scope,
                           RunOptions options) {
        if (options.isValidateSchema()) {
            try {
                SchemaValidationResult schema = schemaValidator.validate(response,
                    OperationDescriptor.of(response.getRequest()), options.getSchemaOptions());
                result.setSchemaResult(schema);
                if (!schema.isValid()) {
                    result.setStatus(TestStatus.FAILED);
                    result.setError("Schema validation failed: " + schema.firstMessage());
                    return;
                }
            } catch (SchemaValidationException e) {
                result.setStatus(TestStatus.ERROR);
                result.setError(e.getMessage());
                return;
            }
        }

        if (options.isRunAssertions() && template.getAssertions() != null && !template.getAssertions().isEmpty()) {
            try {
                List<AssertionResult> evaluated = assertions.evaluate(response, template.getAssertions());
                result.setAssertionResults(evaluated);
                evaluated.stream().filter(a -> !a.isSucceeded()).findFirst().ifPresent(failed -> {
                    result.setStatus(TestStatus.FAILED);
                    result.setError(failed.getMessage());
                });
                if (result.getStatus() != TestStatus.PASSED) {
                    return;
                }
            } catch (AssertionEvaluationException e) {
                result.setStatus(TestStatus.ERROR);
                result.setError(e.getMessage());
                return;
            }
        }

        if (options.isExtractVariables() && template.getExtract() != null && !template.getExtract().isEmpty()) {
            try {
                Map<String, String> extracted = extractor.extract(response, template.getExtract());
                result.setExtractedVariables(new LinkedHashMap<>(extracted));
                scope.putAll(extracted);
            } catch (VariableExtractionException e) {
                result.setStatus(TestStatus.ERROR);
                result.setError(e.getMessage());
            }
        }
    }

    private void pass(TestResult result, SnapshotResult snapshot) {
        result.setSnapshotResult(snapshot);
        result.setStatus(TestStatus.PASSED);
        snapshots.record(snapshot, true);
    }

    private void fail(TestResult result, SnapshotResult snapshot, String error) {
        result.setSnapshotResult(snapshot);
        result.setStatus(TestStatus.FAILED);
        result.setError(error);
        snapshots.record(snapshot, false);
    }

    // --- sequences ---

    /**
     * Runs the sequences one after another. Step results are flattened into the report's results with
     * {@code sequence} and {@code step} metadata; whole sequence outcomes go to {@link TestReport#getSequences()}.
     */
    public TestReport runSequences(List<TestSequence> sequences, RunOptions options, CancellationSignal cancellation)
        throws IOException {
        TestReport report = new TestReport();
        report.setStartTime(clock.instant());
        long started = System.nanoTime();

        RunOptions effective = withSavedVariables(options);
        int ordinal = 0;
        for (TestSequence sequence : sequences) {
            if (cancellation.isCancelled()) {
                break;
            }
            SequenceResult sequenceResult = sequenceRunner.run(sequence, effective, cancellation);
            report.getSequences().add(sequenceResult);
            for (StepResult step : sequenceResult.getStepResults()) {
                report.getResults().add(toTestResult(sequence, step, ordinal++));
            }
            if (options.isStopOnFailure() && !sequenceResult.isSuccess()) {
                log.info("Stopping after failed sequence '{}'", sequence.getName());
                break;
            }
        }

        report.setCancelled(cancellation.isCancelled());
        finish(report, started);
        return report;
    }

    private RunOptions withSavedVariables(RunOptions options) throws IOException {
        if (variableFiles == null || options.getVariablesFile() == null || options.getVariablesFile().isBlank()) {
            return options;
        }
        Map<String, String> saved = variableFiles.load(options.getVariablesFile());
        if (saved.isEmpty()) {
            return options;
        }
        log.debug("Loaded {} variable(s) from {}", saved.size(), options.getVariablesFile());
        return options.toBuilder()
            .variables(VariableStore.layer(saved, options.getVariables()))
            .build();
    }

    private static TestResult toTestResult(TestSequence sequence, StepResult step, int ordinal) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("sequence", sequence.getName());
        metadata.put("step", step.getName());
        return TestResult.builder()
            .name(sequence.getName() + " / " + step.getName())
            .filePath(sequence.getFilePath())
            .ordinal(ordinal)
            .request(step.getRequest())
            .response(step.getResponse())
            .schemaResult(step.getSchemaResult())
            .duration(step.getExecutionTime())
            .status(step.getStatus())
            .error(step.getError() != null ? step.getError() : step.getValidationError())
            .tags(new ArrayList<>(sequence.getTags()))
            .metadata(metadata)
            .extractedVariables(new LinkedHashMap<>(step.getVariables()))
            .assertionResults(new ArrayList<>(step.getAssertionResults()))
            .build();
    }

    // --- summary ---

    private void finish(TestReport report, long startedNanos) {
        TestSummary summary = new TestSummary();
        report.getResults().forEach(summary::count);
        for (SequenceResult sequence : report.getSequences()) {
            summary.setSequencesTotal(summary.getSequencesTotal() + 1);
            if (sequence.isSuccess()) {
                summary.setSequencesPassed(summary.getSequencesPassed() + 1);
            } else {
                summary.setSequencesFailed(summary.getSequencesFailed() + 1);
            }
        }
        summary.setDurationMs(elapsed(startedNanos).toMillis());
        report.setSummary(summary);
        report.setEndTime(clock.instant());
        log.info("Run finished: {} total, {} passed, {} failed, {} skipped, {} errors in {} ms{}",
            summary.getTotal(), summary.getPassed(), summary.getFailed(), summary.getSkipped(), summary.getErrors(),
            summary.getDurationMs(), report.isCancelled() ? " (cancelled)" : "");
    }

    private void requireValidator(RunOptions options) {
        if (options.isValidateSchema() && schemaValidator == null) {
            throw new IllegalStateException("Schema validation requested but no schema validator is configured");
        }
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
