package com.vtb.httptest.runner;

import com.vtb.httptest.exceptions.AssertionEvaluationException;
import com.vtb.httptest.exceptions.CancelledException;
import com.vtb.httptest.exceptions.HttpTestException;
import com.vtb.httptest.exceptions.SchemaValidationException;
import com.vtb.httptest.exceptions.VariableExtractionException;
import com.vtb.httptest.execution.CancellationSignal;
import com.vtb.httptest.execution.HttpExecutor;
import com.vtb.httptest.execution.VariableStore;
import com.vtb.httptest.models.AssertionResult;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.OperationDescriptor;
import com.vtb.httptest.models.RunOptions;
import com.vtb.httptest.models.SchemaValidationResult;
import com.vtb.httptest.models.SequenceResult;
import com.vtb.httptest.models.StepResult;
import com.vtb.httptest.models.TestSequence;
import com.vtb.httptest.models.TestStatus;
import com.vtb.httptest.models.TestStep;
import com.vtb.httptest.validation.SchemaValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the steps of a {@link TestSequence} in order on the calling thread.
 * <p>
 * All steps share one variable scope: run variables, overlaid by the sequence's own variables, overlaid by
 * values extracted from earlier steps. A failed or errored step ends the sequence when
 * {@link RunOptions#isFailFast()} or {@link TestStep#isStopOnFail()} is set; otherwise the next step runs.
 */
@Slf4j
public class SequenceRunner {

    private final HttpExecutor executor;
    private final SchemaValidator schemaValidator;
    private final VariableExtractor extractor;
    private final AssertionEvaluator assertions;
    private final VariableFileStore variableFiles;
    private final Clock clock;

    /**
     * @param schemaValidator may be {@code null} when no step asks for schema validation
     * @param variableFiles   may be {@code null} when variables are never saved
     */
    public SequenceRunner(HttpExecutor executor,
                          SchemaValidator schemaValidator,
                          VariableExtractor extractor,
                          AssertionEvaluator assertions,
                          VariableFileStore variableFiles,
                          Clock clock) {
        this.executor = executor;
        this.schemaValidator = schemaValidator;
        this.extractor = extractor;
        this.assertions = assertions;
        this.variableFiles = variableFiles;
        this.clock = clock;
    }

    public SequenceResult run(TestSequence sequence, RunOptions options, CancellationSignal cancellation) {
        Instant startTime = clock.instant();
        long started = System.nanoTime();
        Map<String, String> scope = new LinkedHashMap<>(VariableStore.layer(options.getVariables(), sequence.getVariables()));
        List<StepResult> stepResults = new ArrayList<>();
        boolean cancelled = false;
        String error = null;

        log.info("Running sequence '{}' ({} step(s))", sequence.getName(), sequence.getSteps().size());
        for (TestStep step : sequence.getSteps()) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            try {
                StepResult stepResult = runStep(step, scope, options, cancellation);
                stepResults.add(stepResult);
                if (stepResult.getStatus().isFailure()) {
                    log.debug("Step '{}' {}: {}", step.getName(), stepResult.getStatus().jsonValue(),
                        stepResult.getError() != null ? stepResult.getError() : stepResult.getValidationError());
                    if (options.isFailFast() || step.isStopOnFail()) {
                        error = "Stopped after step '" + step.getName() + "'";
                        break;
                    }
                }
                if (stepResult.getStatus() != TestStatus.SKIPPED && step.getWaitAfterMs() > 0) {
                    cancellation.await(Duration.ofMillis(step.getWaitAfterMs()));
                }
            } catch (CancelledException e) {
                log.info("Sequence '{}' cancelled at step '{}'", sequence.getName(), step.getName());
                cancelled = true;
                break;
            }
        }
        if (cancelled) {
            error = "Cancelled: " + cancellation.getReason();
        }

        boolean success = !cancelled && stepResults.stream().allMatch(StepResult::isSuccess);
        SequenceResult result = SequenceResult.builder()
            .name(sequence.getName())
            .filePath(sequence.getFilePath())
            .success(success)
            .stepResults(stepResults)
            .executionTime(Duration.ofNanos(System.nanoTime() - started))
            .variables(new LinkedHashMap<>(scope))
            .startTime(startTime)
            .endTime(clock.instant())
            .error(error)
            .cancelled(cancelled)
            .build();

        saveVariables(scope, options);
        log.info("Sequence '{}' {} in {} ms", sequence.getName(), success ? "passed" : "failed",
            result.getExecutionTime().toMillis());
        return result;
    }

    private StepResult runStep(TestStep step, Map<String, String> scope, RunOptions options,
                               CancellationSignal cancellation) throws CancelledException {
        StepResult.StepResultBuilder result = StepResult.builder()
            .name(step.getName())
            .request(step.getRequest());

        if (step.isSkip()) {
            return result.status(TestStatus.SKIPPED).executionTime(Duration.ZERO).build();
        }
        if (step.getSkipCondition() != null && !step.getSkipCondition().isBlank()) {
            String condition = executor.getSubstitutor()
                .substitute(step.getSkipCondition(), executor.getVariables().mergedWith(scope));
            if (SkipConditionEvaluator.holds(condition)) {
                return result.status(TestStatus.SKIPPED).conditionallySkipped(true).executionTime(Duration.ZERO).build();
            }
        }
        if (step.getWaitBeforeMs() > 0) {
            cancellation.await(Duration.ofMillis(step.getWaitBeforeMs()));
        }

        long started = System.nanoTime();
        if (step.getRequest() == null) {
            return result.status(TestStatus.ERROR).error("Step has no request").executionTime(Duration.ZERO).build();
        }
        HttpResponse response;
        try {
            response = executor.execute(step.getRequest(), scope, options.getTimeout(), cancellation);
        } catch (CancelledException e) {
            throw e;
        } catch (HttpTestException e) {
            return result.status(TestStatus.ERROR).error(e.getMessage()).executionTime(elapsed(started)).build();
        }
        result.response(response).request(response.getRequest());

        if (step.getExpectedStatus() > 0 && step.getExpectedStatus() != response.getStatusCode()) {
            String message = "Expected status " + step.getExpectedStatus() + ", got " + response.getStatusCode();
            return result.status(TestStatus.FAILED).validationError(message).error(message)
                .executionTime(elapsed(started)).build();
        }

        TestStatus status = null;
        if (options.isValidateSchema() || step.isSchemaValidate()) {
            if (schemaValidator == null) {
                return result.status(TestStatus.ERROR).error("Schema validation requested but no validator is configured")
                    .executionTime(elapsed(started)).build();
            }
            try {
                SchemaValidationResult schema = schemaValidator.validate(response,
                    OperationDescriptor.of(response.getRequest()), options.getSchemaOptions());
                result.schemaResult(schema);
                if (!schema.isValid()) {
                    status = TestStatus.FAILED;
                    result.validationError("Schema validation failed: " + schema.firstMessage());
                    if (options.isFailFast() || step.isStopOnFail()) {
                        return result.status(status).executionTime(elapsed(started)).build();
                    }
                }
            } catch (SchemaValidationException e) {
                return result.status(TestStatus.ERROR).error(e.getMessage()).executionTime(elapsed(started)).build();
            }
        }

        if (step.getAssertions() != null && !step.getAssertions().isEmpty()) {
            try {
                List<AssertionResult> evaluated = assertions.evaluate(response, step.getAssertions());
                result.assertionResults(evaluated);
                AssertionResult firstFailed = evaluated.stream().filter(a -> !a.isSucceeded()).findFirst().orElse(null);
                if (firstFailed != null) {
                    return result.status(TestStatus.FAILED).error(firstFailed.getMessage())
                        .executionTime(elapsed(started)).build();
                }
            } catch (AssertionEvaluationException e) {
                return result.status(TestStatus.ERROR).error(e.getMessage()).executionTime(elapsed(started)).build();
            }
        }

        try {
            Map<String, String> extracted = extractor.extract(response, step.getVariables());
            scope.putAll(extracted);
            result.variables(new LinkedHashMap<>(extracted));
        } catch (VariableExtractionException e) {
            return result.status(TestStatus.ERROR).error(e.getMessage()).executionTime(elapsed(started)).build();
        }

        return result.status(status != null ? status : TestStatus.PASSED).executionTime(elapsed(started)).build();
    }

    private void saveVariables(Map<String, String> scope, RunOptions options) {
        if (!options.isSaveVariables() || options.getVariablesFile() == null || options.getVariablesFile().isBlank()) {
            return;
        }
        if (variableFiles == null) {
            log.warn("Variables not saved: no variable file store configured");
            return;
        }
        try {
            variableFiles.save(scope, options.getVariablesFile());
            log.debug("Saved {} variable(s) to {}", scope.size(), options.getVariablesFile());
        } catch (IOException e) {
            log.warn("Failed to save variables to {}: {}", options.getVariablesFile(), e.getMessage());
        }
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
