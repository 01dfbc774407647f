/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stratus.workflow;

import dev.mars.stratus.config.StratusConfiguration;
import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.InvalidTransitionException;
import dev.mars.stratus.core.exceptions.OperationException;
import dev.mars.stratus.core.exceptions.StratusException;
import dev.mars.stratus.operation.OperationBackend;
import dev.mars.stratus.operation.OperationResult;
import dev.mars.stratus.operation.StateBackend;
import dev.mars.stratus.workflow.checkpoint.CheckpointException;
import dev.mars.stratus.workflow.checkpoint.WorkflowCheckpoint;
import dev.mars.stratus.workflow.observability.WorkflowMetrics;
import dev.mars.stratus.workflow.recovery.ErrorContext;
import dev.mars.stratus.workflow.recovery.ErrorRecoveryManager;
import dev.mars.stratus.workflow.recovery.ErrorRecoveryStrategy;
import dev.mars.stratus.workflow.recovery.InterventionNotFoundException;
import dev.mars.stratus.workflow.recovery.ManualInterventionHandler;
import dev.mars.stratus.workflow.recovery.ManualInterventionQueue;
import dev.mars.stratus.workflow.recovery.ManualInterventionRequest;
import dev.mars.stratus.workflow.recovery.RecoveryType;
import dev.mars.stratus.workflow.retry.CancellationToken;
import dev.mars.stratus.workflow.retry.RecoveryExhaustedException;
import dev.mars.stratus.workflow.retry.RetryExecutor;
import dev.mars.stratus.workflow.rollback.RollbackContext;
import dev.mars.stratus.workflow.rollback.RollbackExecutionResult;
import dev.mars.stratus.workflow.rollback.RollbackManager;
import dev.mars.stratus.workflow.rollback.RollbackPlan;
import dev.mars.stratus.workflow.rollback.RollbackStrategy;
import dev.mars.stratus.workflow.rollback.RollbackTriggerType;
import dev.mars.stratus.workflow.scheduler.ExecutionBatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one run of a workflow definition through its state machine.
 *
 * <p>Batches run strictly one after another, each as a set of independent step
 * futures joined before the next batch starts. Attempts share a per-run
 * {@link Semaphore} so at most {@code maxConcurrency} operations are in flight;
 * retry and recovery delays are scheduled continuations that hold neither a
 * permit nor a thread.</p>
 *
 * <p>A step failure is classified by the run's {@link ErrorRecoveryManager}. An
 * abort, a rollback or the overall timeout stops the run: the shared cancellation
 * token is cancelled so no further attempt starts, and the run is finished without
 * waiting for operations already sent to the backend.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
final class WorkflowExecution {

    private static final Logger logger = Logger.getLogger(WorkflowExecution.class.getName());

    static final String WAIT_COMMAND = "wait";
    static final String BACKUP_STATE_COMMAND = "backup-state";
    static final String STATE_BACKUP_LOCATION_KEY = "stateBackupLocation";
    static final String OUTPUTS_KEY = "outputs";

    private enum StopReason {
        ABORT,
        ROLLBACK,
        TIMEOUT
    }

    private final String runId = "run-" + UUID.randomUUID();
    private final WorkflowDefinition definition;
    private final WorkflowExecutionOptions options;
    private final StratusConfiguration configuration;
    private final OperationBackend operationBackend;
    private final StateBackend stateBackend;
    private final RollbackManager rollbackManager;
    private final ErrorRecoveryManager recoveryManager;
    private final ConditionEvaluator conditionEvaluator;
    private final RetryExecutor retryExecutor;
    private final Executor executor;
    private final WorkflowMetrics metrics;
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<WorkflowExecutionResult> result = new CompletableFuture<>();
    private final CompletableFuture<Void> stopSignal = new CompletableFuture<>();
    private final WorkflowRun handle;

    private final Object lock = new Object();
    private WorkflowState state = WorkflowState.NOT_STARTED;
    private Semaphore permits;
    private Instant startTime;
    private String resumedFrom;
    private StopReason stopReason;
    private String stopMessage;
    private WorkflowStep stopStep;
    private StratusException stopError;
    private boolean finishing;
    private boolean hookFailed;
    private int recovering;
    private int awaiting;
    private List<ManualInterventionRequest> pendingAtStop = List.of();

    private final Set<String> restored = new HashSet<>();
    private final List<String> completed = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final Set<String> blocked = new HashSet<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> checkpoints = new ArrayList<>();
    private final Map<String, StepExecutionContext> stepResults = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> stepOutputs = new LinkedHashMap<>();
    private final Map<String, Object> runState = new LinkedHashMap<>();
    private final List<ParallelExecutionStats.BatchStats> batchStats = new ArrayList<>();

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger batchPeak = new AtomicInteger();
    private final AtomicInteger overallPeak = new AtomicInteger();

    WorkflowExecution(WorkflowDefinition definition, WorkflowExecutionOptions options,
                      StratusConfiguration configuration, OperationBackend operationBackend,
                      StateBackend stateBackend, RollbackManager rollbackManager,
                      ErrorRecoveryManager recoveryManager, ConditionEvaluator conditionEvaluator,
                      RetryExecutor retryExecutor, Executor executor) {
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.options = Objects.requireNonNull(options, "Execution options cannot be null");
        this.configuration = configuration;
        this.operationBackend = operationBackend;
        this.stateBackend = stateBackend;
        this.rollbackManager = rollbackManager;
        this.recoveryManager = recoveryManager;
        this.conditionEvaluator = conditionEvaluator;
        this.retryExecutor = retryExecutor;
        this.executor = executor;
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.handle = new WorkflowRun(this);
    }

    String getRunId() {
        return runId;
    }

    WorkflowDefinition getDefinition() {
        return definition;
    }

    WorkflowRun getHandle() {
        return handle;
    }

    CompletableFuture<WorkflowExecutionResult> getResult() {
        return result;
    }

    WorkflowState getState() {
        synchronized (lock) {
            return state;
        }
    }

    ManualInterventionQueue getInterventionQueue() {
        return recoveryManager.getInterventionQueue();
    }

    /**
     * Moves the run along its state machine.
     *
     * @throws IllegalStateException if the move is not allowed from the current state
     */
    void transition(WorkflowState target) {
        synchronized (lock) {
            try {
                state = state.transitionTo(runId, target);
            } catch (InvalidTransitionException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }
        logger.fine("Run " + runId + " of " + definition.getName() + " is now " + target);
    }

    /**
     * Starts executing the scheduled batches. Returns immediately; the outcome is
     * delivered through {@link #getResult()}.
     *
     * @param batches    batches computed by the scheduler
     * @param checkpoint checkpoint to resume from, or null
     */
    void start(List<ExecutionBatch> batches, int maxConcurrency, WorkflowCheckpoint checkpoint) {
        this.startTime = Instant.now();
        this.permits = new Semaphore(maxConcurrency);
        if (checkpoint != null) {
            restore(checkpoint);
        }

        String mode = options.isDryRun() ? "dry-run" : "normal";
        if (metrics != null) {
            metrics.recordWorkflowStarted(definition.getName(), mode);
        }
        logger.info("Starting workflow " + definition.getName() + " (" + runId + ", " + mode + ", " +
                batches.size() + " batches, max concurrency " + maxConcurrency + ")");

        if (options.isDryRun()) {
            CompletableFuture.runAsync(() -> dryRun(batches), executor)
                    .exceptionally(error -> {
                        result.completeExceptionally(unwrap(error));
                        return null;
                    });
            return;
        }

        transition(WorkflowState.EXECUTING);
        scheduleTimeout();

        CompletableFuture<Void> work = runHooks(definition.getPreHooks(), true)
                .thenCompose(ignored -> runBatches(batches, 0));

        CompletableFuture.anyOf(work, stopSignal)
                .handleAsync((ignored, error) -> {
                    finish(error);
                    return null;
                }, executor)
                .exceptionally(error -> {
                    result.completeExceptionally(unwrap(error));
                    return null;
                });
    }

    /**
     * Stops the run as aborted. No-op once the run is finishing.
     */
    void cancel(String reason) {
        stop(StopReason.ABORT, null, null, "Workflow cancelled: " + reason);
    }

    private void restore(WorkflowCheckpoint checkpoint) {
        Set<String> stepNames = new HashSet<>();
        definition.getSteps().forEach(step -> stepNames.add(step.getName()));

        synchronized (lock) {
            resumedFrom = checkpoint.getId();
            for (String name : checkpoint.getCompletedSteps()) {
                if (stepNames.contains(name) && restored.add(name)) {
                    completed.add(name);
                }
            }
            checkpoint.getState().forEach((key, value) -> {
                if (!OUTPUTS_KEY.equals(key)) {
                    runState.put(key, value);
                }
            });
            if (checkpoint.getState().get(OUTPUTS_KEY) instanceof Map<?, ?> outputs) {
                outputs.forEach((step, values) -> {
                    if (values instanceof Map<?, ?> map) {
                        Map<String, Object> copy = new LinkedHashMap<>();
                        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
                        stepOutputs.put(String.valueOf(step), copy);
                    }
                });
            }
        }
        logger.info("Resuming " + definition.getName() + " from checkpoint " + checkpoint.getId() + ", " +
                restored.size() + " steps already completed");
    }

    private void scheduleTimeout() {
        Duration timeout = options.getTimeout()
                .orElse(Duration.ofMillis(configuration.getWorkflowTimeoutMs()));
        if (timeout.isZero() || timeout.isNegative()) {
            return;
        }
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS, executor)
                .execute(() -> stop(StopReason.TIMEOUT, null, null,
                        ErrorCode.TIMEOUT_ERROR.code() + ": " + ErrorCode.TIMEOUT_ERROR.formatMessage(
                                "workflow " + definition.getName() + " after " + timeout.toMillis() + "ms")));
    }

    // ---------------------------------------------------------------- dry run

    private void dryRun(List<ExecutionBatch> batches) {
        List<String> planned = new ArrayList<>();
        List<ParallelExecutionStats.BatchStats> stats = new ArrayList<>();
        int parallelSteps = 0;

        for (ExecutionBatch batch : batches) {
            int batchPlanned = 0;
            for (WorkflowStep step : batch.getSteps()) {
                if (restored.contains(step.getName())) {
                    continue;
                }
                try {
                    if (shouldRun(step)) {
                        planned.add(step.getName());
                        batchPlanned++;
                    } else {
                        markSkipped(step, "condition not met");
                    }
                } catch (StepExecutionException e) {
                    recordError(step.getName() + ": " + describe(e));
                    markBlocked(step, e.getMessage());
                }
            }
            if (batchPlanned > 1) {
                parallelSteps += batchPlanned;
            }
            stats.add(new ParallelExecutionStats.BatchStats(batch.getBatchNumber(),
                    batch.getParallelGroup().orElse(null), batchPlanned, 0, Duration.ZERO, true));
        }

        transition(WorkflowState.SUCCEEDED);
        transition(WorkflowState.COMPLETED);
        logger.info("Dry run of " + definition.getName() + " planned " + planned.size() + " steps in " +
                batches.size() + " batches");

        WorkflowExecutionResult.Builder builder = baseResult(WorkflowState.COMPLETED)
                .dryRun(true)
                .plannedSteps(planned)
                .parallelExecutionStats(new ParallelExecutionStats(planned.size(), parallelSteps, 0, stats));
        synchronized (lock) {
            builder.success(errors.isEmpty());
        }
        complete(builder.build());
    }

    // ---------------------------------------------------------------- batches

    private CompletableFuture<Void> runBatches(List<ExecutionBatch> batches, int index) {
        if (index >= batches.size() || isStopped()) {
            return CompletableFuture.completedFuture(null);
        }
        return runBatch(batches.get(index)).thenCompose(ignored -> runBatches(batches, index + 1));
    }

    private CompletableFuture<Void> runBatch(ExecutionBatch batch) {
        Instant batchStart = Instant.now();
        batchPeak.set(0);
        logger.info("Starting batch " + batch.getBatchNumber() + " of " + definition.getName() + ": " +
                batch.getStepNames());

        CompletableFuture<?>[] steps = batch.getSteps().stream()
                .map(this::runStep)
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(steps).thenRunAsync(() -> completeBatch(batch, batchStart), executor);
    }

    private void completeBatch(ExecutionBatch batch, Instant batchStart) {
        Duration duration = Duration.between(batchStart, Instant.now());
        boolean success;
        synchronized (lock) {
            success = batch.getStepNames().stream().noneMatch(failed::contains);
            batchStats.add(new ParallelExecutionStats.BatchStats(batch.getBatchNumber(),
                    batch.getParallelGroup().orElse(null), batch.size(), batchPeak.get(), duration, success));
        }
        if (metrics != null) {
            metrics.recordBatchConcurrency(definition.getName(), batchPeak.get());
        }
        logger.info("Finished batch " + batch.getBatchNumber() + " of " + definition.getName() + " in " +
                duration.toMillis() + "ms" + (success ? "" : " with failures"));

        if (options.isSaveCheckpoints() && !isStopped()) {
            WorkflowStep last = batch.getSteps().get(batch.size() - 1);
            WorkflowCheckpoint checkpoint;
            synchronized (lock) {
                checkpoint = new WorkflowCheckpoint("checkpoint-" + UUID.randomUUID(), definition.getName(),
                        definition.indexOf(last.getName()), last.getName(), Instant.now(), snapshotState(),
                        completed, failed);
            }
            try {
                recoveryManager.saveCheckpoint(checkpoint);
            } catch (CheckpointException e) {
                logger.severe("Could not save checkpoint after batch " + batch.getBatchNumber() + ": " +
                        e.getMessage());
                throw new CompletionException(e);
            }
            synchronized (lock) {
                checkpoints.add(checkpoint.getId());
            }
            logger.info("Saved checkpoint " + checkpoint.getId() + " after batch " + batch.getBatchNumber());
        }
    }

    // ---------------------------------------------------------------- steps

    private CompletableFuture<Void> runStep(WorkflowStep step) {
        if (restored.contains(step.getName())) {
            logger.fine("Step " + step.getName() + " already completed in checkpoint " + resumedFrom);
            return CompletableFuture.completedFuture(null);
        }
        if (isStopped()) {
            markSkipped(step, "workflow stopped");
            return CompletableFuture.completedFuture(null);
        }
        Optional<String> blocker;
        synchronized (lock) {
            blocker = step.getDependsOn().stream().filter(blocked::contains).findFirst();
        }
        if (blocker.isPresent()) {
            markBlocked(step, "dependency " + blocker.get() + " did not complete");
            return CompletableFuture.completedFuture(null);
        }

        int index = definition.indexOf(step.getName());
        StepProgress progress = new StepProgress();
        return CompletableFuture.supplyAsync(() -> {
                    try {
                        return shouldRun(step);
                    } catch (StepExecutionException e) {
                        throw new CompletionException(e);
                    }
                }, executor)
                .handle((run, error) -> {
                    if (error != null) {
                        return handleFailure(step, index, error, progress);
                    }
                    if (!run) {
                        markSkipped(step, "condition not met");
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return attempt(step, index, step.getRetry().orElseGet(this::defaultRetryPolicy), progress);
                })
                .thenCompose(Function.identity());
    }

    private boolean shouldRun(WorkflowStep step) throws StepExecutionException {
        Optional<StepCondition> condition = step.getCondition();
        if (condition.isEmpty()) {
            return true;
        }
        ConditionContext context;
        synchronized (lock) {
            context = new ConditionContext(definition.getName(), completed, failed, stepOutputs, runState);
        }
        return conditionEvaluator.evaluate(step.getName(), condition.get(), context);
    }

    private RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(configuration.getRetryMaxAttempts())
                .delayMs(configuration.getRetryDelayMs())
                .maxDelayMs(configuration.getRetryMaxDelayMs())
                .build();
    }

    private CompletableFuture<Void> attempt(WorkflowStep step, int index, RetryPolicy policy,
                                            StepProgress progress) {
        return operation(step, policy, new StepListener(step, index, progress))
                .handle((outputs, error) -> error == null
                        ? succeed(step, outputs)
                        : handleFailure(step, index, error, progress))
                .thenCompose(Function.identity());
    }

    /**
     * Runs a step's operation under a retry policy. Built-in {@code wait} is a
     * scheduled delay; everything else goes through the retry executor.
     */
    private CompletableFuture<Map<String, Object>> operation(WorkflowStep step, RetryPolicy policy,
                                                             RetryExecutor.AttemptListener listener) {
        if (WAIT_COMMAND.equals(step.getCommand())) {
            return waitFor(step);
        }
        return retryExecutor.execute(() -> invoke(step), policy, step.getName(), permits, token,
                step.getTimeout().orElse(null), listener);
    }

    private CompletableFuture<Map<String, Object>> waitFor(WorkflowStep step) {
        long durationMs;
        try {
            durationMs = Long.parseLong(String.valueOf(step.getOptions().getOrDefault("durationMs", "0")).trim());
        } catch (NumberFormatException e) {
            return CompletableFuture.failedFuture(new StepExecutionException(step.getName(),
                    ErrorCode.CONFIGURATION_ERROR.code(), "Invalid wait duration: " +
                    step.getOptions().get("durationMs"), e));
        }

        CompletableFuture<Void> pause = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(Math.max(0, durationMs), TimeUnit.MILLISECONDS, executor)
                .execute(() -> pause.complete(null));
        token.onCancel(() -> pause.complete(null));
        return pause.thenApply(ignored -> {
            if (token.isCancelled()) {
                throw new CompletionException(new StepExecutionException(step.getName(),
                        ErrorCode.STEP_CANCELLED.code(), ErrorCode.STEP_CANCELLED.formatMessage(step.getName())));
            }
            return Map.<String, Object>of("durationMs", durationMs);
        });
    }

    private Map<String, Object> invoke(WorkflowStep step) throws OperationException {
        if (BACKUP_STATE_COMMAND.equals(step.getCommand())) {
            if (stateBackend == null) {
                throw new OperationException(BACKUP_STATE_COMMAND, ErrorCode.CONFIGURATION_ERROR,
                        "No state backend is configured");
            }
            String location = stateBackend.createBackup();
            synchronized (lock) {
                runState.put(STATE_BACKUP_LOCATION_KEY, location);
            }
            logger.info("State backed up to " + location + " by step " + step.getName());
            return Map.of("backupLocation", location);
        }

        OperationResult outcome = operationBackend.execute(step.getCommand(), step.getArgs(), step.getOptions());
        if (outcome == null) {
            throw new OperationException(step.getCommand(), ErrorCode.OPERATION_FAILED,
                    "Backend returned no result for step " + step.getName());
        }
        if (!outcome.isSuccess()) {
            throw new OperationException(step.getCommand(), outcome.getErrorCode(),
                    outcome.getErrorMessage().orElse("Operation " + step.getCommand() + " failed"));
        }
        return outcome.getOutputs();
    }

    private CompletableFuture<Void> succeed(WorkflowStep step, Map<String, Object> outputs) {
        synchronized (lock) {
            completed.add(step.getName());
            stepOutputs.put(step.getName(), outputs != null ? new LinkedHashMap<>(outputs) : new LinkedHashMap<>());
        }
        logger.info("Step " + step.getName() + " completed");
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> handleFailure(WorkflowStep step, int index, Throwable error,
                                                  StepProgress progress) {
        Throwable cause = unwrap(error);
        StratusException failure;
        if (cause instanceof RecoveryExhaustedException exhausted) {
            failure = exhausted.getLastError() != null ? exhausted.getLastError() : exhausted;
            progress.errors.addAll(exhausted.getErrorMessages());
        } else {
            failure = RetryExecutor.toFailure(step.getName(), cause, step.getTimeout().orElse(null));
            if (failure.hasErrorCode(ErrorCode.STEP_CANCELLED)) {
                markSkipped(step, "cancelled");
                return CompletableFuture.completedFuture(null);
            }
            progress.errors.add(describe(failure));
        }

        if (metrics != null) {
            metrics.recordStepFailed(definition.getName(), step.getCommand(), failure.getErrorCode());
        }
        logger.warning("Step " + step.getName() + " failed after " + progress.attempts.get() + " attempt(s): " +
                describe(failure));

        if (isStopped()) {
            markFailed(step, failure);
            return CompletableFuture.completedFuture(null);
        }

        List<String> previous = progress.errors.subList(0, Math.max(0, progress.errors.size() - 1));
        ErrorContext context = new ErrorContext(step, index, failure, Math.max(1, progress.attempts.get()),
                previous, snapshotStateLocked());
        ErrorRecoveryStrategy strategy = recoveryManager.analyzeError(context);

        if (!recoveryManager.validateRecoveryStrategy(strategy, context)) {
            if (strategy.type() == RecoveryType.RETRY) {
                return escalate(step, failure, "retry limit reached for " + step.getName());
            }
            strategy = ErrorRecoveryStrategy.manual("Skipping " + step.getName() + " is not allowed",
                    List.of("Review step failure", "Retry or abort the workflow"));
        }
        return apply(step, index, context, strategy, progress);
    }

    private CompletableFuture<Void> apply(WorkflowStep step, int index, ErrorContext context,
                                          ErrorRecoveryStrategy strategy, StepProgress progress) {
        switch (strategy.type()) {
            case RETRY:
                return retry(step, index, (ErrorRecoveryStrategy.Retry) strategy, progress);
            case SKIP:
                recordError(step.getName() + ": " + describe(context.error()));
                markSkipped(step, strategy.reason());
                return CompletableFuture.completedFuture(null);
            case MANUAL:
                return requestIntervention(step, index, context, (ErrorRecoveryStrategy.Manual) strategy, progress);
            case ROLLBACK:
                markFailed(step, context.error());
                stop(StopReason.ROLLBACK, step, context.error(), strategy.reason());
                return CompletableFuture.completedFuture(null);
            case ABORT:
            default:
                markFailed(step, context.error());
                stop(StopReason.ABORT, step, context.error(), strategy.reason());
                return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> retry(WorkflowStep step, int index, ErrorRecoveryStrategy.Retry retry,
                                          StepProgress progress) {
        long delay = retry.delayMs() > 0 ? retry.delayMs() : configuration.getRetryDelayMs();
        logger.warning("Recovering step " + step.getName() + " (" + retry.reason() + "), retrying in " +
                delay + "ms");
        if (metrics != null) {
            metrics.recordStepRetried(definition.getName(), step.getCommand());
        }
        adjustActivity(1, 0);

        CompletableFuture<Void> pause = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor)
                .execute(() -> pause.complete(null));
        token.onCancel(() -> pause.complete(null));

        return pause.thenCompose(ignored -> {
            adjustActivity(-1, 0);
            return attempt(step, index, RetryPolicy.singleAttempt(), progress);
        });
    }

    private CompletableFuture<Void> requestIntervention(WorkflowStep step, int index, ErrorContext context,
                                                        ErrorRecoveryStrategy.Manual manual,
                                                        StepProgress progress) {
        if (!options.isAllowManualIntervention()) {
            return escalate(step, context.error(), "manual intervention required (" + manual.reason() +
                    ") but not allowed");
        }
        ManualInterventionQueue queue = recoveryManager.getInterventionQueue();
        int limit = options.getMaxManualInterventions().orElse(configuration.getMaxManualInterventions());
        if (queue.getRequestCount() >= limit) {
            return escalate(step, context.error(), ErrorCode.INTERVENTION_LIMIT_EXCEEDED.formatMessage(limit));
        }

        ManualInterventionRequest request = recoveryManager.requestManualIntervention(context,
                manual.suggestedActions());
        if (metrics != null) {
            metrics.recordInterventionRequested(definition.getName(), context.errorCode());
        }
        adjustActivity(0, 1);

        Duration timeout = options.getInterventionTimeout()
                .orElse(Duration.ofMillis(configuration.getInterventionTimeoutMs()));
        CompletableFuture<ErrorRecoveryStrategy> decision;
        try {
            decision = queue.awaitResolution(request.getId(), timeout);
        } catch (InterventionNotFoundException e) {
            adjustActivity(0, -1);
            return escalate(step, context.error(), e.getMessage());
        }
        token.onCancel(() -> queue.withdraw(request.getId()));
        options.getInterventionHandler().ifPresent(handler -> notifyHandler(handler, request, queue));

        return decision
                .handle((chosen, error) -> {
                    adjustActivity(0, -1);
                    if (error != null) {
                        return escalate(step, context.error(),
                                ErrorCode.INTERVENTION_TIMEOUT.formatMessage(step.getName()));
                    }
                    if (chosen.type() == RecoveryType.MANUAL) {
                        return escalate(step, context.error(), "intervention " + request.getId() +
                                " was resolved without a decision");
                    }
                    logger.info("Step " + step.getName() + " resumes with operator decision " +
                            chosen.type().value());
                    return apply(step, index, context, chosen, progress);
                })
                .thenCompose(Function.identity());
    }

    private void notifyHandler(ManualInterventionHandler handler, ManualInterventionRequest request,
                               ManualInterventionQueue queue) {
        try {
            handler.onInterventionRequested(request, queue);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Intervention handler failed for " + request.getId() +
                    "; the request stays pending", e);
        }
    }

    /**
     * Unrecoverable failure: continue, roll back or abort, in that order of preference.
     */
    private CompletableFuture<Void> escalate(WorkflowStep step, StratusException failure, String reason) {
        markFailed(step, failure);
        recordError(step.getName() + ": " + reason);
        if (options.isContinueOnError()) {
            logger.warning("Continuing past failed step " + step.getName() + ": " + reason);
        } else if (options.isRollbackOnError()) {
            stop(StopReason.ROLLBACK, step, failure, reason);
        } else {
            stop(StopReason.ABORT, step, failure, reason);
        }
        return CompletableFuture.completedFuture(null);
    }

    // ---------------------------------------------------------------- hooks

    private CompletableFuture<Void> runHooks(List<WorkflowStep> hooks, boolean pre) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (WorkflowStep hook : hooks) {
            chain = chain.thenCompose(ignored -> pre && isStopped()
                    ? CompletableFuture.completedFuture(null)
                    : runHook(hook, pre));
        }
        return chain;
    }

    private CompletableFuture<Void> runHook(WorkflowStep hook, boolean pre) {
        String phase = pre ? "Pre-hook " : "Post-hook ";
        return operation(hook, hook.getRetry().orElseGet(this::defaultRetryPolicy), RetryExecutor.AttemptListener.NONE)
                .handle((outputs, error) -> {
                    if (error == null) {
                        logger.fine(phase + hook.getName() + " completed");
                        return null;
                    }
                    StratusException failure = RetryExecutor.toFailure(hook.getName(), unwrap(error), null);
                    if (failure instanceof RecoveryExhaustedException exhausted && exhausted.getLastError() != null) {
                        failure = exhausted.getLastError();
                    }
                    recordError(phase + hook.getName() + " failed: " + describe(failure));
                    logger.warning(phase + hook.getName() + " failed: " + failure.getMessage());
                    synchronized (lock) {
                        hookFailed = true;
                    }
                    if (pre && !options.isContinueOnHookFailure()) {
                        stop(StopReason.ABORT, null, failure, phase + hook.getName() + " failed");
                    }
                    return null;
                });
    }

    // ---------------------------------------------------------------- termination

    private void stop(StopReason reason, WorkflowStep step, StratusException error, String message) {
        ManualInterventionQueue queue = recoveryManager.getInterventionQueue();
        synchronized (lock) {
            if (stopReason != null || finishing) {
                return;
            }
            stopReason = reason;
            stopStep = step;
            stopError = error;
            stopMessage = message;
            pendingAtStop = queue.listPending();
        }

        if (step == null && error == null) {
            recordError(message);
        }
        if (reason == StopReason.ROLLBACK) {
            logger.warning("Workflow " + definition.getName() + " is rolling back: " + message);
        } else {
            logger.severe("Workflow " + definition.getName() + " is stopping: " + message);
        }
        token.cancel(message);
        stopSignal.complete(null);
    }

    private boolean isStopped() {
        synchronized (lock) {
            return stopReason != null;
        }
    }

    private void finish(Throwable error) {
        StopReason reason;
        synchronized (lock) {
            finishing = true;
            reason = stopReason;
        }

        if (error != null) {
            Throwable cause = unwrap(error);
            transition(WorkflowState.ABORTED);
            if (cause instanceof CheckpointException) {
                logger.severe("Workflow " + definition.getName() + " aborted: " + cause.getMessage());
                recordFinished(WorkflowState.ABORTED, false);
                result.completeExceptionally(cause);
                return;
            }
            logger.log(Level.SEVERE, "Workflow " + definition.getName() + " failed unexpectedly", cause);
            recordError("Unexpected failure: " + cause);
            completeTerminal(WorkflowState.ABORTED, null);
            return;
        }

        if (reason == StopReason.ROLLBACK || (reason == StopReason.TIMEOUT && options.isRollbackOnError())) {
            rollBack(reason == StopReason.TIMEOUT ? RollbackTriggerType.TIMEOUT : triggerFor(stopError));
            return;
        }
        if (reason != null) {
            transition(WorkflowState.ABORTED);
            completeTerminal(WorkflowState.ABORTED, null);
            return;
        }

        if (shouldRollBackPartialSuccess()) {
            rollBack(RollbackTriggerType.STEP_FAILURE);
            return;
        }

        transition(WorkflowState.SUCCEEDED);
        runHooks(definition.getPostHooks(), false)
                .whenComplete((ignored, hookError) -> {
                    transition(WorkflowState.COMPLETED);
                    boolean success;
                    synchronized (lock) {
                        success = failed.isEmpty() && (!hookFailed || options.isContinueOnHookFailure());
                    }
                    logger.info("Workflow " + definition.getName() + " completed" +
                            (success ? "" : " with failures") + " in " + elapsed().toMillis() + "ms");
                    complete(baseResult(WorkflowState.COMPLETED).success(success).build());
                });
    }

    private boolean shouldRollBackPartialSuccess() {
        synchronized (lock) {
            if (failed.isEmpty() || !options.isContinueOnError() || !options.isRollbackOnError()) {
                return false;
            }
        }
        return definition.getRollbackStrategy()
                .map(strategy -> strategy.getOptions().isRollbackOnPartialSuccess())
                .orElse(false);
    }

    private static RollbackTriggerType triggerFor(StratusException error) {
        if (error != null && (error.hasErrorCode(ErrorCode.RESOURCE_CONFLICT)
                || error.hasErrorCode(ErrorCode.STATE_LOCK_ERROR))) {
            return RollbackTriggerType.RESOURCE_ERROR;
        }
        if (error != null && error.hasErrorCode(ErrorCode.TIMEOUT_ERROR)) {
            return RollbackTriggerType.TIMEOUT;
        }
        return RollbackTriggerType.STEP_FAILURE;
    }

    private void rollBack(RollbackTriggerType trigger) {
        RollbackContext context = rollbackContext(trigger);
        RollbackStrategy strategy = definition.getRollbackStrategy().orElseGet(RollbackStrategy::automatic);

        if (!rollbackManager.shouldTrigger(strategy, context)) {
            logger.warning("No rollback trigger condition matched for " + definition.getName() + ", aborting");
            recordError("Rollback not triggered: no trigger condition matched " + trigger.value());
            transition(WorkflowState.ABORTED);
            completeTerminal(WorkflowState.ABORTED, null);
            return;
        }

        transition(WorkflowState.ROLLING_BACK);
        RollbackExecutionResult rollback;
        try {
            RollbackPlan plan = rollbackManager.plan(definition, context);
            rollback = rollbackManager.execute(plan, context);
        } catch (WorkflowValidationException e) {
            rollback = RollbackExecutionResult.builder().success(false).error(describe(e)).build();
        }
        if (metrics != null) {
            metrics.recordRollbackExecuted(definition.getName(), strategy.getType().value(), rollback.isSuccess());
        }
        for (String rollbackError : rollback.getErrors()) {
            recordError("Rollback: " + rollbackError);
        }

        transition(WorkflowState.ROLLED_BACK);
        completeTerminal(WorkflowState.ROLLED_BACK, rollback);
    }

    private RollbackContext rollbackContext(RollbackTriggerType trigger) {
        synchronized (lock) {
            RollbackContext.Builder builder = RollbackContext.builder()
                    .workflowName(definition.getName())
                    .trigger(trigger)
                    .completedSteps(completed)
                    .failedSteps(failed)
                    .workflowState(snapshotState())
                    .reason(stopMessage != null ? stopMessage : "workflow finished with failed steps");
            if (stopStep != null) {
                builder.failedStep(stopStep.getName(), definition.indexOf(stopStep.getName()))
                       .affectedResources(affectedResources(stopStep));
            } else if (!failed.isEmpty()) {
                definition.findStep(failed.get(0)).ifPresent(step ->
                        builder.failedStep(step.getName(), definition.indexOf(step.getName()))
                               .affectedResources(affectedResources(step)));
            }
            if (stopError != null) {
                builder.error(stopError.getErrorCode(), stopError.getMessage());
            }
            return builder.build();
        }
    }

    private static List<String> affectedResources(WorkflowStep step) {
        Set<String> resources = new LinkedHashSet<>();
        for (String key : List.of("target", "resources")) {
            Object value = step.getOptions().get(key);
            if (value instanceof Collection<?> values) {
                values.forEach(item -> resources.add(String.valueOf(item)));
            } else if (value != null) {
                resources.add(String.valueOf(value));
            }
        }
        return new ArrayList<>(resources);
    }

    /**
     * Completes an aborted or rolled back run, writing an emergency checkpoint first.
     */
    private void completeTerminal(WorkflowState terminal, RollbackExecutionResult rollback) {
        WorkflowCheckpoint emergency;
        try {
            synchronized (lock) {
                int index = stopStep != null ? definition.indexOf(stopStep.getName()) : -1;
                String stepName = stopStep != null ? stopStep.getName() : null;
                Map<String, Object> snapshot = snapshotState();
                List<String> completedSnapshot = new ArrayList<>(completed);
                List<String> failedSnapshot = new ArrayList<>(failed);
                emergency = recoveryManager.createEmergencyCheckpoint(definition.getName(), index, stepName,
                        snapshot, completedSnapshot, failedSnapshot);
                checkpoints.add(emergency.getId());
            }
        } catch (CheckpointException e) {
            logger.severe("Could not write emergency checkpoint for " + definition.getName() + ": " +
                    e.getMessage());
            recordFinished(terminal, false);
            result.completeExceptionally(e);
            return;
        }

        logger.severe("Workflow " + definition.getName() + " ended " + terminal + " after " +
                elapsed().toMillis() + "ms; emergency checkpoint " + emergency.getId());
        complete(baseResult(terminal).success(false).rollbackResult(rollback).build());
    }

    private void complete(WorkflowExecutionResult executionResult) {
        recordFinished(executionResult.getFinalState(), executionResult.isSuccess());
        result.complete(executionResult);
    }

    private void recordFinished(WorkflowState terminal, boolean success) {
        if (metrics != null) {
            metrics.recordWorkflowFinished(definition.getName(), options.isDryRun() ? "dry-run" : "normal",
                    terminal.name(), success, elapsed().toMillis() / 1000.0);
        }
    }

    private WorkflowExecutionResult.Builder baseResult(WorkflowState terminal) {
        ManualInterventionQueue queue = recoveryManager.getInterventionQueue();
        synchronized (lock) {
            int parallelSteps = 0;
            for (ParallelExecutionStats.BatchStats stats : batchStats) {
                if (stats.getStepCount() > 1) {
                    parallelSteps += stats.getStepCount();
                }
            }
            List<ManualInterventionRequest> pending = stopReason != null ? pendingAtStop : queue.listPending();
            return WorkflowExecutionResult.builder()
                    .runId(runId)
                    .workflowName(definition.getName())
                    .finalState(terminal)
                    .duration(elapsed())
                    .completedSteps(completed)
                    .failedSteps(failed)
                    .skippedSteps(skipped)
                    .errors(errors)
                    .stepResults(stepResults)
                    .checkpointsSaved(checkpoints)
                    .resumedFromCheckpoint(resumedFrom)
                    .manualInterventionsRequested(queue.getRequestCount())
                    .pendingInterventions(pending)
                    .parallelExecutionStats(new ParallelExecutionStats(stepResults.size(), parallelSteps,
                            overallPeak.get(), batchStats));
        }
    }

    // ---------------------------------------------------------------- bookkeeping

    private void markFailed(WorkflowStep step, StratusException failure) {
        synchronized (lock) {
            if (!failed.contains(step.getName())) {
                failed.add(step.getName());
                blocked.add(step.getName());
                errors.add(step.getName() + ": " + describe(failure));
            }
        }
    }

    private void markSkipped(WorkflowStep step, String reason) {
        synchronized (lock) {
            if (!skipped.contains(step.getName())) {
                skipped.add(step.getName());
            }
        }
        logger.info("Step " + step.getName() + " skipped: " + reason);
    }

    private void markBlocked(WorkflowStep step, String reason) {
        synchronized (lock) {
            blocked.add(step.getName());
        }
        markSkipped(step, reason);
    }

    private void recordError(String error) {
        synchronized (lock) {
            errors.add(error);
        }
    }

    /**
     * Tracks steps in recovery and awaiting intervention, moving the run between
     * {@code EXECUTING}, {@code RECOVERING} and {@code AWAITING_MANUAL_INTERVENTION}.
     */
    private void adjustActivity(int recoveringDelta, int awaitingDelta) {
        synchronized (lock) {
            recovering += recoveringDelta;
            awaiting += awaitingDelta;
            if (stopReason != null || finishing) {
                return;
            }
            WorkflowState target = awaiting > 0 ? WorkflowState.AWAITING_MANUAL_INTERVENTION
                    : recovering > 0 ? WorkflowState.RECOVERING
                    : WorkflowState.EXECUTING;
            if (target != state && state.canTransitionTo(target)) {
                state = target;
                logger.fine("Run " + runId + " of " + definition.getName() + " is now " + target);
            }
        }
    }

    private Map<String, Object> snapshotStateLocked() {
        synchronized (lock) {
            return snapshotState();
        }
    }

    // caller holds lock
    private Map<String, Object> snapshotState() {
        Map<String, Object> snapshot = new LinkedHashMap<>(runState);
        Map<String, Object> outputs = new LinkedHashMap<>();
        stepOutputs.forEach((step, values) -> outputs.put(step, new LinkedHashMap<>(values)));
        snapshot.put(OUTPUTS_KEY, outputs);
        return snapshot;
    }

    private Duration elapsed() {
        return startTime != null ? Duration.between(startTime, Instant.now()) : Duration.ZERO;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(StratusException failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return failure.getErrorCode() != null ? failure.getErrorCode() + ": " + message : message;
    }

    /**
     * Attempt count and error messages of one step, carried across recovery retries.
     */
    private static final class StepProgress {
        private final AtomicInteger attempts = new AtomicInteger();
        private final List<String> errors = new CopyOnWriteArrayList<>();
    }

    private final class StepListener implements RetryExecutor.AttemptListener {
        private final WorkflowStep step;
        private final int index;
        private final StepProgress progress;

        private StepListener(WorkflowStep step, int index, StepProgress progress) {
            this.step = step;
            this.index = index;
            this.progress = progress;
        }

        @Override
        public void onAttemptStarted(String stepName, int attempt) {
            progress.attempts.incrementAndGet();
            int now = running.incrementAndGet();
            batchPeak.accumulateAndGet(now, Math::max);
            overallPeak.accumulateAndGet(now, Math::max);
            if (metrics != null) {
                metrics.recordStepExecuted(definition.getName(), step.getCommand());
            }
        }

        @Override
        public void onAttemptFinished(String stepName, int attempt, Instant startTime, Instant endTime,
                                      StratusException failure) {
            running.decrementAndGet();
            StepExecutionContext context = failure == null
                    ? StepExecutionContext.succeeded(step, index, progress.attempts.get(), startTime, endTime)
                    : StepExecutionContext.failed(step, index, progress.attempts.get(), startTime, endTime,
                            failure.getErrorCode(), failure.getMessage());
            synchronized (lock) {
                stepResults.put(step.getName(), context);
            }
        }
    }
}
