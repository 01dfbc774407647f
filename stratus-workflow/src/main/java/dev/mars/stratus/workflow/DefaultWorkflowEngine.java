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
import dev.mars.stratus.operation.OperationBackend;
import dev.mars.stratus.operation.StateBackend;
import dev.mars.stratus.workflow.checkpoint.CheckpointException;
import dev.mars.stratus.workflow.checkpoint.CheckpointStore;
import dev.mars.stratus.workflow.checkpoint.FileCheckpointStore;
import dev.mars.stratus.workflow.checkpoint.WorkflowCheckpoint;
import dev.mars.stratus.workflow.recovery.ErrorRecoveryManager;
import dev.mars.stratus.workflow.retry.RetryExecutor;
import dev.mars.stratus.workflow.rollback.RollbackConfirmation;
import dev.mars.stratus.workflow.rollback.RollbackContext;
import dev.mars.stratus.workflow.rollback.RollbackExecutionResult;
import dev.mars.stratus.workflow.rollback.RollbackHistoryEntry;
import dev.mars.stratus.workflow.rollback.RollbackManager;
import dev.mars.stratus.workflow.rollback.RollbackPlan;
import dev.mars.stratus.workflow.rollback.RollbackStep;
import dev.mars.stratus.workflow.rollback.RollbackTriggerType;
import dev.mars.stratus.workflow.scheduler.DependencyGraph;
import dev.mars.stratus.workflow.scheduler.DependencyScheduler;
import dev.mars.stratus.workflow.scheduler.ExecutionBatch;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Default {@link WorkflowEngine}.
 *
 * <p>One engine can run many workflows at once. Each run gets its own
 * intervention queue and recovery manager; the worker pool, the checkpoint
 * store and the rollback history are shared.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(DefaultWorkflowEngine.class.getName());

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final int MIN_WORKER_THREADS = 8;

    private final OperationBackend operationBackend;
    private final StateBackend stateBackend;
    private final StratusConfiguration configuration;
    private final DependencyScheduler scheduler = new DependencyScheduler();
    private final RollbackManager rollbackManager;
    private final ConditionEvaluator conditionEvaluator;
    private final CheckpointStore checkpointStore;
    private final ThreadPoolExecutor executorService;
    private final RetryExecutor retryExecutor;
    private final Map<String, WorkflowExecution> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DefaultWorkflowEngine(OperationBackend operationBackend, StateBackend stateBackend,
                                 StratusConfiguration configuration) {
        this(operationBackend, stateBackend, configuration, RollbackConfirmation.NEVER,
                Paths.get(System.getProperty("user.dir")));
    }

    /**
     * @param operationBackend backend that executes step commands
     * @param stateBackend     state access for backups, restores and conditions, or null
     * @param configuration    engine configuration
     * @param confirmation     approval source for manual-strategy rollbacks
     * @param workingDirectory base directory for {@code file-exists} conditions
     */
    public DefaultWorkflowEngine(OperationBackend operationBackend, StateBackend stateBackend,
                                 StratusConfiguration configuration, RollbackConfirmation confirmation,
                                 Path workingDirectory) {
        this.operationBackend = Objects.requireNonNull(operationBackend, "Operation backend cannot be null");
        this.stateBackend = stateBackend;
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.rollbackManager = new RollbackManager(operationBackend, stateBackend, confirmation);
        this.conditionEvaluator = new ConditionEvaluator(workingDirectory, stateBackend);
        this.checkpointStore = new FileCheckpointStore(configuration.getCheckpointDirectory());

        int threads = workerThreadsFor(configuration.getMaxConcurrency());
        AtomicInteger threadNumber = new AtomicInteger();
        this.executorService = new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "stratus-workflow-" + threadNumber.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        this.executorService.allowCoreThreadTimeOut(true);
        this.retryExecutor = new RetryExecutor(executorService);

        logger.info("DefaultWorkflowEngine initialized with " + threads + " worker threads, checkpoints in " +
                configuration.getCheckpointDirectory());
    }

    @Override
    public ValidationResult validateWorkflow(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (isBlank(definition.getName())) {
            result.addError(ErrorCode.VALIDATION_ERROR.code(), "name", "Workflow name is required and cannot be empty");
        }
        if (isBlank(definition.getDescription())) {
            result.addError(ErrorCode.VALIDATION_ERROR.code(), "description",
                    "Workflow description is required and cannot be empty");
        }
        if (definition.getSteps().isEmpty()) {
            result.addError(ErrorCode.VALIDATION_ERROR.code(), "steps", "Workflow must have at least one step");
        }

        List<WorkflowStep> steps = definition.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String path = "steps[" + i + "]";
            if (isBlank(step.getName())) {
                result.addError(ErrorCode.VALIDATION_ERROR.code(), path + ".name",
                        "Step " + (i + 1) + ": Step name is required and cannot be empty");
            }
            if (isBlank(step.getDescription())) {
                result.addError(ErrorCode.VALIDATION_ERROR.code(), path + ".description",
                        "Step " + (i + 1) + ": Step description is required and cannot be empty");
            }
            if (isBlank(step.getCommand())) {
                result.addError(ErrorCode.VALIDATION_ERROR.code(), path + ".command",
                        "Step " + (i + 1) + ": Step command is required and cannot be empty");
            }
        }
        result.merge(scheduler.validate(steps));

        List<String> rollbackCycle = RollbackManager.findRollbackCycle(allRollbackSteps(definition));
        if (!rollbackCycle.isEmpty()) {
            result.addError(ErrorCode.CYCLIC_DEPENDENCY.code(), "rollbackSteps",
                    ErrorCode.CYCLIC_DEPENDENCY.formatMessage(String.join(" -> ", rollbackCycle)));
        }

        if (!result.isValid()) {
            logger.warning("Workflow " + definition.getName() + " failed validation with " +
                    result.getErrorCount() + " errors");
        }
        return result;
    }

    @Override
    public WorkflowExecutionResult executeWorkflow(WorkflowDefinition definition, WorkflowExecutionOptions options)
            throws WorkflowValidationException, CheckpointException {
        return startWorkflow(definition, options).await();
    }

    @Override
    public WorkflowRun startWorkflow(WorkflowDefinition definition, WorkflowExecutionOptions options)
            throws WorkflowValidationException, CheckpointException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        WorkflowExecutionOptions effective = options != null ? options : WorkflowExecutionOptions.defaults();
        if (shutdown.get()) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }

        CheckpointStore store = effective.getCheckpointDirectory()
                .<CheckpointStore>map(FileCheckpointStore::new)
                .orElse(checkpointStore);
        ErrorRecoveryManager recoveryManager = new ErrorRecoveryManager(store);
        WorkflowExecution execution = new WorkflowExecution(definition, effective, configuration,
                operationBackend, stateBackend, rollbackManager, recoveryManager, conditionEvaluator,
                retryExecutor, executorService);

        execution.transition(WorkflowState.VALIDATING);
        ValidationResult validation = validateWorkflow(definition);
        if (!validation.isValid()) {
            execution.transition(WorkflowState.ABORTED);
            throw new WorkflowValidationException(definition.getName(), validation);
        }

        int maxConcurrency = effective.isParallel()
                ? effective.getMaxConcurrency().orElse(configuration.getMaxConcurrency())
                : 1;
        List<ExecutionBatch> batches;
        WorkflowCheckpoint checkpoint = null;
        try {
            batches = scheduler.schedule(definition.getSteps(), Math.max(1, maxConcurrency));
            Optional<String> resumeFrom = effective.getResumeFromCheckpoint();
            if (resumeFrom.isPresent()) {
                checkpoint = recoveryManager.loadCheckpoint(resumeFrom.get());
                if (!definition.getName().equals(checkpoint.getWorkflowName())) {
                    throw new CheckpointException(ErrorCode.CHECKPOINT_INVALID, checkpoint.getId(),
                            ErrorCode.CHECKPOINT_INVALID.formatMessage("checkpoint " + checkpoint.getId() +
                                    " belongs to workflow " + checkpoint.getWorkflowName() + ", not " +
                                    definition.getName()));
                }
            }
        } catch (WorkflowValidationException | CheckpointException e) {
            execution.transition(WorkflowState.ABORTED);
            throw e;
        }

        execution.transition(WorkflowState.SCHEDULED);
        activeRuns.put(execution.getRunId(), execution);
        execution.getResult().whenComplete((result, error) -> activeRuns.remove(execution.getRunId()));
        ensureWorkerThreads(Math.max(1, maxConcurrency));
        execution.start(batches, Math.max(1, maxConcurrency), checkpoint);
        return execution.getHandle();
    }

    private static int workerThreadsFor(int maxConcurrency) {
        return Math.max(MIN_WORKER_THREADS, maxConcurrency * 2);
    }

    /**
     * Grows the shared worker pool so a run's concurrency limit is not capped by the
     * pool size. The pool never shrinks; idle threads time out.
     */
    private synchronized void ensureWorkerThreads(int maxConcurrency) {
        int required = workerThreadsFor(maxConcurrency);
        if (required <= executorService.getMaximumPoolSize()) {
            return;
        }
        executorService.setMaximumPoolSize(required);
        executorService.setCorePoolSize(required);
        logger.info("Worker pool grown to " + required + " threads for a run with max concurrency " +
                maxConcurrency);
    }

    int getWorkerThreads() {
        return executorService.getMaximumPoolSize();
    }

    /**
     * Looks up a run that has not finished yet.
     */
    public Optional<WorkflowRun> getRun(String runId) {
        WorkflowExecution execution = activeRuns.get(runId);
        return execution != null ? Optional.of(execution.getHandle()) : Optional.empty();
    }

    @Override
    public RollbackExecutionResult executeManualRollback(WorkflowDefinition definition, String reason)
            throws WorkflowValidationException {
        return executeManualRollback(definition, reason, null);
    }

    @Override
    public RollbackExecutionResult executeManualRollback(WorkflowDefinition definition, String reason,
                                                         List<String> completedSteps)
            throws WorkflowValidationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        List<String> completed = completedSteps;
        if (completed == null) {
            completed = new ArrayList<>();
            for (WorkflowStep step : definition.getSteps()) {
                completed.add(step.getName());
            }
        }

        RollbackContext context = RollbackContext.builder()
                .workflowName(definition.getName())
                .trigger(RollbackTriggerType.MANUAL)
                .completedSteps(completed)
                .reason(reason != null ? reason : "manual rollback requested")
                .build();

        logger.info("Manual rollback of " + definition.getName() + " requested: " + context.getReason());
        RollbackPlan plan = rollbackManager.plan(definition, context);
        return rollbackManager.execute(plan, context);
    }

    @Override
    public ParallelizationAnalysis analyzeWorkflowParallelization(WorkflowDefinition definition)
            throws WorkflowValidationException {
        List<WorkflowStep> steps = definition.getSteps();
        requireValidGraph(definition);
        DependencyGraph graph = scheduler.buildGraph(steps);
        List<List<String>> layers = graph.layers();

        List<String> parallelizable = new ArrayList<>();
        int maxParallelism = 0;
        for (List<String> layer : layers) {
            if (layer.size() > 1) {
                parallelizable.addAll(layer);
            }
            maxParallelism = Math.max(maxParallelism, layer.size());
        }

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (WorkflowStep step : steps) {
            dependencies.put(step.getName(), step.getDependsOn());
            step.getParallelGroup().ifPresent(group ->
                    groups.computeIfAbsent(group, key -> new ArrayList<>()).add(step.getName()));
        }

        double speedup = layers.isEmpty() ? 1.0 : (double) steps.size() / layers.size();
        return new ParallelizationAnalysis(steps.size(), layers, parallelizable, dependencies, groups,
                graph.longestPath(), maxParallelism, speedup);
    }

    @Override
    public WorkflowDefinition optimizeWorkflowForParallelExecution(WorkflowDefinition definition)
            throws WorkflowValidationException {
        requireValidGraph(definition);
        DependencyGraph graph = scheduler.buildGraph(definition.getSteps());
        List<List<String>> layers = graph.layers();

        List<WorkflowStep> optimized = new ArrayList<>();
        int reducedEdges = 0;
        for (int i = 0; i < layers.size(); i++) {
            List<String> layer = layers.get(i);
            for (String name : layer) {
                WorkflowStep step = definition.findStep(name).orElseThrow();
                List<String> direct = new ArrayList<>();
                for (String dependency : step.getDependsOn()) {
                    boolean implied = step.getDependsOn().stream()
                            .filter(other -> !other.equals(dependency))
                            .anyMatch(other -> graph.transitiveDependencies(other).contains(dependency));
                    if (implied) {
                        reducedEdges++;
                    } else {
                        direct.add(dependency);
                    }
                }

                WorkflowStep.Builder builder = step.toBuilder().dependsOn(direct);
                if (layer.size() > 1 && step.getParallelGroup().isEmpty()) {
                    builder.parallelGroup("batch-" + (i + 1));
                }
                optimized.add(builder.build());
            }
        }

        logger.info("Optimized " + definition.getName() + ": " + layers.size() + " batches, " + reducedEdges +
                " redundant dependencies removed");
        return definition.toBuilder().steps(optimized).build();
    }

    @Override
    public List<RollbackHistoryEntry> getRollbackHistory(String workflowName) {
        return rollbackManager.history(workflowName);
    }

    @Override
    public String generateRollbackReport(String workflowName) {
        return rollbackManager.report(workflowName);
    }

    @Override
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down workflow engine...");
        activeRuns.values().forEach(run -> run.cancel("engine shutdown"));

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warning("Workflow engine shutdown timed out, forcing shutdown");
                executorService.shutdownNow();
                return;
            }
            logger.info("Workflow engine shutdown completed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    private void requireValidGraph(WorkflowDefinition definition) throws WorkflowValidationException {
        ValidationResult validation = scheduler.validate(definition.getSteps());
        if (!validation.isValid()) {
            throw new WorkflowValidationException(definition.getName(), validation);
        }
    }

    private static List<RollbackStep> allRollbackSteps(
            WorkflowDefinition definition) {
        List<RollbackStep> all = new ArrayList<>(definition.getRollbackSteps());
        definition.getRollbackStrategy().ifPresent(strategy -> all.addAll(strategy.getRollbackSteps()));
        return all;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
