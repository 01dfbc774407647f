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

package dev.mars.stratus.workflow.rollback;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.OperationException;
import dev.mars.stratus.operation.OperationBackend;
import dev.mars.stratus.operation.OperationResult;
import dev.mars.stratus.operation.StateBackend;
import dev.mars.stratus.workflow.WorkflowDefinition;
import dev.mars.stratus.workflow.WorkflowStep;
import dev.mars.stratus.workflow.WorkflowValidationException;
import dev.mars.stratus.workflow.scheduler.DependencyGraph;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plans and executes compensating steps when a workflow has to be unwound, and
 * keeps the rollback history.
 *
 * <p>Planning merges the definition's rollback steps with the strategy's own
 * (first declaration of a name wins), moves validation and cleanup steps after the
 * main plan and orders the main plan according to the strategy type. The default
 * order follows declared rollback dependencies, choosing higher priority first and
 * then declaration order among ready steps.</p>
 *
 * <p>Execution runs steps one at a time. A failed step is recorded and its
 * dependents are skipped; the rest of the plan carries on unless the failed step is
 * critical, in which case the remaining main and validation steps are skipped.
 * Cleanup steps always run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class RollbackManager {

    private static final Logger logger = Logger.getLogger(RollbackManager.class.getName());

    static final String BACKUP_LOCATION_KEY = "backupLocation";
    static final String STATE_BACKUP_LOCATION_KEY = "stateBackupLocation";

    private final OperationBackend operationBackend;
    private final StateBackend stateBackend;
    private final RollbackConfirmation confirmation;
    private final List<RollbackHistoryEntry> history = new CopyOnWriteArrayList<>();

    public RollbackManager(OperationBackend operationBackend, StateBackend stateBackend) {
        this(operationBackend, stateBackend, RollbackConfirmation.NEVER);
    }

    /**
     * @param operationBackend backend the compensating operations are sent to
     * @param stateBackend     state access for restores and progressive rollback, or null
     * @param confirmation     approval source for manual-strategy rollbacks
     */
    public RollbackManager(OperationBackend operationBackend, StateBackend stateBackend,
                           RollbackConfirmation confirmation) {
        this.operationBackend = Objects.requireNonNull(operationBackend, "Operation backend cannot be null");
        this.stateBackend = stateBackend;
        this.confirmation = Objects.requireNonNull(confirmation, "Rollback confirmation cannot be null");
    }

    /**
     * Whether the strategy fires for this context. A strategy without trigger
     * conditions fires for every trigger; otherwise one condition must match.
     */
    public boolean shouldTrigger(RollbackStrategy strategy, RollbackContext context) {
        if (strategy.getTriggerConditions().isEmpty()) {
            return true;
        }
        return strategy.getTriggerConditions().stream().anyMatch(condition -> condition.matches(context));
    }

    /**
     * Builds the rollback plan for a definition.
     *
     * @throws WorkflowValidationException if the rollback steps depend on each other in a cycle
     */
    public RollbackPlan plan(WorkflowDefinition definition, RollbackContext context)
            throws WorkflowValidationException {
        RollbackStrategy strategy = definition.getRollbackStrategy().orElseGet(RollbackStrategy::automatic);

        Map<String, RollbackStep> merged = new LinkedHashMap<>();
        for (RollbackStep step : definition.getRollbackSteps()) {
            merged.putIfAbsent(step.getName(), step);
        }
        for (RollbackStep step : strategy.getRollbackSteps()) {
            merged.putIfAbsent(step.getName(), step);
        }

        List<RollbackStep> main = new ArrayList<>();
        List<RollbackStep> validation = new ArrayList<>();
        List<RollbackStep> cleanup = new ArrayList<>();
        for (RollbackStep step : merged.values()) {
            switch (step.getRollbackType()) {
                case VALIDATION -> validation.add(step);
                case CLEANUP -> cleanup.add(step);
                default -> main.add(step);
            }
        }

        List<RollbackStep> ordered = switch (strategy.getType()) {
            case SELECTIVE -> orderByDependencies(selectAffected(main, context));
            case PROGRESSIVE -> orderByCompletion(main, context);
            default -> orderByDependencies(main);
        };

        RollbackPlan plan = new RollbackPlan(context.getWorkflowName(), ordered, orderByDependencies(validation),
                orderByDependencies(cleanup), strategy.getType(), strategy.getOptions());
        logger.info("Planned rollback for " + context.getWorkflowName() + ": " + plan);
        return plan;
    }

    /**
     * Validates the dependency graph of a definition's rollback steps.
     *
     * @return the cycle found, as a path starting and ending with the same step, or an empty list
     */
    public static List<String> findRollbackCycle(List<RollbackStep> steps) {
        return buildGraph(steps).findCycle().orElse(List.of());
    }

    private static List<RollbackStep> selectAffected(List<RollbackStep> steps, RollbackContext context) {
        Set<String> affected = new HashSet<>(context.getAffectedResources());
        List<RollbackStep> selected = new ArrayList<>();
        for (RollbackStep step : steps) {
            boolean touchesAffected = step.getResources().stream().anyMatch(affected::contains);
            boolean compensatesFailure = context.getFailedStep() != null
                    && step.getCompensates().map(context.getFailedStep()::equals).orElse(false);
            if (touchesAffected || compensatesFailure) {
                selected.add(step);
            }
        }
        return selected;
    }

    /**
     * Steps compensating the failed step first, then the others in reverse order of
     * the forward step they compensate. Steps without a completed target follow in
     * dependency order.
     */
    private static List<RollbackStep> orderByCompletion(List<RollbackStep> steps, RollbackContext context)
            throws WorkflowValidationException {
        List<String> completed = context.getCompletedSteps();
        List<RollbackStep> forFailed = new ArrayList<>();
        List<RollbackStep> forCompleted = new ArrayList<>();
        List<RollbackStep> others = new ArrayList<>();

        for (RollbackStep step : steps) {
            String target = step.getCompensates().orElse(null);
            if (target != null && target.equals(context.getFailedStep())) {
                forFailed.add(step);
            } else if (target != null && completed.contains(target)) {
                forCompleted.add(step);
            } else {
                others.add(step);
            }
        }

        forCompleted.sort(Comparator.comparingInt(
                (RollbackStep step) -> completed.indexOf(step.getCompensates().orElseThrow())).reversed());

        List<RollbackStep> ordered = new ArrayList<>(forFailed);
        ordered.addAll(forCompleted);
        ordered.addAll(orderByDependencies(others));
        return ordered;
    }

    private static List<RollbackStep> orderByDependencies(List<RollbackStep> steps)
            throws WorkflowValidationException {
        Map<String, RollbackStep> byName = new LinkedHashMap<>();
        Map<String, Integer> declarationOrder = new HashMap<>();
        for (RollbackStep step : steps) {
            byName.put(step.getName(), step);
            declarationOrder.put(step.getName(), declarationOrder.size());
        }

        Comparator<String> tieBreak = Comparator
                .comparingInt((String name) -> byName.get(name).getPriority().ordinal())
                .thenComparingInt(declarationOrder::get);

        List<RollbackStep> ordered = new ArrayList<>();
        for (String name : buildGraph(steps).topologicalSort(tieBreak)) {
            ordered.add(byName.get(name));
        }
        return ordered;
    }

    private static DependencyGraph buildGraph(List<RollbackStep> steps) {
        DependencyGraph graph = new DependencyGraph();
        for (RollbackStep step : steps) {
            graph.addNode(step.getName(), step.getDependencies());
        }
        return graph;
    }

    /**
     * Executes a plan and appends the outcome to the history. A manual-strategy plan
     * runs only if the confirmation collaborator approves it; a declined plan runs
     * nothing and leaves no history entry.
     */
    public RollbackExecutionResult execute(RollbackPlan plan, RollbackContext context) {
        Objects.requireNonNull(plan, "Rollback plan cannot be null");
        Objects.requireNonNull(context, "Rollback context cannot be null");

        if (plan.getStrategyType() == RollbackStrategyType.MANUAL && !confirmation.confirm(plan, context)) {
            logger.warning("Rollback of " + plan.getWorkflowName() + " was not confirmed");
            return RollbackExecutionResult.builder()
                    .success(false)
                    .error(ErrorCode.ROLLBACK_NOT_CONFIRMED.code() + ": " +
                            ErrorCode.ROLLBACK_NOT_CONFIRMED.formatMessage(plan.getWorkflowName()))
                    .build();
        }

        logger.info("Starting " + plan.getStrategyType().value() + " rollback of " + plan.getWorkflowName() +
                " (" + context.getReason() + ")");
        Instant start = Instant.now();
        RollbackRun run = new RollbackRun(plan, context, start);

        if (plan.getOptions().isPreserveState()) {
            run.preserveState();
        }

        for (RollbackStep step : plan.getSteps()) {
            run.runMain(step);
        }
        for (RollbackStep step : plan.getValidationSteps()) {
            if (!plan.getOptions().isValidateAfterRollback()) {
                run.skip(step, "validation disabled");
            } else {
                run.runMain(step);
            }
        }
        for (RollbackStep step : plan.getCleanupSteps()) {
            run.runCleanup(step);
        }

        RollbackExecutionResult result = run.result
                .success(!run.result.hasFailures() && !run.aborted)
                .aborted(run.aborted)
                .duration(Duration.between(start, Instant.now()))
                .build();

        history.add(new RollbackHistoryEntry("rollback-" + UUID.randomUUID(), plan.getWorkflowName(),
                start, context.getReason(), plan.getStrategyType(), result, context));

        if (result.isSuccess()) {
            logger.info("Rollback of " + plan.getWorkflowName() + " completed in " +
                    result.getDuration().toMillis() + "ms");
        } else {
            logger.warning("Rollback of " + plan.getWorkflowName() + " finished with failures: " +
                    result.getFailedRollbackSteps());
        }
        return result;
    }

    /**
     * Rollbacks executed so far, oldest first.
     *
     * @param workflowName only return entries of this workflow, or null for all
     */
    public List<RollbackHistoryEntry> history(String workflowName) {
        List<RollbackHistoryEntry> entries = new ArrayList<>();
        for (RollbackHistoryEntry entry : history) {
            if (workflowName == null || workflowName.equals(entry.workflowName())) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * Plain-text summary of the rollback history.
     */
    public String report(String workflowName) {
        List<RollbackHistoryEntry> entries = history(workflowName);
        long succeeded = entries.stream().filter(entry -> entry.result().isSuccess()).count();

        StringBuilder report = new StringBuilder();
        report.append("Rollback report for ")
              .append(workflowName != null ? workflowName : "all workflows").append('\n');
        report.append("Total rollbacks: ").append(entries.size())
              .append(" (succeeded ").append(succeeded)
              .append(", failed ").append(entries.size() - succeeded).append(")\n");

        for (RollbackHistoryEntry entry : entries) {
            RollbackExecutionResult result = entry.result();
            report.append('\n')
                  .append(entry.timestamp()).append(' ')
                  .append(entry.workflowName())
                  .append(" [").append(entry.strategy().value()).append("] ")
                  .append(result.isSuccess() ? "SUCCESS" : "FAILED").append('\n');
            report.append("  trigger: ").append(entry.triggerReason()).append('\n');
            report.append("  steps: ").append(result.getRollbackSteps()).append('\n');
            for (RollbackStepOutcome outcome : result.getStepOutcomes()) {
                report.append("    ").append(outcome.name())
                      .append(outcome.success() ? " OK " : " FAILED ")
                      .append(outcome.duration().toMillis()).append("ms");
                outcome.errorMessage().ifPresent(error -> report.append(" (").append(error).append(')'));
                report.append('\n');
            }
            if (!result.getFailedRollbackSteps().isEmpty()) {
                report.append("  failed: ").append(result.getFailedRollbackSteps()).append('\n');
            }
            if (!result.getResourcesDestroyed().isEmpty()) {
                report.append("  destroyed: ").append(result.getResourcesDestroyed()).append('\n');
            }
            report.append("  duration: ").append(result.getDuration().toMillis()).append("ms\n");
            for (String error : result.getErrors()) {
                report.append("  error: ").append(error).append('\n');
            }
        }
        return report.toString();
    }

    /**
     * Mutable bookkeeping of one plan execution.
     */
    private final class RollbackRun {
        private final RollbackPlan plan;
        private final RollbackContext context;
        private final Instant deadline;
        private final RollbackExecutionResult.Builder result = RollbackExecutionResult.builder();
        private final Set<String> unsuccessful = new LinkedHashSet<>();
        private boolean aborted;

        private RollbackRun(RollbackPlan plan, RollbackContext context, Instant start) {
            this.plan = plan;
            this.context = context;
            this.deadline = plan.getOptions().getRollbackTimeout().map(start::plus).orElse(null);
        }

        private void preserveState() {
            if (stateBackend == null) {
                result.warning("State preservation requested but no state backend is configured");
                return;
            }
            try {
                String location = stateBackend.createBackup();
                logger.info("Preserved state before rollback at " + location);
            } catch (OperationException e) {
                result.warning("Could not preserve state before rollback: " + e.getMessage());
            }
        }

        private void runMain(RollbackStep step) {
            if (aborted) {
                skip(step, "rollback aborted");
                return;
            }
            if (deadline != null && Instant.now().isAfter(deadline)) {
                aborted = true;
                result.error(ErrorCode.TIMEOUT_ERROR.code() + ": " +
                        ErrorCode.TIMEOUT_ERROR.formatMessage("rollback of " + plan.getWorkflowName()));
                skip(step, "rollback timed out");
                return;
            }
            if (!run(step) && step.getPriority() == RollbackPriority.CRITICAL) {
                aborted = true;
                logger.severe("Critical rollback step " + step.getName() + " failed, aborting rollback");
            }
        }

        private void runCleanup(RollbackStep step) {
            run(step);
        }

        private void skip(RollbackStep step, String reason) {
            unsuccessful.add(step.getName());
            result.skippedRollbackStep(step.getName());
            result.warning("Skipped rollback step " + step.getName() + ": " + reason);
        }

        private boolean run(RollbackStep step) {
            for (String dependency : step.getDependencies()) {
                if (unsuccessful.contains(dependency)) {
                    skip(step, "dependency " + dependency + " did not complete");
                    return true;
                }
            }

            if (plan.getStrategyType() == RollbackStrategyType.PROGRESSIVE && alreadyRolledBack(step)) {
                result.skippedRollbackStep(step.getName());
                result.warning("Skipped rollback step " + step.getName() + ": resources already absent");
                return true;
            }

            int maxAttempts = plan.getOptions().getMaxRollbackAttempts();
            RollbackStepException lastError = null;
            Instant started = Instant.now();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    perform(step);
                    Duration took = Duration.between(started, Instant.now());
                    result.rollbackStep(step.getName());
                    result.stepOutcome(RollbackStepOutcome.succeeded(step.getName(), took));
                    logger.info("Rollback step " + step.getName() + " succeeded in " + took.toMillis() + "ms");
                    return true;
                } catch (RollbackStepException e) {
                    lastError = e;
                    logger.warning("Rollback step " + step.getName() + " failed (attempt " + attempt + "/" +
                            maxAttempts + "): " + e.getMessage());
                }
            }

            unsuccessful.add(step.getName());
            result.failedRollbackStep(step.getName());
            result.stepOutcome(RollbackStepOutcome.failed(step.getName(),
                    Duration.between(started, Instant.now()), lastError.getMessage()));
            result.error(lastError.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Rollback step " + step.getName() + " failure", lastError);
            }
            return false;
        }

        private boolean alreadyRolledBack(RollbackStep step) {
            if (stateBackend == null || step.getRollbackType() != RollbackType.RESOURCE_DESTROY
                    || step.getResources().isEmpty()) {
                return false;
            }
            try {
                Set<String> present = StateBackend.resourceAddresses(stateBackend.loadState());
                return step.getResources().stream().noneMatch(present::contains);
            } catch (OperationException e) {
                result.warning("Could not re-read state before " + step.getName() + ": " + e.getMessage());
                return false;
            }
        }

        private void perform(RollbackStep step) throws RollbackStepException {
            WorkflowStep workflowStep = step.getStep();
            try {
                switch (step.getRollbackType()) {
                    case STATE_RESTORE -> {
                        restoreState(step);
                        return;
                    }
                    case RESOURCE_DESTROY -> {
                        Map<String, Object> options = new LinkedHashMap<>(workflowStep.getOptions());
                        if (!step.getResources().isEmpty()) {
                            options.putIfAbsent("resources", step.getResources());
                        }
                        OperationResult outcome = operationBackend.destroy(options);
                        requireSuccess(step, outcome);
                        result.resourcesDestroyed(!outcome.getResources().isEmpty()
                                ? outcome.getResources() : step.getResources());
                        return;
                    }
                    default -> requireSuccess(step, operationBackend.execute(workflowStep.getCommand(),
                            workflowStep.getArgs(), workflowStep.getOptions()));
                }
            } catch (OperationException e) {
                throw new RollbackStepException(step.getName(), e.getErrorCode() + ": " + e.getMessage(), e);
            }
        }

        private void restoreState(RollbackStep step) throws RollbackStepException, OperationException {
            if (stateBackend == null) {
                throw new RollbackStepException(step.getName(), "no state backend is configured", null);
            }
            Object location = step.getRollbackData().get(BACKUP_LOCATION_KEY);
            if (location == null) {
                location = context.getWorkflowState().get(STATE_BACKUP_LOCATION_KEY);
            }
            if (location == null) {
                throw new RollbackStepException(step.getName(), "no state backup location is known", null);
            }
            stateBackend.restoreBackup(location.toString());
            result.stateRestored(true);
            logger.info("Restored state from " + location);
        }

        private void requireSuccess(RollbackStep step, OperationResult outcome) throws RollbackStepException {
            if (!outcome.isSuccess()) {
                throw new RollbackStepException(step.getName(), outcome.getErrorCode() + ": " +
                        outcome.getErrorMessage().orElse("operation reported failure"), null);
            }
        }
    }
}
