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

package dev.mars.stratus.workflow.recovery;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.operation.OperationType;
import dev.mars.stratus.workflow.checkpoint.CheckpointException;
import dev.mars.stratus.workflow.checkpoint.CheckpointStore;
import dev.mars.stratus.workflow.checkpoint.WorkflowCheckpoint;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Decides how a workflow run recovers from a step failure, and owns that run's
 * manual intervention queue.
 *
 * <p>Classification rules, first match wins:</p>
 * <ol>
 *   <li>network, timeout or temporary failures below attempt 3: retry</li>
 *   <li>permission or authentication failures: manual, credentials review</li>
 *   <li>resource conflicts and state locks: retry after {@code 5000 + attempt * 2000} ms</li>
 *   <li>configuration or validation failures: manual, configuration review</li>
 *   <li>failed deploy/apply below attempt 2: retry</li>
 *   <li>failed destroy mentioning a dependency: manual, dependency review</li>
 *   <li>anything else: manual</li>
 * </ol>
 *
 * <p>One instance per workflow run, so concurrent runs never share pending requests.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ErrorRecoveryManager {

    private static final Logger logger = Logger.getLogger(ErrorRecoveryManager.class.getName());

    static final int MAX_TRANSIENT_RETRY_ATTEMPTS = 3;
    static final int MAX_DEPLOY_RETRY_ATTEMPTS = 2;
    static final int MAX_RETRY_ATTEMPTS = 5;
    static final long CONFLICT_BASE_DELAY_MS = 5000;
    static final long CONFLICT_DELAY_STEP_MS = 2000;

    private static final Set<String> TRANSIENT_CODES = Set.of(
            ErrorCode.NETWORK_ERROR.code(), ErrorCode.TIMEOUT_ERROR.code(), ErrorCode.TEMPORARY_FAILURE.code());
    private static final Set<String> ACCESS_CODES = Set.of(
            ErrorCode.PERMISSION_DENIED.code(), ErrorCode.AUTHENTICATION_FAILED.code());
    private static final Set<String> CONTENTION_CODES = Set.of(
            ErrorCode.RESOURCE_CONFLICT.code(), ErrorCode.STATE_LOCK_ERROR.code());
    private static final Set<String> CONFIGURATION_CODES = Set.of(
            ErrorCode.CONFIGURATION_ERROR.code(), ErrorCode.VALIDATION_ERROR.code());

    private static final List<String> ACCESS_ACTIONS = List.of(
            "Check cloud provider credentials", "Verify IAM permissions", "Refresh authentication tokens");
    private static final List<String> CONFIGURATION_ACTIONS = List.of(
            "Review step configuration", "Check step options", "Validate workflow definition");
    private static final List<String> DEPENDENCY_ACTIONS = List.of(
            "Check resource dependencies", "Consider destroying dependencies first", "Review infrastructure state");
    private static final List<String> DEFAULT_ACTIONS = List.of(
            "Review error details", "Check infrastructure state", "Retry or skip the step");

    private final CheckpointStore checkpointStore;
    private final ManualInterventionQueue interventions;

    public ErrorRecoveryManager(CheckpointStore checkpointStore) {
        this(checkpointStore, new ManualInterventionQueue());
    }

    public ErrorRecoveryManager(CheckpointStore checkpointStore, ManualInterventionQueue interventions) {
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "Checkpoint store cannot be null");
        this.interventions = Objects.requireNonNull(interventions, "Intervention queue cannot be null");
    }

    /**
     * Classifies a step failure into a recovery strategy.
     */
    public ErrorRecoveryStrategy analyzeError(ErrorContext context) {
        Objects.requireNonNull(context, "Error context cannot be null");
        String code = context.errorCode();
        int attempt = context.attemptNumber();
        ErrorRecoveryStrategy strategy = classify(context, code, attempt);
        logger.fine("Step " + context.step().getName() + " failed with " + code + " on attempt " + attempt +
                ", recovery: " + strategy.type().value() + " (" + strategy.reason() + ")");
        return strategy;
    }

    private ErrorRecoveryStrategy classify(ErrorContext context, String code, int attempt) {
        if (code != null && TRANSIENT_CODES.contains(code) && attempt < MAX_TRANSIENT_RETRY_ATTEMPTS) {
            return ErrorRecoveryStrategy.retry("Transient error " + code + ", retrying");
        }
        if (code != null && ACCESS_CODES.contains(code)) {
            return ErrorRecoveryStrategy.manual("Access denied: " + code, ACCESS_ACTIONS);
        }
        if (code != null && CONTENTION_CODES.contains(code)) {
            long delay = CONFLICT_BASE_DELAY_MS + attempt * CONFLICT_DELAY_STEP_MS;
            return ErrorRecoveryStrategy.retry("Resource contention " + code + ", retrying after delay", delay);
        }
        if (code != null && CONFIGURATION_CODES.contains(code)) {
            return ErrorRecoveryStrategy.manual("Configuration problem: " + code, CONFIGURATION_ACTIONS);
        }

        Optional<OperationType> operation = OperationType.fromCommand(context.step().getCommand());
        if (operation.isPresent() && operation.get() == OperationType.DEPLOY
                && attempt < MAX_DEPLOY_RETRY_ATTEMPTS) {
            return ErrorRecoveryStrategy.retry("Deploy failures often succeed on retry");
        }
        if (operation.isPresent() && operation.get() == OperationType.DESTROY
                && context.errorMessage().toLowerCase(Locale.ROOT).contains("dependency")) {
            return ErrorRecoveryStrategy.manual("Destroy blocked by resource dependencies", DEPENDENCY_ACTIONS);
        }

        return ErrorRecoveryStrategy.manual("Unknown error type, manual intervention recommended", DEFAULT_ACTIONS);
    }

    /**
     * Checks that a strategy is acceptable for the failure. A retry is refused once
     * {@value #MAX_RETRY_ATTEMPTS} attempts have been made; a skip is refused for steps
     * whose name marks them as deploying or destroying infrastructure.
     */
    public boolean validateRecoveryStrategy(ErrorRecoveryStrategy strategy, ErrorContext context) {
        if (strategy instanceof ErrorRecoveryStrategy.Retry) {
            return context.attemptNumber() < MAX_RETRY_ATTEMPTS;
        }
        if (strategy instanceof ErrorRecoveryStrategy.Skip) {
            String name = context.step().getName().toLowerCase(Locale.ROOT);
            return !name.contains("deploy") && !name.contains("destroy");
        }
        return true;
    }

    public ManualInterventionRequest requestManualIntervention(ErrorContext context, List<String> suggestedActions) {
        return interventions.request(context, suggestedActions);
    }

    public RecoveryHandlerResult resolveManualIntervention(String id, ErrorRecoveryStrategy strategy)
            throws InterventionNotFoundException {
        return interventions.resolve(id, strategy);
    }

    public List<ManualInterventionRequest> listPendingInterventions() {
        return interventions.listPending();
    }

    public ManualInterventionQueue getInterventionQueue() {
        return interventions;
    }

    public String saveCheckpoint(WorkflowCheckpoint checkpoint) throws CheckpointException {
        return checkpointStore.save(checkpoint);
    }

    public WorkflowCheckpoint loadCheckpoint(String id) throws CheckpointException {
        return checkpointStore.load(id);
    }

    public List<WorkflowCheckpoint> listCheckpoints(String workflowName) throws CheckpointException {
        return checkpointStore.list(workflowName);
    }

    /**
     * Snapshots progress at a fatal failure so a later run can resume past the
     * completed steps.
     *
     * @return the checkpoint written
     * @throws CheckpointException if it cannot be written
     */
    public WorkflowCheckpoint createEmergencyCheckpoint(String workflowName, int stepIndex, String stepName,
                                                        Map<String, Object> state, List<String> completedSteps,
                                                        List<String> failedSteps) throws CheckpointException {
        WorkflowCheckpoint checkpoint = new WorkflowCheckpoint(
                WorkflowCheckpoint.EMERGENCY_PREFIX + UUID.randomUUID(), workflowName, stepIndex, stepName,
                Instant.now(), state, completedSteps, failedSteps);
        String location = checkpointStore.save(checkpoint);
        logger.warning("Emergency checkpoint " + checkpoint.getId() + " written to " + location);
        return checkpoint;
    }
}
