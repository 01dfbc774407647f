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

import dev.mars.stratus.workflow.recovery.ManualInterventionRequest;
import dev.mars.stratus.workflow.rollback.RollbackExecutionResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured report of a workflow run. Step-level failures never escape the engine
 * as exceptions; they are enumerated here.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public final class WorkflowExecutionResult {

    private final String runId;
    private final String workflowName;
    private final WorkflowState finalState;
    private final boolean success;
    private final boolean dryRun;
    private final Duration duration;
    private final List<String> completedSteps;
    private final List<String> failedSteps;
    private final List<String> skippedSteps;
    private final List<String> plannedSteps;
    private final List<String> errors;
    private final Map<String, StepExecutionContext> stepResults;
    private final boolean rollbackPerformed;
    private final RollbackExecutionResult rollbackResult;
    private final List<String> checkpointsSaved;
    private final String resumedFromCheckpoint;
    private final int manualInterventionsRequested;
    private final List<ManualInterventionRequest> pendingInterventions;
    private final ParallelExecutionStats parallelExecutionStats;

    private WorkflowExecutionResult(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "Run id cannot be null");
        this.workflowName = Objects.requireNonNull(builder.workflowName, "Workflow name cannot be null");
        this.finalState = Objects.requireNonNull(builder.finalState, "Final state cannot be null");
        this.success = builder.success;
        this.dryRun = builder.dryRun;
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
        this.completedSteps = List.copyOf(builder.completedSteps);
        this.failedSteps = List.copyOf(builder.failedSteps);
        this.skippedSteps = List.copyOf(builder.skippedSteps);
        this.plannedSteps = List.copyOf(builder.plannedSteps);
        this.errors = List.copyOf(builder.errors);
        this.stepResults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stepResults));
        this.rollbackPerformed = builder.rollbackPerformed;
        this.rollbackResult = builder.rollbackResult;
        this.checkpointsSaved = List.copyOf(builder.checkpointsSaved);
        this.resumedFromCheckpoint = builder.resumedFromCheckpoint;
        this.manualInterventionsRequested = builder.manualInterventionsRequested;
        this.pendingInterventions = List.copyOf(builder.pendingInterventions);
        this.parallelExecutionStats = builder.parallelExecutionStats != null
                ? builder.parallelExecutionStats : ParallelExecutionStats.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * {@link WorkflowState#COMPLETED}, {@link WorkflowState#ROLLED_BACK} or {@link WorkflowState#ABORTED}.
     */
    public WorkflowState getFinalState() {
        return finalState;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Completed steps in completion order, including steps restored from a checkpoint.
     */
    public List<String> getCompletedSteps() {
        return completedSteps;
    }

    public List<String> getFailedSteps() {
        return failedSteps;
    }

    /**
     * Steps not run because their condition was false, a dependency did not complete
     * or the run was cancelled.
     */
    public List<String> getSkippedSteps() {
        return skippedSteps;
    }

    /**
     * Steps a dry run would have executed, in batch order.
     */
    public List<String> getPlannedSteps() {
        return plannedSteps;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Final attempt of every step that ran.
     */
    public Map<String, StepExecutionContext> getStepResults() {
        return stepResults;
    }

    public boolean isRollbackPerformed() {
        return rollbackPerformed;
    }

    public Optional<RollbackExecutionResult> getRollbackResult() {
        return Optional.ofNullable(rollbackResult);
    }

    public List<String> getCheckpointsSaved() {
        return checkpointsSaved;
    }

    public Optional<String> getResumedFromCheckpoint() {
        return Optional.ofNullable(resumedFromCheckpoint);
    }

    public int getManualInterventionsRequested() {
        return manualInterventionsRequested;
    }

    /**
     * Interventions still unresolved when the run ended.
     */
    public List<ManualInterventionRequest> getPendingInterventions() {
        return pendingInterventions;
    }

    public ParallelExecutionStats getParallelExecutionStats() {
        return parallelExecutionStats;
    }

    @Override
    public String toString() {
        return "WorkflowExecutionResult{" +
               "runId='" + runId + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", finalState=" + finalState +
               ", success=" + success +
               ", dryRun=" + dryRun +
               ", duration=" + duration.toMillis() + "ms" +
               ", completedSteps=" + completedSteps +
               ", failedSteps=" + failedSteps +
               ", skippedSteps=" + skippedSteps +
               ", errors=" + errors.size() +
               ", rollbackPerformed=" + rollbackPerformed +
               '}';
    }

    public static class Builder {
        private String runId;
        private String workflowName;
        private WorkflowState finalState;
        private boolean success;
        private boolean dryRun;
        private Duration duration;
        private List<String> completedSteps = new ArrayList<>();
        private List<String> failedSteps = new ArrayList<>();
        private List<String> skippedSteps = new ArrayList<>();
        private List<String> plannedSteps = new ArrayList<>();
        private List<String> errors = new ArrayList<>();
        private Map<String, StepExecutionContext> stepResults = new LinkedHashMap<>();
        private boolean rollbackPerformed;
        private RollbackExecutionResult rollbackResult;
        private List<String> checkpointsSaved = new ArrayList<>();
        private String resumedFromCheckpoint;
        private int manualInterventionsRequested;
        private List<ManualInterventionRequest> pendingInterventions = new ArrayList<>();
        private ParallelExecutionStats parallelExecutionStats;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder finalState(WorkflowState finalState) {
            this.finalState = finalState;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder completedSteps(List<String> completedSteps) {
            this.completedSteps = new ArrayList<>(completedSteps);
            return this;
        }

        public Builder failedSteps(List<String> failedSteps) {
            this.failedSteps = new ArrayList<>(failedSteps);
            return this;
        }

        public Builder skippedSteps(List<String> skippedSteps) {
            this.skippedSteps = new ArrayList<>(skippedSteps);
            return this;
        }

        public Builder plannedSteps(List<String> plannedSteps) {
            this.plannedSteps = new ArrayList<>(plannedSteps);
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder stepResults(Map<String, StepExecutionContext> stepResults) {
            this.stepResults = new LinkedHashMap<>(stepResults);
            return this;
        }

        public Builder rollbackResult(RollbackExecutionResult rollbackResult) {
            this.rollbackResult = rollbackResult;
            this.rollbackPerformed = rollbackResult != null;
            return this;
        }

        public Builder checkpointsSaved(List<String> checkpointsSaved) {
            this.checkpointsSaved = new ArrayList<>(checkpointsSaved);
            return this;
        }

        public Builder resumedFromCheckpoint(String resumedFromCheckpoint) {
            this.resumedFromCheckpoint = resumedFromCheckpoint;
            return this;
        }

        public Builder manualInterventionsRequested(int manualInterventionsRequested) {
            this.manualInterventionsRequested = manualInterventionsRequested;
            return this;
        }

        public Builder pendingInterventions(List<ManualInterventionRequest> pendingInterventions) {
            this.pendingInterventions = new ArrayList<>(pendingInterventions);
            return this;
        }

        public Builder parallelExecutionStats(ParallelExecutionStats parallelExecutionStats) {
            this.parallelExecutionStats = parallelExecutionStats;
            return this;
        }

        public WorkflowExecutionResult build() {
            return new WorkflowExecutionResult(this);
        }
    }
}
