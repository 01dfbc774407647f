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

import dev.mars.stratus.workflow.checkpoint.CheckpointException;
import dev.mars.stratus.workflow.recovery.ErrorRecoveryStrategy;
import dev.mars.stratus.workflow.recovery.InterventionNotFoundException;
import dev.mars.stratus.workflow.recovery.ManualInterventionRequest;
import dev.mars.stratus.workflow.recovery.RecoveryHandlerResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Handle on a workflow run started with {@link WorkflowEngine#startWorkflow}.
 *
 * <p>Operators use it to watch the run's state, answer pending manual
 * interventions and cancel the run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public final class WorkflowRun {

    private final WorkflowExecution execution;

    WorkflowRun(WorkflowExecution execution) {
        this.execution = execution;
    }

    public String getRunId() {
        return execution.getRunId();
    }

    public String getWorkflowName() {
        return execution.getDefinition().getName();
    }

    public WorkflowState getState() {
        return execution.getState();
    }

    /**
     * Interventions waiting for an operator decision, oldest first.
     */
    public List<ManualInterventionRequest> getPendingInterventions() {
        return execution.getInterventionQueue().listPending();
    }

    /**
     * Answers a pending intervention; the waiting step continues with the chosen strategy.
     *
     * @throws InterventionNotFoundException if the id is unknown or already resolved
     */
    public RecoveryHandlerResult resolveIntervention(String interventionId, ErrorRecoveryStrategy strategy)
            throws InterventionNotFoundException {
        return execution.getInterventionQueue().resolve(interventionId, strategy);
    }

    /**
     * Stops the run as aborted. Has no effect once the run is finishing.
     */
    public void cancel(String reason) {
        execution.cancel(reason);
    }

    public boolean isDone() {
        return execution.getResult().isDone();
    }

    /**
     * Future of the run's result. Completes exceptionally with a
     * {@link CheckpointException} if a required checkpoint could not be written.
     */
    public CompletableFuture<WorkflowExecutionResult> getResult() {
        return execution.getResult();
    }

    /**
     * Blocks until the run finishes. Interrupting the caller cancels the run.
     *
     * @throws CheckpointException if a required checkpoint could not be written
     */
    public WorkflowExecutionResult await() throws CheckpointException {
        try {
            return execution.getResult().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.cancel("caller interrupted");
            throw new IllegalStateException("Interrupted while waiting for " + getWorkflowName(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CheckpointException) {
                throw (CheckpointException) e.getCause();
            }
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Workflow " + getWorkflowName() + " failed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "WorkflowRun{runId='" + getRunId() + "', workflow='" + getWorkflowName() + "', state=" +
                getState() + "}";
    }
}
