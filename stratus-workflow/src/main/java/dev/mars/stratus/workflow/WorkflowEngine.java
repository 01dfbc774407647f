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
import dev.mars.stratus.workflow.rollback.RollbackExecutionResult;
import dev.mars.stratus.workflow.rollback.RollbackHistoryEntry;

import java.util.List;

/**
 * Orchestrates infrastructure workflows: validation, dependency-ordered
 * execution with recovery, checkpoints and rollback.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public interface WorkflowEngine {

    /**
     * Checks a definition without running it.
     *
     * @param definition the workflow definition
     * @return the result; never throws for an invalid definition
     */
    ValidationResult validateWorkflow(WorkflowDefinition definition);

    /**
     * Runs a workflow to completion.
     *
     * @param definition the workflow definition
     * @param options execution options
     * @return the result of the run; step failures are reported here, not thrown
     * @throws WorkflowValidationException if the definition is invalid
     * @throws CheckpointException if a checkpoint cannot be read or written
     */
    WorkflowExecutionResult executeWorkflow(WorkflowDefinition definition, WorkflowExecutionOptions options)
            throws WorkflowValidationException, CheckpointException;

    /**
     * Starts a workflow and returns immediately with a handle on the run.
     *
     * @throws WorkflowValidationException if the definition is invalid
     * @throws CheckpointException if the checkpoint to resume from cannot be loaded
     */
    WorkflowRun startWorkflow(WorkflowDefinition definition, WorkflowExecutionOptions options)
            throws WorkflowValidationException, CheckpointException;

    /**
     * Rolls back every step of a workflow on operator request.
     */
    RollbackExecutionResult executeManualRollback(WorkflowDefinition definition, String reason)
            throws WorkflowValidationException;

    /**
     * Rolls back a workflow whose given steps completed.
     */
    RollbackExecutionResult executeManualRollback(WorkflowDefinition definition, String reason,
                                                  List<String> completedSteps)
            throws WorkflowValidationException;

    ParallelizationAnalysis analyzeWorkflowParallelization(WorkflowDefinition definition)
            throws WorkflowValidationException;

    /**
     * Returns a copy of the definition reordered and regrouped for parallel execution.
     * Dependencies are reduced to their transitive core; the execution order they
     * imply is unchanged.
     */
    WorkflowDefinition optimizeWorkflowForParallelExecution(WorkflowDefinition definition)
            throws WorkflowValidationException;

    /**
     * @param workflowName workflow to filter on, or null for all
     */
    List<RollbackHistoryEntry> getRollbackHistory(String workflowName);

    String generateRollbackReport(String workflowName);

    void shutdown();
}
