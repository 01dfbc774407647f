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

package dev.mars.stratus.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Stratus workflow engine.
 *
 * Provides the following metrics:
 * - stratus.workflow.active (gauge) - Currently running workflows
 * - stratus.workflow.total (counter) - Workflows started
 * - stratus.workflow.completed / failed / rolled_back / aborted (counters) - Workflow outcomes
 * - stratus.workflow.steps.total / failed / retried (counters) - Step executions
 * - stratus.workflow.interventions (counter) - Manual interventions requested
 * - stratus.workflow.rollbacks (counter) - Rollback plans executed
 * - stratus.workflow.duration.seconds (histogram) - Workflow duration distribution
 * - stratus.workflow.batch.concurrency (histogram) - Steps running at once per batch
 *
 * Without an OpenTelemetry SDK installed every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "stratus-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsRolledBack;
    private final LongCounter workflowsAborted;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;
    private final LongCounter interventionsRequested;
    private final LongCounter rollbacksExecuted;

    private final DoubleHistogram workflowDuration;
    private final LongHistogram batchConcurrency;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> EXECUTION_MODE_KEY = AttributeKey.stringKey("execution.mode");
    private static final AttributeKey<String> STEP_COMMAND_KEY = AttributeKey.stringKey("step.command");
    private static final AttributeKey<String> ERROR_CODE_KEY = AttributeKey.stringKey("error.code");
    private static final AttributeKey<String> ROLLBACK_STRATEGY_KEY = AttributeKey.stringKey("rollback.strategy");
    private static final AttributeKey<Boolean> SUCCESS_KEY = AttributeKey.booleanKey("success");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = counter(meter, "stratus.workflow.total", "Total number of workflows started");
        workflowsCompleted = counter(meter, "stratus.workflow.completed", "Number of completed workflows");
        workflowsFailed = counter(meter, "stratus.workflow.failed",
                "Number of workflows that completed with failed steps");
        workflowsRolledBack = counter(meter, "stratus.workflow.rolled_back", "Number of rolled back workflows");
        workflowsAborted = counter(meter, "stratus.workflow.aborted", "Number of aborted workflows");
        stepsTotal = counter(meter, "stratus.workflow.steps.total", "Total number of step attempts");
        stepsFailed = counter(meter, "stratus.workflow.steps.failed", "Number of failed steps");
        stepsRetried = counter(meter, "stratus.workflow.steps.retried", "Number of step retries");
        interventionsRequested = counter(meter, "stratus.workflow.interventions",
                "Number of manual interventions requested");
        rollbacksExecuted = counter(meter, "stratus.workflow.rollbacks", "Number of rollback plans executed");

        workflowDuration = meter.histogramBuilder("stratus.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        batchConcurrency = meter.histogramBuilder("stratus.workflow.batch.concurrency")
                .setDescription("Maximum number of steps running at once within a batch")
                .setUnit("1")
                .ofLongs()
                .build();

        meter.gaugeBuilder("stratus.workflow.active")
                .setDescription("Number of currently running workflows")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName, String executionMode) {
        workflowsTotal.add(1, workflowAttributes(workflowName, executionMode));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Record a finished workflow.
     *
     * @param outcome terminal state name, e.g. {@code COMPLETED}, {@code ROLLED_BACK} or {@code ABORTED}
     * @param success whether the run succeeded
     */
    public void recordWorkflowFinished(String workflowName, String executionMode, String outcome,
                                       boolean success, double durationSeconds) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = workflowAttributes(workflowName, executionMode);
        switch (outcome) {
            case "ROLLED_BACK" -> workflowsRolledBack.add(1, attrs);
            case "ABORTED" -> workflowsAborted.add(1, attrs);
            default -> {
                if (success) {
                    workflowsCompleted.add(1, attrs);
                } else {
                    workflowsFailed.add(1, attrs);
                }
            }
        }
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordStepExecuted(String workflowName, String command) {
        stepsTotal.add(1, stepAttributes(workflowName, command).build());
    }

    public void recordStepFailed(String workflowName, String command, String errorCode) {
        stepsFailed.add(1, stepAttributes(workflowName, command)
                .put(ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown")
                .build());
    }

    public void recordStepRetried(String workflowName, String command) {
        stepsRetried.add(1, stepAttributes(workflowName, command).build());
    }

    public void recordInterventionRequested(String workflowName, String errorCode) {
        interventionsRequested.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown")
                .build());
    }

    public void recordRollbackExecuted(String workflowName, String strategy, boolean success) {
        rollbacksExecuted.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(ROLLBACK_STRATEGY_KEY, strategy)
                .put(SUCCESS_KEY, success)
                .build());
    }

    public void recordBatchConcurrency(String workflowName, int concurrency) {
        batchConcurrency.record(concurrency, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName, String executionMode) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(EXECUTION_MODE_KEY, executionMode)
                .build();
    }

    private static AttributesBuilder stepAttributes(String workflowName, String command) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_COMMAND_KEY, command != null ? command : "unknown");
    }
}
