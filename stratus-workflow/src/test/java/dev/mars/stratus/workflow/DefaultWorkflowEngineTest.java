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
import dev.mars.stratus.core.exceptions.OperationException;
import dev.mars.stratus.operation.OperationBackend;
import dev.mars.stratus.operation.OperationResult;
import dev.mars.stratus.operation.StateBackend;
import dev.mars.stratus.workflow.checkpoint.CheckpointException;
import dev.mars.stratus.workflow.checkpoint.WorkflowCheckpoint;
import dev.mars.stratus.workflow.recovery.ErrorRecoveryStrategy;
import dev.mars.stratus.workflow.recovery.InterventionNotFoundException;
import dev.mars.stratus.workflow.recovery.ManualInterventionRequest;
import dev.mars.stratus.workflow.rollback.RollbackConfirmation;
import dev.mars.stratus.workflow.rollback.RollbackExecutionResult;
import dev.mars.stratus.workflow.rollback.RollbackOptions;
import dev.mars.stratus.workflow.rollback.RollbackStep;
import dev.mars.stratus.workflow.rollback.RollbackStrategy;
import dev.mars.stratus.workflow.rollback.RollbackStrategyType;
import dev.mars.stratus.workflow.rollback.RollbackTriggerCondition;
import dev.mars.stratus.workflow.rollback.RollbackTriggerType;
import dev.mars.stratus.workflow.rollback.RollbackType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end runs of the engine against an in-memory backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-11
 */
@DisplayName("DefaultWorkflowEngine")
class DefaultWorkflowEngineTest {

    private static final long RESULT_TIMEOUT_SECONDS = 10;

    @TempDir
    Path tempDir;

    private ScriptedBackend backend;
    private StateBackend stateBackend;
    private DefaultWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        stateBackend = mock(StateBackend.class);
        engine = newEngine(RollbackConfirmation.NEVER);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private DefaultWorkflowEngine newEngine(RollbackConfirmation confirmation) {
        Properties properties = new Properties();
        properties.setProperty(StratusConfiguration.CHECKPOINT_DIR, tempDir.resolve("checkpoints").toString());
        properties.setProperty(StratusConfiguration.RETRY_DELAY_MS, "10");
        properties.setProperty(StratusConfiguration.RETRY_MAX_ATTEMPTS, "1");
        properties.setProperty(StratusConfiguration.INTERVENTION_TIMEOUT_MS, "5000");
        properties.setProperty(StratusConfiguration.METRICS_ENABLED, "false");
        return new DefaultWorkflowEngine(backend, stateBackend, new StratusConfiguration(properties),
                confirmation, tempDir);
    }

    private static WorkflowStep step(String name, String command, String... dependsOn) {
        return WorkflowStep.builder(name)
                .description("Step " + name)
                .command(command)
                .option("stack", name)
                .dependsOn(dependsOn)
                .build();
    }

    private static WorkflowDefinition workflow(String name, WorkflowStep... steps) {
        return WorkflowDefinition.builder()
                .name(name)
                .description("Workflow " + name)
                .steps(List.of(steps))
                .build();
    }

    /** plan -> broken -> app, where broken is a synth step. */
    private static WorkflowDefinition chain() {
        return workflow("chain",
                step("plan", "plan"),
                step("broken", "synth", "plan"),
                step("app", "deploy", "broken"));
    }

    private WorkflowExecutionResult run(WorkflowDefinition definition, WorkflowExecutionOptions options)
            throws Exception {
        return engine.startWorkflow(definition, options).getResult().get(RESULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(RESULT_TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("runs dependency batches in order with hooks around them")
        void runsBatchesInOrder() throws Exception {
            WorkflowDefinition definition = workflow("infra",
                    step("plan", "plan"),
                    step("network", "deploy", "plan"),
                    step("database", "deploy", "plan"),
                    step("app", "deploy", "network", "database"))
                    .toBuilder()
                    .preHooks(List.of(step("pre", "diff")))
                    .postHooks(List.of(step("post", "diff")))
                    .build();

            WorkflowExecutionResult result = engine.executeWorkflow(definition,
                    WorkflowExecutionOptions.builder().maxConcurrency(2).build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getFinalState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(result.getCompletedSteps())
                    .containsExactlyInAnyOrder("plan", "network", "database", "app");
            assertThat(result.getCompletedSteps().get(0)).isEqualTo("plan");
            assertThat(result.getCompletedSteps().get(3)).isEqualTo("app");
            assertThat(backend.calls.get(0)).isEqualTo("pre");
            assertThat(backend.calls.get(backend.calls.size() - 1)).isEqualTo("post");
            assertThat(result.getParallelExecutionStats().getBatchCount()).isEqualTo(3);
            assertThat(result.getParallelExecutionStats().getParallelSteps()).isEqualTo(2);
            assertThat(result.getStepResults()).containsKeys("plan", "network", "database", "app");
        }

        @Test
        @DisplayName("runs one step at a time when parallelism is off")
        void runsSequentially() throws Exception {
            WorkflowDefinition definition = workflow("flat",
                    step("a", "plan"), step("b", "plan"), step("c", "plan"));

            WorkflowExecutionResult result = run(definition,
                    WorkflowExecutionOptions.builder().parallel(false).build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCompletedSteps()).containsExactly("a", "b", "c");
            assertThat(result.getParallelExecutionStats().getMaxConcurrentSteps()).isEqualTo(1);
        }

        @Test
        @DisplayName("grows the worker pool beyond the configured concurrency for a wider run")
        void runsWiderThanTheDefaultPool() throws Exception {
            int width = 12;
            WorkflowStep[] steps = new WorkflowStep[width];
            for (int i = 0; i < width; i++) {
                steps[i] = step("stack-" + i, "deploy");
            }
            backend.barrier = new CyclicBarrier(width);

            WorkflowExecutionResult result = run(workflow("wide", steps),
                    WorkflowExecutionOptions.builder().maxConcurrency(width).build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCompletedSteps()).hasSize(width);
            assertThat(result.getParallelExecutionStats().getMaxConcurrentSteps()).isEqualTo(width);
            assertThat(engine.getWorkerThreads()).isGreaterThanOrEqualTo(width * 2);
        }

        @Test
        @DisplayName("retries transient failures through recovery")
        void retriesTransientFailure() throws Exception {
            backend.script("network", OperationResult.failure("deploy", ErrorCode.NETWORK_ERROR.code(), "reset"));

            WorkflowExecutionResult result = run(workflow("flaky", step("network", "deploy")),
                    WorkflowExecutionOptions.defaults());

            assertThat(result.isSuccess()).isTrue();
            assertThat(backend.callsFor("network")).isEqualTo(2);
            assertThat(result.getStepResults().get("network").getAttempt()).isEqualTo(2);
        }

        @Test
        @DisplayName("skips steps whose condition is false without blocking dependents")
        void skipsConditionalSteps() throws Exception {
            backend.outputs("plan", Map.of("status", "no-changes"));
            WorkflowStep apply = step("apply", "deploy", "plan").toBuilder()
                    .condition(StepCondition.outputEquals("plan.status", "changes-pending"))
                    .build();
            WorkflowDefinition definition = workflow("conditional",
                    step("plan", "plan"), apply, step("report", "diff", "apply"));

            WorkflowExecutionResult result = run(definition, WorkflowExecutionOptions.defaults());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSkippedSteps()).containsExactly("apply");
            assertThat(result.getCompletedSteps()).containsExactly("plan", "report");
            assertThat(backend.callsFor("apply")).isZero();
        }

        @Test
        @DisplayName("backs state up with the built-in backup-state step")
        void backsUpState() throws Exception {
            when(stateBackend.createBackup()).thenReturn("/backups/state-1.json");

            WorkflowExecutionResult result = run(workflow("backup", step("backup", "backup-state")),
                    WorkflowExecutionOptions.defaults());

            assertThat(result.isSuccess()).isTrue();
            verify(stateBackend).createBackup();
            assertThat(backend.calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("abort the run and write an emergency checkpoint")
        void abortWithEmergencyCheckpoint() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));

            WorkflowExecutionResult result = run(chain(), WorkflowExecutionOptions.defaults());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getCompletedSteps()).containsExactly("plan");
            assertThat(result.getFailedSteps()).containsExactly("broken");
            assertThat(result.getErrors()).anyMatch(error -> error.contains("exploded"));
            assertThat(backend.callsFor("app")).isZero();

            String emergency = result.getCheckpointsSaved().get(result.getCheckpointsSaved().size() - 1);
            assertThat(emergency).startsWith(WorkflowCheckpoint.EMERGENCY_PREFIX);
            assertThat(tempDir.resolve("checkpoints").resolve(emergency + ".json")).exists();
        }

        @Test
        @DisplayName("continue past failures when asked")
        void continueOnError() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));
            WorkflowDefinition definition = workflow("partial",
                    step("plan", "plan"),
                    step("broken", "synth", "plan"),
                    step("app", "deploy", "broken"),
                    step("docs", "diff", "plan"));

            WorkflowExecutionResult result = run(definition,
                    WorkflowExecutionOptions.builder().continueOnError(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailedSteps()).containsExactly("broken");
            assertThat(result.getSkippedSteps()).containsExactly("app");
            assertThat(result.getCompletedSteps()).contains("plan", "docs");
        }

        @Test
        @DisplayName("abort when a pre-hook fails")
        void preHookFailureAborts() throws Exception {
            backend.script("pre", OperationResult.failure("diff", ErrorCode.OPERATION_FAILED.code(), "no diff"));
            WorkflowDefinition definition = workflow("hooked", step("plan", "plan")).toBuilder()
                    .preHooks(List.of(step("pre", "diff")))
                    .build();

            WorkflowExecutionResult result = run(definition, WorkflowExecutionOptions.defaults());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(backend.callsFor("plan")).isZero();
        }

        @Test
        @DisplayName("tolerate hook failures when asked")
        void toleratesHookFailure() throws Exception {
            backend.script("pre", OperationResult.failure("diff", ErrorCode.OPERATION_FAILED.code(), "no diff"));
            WorkflowDefinition definition = workflow("hooked", step("plan", "plan")).toBuilder()
                    .preHooks(List.of(step("pre", "diff")))
                    .build();

            WorkflowExecutionResult result = run(definition,
                    WorkflowExecutionOptions.builder().continueOnHookFailure(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getErrors()).anyMatch(error -> error.contains("Pre-hook pre failed"));
        }

        @Test
        @DisplayName("stop at the workflow timeout")
        void timesOut() throws Exception {
            WorkflowStep slow = step("slow", "wait").toBuilder().option("durationMs", 5000).build();

            WorkflowExecutionResult result = run(workflow("slow", slow),
                    WorkflowExecutionOptions.builder().timeout(Duration.ofMillis(100)).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getErrors()).anyMatch(error -> error.startsWith(ErrorCode.TIMEOUT_ERROR.code()));
            assertThat(result.getDuration()).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("stop when cancelled through the run handle")
        void cancelsRun() throws Exception {
            WorkflowStep slow = step("slow", "wait").toBuilder().option("durationMs", 5000).build();
            WorkflowRun run = engine.startWorkflow(workflow("slow", slow), WorkflowExecutionOptions.defaults());

            assertThat(engine.getRun(run.getRunId())).isPresent();
            run.cancel("operator request");
            WorkflowExecutionResult result = run.getResult().get(RESULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getErrors()).contains("Workflow cancelled: operator request");
            assertThat(run.isDone()).isTrue();
        }
    }

    @Nested
    @DisplayName("manual intervention")
    class ManualIntervention {

        @Test
        @DisplayName("retries a step once the operator fixes access")
        void operatorRetries() throws Exception {
            backend.script("network",
                    OperationResult.failure("deploy", ErrorCode.PERMISSION_DENIED.code(), "access denied"));
            List<ManualInterventionRequest> seen = new CopyOnWriteArrayList<>();
            WorkflowExecutionOptions options = WorkflowExecutionOptions.builder()
                    .interventionHandler((request, queue) -> {
                        seen.add(request);
                        try {
                            queue.resolve(request.getId(), ErrorRecoveryStrategy.retry("credentials refreshed"));
                        } catch (InterventionNotFoundException e) {
                            throw new IllegalStateException(e);
                        }
                    })
                    .build();

            WorkflowExecutionResult result = run(workflow("access", step("network", "deploy")), options);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getManualInterventionsRequested()).isEqualTo(1);
            assertThat(seen).singleElement().satisfies(request -> {
                assertThat(request.getStepName()).isEqualTo("network");
                assertThat(request.getSuggestedActions()).contains("Check cloud provider credentials");
            });
            assertThat(result.getPendingInterventions()).isEmpty();
        }

        @Test
        @DisplayName("aborts when the operator decides so")
        void operatorAborts() throws Exception {
            backend.script("broken",
                    OperationResult.failure("synth", ErrorCode.PERMISSION_DENIED.code(), "access denied"));
            WorkflowExecutionOptions options = WorkflowExecutionOptions.builder()
                    .interventionHandler((request, queue) -> {
                        try {
                            queue.resolve(request.getId(), ErrorRecoveryStrategy.abort("not today"));
                        } catch (InterventionNotFoundException e) {
                            throw new IllegalStateException(e);
                        }
                    })
                    .build();

            WorkflowExecutionResult result = run(chain(), options);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getFailedSteps()).containsExactly("broken");
            assertThat(backend.callsFor("app")).isZero();
        }

        @Test
        @DisplayName("waits in AWAITING_MANUAL_INTERVENTION until resolved through the run")
        void resolvesThroughRun() throws Exception {
            backend.script("configure",
                    OperationResult.failure("synth", ErrorCode.CONFIGURATION_ERROR.code(), "bad variable"));
            WorkflowDefinition definition = workflow("await",
                    step("configure", "synth"), step("report", "diff", "configure"));
            WorkflowRun run = engine.startWorkflow(definition,
                    WorkflowExecutionOptions.builder().allowManualIntervention(true).build());

            waitUntil(() -> run.getState() == WorkflowState.AWAITING_MANUAL_INTERVENTION);
            assertThat(run.getPendingInterventions()).hasSize(1);
            ManualInterventionRequest request = run.getPendingInterventions().get(0);
            run.resolveIntervention(request.getId(), ErrorRecoveryStrategy.skip("variable not needed"));

            WorkflowExecutionResult result = run.getResult().get(RESULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertThat(result.getFinalState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(result.getSkippedSteps()).containsExactly("configure");
            assertThat(result.getCompletedSteps()).containsExactly("report");
            assertThatThrownBy(() -> run.resolveIntervention(request.getId(), ErrorRecoveryStrategy.skip("again")))
                    .isInstanceOf(InterventionNotFoundException.class);
        }

        @Test
        @DisplayName("escalates once the intervention limit is reached")
        void escalatesAtLimit() throws Exception {
            backend.script("network",
                    OperationResult.failure("deploy", ErrorCode.PERMISSION_DENIED.code(), "access denied"));

            WorkflowExecutionResult result = run(workflow("limited", step("network", "deploy")),
                    WorkflowExecutionOptions.builder()
                            .allowManualIntervention(true)
                            .maxManualInterventions(0)
                            .build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getManualInterventionsRequested()).isZero();
            assertThat(result.getErrors())
                    .anyMatch(error -> error.contains(ErrorCode.INTERVENTION_LIMIT_EXCEEDED.formatMessage(0)));
        }

        @Test
        @DisplayName("escalates when nobody answers in time")
        void escalatesOnTimeout() throws Exception {
            backend.script("network",
                    OperationResult.failure("deploy", ErrorCode.PERMISSION_DENIED.code(), "access denied"));

            WorkflowExecutionResult result = run(workflow("unanswered", step("network", "deploy")),
                    WorkflowExecutionOptions.builder()
                            .allowManualIntervention(true)
                            .interventionTimeout(Duration.ofMillis(50))
                            .build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.getManualInterventionsRequested()).isEqualTo(1);
            assertThat(result.getErrors())
                    .anyMatch(error -> error.contains(ErrorCode.INTERVENTION_TIMEOUT.formatMessage("network")));
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        private WorkflowDefinition withRollback(RollbackStrategy strategy) {
            return chain().toBuilder()
                    .rollbackSteps(List.of(RollbackStep.builder()
                            .step(step("undo-plan", "destroy"))
                            .rollbackType(RollbackType.RESOURCE_DESTROY)
                            .resources("aws_vpc.main")
                            .compensates("plan")
                            .build()))
                    .rollbackStrategy(strategy)
                    .build();
        }

        @Test
        @DisplayName("rolls back after an unrecoverable failure")
        void rollsBackOnError() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));

            WorkflowExecutionResult result = run(withRollback(RollbackStrategy.automatic()),
                    WorkflowExecutionOptions.builder().rollbackOnError(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ROLLED_BACK);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.isRollbackPerformed()).isTrue();
            RollbackExecutionResult rollback = result.getRollbackResult().orElseThrow();
            assertThat(rollback.isSuccess()).isTrue();
            assertThat(rollback.getRollbackSteps()).containsExactly("undo-plan");
            assertThat(backend.callsFor("undo-plan")).isEqualTo(1);

            assertThat(engine.getRollbackHistory("chain")).hasSize(1);
            assertThat(engine.generateRollbackReport("chain")).contains("Total rollbacks: 1");
        }

        @Test
        @DisplayName("aborts instead when no trigger condition matches")
        void abortsWhenNotTriggered() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));
            RollbackStrategy onTimeoutOnly = RollbackStrategy.builder()
                    .triggerCondition(RollbackTriggerCondition.on(RollbackTriggerType.TIMEOUT))
                    .build();

            WorkflowExecutionResult result = run(withRollback(onTimeoutOnly),
                    WorkflowExecutionOptions.builder().rollbackOnError(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ABORTED);
            assertThat(result.isRollbackPerformed()).isFalse();
            assertThat(backend.callsFor("undo-plan")).isZero();
        }

        @Test
        @DisplayName("rolls back a partial success when the strategy asks for it")
        void rollsBackPartialSuccess() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));
            RollbackStrategy strategy = RollbackStrategy.builder()
                    .options(RollbackOptions.builder().rollbackOnPartialSuccess(true).build())
                    .build();

            WorkflowExecutionResult result = run(withRollback(strategy),
                    WorkflowExecutionOptions.builder().continueOnError(true).rollbackOnError(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ROLLED_BACK);
            assertThat(result.getSkippedSteps()).containsExactly("app");
        }

        @Test
        @DisplayName("restores the state backed up earlier in the run")
        void restoresBackedUpState() throws Exception {
            when(stateBackend.createBackup()).thenReturn("/backups/run.json");
            when(stateBackend.restoreBackup("/backups/run.json")).thenReturn(Map.of());
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));
            WorkflowDefinition definition = workflow("restore",
                    step("backup", "backup-state"), step("broken", "synth", "backup"))
                    .toBuilder()
                    .rollbackSteps(List.of(RollbackStep.builder()
                            .step(step("restore", "plan"))
                            .rollbackType(RollbackType.STATE_RESTORE)
                            .build()))
                    .build();

            WorkflowExecutionResult result = run(definition,
                    WorkflowExecutionOptions.builder().rollbackOnError(true).build());

            assertThat(result.getFinalState()).isEqualTo(WorkflowState.ROLLED_BACK);
            assertThat(result.getRollbackResult().orElseThrow().isStateRestored()).isTrue();
            verify(stateBackend).restoreBackup("/backups/run.json");
        }

        @Test
        @DisplayName("runs manual rollbacks on demand")
        void manualRollback() throws Exception {
            RollbackExecutionResult result = engine.executeManualRollback(withRollback(null), "clean up test env");

            assertThat(result.isSuccess()).isTrue();
            assertThat(engine.getRollbackHistory("chain")).singleElement()
                    .satisfies(entry -> assertThat(entry.triggerReason()).isEqualTo("clean up test env"));
        }

        @Test
        @DisplayName("needs confirmation for a manual strategy")
        void manualStrategyNeedsConfirmation() throws Exception {
            RollbackStrategy manual = RollbackStrategy.builder().type(RollbackStrategyType.MANUAL).build();

            RollbackExecutionResult declined = engine.executeManualRollback(withRollback(manual), "tidy");

            assertThat(declined.isSuccess()).isFalse();
            assertThat(declined.getErrors()).anyMatch(e -> e.startsWith(ErrorCode.ROLLBACK_NOT_CONFIRMED.code()));
            assertThat(engine.getRollbackHistory(null)).isEmpty();
            assertThat(backend.calls).isEmpty();

            DefaultWorkflowEngine confirming = newEngine(RollbackConfirmation.ALWAYS);
            try {
                assertThat(confirming.executeManualRollback(withRollback(manual), "tidy").isSuccess()).isTrue();
            } finally {
                confirming.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("checkpoints")
    class Checkpoints {

        @Test
        @DisplayName("resume past the steps a failed run completed")
        void resumesFromEmergencyCheckpoint() throws Exception {
            backend.script("broken", OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "exploded"));
            WorkflowExecutionResult failed = run(chain(),
                    WorkflowExecutionOptions.builder().saveCheckpoints(true).build());
            assertThat(failed.getCheckpointsSaved()).hasSizeGreaterThanOrEqualTo(2);
            assertThat(failed.getCheckpointsSaved().get(0)).startsWith("checkpoint-");
            String emergency = failed.getCheckpointsSaved().get(failed.getCheckpointsSaved().size() - 1);

            WorkflowExecutionResult resumed = run(chain(),
                    WorkflowExecutionOptions.builder().resumeFromCheckpoint(emergency).build());

            assertThat(resumed.isSuccess()).isTrue();
            assertThat(resumed.getResumedFromCheckpoint()).contains(emergency);
            assertThat(resumed.getCompletedSteps()).containsExactly("plan", "broken", "app");
            assertThat(backend.callsFor("plan")).isEqualTo(1);
        }

        @Test
        @DisplayName("write checkpoints to the directory given in the options")
        void usesOptionDirectory() throws Exception {
            Path custom = tempDir.resolve("custom");

            WorkflowExecutionResult result = run(workflow("one", step("plan", "plan")),
                    WorkflowExecutionOptions.builder().saveCheckpoints(true).checkpointDirectory(custom).build());

            assertThat(result.getCheckpointsSaved()).hasSize(1);
            assertThat(Files.exists(custom.resolve(result.getCheckpointsSaved().get(0) + ".json"))).isTrue();
        }

        @Test
        @DisplayName("reject a missing checkpoint")
        void rejectsMissingCheckpoint() {
            assertThatThrownBy(() -> engine.startWorkflow(chain(),
                    WorkflowExecutionOptions.builder().resumeFromCheckpoint("nope").build()))
                    .isInstanceOf(CheckpointException.class)
                    .satisfies(e -> assertThat(((CheckpointException) e).hasErrorCode(ErrorCode.CHECKPOINT_NOT_FOUND))
                            .isTrue());
        }

        @Test
        @DisplayName("reject a checkpoint of another workflow")
        void rejectsForeignCheckpoint() throws Exception {
            WorkflowExecutionResult other = run(workflow("other", step("plan", "plan")),
                    WorkflowExecutionOptions.builder().saveCheckpoints(true).build());

            assertThatThrownBy(() -> engine.startWorkflow(chain(), WorkflowExecutionOptions.builder()
                    .resumeFromCheckpoint(other.getCheckpointsSaved().get(0)).build()))
                    .isInstanceOf(CheckpointException.class)
                    .satisfies(e -> assertThat(((CheckpointException) e).hasErrorCode(ErrorCode.CHECKPOINT_INVALID))
                            .isTrue());
        }
    }

    @Nested
    @DisplayName("dry run")
    class DryRun {

        @Test
        @DisplayName("plans steps without calling the backend")
        void plansWithoutExecuting() throws Exception {
            WorkflowStep gated = step("gated", "deploy", "plan").toBuilder()
                    .condition(StepCondition.fileExists("missing.tf"))
                    .build();
            WorkflowDefinition definition = workflow("dry",
                    step("plan", "plan"), step("network", "deploy", "plan"), gated);

            WorkflowExecutionResult result = run(definition,
                    WorkflowExecutionOptions.builder().dryRun(true).build());

            assertThat(result.isDryRun()).isTrue();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getFinalState()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(result.getPlannedSteps()).containsExactly("plan", "network");
            assertThat(result.getSkippedSteps()).containsExactly("gated");
            assertThat(backend.calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation and analysis")
    class ValidationAndAnalysis {

        @Test
        @DisplayName("reports missing fields")
        void reportsMissingFields() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("")
                    .step(WorkflowStep.builder("plan").command("plan").build())
                    .build();

            ValidationResult result = engine.validateWorkflow(definition);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getIssues()).anyMatch(issue -> issue.contains("Workflow name is required"));
            assertThat(result.getIssues()).anyMatch(issue -> issue.contains("Workflow description is required"));
            assertThat(result.getIssues()).anyMatch(issue -> issue.contains("Step 1: Step description is required"));
        }

        @Test
        @DisplayName("refuses to start a cyclic workflow")
        void refusesCycle() {
            WorkflowDefinition definition = workflow("cyclic",
                    step("a", "plan", "b"), step("b", "plan", "a"));

            assertThatThrownBy(() -> engine.startWorkflow(definition, WorkflowExecutionOptions.defaults()))
                    .isInstanceOf(WorkflowValidationException.class)
                    .satisfies(e -> assertThat(((WorkflowValidationException) e)
                            .hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY)).isTrue());
            assertThat(backend.calls).isEmpty();
        }

        @Test
        @DisplayName("flags cyclic rollback steps")
        void flagsRollbackCycle() {
            WorkflowDefinition definition = chain().toBuilder()
                    .rollbackSteps(List.of(
                            RollbackStep.builder().step(step("r1", "destroy")).dependencies("r2").build(),
                            RollbackStep.builder().step(step("r2", "destroy")).dependencies("r1").build()))
                    .build();

            ValidationResult result = engine.validateWorkflow(definition);

            assertThat(result.hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY.code())).isTrue();
        }

        @Test
        @DisplayName("analyzes parallelization")
        void analyzesParallelization() throws Exception {
            WorkflowDefinition definition = workflow("diamond",
                    step("plan", "plan"),
                    step("network", "deploy", "plan"),
                    step("database", "deploy", "plan"),
                    step("app", "deploy", "network", "database"));

            ParallelizationAnalysis analysis = engine.analyzeWorkflowParallelization(definition);

            assertThat(analysis.totalSteps()).isEqualTo(4);
            assertThat(analysis.batches()).hasSize(3);
            assertThat(analysis.parallelizableSteps()).containsExactlyInAnyOrder("network", "database");
            assertThat(analysis.maxParallelism()).isEqualTo(2);
            assertThat(analysis.criticalPath()).hasSize(3).startsWith("plan").endsWith("app");
            assertThat(analysis.estimatedSpeedup()).isCloseTo(4.0 / 3.0, within(0.001));
        }

        @Test
        @DisplayName("drops implied dependencies and groups parallel steps")
        void optimizes() throws Exception {
            WorkflowDefinition definition = workflow("redundant",
                    step("plan", "plan"),
                    step("network", "deploy", "plan"),
                    step("database", "deploy", "plan"),
                    step("app", "deploy", "plan", "network", "database"));

            WorkflowDefinition optimized = engine.optimizeWorkflowForParallelExecution(definition);

            WorkflowStep app = optimized.findStep("app").orElseThrow();
            assertThat(app.getDependsOn()).containsExactly("network", "database");
            assertThat(optimized.findStep("network").orElseThrow().getParallelGroup()).contains("batch-2");
            assertThat(optimized.findStep("plan").orElseThrow().getParallelGroup()).isEmpty();
        }

        @Test
        @DisplayName("refuses new runs after shutdown")
        void refusesAfterShutdown() {
            engine.shutdown();

            assertThatThrownBy(() -> engine.startWorkflow(chain(), WorkflowExecutionOptions.defaults()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    /**
     * Backend that answers from per-stack scripts, succeeding once a script runs out.
     */
    private static final class ScriptedBackend implements OperationBackend {

        private final Map<String, Deque<OperationResult>> scripts = new ConcurrentHashMap<>();
        private final Map<String, Map<String, Object>> outputs = new ConcurrentHashMap<>();
        private final List<String> calls = new CopyOnWriteArrayList<>();
        private volatile CyclicBarrier barrier;

        void script(String stack, OperationResult... results) {
            scripts.computeIfAbsent(stack, key -> new ConcurrentLinkedDeque<>()).addAll(List.of(results));
        }

        void outputs(String stack, Map<String, Object> values) {
            outputs.put(stack, values);
        }

        int callsFor(String stack) {
            return (int) calls.stream().filter(stack::equals).count();
        }

        private OperationResult respond(String operation, Map<String, Object> options) {
            String stack = String.valueOf(options.get("stack"));
            calls.add(stack);
            if (barrier != null) {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("Steps did not run together: " + e, e);
                }
            }
            Deque<OperationResult> script = scripts.get(stack);
            OperationResult scripted = script != null ? script.poll() : null;
            if (scripted != null) {
                return scripted;
            }
            return OperationResult.builder()
                    .operation(operation)
                    .success(true)
                    .outputs(outputs.getOrDefault(stack, Map.of("stack", stack)))
                    .build();
        }

        @Override
        public OperationResult deploy(Map<String, Object> options) throws OperationException {
            return respond("deploy", options);
        }

        @Override
        public OperationResult destroy(Map<String, Object> options) throws OperationException {
            return respond("destroy", options);
        }

        @Override
        public OperationResult plan(Map<String, Object> options) throws OperationException {
            return respond("plan", options);
        }

        @Override
        public OperationResult synth(Map<String, Object> options) throws OperationException {
            return respond("synth", options);
        }

        @Override
        public OperationResult diff(Map<String, Object> options) throws OperationException {
            return respond("diff", options);
        }
    }
}
