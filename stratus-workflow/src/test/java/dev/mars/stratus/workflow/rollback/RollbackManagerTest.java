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
import dev.mars.stratus.operation.OperationBackend;
import dev.mars.stratus.operation.OperationResult;
import dev.mars.stratus.operation.StateBackend;
import dev.mars.stratus.workflow.WorkflowDefinition;
import dev.mars.stratus.workflow.WorkflowStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-07
 */
class RollbackManagerTest {

    @Mock
    private OperationBackend operationBackend;

    @Mock
    private StateBackend stateBackend;

    private AutoCloseable mocks;
    private RollbackManager rollbackManager;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        when(operationBackend.execute(anyString(), anyList(), anyMap())).thenReturn(OperationResult.success("deploy"));
        when(operationBackend.destroy(anyMap())).thenReturn(OperationResult.success("destroy"));
        rollbackManager = new RollbackManager(operationBackend, stateBackend);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static RollbackStep.Builder rollbackStep(String name, String command) {
        return RollbackStep.builder().step(WorkflowStep.builder(name)
                .description("Roll back " + name)
                .command(command)
                .build());
    }

    private static WorkflowDefinition definition(RollbackStrategy strategy, RollbackStep... steps) {
        return WorkflowDefinition.builder()
                .name("infra")
                .description("Infrastructure")
                .step(WorkflowStep.builder("deploy-app").description("Deploy").command("deploy").build())
                .rollbackSteps(List.of(steps))
                .rollbackStrategy(strategy)
                .build();
    }

    private static RollbackContext context() {
        return RollbackContext.builder()
                .workflowName("infra")
                .failedStep("deploy-app", 2)
                .error(ErrorCode.OPERATION_FAILED.code(), "deploy failed")
                .completedSteps(List.of("deploy-network", "deploy-db"))
                .build();
    }

    @Test
    void testPlanOrdersByDependenciesThenPriority() throws Exception {
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("rb-db", "deploy").build(),
                rollbackStep("rb-net", "deploy").dependencies("rb-app").build(),
                rollbackStep("rb-app", "deploy").priority(RollbackPriority.HIGH).build(),
                rollbackStep("verify", "plan").rollbackType(RollbackType.VALIDATION).build(),
                rollbackStep("tidy", "deploy").rollbackType(RollbackType.CLEANUP).build());

        RollbackPlan plan = rollbackManager.plan(definition, context());

        assertEquals(List.of("rb-app", "rb-db", "rb-net"), names(plan.getSteps()));
        assertEquals(List.of("verify"), names(plan.getValidationSteps()));
        assertEquals(List.of("tidy"), names(plan.getCleanupSteps()));
        assertEquals(RollbackStrategyType.AUTOMATIC, plan.getStrategyType());
        assertEquals(RollbackPriority.HIGH, plan.getRiskLevel());
    }

    @Test
    void testSelectivePlanKeepsAffectedSteps() throws Exception {
        RollbackStrategy selective = RollbackStrategy.builder().type(RollbackStrategyType.SELECTIVE).build();
        WorkflowDefinition definition = definition(selective,
                rollbackStep("rb-db", "destroy").resources("aws_db_instance.main").build(),
                rollbackStep("rb-bucket", "destroy").resources("aws_s3_bucket.logs").build(),
                rollbackStep("rb-app", "deploy").compensates("deploy-app").build());
        RollbackContext context = RollbackContext.builder()
                .workflowName("infra")
                .failedStep("deploy-app", 2)
                .affectedResources(List.of("aws_db_instance.main"))
                .build();

        RollbackPlan plan = rollbackManager.plan(definition, context);

        assertEquals(List.of("rb-db", "rb-app"), names(plan.getSteps()));
    }

    @Test
    void testProgressivePlanReversesCompletionOrder() throws Exception {
        RollbackStrategy progressive = RollbackStrategy.builder().type(RollbackStrategyType.PROGRESSIVE).build();
        WorkflowDefinition definition = definition(progressive,
                rollbackStep("undo-network", "deploy").compensates("deploy-network").build(),
                rollbackStep("undo-db", "deploy").compensates("deploy-db").build(),
                rollbackStep("undo-app", "deploy").compensates("deploy-app").build(),
                rollbackStep("notify", "plan").build());

        RollbackPlan plan = rollbackManager.plan(definition, context());

        assertEquals(List.of("undo-app", "undo-db", "undo-network", "notify"), names(plan.getSteps()));
    }

    @Test
    void testFindRollbackCycle() {
        List<RollbackStep> steps = List.of(
                rollbackStep("a", "deploy").dependencies("b").build(),
                rollbackStep("b", "deploy").dependencies("a").build());

        List<String> cycle = RollbackManager.findRollbackCycle(steps);

        assertFalse(cycle.isEmpty());
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
        assertTrue(RollbackManager.findRollbackCycle(List.of(rollbackStep("a", "deploy").build())).isEmpty());
    }

    @Test
    void testShouldTrigger() {
        RollbackStrategy unconditional = RollbackStrategy.automatic();
        RollbackStrategy onTimeout = RollbackStrategy.builder()
                .triggerCondition(RollbackTriggerCondition.on(RollbackTriggerType.TIMEOUT))
                .build();
        RollbackStrategy onDeployError = RollbackStrategy.builder()
                .triggerCondition(new RollbackTriggerCondition(RollbackTriggerType.STEP_FAILURE, "deploy-app",
                        "deploy fail"))
                .build();

        assertTrue(rollbackManager.shouldTrigger(unconditional, context()));
        assertFalse(rollbackManager.shouldTrigger(onTimeout, context()));
        assertTrue(rollbackManager.shouldTrigger(onDeployError, context()));
    }

    @Test
    void testExecuteRunsStepsAndRecordsHistory() throws Exception {
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("rb-app", "deploy").build(),
                rollbackStep("rb-db", "destroy").rollbackType(RollbackType.RESOURCE_DESTROY)
                        .resources("aws_db_instance.main").build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertTrue(result.isSuccess());
        assertEquals(List.of("rb-app", "rb-db"), result.getRollbackSteps());
        assertEquals(List.of("aws_db_instance.main"), result.getResourcesDestroyed());
        verify(operationBackend).execute(eq("deploy"), anyList(), anyMap());
        verify(operationBackend).destroy(argThat(options ->
                List.of("aws_db_instance.main").equals(options.get("resources"))));

        List<RollbackHistoryEntry> history = rollbackManager.history("infra");
        assertEquals(1, history.size());
        assertEquals(RollbackStrategyType.AUTOMATIC, history.get(0).strategy());
        assertTrue(rollbackManager.history("other").isEmpty());

        String report = rollbackManager.report("infra");
        assertTrue(report.contains("Total rollbacks: 1 (succeeded 1, failed 0)"));
        assertTrue(report.contains("destroyed: [aws_db_instance.main]"));
    }

    @Test
    void testCriticalFailureAbortsRemainingStepsButRunsCleanup() throws Exception {
        when(operationBackend.execute(eq("synth"), anyList(), anyMap()))
                .thenReturn(OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "synth broke"));
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("critical", "synth").priority(RollbackPriority.CRITICAL).build(),
                rollbackStep("later", "deploy").build(),
                rollbackStep("check", "plan").rollbackType(RollbackType.VALIDATION).build(),
                rollbackStep("tidy", "deploy").rollbackType(RollbackType.CLEANUP).build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertFalse(result.isSuccess());
        assertTrue(result.isAborted());
        assertEquals(List.of("critical"), result.getFailedRollbackSteps());
        assertEquals(List.of("later", "check"), result.getSkippedRollbackSteps());
        assertEquals(List.of("tidy"), result.getRollbackSteps());
        assertTrue(result.getErrors().get(0).contains("synth broke"));
    }

    @Test
    void testRecordsOutcomeAndDurationOfEachAttemptedStep() throws Exception {
        when(operationBackend.execute(eq("synth"), anyList(), anyMap()))
                .thenReturn(OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "synth broke"));
        when(operationBackend.execute(eq("deploy"), anyList(), anyMap())).thenAnswer(invocation -> {
            Thread.sleep(30);
            return OperationResult.success("deploy");
        });
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("critical", "synth").priority(RollbackPriority.CRITICAL).build(),
                rollbackStep("later", "deploy").build(),
                rollbackStep("tidy", "deploy").rollbackType(RollbackType.CLEANUP).build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        List<RollbackStepOutcome> outcomes = result.getStepOutcomes();
        assertEquals(List.of("critical", "tidy"), outcomes.stream().map(RollbackStepOutcome::name).toList());

        RollbackStepOutcome critical = outcomes.get(0);
        assertFalse(critical.success());
        assertTrue(critical.error().contains("synth broke"));
        assertFalse(critical.duration().isNegative());

        RollbackStepOutcome tidy = outcomes.get(1);
        assertTrue(tidy.success());
        assertTrue(tidy.errorMessage().isEmpty());
        assertTrue(tidy.duration().toMillis() >= 30, "tidy took " + tidy.duration());

        String report = rollbackManager.report("infra");
        assertTrue(report.contains("    critical FAILED "));
        assertTrue(report.contains("synth broke)"));
        assertTrue(report.contains("    tidy OK "));
    }

    @Test
    void testFailedDependencySkipsDependent() throws Exception {
        when(operationBackend.execute(eq("synth"), anyList(), anyMap()))
                .thenReturn(OperationResult.failure("synth", ErrorCode.OPERATION_FAILED.code(), "no"));
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("first", "synth").build(),
                rollbackStep("second", "deploy").dependencies("first").build(),
                rollbackStep("independent", "deploy").build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertFalse(result.isSuccess());
        assertFalse(result.isAborted());
        assertEquals(List.of("first"), result.getFailedRollbackSteps());
        assertEquals(List.of("second"), result.getSkippedRollbackSteps());
        assertEquals(List.of("independent"), result.getRollbackSteps());
    }

    @Test
    void testRetriesRollbackStepUpToMaxAttempts() throws Exception {
        when(operationBackend.execute(eq("synth"), anyList(), anyMap()))
                .thenReturn(OperationResult.failure("synth", ErrorCode.NETWORK_ERROR.code(), "reset"))
                .thenReturn(OperationResult.success("synth"));
        RollbackStrategy strategy = RollbackStrategy.builder()
                .options(RollbackOptions.builder().maxRollbackAttempts(2).build())
                .build();

        RollbackExecutionResult result = rollbackManager.execute(
                rollbackManager.plan(definition(strategy, rollbackStep("flaky", "synth").build()), context()),
                context());

        assertTrue(result.isSuccess());
        verify(operationBackend, times(2)).execute(eq("synth"), anyList(), anyMap());
    }

    @Test
    void testStateRestoreUsesBackupLocation() throws Exception {
        when(stateBackend.restoreBackup("/backups/state-1.json")).thenReturn(Map.of());
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("restore", "deploy").rollbackType(RollbackType.STATE_RESTORE)
                        .rollbackData(Map.of(RollbackManager.BACKUP_LOCATION_KEY, "/backups/state-1.json"))
                        .build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertTrue(result.isSuccess());
        assertTrue(result.isStateRestored());
        verify(stateBackend).restoreBackup("/backups/state-1.json");
    }

    @Test
    void testStateRestoreWithoutLocationFails() throws Exception {
        WorkflowDefinition definition = definition(RollbackStrategy.automatic(),
                rollbackStep("restore", "deploy").rollbackType(RollbackType.STATE_RESTORE).build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertFalse(result.isSuccess());
        assertFalse(result.isStateRestored());
        verify(stateBackend, never()).restoreBackup(anyString());
    }

    @Test
    void testProgressiveSkipsResourcesAlreadyGone() throws Exception {
        when(stateBackend.loadState()).thenReturn(Map.of("resources", List.of("aws_vpc.main")));
        RollbackStrategy progressive = RollbackStrategy.builder().type(RollbackStrategyType.PROGRESSIVE).build();
        WorkflowDefinition definition = definition(progressive,
                rollbackStep("drop-db", "destroy").rollbackType(RollbackType.RESOURCE_DESTROY)
                        .resources("aws_db_instance.main").compensates("deploy-db").build(),
                rollbackStep("drop-vpc", "destroy").rollbackType(RollbackType.RESOURCE_DESTROY)
                        .resources("aws_vpc.main").compensates("deploy-network").build());

        RollbackExecutionResult result = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertTrue(result.isSuccess());
        assertEquals(List.of("drop-db"), result.getSkippedRollbackSteps());
        assertEquals(List.of("drop-vpc"), result.getRollbackSteps());
        verify(operationBackend, times(1)).destroy(anyMap());
    }

    @Test
    void testManualStrategyRequiresConfirmation() throws Exception {
        RollbackStrategy manual = RollbackStrategy.builder().type(RollbackStrategyType.MANUAL).build();
        WorkflowDefinition definition = definition(manual, rollbackStep("rb-app", "deploy").build());

        RollbackExecutionResult declined = rollbackManager.execute(rollbackManager.plan(definition, context()),
                context());

        assertFalse(declined.isSuccess());
        assertTrue(declined.getErrors().get(0).startsWith(ErrorCode.ROLLBACK_NOT_CONFIRMED.code()));
        assertTrue(rollbackManager.history(null).isEmpty());
        verify(operationBackend, never()).execute(anyString(), anyList(), anyMap());

        RollbackManager approving = new RollbackManager(operationBackend, stateBackend, RollbackConfirmation.ALWAYS);
        RollbackExecutionResult approved = approving.execute(approving.plan(definition, context()), context());

        assertTrue(approved.isSuccess());
        assertEquals(1, approving.history("infra").size());
    }

    @Test
    void testPreserveStateTakesBackupFirst() throws Exception {
        when(stateBackend.createBackup()).thenReturn("/backups/pre-rollback.json");
        RollbackStrategy strategy = RollbackStrategy.builder()
                .options(RollbackOptions.builder().preserveState(true).build())
                .build();

        RollbackExecutionResult result = rollbackManager.execute(
                rollbackManager.plan(definition(strategy, rollbackStep("rb-app", "deploy").build()), context()),
                context());

        assertTrue(result.isSuccess());
        verify(stateBackend).createBackup();
    }

    private static List<String> names(List<RollbackStep> steps) {
        return steps.stream().map(RollbackStep::getName).toList();
    }
}
