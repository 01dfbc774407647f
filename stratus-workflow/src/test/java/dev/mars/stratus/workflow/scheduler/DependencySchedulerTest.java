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

package dev.mars.stratus.workflow.scheduler;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.workflow.ValidationResult;
import dev.mars.stratus.workflow.WorkflowStep;
import dev.mars.stratus.workflow.WorkflowValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencySchedulerTest {

    private DependencyScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new DependencyScheduler();
    }

    @Test
    void testIndependentStepsShareBatch() throws WorkflowValidationException {
        List<WorkflowStep> steps = List.of(step("A"), step("B", "A"), step("C"));

        List<ExecutionBatch> batches = scheduler.schedule(steps, 2);

        assertEquals(2, batches.size());
        assertEquals(List.of("A", "C"), batches.get(0).getStepNames());
        assertEquals(List.of("B"), batches.get(1).getStepNames());
        assertEquals(1, batches.get(0).getBatchNumber());
        assertEquals(2, batches.get(1).getBatchNumber());
    }

    @Test
    void testLayerSplitByMaxConcurrency() throws WorkflowValidationException {
        List<WorkflowStep> steps = List.of(step("a"), step("b"), step("c"), step("d", "a"));

        List<ExecutionBatch> batches = scheduler.schedule(steps, 2);

        assertEquals(List.of("a", "b"), batches.get(0).getStepNames());
        assertEquals(List.of("c"), batches.get(1).getStepNames());
        assertEquals(List.of("d"), batches.get(2).getStepNames());
    }

    @Test
    void testSequentialWhenMaxConcurrencyIsOne() throws WorkflowValidationException {
        List<ExecutionBatch> batches = scheduler.schedule(List.of(step("a"), step("b"), step("c")), 1);

        assertEquals(3, batches.size());
        batches.forEach(batch -> assertEquals(1, batch.size()));
    }

    @Test
    void testBatchesRespectDependencies() throws WorkflowValidationException {
        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(step("vpc"));
        steps.add(step("subnet", "vpc"));
        steps.add(step("sg", "vpc"));
        steps.add(step("db", "subnet", "sg"));
        steps.add(step("app", "db", "sg"));
        steps.add(step("dns"));

        Map<String, Integer> batchOf = new HashMap<>();
        for (ExecutionBatch batch : scheduler.schedule(steps, 3)) {
            batch.getStepNames().forEach(name -> batchOf.put(name, batch.getBatchNumber()));
        }

        for (WorkflowStep step : steps) {
            for (String dependency : step.getDependsOn()) {
                assertTrue(batchOf.get(dependency) < batchOf.get(step.getName()),
                        dependency + " must run before " + step.getName());
            }
        }
    }

    @Test
    void testParallelGroupReportedWhenShared() throws WorkflowValidationException {
        List<WorkflowStep> steps = List.of(
                WorkflowStep.builder("web").description("web").command("deploy").parallelGroup("tier").build(),
                WorkflowStep.builder("api").description("api").command("deploy").parallelGroup("tier").build());

        ExecutionBatch batch = scheduler.schedule(steps, 4).get(0);

        assertEquals("tier", batch.getParallelGroup().orElseThrow());
    }

    @Test
    void testValidateReportsCycle() {
        ValidationResult result = scheduler.validate(List.of(step("a", "b"), step("b", "a")));

        assertFalse(result.isValid());
        assertTrue(result.hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY.code()));
    }

    @Test
    void testValidateReportsSelfDependency() {
        ValidationResult result = scheduler.validate(List.of(step("a", "a")));

        assertTrue(result.hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY.code()));
        assertTrue(result.getIssues().get(0).contains("itself"));
    }

    @Test
    void testValidateReportsMissingDependency() {
        ValidationResult result = scheduler.validate(List.of(step("app", "database")));

        assertTrue(result.hasErrorCode(ErrorCode.MISSING_DEPENDENCY.code()));
    }

    @Test
    void testValidateReportsDuplicateName() {
        ValidationResult result = scheduler.validate(List.of(step("a"), step("a")));

        assertTrue(result.hasErrorCode(ErrorCode.VALIDATION_ERROR.code()));
    }

    @Test
    void testScheduleRejectsInvalidGraph() {
        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                () -> scheduler.schedule(List.of(step("a", "b"), step("b", "a")), 2));

        assertTrue(e.hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY));
    }

    @Test
    void testScheduleRejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(List.of(step("a")), 0));
    }

    private static WorkflowStep step(String name, String... dependsOn) {
        return WorkflowStep.builder(name)
                .description("Step " + name)
                .command("deploy")
                .dependsOn(dependsOn)
                .build();
    }
}
