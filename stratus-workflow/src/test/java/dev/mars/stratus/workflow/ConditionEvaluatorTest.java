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

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.OperationException;
import dev.mars.stratus.operation.StateBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-08
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ConditionEvaluator")
class ConditionEvaluatorTest {

    @TempDir
    Path workingDirectory;

    @Mock
    StateBackend stateBackend;

    private ConditionEvaluator evaluator;
    private ConditionContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator(workingDirectory, stateBackend);
        context = new ConditionContext("infra",
                List.of("plan", "deploy-network"),
                List.of(),
                Map.of("plan", Map.of("changes", 3, "status", "pending"),
                        "deploy-network", Map.of("status", "applied", "vpcId", "vpc-123")),
                Map.of());
    }

    @Nested
    @DisplayName("file-exists")
    class FileExists {

        @Test
        @DisplayName("resolves paths against the working directory")
        void resolvesRelativePaths() throws Exception {
            Files.createDirectories(workingDirectory.resolve("stacks"));
            Files.writeString(workingDirectory.resolve("stacks/main.tf"), "terraform {}");

            assertThat(evaluator.evaluate("deploy", StepCondition.fileExists("stacks/main.tf"), context)).isTrue();
            assertThat(evaluator.evaluate("deploy", StepCondition.fileExists("stacks/other.tf"), context)).isFalse();
        }
    }

    @Nested
    @DisplayName("state-has-resource")
    class StateHasResource {

        @Test
        @DisplayName("looks the address up in the state resources")
        void findsResource() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of("resources",
                    List.of(Map.of("address", "aws_vpc.main"), "aws_subnet.a")));

            assertThat(evaluator.evaluate("s", StepCondition.stateHasResource("aws_vpc.main"), context)).isTrue();
            assertThat(evaluator.evaluate("s", StepCondition.stateHasResource("aws_subnet.a"), context)).isTrue();
            assertThat(evaluator.evaluate("s", StepCondition.stateHasResource("aws_db.main"), context)).isFalse();
        }

        @Test
        @DisplayName("is false without a state backend")
        void falseWithoutBackend() throws Exception {
            ConditionEvaluator stateless = new ConditionEvaluator(workingDirectory, null);

            assertThat(stateless.evaluate("s", StepCondition.stateHasResource("aws_vpc.main"), context)).isFalse();
        }

        @Test
        @DisplayName("propagates state read failures with the backend's code")
        void propagatesStateErrors() throws Exception {
            when(stateBackend.loadState())
                    .thenThrow(new OperationException("loadState", ErrorCode.STATE_LOCK_ERROR, "locked"));

            assertThatThrownBy(() -> evaluator.evaluate("s", StepCondition.stateHasResource("x"), context))
                    .isInstanceOf(StepExecutionException.class)
                    .satisfies(e -> assertThat(((StepExecutionException) e).hasErrorCode(ErrorCode.STATE_LOCK_ERROR))
                            .isTrue());
        }
    }

    @Nested
    @DisplayName("output-equals")
    class OutputEquals {

        @Test
        @DisplayName("matches a qualified step output")
        void matchesQualifiedOutput() throws Exception {
            assertThat(evaluator.evaluate("s", StepCondition.outputEquals("plan.changes", "3"), context)).isTrue();
            assertThat(evaluator.evaluate("s", StepCondition.outputEquals("plan.status", "applied"), context))
                    .isFalse();
        }

        @Test
        @DisplayName("prefers the latest completed step for an unqualified output")
        void latestStepWins() throws Exception {
            assertThat(evaluator.evaluate("s", StepCondition.outputEquals("status", "applied"), context)).isTrue();
        }

        @Test
        @DisplayName("falls back to the state outputs")
        void fallsBackToState() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of("outputs", Map.of("dbEndpoint", "db.internal")));

            assertThat(evaluator.evaluate("s", StepCondition.outputEquals("dbEndpoint", "db.internal"), context))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("custom")
    class Custom {

        @Test
        @DisplayName("evaluates expressions over the run context")
        void evaluatesExpression() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of("environment", "staging"));

            assertThat(evaluator.evaluate("s",
                    StepCondition.custom("completedSteps.contains('plan') and state['environment'] == 'staging'"),
                    context)).isTrue();
        }

        @Test
        @DisplayName("reads step outputs")
        void readsOutputs() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of());

            assertThat(evaluator.evaluate("s", StepCondition.custom("outputs['plan']['changes'] > 0"), context))
                    .isTrue();
        }

        @Test
        @DisplayName("rejects malformed expressions as configuration errors")
        void rejectsMalformedExpression() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of());

            assertThatThrownBy(() -> evaluator.evaluate("s", StepCondition.custom("completedSteps.contains("), context))
                    .isInstanceOf(StepExecutionException.class)
                    .hasMessageContaining("Invalid condition expression");
        }

        @Test
        @DisplayName("rejects non-boolean results")
        void rejectsNonBoolean() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of());

            assertThatThrownBy(() -> evaluator.evaluate("s", StepCondition.custom("workflowName"), context))
                    .isInstanceOf(StepExecutionException.class)
                    .satisfies(e -> assertThat(((StepExecutionException) e).hasErrorCode(ErrorCode.CONFIGURATION_ERROR))
                            .isTrue());
        }

        @Test
        @DisplayName("cannot reach types outside the context")
        void blocksTypeReferences() throws Exception {
            when(stateBackend.loadState()).thenReturn(Map.of());

            assertThatThrownBy(() -> evaluator.evaluate("s",
                    StepCondition.custom("T(java.lang.System).exit(1) == null"), context))
                    .isInstanceOf(StepExecutionException.class);
        }
    }
}
