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
import dev.mars.stratus.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
class WorkflowStateTest {

    @Test
    void testHappyPath() throws Exception {
        WorkflowState state = WorkflowState.NOT_STARTED;
        for (WorkflowState next : List.of(WorkflowState.VALIDATING, WorkflowState.SCHEDULED,
                WorkflowState.EXECUTING, WorkflowState.SUCCEEDED, WorkflowState.COMPLETED)) {
            state = state.transitionTo("run-1", next);
        }
        assertEquals(WorkflowState.COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void testRecoveryLoop() {
        assertTrue(WorkflowState.EXECUTING.canTransitionTo(WorkflowState.RECOVERING));
        assertTrue(WorkflowState.RECOVERING.canTransitionTo(WorkflowState.AWAITING_MANUAL_INTERVENTION));
        assertTrue(WorkflowState.AWAITING_MANUAL_INTERVENTION.canTransitionTo(WorkflowState.EXECUTING));
        assertTrue(WorkflowState.RECOVERING.canTransitionTo(WorkflowState.EXECUTING));
    }

    @Test
    void testDryRunSkipsExecution() {
        assertTrue(WorkflowState.SCHEDULED.canTransitionTo(WorkflowState.SUCCEEDED));
    }

    @Test
    void testRollbackOnlyEndsRolledBack() {
        assertArrayEquals(new WorkflowState[]{WorkflowState.ROLLED_BACK},
                WorkflowState.ROLLING_BACK.getValidTransitions());
        assertFalse(WorkflowState.SUCCEEDED.canTransitionTo(WorkflowState.ROLLING_BACK));
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowState.class, names = {"COMPLETED", "ROLLED_BACK", "ABORTED"})
    void testTerminalStatesHaveNoExits(WorkflowState terminal) {
        assertTrue(terminal.isTerminal());
        assertEquals(0, terminal.getValidTransitions().length);
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowState.class,
            names = {"NOT_STARTED", "VALIDATING", "SCHEDULED", "EXECUTING", "RECOVERING",
                    "AWAITING_MANUAL_INTERVENTION", "SUCCEEDED"})
    void testActiveStatesCanAbort(WorkflowState active) {
        assertFalse(active.isTerminal());
        assertTrue(active.canTransitionTo(WorkflowState.ABORTED));
    }

    @Test
    void testInvalidTransitionCarriesContext() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> WorkflowState.COMPLETED.transitionTo("run-7", WorkflowState.EXECUTING));

        assertTrue(e.hasErrorCode(ErrorCode.INVALID_STATE_TRANSITION));
        assertEquals("run-7", e.getEntityId());
        assertTrue(e.getMessage().contains("COMPLETED -> EXECUTING"));
    }

    @Test
    void testNoSelfTransitions() {
        Arrays.stream(WorkflowState.values())
                .forEach(state -> assertFalse(state.canTransitionTo(state), state + " -> " + state));
    }
}
