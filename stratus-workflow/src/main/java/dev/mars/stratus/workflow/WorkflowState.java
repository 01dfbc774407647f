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

import dev.mars.stratus.core.exceptions.InvalidTransitionException;

import java.util.Arrays;

/**
 * Lifecycle of a single workflow run.
 *
 * <pre>
 * NOT_STARTED -> VALIDATING -> SCHEDULED -> EXECUTING
 * EXECUTING  <-> RECOVERING | AWAITING_MANUAL_INTERVENTION
 * EXECUTING   -> SUCCEEDED -> COMPLETED
 * any active  -> ROLLING_BACK -> ROLLED_BACK
 * any active  -> ABORTED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public enum WorkflowState {

    NOT_STARTED,
    VALIDATING,
    SCHEDULED,
    EXECUTING,
    RECOVERING,
    AWAITING_MANUAL_INTERVENTION,
    ROLLING_BACK,
    /** Every batch has finished; post-hooks may still run. */
    SUCCEEDED,
    COMPLETED,
    ROLLED_BACK,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == ABORTED;
    }

    public boolean canTransitionTo(WorkflowState target) {
        return switch (this) {
            case NOT_STARTED -> target == VALIDATING || target == ABORTED;
            case VALIDATING -> target == SCHEDULED || target == ABORTED;
            case SCHEDULED -> target == EXECUTING || target == SUCCEEDED || target == ABORTED;
            case EXECUTING -> target == RECOVERING || target == AWAITING_MANUAL_INTERVENTION
                    || target == ROLLING_BACK || target == SUCCEEDED || target == ABORTED;
            case RECOVERING -> target == EXECUTING || target == AWAITING_MANUAL_INTERVENTION
                    || target == ROLLING_BACK || target == ABORTED;
            case AWAITING_MANUAL_INTERVENTION -> target == EXECUTING || target == RECOVERING
                    || target == ROLLING_BACK || target == ABORTED;
            case ROLLING_BACK -> target == ROLLED_BACK;
            case SUCCEEDED -> target == COMPLETED || target == ABORTED;
            case COMPLETED, ROLLED_BACK, ABORTED -> false;
        };
    }

    public WorkflowState[] getValidTransitions() {
        return Arrays.stream(values())
                .filter(this::canTransitionTo)
                .toArray(WorkflowState[]::new);
    }

    /**
     * Validates and returns the target state.
     *
     * @throws InvalidTransitionException if the move is not allowed
     */
    public WorkflowState transitionTo(String runId, WorkflowState target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(runId, this, target, getValidTransitions());
        }
        return target;
    }
}
