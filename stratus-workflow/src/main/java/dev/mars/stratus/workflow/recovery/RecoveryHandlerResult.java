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

package dev.mars.stratus.workflow.recovery;

import dev.mars.stratus.workflow.WorkflowStep;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a manual intervention.
 *
 * @param strategy     the operator's decision
 * @param modifiedStep the step to re-execute, present for a retry decision
 */
public record RecoveryHandlerResult(ErrorRecoveryStrategy strategy, WorkflowStep modifiedStep) {

    public RecoveryHandlerResult {
        Objects.requireNonNull(strategy, "Strategy cannot be null");
    }

    public Optional<WorkflowStep> getModifiedStep() {
        return Optional.ofNullable(modifiedStep);
    }
}
