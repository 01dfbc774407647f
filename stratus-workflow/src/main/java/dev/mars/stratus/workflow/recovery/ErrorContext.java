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

import dev.mars.stratus.core.exceptions.StratusException;
import dev.mars.stratus.workflow.WorkflowStep;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything known about a step failure at the moment recovery is decided.
 *
 * @param step           the failing step
 * @param stepIndex      position of the step in definition order
 * @param error          the coded failure of the last attempt
 * @param attemptNumber  attempts made so far, 1-indexed
 * @param previousErrors messages of earlier attempts, oldest first
 * @param workflowState  snapshot of the run state
 */
public record ErrorContext(WorkflowStep step, int stepIndex, StratusException error, int attemptNumber,
                           List<String> previousErrors, Map<String, Object> workflowState) {

    public ErrorContext {
        Objects.requireNonNull(step, "Step cannot be null");
        Objects.requireNonNull(error, "Error cannot be null");
        previousErrors = previousErrors != null ? List.copyOf(previousErrors) : List.of();
        workflowState = workflowState != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(workflowState)) : Map.of();
    }

    public String errorCode() {
        return error.getErrorCode();
    }

    public String errorMessage() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
