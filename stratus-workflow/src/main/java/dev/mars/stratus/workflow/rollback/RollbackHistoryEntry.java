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

import java.time.Instant;
import java.util.Objects;

/**
 * One executed rollback. Entries are immutable and only ever appended.
 */
public record RollbackHistoryEntry(String id, String workflowName, Instant timestamp, String triggerReason,
                                   RollbackStrategyType strategy, RollbackExecutionResult result,
                                   RollbackContext context) {

    public RollbackHistoryEntry {
        Objects.requireNonNull(id, "History id cannot be null");
        Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(strategy, "Strategy cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
    }
}
