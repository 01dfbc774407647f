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

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A step suspended until an operator decides how to recover. Removed from the
 * pending queue when resolved.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class ManualInterventionRequest {

    private final String id;
    private final String stepName;
    private final String errorCode;
    private final String errorMessage;
    private final List<String> suggestedActions;
    private final Instant timestamp;
    private final ErrorContext context;

    public ManualInterventionRequest(String id, ErrorContext context, List<String> suggestedActions,
                                     Instant timestamp) {
        this.id = Objects.requireNonNull(id, "Intervention id cannot be null");
        this.context = Objects.requireNonNull(context, "Error context cannot be null");
        this.stepName = context.step().getName();
        this.errorCode = context.errorCode();
        this.errorMessage = context.errorMessage();
        this.suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public String getId() {
        return id;
    }

    public String getStepName() {
        return stepName;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getSuggestedActions() {
        return suggestedActions;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ErrorContext getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ManualInterventionRequest) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ManualInterventionRequest{" +
               "id='" + id + '\'' +
               ", stepName='" + stepName + '\'' +
               ", errorCode='" + errorCode + '\'' +
               ", suggestedActions=" + suggestedActions +
               '}';
    }
}
