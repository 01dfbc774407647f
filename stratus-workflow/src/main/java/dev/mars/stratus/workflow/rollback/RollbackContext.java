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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Why a rollback is happening and what the run had done by then.
 *
 * <p>{@code completedSteps} is in completion order; progressive rollback walks it
 * backwards.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public final class RollbackContext {

    private final String workflowName;
    private final String failedStep;
    private final int failedStepIndex;
    private final String errorMessage;
    private final String errorCode;
    private final RollbackTriggerType trigger;
    private final List<String> completedSteps;
    private final List<String> failedSteps;
    private final Map<String, Object> workflowState;
    private final Map<String, Object> previousState;
    private final List<String> affectedResources;
    private final String reason;
    private final Instant timestamp;

    private RollbackContext(Builder builder) {
        this.workflowName = Objects.requireNonNull(builder.workflowName, "Workflow name cannot be null");
        this.failedStep = builder.failedStep;
        this.failedStepIndex = builder.failedStepIndex;
        this.errorMessage = builder.errorMessage;
        this.errorCode = builder.errorCode;
        this.trigger = Objects.requireNonNull(builder.trigger, "Trigger cannot be null");
        this.completedSteps = List.copyOf(builder.completedSteps);
        this.failedSteps = List.copyOf(builder.failedSteps);
        this.workflowState = Collections.unmodifiableMap(new LinkedHashMap<>(builder.workflowState));
        this.previousState = builder.previousState != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.previousState)) : null;
        this.affectedResources = List.copyOf(new LinkedHashSet<>(builder.affectedResources));
        this.reason = builder.reason != null ? builder.reason : describe(builder);
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    private static String describe(Builder builder) {
        if (builder.failedStep != null) {
            return builder.trigger.value() + " in step " + builder.failedStep;
        }
        return builder.trigger.value();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * Name of the step whose failure triggered the rollback; null for a manual rollback.
     */
    public String getFailedStep() {
        return failedStep;
    }

    public int getFailedStepIndex() {
        return failedStepIndex;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public RollbackTriggerType getTrigger() {
        return trigger;
    }

    public List<String> getCompletedSteps() {
        return completedSteps;
    }

    public List<String> getFailedSteps() {
        return failedSteps;
    }

    public Map<String, Object> getWorkflowState() {
        return workflowState;
    }

    public Optional<Map<String, Object>> getPreviousState() {
        return Optional.ofNullable(previousState);
    }

    public List<String> getAffectedResources() {
        return affectedResources;
    }

    public String getReason() {
        return reason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "RollbackContext{" +
               "workflowName='" + workflowName + '\'' +
               ", failedStep='" + failedStep + '\'' +
               ", trigger=" + trigger.value() +
               ", reason='" + reason + '\'' +
               ", completedSteps=" + completedSteps +
               '}';
    }

    public static class Builder {
        private String workflowName;
        private String failedStep;
        private int failedStepIndex = -1;
        private String errorMessage;
        private String errorCode;
        private RollbackTriggerType trigger = RollbackTriggerType.STEP_FAILURE;
        private List<String> completedSteps = new ArrayList<>();
        private List<String> failedSteps = new ArrayList<>();
        private Map<String, Object> workflowState = new LinkedHashMap<>();
        private Map<String, Object> previousState;
        private List<String> affectedResources = new ArrayList<>();
        private String reason;
        private Instant timestamp;

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder failedStep(String failedStep, int failedStepIndex) {
            this.failedStep = failedStep;
            this.failedStepIndex = failedStepIndex;
            return this;
        }

        public Builder error(String errorCode, String errorMessage) {
            this.errorCode = errorCode;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder trigger(RollbackTriggerType trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder completedSteps(List<String> completedSteps) {
            this.completedSteps = completedSteps != null ? new ArrayList<>(completedSteps) : new ArrayList<>();
            return this;
        }

        public Builder failedSteps(List<String> failedSteps) {
            this.failedSteps = failedSteps != null ? new ArrayList<>(failedSteps) : new ArrayList<>();
            return this;
        }

        public Builder workflowState(Map<String, Object> workflowState) {
            this.workflowState = new LinkedHashMap<>();
            if (workflowState != null) {
                workflowState.forEach((key, value) -> {
                    if (key != null && value != null) {
                        this.workflowState.put(key, value);
                    }
                });
            }
            return this;
        }

        public Builder previousState(Map<String, Object> previousState) {
            this.previousState = previousState;
            return this;
        }

        public Builder affectedResources(List<String> affectedResources) {
            this.affectedResources = affectedResources != null
                    ? new ArrayList<>(affectedResources) : new ArrayList<>();
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public RollbackContext build() {
            return new RollbackContext(this);
        }
    }
}
