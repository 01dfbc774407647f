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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of executing a rollback plan.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public final class RollbackExecutionResult {

    private final boolean success;
    private final List<String> rollbackSteps;
    private final List<String> failedRollbackSteps;
    private final List<String> skippedRollbackSteps;
    private final List<RollbackStepOutcome> stepOutcomes;
    private final List<String> errors;
    private final List<String> warnings;
    private final Duration duration;
    private final boolean stateRestored;
    private final List<String> resourcesDestroyed;
    private final boolean aborted;

    private RollbackExecutionResult(Builder builder) {
        this.success = builder.success;
        this.rollbackSteps = List.copyOf(builder.rollbackSteps);
        this.failedRollbackSteps = List.copyOf(builder.failedRollbackSteps);
        this.skippedRollbackSteps = List.copyOf(builder.skippedRollbackSteps);
        this.stepOutcomes = List.copyOf(builder.stepOutcomes);
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
        this.stateRestored = builder.stateRestored;
        this.resourcesDestroyed = List.copyOf(builder.resourcesDestroyed);
        this.aborted = builder.aborted;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Rollback steps that ran successfully, in execution order.
     */
    public List<String> getRollbackSteps() {
        return rollbackSteps;
    }

    public List<String> getFailedRollbackSteps() {
        return failedRollbackSteps;
    }

    public List<String> getSkippedRollbackSteps() {
        return skippedRollbackSteps;
    }

    /**
     * Success, duration and error of every rollback step that was attempted, in
     * execution order. Skipped steps have no outcome.
     */
    public List<RollbackStepOutcome> getStepOutcomes() {
        return stepOutcomes;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isStateRestored() {
        return stateRestored;
    }

    public List<String> getResourcesDestroyed() {
        return resourcesDestroyed;
    }

    /**
     * Whether a critical step failure stopped the plan early.
     */
    public boolean isAborted() {
        return aborted;
    }

    @Override
    public String toString() {
        return "RollbackExecutionResult{" +
               "success=" + success +
               ", rollbackSteps=" + rollbackSteps +
               ", failedRollbackSteps=" + failedRollbackSteps +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               ", duration=" + duration.toMillis() + "ms" +
               ", aborted=" + aborted +
               '}';
    }

    public static class Builder {
        private boolean success;
        private final List<String> rollbackSteps = new ArrayList<>();
        private final List<String> failedRollbackSteps = new ArrayList<>();
        private final List<String> skippedRollbackSteps = new ArrayList<>();
        private final List<RollbackStepOutcome> stepOutcomes = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private Duration duration;
        private boolean stateRestored;
        private final List<String> resourcesDestroyed = new ArrayList<>();
        private boolean aborted;

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder rollbackStep(String name) {
            rollbackSteps.add(Objects.requireNonNull(name));
            return this;
        }

        public Builder failedRollbackStep(String name) {
            failedRollbackSteps.add(Objects.requireNonNull(name));
            return this;
        }

        public Builder skippedRollbackStep(String name) {
            skippedRollbackSteps.add(Objects.requireNonNull(name));
            return this;
        }

        public Builder stepOutcome(RollbackStepOutcome outcome) {
            stepOutcomes.add(Objects.requireNonNull(outcome));
            return this;
        }

        public Builder error(String error) {
            errors.add(error);
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder stateRestored(boolean stateRestored) {
            this.stateRestored = stateRestored;
            return this;
        }

        public Builder resourcesDestroyed(List<String> resources) {
            resourcesDestroyed.addAll(resources);
            return this;
        }

        public Builder aborted(boolean aborted) {
            this.aborted = aborted;
            return this;
        }

        public boolean hasFailures() {
            return !failedRollbackSteps.isEmpty();
        }

        public RollbackExecutionResult build() {
            return new RollbackExecutionResult(this);
        }
    }
}
