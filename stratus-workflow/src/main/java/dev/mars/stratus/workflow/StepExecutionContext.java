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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one attempt of one step: timing, outcome and error.
 */
public final class StepExecutionContext {

    private final WorkflowStep step;
    private final int stepIndex;
    private final int attempt;
    private final Instant startTime;
    private final Instant endTime;
    private final boolean success;
    private final String errorCode;
    private final String errorMessage;

    public StepExecutionContext(WorkflowStep step, int stepIndex, int attempt, Instant startTime,
                                Instant endTime, boolean success, String errorCode, String errorMessage) {
        this.step = Objects.requireNonNull(step, "Step cannot be null");
        this.stepIndex = stepIndex;
        this.attempt = attempt;
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.success = success;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static StepExecutionContext succeeded(WorkflowStep step, int stepIndex, int attempt,
                                                 Instant startTime, Instant endTime) {
        return new StepExecutionContext(step, stepIndex, attempt, startTime, endTime, true, null, null);
    }

    public static StepExecutionContext failed(WorkflowStep step, int stepIndex, int attempt, Instant startTime,
                                              Instant endTime, String errorCode, String errorMessage) {
        return new StepExecutionContext(step, stepIndex, attempt, startTime, endTime, false, errorCode, errorMessage);
    }

    public WorkflowStep getStep() {
        return step;
    }

    public String getStepName() {
        return step.getName();
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Duration getDuration() {
        return endTime != null ? Duration.between(startTime, endTime) : Duration.ZERO;
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "StepExecutionContext{" +
               "step='" + step.getName() + '\'' +
               ", attempt=" + attempt +
               ", success=" + success +
               ", duration=" + getDuration().toMillis() + "ms" +
               (success ? "" : ", errorCode='" + errorCode + '\'') +
               '}';
    }
}
