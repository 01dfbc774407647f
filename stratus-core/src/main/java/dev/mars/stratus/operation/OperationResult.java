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

package dev.mars.stratus.operation;

import dev.mars.stratus.core.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value object describing the outcome of one backend operation.
 *
 * <p>A result with {@code success=false} is not an exception: the workflow engine
 * converts it into an {@link dev.mars.stratus.core.exceptions.OperationException}
 * carrying {@link #getErrorCode()}, defaulting to {@code OPERATION_FAILED}.</p>
 *
 * <pre>{@code
 * OperationResult result = OperationResult.builder()
 *     .operation("deploy")
 *     .success(true)
 *     .outputs(Map.of("vpcId", "vpc-123"))
 *     .resources(List.of("aws_vpc.main"))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see OperationBackend
 */
public final class OperationResult {

    private final String operation;
    private final boolean success;
    private final Map<String, Object> outputs;
    private final List<String> resources;
    private final String summary;
    private final String errorCode;
    private final String errorMessage;
    private final Instant startTime;
    private final Instant endTime;

    private OperationResult(Builder builder) {
        this.operation = Objects.requireNonNull(builder.operation, "Operation cannot be null");
        this.success = builder.success;
        this.outputs = builder.outputs == null ? Map.of() : Map.copyOf(builder.outputs);
        this.resources = builder.resources == null ? List.of() : List.copyOf(builder.resources);
        this.summary = builder.summary;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OperationResult success(String operation) {
        return builder().operation(operation).success(true).build();
    }

    public static OperationResult failure(String operation, String errorCode, String errorMessage) {
        return builder().operation(operation).success(false).errorCode(errorCode).errorMessage(errorMessage).build();
    }

    public String getOperation() {
        return operation;
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public List<String> getResources() {
        return resources;
    }

    public Optional<String> getSummary() {
        return Optional.ofNullable(summary);
    }

    /**
     * Returns the backend error code for a failed result, falling back to
     * {@code OPERATION_FAILED} when the backend gave none.
     */
    public String getErrorCode() {
        if (success) {
            return null;
        }
        return errorCode != null ? errorCode : ErrorCode.OPERATION_FAILED.code();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationResult that = (OperationResult) o;
        return success == that.success &&
               Objects.equals(operation, that.operation) &&
               Objects.equals(outputs, that.outputs) &&
               Objects.equals(resources, that.resources) &&
               Objects.equals(errorCode, that.errorCode) &&
               Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, success, outputs, resources, errorCode, errorMessage);
    }

    @Override
    public String toString() {
        return "OperationResult{" +
               "operation='" + operation + '\'' +
               ", success=" + success +
               ", resources=" + resources.size() +
               (success ? "" : ", errorCode='" + getErrorCode() + '\'' + ", errorMessage='" + errorMessage + '\'') +
               '}';
    }

    public static class Builder {
        private String operation;
        private boolean success;
        private Map<String, Object> outputs;
        private List<String> resources;
        private String summary;
        private String errorCode;
        private String errorMessage;
        private Instant startTime;
        private Instant endTime;

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources = resources;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public OperationResult build() {
            return new OperationResult(this);
        }
    }
}
