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
import java.util.Objects;
import java.util.Optional;

/**
 * Execution knobs of a rollback strategy.
 */
public final class RollbackOptions {

    private final int maxRollbackAttempts;
    private final Duration rollbackTimeout;
    private final boolean preserveState;
    private final boolean validateAfterRollback;
    private final boolean rollbackOnPartialSuccess;

    private RollbackOptions(Builder builder) {
        this.maxRollbackAttempts = builder.maxRollbackAttempts;
        this.rollbackTimeout = builder.rollbackTimeout;
        this.preserveState = builder.preserveState;
        this.validateAfterRollback = builder.validateAfterRollback;
        this.rollbackOnPartialSuccess = builder.rollbackOnPartialSuccess;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RollbackOptions defaults() {
        return builder().build();
    }

    public int getMaxRollbackAttempts() {
        return maxRollbackAttempts;
    }

    public Optional<Duration> getRollbackTimeout() {
        return Optional.ofNullable(rollbackTimeout);
    }

    /**
     * Take a state backup before the first rollback step runs.
     */
    public boolean isPreserveState() {
        return preserveState;
    }

    public boolean isValidateAfterRollback() {
        return validateAfterRollback;
    }

    /**
     * Roll back a run that finished with failed steps under continue-on-error.
     */
    public boolean isRollbackOnPartialSuccess() {
        return rollbackOnPartialSuccess;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollbackOptions that = (RollbackOptions) o;
        return maxRollbackAttempts == that.maxRollbackAttempts &&
               preserveState == that.preserveState &&
               validateAfterRollback == that.validateAfterRollback &&
               rollbackOnPartialSuccess == that.rollbackOnPartialSuccess &&
               Objects.equals(rollbackTimeout, that.rollbackTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRollbackAttempts, rollbackTimeout, preserveState, validateAfterRollback,
                rollbackOnPartialSuccess);
    }

    @Override
    public String toString() {
        return "RollbackOptions{" +
               "maxRollbackAttempts=" + maxRollbackAttempts +
               ", rollbackTimeout=" + rollbackTimeout +
               ", preserveState=" + preserveState +
               ", validateAfterRollback=" + validateAfterRollback +
               ", rollbackOnPartialSuccess=" + rollbackOnPartialSuccess +
               '}';
    }

    public static class Builder {
        private int maxRollbackAttempts = 1;
        private Duration rollbackTimeout;
        private boolean preserveState;
        private boolean validateAfterRollback = true;
        private boolean rollbackOnPartialSuccess;

        public Builder maxRollbackAttempts(int maxRollbackAttempts) {
            this.maxRollbackAttempts = maxRollbackAttempts;
            return this;
        }

        public Builder rollbackTimeout(Duration rollbackTimeout) {
            this.rollbackTimeout = rollbackTimeout;
            return this;
        }

        public Builder preserveState(boolean preserveState) {
            this.preserveState = preserveState;
            return this;
        }

        public Builder validateAfterRollback(boolean validateAfterRollback) {
            this.validateAfterRollback = validateAfterRollback;
            return this;
        }

        public Builder rollbackOnPartialSuccess(boolean rollbackOnPartialSuccess) {
            this.rollbackOnPartialSuccess = rollbackOnPartialSuccess;
            return this;
        }

        public RollbackOptions build() {
            if (maxRollbackAttempts < 1) {
                throw new IllegalArgumentException("maxRollbackAttempts must be at least 1");
            }
            return new RollbackOptions(this);
        }
    }
}
