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

import dev.mars.stratus.workflow.recovery.ManualInterventionHandler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-run execution settings. Unset numeric and duration settings fall back to
 * the engine's {@link dev.mars.stratus.config.StratusConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public final class WorkflowExecutionOptions {

    private final boolean dryRun;
    private final Duration timeout;
    private final boolean parallel;
    private final Integer maxConcurrency;
    private final boolean continueOnError;
    private final boolean rollbackOnError;
    private final boolean saveCheckpoints;
    private final Path checkpointDirectory;
    private final String resumeFromCheckpoint;
    private final boolean allowManualIntervention;
    private final Integer maxManualInterventions;
    private final Duration interventionTimeout;
    private final boolean continueOnHookFailure;
    private final ManualInterventionHandler interventionHandler;

    private WorkflowExecutionOptions(Builder builder) {
        this.dryRun = builder.dryRun;
        this.timeout = builder.timeout;
        this.parallel = builder.parallel;
        this.maxConcurrency = builder.maxConcurrency;
        this.continueOnError = builder.continueOnError;
        this.rollbackOnError = builder.rollbackOnError;
        this.saveCheckpoints = builder.saveCheckpoints;
        this.checkpointDirectory = builder.checkpointDirectory;
        this.resumeFromCheckpoint = builder.resumeFromCheckpoint;
        this.allowManualIntervention = builder.allowManualIntervention;
        this.maxManualInterventions = builder.maxManualInterventions;
        this.interventionTimeout = builder.interventionTimeout;
        this.continueOnHookFailure = builder.continueOnHookFailure;
        this.interventionHandler = builder.interventionHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkflowExecutionOptions defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return builder()
                .dryRun(dryRun)
                .timeout(timeout)
                .parallel(parallel)
                .maxConcurrency(maxConcurrency)
                .continueOnError(continueOnError)
                .rollbackOnError(rollbackOnError)
                .saveCheckpoints(saveCheckpoints)
                .checkpointDirectory(checkpointDirectory)
                .resumeFromCheckpoint(resumeFromCheckpoint)
                .allowManualIntervention(allowManualIntervention)
                .maxManualInterventions(maxManualInterventions)
                .interventionTimeout(interventionTimeout)
                .continueOnHookFailure(continueOnHookFailure)
                .interventionHandler(interventionHandler);
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean isParallel() {
        return parallel;
    }

    public Optional<Integer> getMaxConcurrency() {
        return Optional.ofNullable(maxConcurrency);
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public boolean isRollbackOnError() {
        return rollbackOnError;
    }

    public boolean isSaveCheckpoints() {
        return saveCheckpoints;
    }

    public Optional<Path> getCheckpointDirectory() {
        return Optional.ofNullable(checkpointDirectory);
    }

    public Optional<String> getResumeFromCheckpoint() {
        return Optional.ofNullable(resumeFromCheckpoint);
    }

    /**
     * Whether a step may be suspended for an operator decision. When false, a failure
     * classified as needing manual intervention is treated as unrecoverable.
     */
    public boolean isAllowManualIntervention() {
        return allowManualIntervention;
    }

    public Optional<Integer> getMaxManualInterventions() {
        return Optional.ofNullable(maxManualInterventions);
    }

    public Optional<Duration> getInterventionTimeout() {
        return Optional.ofNullable(interventionTimeout);
    }

    public boolean isContinueOnHookFailure() {
        return continueOnHookFailure;
    }

    public Optional<ManualInterventionHandler> getInterventionHandler() {
        return Optional.ofNullable(interventionHandler);
    }

    @Override
    public String toString() {
        return "WorkflowExecutionOptions{" +
               "dryRun=" + dryRun +
               ", timeout=" + timeout +
               ", parallel=" + parallel +
               ", maxConcurrency=" + maxConcurrency +
               ", continueOnError=" + continueOnError +
               ", rollbackOnError=" + rollbackOnError +
               ", saveCheckpoints=" + saveCheckpoints +
               ", resumeFromCheckpoint='" + resumeFromCheckpoint + '\'' +
               ", allowManualIntervention=" + allowManualIntervention +
               ", maxManualInterventions=" + maxManualInterventions +
               '}';
    }

    public static class Builder {
        private boolean dryRun;
        private Duration timeout;
        private boolean parallel = true;
        private Integer maxConcurrency;
        private boolean continueOnError;
        private boolean rollbackOnError;
        private boolean saveCheckpoints;
        private Path checkpointDirectory;
        private String resumeFromCheckpoint;
        private boolean allowManualIntervention;
        private Integer maxManualInterventions;
        private Duration interventionTimeout;
        private boolean continueOnHookFailure;
        private ManualInterventionHandler interventionHandler;

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder maxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder rollbackOnError(boolean rollbackOnError) {
            this.rollbackOnError = rollbackOnError;
            return this;
        }

        public Builder saveCheckpoints(boolean saveCheckpoints) {
            this.saveCheckpoints = saveCheckpoints;
            return this;
        }

        public Builder checkpointDirectory(Path checkpointDirectory) {
            this.checkpointDirectory = checkpointDirectory;
            return this;
        }

        public Builder resumeFromCheckpoint(String resumeFromCheckpoint) {
            this.resumeFromCheckpoint = resumeFromCheckpoint;
            return this;
        }

        public Builder allowManualIntervention(boolean allowManualIntervention) {
            this.allowManualIntervention = allowManualIntervention;
            return this;
        }

        public Builder maxManualInterventions(Integer maxManualInterventions) {
            this.maxManualInterventions = maxManualInterventions;
            return this;
        }

        public Builder interventionTimeout(Duration interventionTimeout) {
            this.interventionTimeout = interventionTimeout;
            return this;
        }

        public Builder continueOnHookFailure(boolean continueOnHookFailure) {
            this.continueOnHookFailure = continueOnHookFailure;
            return this;
        }

        /**
         * Handler notified of each manual intervention request. Setting one also
         * allows manual intervention.
         */
        public Builder interventionHandler(ManualInterventionHandler interventionHandler) {
            this.interventionHandler = interventionHandler;
            if (interventionHandler != null) {
                this.allowManualIntervention = true;
            }
            return this;
        }

        public WorkflowExecutionOptions build() {
            if (maxConcurrency != null && maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1");
            }
            if (maxManualInterventions != null && maxManualInterventions < 0) {
                throw new IllegalArgumentException("maxManualInterventions cannot be negative");
            }
            return new WorkflowExecutionOptions(this);
        }
    }
}
