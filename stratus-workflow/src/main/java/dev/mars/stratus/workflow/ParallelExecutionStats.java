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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Observed parallelism of a run.
 */
public final class ParallelExecutionStats {

    private final int totalSteps;
    private final int parallelSteps;
    private final int maxConcurrentSteps;
    private final List<BatchStats> batches;

    public ParallelExecutionStats(int totalSteps, int parallelSteps, int maxConcurrentSteps,
                                  List<BatchStats> batches) {
        this.totalSteps = totalSteps;
        this.parallelSteps = parallelSteps;
        this.maxConcurrentSteps = maxConcurrentSteps;
        this.batches = List.copyOf(batches);
    }

    public static ParallelExecutionStats empty() {
        return new ParallelExecutionStats(0, 0, 0, List.of());
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    /**
     * Steps that ran in a batch with at least one other step.
     */
    public int getParallelSteps() {
        return parallelSteps;
    }

    /**
     * Highest number of step attempts observed running at the same time.
     */
    public int getMaxConcurrentSteps() {
        return maxConcurrentSteps;
    }

    public int getBatchCount() {
        return batches.size();
    }

    public double getAverageConcurrency() {
        return batches.isEmpty() ? 0.0 : (double) totalSteps / batches.size();
    }

    public List<BatchStats> getBatches() {
        return batches;
    }

    @Override
    public String toString() {
        return "ParallelExecutionStats{" +
               "totalSteps=" + totalSteps +
               ", parallelSteps=" + parallelSteps +
               ", maxConcurrentSteps=" + maxConcurrentSteps +
               ", batches=" + batches.size() +
               '}';
    }

    /**
     * Outcome of one execution batch.
     */
    public static final class BatchStats {
        private final int batchNumber;
        private final String groupName;
        private final int stepCount;
        private final int maxConcurrency;
        private final Duration duration;
        private final boolean success;

        public BatchStats(int batchNumber, String groupName, int stepCount, int maxConcurrency,
                          Duration duration, boolean success) {
            this.batchNumber = batchNumber;
            this.groupName = groupName;
            this.stepCount = stepCount;
            this.maxConcurrency = maxConcurrency;
            this.duration = Objects.requireNonNull(duration, "Duration cannot be null");
            this.success = success;
        }

        public int getBatchNumber() {
            return batchNumber;
        }

        public Optional<String> getGroupName() {
            return Optional.ofNullable(groupName);
        }

        public int getStepCount() {
            return stepCount;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public Duration getDuration() {
            return duration;
        }

        public boolean isSuccess() {
            return success;
        }

        @Override
        public String toString() {
            return "BatchStats{" +
                   "batch=" + batchNumber +
                   ", group=" + groupName +
                   ", steps=" + stepCount +
                   ", maxConcurrency=" + maxConcurrency +
                   ", duration=" + duration.toMillis() + "ms" +
                   ", success=" + success +
                   '}';
        }
    }
}
