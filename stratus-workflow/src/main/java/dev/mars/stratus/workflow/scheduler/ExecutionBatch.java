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

package dev.mars.stratus.workflow.scheduler;

import dev.mars.stratus.workflow.WorkflowStep;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered group of steps eligible to run concurrently. Batch {@code i} holds only
 * steps whose dependencies are satisfied by batches before {@code i}.
 */
public final class ExecutionBatch {

    private final int batchNumber;
    private final List<WorkflowStep> steps;

    public ExecutionBatch(int batchNumber, List<WorkflowStep> steps) {
        if (batchNumber < 1) {
            throw new IllegalArgumentException("Batch number must be positive");
        }
        this.batchNumber = batchNumber;
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Steps cannot be null"));
    }

    /**
     * One-based position of this batch in the schedule.
     */
    public int getBatchNumber() {
        return batchNumber;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public List<String> getStepNames() {
        return steps.stream().map(WorkflowStep::getName).collect(Collectors.toList());
    }

    public int size() {
        return steps.size();
    }

    /**
     * Returns the parallel group shared by every step of the batch, if there is one.
     */
    public Optional<String> getParallelGroup() {
        if (steps.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> first = steps.get(0).getParallelGroup();
        if (first.isPresent() && steps.stream().allMatch(step -> step.getParallelGroup().equals(first))) {
            return first;
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionBatch that = (ExecutionBatch) o;
        return batchNumber == that.batchNumber && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchNumber, steps);
    }

    @Override
    public String toString() {
        return "ExecutionBatch{" +
               "batchNumber=" + batchNumber +
               ", steps=" + getStepNames() +
               '}';
    }
}
