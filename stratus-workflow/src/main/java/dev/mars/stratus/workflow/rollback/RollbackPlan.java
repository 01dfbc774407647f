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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered compensating steps for one rollback.
 *
 * <p>{@link #getSteps()} runs first, in order. Validation then cleanup steps run
 * after it. The risk level is the highest priority present in the plan.</p>
 */
public final class RollbackPlan {

    static final Duration DEFAULT_STEP_ESTIMATE = Duration.ofSeconds(30);

    private final String workflowName;
    private final List<RollbackStep> steps;
    private final List<RollbackStep> validationSteps;
    private final List<RollbackStep> cleanupSteps;
    private final Map<String, List<String>> dependencies;
    private final RollbackStrategyType strategyType;
    private final RollbackOptions options;

    public RollbackPlan(String workflowName, List<RollbackStep> steps, List<RollbackStep> validationSteps,
                        List<RollbackStep> cleanupSteps, RollbackStrategyType strategyType,
                        RollbackOptions options) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.steps = List.copyOf(steps);
        this.validationSteps = List.copyOf(validationSteps);
        this.cleanupSteps = List.copyOf(cleanupSteps);
        this.strategyType = Objects.requireNonNull(strategyType, "Strategy type cannot be null");
        this.options = options != null ? options : RollbackOptions.defaults();

        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (RollbackStep step : getAllSteps()) {
            deps.put(step.getName(), step.getDependencies());
        }
        this.dependencies = Collections.unmodifiableMap(deps);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<RollbackStep> getSteps() {
        return steps;
    }

    public List<RollbackStep> getValidationSteps() {
        return validationSteps;
    }

    public List<RollbackStep> getCleanupSteps() {
        return cleanupSteps;
    }

    /**
     * Main, validation and cleanup steps in execution order.
     */
    public List<RollbackStep> getAllSteps() {
        List<RollbackStep> all = new ArrayList<>(steps);
        all.addAll(validationSteps);
        all.addAll(cleanupSteps);
        return all;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public RollbackStrategyType getStrategyType() {
        return strategyType;
    }

    public RollbackOptions getOptions() {
        return options;
    }

    public boolean isEmpty() {
        return steps.isEmpty() && validationSteps.isEmpty() && cleanupSteps.isEmpty();
    }

    /**
     * Sum of step timeouts, counting steps without one as 30 seconds.
     */
    public Duration getEstimatedDuration() {
        Duration total = Duration.ZERO;
        for (RollbackStep step : getAllSteps()) {
            total = total.plus(step.getStep().getTimeout().orElse(DEFAULT_STEP_ESTIMATE));
        }
        return total;
    }

    public RollbackPriority getRiskLevel() {
        RollbackPriority highest = RollbackPriority.LOW;
        for (RollbackStep step : getAllSteps()) {
            if (step.getPriority().isHigherThan(highest)) {
                highest = step.getPriority();
            }
        }
        return highest;
    }

    @Override
    public String toString() {
        return "RollbackPlan{" +
               "workflowName='" + workflowName + '\'' +
               ", strategy=" + strategyType.value() +
               ", steps=" + steps.stream().map(RollbackStep::getName).toList() +
               ", validationSteps=" + validationSteps.size() +
               ", cleanupSteps=" + cleanupSteps.size() +
               ", riskLevel=" + getRiskLevel().value() +
               '}';
    }
}
