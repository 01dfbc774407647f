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

import dev.mars.stratus.workflow.rollback.RollbackStep;
import dev.mars.stratus.workflow.rollback.RollbackStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable definition of an infrastructure-change workflow: ordered steps, hooks
 * that run outside the dependency graph, and the rollback plan.
 *
 * <pre>{@code
 * WorkflowDefinition definition = WorkflowDefinition.builder()
 *     .name("network-rollout")
 *     .description("Deploy the shared network stack")
 *     .step(WorkflowStep.builder("plan").description("Plan").command("plan").build())
 *     .step(WorkflowStep.builder("deploy").description("Deploy").command("deploy")
 *           .dependsOn("plan").build())
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
public final class WorkflowDefinition {

    private final String name;
    private final String description;
    private final List<WorkflowStep> steps;
    private final List<WorkflowStep> preHooks;
    private final List<WorkflowStep> postHooks;
    private final List<RollbackStep> rollbackSteps;
    private final RollbackStrategy rollbackStrategy;

    private WorkflowDefinition(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.preHooks = List.copyOf(builder.preHooks);
        this.postHooks = List.copyOf(builder.postHooks);
        this.rollbackSteps = List.copyOf(builder.rollbackSteps);
        this.rollbackStrategy = builder.rollbackStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .description(description)
                .steps(steps)
                .preHooks(preHooks)
                .postHooks(postHooks)
                .rollbackSteps(rollbackSteps)
                .rollbackStrategy(rollbackStrategy);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public List<WorkflowStep> getPreHooks() {
        return preHooks;
    }

    public List<WorkflowStep> getPostHooks() {
        return postHooks;
    }

    public List<RollbackStep> getRollbackSteps() {
        return rollbackSteps;
    }

    public Optional<RollbackStrategy> getRollbackStrategy() {
        return Optional.ofNullable(rollbackStrategy);
    }

    public Optional<WorkflowStep> findStep(String stepName) {
        return steps.stream().filter(step -> Objects.equals(step.getName(), stepName)).findFirst();
    }

    /**
     * Returns the position of a step in definition order, or -1 if absent.
     */
    public int indexOf(String stepName) {
        for (int i = 0; i < steps.size(); i++) {
            if (Objects.equals(steps.get(i).getName(), stepName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(steps, that.steps) &&
               Objects.equals(preHooks, that.preHooks) &&
               Objects.equals(postHooks, that.postHooks) &&
               Objects.equals(rollbackSteps, that.rollbackSteps) &&
               Objects.equals(rollbackStrategy, that.rollbackStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, steps, preHooks, postHooks, rollbackSteps, rollbackStrategy);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", steps=" + steps.size() +
               ", preHooks=" + preHooks.size() +
               ", postHooks=" + postHooks.size() +
               ", rollbackSteps=" + rollbackSteps.size() +
               '}';
    }

    public static class Builder {
        private String name;
        private String description;
        private List<WorkflowStep> steps = new ArrayList<>();
        private List<WorkflowStep> preHooks = new ArrayList<>();
        private List<WorkflowStep> postHooks = new ArrayList<>();
        private List<RollbackStep> rollbackSteps = new ArrayList<>();
        private RollbackStrategy rollbackStrategy;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder preHooks(List<WorkflowStep> preHooks) {
            this.preHooks = preHooks != null ? new ArrayList<>(preHooks) : new ArrayList<>();
            return this;
        }

        public Builder postHooks(List<WorkflowStep> postHooks) {
            this.postHooks = postHooks != null ? new ArrayList<>(postHooks) : new ArrayList<>();
            return this;
        }

        public Builder rollbackSteps(List<RollbackStep> rollbackSteps) {
            this.rollbackSteps = rollbackSteps != null ? new ArrayList<>(rollbackSteps) : new ArrayList<>();
            return this;
        }

        public Builder rollbackStep(RollbackStep rollbackStep) {
            this.rollbackSteps.add(Objects.requireNonNull(rollbackStep, "Rollback step cannot be null"));
            return this;
        }

        public Builder rollbackStrategy(RollbackStrategy rollbackStrategy) {
            this.rollbackStrategy = rollbackStrategy;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
