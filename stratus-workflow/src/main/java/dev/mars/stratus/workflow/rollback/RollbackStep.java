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

import dev.mars.stratus.workflow.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A compensating step: an ordinary workflow step plus rollback metadata.
 *
 * <p>{@code dependencies} name other rollback steps that must run first.
 * {@code compensates} names the forward step this one undoes; selective and
 * progressive rollbacks use it to pick and order steps. {@code resources} lists
 * the resource addresses the step touches.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public final class RollbackStep {

    private final WorkflowStep step;
    private final RollbackType rollbackType;
    private final RollbackPriority priority;
    private final List<String> dependencies;
    private final Map<String, Object> rollbackData;
    private final List<String> resources;
    private final String compensates;

    private RollbackStep(Builder builder) {
        this.step = Objects.requireNonNull(builder.step, "Step cannot be null");
        this.rollbackType = Objects.requireNonNull(builder.rollbackType, "Rollback type cannot be null");
        this.priority = builder.priority != null ? builder.priority : RollbackPriority.MEDIUM;
        this.dependencies = List.copyOf(new LinkedHashSet<>(builder.dependencies));
        this.rollbackData = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rollbackData));
        this.resources = List.copyOf(builder.resources);
        this.compensates = builder.compensates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return step.getName();
    }

    public WorkflowStep getStep() {
        return step;
    }

    public RollbackType getRollbackType() {
        return rollbackType;
    }

    public RollbackPriority getPriority() {
        return priority;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public Map<String, Object> getRollbackData() {
        return rollbackData;
    }

    public List<String> getResources() {
        return resources;
    }

    public Optional<String> getCompensates() {
        return Optional.ofNullable(compensates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollbackStep that = (RollbackStep) o;
        return step.equals(that.step) &&
               rollbackType == that.rollbackType &&
               priority == that.priority &&
               dependencies.equals(that.dependencies) &&
               rollbackData.equals(that.rollbackData) &&
               resources.equals(that.resources) &&
               Objects.equals(compensates, that.compensates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, rollbackType, priority, dependencies, rollbackData, resources, compensates);
    }

    @Override
    public String toString() {
        return "RollbackStep{" +
               "name='" + getName() + '\'' +
               ", rollbackType=" + rollbackType.value() +
               ", priority=" + priority.value() +
               ", dependencies=" + dependencies +
               ", compensates='" + compensates + '\'' +
               '}';
    }

    public static class Builder {
        private WorkflowStep step;
        private RollbackType rollbackType = RollbackType.CUSTOM;
        private RollbackPriority priority = RollbackPriority.MEDIUM;
        private List<String> dependencies = new ArrayList<>();
        private Map<String, Object> rollbackData = new LinkedHashMap<>();
        private List<String> resources = new ArrayList<>();
        private String compensates;

        public Builder step(WorkflowStep step) {
            this.step = step;
            return this;
        }

        public Builder rollbackType(RollbackType rollbackType) {
            this.rollbackType = rollbackType;
            return this;
        }

        public Builder priority(RollbackPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
            return this;
        }

        public Builder dependencies(String... dependencies) {
            return dependencies(List.of(dependencies));
        }

        public Builder rollbackData(Map<String, Object> rollbackData) {
            this.rollbackData = new LinkedHashMap<>();
            if (rollbackData != null) {
                rollbackData.forEach((key, value) -> {
                    if (key != null && value != null) {
                        this.rollbackData.put(key, value);
                    }
                });
            }
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources = resources != null ? new ArrayList<>(resources) : new ArrayList<>();
            return this;
        }

        public Builder resources(String... resources) {
            return resources(List.of(resources));
        }

        public Builder compensates(String compensates) {
            this.compensates = compensates;
            return this;
        }

        public RollbackStep build() {
            return new RollbackStep(this);
        }
    }
}
