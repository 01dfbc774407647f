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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * When a rollback fires and how it runs. Strategy-level rollback steps are merged
 * with the workflow definition's own rollback steps when a plan is built.
 */
public final class RollbackStrategy {

    private final RollbackStrategyType type;
    private final List<RollbackTriggerCondition> triggerConditions;
    private final List<RollbackStep> rollbackSteps;
    private final RollbackOptions options;

    private RollbackStrategy(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Strategy type cannot be null");
        this.triggerConditions = List.copyOf(builder.triggerConditions);
        this.rollbackSteps = List.copyOf(builder.rollbackSteps);
        this.options = builder.options != null ? builder.options : RollbackOptions.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RollbackStrategy automatic() {
        return builder().build();
    }

    public RollbackStrategyType getType() {
        return type;
    }

    /**
     * Conditions of which at least one must match. Empty means every trigger fires.
     */
    public List<RollbackTriggerCondition> getTriggerConditions() {
        return triggerConditions;
    }

    public List<RollbackStep> getRollbackSteps() {
        return rollbackSteps;
    }

    public RollbackOptions getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollbackStrategy that = (RollbackStrategy) o;
        return type == that.type &&
               triggerConditions.equals(that.triggerConditions) &&
               rollbackSteps.equals(that.rollbackSteps) &&
               options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, triggerConditions, rollbackSteps, options);
    }

    @Override
    public String toString() {
        return "RollbackStrategy{" +
               "type=" + type.value() +
               ", triggerConditions=" + triggerConditions +
               ", rollbackSteps=" + rollbackSteps.size() +
               ", options=" + options +
               '}';
    }

    public static class Builder {
        private RollbackStrategyType type = RollbackStrategyType.AUTOMATIC;
        private List<RollbackTriggerCondition> triggerConditions = new ArrayList<>();
        private List<RollbackStep> rollbackSteps = new ArrayList<>();
        private RollbackOptions options;

        public Builder type(RollbackStrategyType type) {
            this.type = type;
            return this;
        }

        public Builder triggerConditions(List<RollbackTriggerCondition> triggerConditions) {
            this.triggerConditions = triggerConditions != null
                    ? new ArrayList<>(triggerConditions) : new ArrayList<>();
            return this;
        }

        public Builder triggerCondition(RollbackTriggerCondition condition) {
            this.triggerConditions.add(Objects.requireNonNull(condition, "Trigger condition cannot be null"));
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

        public Builder options(RollbackOptions options) {
            this.options = options;
            return this;
        }

        public RollbackStrategy build() {
            return new RollbackStrategy(this);
        }
    }
}
