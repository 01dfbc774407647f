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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One named unit of work in a workflow, invoking an opaque backend command.
 *
 * <p>Steps are immutable. Required fields are not enforced here so that
 * {@code validateWorkflow} can report every missing field instead of failing on
 * the first one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
public final class WorkflowStep {

    private final String name;
    private final String description;
    private final String command;
    private final List<String> args;
    private final Map<String, Object> options;
    private final List<String> dependsOn;
    private final String parallelGroup;
    private final StepCondition condition;
    private final RetryPolicy retry;
    private final Duration timeout;

    private WorkflowStep(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.command = builder.command;
        this.args = List.copyOf(builder.args);
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.dependsOn = List.copyOf(new LinkedHashSet<>(builder.dependsOn));
        this.parallelGroup = builder.parallelGroup;
        this.condition = builder.condition;
        this.retry = builder.retry;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * Returns a builder pre-populated with this step's fields.
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .description(description)
                .command(command)
                .args(args)
                .options(options)
                .dependsOn(dependsOn)
                .parallelGroup(parallelGroup)
                .condition(condition)
                .retry(retry)
                .timeout(timeout);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * Names of the steps that must reach a terminal outcome before this one starts.
     * Duplicates are removed, declaration order is kept.
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Optional<String> getParallelGroup() {
        return Optional.ofNullable(parallelGroup);
    }

    public Optional<StepCondition> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Optional<RetryPolicy> getRetry() {
        return Optional.ofNullable(retry);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(command, that.command) &&
               Objects.equals(args, that.args) &&
               Objects.equals(options, that.options) &&
               Objects.equals(dependsOn, that.dependsOn) &&
               Objects.equals(parallelGroup, that.parallelGroup) &&
               Objects.equals(condition, that.condition) &&
               Objects.equals(retry, that.retry) &&
               Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, command, args, options, dependsOn, parallelGroup,
                condition, retry, timeout);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "name='" + name + '\'' +
               ", command='" + command + '\'' +
               ", dependsOn=" + dependsOn +
               (parallelGroup != null ? ", parallelGroup='" + parallelGroup + '\'' : "") +
               '}';
    }

    public static class Builder {
        private String name;
        private String description;
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, Object> options = new LinkedHashMap<>();
        private List<String> dependsOn = new ArrayList<>();
        private String parallelGroup;
        private StepCondition condition;
        private RetryPolicy retry;
        private Duration timeout;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args != null ? new ArrayList<>(args) : new ArrayList<>();
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = new LinkedHashMap<>();
            if (options != null) {
                options.forEach((key, value) -> {
                    if (key != null && value != null) {
                        this.options.put(key, value);
                    }
                });
            }
            return this;
        }

        public Builder option(String key, Object value) {
            this.options.put(Objects.requireNonNull(key, "Option key cannot be null"),
                    Objects.requireNonNull(value, "Option value cannot be null"));
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn != null ? new ArrayList<>(dependsOn) : new ArrayList<>();
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            return dependsOn(List.of(dependsOn));
        }

        public Builder parallelGroup(String parallelGroup) {
            this.parallelGroup = parallelGroup;
            return this;
        }

        public Builder condition(StepCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = retry;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(this);
        }
    }
}
