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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a run that step conditions are evaluated against. Custom
 * expressions see its properties by name, e.g.
 * {@code completedSteps.contains('plan') and outputs['plan']['changes'] > 0}.
 */
public final class ConditionContext {

    private final String workflowName;
    private final List<String> completedSteps;
    private final List<String> failedSteps;
    private final Map<String, Map<String, Object>> outputs;
    private final Map<String, Object> state;

    public ConditionContext(String workflowName, List<String> completedSteps, List<String> failedSteps,
                            Map<String, Map<String, Object>> outputs, Map<String, Object> state) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
        this.failedSteps = failedSteps != null ? List.copyOf(failedSteps) : List.of();
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.state = state != null ? Collections.unmodifiableMap(new LinkedHashMap<>(state)) : Map.of();
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<String> getCompletedSteps() {
        return completedSteps;
    }

    public List<String> getFailedSteps() {
        return failedSteps;
    }

    /**
     * Outputs recorded by completed steps, keyed by step name.
     */
    public Map<String, Map<String, Object>> getOutputs() {
        return outputs;
    }

    /**
     * Infrastructure state as last loaded from the state backend; empty without one.
     */
    public Map<String, Object> getState() {
        return state;
    }

    public ConditionContext withState(Map<String, Object> newState) {
        return new ConditionContext(workflowName, completedSteps, failedSteps, outputs, newState);
    }
}
