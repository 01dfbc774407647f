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

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.workflow.ValidationResult;
import dev.mars.stratus.workflow.WorkflowStep;
import dev.mars.stratus.workflow.WorkflowValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns the step dependency graph into an ordered sequence of concurrency-bounded
 * execution batches.
 *
 * <p>{@code dependsOn} is authoritative. {@code parallelGroup} never changes which
 * batch a step lands in; it is only reported on batches whose members share it.
 * A layer larger than {@code maxConcurrency} is split into consecutive sub-batches,
 * which keeps the dependency guarantee because members of a layer never depend on
 * each other.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class DependencyScheduler {

    private static final Logger logger = Logger.getLogger(DependencyScheduler.class.getName());

    /**
     * Checks step names and dependency references without throwing.
     * Reports duplicate names, self dependencies, unknown dependencies and the
     * first dependency cycle found.
     *
     * @param steps the workflow steps
     * @return validation result with coded issues
     */
    public ValidationResult validate(List<WorkflowStep> steps) {
        ValidationResult result = new ValidationResult();
        Set<String> seen = new HashSet<>();

        for (WorkflowStep step : steps) {
            String name = step.getName();
            if (name == null || name.isBlank()) {
                continue;
            }
            if (!seen.add(name)) {
                result.addError(ErrorCode.VALIDATION_ERROR.code(), "steps." + name,
                        "Duplicate step name '" + name + "'");
            }
            if (step.getDependsOn().contains(name)) {
                result.addError(ErrorCode.CYCLIC_DEPENDENCY.code(), "steps." + name + ".dependsOn",
                        "Step '" + name + "' cannot depend on itself");
            }
        }

        DependencyGraph graph = buildGraph(steps);
        for (String name : graph.getNodes()) {
            for (String missing : graph.findMissingDependencies(name)) {
                result.addError(ErrorCode.MISSING_DEPENDENCY.code(), "steps." + name + ".dependsOn",
                        ErrorCode.MISSING_DEPENDENCY.formatMessage(name, missing));
            }
        }

        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent() && cycle.get().size() > 2) {
            result.addError(ErrorCode.CYCLIC_DEPENDENCY.code(), "steps." + cycle.get().get(0) + ".dependsOn",
                    ErrorCode.CYCLIC_DEPENDENCY.formatMessage(String.join(" -> ", cycle.get())));
        }

        return result;
    }

    /**
     * Computes execution batches.
     *
     * @param steps the workflow steps in definition order
     * @param maxConcurrency the largest batch allowed, at least 1
     * @return batches numbered from 1
     * @throws WorkflowValidationException if the steps reference unknown steps or form a cycle
     */
    public List<ExecutionBatch> schedule(List<WorkflowStep> steps, int maxConcurrency)
            throws WorkflowValidationException {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }

        ValidationResult validation = validate(steps);
        if (!validation.isValid()) {
            ValidationResult.ValidationIssue first = validation.getErrors().get(0);
            throw new WorkflowValidationException(
                    ErrorCode.fromCode(first.getCode()).orElse(ErrorCode.VALIDATION_ERROR), first.getMessage());
        }

        Map<String, WorkflowStep> byName = new LinkedHashMap<>();
        for (WorkflowStep step : steps) {
            byName.put(step.getName(), step);
        }

        List<ExecutionBatch> batches = new ArrayList<>();
        for (List<String> layer : buildGraph(steps).layers()) {
            for (int start = 0; start < layer.size(); start += maxConcurrency) {
                List<WorkflowStep> members = new ArrayList<>();
                for (String name : layer.subList(start, Math.min(layer.size(), start + maxConcurrency))) {
                    members.add(byName.get(name));
                }
                batches.add(new ExecutionBatch(batches.size() + 1, members));
            }
        }

        logger.fine("Scheduled " + steps.size() + " steps into " + batches.size() +
                " batches (maxConcurrency=" + maxConcurrency + ")");
        return batches;
    }

    /**
     * Builds the dependency graph of the given steps, skipping unnamed ones.
     */
    public DependencyGraph buildGraph(List<WorkflowStep> steps) {
        DependencyGraph graph = new DependencyGraph();
        for (WorkflowStep step : steps) {
            if (step.getName() != null && !step.getName().isBlank()) {
                graph.addNode(step.getName(), step.getDependsOn());
            }
        }
        return graph;
    }
}
