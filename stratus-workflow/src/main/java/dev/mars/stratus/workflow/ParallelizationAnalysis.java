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

/**
 * Static parallelism analysis of a workflow definition.
 *
 * @param totalSteps          number of steps
 * @param batches             step names per execution batch, ignoring concurrency limits
 * @param parallelizableSteps steps sharing a batch with at least one other step
 * @param dependencies        declared dependencies per step
 * @param parallelGroups      declared parallel groups and their members
 * @param criticalPath        longest dependency chain
 * @param maxParallelism      size of the widest batch
 * @param estimatedSpeedup    sequential step count divided by batch count
 */
public record ParallelizationAnalysis(int totalSteps, List<List<String>> batches, List<String> parallelizableSteps,
                                      Map<String, List<String>> dependencies,
                                      Map<String, List<String>> parallelGroups, List<String> criticalPath,
                                      int maxParallelism, double estimatedSpeedup) {

    public ParallelizationAnalysis {
        batches = batches.stream().map(List::copyOf).toList();
        parallelizableSteps = List.copyOf(parallelizableSteps);
        dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        parallelGroups = Collections.unmodifiableMap(new LinkedHashMap<>(parallelGroups));
        criticalPath = List.copyOf(criticalPath);
    }
}
