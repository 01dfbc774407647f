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
import dev.mars.stratus.workflow.WorkflowValidationException;

import java.util.*;

/**
 * Directed dependency graph over named nodes. Used for workflow steps and for the
 * much smaller graph of rollback steps.
 *
 * <p>Edges pointing at unknown nodes are kept for reporting but ignored by
 * ordering. Iteration follows insertion order, so results are deterministic.</p>
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
    }

    /**
     * Adds a node with its dependencies. Adding the same name twice merges the edges.
     *
     * @param name the node name
     * @param dependsOn names of the nodes this one depends on
     */
    public void addNode(String name, Collection<String> dependsOn) {
        Objects.requireNonNull(name, "Node name cannot be null");
        Set<String> edges = dependencies.computeIfAbsent(name, key -> new LinkedHashSet<>());
        if (dependsOn != null) {
            edges.addAll(dependsOn);
        }
    }

    public boolean contains(String name) {
        return dependencies.containsKey(name);
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    public int size() {
        return dependencies.size();
    }

    /**
     * Gets the declared dependencies for a node.
     *
     * @param name the node name
     * @return set of dependency names, including unknown ones
     */
    public Set<String> getDependencies(String name) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(name, Set.of()));
    }

    /**
     * Returns the nodes that depend directly on the given node.
     */
    public Set<String> findDependents(String name) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(name)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Returns every node reachable by following dependency edges from the given node.
     */
    public Set<String> transitiveDependencies(String name) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(getDependencies(name));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (contains(current) && visited.add(current)) {
                stack.addAll(getDependencies(current));
            }
        }
        return visited;
    }

    /**
     * Returns the dependency names of a node that are not nodes of this graph.
     */
    public List<String> findMissingDependencies(String name) {
        List<String> missing = new ArrayList<>();
        for (String dependency : getDependencies(name)) {
            if (!dependencies.containsKey(dependency)) {
                missing.add(dependency);
            }
        }
        return missing;
    }

    /**
     * Finds the first cycle by depth-first search with a recursion stack.
     *
     * @return the cycle as a path that starts and ends with the same node, or empty if acyclic
     */
    public Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Deque<String> recursionStack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();

        for (String node : dependencies.keySet()) {
            if (!visited.contains(node)) {
                List<String> cycle = visit(node, visited, recursionStack, onStack);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String node, Set<String> visited, Deque<String> recursionStack, Set<String> onStack) {
        visited.add(node);
        recursionStack.addLast(node);
        onStack.add(node);

        for (String dependency : getDependencies(node)) {
            if (!contains(dependency)) {
                continue;
            }
            if (onStack.contains(dependency)) {
                List<String> path = new ArrayList<>(recursionStack);
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return cycle;
            }
            if (!visited.contains(dependency)) {
                List<String> cycle = visit(dependency, visited, recursionStack, onStack);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        recursionStack.removeLast();
        onStack.remove(node);
        return null;
    }

    public boolean hasCycles() {
        return findCycle().isPresent();
    }

    /**
     * Splits the graph into topological layers: layer i holds every node whose
     * dependencies all sit in layers before i. Nodes keep insertion order within a layer.
     *
     * @throws WorkflowValidationException if the graph contains a cycle
     */
    public List<List<String>> layers() throws WorkflowValidationException {
        requireAcyclic();

        List<List<String>> layers = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new HashSet<>();

        while (processed.size() < dependencies.size()) {
            List<String> layer = new ArrayList<>();
            for (String node : dependencies.keySet()) {
                if (!processed.contains(node) && inDegree.get(node) == 0) {
                    layer.add(node);
                }
            }

            if (layer.isEmpty()) {
                throw cycleException(List.of());
            }

            processed.addAll(layer);
            layers.add(layer);

            for (String node : layer) {
                for (String dependent : findDependents(node)) {
                    inDegree.put(dependent, inDegree.get(dependent) - 1);
                }
            }
        }

        return layers;
    }

    /**
     * Orders all nodes so every node follows its dependencies, choosing among ready
     * nodes with the given comparator (Kahn's algorithm).
     *
     * @throws WorkflowValidationException if the graph contains a cycle
     */
    public List<String> topologicalSort(Comparator<String> tieBreak) throws WorkflowValidationException {
        requireAcyclic();

        Map<String, Integer> inDegree = calculateInDegree();
        PriorityQueue<String> ready = new PriorityQueue<>(tieBreak);
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.offer(entry.getKey());
            }
        }

        while (!ready.isEmpty()) {
            String current = ready.poll();
            result.add(current);

            for (String dependent : findDependents(current)) {
                inDegree.put(dependent, inDegree.get(dependent) - 1);
                if (inDegree.get(dependent) == 0) {
                    ready.offer(dependent);
                }
            }
        }

        return result;
    }

    /**
     * Returns the longest chain of dependent nodes, ending at the deepest node.
     *
     * @throws WorkflowValidationException if the graph contains a cycle
     */
    public List<String> longestPath() throws WorkflowValidationException {
        Map<String, List<String>> bestPath = new HashMap<>();
        List<String> longest = List.of();

        for (List<String> layer : layers()) {
            for (String node : layer) {
                List<String> best = List.of();
                for (String dependency : getDependencies(node)) {
                    List<String> candidate = bestPath.get(dependency);
                    if (candidate != null && candidate.size() > best.size()) {
                        best = candidate;
                    }
                }
                List<String> path = new ArrayList<>(best);
                path.add(node);
                bestPath.put(node, path);
                if (path.size() > longest.size()) {
                    longest = path;
                }
            }
        }

        return List.copyOf(longest);
    }

    private void requireAcyclic() throws WorkflowValidationException {
        Optional<List<String>> cycle = findCycle();
        if (cycle.isPresent()) {
            throw cycleException(cycle.get());
        }
    }

    private static WorkflowValidationException cycleException(List<String> cycle) {
        return new WorkflowValidationException(ErrorCode.CYCLIC_DEPENDENCY,
                ErrorCode.CYCLIC_DEPENDENCY.formatMessage(String.join(" -> ", cycle)));
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int count = 0;
            for (String dependency : entry.getValue()) {
                if (contains(dependency)) {
                    count++;
                }
            }
            inDegree.put(entry.getKey(), count);
        }

        return inDegree;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "nodes=" + dependencies.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
