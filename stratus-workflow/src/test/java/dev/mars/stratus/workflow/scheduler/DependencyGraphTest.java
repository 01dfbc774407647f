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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-05
 */
class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testEmptyGraph() throws WorkflowValidationException {
        assertEquals(0, graph.size());
        assertTrue(graph.layers().isEmpty());
        assertFalse(graph.hasCycles());
    }

    @Test
    void testLinearDependency() throws WorkflowValidationException {
        graph.addNode("network", List.of());
        graph.addNode("database", List.of("network"));
        graph.addNode("app", List.of("database"));

        assertEquals(List.of(List.of("network"), List.of("database"), List.of("app")), graph.layers());
        assertEquals(List.of("network", "database", "app"), graph.longestPath());
        assertEquals(Set.of("database", "network"), graph.transitiveDependencies("app"));
    }

    @Test
    void testLayersKeepInsertionOrder() throws WorkflowValidationException {
        graph.addNode("dns", List.of());
        graph.addNode("cdn", List.of("dns"));
        graph.addNode("vpc", List.of());
        graph.addNode("iam", List.of());

        assertEquals(List.of(List.of("dns", "vpc", "iam"), List.of("cdn")), graph.layers());
    }

    @Test
    void testDiamondDependency() throws WorkflowValidationException {
        graph.addNode("vpc", List.of());
        graph.addNode("subnet-a", List.of("vpc"));
        graph.addNode("subnet-b", List.of("vpc"));
        graph.addNode("cluster", List.of("subnet-a", "subnet-b"));

        List<List<String>> layers = graph.layers();
        assertEquals(3, layers.size());
        assertEquals(List.of("subnet-a", "subnet-b"), layers.get(1));
        assertEquals(Set.of("subnet-a", "subnet-b"), graph.findDependents("vpc"));
        assertEquals(3, graph.longestPath().size());
    }

    @Test
    void testFindCycle() {
        graph.addNode("a", List.of("c"));
        graph.addNode("b", List.of("a"));
        graph.addNode("c", List.of("b"));

        Optional<List<String>> cycle = graph.findCycle();

        assertTrue(cycle.isPresent());
        assertEquals(cycle.get().get(0), cycle.get().get(cycle.get().size() - 1));
        assertEquals(4, cycle.get().size());
        assertTrue(graph.hasCycles());
    }

    @Test
    void testLayersRejectCycle() {
        graph.addNode("a", List.of("b"));
        graph.addNode("b", List.of("a"));

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class, graph::layers);
        assertTrue(e.hasErrorCode(ErrorCode.CYCLIC_DEPENDENCY));
    }

    @Test
    void testMissingDependenciesAreIgnoredForOrdering() throws WorkflowValidationException {
        graph.addNode("app", List.of("ghost"));

        assertEquals(List.of("ghost"), graph.findMissingDependencies("app"));
        assertFalse(graph.hasCycles());
        assertEquals(List.of(List.of("app")), graph.layers());
    }

    @Test
    void testTopologicalSortUsesTieBreak() throws WorkflowValidationException {
        graph.addNode("b", List.of());
        graph.addNode("a", List.of());
        graph.addNode("c", List.of("a", "b"));

        assertEquals(List.of("a", "b", "c"), graph.topologicalSort(Comparator.naturalOrder()));
        assertEquals(List.of("b", "a", "c"), graph.topologicalSort(Comparator.reverseOrder()));
    }

    @Test
    void testAddNodeTwiceMergesEdges() {
        graph.addNode("app", List.of("db"));
        graph.addNode("app", List.of("cache"));

        assertEquals(1, graph.size());
        assertEquals(Set.of("db", "cache"), graph.getDependencies("app"));
    }
}
