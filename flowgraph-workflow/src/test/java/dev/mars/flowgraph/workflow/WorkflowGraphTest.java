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

package dev.mars.flowgraph.workflow;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowGraph indexing and graph algorithms.
 */
class WorkflowGraphTest {

    @Test
    void testTopologicalSortFollowsEdges() throws WorkflowParseException {
        WorkflowGraph graph = new WorkflowGraph(WorkflowBuilder.create("linear", "Linear")
                .start("start")
                .agentExecute("b", "second")
                .agentExecute("a", "first")
                .end("end")
                .connect("start", "a")
                .connect("a", "b")
                .connect("b", "end")
                .buildUnvalidated());

        List<String> order = graph.topologicalSort();

        assertEquals(List.of("start", "a", "b", "end"), order);
        assertFalse(graph.hasCycles());
    }

    @Test
    void testLoopBackEdgesAreNotCycles() throws WorkflowParseException {
        WorkflowGraph graph = new WorkflowGraph(loopWorkflow());

        assertFalse(graph.hasCycles());
        assertTrue(graph.findCycles().isEmpty());
        assertEquals(5, graph.topologicalSort().size());
    }

    @Test
    void testUnmarkedCycleIsReported() {
        WorkflowGraph graph = new WorkflowGraph(WorkflowBuilder.create("cyclic", "Cyclic")
                .start("start")
                .agentExecute("a", "a")
                .agentExecute("b", "b")
                .end("end")
                .connect("start", "a")
                .connect("a", "b")
                .connect("b", "a")
                .connect("b", "end")
                .buildUnvalidated());

        assertTrue(graph.hasCycles());
        WorkflowParseException exception = assertThrows(WorkflowParseException.class, graph::topologicalSort);
        assertTrue(exception.getMessage().contains("Cycle detected"));
        List<List<String>> cycles = graph.findCycles();
        assertEquals(1, cycles.size());
        assertEquals(Set.of("a", "b"), Set.copyOf(cycles.get(0)));
    }

    @Test
    void testEdgeIndices() {
        WorkflowGraph graph = new WorkflowGraph(loopWorkflow());

        assertEquals(2, graph.getOutgoingEdgeIndices("refine").size());
        assertEquals(2, graph.getIncomingEdgeIndices("refine").size());
        assertEquals(1, graph.getForwardIncomingEdgeIndices("refine").size());
        assertTrue(graph.getOutgoingEdgeIndices("unknown").isEmpty());
    }

    @Test
    void testLoopBody() {
        WorkflowGraph graph = new WorkflowGraph(WorkflowBuilder.create("loop", "Loop")
                .start("start")
                .loopTimes("repeat", "fetch", 3, 5)
                .agentExecute("fetch", "fetch")
                .agentExecute("store", "store")
                .end("end")
                .connect("start", "repeat")
                .connect("repeat", "fetch")
                .connect("fetch", "store")
                .loopBack("store", "repeat")
                .connect("repeat", "end")
                .buildUnvalidated());

        assertEquals(Set.of("fetch", "store"), graph.getLoopBody("repeat"));
        assertTrue(graph.getLoopBody("fetch").isEmpty());
    }

    @Test
    void testParallelBranchesStopAtJoin() {
        WorkflowGraph graph = new WorkflowGraph(WorkflowBuilder.create("fork", "Fork")
                .start("start")
                .parallel("fork")
                .agentExecute("a1", "a1")
                .agentExecute("a2", "a2")
                .agentExecute("b1", "b1")
                .join("merge", "fork", BranchFailurePolicy.FAIL_FAST)
                .end("end")
                .connect("start", "fork")
                .connect("fork", "a1")
                .connect("a1", "a2")
                .connect("a2", "merge")
                .connect("fork", "b1")
                .connect("b1", "merge")
                .connect("merge", "end")
                .buildUnvalidated());

        List<Set<String>> branches = graph.getParallelBranches("fork", "merge");

        assertEquals(2, branches.size());
        assertEquals(Set.of("a1", "a2"), branches.get(0));
        assertEquals(Set.of("b1"), branches.get(1));
        assertEquals(1, graph.findParallels("fork").size());
    }

    @Test
    void testReachability() {
        WorkflowGraph graph = new WorkflowGraph(loopWorkflow());

        Set<String> reachable = graph.reachableFrom("start");

        assertEquals(5, reachable.size());
        assertEquals(Set.of("end"), graph.reachableFrom("end"));
        assertTrue(graph.reachableFrom("missing").isEmpty());
    }

    private WorkflowDefinition loopWorkflow() {
        return WorkflowBuilder.create("refinement", "Refinement")
                .start("start")
                .agentExecute("draft", "draft")
                .loop("refine", "improve", "score < 8", 3)
                .agentExecute("improve", "improve")
                .end("end")
                .connect("start", "draft")
                .connect("draft", "refine")
                .connect("refine", "improve")
                .loopBack("improve", "refine")
                .connect("refine", "end")
                .buildUnvalidated();
    }
}
