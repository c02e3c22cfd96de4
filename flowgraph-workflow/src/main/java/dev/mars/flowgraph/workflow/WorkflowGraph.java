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

import java.util.*;

/**
 * Index over the nodes and edges of a workflow definition.
 * Provides topological sorting and cycle detection over forward edges, reachability,
 * and the structural queries the engine needs for LOOP bodies and PARALLEL branches.
 * <p>
 * Edges are addressed by their position in {@link WorkflowDefinition#getEdges()}.
 */
public class WorkflowGraph {

    private final WorkflowDefinition definition;
    private final Map<String, WorkflowNode> nodes;
    private final Map<String, List<Integer>> outgoing;
    private final Map<String, List<Integer>> incoming;

    public WorkflowGraph(WorkflowDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.nodes = definition.getNodeMap();
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();

        List<WorkflowEdge> edges = definition.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            WorkflowEdge edge = edges.get(i);
            outgoing.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(i);
            incoming.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(i);
        }
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public WorkflowNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public WorkflowEdge getEdge(int index) {
        return definition.getEdges().get(index);
    }

    public int getEdgeCount() {
        return definition.getEdges().size();
    }

    /**
     * Gets the indices of the edges leaving a node, in declaration order.
     */
    public List<Integer> getOutgoingEdgeIndices(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<Integer> getIncomingEdgeIndices(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    /**
     * Gets the incoming edges that are not loop-back edges.
     */
    public List<Integer> getForwardIncomingEdgeIndices(String nodeId) {
        List<Integer> result = new ArrayList<>();
        for (int index : getIncomingEdgeIndices(nodeId)) {
            if (!getEdge(index).isLoopBack()) {
                result.add(index);
            }
        }
        return result;
    }

    public List<WorkflowEdge> getOutgoingEdges(String nodeId) {
        return toEdges(getOutgoingEdgeIndices(nodeId));
    }

    public List<WorkflowEdge> getIncomingEdges(String nodeId) {
        return toEdges(getIncomingEdgeIndices(nodeId));
    }

    /**
     * Performs topological sort over forward edges to determine a possible execution order.
     *
     * @return node ids in execution order
     * @throws WorkflowParseException if a cycle not closed by a loop-back edge exists
     */
    public List<String> topologicalSort() throws WorkflowParseException {
        // Kahn's algorithm for topological sorting
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new LinkedList<>();
        List<String> result = new ArrayList<>();

        // Find all nodes with no incoming edges, keeping declaration order
        for (String nodeId : nodes.keySet()) {
            if (inDegree.get(nodeId) == 0) {
                queue.offer(nodeId);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);

            // Remove edges from current node
            for (String dependent : forwardSuccessors(current)) {
                inDegree.put(dependent, inDegree.get(dependent) - 1);
                if (inDegree.get(dependent) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        // Check for circular dependencies
        if (result.size() != nodes.size()) {
            List<String> remaining = new ArrayList<>(nodes.keySet());
            remaining.removeAll(result);
            throw new WorkflowParseException("Cycle detected among nodes: " + remaining);
        }

        return result;
    }

    /**
     * Detects cycles that are not closed by a loop-back edge.
     *
     * @return true if such cycles exist
     */
    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (WorkflowParseException e) {
            return true;
        }
    }

    /**
     * Finds the cycles formed by forward edges. Each cycle is listed from its first visited node.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        Deque<String> path = new ArrayDeque<>();

        for (String nodeId : nodes.keySet()) {
            if (!state.containsKey(nodeId)) {
                visitForCycles(nodeId, state, path, cycles, seen);
            }
        }
        return cycles;
    }

    private void visitForCycles(String nodeId, Map<String, Integer> state, Deque<String> path,
                                List<List<String>> cycles, Set<Set<String>> seen) {
        state.put(nodeId, 1);
        path.addLast(nodeId);
        for (String next : forwardSuccessors(nodeId)) {
            Integer nextState = state.get(next);
            if (nextState == null) {
                visitForCycles(next, state, path, cycles, seen);
            } else if (nextState == 1) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(next)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                if (seen.add(new HashSet<>(cycle))) {
                    cycles.add(cycle);
                }
            }
        }
        path.removeLast();
        state.put(nodeId, 2);
    }

    /**
     * Computes every node reachable from the given node, following all edges. The node itself is included.
     */
    public Set<String> reachableFrom(String nodeId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        if (nodes.containsKey(nodeId)) {
            visited.add(nodeId);
            queue.add(nodeId);
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (WorkflowEdge edge : getOutgoingEdges(current)) {
                if (nodes.containsKey(edge.getTo()) && visited.add(edge.getTo())) {
                    queue.add(edge.getTo());
                }
            }
        }
        return visited;
    }

    /**
     * Gets the join group a PARALLEL node forks for: its {@code joinGroup} setting, or its own id.
     */
    public String getJoinGroup(WorkflowNode parallel) {
        return parallel.getConfigString("joinGroup", parallel.getId());
    }

    /**
     * Finds the PARALLEL nodes forking for the given join group.
     */
    public List<WorkflowNode> findParallels(String joinGroup) {
        List<WorkflowNode> result = new ArrayList<>();
        for (WorkflowNode node : nodes.values()) {
            if (node.getKind() == NodeKind.PARALLEL && getJoinGroup(node).equals(joinGroup)) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Computes the body of a LOOP node: the nodes reachable from its {@code body} entry, without
     * passing through the LOOP, that lead back to one of the loop-back edges closing it.
     */
    public Set<String> getLoopBody(String loopId) {
        WorkflowNode loop = nodes.get(loopId);
        if (loop == null) {
            return Set.of();
        }
        String entry = loop.getConfigString("body");
        if (entry == null || !nodes.containsKey(entry) || entry.equals(loopId)) {
            return Set.of();
        }

        Set<String> forward = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        forward.add(entry);
        queue.add(entry);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (WorkflowEdge edge : getOutgoingEdges(current)) {
                String target = edge.getTo();
                if (!target.equals(loopId) && nodes.containsKey(target) && forward.add(target)) {
                    queue.add(target);
                }
            }
        }

        Set<String> backward = new HashSet<>();
        for (WorkflowEdge edge : getIncomingEdges(loopId)) {
            if (edge.isLoopBack() && backward.add(edge.getFrom())) {
                queue.add(edge.getFrom());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (WorkflowEdge edge : getIncomingEdges(current)) {
                String source = edge.getFrom();
                if (!source.equals(loopId) && nodes.containsKey(source) && backward.add(source)) {
                    queue.add(source);
                }
            }
        }

        Set<String> body = new LinkedHashSet<>();
        body.add(entry);
        for (String nodeId : forward) {
            if (backward.contains(nodeId)) {
                body.add(nodeId);
            }
        }
        return Collections.unmodifiableSet(body);
    }

    /**
     * Computes the branches forked by a PARALLEL node: for each outgoing edge, the nodes reachable
     * from its target, stopping at the matching JOIN.
     */
    public List<Set<String>> getParallelBranches(String parallelId, String joinId) {
        List<Set<String>> branches = new ArrayList<>();
        for (WorkflowEdge edge : getOutgoingEdges(parallelId)) {
            Set<String> branch = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            if (!edge.getTo().equals(joinId) && nodes.containsKey(edge.getTo())) {
                branch.add(edge.getTo());
                queue.add(edge.getTo());
            }
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (WorkflowEdge next : getOutgoingEdges(current)) {
                    String target = next.getTo();
                    if (!target.equals(joinId) && !target.equals(parallelId)
                            && nodes.containsKey(target) && branch.add(target)) {
                        queue.add(target);
                    }
                }
            }
            branches.add(Collections.unmodifiableSet(branch));
        }
        return branches;
    }

    private List<String> forwardSuccessors(String nodeId) {
        List<String> successors = new ArrayList<>();
        for (WorkflowEdge edge : getOutgoingEdges(nodeId)) {
            if (!edge.isLoopBack() && nodes.containsKey(edge.getTo())) {
                successors.add(edge.getTo());
            }
        }
        return successors;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new HashMap<>();

        // Initialize all nodes with 0 in-degree
        for (String nodeId : nodes.keySet()) {
            inDegree.put(nodeId, 0);
        }

        // Calculate in-degree for each node
        for (String nodeId : nodes.keySet()) {
            for (String successor : forwardSuccessors(nodeId)) {
                inDegree.put(successor, inDegree.get(successor) + 1);
            }
        }

        return inDegree;
    }

    private List<WorkflowEdge> toEdges(List<Integer> indices) {
        List<WorkflowEdge> result = new ArrayList<>(indices.size());
        for (int index : indices) {
            result.add(getEdge(index));
        }
        return result;
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
               "workflow=" + definition.getId() +
               ", nodes=" + nodes.keySet() +
               ", edges=" + definition.getEdges().size() +
               '}';
    }
}
