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

package dev.mars.flowgraph.workflow.engine;

import dev.mars.flowgraph.workflow.Condition;
import dev.mars.flowgraph.workflow.NodeKind;
import dev.mars.flowgraph.workflow.WorkflowDefinition;
import dev.mars.flowgraph.workflow.WorkflowEdge;
import dev.mars.flowgraph.workflow.WorkflowGraph;
import dev.mars.flowgraph.workflow.WorkflowNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of one execution. Every access happens while holding the run's monitor.
 * <p>
 * Each dispatch of a node hands out a token; callbacks (worker results, timers) carry the token
 * they were issued with and are ignored once the node has been re-dispatched, reset or cancelled.
 */
final class WorkflowRun {

    private final String executionId;
    private final WorkflowDefinition definition;
    private final WorkflowGraph graph;
    private final Map<String, NodeState> nodeStates = new LinkedHashMap<>();
    private final EdgeStatus[] edgeStatuses;
    private final Map<String, Object> variables = new HashMap<>();
    private final Map<String, Integer> loopIterations = new HashMap<>();
    private final List<NodeFailure> failures = new ArrayList<>();
    private final CompletableFuture<WorkflowExecution> completion = new CompletableFuture<>();

    private final Map<String, Long> tokens = new HashMap<>();
    private final Map<String, Future<?>> inflight = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> timers = new HashMap<>();
    private final Set<String> backoffPending = new HashSet<>();
    private final Map<String, Set<String>> loopBodies = new HashMap<>();
    private final Map<String, List<Set<String>>> joinBranches = new HashMap<>();
    private final Map<String, Condition> loopConditions = new HashMap<>();

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant startTime;
    private Instant endTime;
    private String completedBy;
    private long tokenSequence;
    private boolean detached;
    private boolean paused;
    private ScheduledFuture<?> runTimer;

    WorkflowRun(String executionId, WorkflowDefinition definition, WorkflowGraph graph, Map<String, Object> initialVariables) {
        this.executionId = executionId;
        this.definition = definition;
        this.graph = graph;
        this.edgeStatuses = new EdgeStatus[graph.getEdgeCount()];
        Arrays.fill(edgeStatuses, EdgeStatus.PENDING);
        for (WorkflowNode node : definition.getNodes()) {
            nodeStates.putIfAbsent(node.getId(), NodeState.pending());
        }
        if (initialVariables != null) {
            variables.putAll(initialVariables);
        }
    }

    /**
     * Rebuilds a run from a stored snapshot.
     */
    static WorkflowRun fromSnapshot(WorkflowExecution snapshot, WorkflowGraph graph) {
        WorkflowRun run = new WorkflowRun(snapshot.getExecutionId(), snapshot.getDefinition(), graph,
                snapshot.getVariables());
        run.nodeStates.putAll(snapshot.getNodeStates());
        List<EdgeStatus> stored = snapshot.getEdgeStatuses();
        for (int i = 0; i < stored.size() && i < run.edgeStatuses.length; i++) {
            run.edgeStatuses[i] = stored.get(i);
        }
        run.loopIterations.putAll(snapshot.getLoopIterations());
        run.failures.addAll(snapshot.getFailures());
        run.completedBy = snapshot.getCompletedBy().orElse(null);
        run.startTime = snapshot.getStartTime();
        run.status = snapshot.getStatus();
        run.paused = snapshot.getStatus() == ExecutionStatus.PAUSED;
        return run;
    }

    WorkflowExecution snapshot() {
        return WorkflowExecution.builder()
                .executionId(executionId)
                .definition(definition)
                .status(paused && status == ExecutionStatus.RUNNING ? ExecutionStatus.PAUSED : status)
                .startTime(startTime)
                .endTime(endTime)
                .variables(variables)
                .nodeStates(nodeStates)
                .failures(failures)
                .completedBy(completedBy)
                .edgeStatuses(Arrays.asList(edgeStatuses))
                .loopIterations(loopIterations)
                .build();
    }

    // ========== Identity ==========

    String getExecutionId() {
        return executionId;
    }

    WorkflowDefinition getDefinition() {
        return definition;
    }

    WorkflowGraph getGraph() {
        return graph;
    }

    CompletableFuture<WorkflowExecution> getCompletion() {
        return completion;
    }

    // ========== Run status ==========

    ExecutionStatus getStatus() {
        return status;
    }

    boolean isRunning() {
        return status == ExecutionStatus.RUNNING && !detached;
    }

    /**
     * A paused run keeps accepting results of work already dispatched but dispatches nothing new.
     */
    boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    void start(Instant now) {
        this.status = ExecutionStatus.RUNNING;
        if (startTime == null) {
            this.startTime = now;
        }
    }

    void finish(ExecutionStatus finalStatus, Instant now) {
        this.status = finalStatus;
        this.endTime = now;
    }

    Instant getStartTime() {
        return startTime;
    }

    String getCompletedBy() {
        return completedBy;
    }

    void recordEndReached(String endNodeId) {
        if (completedBy == null) {
            completedBy = endNodeId;
        }
    }

    List<NodeFailure> getFailures() {
        return failures;
    }

    void addFailure(NodeFailure failure) {
        failures.add(failure);
    }

    /**
     * Stops accepting callbacks; the stored snapshot stays as it is.
     */
    void detach() {
        detached = true;
        cancelAllTimers();
    }

    // ========== Nodes ==========

    List<WorkflowNode> getNodes() {
        return definition.getNodes();
    }

    WorkflowNode getNode(String nodeId) {
        return graph.getNode(nodeId);
    }

    NodeState getState(String nodeId) {
        return nodeStates.get(nodeId);
    }

    /**
     * Replaces a node's state.
     *
     * @return the previous state
     */
    NodeState putState(String nodeId, NodeState state) {
        return nodeStates.put(nodeId, state);
    }

    Map<String, NodeState> getNodeStates() {
        return Collections.unmodifiableMap(nodeStates);
    }

    /**
     * True when nothing can make further progress: no node is READY, RUNNING or awaiting approval
     * and no retry is waiting for its backoff.
     */
    boolean isQuiescent() {
        if (!backoffPending.isEmpty()) {
            return false;
        }
        for (NodeState state : nodeStates.values()) {
            if (state.getStatus().isActive()) {
                return false;
            }
        }
        return true;
    }

    // ========== Edges ==========

    EdgeStatus getEdgeStatus(int edgeIndex) {
        return edgeStatuses[edgeIndex];
    }

    void setEdgeStatus(int edgeIndex, EdgeStatus edgeStatus) {
        edgeStatuses[edgeIndex] = edgeStatus;
    }

    WorkflowEdge getEdge(int edgeIndex) {
        return graph.getEdge(edgeIndex);
    }

    // ========== Variables ==========

    Map<String, Object> getVariables() {
        return variables;
    }

    Map<String, Object> variablesSnapshot() {
        return Collections.unmodifiableMap(new HashMap<>(variables));
    }

    void setVariable(String name, Object value) {
        variables.put(name, value);
    }

    // ========== Loops and joins ==========

    int getLoopIteration(String loopId) {
        return loopIterations.getOrDefault(loopId, 0);
    }

    void setLoopIteration(String loopId, int iterations) {
        loopIterations.put(loopId, iterations);
    }

    void clearLoopIteration(String loopId) {
        loopIterations.remove(loopId);
    }

    Set<String> getLoopBody(String loopId) {
        return loopBodies.computeIfAbsent(loopId, graph::getLoopBody);
    }

    Condition getLoopCondition(WorkflowNode loop) {
        return loopConditions.computeIfAbsent(loop.getId(),
                id -> Condition.parse(loop.getConfigString("condition")));
    }

    /**
     * Branches forked by the PARALLEL whose join group the JOIN waits for; empty if there is no single match.
     */
    List<Set<String>> getJoinBranches(WorkflowNode join) {
        return joinBranches.computeIfAbsent(join.getId(), id -> {
            List<WorkflowNode> parallels = graph.findParallels(join.getConfigString("joinGroup"));
            if (parallels.size() != 1) {
                return List.of();
            }
            return graph.getParallelBranches(parallels.get(0).getId(), id);
        });
    }

    boolean isLoop(String nodeId) {
        WorkflowNode node = getNode(nodeId);
        return node != null && node.getKind() == NodeKind.LOOP;
    }

    // ========== Dispatch bookkeeping ==========

    long nextToken(String nodeId) {
        long token = ++tokenSequence;
        tokens.put(nodeId, token);
        return token;
    }

    boolean isCurrent(String nodeId, long token) {
        Long current = tokens.get(nodeId);
        return isRunning() && current != null && current == token;
    }

    void invalidate(String nodeId) {
        tokens.remove(nodeId);
    }

    void setInflight(String nodeId, Future<?> future) {
        inflight.put(nodeId, future);
    }

    Future<?> removeInflight(String nodeId) {
        return inflight.remove(nodeId);
    }

    void setTimer(String nodeId, ScheduledFuture<?> timer) {
        ScheduledFuture<?> previous = timers.put(nodeId, timer);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    void cancelTimer(String nodeId) {
        ScheduledFuture<?> timer = timers.remove(nodeId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    void setRunTimer(ScheduledFuture<?> timer) {
        this.runTimer = timer;
    }

    void cancelAllTimers() {
        if (runTimer != null) {
            runTimer.cancel(false);
            runTimer = null;
        }
        for (ScheduledFuture<?> timer : timers.values()) {
            timer.cancel(false);
        }
        timers.clear();
    }

    void markBackoff(String nodeId) {
        backoffPending.add(nodeId);
    }

    boolean clearBackoff(String nodeId) {
        return backoffPending.remove(nodeId);
    }

    boolean isInBackoff(String nodeId) {
        return backoffPending.contains(nodeId);
    }
}
