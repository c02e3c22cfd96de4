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

import dev.mars.flowgraph.config.FlowgraphConfiguration;
import dev.mars.flowgraph.core.ErrorKind;
import dev.mars.flowgraph.core.exceptions.NodeExecutionException;
import dev.mars.flowgraph.workflow.BranchFailurePolicy;
import dev.mars.flowgraph.workflow.InvalidDefinitionException;
import dev.mars.flowgraph.workflow.NodeKind;
import dev.mars.flowgraph.workflow.RetryPolicy;
import dev.mars.flowgraph.workflow.ValidationResult;
import dev.mars.flowgraph.workflow.VariableResolver;
import dev.mars.flowgraph.workflow.WorkflowDefinition;
import dev.mars.flowgraph.workflow.WorkflowEdge;
import dev.mars.flowgraph.workflow.WorkflowGraph;
import dev.mars.flowgraph.workflow.WorkflowNode;
import dev.mars.flowgraph.workflow.WorkflowParseException;
import dev.mars.flowgraph.workflow.WorkflowValidator;
import dev.mars.flowgraph.workflow.observability.NodeTransitionEvent;
import dev.mars.flowgraph.workflow.observability.NodeTransitionListener;
import dev.mars.flowgraph.workflow.observability.WorkflowMetrics;
import dev.mars.flowgraph.workflow.store.ExecutionStore;
import dev.mars.flowgraph.workflow.store.InMemoryExecutionStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes workflow graphs node by node.
 * <p>
 * Each run keeps a status per node and a routing status per edge. A node becomes ready once none of
 * its incoming forward edges is pending and at least one was taken; a node whose incoming edges are all
 * dead is skipped and kills its own outgoing edges. Ready nodes are dispatched at once: control nodes
 * complete in place, agent and service calls run on a cached worker pool, and delays, retry backoff and
 * timeouts run on a scheduled pool. All state of one run is changed while holding that run's monitor.
 * <p>
 * The shared variables of a run are a single map. Nodes on parallel branches that write the same
 * variable overwrite each other, last writer wins; branches should write distinct names and merge them
 * after the JOIN, for example with a DATA_TRANSFORM {@code COLLECT} or {@code MERGE}.
 * <p>
 * Every change is written to the {@link ExecutionStore}. A run interrupted by {@link #shutdown()} stays
 * in the store as it was and can be continued with {@link #resume(String, WorkflowDefinition)}.
 * Finished runs are purged from the store once they are older than {@code flowgraph.store.max.age.ms};
 * the purge runs on the scheduled pool every {@code flowgraph.store.purge.interval.ms}, or more often
 * when the maximum age is shorter.
 * <p>
 * A paused run records the outcome of nodes already running but dispatches no new node until it is
 * resumed. A workflow timeout fails the run and cancels its active nodes, paused or not.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class GraphWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(GraphWorkflowEngine.class.getName());
    private static final long MIN_PURGE_INTERVAL_MS = 100;

    private final TaskExecutor taskExecutor;
    private final ExternalService externalService;
    private final ExecutionStore executionStore;
    private final FlowgraphConfiguration configuration;
    private final DataTransformer dataTransformer;
    private final WorkflowValidator validator = new WorkflowValidator();
    private final RetryPolicy defaultRetryPolicy;
    private final WorkflowMetrics metrics;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    private final List<NodeTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean shutdown = false;

    public GraphWorkflowEngine(TaskExecutor taskExecutor) {
        this(builder().taskExecutor(taskExecutor));
    }

    private GraphWorkflowEngine(Builder builder) {
        this.configuration = builder.configuration != null ? builder.configuration : new FlowgraphConfiguration();
        this.taskExecutor = builder.taskExecutor;
        this.externalService = builder.externalService;
        this.executionStore = builder.executionStore != null
                ? builder.executionStore : new InMemoryExecutionStore(configuration);
        this.dataTransformer = builder.dataTransformer != null ? builder.dataTransformer : new DataTransformer();
        this.defaultRetryPolicy = RetryPolicy.fromConfiguration(configuration);
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.global() : null;
        this.workers = Executors.newCachedThreadPool();
        this.scheduler = Executors.newScheduledThreadPool(configuration.getSchedulerThreads());
        schedulePurge();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionStore getExecutionStore() {
        return executionStore;
    }

    // ========== WorkflowEngine ==========

    @Override
    public CompletableFuture<WorkflowExecution> execute(WorkflowDefinition definition, ExecutionContext context) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        ExecutionContext executionContext = context != null ? context : ExecutionContext.empty();
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }

        ValidationResult validation = validator.validate(definition);
        if (!validation.isValid()) {
            logger.warning("Rejected invalid workflow " + definition.getId() + " with "
                    + validation.getErrorCount() + " violation(s)");
            return CompletableFuture.failedFuture(
                    new InvalidDefinitionException(definition.getId(), validation.getErrors()));
        }

        String executionId = executionContext.getExecutionId();
        WorkflowGraph graph = new WorkflowGraph(definition);
        logExecutionOrder(graph);
        WorkflowRun run = new WorkflowRun(executionId, definition, graph, seedVariables(definition, executionContext));

        synchronized (run) {
            run.start(Instant.now());
            try {
                executionStore.create(run.snapshot());
            } catch (IllegalStateException e) {
                return CompletableFuture.failedFuture(e);
            }
            runs.put(executionId, run);
            if (metrics != null) {
                metrics.recordRunStarted(definition.getId());
            }
            logger.info("Starting workflow execution: " + executionId + " (" + definition.getId() + ")");
            scheduleRunTimeout(run);

            String startId = definition.getStartNode()
                    .orElseThrow(() -> new IllegalStateException("Validated workflow has no START node"))
                    .getId();
            setState(run, startId, run.getState(startId).withStatus(NodeStatus.READY));
            advance(run);
        }
        return run.getCompletion();
    }

    @Override
    public CompletableFuture<WorkflowExecution> resume(String executionId, WorkflowDefinition definition) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        Optional<WorkflowExecution> stored = executionStore.get(executionId);
        if (stored.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown execution: " + executionId));
        }
        WorkflowExecution snapshot = stored.get();
        if (snapshot.isTerminal()) {
            return CompletableFuture.completedFuture(snapshot);
        }
        if (definition != null && !definition.equals(snapshot.getDefinition())) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Definition " + definition.getId() + " does not match execution " + executionId));
        }

        WorkflowRun run = WorkflowRun.fromSnapshot(snapshot, new WorkflowGraph(snapshot.getDefinition()));
        synchronized (run) {
            if (runs.putIfAbsent(executionId, run) != null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Execution " + executionId + " is already running"));
            }
            run.start(Instant.now());
            if (metrics != null) {
                metrics.recordRunStarted(snapshot.getWorkflowId());
            }
            logger.info("Resuming workflow execution: " + executionId + " (" + snapshot.getWorkflowId() + ")"
                    + (run.isPaused() ? ", still paused" : ""));
            scheduleRunTimeout(run);

            for (WorkflowNode node : run.getNodes()) {
                NodeState state = run.getState(node.getId());
                if (state.getStatus() == NodeStatus.RUNNING && node.getKind() != NodeKind.LOOP) {
                    // the interrupted attempt is dispatched again
                    setState(run, node.getId(), state.withStatus(NodeStatus.READY));
                } else if (state.getStatus() == NodeStatus.AWAITING_APPROVAL) {
                    long token = run.nextToken(node.getId());
                    scheduleApprovalTimeout(run, node, token);
                }
            }
            advance(run);
        }
        return run.getCompletion();
    }

    @Override
    public boolean pause(String executionId) {
        WorkflowRun run = runs.get(executionId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (!run.isRunning() || run.isPaused()) {
                return false;
            }
            run.setPaused(true);
            persist(run);
            logger.info("Paused workflow execution: " + executionId);
            return true;
        }
    }

    @Override
    public boolean resume(String executionId) {
        WorkflowRun run = runs.get(executionId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (!run.isRunning() || !run.isPaused()) {
                return false;
            }
            run.setPaused(false);
            logger.info("Resumed workflow execution: " + executionId);
            advance(run);
            return true;
        }
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        return executionStore.get(executionId);
    }

    @Override
    public ExecutionStatus getStatus(String executionId) {
        return executionStore.get(executionId).map(WorkflowExecution::getStatus).orElse(null);
    }

    @Override
    public boolean cancel(String executionId) {
        WorkflowRun run = runs.get(executionId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (!run.isRunning()) {
                return false;
            }
            logger.info("Cancelling workflow execution: " + executionId);
            cancelActiveNodes(run, "Run cancelled");
            finishRun(run, ExecutionStatus.CANCELLED);
            return true;
        }
    }

    @Override
    public boolean approve(String executionId, String nodeId) {
        WorkflowRun run = runs.get(executionId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (!isAwaitingApproval(run, nodeId)) {
                return false;
            }
            applyApproval(run, run.getNode(nodeId));
            advance(run);
            return true;
        }
    }

    @Override
    public boolean reject(String executionId, String nodeId, String reason) {
        WorkflowRun run = runs.get(executionId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (!isAwaitingApproval(run, nodeId)) {
                return false;
            }
            applyRejection(run, run.getNode(nodeId), reason != null ? reason : "Rejected");
            advance(run);
            return true;
        }
    }

    @Override
    public void addTransitionListener(NodeTransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeTransitionListener(NodeTransitionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        for (WorkflowRun run : runs.values()) {
            synchronized (run) {
                if (run.isRunning()) {
                    run.detach();
                    if (metrics != null) {
                        metrics.recordRunDetached(run.getDefinition().getId());
                    }
                    run.getCompletion().completeExceptionally(new IllegalStateException(
                            "Workflow engine shut down before execution " + run.getExecutionId() + " completed"));
                }
            }
        }
        runs.clear();
        workers.shutdownNow();
        scheduler.shutdownNow();
        logger.info("GraphWorkflowEngine shutdown initiated");
    }

    // ========== Scheduling ==========

    /**
     * Drives the run until nothing more can happen without an external event, then either completes
     * it or writes its snapshot. Caller holds the run's monitor.
     */
    private void advance(WorkflowRun run) {
        boolean progressed = true;
        while (run.isRunning() && progressed) {
            progressed = promotePending(run);
            if (!run.isPaused()) {
                progressed |= reevaluateLoops(run);
                progressed |= dispatchReady(run);
            }
        }
        if (!run.isRunning()) {
            return;
        }
        if (run.isQuiescent()) {
            if (run.getCompletedBy() != null) {
                finishRun(run, ExecutionStatus.SUCCEEDED);
            } else {
                run.addFailure(new NodeFailure(null, ErrorKind.NO_END_REACHED,
                        "All branches finished without reaching an END node"));
                finishRun(run, ExecutionStatus.FAILED);
            }
        } else {
            persist(run);
        }
    }

    private boolean promotePending(WorkflowRun run) {
        boolean changed = false;
        WorkflowGraph graph = run.getGraph();
        for (WorkflowNode node : run.getNodes()) {
            String nodeId = node.getId();
            NodeState state = run.getState(nodeId);
            if (state.getStatus() != NodeStatus.PENDING) {
                continue;
            }
            List<Integer> incoming = graph.getForwardIncomingEdgeIndices(nodeId);
            if (incoming.isEmpty()) {
                continue;
            }
            boolean anyPending = false;
            boolean anyTaken = false;
            for (int edgeIndex : incoming) {
                EdgeStatus edgeStatus = run.getEdgeStatus(edgeIndex);
                anyPending |= edgeStatus == EdgeStatus.PENDING;
                anyTaken |= edgeStatus == EdgeStatus.TAKEN;
            }
            if (anyPending) {
                continue;
            }
            if (anyTaken) {
                if (node.getKind() == NodeKind.JOIN && !branchesSettled(run, node)) {
                    continue;
                }
                setState(run, nodeId, state.withStatus(NodeStatus.READY));
            } else {
                setState(run, nodeId, state.withStatus(NodeStatus.SKIPPED));
                for (int edgeIndex : graph.getOutgoingEdgeIndices(nodeId)) {
                    run.setEdgeStatus(edgeIndex, EdgeStatus.DEAD);
                }
            }
            changed = true;
        }
        return changed;
    }

    private boolean branchesSettled(WorkflowRun run, WorkflowNode join) {
        for (Set<String> branch : run.getJoinBranches(join)) {
            for (String nodeId : branch) {
                if (!run.getState(nodeId).isTerminal()) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean reevaluateLoops(WorkflowRun run) {
        boolean changed = false;
        for (WorkflowNode node : run.getNodes()) {
            if (!run.isRunning()) {
                break;
            }
            if (node.getKind() != NodeKind.LOOP || run.getState(node.getId()).getStatus() != NodeStatus.RUNNING) {
                continue;
            }
            boolean bodyDone = true;
            for (String bodyNodeId : run.getLoopBody(node.getId())) {
                if (!run.getState(bodyNodeId).isTerminal()) {
                    bodyDone = false;
                    break;
                }
            }
            if (bodyDone) {
                evaluateLoop(run, node);
                changed = true;
            }
        }
        return changed;
    }

    private boolean dispatchReady(WorkflowRun run) {
        boolean changed = false;
        for (WorkflowNode node : run.getNodes()) {
            if (!run.isRunning()) {
                break;
            }
            String nodeId = node.getId();
            if (run.getState(nodeId).getStatus() == NodeStatus.READY && !run.isInBackoff(nodeId)) {
                dispatch(run, node);
                changed = true;
            }
        }
        return changed;
    }

    private void dispatch(WorkflowRun run, WorkflowNode node) {
        String nodeId = node.getId();
        NodeState attempt = run.getState(nodeId).startAttempt();
        if (node.getKind() == NodeKind.HUMAN_APPROVAL) {
            attempt = attempt.withStatus(NodeStatus.AWAITING_APPROVAL);
        }
        setState(run, nodeId, attempt);
        if (metrics != null) {
            metrics.recordNodeDispatched(run.getDefinition().getId(), node.getKind().name());
        }

        switch (node.getKind()) {
            case START:
            case PARALLEL:
                succeedNode(run, node, null);
                break;
            case END:
                run.recordEndReached(nodeId);
                succeedNode(run, node, null);
                break;
            case CONDITION:
                routeCondition(run, node);
                break;
            case JOIN:
                completeJoin(run, node);
                break;
            case LOOP:
                evaluateLoop(run, node);
                break;
            case DELAY:
                scheduleDelay(run, node);
                break;
            case HUMAN_APPROVAL:
                awaitApproval(run, node);
                break;
            case AGENT_SPAWN:
            case AGENT_EXECUTE:
                submitTask(run, node);
                break;
            case MCP_CALL:
            case WEBHOOK:
                submitServiceCall(run, node);
                break;
            case DATA_TRANSFORM:
                applyTransform(run, node);
                break;
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.getKind());
        }
    }

    private static Map<String, Object> seedVariables(WorkflowDefinition definition, ExecutionContext context) {
        Map<String, Object> variables = new LinkedHashMap<>(definition.getVariables());
        variables.putAll(context.getVariables());
        return variables;
    }

    private void scheduleRunTimeout(WorkflowRun run) {
        Duration timeout = run.getDefinition().getTimeout();
        if (timeout == null) {
            return;
        }
        Duration elapsed = Duration.between(run.getStartTime(), Instant.now());
        long remainingMs = Math.max(0, timeout.minus(elapsed).toMillis());
        run.setRunTimer(scheduler.schedule(() -> onRunTimeout(run, timeout), remainingMs, TimeUnit.MILLISECONDS));
    }

    private void onRunTimeout(WorkflowRun run, Duration timeout) {
        synchronized (run) {
            if (!run.isRunning()) {
                return;
            }
            String message = "Workflow " + run.getDefinition().getId() + " exceeded its timeout of "
                    + timeout.toMillis() + "ms";
            logger.severe("Execution " + run.getExecutionId() + ": " + message);
            run.addFailure(new NodeFailure(null, ErrorKind.TIMEOUT_EXCEEDED, message));
            cancelActiveNodes(run, "Cancelled after workflow timeout");
            finishRun(run, ExecutionStatus.FAILED);
        }
    }

    // ========== Control nodes ==========

    private void routeCondition(WorkflowRun run, WorkflowNode node) {
        List<Integer> outgoing = run.getGraph().getOutgoingEdgeIndices(node.getId());
        int chosen = -1;
        for (int edgeIndex : outgoing) {
            WorkflowEdge edge = run.getEdge(edgeIndex);
            if (edge.isConditional() && edge.getCondition().evaluate(run.getVariables())) {
                chosen = edgeIndex;
                break;
            }
        }
        if (chosen < 0) {
            for (int edgeIndex : outgoing) {
                if (!run.getEdge(edgeIndex).isConditional()) {
                    chosen = edgeIndex;
                    break;
                }
            }
        }
        if (chosen < 0) {
            failNode(run, node, ErrorKind.NO_MATCHING_BRANCH,
                    "No branch of condition " + node.getId() + " matched and there is no default edge");
            return;
        }
        for (int edgeIndex : outgoing) {
            run.setEdgeStatus(edgeIndex, edgeIndex == chosen ? EdgeStatus.TAKEN : EdgeStatus.DEAD);
        }
        String target = run.getEdge(chosen).getTo();
        logger.fine("Condition " + node.getId() + " routed to " + target);
        succeedNode(run, node, target);
    }

    private void completeJoin(WorkflowRun run, WorkflowNode node) {
        List<Set<String>> branches = run.getJoinBranches(node);
        int failedBranches = 0;
        for (Set<String> branch : branches) {
            for (String nodeId : branch) {
                if (run.getState(nodeId).getStatus() == NodeStatus.FAILED) {
                    failedBranches++;
                    break;
                }
            }
        }
        BranchFailurePolicy policy = BranchFailurePolicy.fromName(node.getConfigString("onBranchFailure"));
        if (failedBranches > 0 && policy != BranchFailurePolicy.TOLERATE_PARTIAL) {
            failNode(run, node, ErrorKind.JOINED_BRANCH_FAILED,
                    failedBranches + " of " + branches.size() + " joined branches failed");
            return;
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("branches", branches.size());
        output.put("failedBranches", failedBranches);
        succeedNode(run, node, output);
    }

    /**
     * Decides whether a LOOP runs its body again. Called when the LOOP is dispatched and again each
     * time every node of its body has finished.
     */
    private void evaluateLoop(WorkflowRun run, WorkflowNode loop) {
        String loopId = loop.getId();
        int index = run.getLoopIteration(loopId);
        int maxIterations = loop.getConfigInt("maxIterations", 1);

        boolean proceed;
        boolean forEach = false;
        Object item = null;
        if (loop.hasConfig("condition")) {
            proceed = run.getLoopCondition(loop).evaluate(run.getVariables());
        } else if (loop.hasConfig("iterations")) {
            proceed = index < loop.getConfigInt("iterations", 0);
        } else {
            List<Object> items = forEachItems(run, loop);
            forEach = true;
            proceed = index < items.size();
            item = proceed ? items.get(index) : null;
        }

        if (!proceed) {
            routeOutgoing(run, loop);
            succeedNode(run, loop, index);
            logger.fine("Loop " + loopId + " finished after " + index + " iteration(s)");
            return;
        }
        if (index >= maxIterations) {
            failNode(run, loop, ErrorKind.LOOP_BOUND_EXCEEDED,
                    "Loop " + loopId + " reached maxIterations=" + maxIterations + " and would run again");
            return;
        }

        resetLoopBody(run, loop);
        run.setVariable(loopId + "_iteration", index);
        if (forEach) {
            run.setVariable(loop.getConfigString("itemVariable", loopId + "_item"), item);
        }
        run.setLoopIteration(loopId, index + 1);
        String entry = loop.getConfigString("body");
        for (int edgeIndex : run.getGraph().getOutgoingEdgeIndices(loopId)) {
            WorkflowEdge edge = run.getEdge(edgeIndex);
            if (!edge.isLoopBack() && edge.getTo().equals(entry)) {
                run.setEdgeStatus(edgeIndex, EdgeStatus.TAKEN);
            }
        }
        logger.fine("Loop " + loopId + " starting iteration " + index);
    }

    private List<Object> forEachItems(WorkflowRun run, WorkflowNode loop) {
        Object source = loop.getConfigValue("forEach");
        Object items = source instanceof List ? source : VariableResolver.lookup(run.getVariables(), String.valueOf(source));
        if (items == null) {
            return List.of();
        }
        if (items instanceof Collection) {
            return new ArrayList<>((Collection<?>) items);
        }
        List<Object> single = new ArrayList<>();
        single.add(items);
        return single;
    }

    /**
     * Gives every body node a fresh PENDING state and re-opens the edges inside the body.
     */
    private void resetLoopBody(WorkflowRun run, WorkflowNode loop) {
        Set<String> body = run.getLoopBody(loop.getId());
        for (String nodeId : body) {
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            run.clearBackoff(nodeId);
            Future<?> future = run.removeInflight(nodeId);
            if (future != null) {
                future.cancel(true);
            }
            if (run.isLoop(nodeId)) {
                run.clearLoopIteration(nodeId);
            }
            setState(run, nodeId, NodeState.pending());
        }
        WorkflowGraph graph = run.getGraph();
        for (int edgeIndex = 0; edgeIndex < graph.getEdgeCount(); edgeIndex++) {
            WorkflowEdge edge = graph.getEdge(edgeIndex);
            boolean internal = body.contains(edge.getFrom()) && body.contains(edge.getTo());
            boolean closing = edge.isLoopBack() && edge.getTo().equals(loop.getId());
            if (internal || closing) {
                run.setEdgeStatus(edgeIndex, EdgeStatus.PENDING);
            }
        }
    }

    private void scheduleDelay(WorkflowRun run, WorkflowNode node) {
        String nodeId = node.getId();
        Duration duration = node.getConfigDuration("duration");
        long token = run.nextToken(nodeId);
        logger.fine("Node " + nodeId + " delaying for " + duration.toMillis() + "ms");
        run.setTimer(nodeId, scheduler.schedule(() -> onDelayElapsed(run, node, token),
                duration.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void onDelayElapsed(WorkflowRun run, WorkflowNode node, long token) {
        synchronized (run) {
            if (!run.isCurrent(node.getId(), token)) {
                return;
            }
            run.invalidate(node.getId());
            run.cancelTimer(node.getId());
            succeedNode(run, node, null);
            advance(run);
        }
    }

    // ========== Human approval ==========

    private void awaitApproval(WorkflowRun run, WorkflowNode node) {
        long token = run.nextToken(node.getId());
        logger.info("Node " + node.getId() + " of execution " + run.getExecutionId() + " awaiting approval"
                + (node.hasConfig("message") ? ": " + node.getConfigString("message") : ""));
        scheduleApprovalTimeout(run, node, token);
    }

    private void scheduleApprovalTimeout(WorkflowRun run, WorkflowNode node, long token) {
        Duration timeout = node.getTimeout();
        if (timeout == null) {
            return;
        }
        run.setTimer(node.getId(), scheduler.schedule(() -> onApprovalTimeout(run, node, token, timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void onApprovalTimeout(WorkflowRun run, WorkflowNode node, long token, Duration timeout) {
        synchronized (run) {
            if (!run.isCurrent(node.getId(), token)) {
                return;
            }
            String action = node.getConfigString("defaultAction", "reject");
            logger.warning("Approval of node " + node.getId() + " timed out after " + timeout.toMillis()
                    + "ms; applying " + action);
            if ("approve".equalsIgnoreCase(action)) {
                applyApproval(run, node);
            } else {
                applyRejection(run, node, "Approval timed out after " + timeout.toMillis() + "ms");
            }
            advance(run);
        }
    }

    private boolean isAwaitingApproval(WorkflowRun run, String nodeId) {
        NodeState state = run.getState(nodeId);
        return run.isRunning() && state != null && state.getStatus() == NodeStatus.AWAITING_APPROVAL;
    }

    private void applyApproval(WorkflowRun run, WorkflowNode node) {
        String nodeId = node.getId();
        run.invalidate(nodeId);
        run.cancelTimer(nodeId);
        run.setVariable(nodeId + "_approved", true);
        logger.info("Node " + nodeId + " of execution " + run.getExecutionId() + " approved");
        succeedNode(run, node, true);
    }

    private void applyRejection(WorkflowRun run, WorkflowNode node, String reason) {
        String nodeId = node.getId();
        run.invalidate(nodeId);
        run.cancelTimer(nodeId);
        run.setVariable(nodeId + "_approved", false);
        failNode(run, node, ErrorKind.APPROVAL_REJECTED, reason);
    }

    // ========== Work nodes ==========

    private void submitTask(WorkflowRun run, WorkflowNode node) {
        if (taskExecutor == null) {
            failNode(run, node, ErrorKind.EXECUTOR_FAILURE, "No task executor configured");
            return;
        }
        Map<String, Object> config;
        try {
            config = new VariableResolver(run.getVariables()).resolveAll(node.getConfig());
        } catch (VariableResolver.VariableResolutionException e) {
            failNode(run, node, ErrorKind.EXECUTOR_FAILURE, e.getMessage());
            return;
        }
        String nodeId = node.getId();
        long token = run.nextToken(nodeId);
        TaskRequest request = new TaskRequest(run.getExecutionId(), nodeId, node.getKind(), config,
                run.variablesSnapshot(), run.getState(nodeId).getAttempts());
        run.setInflight(nodeId, workers.submit(() -> runTask(run, node, token, request)));
        if (node.getTimeout() != null) {
            scheduleTimeout(run, node, token, node.getTimeout());
        }
    }

    private void runTask(WorkflowRun run, WorkflowNode node, long token, TaskRequest request) {
        Object result;
        try {
            result = taskExecutor.execute(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onWorkFailed(run, node, token, ErrorKind.EXECUTOR_FAILURE, "Task interrupted", e);
            return;
        } catch (Exception e) {
            onWorkFailed(run, node, token, ErrorKind.EXECUTOR_FAILURE, describe(e), e);
            return;
        }
        onWorkSucceeded(run, node, token, result);
    }

    private void submitServiceCall(WorkflowRun run, WorkflowNode node) {
        if (externalService == null) {
            failNode(run, node, ErrorKind.SERVICE_FAILURE, "No external service configured");
            return;
        }
        VariableResolver resolver = new VariableResolver(run.getVariables());
        String target;
        String method = null;
        Map<String, Object> payload;
        try {
            if (node.getKind() == NodeKind.MCP_CALL) {
                target = resolver.resolve(node.getConfigString("server")) + "/" + resolver.resolve(node.getConfigString("tool"));
            } else {
                target = resolver.resolve(node.getConfigString("url"));
                method = node.getConfigString("method", "POST").toUpperCase(Locale.ROOT);
            }
            payload = resolver.resolveAll(node.getConfigMap("payload"));
        } catch (VariableResolver.VariableResolutionException e) {
            failNode(run, node, ErrorKind.SERVICE_FAILURE, e.getMessage());
            return;
        }
        Duration timeout = node.getTimeout() != null
                ? node.getTimeout() : Duration.ofMillis(configuration.getServiceTimeoutMs());
        String nodeId = node.getId();
        long token = run.nextToken(nodeId);
        ServiceRequest request = new ServiceRequest(run.getExecutionId(), nodeId, node.getKind(), target, method,
                payload, timeout, run.getState(nodeId).getAttempts());
        run.setInflight(nodeId, workers.submit(() -> runServiceCall(run, node, token, request)));
        scheduleTimeout(run, node, token, timeout);
    }

    private void runServiceCall(WorkflowRun run, WorkflowNode node, long token, ServiceRequest request) {
        Object response;
        try {
            response = externalService.call(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onWorkFailed(run, node, token, ErrorKind.SERVICE_FAILURE, "Service call interrupted", e);
            return;
        } catch (Exception e) {
            onWorkFailed(run, node, token, ErrorKind.SERVICE_FAILURE, describe(e), e);
            return;
        }
        onWorkSucceeded(run, node, token, response);
    }

    private void onWorkSucceeded(WorkflowRun run, WorkflowNode node, long token, Object result) {
        synchronized (run) {
            String nodeId = node.getId();
            if (!run.isCurrent(nodeId, token)) {
                logger.fine("Ignoring stale result of node " + nodeId + " in execution " + run.getExecutionId());
                return;
            }
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            run.removeInflight(nodeId);
            storeResult(run, node, result);
            succeedNode(run, node, result);
            advance(run);
        }
    }

    private void onWorkFailed(WorkflowRun run, WorkflowNode node, long token, ErrorKind kind,
                              String message, Exception cause) {
        synchronized (run) {
            String nodeId = node.getId();
            if (!run.isCurrent(nodeId, token)) {
                logger.fine("Ignoring stale failure of node " + nodeId + " in execution " + run.getExecutionId());
                return;
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Node " + nodeId + " failure details", cause);
            }
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            run.removeInflight(nodeId);
            failNode(run, node, kind, message);
            advance(run);
        }
    }

    private void scheduleTimeout(WorkflowRun run, WorkflowNode node, long token, Duration timeout) {
        run.setTimer(node.getId(), scheduler.schedule(() -> onTimeout(run, node, token, timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void onTimeout(WorkflowRun run, WorkflowNode node, long token, Duration timeout) {
        synchronized (run) {
            String nodeId = node.getId();
            if (!run.isCurrent(nodeId, token)) {
                return;
            }
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            Future<?> future = run.removeInflight(nodeId);
            if (future != null) {
                future.cancel(true);
            }
            notifyCancel(run, node);
            failNode(run, node, ErrorKind.TIMEOUT_EXCEEDED,
                    "Node " + nodeId + " timed out after " + timeout.toMillis() + "ms");
            advance(run);
        }
    }

    private void storeResult(WorkflowRun run, WorkflowNode node, Object result) {
        String nodeId = node.getId();
        if (node.getKind().isServiceCall()) {
            run.setVariable(node.getConfigString("responseKey", nodeId + "_response"), result);
            return;
        }
        run.setVariable(node.getConfigString("outputKey", nodeId + "_output"), result);
        Map<String, Object> mapping = node.getConfigMap("outputMapping");
        if (!mapping.isEmpty() && result instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> resultMap = (Map<String, Object>) result;
            for (Map.Entry<String, Object> entry : mapping.entrySet()) {
                Object value = VariableResolver.lookup(resultMap, entry.getKey());
                if (value != null) {
                    run.setVariable(String.valueOf(entry.getValue()), value);
                }
            }
        }
    }

    private void applyTransform(WorkflowRun run, WorkflowNode node) {
        Object result;
        try {
            result = dataTransformer.apply(node, run.getVariables());
        } catch (NodeExecutionException e) {
            failNode(run, node, e.getErrorKind(), e.getReason());
            return;
        }
        run.setVariable(node.getConfigString("output"), result);
        succeedNode(run, node, result);
    }

    // ========== Outcomes ==========

    private void succeedNode(WorkflowRun run, WorkflowNode node, Object output) {
        setState(run, node.getId(), run.getState(node.getId()).succeeded(output));
        if (node.getKind() != NodeKind.CONDITION && node.getKind() != NodeKind.LOOP) {
            routeOutgoing(run, node);
        }
    }

    /**
     * Resolves the outgoing edges of a node that finished: unconditional edges are taken, guarded edges
     * are taken when their condition holds. A LOOP's body edge dies.
     */
    private void routeOutgoing(WorkflowRun run, WorkflowNode node) {
        String bodyEntry = node.getKind() == NodeKind.LOOP ? node.getConfigString("body") : null;
        for (int edgeIndex : run.getGraph().getOutgoingEdgeIndices(node.getId())) {
            WorkflowEdge edge = run.getEdge(edgeIndex);
            if (bodyEntry != null && !edge.isLoopBack() && edge.getTo().equals(bodyEntry)) {
                run.setEdgeStatus(edgeIndex, EdgeStatus.DEAD);
            } else if (!edge.isConditional() || edge.getCondition().evaluate(run.getVariables())) {
                run.setEdgeStatus(edgeIndex, EdgeStatus.TAKEN);
            } else {
                run.setEdgeStatus(edgeIndex, EdgeStatus.DEAD);
            }
        }
    }

    /**
     * Records a failed attempt: schedules a retry when the error kind is recoverable and attempts remain,
     * lets an optional node fall through, and otherwise fails the run.
     */
    private void failNode(WorkflowRun run, WorkflowNode node, ErrorKind kind, String message) {
        String nodeId = node.getId();
        NodeState state = run.getState(nodeId);
        String workflowId = run.getDefinition().getId();
        if (metrics != null) {
            metrics.recordNodeFailed(workflowId, node.getKind().name(), kind.name());
        }

        RetryPolicy policy = node.getRetryPolicy() != null ? node.getRetryPolicy() : defaultRetryPolicy;
        if (kind.isRetryable() && state.getAttempts() < policy.getMaxAttempts()) {
            Duration delay = policy.getDelayAfterAttempt(state.getAttempts());
            logger.warning("Node " + nodeId + " failed attempt " + state.getAttempts() + "/" + policy.getMaxAttempts()
                    + " [" + kind + "]: " + message + "; retrying in " + delay.toMillis() + "ms");
            setState(run, nodeId, state.withError(NodeStatus.READY, kind, message));
            run.markBackoff(nodeId);
            if (metrics != null) {
                metrics.recordNodeRetried(workflowId, node.getKind().name());
            }
            long token = run.nextToken(nodeId);
            run.setTimer(nodeId, scheduler.schedule(() -> onBackoffElapsed(run, nodeId, token),
                    delay.toMillis(), TimeUnit.MILLISECONDS));
            return;
        }

        setState(run, nodeId, state.withError(NodeStatus.FAILED, kind, message));
        if (node.isOptional()) {
            logger.warning("Optional node " + nodeId + " failed [" + kind + "]: " + message + "; continuing");
            run.setVariable(nodeId + "_error", message);
            routeOutgoing(run, node);
            return;
        }

        logger.severe("Node " + nodeId + " failed [" + kind + "]: " + message);
        run.addFailure(new NodeFailure(nodeId, kind, message));
        cancelActiveNodes(run, "Cancelled after failure of node " + nodeId);
        finishRun(run, ExecutionStatus.FAILED);
    }

    private void onBackoffElapsed(WorkflowRun run, String nodeId, long token) {
        synchronized (run) {
            if (!run.isCurrent(nodeId, token)) {
                return;
            }
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            run.clearBackoff(nodeId);
            advance(run);
        }
    }

    private void cancelActiveNodes(WorkflowRun run, String reason) {
        for (WorkflowNode node : run.getNodes()) {
            String nodeId = node.getId();
            NodeState state = run.getState(nodeId);
            if (!state.getStatus().isActive()) {
                continue;
            }
            run.invalidate(nodeId);
            run.cancelTimer(nodeId);
            run.clearBackoff(nodeId);
            Future<?> future = run.removeInflight(nodeId);
            if (future != null) {
                future.cancel(true);
                notifyCancel(run, node);
            }
            setState(run, nodeId, state.withError(NodeStatus.CANCELLED, ErrorKind.RUN_CANCELLED, reason));
        }
    }

    private void notifyCancel(WorkflowRun run, WorkflowNode node) {
        try {
            if (node.getKind().isAgent() && taskExecutor != null) {
                taskExecutor.cancel(run.getExecutionId(), node.getId());
            } else if (node.getKind().isServiceCall() && externalService != null) {
                externalService.cancel(run.getExecutionId(), node.getId());
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cancel hook failed for node " + node.getId() + ": " + e.getMessage());
        }
    }

    private void finishRun(WorkflowRun run, ExecutionStatus finalStatus) {
        Instant now = Instant.now();
        run.finish(finalStatus, now);
        run.cancelAllTimers();
        runs.remove(run.getExecutionId(), run);

        WorkflowExecution snapshot = run.snapshot();
        persist(snapshot);

        String workflowId = run.getDefinition().getId();
        double seconds = Duration.between(run.getStartTime(), now).toMillis() / 1000.0;
        switch (finalStatus) {
            case SUCCEEDED:
                logger.info("Workflow execution completed: " + run.getExecutionId() + " via " + run.getCompletedBy());
                if (metrics != null) {
                    metrics.recordRunSucceeded(workflowId, seconds);
                }
                break;
            case FAILED:
                NodeFailure failure = run.getFailures().isEmpty() ? null : run.getFailures().get(0);
                logger.log(Level.SEVERE, "Workflow execution failed: " + run.getExecutionId() + " - "
                        + (failure != null ? failure.getErrorKind() + ": " + failure.getMessage() : "unknown"));
                if (metrics != null) {
                    metrics.recordRunFailed(workflowId, failure != null ? failure.getErrorKind().name() : null, seconds);
                }
                break;
            case CANCELLED:
                logger.info("Workflow execution cancelled: " + run.getExecutionId());
                if (metrics != null) {
                    metrics.recordRunCancelled(workflowId);
                }
                break;
            default:
                throw new IllegalStateException("Not a terminal status: " + finalStatus);
        }
        run.getCompletion().complete(snapshot);
    }

    // ========== State changes ==========

    private void setState(WorkflowRun run, String nodeId, NodeState newState) {
        NodeState previous = run.putState(nodeId, newState);
        if (previous == null || previous.getStatus() == newState.getStatus()) {
            return;
        }
        logger.fine("Execution " + run.getExecutionId() + " node " + nodeId + ": "
                + previous.getStatus() + " -> " + newState.getStatus());
        NodeTransitionEvent event = new NodeTransitionEvent(run.getExecutionId(), nodeId,
                previous.getStatus(), newState.getStatus(), Instant.now());
        for (NodeTransitionListener listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Transition listener failed for node " + nodeId + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Transition listener exception details", e);
                }
            }
        }
    }

    private void persist(WorkflowRun run) {
        persist(run.snapshot());
    }

    private void persist(WorkflowExecution snapshot) {
        try {
            executionStore.update(snapshot);
        } catch (IllegalStateException e) {
            logger.warning("Could not store execution " + snapshot.getExecutionId() + ": " + e.getMessage());
        }
    }

    private void logExecutionOrder(WorkflowGraph graph) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        try {
            logger.fine("Execution order for " + graph.getDefinition().getId() + ": " + graph.topologicalSort());
        } catch (WorkflowParseException e) {
            logger.fine("No execution order for " + graph.getDefinition().getId() + ": " + e.getMessage());
        }
    }

    private void schedulePurge() {
        long maxAgeMs = configuration.getStoreMaxAgeMs();
        long intervalMs = Math.max(MIN_PURGE_INTERVAL_MS, Math.min(configuration.getStorePurgeIntervalMs(), maxAgeMs));
        scheduler.scheduleAtFixedRate(() -> purgeExpired(Duration.ofMillis(maxAgeMs)),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.fine("Purging finished executions older than " + maxAgeMs + "ms every " + intervalMs + "ms");
    }

    private void purgeExpired(Duration maxAge) {
        try {
            executionStore.purgeCompleted(maxAge);
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic purge
            logger.warning("Purging finished executions failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Purge exception details", e);
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Builder for GraphWorkflowEngine. Every collaborator is optional; nodes needing a missing one fail.
     */
    public static class Builder {
        private TaskExecutor taskExecutor;
        private ExternalService externalService;
        private ExecutionStore executionStore;
        private FlowgraphConfiguration configuration;
        private DataTransformer dataTransformer;

        public Builder taskExecutor(TaskExecutor taskExecutor) {
            this.taskExecutor = taskExecutor;
            return this;
        }

        public Builder externalService(ExternalService externalService) {
            this.externalService = externalService;
            return this;
        }

        public Builder executionStore(ExecutionStore executionStore) {
            this.executionStore = executionStore;
            return this;
        }

        public Builder configuration(FlowgraphConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder dataTransformer(DataTransformer dataTransformer) {
            this.dataTransformer = dataTransformer;
            return this;
        }

        public GraphWorkflowEngine build() {
            return new GraphWorkflowEngine(this);
        }
    }
}
