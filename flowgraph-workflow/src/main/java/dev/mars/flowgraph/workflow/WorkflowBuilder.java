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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent construction of workflow definitions.
 * <pre>
 * WorkflowDefinition greeting = WorkflowBuilder.create("greet-flow", "Greeting")
 *         .start("start")
 *         .agentExecute("greet", "Say hello")
 *         .end("end")
 *         .connect("start", "greet")
 *         .connect("greet", "end")
 *         .build();
 * </pre>
 * {@link #build()} validates the result and reports every violation at once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowBuilder {

    private final String id;
    private final String name;
    private String description;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private Duration timeout;
    private final List<WorkflowNode> nodes = new ArrayList<>();
    private final List<WorkflowEdge> edges = new ArrayList<>();
    private final WorkflowValidator validator = new WorkflowValidator();

    private WorkflowBuilder(String id, String name) {
        this.id = Objects.requireNonNull(id, "Workflow ID cannot be null");
        this.name = name != null ? name : id;
    }

    public static WorkflowBuilder create(String id, String name) {
        return new WorkflowBuilder(id, name);
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder metadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public WorkflowBuilder metadata(Map<String, ?> metadata) {
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        return this;
    }

    /**
     * Declares a default value for a shared variable; values passed in the execution context win.
     */
    public WorkflowBuilder variable(String name, Object value) {
        this.variables.put(Objects.requireNonNull(name, "Variable name cannot be null"), value);
        return this;
    }

    public WorkflowBuilder variables(Map<String, ?> variables) {
        if (variables != null) {
            this.variables.putAll(variables);
        }
        return this;
    }

    /**
     * Limits the wall-clock time of a run; a run still going when it elapses fails with TIMEOUT_EXCEEDED.
     */
    public WorkflowBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    // ========== Nodes ==========

    public WorkflowBuilder node(WorkflowNode node) {
        nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
        return this;
    }

    public WorkflowBuilder addNode(String nodeId, NodeKind kind, Map<String, ?> config) {
        return node(WorkflowNode.builder(nodeId, kind).config(config).build());
    }

    public WorkflowBuilder start(String nodeId) {
        return addNode(nodeId, NodeKind.START, Map.of());
    }

    public WorkflowBuilder end(String nodeId) {
        return addNode(nodeId, NodeKind.END, Map.of());
    }

    public WorkflowBuilder agentSpawn(String nodeId, String agentType, String role, String instructions) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("agentType", agentType);
        putIfNotNull(config, "role", role);
        putIfNotNull(config, "instructions", instructions);
        return addNode(nodeId, NodeKind.AGENT_SPAWN, config);
    }

    public WorkflowBuilder agentExecute(String nodeId, String task) {
        return addNode(nodeId, NodeKind.AGENT_EXECUTE, Map.of("task", task));
    }

    public WorkflowBuilder agentExecute(String nodeId, String task, String expectedOutcome) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("task", task);
        putIfNotNull(config, "expectedOutcome", expectedOutcome);
        return addNode(nodeId, NodeKind.AGENT_EXECUTE, config);
    }

    public WorkflowBuilder condition(String nodeId) {
        return addNode(nodeId, NodeKind.CONDITION, Map.of());
    }

    public WorkflowBuilder parallel(String nodeId) {
        return addNode(nodeId, NodeKind.PARALLEL, Map.of());
    }

    /**
     * Adds a JOIN waiting for the branches of the PARALLEL node {@code parallelId}.
     */
    public WorkflowBuilder join(String nodeId, String parallelId, BranchFailurePolicy onBranchFailure) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("joinGroup", parallelId);
        config.put("onBranchFailure", onBranchFailure.name());
        return addNode(nodeId, NodeKind.JOIN, config);
    }

    /**
     * Adds a LOOP repeating its body while {@code condition} holds, at most {@code maxIterations} times.
     */
    public WorkflowBuilder loop(String nodeId, String bodyNodeId, String condition, int maxIterations) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("body", bodyNodeId);
        config.put("condition", condition);
        config.put("maxIterations", maxIterations);
        return addNode(nodeId, NodeKind.LOOP, config);
    }

    /**
     * Adds a LOOP running its body a fixed number of times.
     */
    public WorkflowBuilder loopTimes(String nodeId, String bodyNodeId, int iterations, int maxIterations) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("body", bodyNodeId);
        config.put("iterations", iterations);
        config.put("maxIterations", maxIterations);
        return addNode(nodeId, NodeKind.LOOP, config);
    }

    public WorkflowBuilder delay(String nodeId, String duration) {
        return addNode(nodeId, NodeKind.DELAY, Map.of("duration", duration));
    }

    public WorkflowBuilder mcpCall(String nodeId, String server, String tool, Map<String, ?> payload) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("server", server);
        config.put("tool", tool);
        if (payload != null && !payload.isEmpty()) {
            config.put("payload", payload);
        }
        return addNode(nodeId, NodeKind.MCP_CALL, config);
    }

    public WorkflowBuilder webhook(String nodeId, String url, String method, Map<String, ?> payload) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("url", url);
        putIfNotNull(config, "method", method);
        if (payload != null && !payload.isEmpty()) {
            config.put("payload", payload);
        }
        return addNode(nodeId, NodeKind.WEBHOOK, config);
    }

    public WorkflowBuilder humanApproval(String nodeId, String message) {
        Map<String, Object> config = new LinkedHashMap<>();
        putIfNotNull(config, "message", message);
        return addNode(nodeId, NodeKind.HUMAN_APPROVAL, config);
    }

    public WorkflowBuilder dataTransform(String nodeId, TransformOperation operation, List<String> inputs, String output) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("operation", operation.name());
        if (inputs != null && !inputs.isEmpty()) {
            config.put("inputs", inputs);
        }
        config.put("output", output);
        return addNode(nodeId, NodeKind.DATA_TRANSFORM, config);
    }

    // ========== Edges ==========

    public WorkflowBuilder connect(String from, String to) {
        edges.add(new WorkflowEdge(from, to));
        return this;
    }

    /**
     * Adds an edge guarded by a condition expression.
     *
     * @throws Condition.ConditionSyntaxException if the expression cannot be parsed
     */
    public WorkflowBuilder connect(String from, String to, String conditionExpression) {
        edges.add(new WorkflowEdge(from, to, Condition.parse(conditionExpression)));
        return this;
    }

    /**
     * Closes a LOOP body with an edge from {@code from} back to the LOOP node.
     */
    public WorkflowBuilder loopBack(String from, String loopId) {
        edges.add(WorkflowEdge.loopBack(from, loopId));
        return this;
    }

    public WorkflowBuilder edge(WorkflowEdge edge) {
        edges.add(Objects.requireNonNull(edge, "Edge cannot be null"));
        return this;
    }

    // ========== Build ==========

    /**
     * Builds and validates the definition.
     *
     * @throws InvalidDefinitionException carrying every violation if validation fails
     */
    public WorkflowDefinition build() throws InvalidDefinitionException {
        WorkflowDefinition definition = buildUnvalidated();
        ValidationResult validation = validator.validate(definition);
        if (!validation.isValid()) {
            throw new InvalidDefinitionException(id, validation.getErrors());
        }
        return definition;
    }

    /**
     * Builds the definition without validating it, for tooling that reports problems itself.
     */
    public WorkflowDefinition buildUnvalidated() {
        return new WorkflowDefinition(id, name, description, nodes, edges, metadata, variables, timeout);
    }

    private static void putIfNotNull(Map<String, Object> config, String key, Object value) {
        if (value != null) {
            config.put(key, value);
        }
    }
}
