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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Structural validation of workflow definitions.
 * <p>
 * {@link #validate(WorkflowDefinition)} has no side effects and reports every violation it finds,
 * so a caller sees all problems at once. An empty error list means the definition is executable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowValidator {

    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        WorkflowGraph graph = new WorkflowGraph(definition);

        validateNodeIds(definition, result);
        validateEdges(definition, result);
        String startId = validateStart(definition, graph, result);
        validateEnds(definition, graph, startId, result);
        validateCycles(graph, result);
        if (definition.getTimeout() != null && (definition.getTimeout().isNegative() || definition.getTimeout().isZero())) {
            result.addError("timeout", "Workflow timeout must be positive");
        }

        for (WorkflowNode node : definition.getNodeMap().values()) {
            validateConfiguration(node, result);
            validateRetryAndTimeout(node, result);
            switch (node.getKind()) {
                case CONDITION:
                    validateConditionNode(node, graph, result);
                    break;
                case PARALLEL:
                    if (graph.getOutgoingEdgeIndices(node.getId()).size() < 2) {
                        result.addWarning(nodePath(node), "PARALLEL node has fewer than two outgoing edges");
                    }
                    break;
                case JOIN:
                    validateJoinNode(node, graph, result);
                    break;
                case LOOP:
                    validateLoopNode(node, graph, result);
                    break;
                default:
                    break;
            }
        }

        logger.fine("Validated workflow " + definition.getId() + ": " + result);
        return result;
    }

    private void validateNodeIds(WorkflowDefinition definition, ValidationResult result) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        List<WorkflowNode> nodes = definition.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            if (id.trim().isEmpty()) {
                result.addError("nodes[" + i + "]", "Node id cannot be blank");
            } else if (!seen.add(id) && reported.add(id)) {
                result.addError("nodes." + id, "Duplicate node id '" + id + "'");
            }
        }
    }

    private void validateEdges(WorkflowDefinition definition, ValidationResult result) {
        Map<String, WorkflowNode> nodes = definition.getNodeMap();
        List<WorkflowEdge> edges = definition.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            WorkflowEdge edge = edges.get(i);
            String path = "edges[" + i + "]";
            if (!nodes.containsKey(edge.getFrom())) {
                result.addError(path, "Edge source '" + edge.getFrom() + "' does not exist");
            }
            WorkflowNode target = nodes.get(edge.getTo());
            if (target == null) {
                result.addError(path, "Edge target '" + edge.getTo() + "' does not exist");
            } else if (edge.isLoopBack() && target.getKind() != NodeKind.LOOP) {
                result.addError(path, "Loop-back edge must target a LOOP node, but '" + edge.getTo() +
                        "' is " + target.getKind());
            }
            WorkflowNode source = nodes.get(edge.getFrom());
            if (edge.isConditional() && source != null && source.getKind() != NodeKind.CONDITION) {
                result.addWarning(path, "Conditional edge leaves " + source.getKind() +
                        " node '" + source.getId() + "'; it is taken only when its condition holds");
            }
        }
    }

    private String validateStart(WorkflowDefinition definition, WorkflowGraph graph, ValidationResult result) {
        List<String> starts = new ArrayList<>();
        for (WorkflowNode node : definition.getNodeMap().values()) {
            if (node.getKind() == NodeKind.START) {
                starts.add(node.getId());
            }
        }

        if (starts.isEmpty()) {
            result.addError("nodes", "Workflow must have exactly one START node, found none");
            return null;
        }
        if (starts.size() > 1) {
            for (String extra : starts.subList(1, starts.size())) {
                result.addError("nodes." + extra, "Workflow must have exactly one START node, found " + starts);
            }
        }

        String startId = starts.get(0);
        for (String id : starts) {
            if (!graph.getIncomingEdgeIndices(id).isEmpty()) {
                result.addError("nodes." + id, "START node cannot have incoming edges");
            }
            List<WorkflowEdge> outgoing = graph.getOutgoingEdges(id);
            if (outgoing.size() != 1 || outgoing.get(0).isConditional()) {
                result.addError("nodes." + id, "START node must have exactly one unconditional outgoing edge, found " +
                        outgoing.size() + " edge(s)");
            }
        }
        return starts.size() == 1 ? startId : null;
    }

    private void validateEnds(WorkflowDefinition definition, WorkflowGraph graph, String startId,
                              ValidationResult result) {
        List<String> ends = new ArrayList<>();
        for (WorkflowNode node : definition.getNodeMap().values()) {
            if (node.getKind() == NodeKind.END) {
                ends.add(node.getId());
                if (!graph.getOutgoingEdgeIndices(node.getId()).isEmpty()) {
                    result.addError("nodes." + node.getId(), "END node cannot have outgoing edges");
                }
            }
        }

        if (ends.isEmpty()) {
            result.addError("nodes", "Workflow must have at least one END node");
            return;
        }
        if (startId == null) {
            return;
        }

        Set<String> reachable = graph.reachableFrom(startId);
        if (ends.stream().noneMatch(reachable::contains)) {
            result.addError("nodes." + startId, "No END node is reachable from START");
        }
        for (String nodeId : definition.getNodeMap().keySet()) {
            if (!reachable.contains(nodeId)) {
                result.addWarning("nodes." + nodeId, "Node is unreachable from START");
            }
        }
    }

    private void validateCycles(WorkflowGraph graph, ValidationResult result) {
        for (List<String> cycle : graph.findCycles()) {
            result.addError("nodes." + cycle.get(0), "Cycle not closed by a loop-back edge: " +
                    String.join(" -> ", cycle) + " -> " + cycle.get(0));
        }
    }

    private void validateConfiguration(WorkflowNode node, ValidationResult result) {
        NodeKind kind = node.getKind();
        for (String key : kind.getRequiredKeys()) {
            if (!node.hasConfig(key)) {
                result.addError(configPath(node, key), "Required configuration key '" + key +
                        "' is missing for " + kind + " node");
            }
        }
        for (String key : node.getConfig().keySet()) {
            if (!kind.isKnownKey(key)) {
                result.addWarning(configPath(node, key), "Configuration key '" + key + "' is not used by " + kind + " nodes");
            }
        }

        Object optional = node.getConfigValue(NodeKind.OPTIONAL_KEY);
        if (optional != null && !(optional instanceof Boolean)) {
            result.addError(configPath(node, NodeKind.OPTIONAL_KEY), "Must be a boolean");
        }

        switch (kind) {
            case AGENT_SPAWN:
            case AGENT_EXECUTE:
                requireMapIfPresent(node, "outputMapping", result);
                break;
            case MCP_CALL:
            case WEBHOOK:
                requireMapIfPresent(node, "payload", result);
                break;
            case JOIN:
                if (node.hasConfig("onBranchFailure") &&
                        BranchFailurePolicy.fromName(node.getConfigString("onBranchFailure")) == null) {
                    result.addError(configPath(node, "onBranchFailure"), "Must be FAIL_FAST or TOLERATE_PARTIAL");
                }
                break;
            case DELAY:
                validateDuration(node, "duration", result);
                break;
            case HUMAN_APPROVAL:
                String action = node.getConfigString("defaultAction");
                if (action != null && !"approve".equalsIgnoreCase(action) && !"reject".equalsIgnoreCase(action)) {
                    result.addError(configPath(node, "defaultAction"), "Must be 'approve' or 'reject'");
                }
                break;
            case DATA_TRANSFORM:
                validateTransform(node, result);
                break;
            default:
                break;
        }
    }

    private void validateRetryAndTimeout(WorkflowNode node, ValidationResult result) {
        RetryPolicy policy = node.getRetryPolicy();
        if (policy != null) {
            if (policy.getMaxAttempts() < 1) {
                result.addError(nodePath(node) + ".retry", "maxAttempts must be at least 1");
            }
            if (policy.getInitialDelay().isNegative() || policy.getMaxDelay().isNegative()) {
                result.addError(nodePath(node) + ".retry", "Retry delays cannot be negative");
            }
        }
        if (node.getTimeout() != null && node.getTimeout().isNegative()) {
            result.addError(nodePath(node) + ".timeout", "Timeout cannot be negative");
        }
    }

    private void validateConditionNode(WorkflowNode node, WorkflowGraph graph, ValidationResult result) {
        List<WorkflowEdge> outgoing = graph.getOutgoingEdges(node.getId());
        if (outgoing.isEmpty()) {
            result.addError(nodePath(node), "CONDITION node must have at least one outgoing edge");
            return;
        }
        int unconditional = 0;
        for (WorkflowEdge edge : outgoing) {
            if (!edge.isConditional()) {
                unconditional++;
            }
        }
        if (unconditional > 1) {
            result.addError(nodePath(node), "CONDITION node can have at most one unconditional (default) edge, found " +
                    unconditional);
        } else if (unconditional == 1 && outgoing.get(outgoing.size() - 1).isConditional()) {
            result.addError(nodePath(node), "The unconditional (default) edge of a CONDITION node must be declared last");
        }
    }

    private void validateJoinNode(WorkflowNode node, WorkflowGraph graph, ValidationResult result) {
        String group = node.getConfigString("joinGroup");
        if (group == null) {
            return;
        }
        int matches = graph.findParallels(group).size();
        if (matches != 1) {
            result.addError(configPath(node, "joinGroup"), "Join group '" + group +
                    "' must match exactly one PARALLEL node, found " + matches);
        }
    }

    private void validateLoopNode(WorkflowNode node, WorkflowGraph graph, ValidationResult result) {
        Object max = node.getConfigValue("maxIterations");
        if (max != null && (!(max instanceof Integer || max instanceof Long) || ((Number) max).longValue() < 1)) {
            result.addError(configPath(node, "maxIterations"), "Must be a positive integer");
        }
        Object iterations = node.getConfigValue("iterations");
        if (iterations != null && (!(iterations instanceof Integer || iterations instanceof Long)
                || ((Number) iterations).longValue() < 0)) {
            result.addError(configPath(node, "iterations"), "Must be a non-negative integer");
        }
        Object forEach = node.getConfigValue("forEach");
        if (forEach != null && !(forEach instanceof String || forEach instanceof List)) {
            result.addError(configPath(node, "forEach"), "Must be a variable name or a list");
        }
        String condition = node.getConfigString("condition");
        if (condition != null) {
            try {
                Condition.parse(condition);
            } catch (Condition.ConditionSyntaxException e) {
                result.addError(configPath(node, "condition"), e.getMessage());
            }
        }
        if (condition == null && iterations == null && forEach == null) {
            result.addError(nodePath(node), "LOOP node needs one of 'condition', 'iterations' or 'forEach'");
        }

        String body = node.getConfigString("body");
        if (body != null) {
            boolean bodyEdge = graph.getOutgoingEdges(node.getId()).stream()
                    .anyMatch(edge -> edge.getTo().equals(body));
            if (!bodyEdge) {
                result.addError(configPath(node, "body"), "Body node '" + body +
                        "' must be the target of an outgoing edge of the LOOP");
            }
        }
        boolean closed = graph.getIncomingEdges(node.getId()).stream().anyMatch(WorkflowEdge::isLoopBack);
        if (!closed) {
            result.addError(nodePath(node), "LOOP node has no loop-back edge closing its body");
        }
    }

    private void validateTransform(WorkflowNode node, ValidationResult result) {
        String name = node.getConfigString("operation");
        if (name == null) {
            return;
        }
        TransformOperation operation = TransformOperation.fromName(name);
        if (operation == null) {
            result.addError(configPath(node, "operation"), "Unknown transform operation '" + name + "'");
            return;
        }
        Object inputs = node.getConfigValue("inputs");
        if (operation.requiresInputs()) {
            if (inputs == null) {
                result.addError(configPath(node, "inputs"), operation + " requires 'inputs'");
            } else if (!(inputs instanceof String || inputs instanceof List)) {
                result.addError(configPath(node, "inputs"), "Must be a variable name or a list of names");
            }
        }
        if (operation == TransformOperation.SET && !node.getConfig().containsKey("value")) {
            result.addError(configPath(node, "value"), "SET requires 'value'");
        }
        if (operation == TransformOperation.TEMPLATE && !node.hasConfig("template")) {
            result.addError(configPath(node, "template"), "TEMPLATE requires 'template'");
        }
    }

    private void validateDuration(WorkflowNode node, String key, ValidationResult result) {
        if (!node.hasConfig(key)) {
            return;
        }
        try {
            Duration duration = node.getConfigDuration(key);
            if (duration.isNegative()) {
                result.addError(configPath(node, key), "Duration cannot be negative");
            }
        } catch (IllegalArgumentException e) {
            result.addError(configPath(node, key), e.getMessage());
        }
    }

    private void requireMapIfPresent(WorkflowNode node, String key, ValidationResult result) {
        Object value = node.getConfigValue(key);
        if (value != null && !(value instanceof Map)) {
            result.addError(configPath(node, key), "Must be a map");
        }
    }

    private static String nodePath(WorkflowNode node) {
        return "nodes." + node.getId();
    }

    private static String configPath(WorkflowNode node, String key) {
        return "nodes." + node.getId() + ".config." + key;
    }
}
