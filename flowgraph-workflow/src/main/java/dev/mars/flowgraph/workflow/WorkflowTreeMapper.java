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
import java.util.Locale;
import java.util.Map;

/**
 * Converts workflow definitions to and from a tree of maps, lists and scalars.
 * The tree is what the YAML and JSON parsers read and write; {@code fromTree(toTree(d))} equals {@code d}.
 * <p>
 * Default variables sit under {@code variables}. An entry is either the value itself or a mapping with a
 * {@code value} key, whose descriptive keys ({@code type}, {@code description}) are ignored on import;
 * mapping values are always written in the second form.
 * Durations are written as ISO-8601 ({@code PT30S}); the short forms {@code 30s}, {@code 5m},
 * {@code 250ms} are accepted on import.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowTreeMapper {

    public Map<String, Object> toTree(WorkflowDefinition definition) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", definition.getId());
        tree.put("name", definition.getName());
        if (definition.getDescription() != null) {
            tree.put("description", definition.getDescription());
        }
        if (!definition.getMetadata().isEmpty()) {
            tree.put("metadata", definition.getMetadata());
        }
        if (definition.getTimeout() != null) {
            tree.put("timeout", definition.getTimeout().toString());
        }
        if (!definition.getVariables().isEmpty()) {
            Map<String, Object> variables = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : definition.getVariables().entrySet()) {
                // mapping values are wrapped so that a "value" key inside them survives import
                Object value = entry.getValue();
                variables.put(entry.getKey(), value instanceof Map ? Map.of("value", value) : value);
            }
            tree.put("variables", variables);
        }

        List<Object> nodes = new ArrayList<>();
        for (WorkflowNode node : definition.getNodes()) {
            nodes.add(nodeToTree(node));
        }
        tree.put("nodes", nodes);

        List<Object> edges = new ArrayList<>();
        for (WorkflowEdge edge : definition.getEdges()) {
            Map<String, Object> edgeTree = new LinkedHashMap<>();
            edgeTree.put("from", edge.getFrom());
            edgeTree.put("to", edge.getTo());
            if (edge.isConditional()) {
                edgeTree.put("condition", edge.getCondition().getExpression());
            }
            if (edge.isLoopBack()) {
                edgeTree.put("loopBack", true);
            }
            edges.add(edgeTree);
        }
        tree.put("edges", edges);
        return tree;
    }

    private Map<String, Object> nodeToTree(WorkflowNode node) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", node.getId());
        tree.put("kind", node.getKind().name());
        if (node.getLabel() != null) {
            tree.put("label", node.getLabel());
        }
        if (node.getTimeout() != null) {
            tree.put("timeout", node.getTimeout().toString());
        }
        RetryPolicy retry = node.getRetryPolicy();
        if (retry != null) {
            Map<String, Object> retryTree = new LinkedHashMap<>();
            retryTree.put("maxAttempts", retry.getMaxAttempts());
            retryTree.put("backoff", retry.getBackoff().name());
            retryTree.put("initialDelay", retry.getInitialDelay().toString());
            retryTree.put("maxDelay", retry.getMaxDelay().toString());
            retryTree.put("multiplier", retry.getMultiplier());
            tree.put("retry", retryTree);
        }
        if (!node.getConfig().isEmpty()) {
            tree.put("config", node.getConfig());
        }
        return tree;
    }

    /**
     * Reads a definition from a tree. The result is not validated.
     *
     * @throws WorkflowParseException if the tree is structurally malformed or a condition cannot be parsed
     */
    public WorkflowDefinition fromTree(Map<String, Object> tree) throws WorkflowParseException {
        if (tree == null) {
            throw new WorkflowParseException("Workflow document is empty");
        }
        String id = getStringValue(tree, "id");
        if (id == null || id.trim().isEmpty()) {
            throw new WorkflowParseException(null, "id", "Workflow id is required");
        }
        String name = getStringValue(tree, "name", id);
        String description = getStringValue(tree, "description");
        Map<String, Object> metadata = getMapValue(tree, "metadata", id, "metadata");
        Map<String, Object> variables = parseVariables(getMapValue(tree, "variables", id, "variables"));
        Duration timeout = tree.get("timeout") != null ? parseDuration(tree.get("timeout"), id, "timeout") : null;

        List<WorkflowNode> nodes = new ArrayList<>();
        List<Object> nodeList = getListValue(tree, "nodes", id, "nodes");
        for (int i = 0; i < nodeList.size(); i++) {
            nodes.add(parseNode(id, "nodes[" + i + "]", asMap(nodeList.get(i), id, "nodes[" + i + "]")));
        }

        List<WorkflowEdge> edges = new ArrayList<>();
        List<Object> edgeList = getListValue(tree, "edges", id, "edges");
        for (int i = 0; i < edgeList.size(); i++) {
            edges.add(parseEdge(id, "edges[" + i + "]", asMap(edgeList.get(i), id, "edges[" + i + "]")));
        }

        return new WorkflowDefinition(id, name, description, nodes, edges, metadata, variables, timeout);
    }

    private Map<String, Object> parseVariables(Map<String, Object> data) {
        Map<String, Object> variables = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map && ((Map<?, ?>) value).containsKey("value")) {
                value = ((Map<?, ?>) value).get("value");
            }
            variables.put(String.valueOf(entry.getKey()), value);
        }
        return variables;
    }

    private WorkflowNode parseNode(String workflowId, String path, Map<String, Object> data)
            throws WorkflowParseException {
        String nodeId = getStringValue(data, "id");
        if (nodeId == null) {
            throw new WorkflowParseException(workflowId, path + ".id", "Node id is required");
        }
        String kindName = getStringValue(data, "kind");
        if (kindName == null) {
            throw new WorkflowParseException(workflowId, path + ".kind", "Node kind is required");
        }
        NodeKind kind;
        try {
            kind = NodeKind.valueOf(kindName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(workflowId, path + ".kind", "Unknown node kind '" + kindName + "'", e);
        }

        WorkflowNode.Builder builder = WorkflowNode.builder(nodeId, kind)
                .label(getStringValue(data, "label"))
                .config(getMapValue(data, "config", workflowId, path + ".config"));
        if (data.get("timeout") != null) {
            builder.timeout(parseDuration(data.get("timeout"), workflowId, path + ".timeout"));
        }
        if (data.get("retry") != null) {
            builder.retryPolicy(parseRetry(getMapValue(data, "retry", workflowId, path + ".retry"),
                    workflowId, path + ".retry"));
        }
        return builder.build();
    }

    private RetryPolicy parseRetry(Map<String, Object> data, String workflowId, String path)
            throws WorkflowParseException {
        RetryPolicy.Builder builder = RetryPolicy.builder()
                .maxAttempts(getIntValue(data, "maxAttempts", 1, workflowId, path));
        String backoff = getStringValue(data, "backoff");
        if (backoff != null) {
            try {
                builder.backoff(BackoffShape.valueOf(backoff.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(workflowId, path + ".backoff", "Unknown backoff shape '" + backoff + "'", e);
            }
        }
        if (data.get("initialDelay") != null) {
            builder.initialDelay(parseDuration(data.get("initialDelay"), workflowId, path + ".initialDelay"));
        }
        if (data.get("maxDelay") != null) {
            builder.maxDelay(parseDuration(data.get("maxDelay"), workflowId, path + ".maxDelay"));
        }
        Object multiplier = data.get("multiplier");
        if (multiplier instanceof Number) {
            builder.multiplier(((Number) multiplier).doubleValue());
        } else if (multiplier != null) {
            throw new WorkflowParseException(workflowId, path + ".multiplier", "Multiplier must be a number");
        }
        return builder.build();
    }

    private WorkflowEdge parseEdge(String workflowId, String path, Map<String, Object> data)
            throws WorkflowParseException {
        String from = getStringValue(data, "from");
        String to = getStringValue(data, "to");
        if (from == null) {
            throw new WorkflowParseException(workflowId, path + ".from", "Edge source is required");
        }
        if (to == null) {
            throw new WorkflowParseException(workflowId, path + ".to", "Edge target is required");
        }
        Condition condition = null;
        String expression = getStringValue(data, "condition");
        if (expression != null) {
            try {
                condition = Condition.parse(expression);
            } catch (Condition.ConditionSyntaxException e) {
                throw new WorkflowParseException(workflowId, path + ".condition", e.getMessage(), e);
            }
        }
        return new WorkflowEdge(from, to, condition, getBooleanValue(data, "loopBack", false));
    }

    // Utility methods for safe type conversion

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key, String workflowId, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(workflowId, path, "Expected a mapping but found " + describe(value));
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private List<Object> getListValue(Map<String, Object> data, String key, String workflowId, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(workflowId, path, "Expected a list but found " + describe(value));
        }
        return (List<Object>) value;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String workflowId, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(workflowId, path, "Expected a mapping but found " + describe(value));
        }
        return (Map<String, Object>) value;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue, String workflowId, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(workflowId, path + "." + key, "Expected an integer but found '" + value + "'", e);
        }
    }

    private Duration parseDuration(Object value, String workflowId, String path) throws WorkflowParseException {
        try {
            return TreeValues.parseDuration(value);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(workflowId, path, e.getMessage(), e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName();
    }
}
