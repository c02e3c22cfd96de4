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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workflow graph: nodes, edges and free-form metadata, plus default values for shared
 * variables and an optional limit on the wall-clock time of a run.
 * <p>
 * The constructor only enforces non-null parts. Structural rules (unique ids, a single START,
 * reachable END, no unintended cycles) are checked by {@link WorkflowValidator} so that an invalid
 * definition can still be represented and reported in full.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final List<WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;
    private final Map<String, Object> metadata;
    private final Map<String, Object> variables;
    private final Duration timeout;
    private final Map<String, WorkflowNode> nodesById;

    public WorkflowDefinition(String id, String name, String description, List<WorkflowNode> nodes,
                              List<WorkflowEdge> edges, Map<String, ?> metadata) {
        this(id, name, description, nodes, edges, metadata, Map.of(), null);
    }

    public WorkflowDefinition(String id, String name, String description, List<WorkflowNode> nodes,
                              List<WorkflowEdge> edges, Map<String, ?> metadata,
                              Map<String, ?> variables, Duration timeout) {
        this.id = Objects.requireNonNull(id, "Workflow ID cannot be null");
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.description = description;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.metadata = TreeValues.normalizeMap(metadata);
        this.variables = TreeValues.normalizeMap(variables);
        this.timeout = timeout;

        Map<String, WorkflowNode> index = new LinkedHashMap<>();
        for (WorkflowNode node : this.nodes) {
            index.putIfAbsent(node.getId(), node);
        }
        this.nodesById = Collections.unmodifiableMap(index);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Gets the nodes in declaration order, including duplicates if any were declared.
     */
    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    /**
     * Gets the nodes keyed by id; when an id is declared twice the first declaration wins.
     */
    public Map<String, WorkflowNode> getNodeMap() {
        return nodesById;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    public List<WorkflowEdge> getEdges() {
        return edges;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Gets the default values of shared variables. A run seeds each one unless its execution context
     * already supplies a value under the same name.
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * Gets the limit on the wall-clock time of a run, or null for none.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public Optional<WorkflowNode> getStartNode() {
        return nodes.stream().filter(node -> node.getKind() == NodeKind.START).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(edges, that.edges) &&
               Objects.equals(metadata, that.metadata) &&
               Objects.equals(variables, that.variables) &&
               Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, nodes, edges, metadata, variables, timeout);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               ", edges=" + edges.size() +
               (timeout != null ? ", timeout=" + timeout : "") +
               '}';
    }
}
