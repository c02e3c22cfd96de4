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

import dev.mars.flowgraph.workflow.NodeKind;

import java.util.Map;
import java.util.Objects;

/**
 * Work handed to a {@link TaskExecutor} for an AGENT_SPAWN or AGENT_EXECUTE node.
 * The configuration has its {@code {{var}}} references resolved; the variables are a snapshot
 * taken at dispatch.
 */
public final class TaskRequest {

    private final String executionId;
    private final String nodeId;
    private final NodeKind kind;
    private final Map<String, Object> config;
    private final Map<String, Object> variables;
    private final int attempt;

    public TaskRequest(String executionId, String nodeId, NodeKind kind, Map<String, Object> config,
                       Map<String, Object> variables, int attempt) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.config = config != null ? config : Map.of();
        this.variables = variables != null ? variables : Map.of();
        this.attempt = attempt;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public String getConfigString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * One-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "TaskRequest{" +
               "executionId='" + executionId + '\'' +
               ", nodeId='" + nodeId + '\'' +
               ", kind=" + kind +
               ", attempt=" + attempt +
               '}';
    }
}
