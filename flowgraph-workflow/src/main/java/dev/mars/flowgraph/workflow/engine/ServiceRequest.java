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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A call to an {@link ExternalService} for an MCP_CALL or WEBHOOK node.
 * The target is {@code server/tool} for MCP calls and the URL for webhooks.
 */
public final class ServiceRequest {

    private final String executionId;
    private final String nodeId;
    private final NodeKind kind;
    private final String target;
    private final String method;
    private final Map<String, Object> payload;
    private final Duration timeout;
    private final int attempt;

    public ServiceRequest(String executionId, String nodeId, NodeKind kind, String target, String method,
                          Map<String, Object> payload, Duration timeout, int attempt) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.method = method;
        this.payload = payload != null ? payload : Map.of();
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
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

    public String getTarget() {
        return target;
    }

    /**
     * HTTP method for webhooks, null for MCP calls.
     */
    public String getMethod() {
        return method;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * The bound the engine enforces; implementations may use it for their own transport timeouts.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "ServiceRequest{" +
               "nodeId='" + nodeId + '\'' +
               ", kind=" + kind +
               ", target='" + target + '\'' +
               (method != null ? ", method=" + method : "") +
               ", timeout=" + timeout +
               ", attempt=" + attempt +
               '}';
    }
}
