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

package dev.mars.flowgraph.workflow.observability;

import dev.mars.flowgraph.workflow.engine.NodeStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * A node of a running workflow changed status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class NodeTransitionEvent {

    private final String executionId;
    private final String nodeId;
    private final NodeStatus oldStatus;
    private final NodeStatus newStatus;
    private final Instant timestamp;

    public NodeTransitionEvent(String executionId, String nodeId, NodeStatus oldStatus,
                               NodeStatus newStatus, Instant timestamp) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.oldStatus = Objects.requireNonNull(oldStatus, "Old status cannot be null");
        this.newStatus = Objects.requireNonNull(newStatus, "New status cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeStatus getOldStatus() {
        return oldStatus;
    }

    public NodeStatus getNewStatus() {
        return newStatus;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeTransitionEvent that = (NodeTransitionEvent) o;
        return Objects.equals(executionId, that.executionId) &&
               Objects.equals(nodeId, that.nodeId) &&
               oldStatus == that.oldStatus &&
               newStatus == that.newStatus &&
               Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, nodeId, oldStatus, newStatus, timestamp);
    }

    @Override
    public String toString() {
        return "NodeTransitionEvent{" +
               "executionId='" + executionId + '\'' +
               ", nodeId='" + nodeId + '\'' +
               ", " + oldStatus + " -> " + newStatus +
               ", timestamp=" + timestamp +
               '}';
    }
}
