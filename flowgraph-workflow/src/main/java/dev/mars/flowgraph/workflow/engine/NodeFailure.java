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

import dev.mars.flowgraph.core.ErrorKind;

import java.util.Objects;

/**
 * Why a run failed. The node id is null for failures that belong to no node, such as a run
 * that stopped without reaching an END.
 */
public final class NodeFailure {

    private final String nodeId;
    private final ErrorKind errorKind;
    private final String message;

    public NodeFailure(String nodeId, ErrorKind errorKind, String message) {
        this.nodeId = nodeId;
        this.errorKind = Objects.requireNonNull(errorKind, "Error kind cannot be null");
        this.message = message;
    }

    public String getNodeId() {
        return nodeId;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeFailure that = (NodeFailure) o;
        return Objects.equals(nodeId, that.nodeId) &&
               errorKind == that.errorKind &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, errorKind, message);
    }

    @Override
    public String toString() {
        return "NodeFailure{" +
               "nodeId='" + nodeId + '\'' +
               ", errorKind=" + errorKind +
               ", message='" + message + '\'' +
               '}';
    }
}
