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

package dev.mars.flowgraph.core.exceptions;

import dev.mars.flowgraph.core.ErrorKind;

/**
 * Failure of a single node inside a workflow run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NodeExecutionException extends FlowgraphException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, ErrorKind errorKind, String message) {
        super(errorKind, message);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, ErrorKind errorKind, String message, Throwable cause) {
        super(errorKind, message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Message without the node prefix, as recorded in node state.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Node %s failed [%s]: %s", nodeId, getErrorKind(), super.getMessage());
    }
}
