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
 * Immutable state of one node in one execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class NodeState {

    private static final NodeState PENDING = new NodeState(NodeStatus.PENDING, 0, null, null, null);

    private final NodeStatus status;
    private final int attempts;
    private final String errorMessage;
    private final ErrorKind errorKind;
    private final Object output;

    public NodeState(NodeStatus status, int attempts, String errorMessage, ErrorKind errorKind, Object output) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative: " + attempts);
        }
        this.attempts = attempts;
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
        this.output = output;
    }

    public static NodeState pending() {
        return PENDING;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public Object getOutput() {
        return output;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public NodeState withStatus(NodeStatus newStatus) {
        return new NodeState(newStatus, attempts, errorMessage, errorKind, output);
    }

    /**
     * Moves to RUNNING and counts one more attempt.
     */
    public NodeState startAttempt() {
        return new NodeState(NodeStatus.RUNNING, attempts + 1, errorMessage, errorKind, output);
    }

    public NodeState succeeded(Object result) {
        return new NodeState(NodeStatus.SUCCEEDED, attempts, null, null, result);
    }

    public NodeState withError(NodeStatus newStatus, ErrorKind kind, String message) {
        return new NodeState(newStatus, attempts, message, kind, output);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeState that = (NodeState) o;
        return attempts == that.attempts &&
               status == that.status &&
               Objects.equals(errorMessage, that.errorMessage) &&
               errorKind == that.errorKind &&
               Objects.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, attempts, errorMessage, errorKind, output);
    }

    @Override
    public String toString() {
        return "NodeState{" +
               "status=" + status +
               ", attempts=" + attempts +
               (errorKind != null ? ", errorKind=" + errorKind + ", error='" + errorMessage + '\'' : "") +
               (output != null ? ", output=" + output : "") +
               '}';
    }
}
