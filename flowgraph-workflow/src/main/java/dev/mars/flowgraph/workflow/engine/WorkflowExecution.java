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

import dev.mars.flowgraph.workflow.WorkflowDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a workflow execution, as written to the execution store.
 * Besides the outcome it carries the routing state (edge statuses by edge index and loop counters)
 * needed to resume the run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowExecution {

    private final String executionId;
    private final WorkflowDefinition definition;
    private final ExecutionStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Map<String, Object> variables;
    private final Map<String, NodeState> nodeStates;
    private final List<NodeFailure> failures;
    private final String completedBy;
    private final List<EdgeStatus> edgeStatuses;
    private final Map<String, Integer> loopIterations;

    private WorkflowExecution(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.definition = Objects.requireNonNull(builder.definition, "Definition cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        // outputs may be null
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.nodeStates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeStates));
        this.failures = List.copyOf(builder.failures);
        this.completedBy = builder.completedBy;
        this.edgeStatuses = List.copyOf(builder.edgeStatuses);
        this.loopIterations = Map.copyOf(builder.loopIterations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .executionId(executionId)
                .definition(definition)
                .status(status)
                .startTime(startTime)
                .endTime(endTime)
                .variables(variables)
                .nodeStates(nodeStates)
                .failures(failures)
                .completedBy(completedBy)
                .edgeStatuses(edgeStatuses)
                .loopIterations(loopIterations);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return definition.getId();
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }

    public Map<String, NodeState> getNodeStates() {
        return nodeStates;
    }

    /**
     * @throws IllegalArgumentException if the definition has no such node
     */
    public NodeState getNodeState(String nodeId) {
        NodeState state = nodeStates.get(nodeId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return state;
    }

    public List<NodeFailure> getFailures() {
        return failures;
    }

    /**
     * Id of the END node that completed the run, if one was reached.
     */
    public Optional<String> getCompletedBy() {
        return Optional.ofNullable(completedBy);
    }

    public List<EdgeStatus> getEdgeStatuses() {
        return edgeStatuses;
    }

    public Map<String, Integer> getLoopIterations() {
        return loopIterations;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.SUCCEEDED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(executionId, that.executionId) &&
               status == that.status &&
               Objects.equals(nodeStates, that.nodeStates) &&
               Objects.equals(variables, that.variables) &&
               Objects.equals(failures, that.failures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, status);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + getWorkflowId() + '\'' +
               ", status=" + status +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               ", failures=" + failures +
               '}';
    }

    /**
     * Builder for WorkflowExecution.
     */
    public static class Builder {
        private String executionId;
        private WorkflowDefinition definition;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private Instant startTime;
        private Instant endTime;
        private Map<String, Object> variables = Map.of();
        private Map<String, NodeState> nodeStates = Map.of();
        private List<NodeFailure> failures = List.of();
        private String completedBy;
        private List<EdgeStatus> edgeStatuses = List.of();
        private Map<String, Integer> loopIterations = Map.of();

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder definition(WorkflowDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables != null ? variables : Map.of();
            return this;
        }

        public Builder nodeStates(Map<String, NodeState> nodeStates) {
            this.nodeStates = nodeStates != null ? nodeStates : Map.of();
            return this;
        }

        public Builder failures(List<NodeFailure> failures) {
            this.failures = failures != null ? failures : List.of();
            return this;
        }

        public Builder completedBy(String completedBy) {
            this.completedBy = completedBy;
            return this;
        }

        public Builder edgeStatuses(List<EdgeStatus> edgeStatuses) {
            this.edgeStatuses = edgeStatuses != null ? edgeStatuses : List.of();
            return this;
        }

        public Builder loopIterations(Map<String, Integer> loopIterations) {
            this.loopIterations = loopIterations != null ? loopIterations : Map.of();
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(this);
        }
    }
}
