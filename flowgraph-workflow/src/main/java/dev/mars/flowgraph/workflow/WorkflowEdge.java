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

import java.util.Objects;

/**
 * Directed connection between two nodes, optionally guarded by a {@link Condition}.
 * A loop-back edge closes the body of a LOOP node and is the only way a cycle may be formed.
 */
public final class WorkflowEdge {

    private final String from;
    private final String to;
    private final Condition condition;
    private final boolean loopBack;

    public WorkflowEdge(String from, String to) {
        this(from, to, null, false);
    }

    public WorkflowEdge(String from, String to, Condition condition) {
        this(from, to, condition, false);
    }

    public WorkflowEdge(String from, String to, Condition condition, boolean loopBack) {
        this.from = Objects.requireNonNull(from, "Edge source cannot be null");
        this.to = Objects.requireNonNull(to, "Edge target cannot be null");
        this.condition = condition;
        this.loopBack = loopBack;
    }

    public static WorkflowEdge loopBack(String from, String loopId) {
        return new WorkflowEdge(from, loopId, null, true);
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public Condition getCondition() {
        return condition;
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isLoopBack() {
        return loopBack;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowEdge that = (WorkflowEdge) o;
        return loopBack == that.loopBack &&
               from.equals(that.from) &&
               to.equals(that.to) &&
               Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, condition, loopBack);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(from).append(loopBack ? " ~> " : " -> ").append(to);
        if (condition != null) {
            sb.append(" [").append(condition.getExpression()).append("]");
        }
        return sb.toString();
    }
}
