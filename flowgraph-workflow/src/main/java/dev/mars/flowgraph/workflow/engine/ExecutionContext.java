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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller-supplied settings for one execution: the execution id, generated when none is given, and
 * the variables that seed the run's shared store. Variable values may be null.
 */
public class ExecutionContext {

    private final String executionId;
    private final Map<String, Object> variables;

    private ExecutionContext(Builder builder) {
        this.executionId = builder.executionId != null ? builder.executionId : UUID.randomUUID().toString();
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
    }

    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * A context with a generated id and no seed variables.
     */
    public static ExecutionContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionContext that = (ExecutionContext) o;
        return executionId.equals(that.executionId) && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, variables);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "executionId='" + executionId + '\'' +
               ", variables=" + variables.keySet() +
               '}';
    }

    public static class Builder {
        private String executionId;
        private final Map<String, Object> variables = new LinkedHashMap<>();

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(Objects.requireNonNull(name, "Variable name cannot be null"), value);
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
