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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed unit of work or control flow in a workflow graph.
 * Configuration is an immutable key/value tree interpreted according to the node's {@link NodeKind}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final NodeKind kind;
    private final Map<String, Object> config;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final String label;

    public WorkflowNode(String id, NodeKind kind, Map<String, ?> config, RetryPolicy retryPolicy,
                        Duration timeout, String label) {
        this.id = Objects.requireNonNull(id, "Node ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.config = TreeValues.normalizeMap(config);
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.label = label;
    }

    public static Builder builder(String id, NodeKind kind) {
        return new Builder(id, kind);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Gets the retry policy declared on this node, or null when the engine default applies.
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getLabel() {
        return label;
    }

    public String getDisplayName() {
        return label != null ? label : id;
    }

    public boolean isOptional() {
        Object value = config.get(NodeKind.OPTIONAL_KEY);
        return Boolean.TRUE.equals(value) || "true".equals(value);
    }

    public boolean hasConfig(String key) {
        return config.get(key) != null;
    }

    public Object getConfigValue(String key) {
        return config.get(key);
    }

    public String getConfigString(String key) {
        return getConfigString(key, null);
    }

    public String getConfigString(String key, String defaultValue) {
        Object value = config.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getConfigInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getConfigMap(String key) {
        Object value = config.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    @SuppressWarnings("unchecked")
    public List<Object> getConfigList(String key) {
        Object value = config.get(key);
        return value instanceof List ? (List<Object>) value : List.of();
    }

    /**
     * Reads a duration-valued key ({@code PT5S}, {@code 5s}, {@code 250ms} or milliseconds).
     *
     * @throws IllegalArgumentException if the value is not a readable duration
     */
    public Duration getConfigDuration(String key) {
        return TreeValues.parseDuration(config.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return Objects.equals(id, that.id) &&
               kind == that.kind &&
               Objects.equals(config, that.config) &&
               Objects.equals(retryPolicy, that.retryPolicy) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, config, retryPolicy, timeout, label);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
               "id='" + id + '\'' +
               ", kind=" + kind +
               ", config=" + config +
               (retryPolicy != null ? ", retryPolicy=" + retryPolicy : "") +
               (timeout != null ? ", timeout=" + timeout : "") +
               '}';
    }

    /**
     * Builder for WorkflowNode.
     */
    public static class Builder {
        private final String id;
        private final NodeKind kind;
        private final Map<String, Object> config = new LinkedHashMap<>();
        private RetryPolicy retryPolicy;
        private Duration timeout;
        private String label;

        private Builder(String id, NodeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder config(Map<String, ?> config) {
            if (config != null) {
                this.config.putAll(config);
            }
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder optional(boolean optional) {
            if (optional) {
                this.config.put(NodeKind.OPTIONAL_KEY, true);
            } else {
                this.config.remove(NodeKind.OPTIONAL_KEY);
            }
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(id, kind, config, retryPolicy, timeout, label);
        }
    }
}
