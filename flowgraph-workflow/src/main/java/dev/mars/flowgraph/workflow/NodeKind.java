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

import java.util.Set;

/**
 * Closed set of node kinds a workflow graph can contain.
 * Each kind carries the configuration keys it requires and the ones it understands.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum NodeKind {

    START(Set.of(), Set.of()),
    END(Set.of(), Set.of()),
    AGENT_SPAWN(Set.of("agentType"), Set.of("role", "instructions", "tools", "outputKey", "outputMapping")),
    AGENT_EXECUTE(Set.of("task"), Set.of("agentId", "expectedOutcome", "outputKey", "outputMapping")),
    CONDITION(Set.of(), Set.of()),
    PARALLEL(Set.of(), Set.of("joinGroup")),
    JOIN(Set.of("joinGroup", "onBranchFailure"), Set.of()),
    LOOP(Set.of("maxIterations", "body"), Set.of("condition", "iterations", "forEach", "itemVariable")),
    DELAY(Set.of("duration"), Set.of()),
    MCP_CALL(Set.of("server", "tool"), Set.of("payload", "responseKey")),
    WEBHOOK(Set.of("url"), Set.of("method", "payload", "responseKey")),
    HUMAN_APPROVAL(Set.of(), Set.of("message", "defaultAction")),
    DATA_TRANSFORM(Set.of("operation", "output"), Set.of("inputs", "value", "template", "separator"));

    /** Configuration key accepted by every kind; marks a node best-effort. */
    public static final String OPTIONAL_KEY = "optional";

    private final Set<String> requiredKeys;
    private final Set<String> optionalKeys;

    NodeKind(Set<String> requiredKeys, Set<String> optionalKeys) {
        this.requiredKeys = requiredKeys;
        this.optionalKeys = optionalKeys;
    }

    public Set<String> getRequiredKeys() {
        return requiredKeys;
    }

    public Set<String> getOptionalKeys() {
        return optionalKeys;
    }

    public boolean isKnownKey(String key) {
        return OPTIONAL_KEY.equals(key) || requiredKeys.contains(key) || optionalKeys.contains(key);
    }

    /**
     * Kinds delegated to a {@code TaskExecutor}.
     */
    public boolean isAgent() {
        return this == AGENT_SPAWN || this == AGENT_EXECUTE;
    }

    /**
     * Kinds delegated to an {@code ExternalService}.
     */
    public boolean isServiceCall() {
        return this == MCP_CALL || this == WEBHOOK;
    }
}
