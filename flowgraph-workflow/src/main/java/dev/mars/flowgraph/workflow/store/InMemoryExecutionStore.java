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

package dev.mars.flowgraph.workflow.store;

import dev.mars.flowgraph.config.FlowgraphConfiguration;
import dev.mars.flowgraph.workflow.engine.ExecutionStatus;
import dev.mars.flowgraph.workflow.engine.WorkflowExecution;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * In-memory implementation of {@link ExecutionStore}.
 *
 * <p>Provides no durability: all executions are lost when the process terminates.
 * Terminal executions stay until purged; {@link #purgeCompleted()} uses
 * {@code flowgraph.store.max.age.ms}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class InMemoryExecutionStore implements ExecutionStore {

    private static final Logger logger = Logger.getLogger(InMemoryExecutionStore.class.getName());

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Duration maxAge;

    public InMemoryExecutionStore() {
        this(new FlowgraphConfiguration());
    }

    public InMemoryExecutionStore(FlowgraphConfiguration configuration) {
        this.maxAge = Duration.ofMillis(configuration.getStoreMaxAgeMs());
    }

    @Override
    public void create(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        WorkflowExecution existing = executions.putIfAbsent(execution.getExecutionId(), execution);
        if (existing != null) {
            throw new IllegalStateException("Execution already exists: " + execution.getExecutionId());
        }
        logger.fine("Stored execution " + execution.getExecutionId() + " with status " + execution.getStatus());
    }

    @Override
    public void update(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        executions.compute(execution.getExecutionId(), (id, current) -> {
            if (current == null) {
                throw new IllegalStateException("Unknown execution: " + id);
            }
            if (current.isTerminal()) {
                throw new IllegalStateException("Execution " + id + " is " + current.getStatus() + " and read-only");
            }
            return execution;
        });
    }

    @Override
    public Optional<WorkflowExecution> get(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> list() {
        return executions.values().stream()
                .sorted(Comparator.comparing(WorkflowExecution::getStartTime,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public List<WorkflowExecution> listByStatus(ExecutionStatus status) {
        return list().stream()
                .filter(execution -> execution.getStatus() == status)
                .toList();
    }

    @Override
    public int purgeCompleted(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        for (WorkflowExecution execution : executions.values()) {
            boolean expired = execution.isTerminal()
                    && execution.getEndTime().map(end -> !end.isAfter(cutoff)).orElse(false);
            if (expired && executions.remove(execution.getExecutionId(), execution)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Purged " + removed + " completed executions older than " + maxAge);
        }
        return removed;
    }

    /**
     * Purges with the configured maximum age.
     */
    public int purgeCompleted() {
        return purgeCompleted(maxAge);
    }

    public int size() {
        return executions.size();
    }
}
