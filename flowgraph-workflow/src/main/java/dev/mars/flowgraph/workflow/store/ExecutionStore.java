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

import dev.mars.flowgraph.workflow.engine.ExecutionStatus;
import dev.mars.flowgraph.workflow.engine.WorkflowExecution;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Keeps execution snapshots. Once a stored execution is terminal it is read-only history:
 * further writes are refused.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ExecutionStore {

    /**
     * Stores a new execution.
     *
     * @throws IllegalStateException if an execution with the same id exists
     */
    void create(WorkflowExecution execution);

    /**
     * Replaces the snapshot of a stored execution.
     *
     * @throws IllegalStateException if the execution is unknown or already terminal
     */
    void update(WorkflowExecution execution);

    Optional<WorkflowExecution> get(String executionId);

    List<WorkflowExecution> list();

    List<WorkflowExecution> listByStatus(ExecutionStatus status);

    /**
     * Removes terminal executions that ended more than {@code maxAge} ago.
     *
     * @return the number of executions removed
     */
    int purgeCompleted(Duration maxAge);
}
