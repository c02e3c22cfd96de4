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
import dev.mars.flowgraph.workflow.observability.NodeTransitionListener;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing workflow graphs.
 */
public interface WorkflowEngine extends ApprovalSignals {

    /**
     * Validates and runs a workflow definition.
     *
     * @param definition the workflow definition to execute
     * @param context the execution context; its variables seed the shared store
     * @return future completing with the terminal snapshot of the execution, or failing with
     *         {@link dev.mars.flowgraph.workflow.InvalidDefinitionException} if the definition is invalid
     */
    CompletableFuture<WorkflowExecution> execute(WorkflowDefinition definition, ExecutionContext context);

    /**
     * Continues a non-terminal execution found in the execution store. An execution stored as PAUSED
     * is attached again but stays paused until {@link #resume(String)}.
     *
     * @param executionId the execution to continue
     * @param definition the definition the execution was started with
     * @return future completing with the terminal snapshot
     */
    CompletableFuture<WorkflowExecution> resume(String executionId, WorkflowDefinition definition);

    /**
     * Pauses a running execution. Work already dispatched completes and its results are recorded,
     * but no further node is dispatched until {@link #resume(String)}. The stored status is PAUSED.
     *
     * @return true if the execution was running and is now paused
     */
    boolean pause(String executionId);

    /**
     * Continues an execution paused on this engine.
     *
     * @return true if the execution was paused and is running again
     */
    boolean resume(String executionId);

    /**
     * Gets the latest snapshot of an execution.
     */
    Optional<WorkflowExecution> getExecution(String executionId);

    /**
     * Gets the status of an execution.
     *
     * @return the status, or null if the execution is unknown
     */
    ExecutionStatus getStatus(String executionId);

    /**
     * Cancels a running workflow execution.
     *
     * @param executionId the execution ID
     * @return true if the workflow was cancelled
     */
    boolean cancel(String executionId);

    void addTransitionListener(NodeTransitionListener listener);

    void removeTransitionListener(NodeTransitionListener listener);

    /**
     * Shuts down the workflow engine and cleans up resources.
     * Runs still in progress are left in the store as they are and can be resumed by another engine.
     */
    void shutdown();
}
