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

/**
 * Performs the work behind agent nodes. Called on an engine worker thread; may block.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface TaskExecutor {

    /**
     * Executes one attempt of a node.
     *
     * @return the node output, stored under the node's output key
     * @throws Exception any failure, reported as an executor failure and retried per the node's policy
     */
    Object execute(TaskRequest request) throws Exception;

    /**
     * Called when the engine gives up on a running attempt (timeout or cancellation).
     * The worker thread is interrupted as well.
     */
    default void cancel(String executionId, String nodeId) {
        // nothing to release by default
    }
}
