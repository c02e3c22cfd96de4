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
 * Decisions for HUMAN_APPROVAL nodes.
 */
public interface ApprovalSignals {

    /**
     * @return true if the node was awaiting approval and is now approved
     */
    boolean approve(String executionId, String nodeId);

    /**
     * @return true if the node was awaiting approval and is now rejected
     */
    boolean reject(String executionId, String nodeId, String reason);
}
