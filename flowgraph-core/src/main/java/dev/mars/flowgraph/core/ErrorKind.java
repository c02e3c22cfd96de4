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

package dev.mars.flowgraph.core;

/**
 * Classification of everything that can go wrong while defining or running a workflow.
 *
 * <p>The kind decides how the engine reacts: recoverable kinds are retried according to
 * the node's retry policy, every other kind fails the node on the spot.</p>
 *
 * <ul>
 *   <li>Caller errors: {@link #INVALID_DEFINITION}, {@link #TEMPLATE_NOT_FOUND},
 *       {@link #MISSING_PARAMETER}</li>
 *   <li>Recoverable: {@link #EXECUTOR_FAILURE}, {@link #SERVICE_FAILURE},
 *       {@link #TIMEOUT_EXCEEDED}</li>
 *   <li>Graph logic: {@link #NO_MATCHING_BRANCH}, {@link #JOINED_BRANCH_FAILED},
 *       {@link #LOOP_BOUND_EXCEEDED}, {@link #APPROVAL_REJECTED},
 *       {@link #TRANSFORM_FAILED}, {@link #NO_END_REACHED}</li>
 *   <li>Caller initiated: {@link #RUN_CANCELLED}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ErrorKind {

    /**
     * The workflow definition failed structural validation.
     */
    INVALID_DEFINITION,

    /**
     * A task executor behind an agent node failed.
     */
    EXECUTOR_FAILURE,

    /**
     * An external service behind an MCP or webhook node failed.
     */
    SERVICE_FAILURE,

    /**
     * A node did not finish within its timeout.
     */
    TIMEOUT_EXCEEDED,

    /**
     * No outgoing edge of a condition node matched and there was no default edge.
     */
    NO_MATCHING_BRANCH,

    /**
     * A branch joined by a fail-fast join node contains a failed node.
     */
    JOINED_BRANCH_FAILED,

    /**
     * A loop wanted to start more iterations than its configured maximum.
     */
    LOOP_BOUND_EXCEEDED,

    /**
     * A human approval was rejected.
     */
    APPROVAL_REJECTED,

    /**
     * The run was cancelled by the caller.
     */
    RUN_CANCELLED,

    /**
     * A data transform node could not apply its operation.
     */
    TRANSFORM_FAILED,

    /**
     * Every branch finished but none of them reached an end node.
     */
    NO_END_REACHED,

    /**
     * The requested template is not registered.
     */
    TEMPLATE_NOT_FOUND,

    /**
     * A required template parameter was not supplied.
     */
    MISSING_PARAMETER;

    /**
     * Checks whether a failure of this kind may be retried by a node's retry policy.
     */
    public boolean isRetryable() {
        return this == EXECUTOR_FAILURE || this == SERVICE_FAILURE || this == TIMEOUT_EXCEEDED;
    }

    /**
     * Checks whether this kind is a mistake by the caller rather than a runtime failure.
     */
    public boolean isCallerError() {
        return this == INVALID_DEFINITION || this == TEMPLATE_NOT_FOUND || this == MISSING_PARAMETER;
    }
}
