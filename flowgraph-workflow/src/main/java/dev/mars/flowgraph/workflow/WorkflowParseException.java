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

import dev.mars.flowgraph.core.ErrorKind;
import dev.mars.flowgraph.core.exceptions.FlowgraphException;

/**
 * Thrown when a workflow document cannot be read into a definition. When the problem is inside the
 * document, the exception names the workflow and the field path, e.g. {@code nodes[2].retry.multiplier}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends FlowgraphException {

    private final String workflowId;
    private final String fieldPath;

    public WorkflowParseException(String reason) {
        this(null, null, reason, null);
    }

    public WorkflowParseException(String reason, Throwable cause) {
        this(null, null, reason, cause);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String reason) {
        this(workflowId, fieldPath, reason, null);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String reason, Throwable cause) {
        super(ErrorKind.INVALID_DEFINITION, reason, cause);
        this.workflowId = workflowId;
        this.fieldPath = fieldPath;
    }

    /**
     * @return the id of the workflow being read, or null if it was not known yet
     */
    public String getWorkflowId() {
        return workflowId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (workflowId == null && fieldPath == null) {
            return getReason();
        }
        String location = fieldPath == null ? "" : " at " + fieldPath;
        String workflow = workflowId == null ? "Workflow document" : "Workflow '" + workflowId + "'";
        return workflow + location + ": " + getReason();
    }
}
