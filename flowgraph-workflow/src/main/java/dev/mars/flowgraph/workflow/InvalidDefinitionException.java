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

import java.util.List;

/**
 * Thrown when a workflow definition fails validation. Carries every violation found, not just the first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidDefinitionException extends FlowgraphException {

    private final String workflowId;
    private final List<ValidationResult.ValidationIssue> violations;

    public InvalidDefinitionException(String workflowId, List<ValidationResult.ValidationIssue> violations) {
        super(ErrorKind.INVALID_DEFINITION, buildMessage(workflowId, violations));
        this.workflowId = workflowId;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<ValidationResult.ValidationIssue> getViolations() {
        return violations;
    }

    private static String buildMessage(String workflowId, List<ValidationResult.ValidationIssue> violations) {
        int count = violations != null ? violations.size() : 0;
        StringBuilder sb = new StringBuilder("Workflow '").append(workflowId).append("' is invalid (")
                .append(count).append(count == 1 ? " violation)" : " violations)");
        if (violations != null) {
            for (ValidationResult.ValidationIssue violation : violations) {
                sb.append("\n  - ").append(violation);
            }
        }
        return sb.toString();
    }
}
