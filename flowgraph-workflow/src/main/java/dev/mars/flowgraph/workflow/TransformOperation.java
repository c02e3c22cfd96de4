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

/**
 * Declarative operations a DATA_TRANSFORM node can apply to the shared variables.
 * The node reads its {@code inputs} (variable names), applies the operation and writes {@code output}.
 */
public enum TransformOperation {
    COPY(true),       // value of the single input
    SET(false),       // the configured literal value
    CONCAT(true),     // inputs joined with the separator
    SUM(true),        // numeric sum of the inputs
    COUNT(true),      // number of present inputs, or the size of a single collection input
    COLLECT(true),    // list of the input values
    MERGE(true),      // map inputs merged in order, later keys win
    TEMPLATE(false),  // the template with {{var}} references resolved
    UPPERCASE(true),
    LOWERCASE(true);

    private final boolean requiresInputs;

    TransformOperation(boolean requiresInputs) {
        this.requiresInputs = requiresInputs;
    }

    public boolean requiresInputs() {
        return requiresInputs;
    }

    /**
     * Looks an operation up by name, ignoring case.
     *
     * @return the operation, or null when the name is unknown
     */
    public static TransformOperation fromName(String name) {
        if (name == null) {
            return null;
        }
        for (TransformOperation operation : values()) {
            if (operation.name().equalsIgnoreCase(name.trim())) {
                return operation;
            }
        }
        return null;
    }
}
