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

package dev.mars.flowgraph.core.exceptions;

import dev.mars.flowgraph.core.ErrorKind;

import java.util.Objects;

public class FlowgraphException extends Exception {

    private final ErrorKind errorKind;

    public FlowgraphException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "Error kind cannot be null");
    }

    public FlowgraphException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "Error kind cannot be null");
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public boolean isRetryable() {
        return errorKind.isRetryable();
    }
}
