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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a workflow definition: every error and warning found, in the order the
 * validator reported them. Each issue names the offending element through a field path such as
 * {@code nodes.review}, {@code nodes.review.config.task} or {@code edges[3]}.
 */
public class ValidationResult {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addError(String fieldPath, String message) {
        issues.add(new ValidationIssue(true, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        issues.add(new ValidationIssue(false, fieldPath, message));
    }

    public List<ValidationIssue> getErrors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> getWarnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    /**
     * A definition is runnable when no error was reported; warnings do not count.
     */
    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> !issue.isError());
    }

    public int getErrorCount() {
        return getErrors().size();
    }

    public int getWarningCount() {
        return getWarnings().size();
    }

    /**
     * Checks whether an error was reported against the element at {@code fieldPath} or anything below it,
     * so {@code nodes.loop} also matches {@code nodes.loop.config.body}.
     */
    public boolean hasErrorAt(String fieldPath) {
        for (ValidationIssue issue : getErrors()) {
            if (issue.isAt(fieldPath)) {
                return true;
            }
        }
        return false;
    }

    public String describeErrors() {
        return getErrors().stream().map(ValidationIssue::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() +
                ", errors=" + getErrorCount() +
                ", warnings=" + getWarningCount() +
                '}';
    }

    /**
     * One violation or warning found in a definition.
     */
    public static class ValidationIssue {

        private final boolean error;
        private final String fieldPath;
        private final String message;

        ValidationIssue(boolean error, String fieldPath, String message) {
            this.error = error;
            this.fieldPath = Objects.requireNonNull(fieldPath, "Field path cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public boolean isError() {
            return error;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        boolean isAt(String path) {
            return fieldPath.equals(path) || fieldPath.startsWith(path + ".");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return error == that.error && fieldPath.equals(that.fieldPath) && message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, fieldPath, message);
        }

        @Override
        public String toString() {
            return (error ? "ERROR" : "WARNING") + " [" + fieldPath + "]: " + message;
        }
    }
}
