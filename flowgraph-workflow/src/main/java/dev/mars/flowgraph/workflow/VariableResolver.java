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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variable references in node configuration using template substitution.
 * Supports references in the format {{variableName}} and dotted paths such as {{review.score}}.
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, Object> variables;

    public VariableResolver(Map<String, Object> variables) {
        this.variables = variables != null ? variables : Map.of();
    }

    /**
     * Resolves variables in a string template.
     *
     * @param template the template string containing variable references
     * @return the resolved string with variables substituted
     * @throws VariableResolutionException if a variable cannot be resolved
     */
    public String resolve(String template) throws VariableResolutionException {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            Object value = lookup(variables, variableName);
            if (value == null) {
                throw new VariableResolutionException("Variable not found: " + variableName);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves every string inside a configuration tree, leaving other values untouched.
     */
    public Map<String, Object> resolveAll(Map<String, Object> config) throws VariableResolutionException {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(resolved);
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value) {
        if (value instanceof String) {
            return resolve((String) value);
        }
        if (value instanceof Map) {
            return resolveAll((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                items.add(resolveValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    /**
     * Looks a name up in a variable map. An exact key wins; otherwise a dotted name walks nested maps,
     * and a numeric segment indexes into a list.
     *
     * @return the value, or null when any segment is missing
     */
    public static Object lookup(Map<String, Object> variables, String path) {
        if (variables == null || path == null) {
            return null;
        }
        if (variables.containsKey(path)) {
            return variables.get(path);
        }
        Object current = variables;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List && segment.matches("\\d+")) {
                List<?> list = (List<?>) current;
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Exception thrown when variable resolution fails.
     */
    public static class VariableResolutionException extends RuntimeException {
        public VariableResolutionException(String message) {
            super(message);
        }
    }
}
