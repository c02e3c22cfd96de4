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

import dev.mars.flowgraph.core.ErrorKind;
import dev.mars.flowgraph.core.exceptions.NodeExecutionException;
import dev.mars.flowgraph.workflow.TransformOperation;
import dev.mars.flowgraph.workflow.VariableResolver;
import dev.mars.flowgraph.workflow.WorkflowNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the operation of a DATA_TRANSFORM node to the shared variables.
 * Inputs name variables (dotted paths allowed); the result is what the engine writes to {@code output}.
 * <p>
 * Missing inputs fail COPY, CONCAT, SUM, UPPERCASE and LOWERCASE; COUNT, COLLECT and MERGE skip them,
 * so they can gather the results of branches that may not all have produced one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DataTransformer {

    /**
     * @throws NodeExecutionException with {@link ErrorKind#TRANSFORM_FAILED} if the operation cannot be applied
     */
    public Object apply(WorkflowNode node, Map<String, Object> variables) throws NodeExecutionException {
        String nodeId = node.getId();
        TransformOperation operation = TransformOperation.fromName(node.getConfigString("operation"));
        if (operation == null) {
            throw failure(nodeId, "Unknown transform operation: " + node.getConfigString("operation"));
        }
        List<String> inputs = new ArrayList<>();
        for (Object input : node.getConfigList("inputs")) {
            inputs.add(String.valueOf(input));
        }

        switch (operation) {
            case COPY:
                return require(nodeId, variables, single(nodeId, operation, inputs));
            case SET:
                return node.getConfigValue("value");
            case CONCAT:
                return concat(nodeId, variables, inputs, node.getConfigString("separator", ""));
            case SUM:
                return sum(nodeId, variables, inputs);
            case COUNT:
                return count(variables, inputs);
            case COLLECT:
                return collect(variables, inputs);
            case MERGE:
                return merge(nodeId, variables, inputs);
            case TEMPLATE:
                return template(nodeId, variables, node.getConfigString("template"));
            case UPPERCASE:
                return require(nodeId, variables, single(nodeId, operation, inputs)).toString().toUpperCase(Locale.ROOT);
            case LOWERCASE:
                return require(nodeId, variables, single(nodeId, operation, inputs)).toString().toLowerCase(Locale.ROOT);
            default:
                throw new IllegalStateException("Unhandled transform operation: " + operation);
        }
    }

    private String single(String nodeId, TransformOperation operation, List<String> inputs)
            throws NodeExecutionException {
        if (inputs.size() != 1) {
            throw failure(nodeId, operation + " takes exactly one input but got " + inputs.size());
        }
        return inputs.get(0);
    }

    private Object require(String nodeId, Map<String, Object> variables, String name) throws NodeExecutionException {
        Object value = VariableResolver.lookup(variables, name);
        if (value == null) {
            throw failure(nodeId, "Input variable not found: " + name);
        }
        return value;
    }

    private String concat(String nodeId, Map<String, Object> variables, List<String> inputs, String separator)
            throws NodeExecutionException {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            result.append(require(nodeId, variables, inputs.get(i)));
        }
        return result.toString();
    }

    /**
     * Sums to a Long when every input is integral, otherwise to a Double. An integral sum that
     * overflows a long fails the transform.
     */
    private Number sum(String nodeId, Map<String, Object> variables, List<String> inputs)
            throws NodeExecutionException {
        List<Number> numbers = new ArrayList<>();
        boolean integral = true;
        for (String input : inputs) {
            Object value = require(nodeId, variables, input);
            Number number = toNumber(value);
            if (number == null) {
                throw failure(nodeId, "Input " + input + " is not numeric: " + value);
            }
            integral &= number instanceof Long || number instanceof Integer
                    || number instanceof Short || number instanceof Byte;
            numbers.add(number);
        }
        if (!integral) {
            double decimalSum = 0;
            for (Number number : numbers) {
                decimalSum += number.doubleValue();
            }
            return decimalSum;
        }
        long integralSum = 0;
        try {
            for (Number number : numbers) {
                integralSum = Math.addExact(integralSum, number.longValue());
            }
        } catch (ArithmeticException e) {
            throw new NodeExecutionException(nodeId, ErrorKind.TRANSFORM_FAILED,
                    "Sum of " + inputs + " overflows a long integer", e);
        }
        return integralSum;
    }

    private Number toNumber(Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException notIntegral) {
                try {
                    return Double.parseDouble(text);
                } catch (NumberFormatException notNumeric) {
                    return null;
                }
            }
        }
        return null;
    }

    private int count(Map<String, Object> variables, List<String> inputs) {
        if (inputs.size() == 1) {
            Object value = VariableResolver.lookup(variables, inputs.get(0));
            if (value instanceof Collection) {
                return ((Collection<?>) value).size();
            }
            if (value instanceof Map) {
                return ((Map<?, ?>) value).size();
            }
        }
        int present = 0;
        for (String input : inputs) {
            if (VariableResolver.lookup(variables, input) != null) {
                present++;
            }
        }
        return present;
    }

    private List<Object> collect(Map<String, Object> variables, List<String> inputs) {
        List<Object> values = new ArrayList<>();
        for (String input : inputs) {
            Object value = VariableResolver.lookup(variables, input);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private Map<String, Object> merge(String nodeId, Map<String, Object> variables, List<String> inputs)
            throws NodeExecutionException {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (String input : inputs) {
            Object value = VariableResolver.lookup(variables, input);
            if (value == null) {
                continue;
            }
            if (!(value instanceof Map)) {
                throw failure(nodeId, "Input " + input + " is not a map");
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                merged.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return merged;
    }

    private String template(String nodeId, Map<String, Object> variables, String template)
            throws NodeExecutionException {
        if (template == null) {
            throw failure(nodeId, "TEMPLATE requires a template");
        }
        try {
            return new VariableResolver(variables).resolve(template);
        } catch (VariableResolver.VariableResolutionException e) {
            throw new NodeExecutionException(nodeId, ErrorKind.TRANSFORM_FAILED, e.getMessage(), e);
        }
    }

    private static NodeExecutionException failure(String nodeId, String message) {
        return new NodeExecutionException(nodeId, ErrorKind.TRANSFORM_FAILED, message);
    }
}
