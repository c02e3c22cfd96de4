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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the scalar/map/list trees used as node configuration and metadata.
 * Values are normalised so that a tree read back from YAML or JSON compares equal to the one written.
 */
final class TreeValues {

    private TreeValues() {
    }

    /**
     * Returns an immutable, normalised copy: integral numbers become Integer (or Long when they do
     * not fit, or BigInteger beyond the range of a long), other numbers become Double, maps get String keys.
     */
    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof BigInteger && ((BigInteger) value).bitLength() >= Long.SIZE) {
            return value;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            Number number = (Number) value;
            long longValue = number.longValue();
            if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                return (int) longValue;
            }
            return longValue;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Map) {
            return normalizeMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(normalize(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    static Map<String, Object> normalizeMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Parses a duration written as ISO-8601 ({@code PT30S}), in the short form ({@code 250ms},
     * {@code 30s}, {@code 5m}, {@code 2h}) or as a number of milliseconds.
     *
     * @throws IllegalArgumentException if the value cannot be read as a duration
     */
    static Duration parseDuration(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(((Number) value).longValue());
        }
        String trimmed = value.toString().trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Duration cannot be empty");
        }
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed.toUpperCase());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + value, e);
            }
        }
        try {
            // Simple duration parsing (e.g., "250ms", "30s", "5m", "2h")
            String lower = trimmed.toLowerCase();
            if (lower.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2).trim()));
            } else if (lower.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(lower.substring(0, lower.length() - 1).trim()));
            } else if (lower.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(lower.substring(0, lower.length() - 1).trim()));
            } else if (lower.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(lower.substring(0, lower.length() - 1).trim()));
            } else {
                return Duration.ofMillis(Long.parseLong(lower));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }
}
