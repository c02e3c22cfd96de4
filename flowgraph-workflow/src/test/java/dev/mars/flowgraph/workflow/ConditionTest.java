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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for condition parsing and evaluation.
 */
class ConditionTest {

    private final Map<String, Object> variables = Map.of(
            "score", 7,
            "status", "done",
            "ratio", "0.75",
            "tags", List.of("urgent", "billing"),
            "review", Map.of("score", 9, "author", "ana"),
            "approved", true,
            "empty", "");

    @Test
    void testNumericComparisons() {
        assertTrue(Condition.parse("score > 5").evaluate(variables));
        assertTrue(Condition.parse("score >= 7").evaluate(variables));
        assertFalse(Condition.parse("score < 7").evaluate(variables));
        assertTrue(Condition.parse("score <= 7").evaluate(variables));
        assertTrue(Condition.parse("score == 7.0").evaluate(variables));
        assertTrue(Condition.parse("ratio < 1").evaluate(variables));
    }

    @Test
    void testStringComparisons() {
        assertTrue(Condition.parse("status == 'done'").evaluate(variables));
        assertTrue(Condition.parse("status == \"done\"").evaluate(variables));
        assertTrue(Condition.parse("status == done").evaluate(variables));
        assertTrue(Condition.parse("status != 'pending'").evaluate(variables));
        assertTrue(Condition.parse("status matches '^d.n'").evaluate(variables));
    }

    @Test
    void testContains() {
        assertTrue(Condition.parse("tags contains urgent").evaluate(variables));
        assertTrue(Condition.parse("tags not_contains 'sales'").evaluate(variables));
        assertTrue(Condition.parse("review contains author").evaluate(variables));
        assertTrue(Condition.parse("status contains 'on'").evaluate(variables));
    }

    @Test
    void testInList() {
        assertTrue(Condition.parse("status in ['done', 'skipped']").evaluate(variables));
        assertTrue(Condition.parse("score in [1, 7.0, 9]").evaluate(variables));
        assertTrue(Condition.parse("review.author in [bo, ana]").evaluate(variables));
        assertFalse(Condition.parse("status in ['pending']").evaluate(variables));
        assertFalse(Condition.parse("status in []").evaluate(variables));
        assertFalse(Condition.parse("unknown in [1, 2]").evaluate(variables));
        assertTrue(Condition.parse("!(status in [pending]) && score in [7]").evaluate(variables));
    }

    @Test
    void testDottedPaths() {
        assertTrue(Condition.parse("review.score >= 9").evaluate(variables));
        assertTrue(Condition.parse("review.author == ana").evaluate(variables));
        assertFalse(Condition.parse("review.missing exists").evaluate(variables));
    }

    @Test
    void testExistence() {
        assertTrue(Condition.parse("review exists").evaluate(variables));
        assertTrue(Condition.parse("unknown not_exists").evaluate(variables));
        assertFalse(Condition.parse("unknown exists").evaluate(variables));
    }

    @Test
    void testMissingVariableMakesComparisonsFalse() {
        assertFalse(Condition.parse("unknown > 1").evaluate(variables));
        assertFalse(Condition.parse("unknown == 1").evaluate(variables));
        assertFalse(Condition.parse("unknown contains x").evaluate(variables));
        assertTrue(Condition.parse("unknown != 1").evaluate(variables));
        assertTrue(Condition.parse("unknown == null").evaluate(variables));
    }

    @Test
    void testBooleanOperatorsAndPrecedence() {
        assertTrue(Condition.parse("score > 5 && status == done").evaluate(variables));
        assertTrue(Condition.parse("score > 10 || status == done").evaluate(variables));
        assertTrue(Condition.parse("score > 10 or status == done and approved").evaluate(variables));
        assertFalse(Condition.parse("(score > 10 or status == done) and not approved").evaluate(variables));
        assertTrue(Condition.parse("!(score > 10)").evaluate(variables));
    }

    @Test
    void testTruthyPaths() {
        assertTrue(Condition.parse("approved").evaluate(variables));
        assertTrue(Condition.parse("tags").evaluate(variables));
        assertFalse(Condition.parse("empty").evaluate(variables));
        assertFalse(Condition.parse("unknown").evaluate(variables));
        assertTrue(Condition.parse("true").evaluate(Map.of()));
        assertFalse(Condition.parse("false").evaluate(Map.of()));
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse(""));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("score >"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("(score > 1"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("score > 1 )"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("name matches '['"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("status in 'done'"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("status in [done"));
        assertThrows(Condition.ConditionSyntaxException.class, () -> Condition.parse("status in [done skipped]"));
    }

    @Test
    void testEqualityUsesSourceText() {
        assertEquals(Condition.parse("score > 5"), Condition.parse("  score > 5 "));
        assertNotEquals(Condition.parse("score > 5"), Condition.parse("score>5"));
        assertEquals("score > 5", Condition.parse("score > 5").getExpression());
    }

    @Test
    void testNullVariablesTreatedAsEmpty() {
        assertTrue(Condition.parse("score not_exists").evaluate(null));
    }
}
