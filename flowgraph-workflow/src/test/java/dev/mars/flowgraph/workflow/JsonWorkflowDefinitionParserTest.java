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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading and writing workflow definitions as JSON.
 */
class JsonWorkflowDefinitionParserTest {

    private JsonWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new JsonWorkflowDefinitionParser();
    }

    @Test
    void testParseWorkflow() throws WorkflowParseException {
        String json = """
                {
                  "id": "greet",
                  "name": "Greeting",
                  "nodes": [
                    {"id": "start", "kind": "START"},
                    {"id": "hello", "kind": "AGENT_EXECUTE", "config": {"task": "Say hello to {{name}}"}},
                    {"id": "end", "kind": "END"}
                  ],
                  "edges": [
                    {"from": "start", "to": "hello"},
                    {"from": "hello", "to": "end"}
                  ]
                }
                """;

        WorkflowDefinition definition = parser.parseFromString(json);

        assertEquals("greet", definition.getId());
        assertEquals("start", definition.getStartNode().orElseThrow().getId());
        assertEquals("Say hello to {{name}}", definition.getNode("hello").orElseThrow().getConfigString("task"));
        assertTrue(parser.validate(definition).isValid());
    }

    @Test
    void testLoopBackFlagIsRead() throws WorkflowParseException {
        WorkflowDefinition definition = parser.parseFromString("""
                {"id": "w", "nodes": [], "edges": [{"from": "a", "to": "b", "loopBack": true}]}
                """);

        assertTrue(definition.getEdges().get(0).isLoopBack());
    }

    @Test
    void testInvalidJsonIsRejected() {
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("{\"id\": "));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("  "));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("[1, 2]"));
    }

    @Test
    void testRetryMultiplierMustBeNumeric() {
        WorkflowParseException exception = assertThrows(WorkflowParseException.class, () -> parser.parseFromString("""
                {"id": "w", "nodes": [{"id": "n", "kind": "END", "retry": {"multiplier": "lots"}}]}
                """));

        assertEquals("nodes[0].retry.multiplier", exception.getFieldPath());
    }

    @Test
    void testWriteThenParseGivesEqualDefinition() throws Exception {
        WorkflowDefinition original = YamlWorkflowDefinitionParserTest.richWorkflow();

        WorkflowDefinition parsed = parser.parseFromString(parser.write(original));

        assertEquals(original, parsed);
    }

    @Test
    void testJsonAndYamlAgree() throws Exception {
        WorkflowDefinition original = YamlWorkflowDefinitionParserTest.richWorkflow();
        YamlWorkflowDefinitionParser yamlParser = new YamlWorkflowDefinitionParser();

        WorkflowDefinition viaYaml = yamlParser.parseFromString(yamlParser.write(original));
        WorkflowDefinition viaJson = parser.parseFromString(parser.write(viaYaml));

        assertEquals(original, viaJson);
    }
}
