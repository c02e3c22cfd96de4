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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSON implementation of WorkflowDefinitionParser, backed by a Jackson {@link ObjectMapper}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JsonWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final TypeReference<Map<String, Object>> TREE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final WorkflowTreeMapper mapper = new WorkflowTreeMapper();
    private final WorkflowValidator validator = new WorkflowValidator();

    public JsonWorkflowDefinitionParser() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public WorkflowDefinition parse(Path jsonFile) throws WorkflowParseException {
        try {
            String content = Files.readString(jsonFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read JSON file: " + jsonFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String jsonContent) throws WorkflowParseException {
        if (jsonContent == null || jsonContent.isBlank()) {
            throw new WorkflowParseException("Empty or invalid JSON content");
        }
        Map<String, Object> tree;
        try {
            tree = objectMapper.readValue(jsonContent, TREE_TYPE);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
        return mapper.fromTree(tree);
    }

    @Override
    public String write(WorkflowDefinition definition) {
        try {
            return objectMapper.writeValueAsString(mapper.toTree(definition));
        } catch (JsonProcessingException e) {
            // the tree holds only maps, lists and scalars
            throw new UncheckedIOException("Failed to serialize workflow " + definition.getId(), e);
        }
    }

    @Override
    public void write(WorkflowDefinition definition, Path jsonFile) throws IOException {
        Files.writeString(jsonFile, write(definition));
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        return validator.validate(definition);
    }
}
