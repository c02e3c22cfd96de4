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

package dev.mars.flowgraph.workflow.template;

import dev.mars.flowgraph.workflow.InvalidDefinitionException;
import dev.mars.flowgraph.workflow.WorkflowBuilder;
import dev.mars.flowgraph.workflow.WorkflowDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, parameterised factory of workflow definitions.
 * <p>
 * The template declares its parameters; {@link #instantiate(String, Map)} checks the required ones,
 * fills in defaults and lets the {@link Factory} add nodes and edges to a builder that already
 * carries the {@code template} and {@code category} metadata.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowTemplate {

    /**
     * Adds a template's nodes and edges to a builder.
     */
    @FunctionalInterface
    public interface Factory {
        void populate(WorkflowBuilder builder, TemplateParameters parameters);
    }

    private final String id;
    private final String name;
    private final String description;
    private final String category;
    private final List<TemplateParameter> parameters;
    private final Factory factory;

    private WorkflowTemplate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Template ID cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.category = builder.category != null ? builder.category : "general";
        this.parameters = List.copyOf(builder.parameters);
        this.factory = Objects.requireNonNull(builder.factory, "Template factory cannot be null");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<TemplateParameter> getParameters() {
        return parameters;
    }

    /**
     * Resolves the parameter values: supplied values win, absent optional parameters get their default.
     *
     * @throws TemplateException with {@code MISSING_PARAMETER} if a required parameter is absent
     */
    public TemplateParameters resolveParameters(Map<String, ?> supplied) throws TemplateException {
        Map<String, Object> values = new LinkedHashMap<>();
        if (supplied != null) {
            values.putAll(supplied);
        }
        for (TemplateParameter parameter : parameters) {
            if (values.get(parameter.getName()) != null) {
                continue;
            }
            if (parameter.isRequired()) {
                throw TemplateException.missingParameter(id, parameter.getName());
            }
            values.put(parameter.getName(), parameter.getDefaultValue());
        }
        return new TemplateParameters(values);
    }

    /**
     * Builds a validated definition with the given workflow id.
     */
    public WorkflowDefinition instantiate(String workflowId, Map<String, ?> supplied)
            throws TemplateException, InvalidDefinitionException {
        TemplateParameters resolved = resolveParameters(supplied);
        WorkflowBuilder builder = WorkflowBuilder.create(workflowId, name)
                .description(description)
                .metadata("template", id)
                .metadata("category", category);
        factory.populate(builder, resolved);
        return builder.build();
    }

    @Override
    public String toString() {
        return "WorkflowTemplate{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", parameters=" + parameters.size() +
                '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private String category;
        private final List<TemplateParameter> parameters = new ArrayList<>();
        private Factory factory;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder parameter(TemplateParameter parameter) {
            this.parameters.add(Objects.requireNonNull(parameter, "Parameter cannot be null"));
            return this;
        }

        public Builder factory(Factory factory) {
            this.factory = factory;
            return this;
        }

        public WorkflowTemplate build() {
            return new WorkflowTemplate(this);
        }
    }
}
