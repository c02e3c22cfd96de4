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
import dev.mars.flowgraph.workflow.WorkflowDefinition;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Registry of workflow templates, pre-populated with the built-in ones.
 * <pre>
 * TemplateLibrary library = new TemplateLibrary();
 * WorkflowDefinition definition = library.instantiate("sequential_tasks",
 *         Map.of("tasks", List.of("Collect requirements", "Write summary")));
 * </pre>
 * Categories are informational only; they are copied into the {@code category} metadata of
 * every instantiated definition.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateLibrary {

    private static final Logger logger = Logger.getLogger(TemplateLibrary.class.getName());

    private final Map<String, WorkflowTemplate> templates = new ConcurrentHashMap<>();

    public TemplateLibrary() {
        for (WorkflowTemplate template : BuiltinTemplates.all()) {
            register(template);
        }
    }

    /**
     * Registers a template, replacing any template with the same id.
     */
    public void register(WorkflowTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        WorkflowTemplate previous = templates.put(template.getId(), template);
        if (previous != null) {
            logger.info("Replaced workflow template: " + template.getId());
        } else {
            logger.fine("Registered workflow template: " + template.getId() + " (" + template.getCategory() + ")");
        }
    }

    public Optional<WorkflowTemplate> getTemplate(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public List<WorkflowTemplate> listTemplates() {
        return templates.values().stream()
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .toList();
    }

    public List<WorkflowTemplate> listTemplates(String category) {
        return listTemplates().stream()
                .filter(template -> template.getCategory().equals(category))
                .toList();
    }

    public List<String> getCategories() {
        return templates.values().stream()
                .map(WorkflowTemplate::getCategory)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Instantiates a template under a generated workflow id.
     *
     * @throws TemplateException {@code TEMPLATE_NOT_FOUND} for an unknown id, {@code MISSING_PARAMETER}
     *                           when a required parameter is absent
     * @throws InvalidDefinitionException if the template produced an invalid graph
     */
    public WorkflowDefinition instantiate(String templateId, Map<String, ?> parameters)
            throws TemplateException, InvalidDefinitionException {
        return instantiate(templateId, templateId + "-" + UUID.randomUUID().toString().substring(0, 8), parameters);
    }

    public WorkflowDefinition instantiate(String templateId, String workflowId, Map<String, ?> parameters)
            throws TemplateException, InvalidDefinitionException {
        WorkflowTemplate template = templates.get(templateId);
        if (template == null) {
            throw TemplateException.notFound(templateId);
        }
        WorkflowDefinition definition = template.instantiate(workflowId, parameters);
        logger.info("Instantiated template " + templateId + " as workflow " + workflowId
                + " (" + definition.getNodes().size() + " nodes)");
        return definition;
    }
}
