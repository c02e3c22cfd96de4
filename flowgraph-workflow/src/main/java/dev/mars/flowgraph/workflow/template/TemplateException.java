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

import dev.mars.flowgraph.core.ErrorKind;
import dev.mars.flowgraph.core.exceptions.FlowgraphException;

/**
 * Thrown when a template cannot be instantiated: the template is unknown or a required parameter is missing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateException extends FlowgraphException {

    private final String templateId;

    public TemplateException(String templateId, ErrorKind errorKind, String message) {
        super(errorKind, message);
        this.templateId = templateId;
    }

    public static TemplateException notFound(String templateId) {
        return new TemplateException(templateId, ErrorKind.TEMPLATE_NOT_FOUND, "Template not found: " + templateId);
    }

    public static TemplateException missingParameter(String templateId, String parameterName) {
        return new TemplateException(templateId, ErrorKind.MISSING_PARAMETER,
                "Required parameter '" + parameterName + "' missing for template " + templateId);
    }

    public String getTemplateId() {
        return templateId;
    }
}
