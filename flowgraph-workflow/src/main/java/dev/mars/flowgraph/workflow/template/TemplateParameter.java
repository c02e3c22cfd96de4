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

import java.util.Objects;

/**
 * Declared parameter of a workflow template.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TemplateParameter {

    private final String name;
    private final String description;
    private final boolean required;
    private final Object defaultValue;

    private TemplateParameter(String name, String description, boolean required, Object defaultValue) {
        this.name = Objects.requireNonNull(name, "Parameter name cannot be null");
        this.description = description;
        this.required = required;
        this.defaultValue = defaultValue;
    }

    public static TemplateParameter required(String name, String description) {
        return new TemplateParameter(name, description, true, null);
    }

    public static TemplateParameter optional(String name, String description, Object defaultValue) {
        return new TemplateParameter(name, description, false, defaultValue);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRequired() {
        return required;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplateParameter that = (TemplateParameter) o;
        return required == that.required &&
                Objects.equals(name, that.name) &&
                Objects.equals(description, that.description) &&
                Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, required, defaultValue);
    }

    @Override
    public String toString() {
        return "TemplateParameter{" +
                "name='" + name + '\'' +
                ", required=" + required +
                ", defaultValue=" + defaultValue +
                '}';
    }
}
