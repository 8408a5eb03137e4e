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

package dev.mars.convoy.workflow;

import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads workflow definitions from YAML, or from JSON since YAML is a superset of it.
 * <pre>
 * id: search-and-collect
 * name: Search and collect
 * variables:
 *   query: convoy
 * steps:
 *   - id: each
 *     type: loop-array
 *     config: { array: "{{results}}", variable: result }
 *     body:
 *       - id: remember
 *         type: array-push
 *         config: { variable: seen, value: "{{result.title}}" }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final List<String> CHILD_LISTS = List.of("then", "else", "body", "try", "catch", "finally");

    private final Yaml yaml;
    private final WorkflowValidator validator;

    public YamlWorkflowDefinitionParser(WorkflowValidator validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    @Override
    public Workflow parse(Path file) throws WorkflowParseException {
        try {
            return parseFromString(Files.readString(file));
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public Workflow parseFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);
        String name = getStringValue(data, "name");

        Map<String, Object> variables = getMapValue(data, "variables", name, "variables");
        Object rawSteps = data.get("steps");
        if (rawSteps == null) {
            throw new WorkflowParseException(name, "steps", "Workflow steps are required");
        }
        List<Step> steps = parseSteps(rawSteps, name, "steps");

        return new Workflow(getStringValue(data, "id"), name, getStringValue(data, "description"), variables, steps);
    }

    @Override
    public ValidationResult validate(Workflow workflow) {
        return validator.validate(workflow);
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        Map<String, Object> data;
        try {
            data = load(content);
        } catch (WorkflowParseException e) {
            result.addError(e.getMessage());
            return result;
        }
        for (String field : List.of("id", "name", "steps")) {
            if (!data.containsKey(field)) {
                result.addError(field, "Required field '" + field + "' is missing");
            }
        }
        if (data.containsKey("steps") && !(data.get("steps") instanceof List)) {
            result.addError("steps", "Field 'steps' must be a list");
        }
        if (data.containsKey("variables") && !(data.get("variables") instanceof Map)) {
            result.addError("variables", "Field 'variables' must be a map");
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String content) throws WorkflowParseException {
        if (content == null || content.isBlank()) {
            throw new WorkflowParseException("Empty workflow definition");
        }
        Object data;
        try {
            data = yaml.load(content);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            throw new WorkflowParseException(null, mark != null ? mark.getLine() + 1 : -1, null,
                    "Syntax error: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("Workflow definition parsing failed: " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Workflow definition must be a mapping");
        }
        return (Map<String, Object>) data;
    }

    private List<Step> parseSteps(Object raw, String workflowName, String path) throws WorkflowParseException {
        if (!(raw instanceof List)) {
            throw new WorkflowParseException(workflowName, path, "Expected a list of steps");
        }
        List<?> list = (List<?>) raw;
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            steps.add(parseStep(list.get(i), workflowName, path + "[" + i + "]"));
        }
        return steps;
    }

    @SuppressWarnings("unchecked")
    private Step parseStep(Object raw, String workflowName, String path) throws WorkflowParseException {
        if (!(raw instanceof Map)) {
            throw new WorkflowParseException(workflowName, path, "Step must be a mapping");
        }
        Map<String, Object> data = (Map<String, Object>) raw;
        Map<String, Object> config = getMapValue(data, "config", workflowName, path + ".config");

        Map<String, List<Step>> children = new LinkedHashMap<>();
        for (String key : CHILD_LISTS) {
            Object value = data.get(key);
            children.put(key, value != null ? parseSteps(value, workflowName, path + "." + key) : null);
        }

        return new Step(getStringValue(data, "id"), getStringValue(data, "type"), getStringValue(data, "name"),
                config, children.get("then"), children.get("else"), children.get("body"),
                children.get("try"), children.get("catch"), children.get("finally"));
    }

    // Utility methods for safe type conversion

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key, String workflowName, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(workflowName, path, "Expected a mapping");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
