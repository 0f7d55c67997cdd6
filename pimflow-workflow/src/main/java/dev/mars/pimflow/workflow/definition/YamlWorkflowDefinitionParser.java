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

package dev.mars.pimflow.workflow.definition;

import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses approval workflow documents using SnakeYAML's safe constructor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    private final Yaml yaml;
    private final WorkflowSchemaValidator schemaValidator;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = new WorkflowSchemaValidator();
    }

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        } catch (WorkflowParseException e) {
            throw e.withSource(file.toString());
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);

        ValidationResult schema = schemaValidator.validateWorkflowSchema(data);
        if (!schema.isValid()) {
            ValidationResult.ValidationIssue first = schema.getErrors().get(0);
            throw new WorkflowParseException(first.getFieldPath(),
                    "Schema validation failed: " + String.join("; ", schema.getErrorMessages()));
        }
        for (ValidationResult.ValidationIssue warning : schema.getWarnings()) {
            logger.warn("Workflow schema warning {}", warning);
        }

        return parseWorkflowDefinition(data);
    }

    @Override
    public ValidationResult validateSchema(String content) {
        try {
            return schemaValidator.validateWorkflowSchema(load(content));
        } catch (WorkflowParseException e) {
            ValidationResult result = new ValidationResult();
            result.addError(e.getMessage());
            return result;
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String content) throws WorkflowParseException {
        try {
            Object loaded = yaml.load(content);
            if (loaded == null) {
                throw new WorkflowParseException("Empty or invalid YAML content");
            }
            if (!(loaded instanceof Map)) {
                throw new WorkflowParseException("Workflow document must be a YAML mapping");
            }
            return (Map<String, Object>) loaded;
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML syntax error: " + e.getMessage(), e);
        }
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        String apiVersion = getStringValue(data, "apiVersion", WorkflowDefinition.DEFAULT_API_VERSION);
        String kind = getStringValue(data, "kind", WorkflowDefinition.DEFAULT_KIND);

        WorkflowDefinition.WorkflowMetadata metadata = parseMetadata(getMapValue(data, "metadata"));
        WorkflowDefinition.WorkflowSpec spec = parseSpec(getMapValue(data, "spec"));

        return new WorkflowDefinition(apiVersion, kind, metadata, spec);
    }

    private WorkflowDefinition.WorkflowMetadata parseMetadata(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name");
        if (name == null || name.trim().isEmpty()) {
            throw new WorkflowParseException("metadata.name", "Workflow name is required");
        }

        String id = getStringValue(data, "id");
        String version = getStringValue(data, "version", "1.0.0");
        String description = getStringValue(data, "description");
        String author = getStringValue(data, "author");
        Map<String, String> labels = parseLabels(getMapValue(data, "labels"));

        return new WorkflowDefinition.WorkflowMetadata(id, name, version, description, author, labels);
    }

    private WorkflowDefinition.WorkflowSpec parseSpec(Map<String, Object> data) throws WorkflowParseException {
        if (data == null) {
            throw new WorkflowParseException("spec", "Workflow spec is required");
        }
        String initialStage = getStringValue(data, "initialStage");

        List<Map<String, Object>> stagesList = getListValue(data, "stages");
        if (stagesList == null || stagesList.isEmpty()) {
            throw new WorkflowParseException("spec.stages", "At least one stage is required");
        }

        List<Stage> stages = new ArrayList<>();
        for (int i = 0; i < stagesList.size(); i++) {
            try {
                stages.add(parseStage(stagesList.get(i)));
            } catch (WorkflowParseException e) {
                String field = "spec.stages[" + i + "]" + (e.getFieldPath() != null ? "." + e.getFieldPath() : "");
                throw new WorkflowParseException(field, e.getMessage(), e);
            }
        }

        return new WorkflowDefinition.WorkflowSpec(initialStage, stages);
    }

    private Stage parseStage(Map<String, Object> data) throws WorkflowParseException {
        String id = getStringValue(data, "id");
        if (id == null || id.trim().isEmpty()) {
            throw new WorkflowParseException("id", "Stage id is required");
        }

        StageKind kind;
        try {
            kind = StageKind.fromKey(getStringValue(data, "kind", "human"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("kind", "Unknown stage kind: " + data.get("kind"));
        }

        Stage.Builder builder = Stage.builder(id.trim(), kind)
                .description(getStringValue(data, "description"))
                .next(getStringValue(data, "next"))
                .reentrant(getBooleanValue(data, "reentrant", false));

        String role = getStringValue(data, "role");
        if (role != null && !role.trim().isEmpty()) {
            builder.requiredRole(Role.of(role));
        }

        Map<String, Object> transitions = getMapValue(data, "transitions");
        if (transitions != null) {
            for (Map.Entry<String, Object> entry : transitions.entrySet()) {
                Outcome outcome;
                try {
                    outcome = Outcome.fromKey(entry.getKey());
                } catch (IllegalArgumentException e) {
                    throw new WorkflowParseException("transitions." + entry.getKey(), "Unknown outcome: " + entry.getKey());
                }
                if (entry.getValue() == null) {
                    throw new WorkflowParseException("transitions." + entry.getKey(), "Target stage is required");
                }
                builder.transition(outcome, entry.getValue().toString());
            }
        }

        return builder.build();
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<Map<String, Object>>) value : null;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private Map<String, String> parseLabels(Map<String, Object> data) {
        if (data == null) return Map.of();

        Map<String, String> labels = new HashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            labels.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return labels;
    }
}
