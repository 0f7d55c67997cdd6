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

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validator for approval workflow YAML documents.
 * Runs against the raw YAML tree before it is mapped onto {@link WorkflowDefinition},
 * so problems are reported with the document's own field paths.
 * <p>
 * Graph-level rules (reachability, terminal stages, cycles) are checked later by {@link StageGraph}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class WorkflowSchemaValidator {

    // Regex patterns for validation
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-_]*[a-zA-Z0-9]$");
    private static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+(-[a-zA-Z0-9\\-\\.]+)?$");
    private static final Pattern STAGE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-_]*$");
    private static final Pattern API_VERSION_PATTERN = Pattern.compile("^v[0-9]+$");

    private static final Set<String> STAGE_FIELDS = Set.of(
            "id", "kind", "description", "role", "transitions", "next", "reentrant");

    /**
     * Validates the complete workflow document including metadata and spec.
     */
    public ValidationResult validateWorkflowSchema(Map<String, Object> data) {
        ValidationResult result = new ValidationResult();

        validateRootStructure(data, result);

        Object metadata = data.get("metadata");
        if (metadata instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> metadataMap = (Map<String, Object>) metadata;
            validateMetadata(metadataMap, result);
        } else if (metadata != null) {
            result.addError("metadata", "Field 'metadata' must be a mapping");
        }

        Object spec = data.get("spec");
        if (spec instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> specMap = (Map<String, Object>) spec;
            validateSpec(specMap, result);
        } else if (spec != null) {
            result.addError("spec", "Field 'spec' must be a mapping");
        }

        return result;
    }

    private void validateRootStructure(Map<String, Object> data, ValidationResult result) {
        if (!data.containsKey("metadata")) {
            result.addError("metadata", "Required field 'metadata' is missing");
        }
        if (!data.containsKey("spec")) {
            result.addError("spec", "Required field 'spec' is missing");
        }

        String apiVersion = getStringValue(data, "apiVersion");
        if (apiVersion != null && !API_VERSION_PATTERN.matcher(apiVersion).matches()) {
            result.addError("apiVersion", "API version must follow pattern 'v{number}' (e.g., 'v1')");
        }

        String kind = getStringValue(data, "kind");
        if (kind != null && !WorkflowDefinition.DEFAULT_KIND.equals(kind)) {
            result.addError("kind", "Unsupported document kind '" + kind + "', expected '"
                    + WorkflowDefinition.DEFAULT_KIND + "'");
        }
    }

    private void validateMetadata(Map<String, Object> metadata, ValidationResult result) {
        String name = getStringValue(metadata, "name");
        if (name == null || name.trim().isEmpty()) {
            result.addError("metadata.name", "Required field 'name' is missing");
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            result.addError("metadata.name",
                    "Name must start and end with alphanumeric characters and contain only letters, digits, hyphens and underscores");
        }

        String id = getStringValue(metadata, "id");
        if (id != null && !NAME_PATTERN.matcher(id).matches()) {
            result.addError("metadata.id", "Id must follow the same pattern as 'name'");
        }

        String version = getStringValue(metadata, "version");
        if (version == null) {
            result.addWarning("metadata.version", "No version given, defaulting to 1.0.0");
        } else if (!VERSION_PATTERN.matcher(version).matches()) {
            result.addError("metadata.version", "Version must follow semantic versioning (e.g., '1.0.0')");
        }

        Object labels = metadata.get("labels");
        if (labels != null && !(labels instanceof Map)) {
            result.addError("metadata.labels", "Labels must be a mapping of key to value");
        }
    }

    @SuppressWarnings("unchecked")
    private void validateSpec(Map<String, Object> spec, ValidationResult result) {
        Object stages = spec.get("stages");
        if (stages == null) {
            result.addError("spec.stages", "Required field 'stages' is missing");
            return;
        }
        if (!(stages instanceof List)) {
            result.addError("spec.stages", "Field 'stages' must be a list");
            return;
        }

        List<Object> stageList = (List<Object>) stages;
        if (stageList.isEmpty()) {
            result.addError("spec.stages", "At least one stage is required");
            return;
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < stageList.size(); i++) {
            String path = "spec.stages[" + i + "]";
            Object stage = stageList.get(i);
            if (!(stage instanceof Map)) {
                result.addError(path, "Stage must be a mapping");
                continue;
            }
            validateStage((Map<String, Object>) stage, path, seenIds, result);
        }

        String initialStage = getStringValue(spec, "initialStage");
        if (initialStage != null && !seenIds.contains(initialStage)) {
            result.addError("spec.initialStage", "Initial stage '" + initialStage + "' is not declared");
        }
    }

    private void validateStage(Map<String, Object> stage, String path, Set<String> seenIds, ValidationResult result) {
        String id = getStringValue(stage, "id");
        if (id == null || id.trim().isEmpty()) {
            result.addError(path + ".id", "Required field 'id' is missing");
        } else if (!STAGE_ID_PATTERN.matcher(id).matches()) {
            result.addError(path + ".id", "Stage id '" + id + "' contains invalid characters");
        } else if (!seenIds.add(id)) {
            result.addError(path + ".id", "Duplicate stage id '" + id + "'");
        }

        String kind = getStringValue(stage, "kind");
        if (kind != null) {
            try {
                StageKind.fromKey(kind);
            } catch (IllegalArgumentException e) {
                result.addError(path + ".kind", "Stage kind must be one of human, automatic, terminal");
            }
        }

        Object transitions = stage.get("transitions");
        if (transitions != null) {
            if (!(transitions instanceof Map)) {
                result.addError(path + ".transitions", "Transitions must be a mapping of outcome to stage id");
            } else {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) transitions).entrySet()) {
                    String key = String.valueOf(entry.getKey());
                    try {
                        Outcome.fromKey(key);
                    } catch (IllegalArgumentException e) {
                        result.addError(path + ".transitions." + key,
                                "Unknown outcome '" + key + "', expected approve, reject or request-changes");
                    }
                    if (entry.getValue() == null) {
                        result.addError(path + ".transitions." + key, "Target stage is required");
                    }
                }
            }
        }

        Object reentrant = stage.get("reentrant");
        if (reentrant != null && !(reentrant instanceof Boolean)) {
            result.addError(path + ".reentrant", "Field 'reentrant' must be a boolean");
        }

        for (String field : stage.keySet()) {
            if (!STAGE_FIELDS.contains(field)) {
                result.addWarning(path + "." + field, "Unknown stage field '" + field + "' is ignored");
            }
        }
    }

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
