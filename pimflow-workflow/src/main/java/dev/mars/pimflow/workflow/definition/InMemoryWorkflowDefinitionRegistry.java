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

import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.core.exceptions.InvalidDefinitionException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory definition registry.
 * Every definition is checked against the role catalog and the stage graph rules before it is stored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class InMemoryWorkflowDefinitionRegistry implements WorkflowDefinitionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowDefinitionRegistry.class);

    private final ConcurrentMap<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final RoleCatalog roleCatalog;

    public InMemoryWorkflowDefinitionRegistry(RoleCatalog roleCatalog) {
        this.roleCatalog = Objects.requireNonNull(roleCatalog, "roleCatalog");
    }

    @Override
    public WorkflowDefinition register(WorkflowDefinition definition) throws InvalidDefinitionException {
        Objects.requireNonNull(definition, "definition");
        String id = definition.getId();

        ValidationResult result = new StageGraph(definition).validate(roleCatalog);
        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warn("Workflow definition '{}': {}", id, warning);
        }
        result.throwIfInvalid(id);

        WorkflowDefinition existing = definitions.putIfAbsent(id, definition);
        if (existing == null) {
            logger.info("Registered workflow definition '{}' version {} with {} stages",
                    id, definition.getMetadata().getVersion(), definition.getStages().size());
            return definition;
        }
        if (existing.equals(definition)) {
            logger.debug("Workflow definition '{}' already registered, ignoring identical registration", id);
            return existing;
        }
        throw new InvalidDefinitionException(id,
                "A different definition is already registered under id '" + id + "'; register it under a new id");
    }

    @Override
    public WorkflowDefinition get(String definitionId) throws NotFoundException {
        WorkflowDefinition definition = definitionId != null ? definitions.get(definitionId) : null;
        if (definition == null) {
            throw new NotFoundException("WorkflowDefinition", definitionId);
        }
        return definition;
    }

    @Override
    public List<WorkflowDefinition> list() {
        List<WorkflowDefinition> result = new ArrayList<>(definitions.values());
        result.sort(Comparator.comparing(WorkflowDefinition::getId));
        return result;
    }

    @Override
    public boolean contains(String definitionId) {
        return definitionId != null && definitions.containsKey(definitionId);
    }

    public RoleCatalog getRoleCatalog() {
        return roleCatalog;
    }
}
