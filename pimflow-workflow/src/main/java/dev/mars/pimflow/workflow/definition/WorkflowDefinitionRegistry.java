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

import dev.mars.pimflow.core.exceptions.InvalidDefinitionException;
import dev.mars.pimflow.core.exceptions.NotFoundException;

import java.util.List;

/**
 * Registry of validated, immutable workflow definitions.
 * <p>
 * Definitions are never updated in place. A changed template must be registered under
 * a new id so that runs already bound to the old one keep their stage graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public interface WorkflowDefinitionRegistry {

    /**
     * Validates and registers a definition.
     * Registering a definition equal to the one already held under the same id is a no-op.
     *
     * @param definition the definition to register
     * @return the registered definition
     * @throws InvalidDefinitionException if the stage graph is invalid or a different
     *                                    definition is already registered under the id
     */
    WorkflowDefinition register(WorkflowDefinition definition) throws InvalidDefinitionException;

    /**
     * @throws NotFoundException if no definition is registered under the id
     */
    WorkflowDefinition get(String definitionId) throws NotFoundException;

    List<WorkflowDefinition> list();

    boolean contains(String definitionId);
}
