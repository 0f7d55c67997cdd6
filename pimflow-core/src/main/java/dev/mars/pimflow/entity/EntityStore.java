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

package dev.mars.pimflow.entity;

import dev.mars.pimflow.core.EntityReference;

import java.util.Optional;

/**
 * Read-only contract onto the durable product and asset records.
 * The workflow engine only uses it to check that a run's target exists.
 */
public interface EntityStore {

    /**
     * Looks up an entity.
     *
     * @param reference the product or asset reference
     * @return the entity, or empty if no such record exists
     */
    Optional<Entity> getEntity(EntityReference reference);
}
