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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory implementation of {@link EntityStore}.
 * Suitable for embedding, examples and tests; production deployments
 * adapt the catalogue database behind the same interface.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Map<EntityReference, Entity> entities = new ConcurrentHashMap<>();

    public Entity put(Entity entity) {
        entities.put(entity.getReference(), entity);
        logger.debug("Stored entity {}", entity.getReference());
        return entity;
    }

    public Entity put(EntityReference reference, String displayName) {
        return put(new Entity(reference, displayName, Map.of()));
    }

    public boolean remove(EntityReference reference) {
        return entities.remove(reference) != null;
    }

    @Override
    public Optional<Entity> getEntity(EntityReference reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(reference));
    }

    public int size() {
        return entities.size();
    }
}
