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

package dev.mars.pimflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identifies the product or asset a workflow run is bound to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class EntityReference {

    private final EntityType type;
    private final String id;

    @JsonCreator
    public EntityReference(@JsonProperty("type") EntityType type, @JsonProperty("id") String id) {
        this.type = Objects.requireNonNull(type, "Entity type cannot be null");
        this.id = Objects.requireNonNull(id, "Entity ID cannot be null");
        if (id.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity ID cannot be empty");
        }
    }

    public static EntityReference product(String id) {
        return new EntityReference(EntityType.PRODUCT, id);
    }

    public static EntityReference asset(String id) {
        return new EntityReference(EntityType.ASSET, id);
    }

    public EntityType getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityReference that = (EntityReference) o;
        return type == that.type && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + id;
    }
}
