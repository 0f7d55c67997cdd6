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

import java.util.Map;
import java.util.Objects;

/**
 * The minimal view of a catalogue record the workflow core needs: its reference,
 * a display name and free-form attributes supplied by the entity store.
 */
public class Entity {

    private final EntityReference reference;
    private final String displayName;
    private final Map<String, String> attributes;

    public Entity(EntityReference reference, String displayName, Map<String, String> attributes) {
        this.reference = Objects.requireNonNull(reference, "Entity reference cannot be null");
        this.displayName = displayName != null ? displayName : reference.getId();
        this.attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public EntityReference getReference() {
        return reference;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return reference.equals(entity.reference) &&
               Objects.equals(displayName, entity.displayName) &&
               Objects.equals(attributes, entity.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, displayName, attributes);
    }

    @Override
    public String toString() {
        return "Entity{" +
               "reference=" + reference +
               ", displayName='" + displayName + '\'' +
               '}';
    }
}
