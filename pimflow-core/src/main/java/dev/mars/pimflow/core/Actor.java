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
 * The caller of an engine operation, as vouched for by the authentication layer.
 * The engine trusts the role it is given.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class Actor {

    /** Identity recorded for transitions the engine performs on its own. */
    public static final String SYSTEM_ID = "system";

    private final String userId;
    private final Role role;

    @JsonCreator
    public Actor(@JsonProperty("userId") String userId, @JsonProperty("role") Role role) {
        this.userId = Objects.requireNonNull(userId, "User ID cannot be null");
        this.role = Objects.requireNonNull(role, "Role cannot be null");
    }

    public static Actor of(String userId, Role role) {
        return new Actor(userId, role);
    }

    public static Actor system() {
        return new Actor(SYSTEM_ID, RoleCatalog.ADMIN);
    }

    public String getUserId() {
        return userId;
    }

    public Role getRole() {
        return role;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Actor actor = (Actor) o;
        return userId.equals(actor.userId) && role.equals(actor.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, role);
    }

    @Override
    public String toString() {
        return userId + "(" + role + ")";
    }
}
