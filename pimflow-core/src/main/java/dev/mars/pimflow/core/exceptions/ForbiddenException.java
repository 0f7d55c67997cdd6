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

package dev.mars.pimflow.core.exceptions;

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.Role;

/**
 * Thrown when an actor tries to resolve a task their role (or identity) does not qualify for.
 */
public class ForbiddenException extends PimflowException {

    private final String taskId;
    private final Actor actor;
    private final Role requiredRole;

    public ForbiddenException(String taskId, Actor actor, Role requiredRole, String reason) {
        super(String.format("Actor %s may not resolve task '%s' (requires %s): %s",
                actor, taskId, requiredRole, reason));
        this.taskId = taskId;
        this.actor = actor;
        this.requiredRole = requiredRole;
    }

    public String getTaskId() {
        return taskId;
    }

    public Actor getActor() {
        return actor;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }
}
