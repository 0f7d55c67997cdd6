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

package dev.mars.pimflow.workflow.task;

/**
 * Lifecycle of a human task. A task leaves PENDING exactly once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public enum TaskStatus {

    /**
     * Waiting for an actor holding the task's role.
     */
    PENDING("Awaiting resolution", false),

    /**
     * Resolved with an outcome. Immutable from here on.
     */
    RESOLVED("Resolved with an outcome", true),

    /**
     * Expired by timeout, cancellation of its run or reconciliation. Immutable from here on.
     */
    EXPIRED("Expired without an outcome", true);

    private final String description;
    private final boolean terminal;

    TaskStatus(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return this == PENDING && (target == RESOLVED || target == EXPIRED);
    }

    public TaskStatus[] getValidTransitions() {
        if (this == PENDING) {
            return new TaskStatus[]{RESOLVED, EXPIRED};
        }
        return new TaskStatus[0];
    }
}
