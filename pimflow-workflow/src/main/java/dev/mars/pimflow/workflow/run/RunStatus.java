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

package dev.mars.pimflow.workflow.run;

/**
 * Lifecycle of a workflow run.
 * <pre>
 * ACTIVE → {COMPLETED | CANCELLED}
 * </pre>
 * COMPLETED and CANCELLED are terminal: no transition leaves them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public enum RunStatus {

    /**
     * The run is parked at a human stage waiting for its open task to be resolved.
     */
    ACTIVE("Run in progress", false),

    /**
     * The run reached a terminal stage.
     */
    COMPLETED("Run reached a terminal stage", true),

    /**
     * The run was cancelled by an actor or by task expiry.
     */
    CANCELLED("Run cancelled", true);

    private final String description;
    private final boolean terminal;

    RunStatus(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(RunStatus target) {
        return this == ACTIVE && (target == COMPLETED || target == CANCELLED);
    }

    public RunStatus[] getValidTransitions() {
        if (this == ACTIVE) {
            return new RunStatus[]{COMPLETED, CANCELLED};
        }
        return new RunStatus[0];
    }
}
