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

import dev.mars.pimflow.core.Outcome;

import java.util.Set;

/**
 * Thrown when a task is resolved with an outcome its stage does not allow.
 */
public class InvalidOutcomeException extends PimflowException {

    private final String stageId;
    private final Outcome outcome;
    private final Set<Outcome> allowedOutcomes;

    public InvalidOutcomeException(String stageId, Outcome outcome, Set<Outcome> allowedOutcomes) {
        super(String.format("Outcome %s is not allowed at stage '%s'. Allowed: %s",
                outcome, stageId, allowedOutcomes));
        this.stageId = stageId;
        this.outcome = outcome;
        this.allowedOutcomes = Set.copyOf(allowedOutcomes);
    }

    public String getStageId() {
        return stageId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Set<Outcome> getAllowedOutcomes() {
        return allowedOutcomes;
    }
}
