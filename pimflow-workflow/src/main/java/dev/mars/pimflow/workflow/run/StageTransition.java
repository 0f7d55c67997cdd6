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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.Outcome;

import java.time.Instant;
import java.util.Objects;

/**
 * One step of a run's history. The first transition of every run has no source stage,
 * and transitions out of automatic stages carry no outcome.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StageTransition {

    private final String fromStageId;
    private final String toStageId;
    private final Outcome outcome;
    private final Actor actor;
    private final Instant timestamp;

    @JsonCreator
    public StageTransition(@JsonProperty("fromStageId") String fromStageId,
                           @JsonProperty("toStageId") String toStageId,
                           @JsonProperty("outcome") Outcome outcome,
                           @JsonProperty("actor") Actor actor,
                           @JsonProperty("timestamp") Instant timestamp) {
        this.fromStageId = fromStageId;
        this.toStageId = Objects.requireNonNull(toStageId, "toStageId");
        this.outcome = outcome;
        this.actor = Objects.requireNonNull(actor, "actor");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getFromStageId() {
        return fromStageId;
    }

    public String getToStageId() {
        return toStageId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Actor getActor() {
        return actor;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageTransition that = (StageTransition) o;
        return Objects.equals(fromStageId, that.fromStageId) &&
               Objects.equals(toStageId, that.toStageId) &&
               outcome == that.outcome &&
               Objects.equals(actor, that.actor) &&
               Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromStageId, toStageId, outcome, actor, timestamp);
    }

    @Override
    public String toString() {
        return fromStageId + " -> " + toStageId + (outcome != null ? " [" + outcome.getKey() + "]" : "");
    }
}
