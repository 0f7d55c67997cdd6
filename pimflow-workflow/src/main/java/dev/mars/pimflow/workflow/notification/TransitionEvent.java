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

package dev.mars.pimflow.workflow.notification;

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.EntityReference;
import dev.mars.pimflow.core.Outcome;

import java.time.Instant;
import java.util.Objects;

/**
 * A committed run transition, as published to notification listeners.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class TransitionEvent {

    public enum Type {
        STAGE_ENTERED,
        RUN_COMPLETED,
        RUN_CANCELLED
    }

    private final Type type;
    private final String runId;
    private final String definitionId;
    private final EntityReference target;
    private final String fromStageId;
    private final String toStageId;
    private final Outcome outcome;
    private final Actor actor;
    private final Instant timestamp;

    public TransitionEvent(Type type, String runId, String definitionId, EntityReference target,
                           String fromStageId, String toStageId, Outcome outcome, Actor actor, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.runId = Objects.requireNonNull(runId, "runId");
        this.definitionId = definitionId;
        this.target = target;
        this.fromStageId = fromStageId;
        this.toStageId = toStageId;
        this.outcome = outcome;
        this.actor = actor;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public Type getType() {
        return type;
    }

    public String getRunId() {
        return runId;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public EntityReference getTarget() {
        return target;
    }

    /**
     * @return the stage left, or {@code null} for the first stage of a run
     */
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
    public String toString() {
        return "TransitionEvent{" +
                "type=" + type +
                ", runId='" + runId + '\'' +
                ", target=" + target +
                ", " + fromStageId + " -> " + toStageId +
                (outcome != null ? ", outcome=" + outcome.getKey() : "") +
                ", actor=" + actor +
                '}';
    }
}
