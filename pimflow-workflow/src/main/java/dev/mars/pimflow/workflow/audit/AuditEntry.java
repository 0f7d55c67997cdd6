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

package dev.mars.pimflow.workflow.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.Outcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit record. Sequence numbers start at 1 and are contiguous per run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@JsonDeserialize(builder = AuditEntry.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AuditEntry {

    private final String entryId;
    private final String runId;
    private final long sequence;
    private final AuditAction action;
    private final String stageId;
    private final Actor actor;
    private final Outcome outcome;
    private final Instant timestamp;
    private final String note;

    private AuditEntry(Builder builder) {
        this.entryId = Objects.requireNonNull(builder.entryId, "Entry ID cannot be null");
        this.runId = Objects.requireNonNull(builder.runId, "Run ID cannot be null");
        this.sequence = builder.sequence;
        this.action = Objects.requireNonNull(builder.action, "Action cannot be null");
        this.stageId = Objects.requireNonNull(builder.stageId, "Stage ID cannot be null");
        this.actor = Objects.requireNonNull(builder.actor, "Actor cannot be null");
        this.outcome = builder.outcome;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "Timestamp cannot be null");
        this.note = builder.note;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEntryId() {
        return entryId;
    }

    public String getRunId() {
        return runId;
    }

    public long getSequence() {
        return sequence;
    }

    public AuditAction getAction() {
        return action;
    }

    public String getStageId() {
        return stageId;
    }

    public Actor getActor() {
        return actor;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getNote() {
        return note;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entryId.equals(((AuditEntry) o).entryId);
    }

    @Override
    public int hashCode() {
        return entryId.hashCode();
    }

    @Override
    public String toString() {
        return "AuditEntry{" +
                "runId='" + runId + '\'' +
                ", seq=" + sequence +
                ", action=" + action +
                ", stageId='" + stageId + '\'' +
                ", actor=" + actor +
                (outcome != null ? ", outcome=" + outcome.getKey() : "") +
                ", timestamp=" + timestamp +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String entryId;
        private String runId;
        private long sequence;
        private AuditAction action;
        private String stageId;
        private Actor actor;
        private Outcome outcome;
        private Instant timestamp;
        private String note;

        public Builder entryId(String entryId) {
            this.entryId = entryId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder stageId(String stageId) {
            this.stageId = stageId;
            return this;
        }

        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }
}
