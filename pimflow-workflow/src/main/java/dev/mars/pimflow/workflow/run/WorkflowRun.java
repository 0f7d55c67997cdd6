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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.EntityReference;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single execution of a workflow definition against one product or asset.
 * <p>
 * Instances are immutable. Every state change produces a new run via
 * {@link #enterStage(StageTransition)}, {@link #complete(Instant)} or {@link #cancel(String, Instant)},
 * and the history only ever grows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@JsonDeserialize(builder = WorkflowRun.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowRun {

    private final String runId;
    private final String definitionId;
    private final EntityReference target;
    private final Actor initiator;
    private final String currentStageId;
    private final RunStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String cancellationReason;
    private final List<StageTransition> history;

    private WorkflowRun(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "Run ID cannot be null");
        this.definitionId = Objects.requireNonNull(builder.definitionId, "Definition ID cannot be null");
        this.target = Objects.requireNonNull(builder.target, "Target entity cannot be null");
        this.initiator = Objects.requireNonNull(builder.initiator, "Initiator cannot be null");
        this.currentStageId = Objects.requireNonNull(builder.currentStageId, "Current stage cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "Created timestamp cannot be null");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.cancellationReason = builder.cancellationReason;
        this.history = Collections.unmodifiableList(new ArrayList<>(builder.history));
    }

    public static Builder builder() {
        return new Builder();
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

    public Actor getInitiator() {
        return initiator;
    }

    public String getCurrentStageId() {
        return currentStageId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public List<StageTransition> getHistory() {
        return history;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == RunStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves the run to the transition's target stage and records the transition.
     */
    public WorkflowRun enterStage(StageTransition transition) {
        return new Builder(this)
                .currentStageId(transition.getToStageId())
                .updatedAt(transition.getTimestamp())
                .appendHistory(transition)
                .build();
    }

    public WorkflowRun complete(Instant timestamp) {
        return new Builder(this)
                .status(RunStatus.COMPLETED)
                .updatedAt(timestamp)
                .build();
    }

    public WorkflowRun cancel(String reason, Instant timestamp) {
        return new Builder(this)
                .status(RunStatus.CANCELLED)
                .cancellationReason(reason)
                .updatedAt(timestamp)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowRun that = (WorkflowRun) o;
        return Objects.equals(runId, that.runId) &&
               Objects.equals(currentStageId, that.currentStageId) &&
               status == that.status &&
               Objects.equals(updatedAt, that.updatedAt) &&
               Objects.equals(history, that.history);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, currentStageId, status, updatedAt);
    }

    @Override
    public String toString() {
        return "WorkflowRun{" +
                "runId='" + runId + '\'' +
                ", definitionId='" + definitionId + '\'' +
                ", target=" + target +
                ", currentStageId='" + currentStageId + '\'' +
                ", status=" + status +
                ", transitions=" + history.size() +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String runId;
        private String definitionId;
        private EntityReference target;
        private Actor initiator;
        private String currentStageId;
        private RunStatus status = RunStatus.ACTIVE;
        private Instant createdAt;
        private Instant updatedAt;
        private String cancellationReason;
        private List<StageTransition> history = new ArrayList<>();

        public Builder() {
        }

        public Builder(WorkflowRun existing) {
            this.runId = existing.runId;
            this.definitionId = existing.definitionId;
            this.target = existing.target;
            this.initiator = existing.initiator;
            this.currentStageId = existing.currentStageId;
            this.status = existing.status;
            this.createdAt = existing.createdAt;
            this.updatedAt = existing.updatedAt;
            this.cancellationReason = existing.cancellationReason;
            this.history = new ArrayList<>(existing.history);
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder definitionId(String definitionId) {
            this.definitionId = definitionId;
            return this;
        }

        public Builder target(EntityReference target) {
            this.target = target;
            return this;
        }

        public Builder initiator(Actor initiator) {
            this.initiator = initiator;
            return this;
        }

        public Builder currentStageId(String currentStageId) {
            this.currentStageId = currentStageId;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder cancellationReason(String cancellationReason) {
            this.cancellationReason = cancellationReason;
            return this;
        }

        public Builder history(List<StageTransition> history) {
            this.history = history != null ? new ArrayList<>(history) : new ArrayList<>();
            return this;
        }

        Builder appendHistory(StageTransition transition) {
            this.history.add(transition);
            return this;
        }

        public WorkflowRun build() {
            return new WorkflowRun(this);
        }
    }
}
