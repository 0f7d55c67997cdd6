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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.Role;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A human-actionable unit of work for one stage of one run.
 * <p>
 * A task is created PENDING for a role and may be narrowed to a single user with
 * {@link #assignTo(String)}. Once resolved or expired it never changes again.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@JsonDeserialize(builder = Task.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {

    private final String taskId;
    private final String runId;
    private final String stageId;
    private final Role assignedRole;
    private final String assignee;
    private final TaskStatus status;
    private final Outcome outcome;
    private final Actor resolvedBy;
    private final String note;
    private final Instant createdAt;
    private final Instant resolvedAt;
    private final String expiryReason;

    private Task(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "Task ID cannot be null");
        this.runId = Objects.requireNonNull(builder.runId, "Run ID cannot be null");
        this.stageId = Objects.requireNonNull(builder.stageId, "Stage ID cannot be null");
        this.assignedRole = Objects.requireNonNull(builder.assignedRole, "Assigned role cannot be null");
        this.assignee = builder.assignee;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.outcome = builder.outcome;
        this.resolvedBy = builder.resolvedBy;
        this.note = builder.note;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "Created timestamp cannot be null");
        this.resolvedAt = builder.resolvedAt;
        this.expiryReason = builder.expiryReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTaskId() {
        return taskId;
    }

    public String getRunId() {
        return runId;
    }

    public String getStageId() {
        return stageId;
    }

    public Role getAssignedRole() {
        return assignedRole;
    }

    /**
     * @return the user the task is narrowed to, or {@code null} for any holder of the role
     */
    public String getAssignee() {
        return assignee;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Actor getResolvedBy() {
        return resolvedBy;
    }

    public String getNote() {
        return note;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getExpiryReason() {
        return expiryReason;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    /**
     * Age of the task at the given instant.
     */
    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public Task resolve(Actor actor, Outcome outcome, String note, Instant timestamp) {
        return new Builder(this)
                .status(TaskStatus.RESOLVED)
                .outcome(outcome)
                .resolvedBy(actor)
                .note(note)
                .resolvedAt(timestamp)
                .build();
    }

    public Task expire(Actor actor, String reason, Instant timestamp) {
        return new Builder(this)
                .status(TaskStatus.EXPIRED)
                .resolvedBy(actor)
                .expiryReason(reason)
                .resolvedAt(timestamp)
                .build();
    }

    public Task assignTo(String userId) {
        return new Builder(this).assignee(userId).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return Objects.equals(taskId, task.taskId) &&
               status == task.status &&
               Objects.equals(assignee, task.assignee) &&
               outcome == task.outcome &&
               Objects.equals(resolvedAt, task.resolvedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, status, assignee);
    }

    @Override
    public String toString() {
        return "Task{" +
                "taskId='" + taskId + '\'' +
                ", runId='" + runId + '\'' +
                ", stageId='" + stageId + '\'' +
                ", role=" + assignedRole +
                (assignee != null ? ", assignee='" + assignee + '\'' : "") +
                ", status=" + status +
                (outcome != null ? ", outcome=" + outcome.getKey() : "") +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String taskId;
        private String runId;
        private String stageId;
        private Role assignedRole;
        private String assignee;
        private TaskStatus status = TaskStatus.PENDING;
        private Outcome outcome;
        private Actor resolvedBy;
        private String note;
        private Instant createdAt;
        private Instant resolvedAt;
        private String expiryReason;

        public Builder() {
        }

        public Builder(Task existing) {
            this.taskId = existing.taskId;
            this.runId = existing.runId;
            this.stageId = existing.stageId;
            this.assignedRole = existing.assignedRole;
            this.assignee = existing.assignee;
            this.status = existing.status;
            this.outcome = existing.outcome;
            this.resolvedBy = existing.resolvedBy;
            this.note = existing.note;
            this.createdAt = existing.createdAt;
            this.resolvedAt = existing.resolvedAt;
            this.expiryReason = existing.expiryReason;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder stageId(String stageId) {
            this.stageId = stageId;
            return this;
        }

        public Builder assignedRole(Role assignedRole) {
            this.assignedRole = assignedRole;
            return this;
        }

        public Builder assignee(String assignee) {
            this.assignee = assignee;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder resolvedBy(Actor resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder expiryReason(String expiryReason) {
            this.expiryReason = expiryReason;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
