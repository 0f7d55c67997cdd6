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

package dev.mars.pimflow.workflow.store;

import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The writes of one engine transition: the new run state, the tasks it created or changed
 * and the audit entries it produced. A store applies all of them or none.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class StoreTransaction {

    private final WorkflowRun run;
    private final List<Task> tasks;
    private final List<AuditEntry> auditEntries;

    private StoreTransaction(WorkflowRun run, List<Task> tasks, List<AuditEntry> auditEntries) {
        this.run = run;
        this.tasks = Collections.unmodifiableList(new ArrayList<>(tasks));
        this.auditEntries = Collections.unmodifiableList(new ArrayList<>(auditEntries));
    }

    public static Builder forRun(WorkflowRun run) {
        return new Builder(Objects.requireNonNull(run, "run"));
    }

    /**
     * A transaction that leaves the run record untouched, as used by reconciliation.
     */
    public static Builder withoutRun() {
        return new Builder(null);
    }

    /**
     * @return the run to write, or {@code null} if only tasks and audit entries change
     */
    public WorkflowRun getRun() {
        return run;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public List<AuditEntry> getAuditEntries() {
        return auditEntries;
    }

    public boolean isEmpty() {
        return run == null && tasks.isEmpty() && auditEntries.isEmpty();
    }

    @Override
    public String toString() {
        return "StoreTransaction{" +
                "run=" + (run != null ? run.getRunId() : null) +
                ", tasks=" + tasks.size() +
                ", auditEntries=" + auditEntries.size() +
                '}';
    }

    public static final class Builder {
        private final WorkflowRun run;
        private final List<Task> tasks = new ArrayList<>();
        private final List<AuditEntry> auditEntries = new ArrayList<>();

        private Builder(WorkflowRun run) {
            this.run = run;
        }

        public Builder task(Task task) {
            tasks.add(Objects.requireNonNull(task, "task"));
            return this;
        }

        public Builder audit(AuditEntry entry) {
            auditEntries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder audit(List<AuditEntry> entries) {
            for (AuditEntry entry : entries) {
                audit(entry);
            }
            return this;
        }

        public StoreTransaction build() {
            return new StoreTransaction(run, tasks, auditEntries);
        }
    }
}
