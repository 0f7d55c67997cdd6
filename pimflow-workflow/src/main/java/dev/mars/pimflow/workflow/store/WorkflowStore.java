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

import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.workflow.audit.AuditLog;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence port for runs, tasks and their audit trail.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public interface WorkflowStore {

    /**
     * Applies every write of the transaction, or none of them.
     *
     * @throws StorageUnavailableException if the writes could not be made durable
     */
    void commit(StoreTransaction transaction) throws StorageUnavailableException;

    Optional<WorkflowRun> findRun(String runId);

    List<WorkflowRun> findRuns(Predicate<WorkflowRun> filter);

    Optional<Task> findTask(String taskId);

    /**
     * Tasks matching the filter, oldest first.
     */
    List<Task> findTasks(Predicate<Task> filter);

    AuditLog auditLog();
}
