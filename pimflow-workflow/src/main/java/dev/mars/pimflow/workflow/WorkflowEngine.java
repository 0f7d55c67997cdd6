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

package dev.mars.pimflow.workflow;

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.EntityReference;
import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.exceptions.AlreadyResolvedException;
import dev.mars.pimflow.core.exceptions.AlreadyTerminalException;
import dev.mars.pimflow.core.exceptions.ForbiddenException;
import dev.mars.pimflow.core.exceptions.InvalidOutcomeException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.workflow.audit.AuditLog;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;
import dev.mars.pimflow.workflow.task.TaskQueue;

import java.util.List;

/**
 * Role-gated approval workflow engine.
 * <p>
 * A run is started for a product or asset, passes through automatic stages on its own and
 * stops at each human stage until a task for the stage's role is resolved. Every operation
 * that changes a run either commits all of its run, task and audit writes or fails without
 * changing anything.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public interface WorkflowEngine {

    /**
     * Starts a run of a definition for an entity and advances it to its first human or terminal stage.
     *
     * @param definitionId the registered definition to run
     * @param target the product or asset under review
     * @param initiator the actor starting the run
     * @return the run, ACTIVE with one pending task or already COMPLETED
     * @throws NotFoundException if the definition or the target entity does not exist
     */
    WorkflowRun start(String definitionId, EntityReference target, Actor initiator)
            throws NotFoundException, StorageUnavailableException;

    /**
     * Resolves a pending task with an outcome and moves its run to the mapped stage.
     *
     * @throws NotFoundException if the task does not exist
     * @throws AlreadyTerminalException if the task's run is completed or cancelled
     * @throws AlreadyResolvedException if the task is no longer pending
     * @throws ForbiddenException if the actor's role differs from the task's role or the task
     *                            is assigned to another user
     * @throws InvalidOutcomeException if the stage does not accept the outcome
     */
    WorkflowRun resolveTask(String taskId, Actor actor, Outcome outcome, String note)
            throws NotFoundException, AlreadyTerminalException, AlreadyResolvedException,
                   ForbiddenException, InvalidOutcomeException, StorageUnavailableException;

    /**
     * Cancels an active run and expires its open task.
     *
     * @throws NotFoundException if the run does not exist
     * @throws AlreadyTerminalException if the run is already completed or cancelled
     */
    WorkflowRun cancel(String runId, Actor actor, String reason)
            throws NotFoundException, AlreadyTerminalException, StorageUnavailableException;

    /**
     * Expires a pending task and cancels its run in the same transaction.
     *
     * @throws ForbiddenException unless the actor is an administrator or holds the task's role
     */
    Task expireTask(String taskId, Actor actor, String reason)
            throws NotFoundException, AlreadyTerminalException, AlreadyResolvedException,
                   ForbiddenException, StorageUnavailableException;

    WorkflowRun getRun(String runId) throws NotFoundException;

    List<WorkflowRun> findRunsForEntity(EntityReference target);

    List<WorkflowRun> activeRuns();

    TaskQueue taskQueue();

    AuditLog auditLog();
}
