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

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.Role;
import dev.mars.pimflow.core.exceptions.AlreadyResolvedException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.PimflowException;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.workflow.RunLockManager;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.store.StoreTransaction;
import dev.mars.pimflow.workflow.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Role- and user-scoped view over the tasks held in a {@link WorkflowStore}.
 * <p>
 * Tasks are created and resolved only by the workflow engine. The queue adds the
 * operations that do not move a run: narrowing a task to a user, and expiry, which it
 * hands back to the engine.
 * <p>
 * Query methods accept a {@code null} status to mean any status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class TaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);

    private final WorkflowStore store;
    private final RunLockManager locks;
    private final TaskExpiryHandler expiryHandler;

    public TaskQueue(WorkflowStore store, RunLockManager locks, TaskExpiryHandler expiryHandler) {
        this.store = Objects.requireNonNull(store, "store");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.expiryHandler = Objects.requireNonNull(expiryHandler, "expiryHandler");
    }

    public Task get(String taskId) throws NotFoundException {
        return store.findTask(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    public List<Task> findByRole(Role role, TaskStatus status) {
        Objects.requireNonNull(role, "role");
        return store.findTasks(task -> role.equals(task.getAssignedRole()) && matches(task, status));
    }

    public List<Task> findByAssignee(String userId, TaskStatus status) {
        Objects.requireNonNull(userId, "userId");
        return store.findTasks(task -> userId.equals(task.getAssignee()) && matches(task, status));
    }

    public List<Task> findByStatus(TaskStatus status) {
        return store.findTasks(task -> matches(task, status));
    }

    public List<Task> findByRun(String runId) {
        return store.findTasks(task -> task.getRunId().equals(runId));
    }

    /**
     * The pending task of a run, if the run is parked at a human stage.
     */
    public Optional<Task> findOpenTask(String runId) {
        return store.findTasks(task -> task.getRunId().equals(runId) && task.isPending())
                .stream()
                .reduce((first, second) -> second);
    }

    /**
     * Actionable tasks for an actor: pending tasks of the actor's role that are unassigned
     * or assigned to the actor.
     */
    public List<Task> findActionable(Actor actor) {
        return store.findTasks(task -> task.isPending()
                && task.getAssignedRole().equals(actor.getRole())
                && (task.getAssignee() == null || task.getAssignee().equals(actor.getUserId())));
    }

    /**
     * Narrows a pending role-scoped task to a single user. The status is unchanged.
     *
     * @throws NotFoundException if the task does not exist
     * @throws AlreadyResolvedException if the task is no longer pending
     */
    public Task assign(String taskId, String userId)
            throws NotFoundException, AlreadyResolvedException, StorageUnavailableException {
        Objects.requireNonNull(userId, "userId");
        Task task = get(taskId);

        String runId = task.getRunId();
        ReentrantLock lock = locks.lock(runId);
        try {
            task = get(taskId);
            if (!task.isPending()) {
                throw new AlreadyResolvedException(taskId, task.getStatus(), TaskStatus.PENDING);
            }
            Task assigned = task.assignTo(userId);
            store.commit(StoreTransaction.withoutRun().task(assigned).build());
            logger.debug("Assigned task {} at stage '{}' to {}", taskId, task.getStageId(), userId);
            return assigned;
        } finally {
            locks.release(runId, lock, store.findRun(runId).map(WorkflowRun::isActive).orElse(false));
        }
    }

    /**
     * Expires a pending task. Its run is cancelled in the same transaction.
     */
    public Task expire(String taskId, Actor actor, String reason) throws PimflowException {
        return expiryHandler.expireTask(taskId, actor, reason);
    }

    private static boolean matches(Task task, TaskStatus status) {
        return status == null || task.getStatus() == status;
    }
}
