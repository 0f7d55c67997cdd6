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
import dev.mars.pimflow.workflow.audit.InMemoryAuditLog;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Workflow store kept in memory.
 * <p>
 * Commits hold the write half of a read-write lock and every query holds the read half,
 * so a reader sees either all of a transition's run and task changes or none of them. Run
 * and task writes are applied first and rolled back if the audit append fails.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowStore.class);

    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final AuditLog auditLog;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryWorkflowStore() {
        this(new InMemoryAuditLog());
    }

    public InMemoryWorkflowStore(AuditLog auditLog) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    }

    @Override
    public void commit(StoreTransaction transaction) throws StorageUnavailableException {
        Objects.requireNonNull(transaction, "transaction");
        if (transaction.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            WorkflowRun run = transaction.getRun();
            WorkflowRun previousRun = run != null ? runs.get(run.getRunId()) : null;
            Map<String, Task> previousTasks = new HashMap<>();
            for (Task task : transaction.getTasks()) {
                previousTasks.put(task.getTaskId(), tasks.get(task.getTaskId()));
            }

            if (run != null) {
                runs.put(run.getRunId(), run);
            }
            for (Task task : transaction.getTasks()) {
                tasks.put(task.getTaskId(), task);
            }

            try {
                auditLog.append(transaction.getAuditEntries());
            } catch (StorageUnavailableException | RuntimeException e) {
                logger.warn("Audit append failed, rolling back {}", transaction);
                restore(run, previousRun, previousTasks);
                throw e;
            }
            logger.debug("Committed {}", transaction);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void restore(WorkflowRun run, WorkflowRun previousRun, Map<String, Task> previousTasks) {
        if (run != null) {
            if (previousRun != null) {
                runs.put(previousRun.getRunId(), previousRun);
            } else {
                runs.remove(run.getRunId());
            }
        }
        for (Map.Entry<String, Task> entry : previousTasks.entrySet()) {
            if (entry.getValue() != null) {
                tasks.put(entry.getKey(), entry.getValue());
            } else {
                tasks.remove(entry.getKey());
            }
        }
    }

    @Override
    public Optional<WorkflowRun> findRun(String runId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(runId != null ? runs.get(runId) : null);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<WorkflowRun> findRuns(Predicate<WorkflowRun> filter) {
        lock.readLock().lock();
        try {
            return runs.values().stream()
                    .filter(filter)
                    .sorted(Comparator.comparing(WorkflowRun::getCreatedAt).thenComparing(WorkflowRun::getRunId))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Task> findTask(String taskId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(taskId != null ? tasks.get(taskId) : null);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Task> findTasks(Predicate<Task> filter) {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                    .filter(filter)
                    .sorted(Comparator.comparing(Task::getCreatedAt).thenComparing(Task::getTaskId))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public AuditLog auditLog() {
        return auditLog;
    }
}
