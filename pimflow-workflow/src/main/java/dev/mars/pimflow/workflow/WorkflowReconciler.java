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
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.workflow.audit.AuditAction;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.definition.Stage;
import dev.mars.pimflow.workflow.definition.WorkflowDefinition;
import dev.mars.pimflow.workflow.definition.WorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.run.StageTransition;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.store.StoreTransaction;
import dev.mars.pimflow.workflow.store.WorkflowStore;
import dev.mars.pimflow.workflow.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Restores the task and audit invariants of stored runs after a crash between writes.
 * <p>
 * Repairs never move a run to another stage:
 * <ul>
 *   <li>an ACTIVE run at a human stage without a pending task gets a new task</li>
 *   <li>an ACTIVE run whose audit trail has fewer {@code STAGE_ENTERED} entries than its history,
 *       or does not end with entering its current stage, gets the missing entries, noted
 *       {@value #RECOVERED_NOTE}</li>
 *   <li>pending tasks for another stage, duplicate pending tasks, and pending tasks of terminal
 *       or unknown runs are expired</li>
 *   <li>an ACTIVE run parked on an automatic stage, or bound to an unknown definition, is reported</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class WorkflowReconciler {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowReconciler.class);

    public static final String RECOVERED_NOTE = "recovered";
    private static final String STALE_REASON = "superseded by reconciliation";

    private final WorkflowDefinitionRegistry registry;
    private final WorkflowStore store;
    private final RunLockManager locks;
    private final Clock clock;

    public WorkflowReconciler(WorkflowDefinitionRegistry registry, WorkflowStore store,
                              RunLockManager locks, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReconciliationReport reconcile() throws StorageUnavailableException {
        ReconciliationReport report = new ReconciliationReport();

        for (WorkflowRun stored : store.findRuns(run -> true)) {
            report.runScanned();
            String runId = stored.getRunId();
            ReentrantLock lock = locks.lock(runId);
            try {
                // re-read under the lock in case an engine call committed meanwhile
                reconcileRun(store.findRun(runId).orElse(stored), report);
            } finally {
                locks.release(runId, lock, store.findRun(runId).map(WorkflowRun::isActive).orElse(false));
            }
        }
        expireOrphanTasks(report);

        if (report.isClean()) {
            logger.debug("Reconciliation found nothing to repair in {} runs", report.getRunsScanned());
        } else {
            logger.warn("Reconciliation repaired stored workflow state: {}", report);
        }
        return report;
    }

    private void reconcileRun(WorkflowRun run, ReconciliationReport report) throws StorageUnavailableException {
        Instant now = clock.instant();
        List<Task> pending = store.findTasks(task -> task.getRunId().equals(run.getRunId()) && task.isPending());
        StoreTransaction.Builder repairs = StoreTransaction.withoutRun();
        boolean changed = false;

        if (run.isTerminal()) {
            for (Task task : pending) {
                repairs.task(task.expire(Actor.system(), "run is " + run.getStatus(), now));
                report.taskExpired(task.getTaskId());
                changed = true;
            }
            commit(repairs, changed);
            return;
        }

        WorkflowDefinition definition;
        try {
            definition = registry.get(run.getDefinitionId());
        } catch (NotFoundException e) {
            report.needsAttention(run.getRunId(), "definition '" + run.getDefinitionId() + "' is not registered");
            return;
        }
        Optional<Stage> current = definition.getStage(run.getCurrentStageId());
        if (current.isEmpty()) {
            report.needsAttention(run.getRunId(), "stage '" + run.getCurrentStageId() + "' is not in its definition");
            return;
        }
        Stage stage = current.get();

        Task keep = null;
        if (stage.isHuman()) {
            List<Task> matching = pending.stream()
                    .filter(task -> task.getStageId().equals(stage.getId()))
                    .collect(Collectors.toList());
            if (!matching.isEmpty()) {
                keep = matching.get(matching.size() - 1);
            }
        } else if (stage.isAutomatic()) {
            report.needsAttention(run.getRunId(), "parked on automatic stage '" + stage.getId() + "'");
        } else {
            report.needsAttention(run.getRunId(), "active at terminal stage '" + stage.getId() + "'");
        }

        for (Task task : pending) {
            if (task != keep) {
                repairs.task(task.expire(Actor.system(), STALE_REASON, now));
                report.taskExpired(task.getTaskId());
                changed = true;
            }
        }

        if (stage.isHuman() && keep == null) {
            Task task = Task.builder()
                    .taskId(UUID.randomUUID().toString())
                    .runId(run.getRunId())
                    .stageId(stage.getId())
                    .assignedRole(stage.getRequiredRole())
                    .createdAt(now)
                    .build();
            repairs.task(task);
            report.taskRecreated(task.getTaskId());
            changed = true;
            logger.info("Recreated missing task {} for run {} at stage '{}'", task.getTaskId(), run.getRunId(), stage.getId());
        }

        if (recoverAudit(run, stage, repairs, now)) {
            report.auditRecovered(run.getRunId());
            changed = true;
        }

        commit(repairs, changed);
    }

    private void expireOrphanTasks(ReconciliationReport report) throws StorageUnavailableException {
        Set<String> runIds = store.findRuns(run -> true).stream()
                .map(WorkflowRun::getRunId)
                .collect(Collectors.toSet());
        Map<String, Task> orphans = store.findTasks(task -> task.isPending() && !runIds.contains(task.getRunId()))
                .stream()
                .collect(Collectors.toMap(Task::getTaskId, Function.identity()));
        if (orphans.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        StoreTransaction.Builder repairs = StoreTransaction.withoutRun();
        for (Task task : orphans.values()) {
            repairs.task(task.expire(Actor.system(), "run " + task.getRunId() + " does not exist", now));
            report.taskExpired(task.getTaskId());
        }
        store.commit(repairs.build());
    }

    /**
     * Appends the {@code STAGE_ENTERED} entries the audit trail lost. Every stage in the run's
     * history has one entry, so a short trail is refilled from the tail of the history. A run
     * without history only needs its trail to end at the current stage.
     */
    private boolean recoverAudit(WorkflowRun run, Stage stage, StoreTransaction.Builder repairs, Instant now) {
        long sequence = 0;
        int entered = 0;
        AuditEntry last = null;
        for (AuditEntry entry : store.auditLog().query(run.getRunId())) {
            sequence = entry.getSequence();
            last = entry;
            if (entry.getAction() == AuditAction.STAGE_ENTERED) {
                entered++;
            }
        }

        List<StageTransition> history = run.getHistory();
        boolean recovered = false;
        String lastStageId = last != null && last.getAction() == AuditAction.STAGE_ENTERED ? last.getStageId() : null;
        for (int i = entered; i < history.size(); i++) {
            StageTransition transition = history.get(i);
            repairs.audit(recoveredEntry(run, ++sequence, transition.getToStageId())
                    .actor(transition.getActor())
                    .outcome(transition.getOutcome())
                    .timestamp(transition.getTimestamp())
                    .build());
            lastStageId = transition.getToStageId();
            recovered = true;
        }
        if (!stage.getId().equals(lastStageId)) {
            repairs.audit(recoveredEntry(run, ++sequence, stage.getId())
                    .actor(Actor.system())
                    .timestamp(now)
                    .build());
            recovered = true;
        }
        if (recovered) {
            logger.info("Recovered audit trail of run {} up to sequence {}", run.getRunId(), sequence);
        }
        return recovered;
    }

    private static AuditEntry.Builder recoveredEntry(WorkflowRun run, long sequence, String stageId) {
        return AuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .runId(run.getRunId())
                .sequence(sequence)
                .action(AuditAction.STAGE_ENTERED)
                .stageId(stageId)
                .note(RECOVERED_NOTE);
    }

    private void commit(StoreTransaction.Builder repairs, boolean changed) throws StorageUnavailableException {
        if (changed) {
            store.commit(repairs.build());
        }
    }
}
