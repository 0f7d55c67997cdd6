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
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.core.exceptions.AlreadyResolvedException;
import dev.mars.pimflow.core.exceptions.AlreadyTerminalException;
import dev.mars.pimflow.core.exceptions.ForbiddenException;
import dev.mars.pimflow.core.exceptions.InvalidOutcomeException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.PimflowException;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.entity.EntityStore;
import dev.mars.pimflow.workflow.audit.AuditAction;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.audit.AuditLog;
import dev.mars.pimflow.workflow.definition.Stage;
import dev.mars.pimflow.workflow.definition.WorkflowDefinition;
import dev.mars.pimflow.workflow.definition.WorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.notification.TransitionEvent;
import dev.mars.pimflow.workflow.notification.TransitionListener;
import dev.mars.pimflow.workflow.observability.WorkflowMetrics;
import dev.mars.pimflow.workflow.run.RunStatus;
import dev.mars.pimflow.workflow.run.StageTransition;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.store.StoreTransaction;
import dev.mars.pimflow.workflow.store.WorkflowStore;
import dev.mars.pimflow.workflow.task.Task;
import dev.mars.pimflow.workflow.task.TaskQueue;
import dev.mars.pimflow.workflow.task.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Synchronous implementation of {@link WorkflowEngine} over a {@link WorkflowStore}.
 * <p>
 * Every mutating call takes the run's lock from {@link RunLockManager}, re-reads the run and
 * task under it, validates the request and only then builds one {@link StoreTransaction}.
 * A rejected call therefore writes nothing. Listeners are notified after the commit and
 * outside the lock.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    private final WorkflowDefinitionRegistry registry;
    private final EntityStore entityStore;
    private final WorkflowStore store;
    private final RunLockManager locks;
    private final TransitionListener listener;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final TaskQueue taskQueue;

    private SimpleWorkflowEngine(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "Definition registry cannot be null");
        this.entityStore = Objects.requireNonNull(builder.entityStore, "Entity store cannot be null");
        this.store = Objects.requireNonNull(builder.store, "Workflow store cannot be null");
        this.locks = builder.locks != null ? builder.locks : new RunLockManager();
        this.listener = builder.listener != null ? builder.listener : TransitionListener.noop();
        this.metrics = builder.metrics != null ? builder.metrics : WorkflowMetrics.noop();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.taskQueue = new TaskQueue(store, locks, this::expireTask);

        this.metrics.setActiveRuns(store.findRuns(WorkflowRun::isActive).size());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public WorkflowRun start(String definitionId, EntityReference target, Actor initiator)
            throws NotFoundException, StorageUnavailableException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(initiator, "initiator");

        WorkflowDefinition definition;
        try {
            definition = registry.get(definitionId);
            if (entityStore.getEntity(target).isEmpty()) {
                throw new NotFoundException("Entity", target.toString());
            }
        } catch (NotFoundException e) {
            rejected(e);
            throw e;
        }

        Instant now = clock.instant();
        String runId = UUID.randomUUID().toString();
        String initialStage = definition.getInitialStageId();

        // the run is only visible once committed, so its lock is uncontended here
        ReentrantLock lock = locks.lock(runId);
        Transition transition;
        try {
            WorkflowRun run = WorkflowRun.builder()
                    .runId(runId)
                    .definitionId(definition.getId())
                    .target(target)
                    .initiator(initiator)
                    .currentStageId(initialStage)
                    .status(RunStatus.ACTIVE)
                    .createdAt(now)
                    .build();

            transition = new Transition(definition, run, 0, now);
            transition.enter(null, initialStage, null, initiator, null);
            store.commit(transition.toStoreTransaction());
        } catch (StorageUnavailableException e) {
            rejected(e);
            throw e;
        } finally {
            locks.release(runId, lock, isActive(runId));
        }

        logger.info("Started run {} of '{}' for {} by {}, now at stage '{}' ({})",
                runId, definition.getId(), target, initiator,
                transition.run.getCurrentStageId(), transition.run.getStatus());
        metrics.recordRunStarted(definition.getId());
        afterCommit(transition);
        return transition.run;
    }

    @Override
    public WorkflowRun resolveTask(String taskId, Actor actor, Outcome outcome, String note)
            throws NotFoundException, AlreadyTerminalException, AlreadyResolvedException,
                   ForbiddenException, InvalidOutcomeException, StorageUnavailableException {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(outcome, "outcome");

        Transition transition;
        Task resolved;
        try {
            String runId = taskQueue.get(taskId).getRunId();
            ReentrantLock lock = locks.lock(runId);
            try {
                Task task = taskQueue.get(taskId);
                WorkflowRun run = loadRun(runId);
                if (run.isTerminal()) {
                    throw new AlreadyTerminalException(runId, run.getStatus(), RunStatus.ACTIVE);
                }
                if (!task.isPending()) {
                    throw new AlreadyResolvedException(taskId, task.getStatus(), TaskStatus.RESOLVED);
                }
                checkActor(task, actor);

                WorkflowDefinition definition = registry.get(run.getDefinitionId());
                Stage stage = definition.getStage(task.getStageId())
                        .orElseThrow(() -> new NotFoundException("Stage", task.getStageId()));
                if (!stage.allows(outcome)) {
                    throw new InvalidOutcomeException(stage.getId(), outcome, stage.getAllowedOutcomes());
                }
                String nextStage = stage.nextStageFor(outcome).orElseThrow();

                Instant now = clock.instant();
                resolved = task.resolve(actor, outcome, note, now);
                transition = new Transition(definition, run, store.auditLog().lastSequence(runId), now);
                transition.tasks.add(resolved);
                transition.enter(stage.getId(), nextStage, outcome, actor, note);
                store.commit(transition.toStoreTransaction());
            } finally {
                locks.release(runId, lock, isActive(runId));
            }
        } catch (PimflowException e) {
            rejected(e);
            throw e;
        }

        logger.info("Task {} resolved by {} with '{}', run {} now at stage '{}' ({})",
                taskId, actor, outcome.getKey(), transition.run.getRunId(),
                transition.run.getCurrentStageId(), transition.run.getStatus());
        metrics.recordTaskResolved(resolved.getStageId(), outcome.getKey());
        afterCommit(transition);
        return transition.run;
    }

    @Override
    public WorkflowRun cancel(String runId, Actor actor, String reason)
            throws NotFoundException, AlreadyTerminalException, StorageUnavailableException {
        Objects.requireNonNull(actor, "actor");

        Transition transition;
        try {
            loadRun(runId);
            ReentrantLock lock = locks.lock(runId);
            try {
                WorkflowRun run = loadRun(runId);
                if (run.isTerminal()) {
                    throw new AlreadyTerminalException(runId, run.getStatus(), RunStatus.CANCELLED);
                }
                WorkflowDefinition definition = registry.get(run.getDefinitionId());

                Instant now = clock.instant();
                transition = new Transition(definition, run, store.auditLog().lastSequence(runId), now);
                for (Task open : taskQueue.findByRun(runId)) {
                    if (open.isPending()) {
                        transition.tasks.add(open.expire(actor, "run cancelled: " + reason, now));
                    }
                }
                transition.cancel(actor, reason);
                store.commit(transition.toStoreTransaction());
            } finally {
                locks.release(runId, lock, isActive(runId));
            }
        } catch (NotFoundException | AlreadyTerminalException | StorageUnavailableException e) {
            rejected(e);
            throw e;
        }

        logger.info("Run {} cancelled by {} at stage '{}': {}",
                runId, actor, transition.run.getCurrentStageId(), reason);
        afterCommit(transition);
        return transition.run;
    }

    @Override
    public Task expireTask(String taskId, Actor actor, String reason)
            throws NotFoundException, AlreadyTerminalException, AlreadyResolvedException,
                   ForbiddenException, StorageUnavailableException {
        Objects.requireNonNull(actor, "actor");

        Transition transition;
        Task expired;
        try {
            String runId = taskQueue.get(taskId).getRunId();
            ReentrantLock lock = locks.lock(runId);
            try {
                Task task = taskQueue.get(taskId);
                WorkflowRun run = loadRun(runId);
                if (run.isTerminal()) {
                    throw new AlreadyTerminalException(runId, run.getStatus(), RunStatus.CANCELLED);
                }
                if (!task.isPending()) {
                    throw new AlreadyResolvedException(taskId, task.getStatus(), TaskStatus.EXPIRED);
                }
                if (!RoleCatalog.ADMIN.equals(actor.getRole()) && !task.getAssignedRole().equals(actor.getRole())) {
                    throw new ForbiddenException(taskId, actor, task.getAssignedRole(),
                            "only administrators or holders of the task's role may expire it");
                }
                WorkflowDefinition definition = registry.get(run.getDefinitionId());

                Instant now = clock.instant();
                expired = task.expire(actor, reason, now);
                transition = new Transition(definition, run, store.auditLog().lastSequence(runId), now);
                transition.tasks.add(expired);
                transition.cancel(actor, "task expired: " + reason);
                store.commit(transition.toStoreTransaction());
            } finally {
                locks.release(runId, lock, isActive(runId));
            }
        } catch (NotFoundException | AlreadyTerminalException | AlreadyResolvedException
                 | ForbiddenException | StorageUnavailableException e) {
            rejected(e);
            throw e;
        }

        logger.info("Task {} at stage '{}' expired by {} ({}), run {} cancelled",
                taskId, expired.getStageId(), actor, reason, expired.getRunId());
        afterCommit(transition);
        return expired;
    }

    @Override
    public WorkflowRun getRun(String runId) throws NotFoundException {
        return loadRun(runId);
    }

    @Override
    public List<WorkflowRun> findRunsForEntity(EntityReference target) {
        Objects.requireNonNull(target, "target");
        return store.findRuns(run -> run.getTarget().equals(target));
    }

    @Override
    public List<WorkflowRun> activeRuns() {
        return store.findRuns(WorkflowRun::isActive);
    }

    @Override
    public TaskQueue taskQueue() {
        return taskQueue;
    }

    @Override
    public AuditLog auditLog() {
        return store.auditLog();
    }

    public RunLockManager getRunLocks() {
        return locks;
    }

    private boolean isActive(String runId) {
        return store.findRun(runId).map(WorkflowRun::isActive).orElse(false);
    }

    private WorkflowRun loadRun(String runId) throws NotFoundException {
        return store.findRun(runId).orElseThrow(() -> new NotFoundException("WorkflowRun", runId));
    }

    private static void checkActor(Task task, Actor actor) throws ForbiddenException {
        if (!task.getAssignedRole().equals(actor.getRole())) {
            throw new ForbiddenException(task.getTaskId(), actor, task.getAssignedRole(),
                    "role " + actor.getRole() + " cannot act on a " + task.getAssignedRole() + " task");
        }
        if (task.getAssignee() != null && !task.getAssignee().equals(actor.getUserId())) {
            throw new ForbiddenException(task.getTaskId(), actor, task.getAssignedRole(),
                    "task is assigned to " + task.getAssignee());
        }
    }

    private void rejected(PimflowException e) {
        metrics.recordRejectedCall(e.getClass().getSimpleName());
        logger.debug("Rejected workflow call: {}", e.getMessage());
    }

    private void afterCommit(Transition transition) {
        WorkflowRun run = transition.run;
        for (TransitionEvent event : transition.events) {
            if (event.getType() == TransitionEvent.Type.STAGE_ENTERED) {
                metrics.recordStageEntered(run.getDefinitionId(), event.getToStageId());
            }
        }
        for (Task task : transition.createdTasks) {
            metrics.recordTaskCreated(task.getStageId(), task.getAssignedRole().getName());
        }
        for (Task task : transition.tasks) {
            if (task.getStatus() == TaskStatus.EXPIRED) {
                metrics.recordTaskExpired(task.getStageId());
            }
        }
        if (run.getStatus() == RunStatus.COMPLETED) {
            double seconds = Duration.between(run.getCreatedAt(), run.getUpdatedAt()).toMillis() / 1000.0;
            metrics.recordRunCompleted(run.getDefinitionId(), seconds);
        } else if (run.getStatus() == RunStatus.CANCELLED) {
            metrics.recordRunCancelled(run.getDefinitionId());
        }

        for (TransitionEvent event : transition.events) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                logger.warn("Transition listener failed for {}, transition stays committed", event, e);
            }
        }
    }

    /**
     * Accumulates the writes and events of one engine call.
     */
    private final class Transition {
        private final WorkflowDefinition definition;
        private final Instant now;
        private final List<Task> tasks = new ArrayList<>();
        private final List<Task> createdTasks = new ArrayList<>();
        private final List<AuditEntry> auditEntries = new ArrayList<>();
        private final List<TransitionEvent> events = new ArrayList<>();
        private WorkflowRun run;
        private long sequence;

        private Transition(WorkflowDefinition definition, WorkflowRun run, long lastSequence, Instant now) {
            this.definition = definition;
            this.run = run;
            this.sequence = lastSequence;
            this.now = now;
        }

        /**
         * Enters a stage, then keeps following automatic stages until the run stops at a human
         * stage, which gets a new task, or completes at a terminal stage.
         */
        void enter(String fromStageId, String toStageId, Outcome outcome, Actor actor, String note) {
            String from = fromStageId;
            String to = toStageId;
            Outcome via = outcome;
            Actor by = actor;
            String comment = note;

            // registration rejects automatic-only cycles; this bounds a definition that slipped through
            int remaining = definition.getStages().size() + 1;
            while (true) {
                if (remaining-- == 0) {
                    throw new IllegalStateException("Automatic stages of '" + definition.getId() + "' do not terminate");
                }
                Stage stage = definition.getStage(to)
                        .orElseThrow(() -> new IllegalStateException("Stage missing from registered definition"));

                run = run.enterStage(new StageTransition(from, to, via, by, now));
                auditEntries.add(auditEntry(AuditAction.STAGE_ENTERED, to, by, via, comment));
                events.add(event(TransitionEvent.Type.STAGE_ENTERED, from, to, via, by));

                if (stage.isTerminal()) {
                    run = run.complete(now);
                    events.add(event(TransitionEvent.Type.RUN_COMPLETED, from, to, via, by));
                    return;
                }
                if (stage.isHuman()) {
                    Task task = Task.builder()
                            .taskId(UUID.randomUUID().toString())
                            .runId(run.getRunId())
                            .stageId(stage.getId())
                            .assignedRole(stage.getRequiredRole())
                            .createdAt(now)
                            .build();
                    tasks.add(task);
                    createdTasks.add(task);
                    return;
                }

                from = to;
                to = stage.getNext();
                via = null;
                by = Actor.system();
                comment = null;
            }
        }

        void cancel(Actor actor, String reason) {
            String stageId = run.getCurrentStageId();
            run = run.cancel(reason, now);
            auditEntries.add(auditEntry(AuditAction.RUN_CANCELLED, stageId, actor, null, reason));
            events.add(event(TransitionEvent.Type.RUN_CANCELLED, stageId, null, null, actor));
        }

        private AuditEntry auditEntry(AuditAction action, String stageId, Actor actor, Outcome outcome, String note) {
            return AuditEntry.builder()
                    .entryId(UUID.randomUUID().toString())
                    .runId(run.getRunId())
                    .sequence(++sequence)
                    .action(action)
                    .stageId(stageId)
                    .actor(actor)
                    .outcome(outcome)
                    .timestamp(now)
                    .note(note)
                    .build();
        }

        private TransitionEvent event(TransitionEvent.Type type, String from, String to, Outcome outcome, Actor actor) {
            return new TransitionEvent(type, run.getRunId(), run.getDefinitionId(), run.getTarget(),
                    from, to, outcome, actor, now);
        }

        StoreTransaction toStoreTransaction() {
            StoreTransaction.Builder builder = StoreTransaction.forRun(run).audit(auditEntries);
            for (Task task : tasks) {
                builder.task(task);
            }
            return builder.build();
        }
    }

    public static class Builder {
        private WorkflowDefinitionRegistry registry;
        private EntityStore entityStore;
        private WorkflowStore store;
        private RunLockManager locks;
        private TransitionListener listener;
        private WorkflowMetrics metrics;
        private Clock clock;

        public Builder registry(WorkflowDefinitionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        public Builder store(WorkflowStore store) {
            this.store = store;
            return this;
        }

        public Builder locks(RunLockManager locks) {
            this.locks = locks;
            return this;
        }

        public Builder listener(TransitionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SimpleWorkflowEngine build() {
            return new SimpleWorkflowEngine(this);
        }
    }
}
