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
import dev.mars.pimflow.core.Role;
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.core.exceptions.AlreadyResolvedException;
import dev.mars.pimflow.core.exceptions.AlreadyTerminalException;
import dev.mars.pimflow.core.exceptions.ForbiddenException;
import dev.mars.pimflow.core.exceptions.InvalidOutcomeException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.entity.InMemoryEntityStore;
import dev.mars.pimflow.workflow.audit.AuditAction;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.audit.InMemoryAuditLog;
import dev.mars.pimflow.workflow.definition.InMemoryWorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.notification.TransitionEvent;
import dev.mars.pimflow.workflow.notification.TransitionListener;
import dev.mars.pimflow.workflow.run.RunStatus;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.store.InMemoryWorkflowStore;
import dev.mars.pimflow.workflow.task.Task;
import dev.mars.pimflow.workflow.task.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Tests for SimpleWorkflowEngine: run lifecycle, authorisation, audit trail and atomicity.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
class SimpleWorkflowEngineTest {

    private static final EntityReference PRODUCT = EntityReference.product("sku-1001");
    private static final EntityReference ASSET = EntityReference.asset("img-42");

    private static final Actor IMPORTER = Actor.of("ingest-bot", RoleCatalog.ADMIN);
    private static final Actor STEWARD = Actor.of("dana", RoleCatalog.DATA_STEWARD);
    private static final Actor OTHER_STEWARD = Actor.of("sam", RoleCatalog.DATA_STEWARD);
    private static final Actor MARKETER = Actor.of("mo", RoleCatalog.MARKETING);
    private static final Actor COMPLIANCE = Actor.of("cleo", RoleCatalog.COMPLIANCE_OFFICER);
    private static final Actor ADMIN = Actor.of("root", RoleCatalog.ADMIN);

    @Mock
    private TransitionListener listener;

    private InMemoryAuditLog auditLog;
    private InMemoryWorkflowStore store;
    private RunLockManager locks;
    private TestWorkflows.MutableClock clock;
    private SimpleWorkflowEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        auditLog = spy(new InMemoryAuditLog());
        store = new InMemoryWorkflowStore(auditLog);
        locks = new RunLockManager();
        clock = TestWorkflows.clock();

        InMemoryWorkflowDefinitionRegistry registry = new InMemoryWorkflowDefinitionRegistry(RoleCatalog.defaults());
        registry.register(TestWorkflows.importReview());
        registry.register(TestWorkflows.autoPublish());
        registry.register(TestWorkflows.twoStepReview());

        InMemoryEntityStore entities = new InMemoryEntityStore();
        entities.put(PRODUCT, "Espresso machine");
        entities.put(ASSET, "Hero image");

        engine = SimpleWorkflowEngine.builder()
                .registry(registry)
                .entityStore(entities)
                .store(store)
                .locks(locks)
                .listener(listener)
                .clock(clock)
                .build();
    }

    private List<AuditEntry> audit(String runId) {
        List<AuditEntry> entries = new ArrayList<>();
        engine.auditLog().query(runId).forEach(entries::add);
        return entries;
    }

    private Task openTask(String runId) {
        return engine.taskQueue().findOpenTask(runId).orElseThrow();
    }

    @Nested
    @DisplayName("Import review scenario")
    class ImportReview {

        @Test
        void testStartParksAtHumanStage() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);

            assertEquals(RunStatus.ACTIVE, run.getStatus());
            assertEquals("review", run.getCurrentStageId());
            assertEquals(TestWorkflows.EPOCH, run.getCreatedAt());

            Task task = openTask(run.getRunId());
            assertEquals("review", task.getStageId());
            assertEquals(RoleCatalog.DATA_STEWARD, task.getAssignedRole());
            assertNull(task.getAssignee());
            assertEquals(List.of(task), engine.taskQueue().findByRole(RoleCatalog.DATA_STEWARD, TaskStatus.PENDING));

            List<AuditEntry> entries = audit(run.getRunId());
            assertEquals(2, entries.size());
            assertEquals("validate", entries.get(0).getStageId());
            assertEquals(IMPORTER, entries.get(0).getActor());
            assertEquals("review", entries.get(1).getStageId());
            assertEquals(Actor.system(), entries.get(1).getActor(), "automatic stages advance as system");
            assertNull(entries.get(1).getOutcome());
        }

        @Test
        void testRejectLoopsBackThenApprovePublishes() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            String runId = run.getRunId();

            clock.advance(Duration.ofMinutes(5));
            Task firstReview = openTask(runId);
            run = engine.resolveTask(firstReview.getTaskId(), STEWARD, Outcome.REJECT, "missing dimensions");

            assertEquals("review", run.getCurrentStageId(), "validate runs again and hands back to review");
            assertEquals(4, audit(runId).size());
            Task secondReview = openTask(runId);
            assertNotEquals(firstReview.getTaskId(), secondReview.getTaskId());

            Task resolvedFirst = engine.taskQueue().get(firstReview.getTaskId());
            assertEquals(TaskStatus.RESOLVED, resolvedFirst.getStatus());
            assertEquals(Outcome.REJECT, resolvedFirst.getOutcome());
            assertEquals(STEWARD, resolvedFirst.getResolvedBy());
            assertEquals("missing dimensions", resolvedFirst.getNote());

            clock.advance(Duration.ofMinutes(5));
            run = engine.resolveTask(secondReview.getTaskId(), STEWARD, Outcome.APPROVE, null);

            assertEquals(RunStatus.COMPLETED, run.getStatus());
            assertEquals("publish", run.getCurrentStageId());
            assertTrue(engine.taskQueue().findOpenTask(runId).isEmpty());

            List<AuditEntry> entries = audit(runId);
            assertEquals(5, entries.size());
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L),
                    entries.stream().map(AuditEntry::getSequence).collect(Collectors.toList()));
            assertEquals(List.of("validate", "review", "validate", "review", "publish"),
                    entries.stream().map(AuditEntry::getStageId).collect(Collectors.toList()));
            assertEquals(Outcome.REJECT, entries.get(2).getOutcome());
            assertEquals(STEWARD, entries.get(2).getActor());
            assertEquals(Outcome.APPROVE, entries.get(4).getOutcome());
            assertEquals(TestWorkflows.EPOCH.plus(Duration.ofMinutes(10)), entries.get(4).getTimestamp());

            assertEquals(5, run.getHistory().size());
            assertEquals(0, locks.size(), "terminal runs release their lock entry");
        }

        @Test
        void testWrongRoleIsForbiddenAndChangesNothing() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());

            ForbiddenException e = assertThrows(ForbiddenException.class,
                    () -> engine.resolveTask(task.getTaskId(), MARKETER, Outcome.APPROVE, null));

            assertEquals(RoleCatalog.DATA_STEWARD, e.getRequiredRole());
            assertEquals(MARKETER, e.getActor());
            assertEquals(run, engine.getRun(run.getRunId()));
            assertEquals(task, engine.taskQueue().get(task.getTaskId()));
            assertEquals(2, audit(run.getRunId()).size());
        }

        @Test
        void testRoleNameMustMatchExactly() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());
            Actor lowerCase = Actor.of("dana", Role.of("datasteward"));

            assertThrows(ForbiddenException.class,
                    () -> engine.resolveTask(task.getTaskId(), lowerCase, Outcome.APPROVE, null));
            assertTrue(engine.taskQueue().get(task.getTaskId()).isPending());
        }

        @Test
        void testOutcomeNotAllowedAtStage() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());

            InvalidOutcomeException e = assertThrows(InvalidOutcomeException.class,
                    () -> engine.resolveTask(task.getTaskId(), STEWARD, Outcome.REQUEST_CHANGES, null));

            assertEquals("review", e.getStageId());
            assertTrue(e.getAllowedOutcomes().contains(Outcome.APPROVE));
            assertTrue(openTask(run.getRunId()).isPending());
            assertEquals(2, audit(run.getRunId()).size());
        }

        @Test
        void testResolvingOnCompletedRun() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());
            engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null);

            assertThrows(AlreadyTerminalException.class,
                    () -> engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null));
        }

        @Test
        void testRepeatedCallsOnFinishedRunsLeaveNoLocks() throws Exception {
            for (int i = 0; i < 50; i++) {
                WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
                Task task = openTask(run.getRunId());
                engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null);

                assertThrows(AlreadyTerminalException.class,
                        () -> engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null));
                assertThrows(AlreadyTerminalException.class,
                        () -> engine.cancel(run.getRunId(), ADMIN, "too late"));
                assertThrows(AlreadyTerminalException.class,
                        () -> engine.expireTask(task.getTaskId(), ADMIN, "too late"));
                assertThrows(AlreadyResolvedException.class,
                        () -> engine.taskQueue().assign(task.getTaskId(), "sam"));
            }

            assertEquals(0, locks.size());
        }

        @Test
        void testRunsForEntityAndActiveRuns() throws Exception {
            WorkflowRun first = engine.start("import-review", PRODUCT, IMPORTER);
            clock.advance(Duration.ofSeconds(1));
            WorkflowRun second = engine.start("import-review", PRODUCT, IMPORTER);
            engine.start("two-step", ASSET, IMPORTER);

            assertEquals(List.of(first, second), engine.findRunsForEntity(PRODUCT));
            assertEquals(3, engine.activeRuns().size());

            engine.cancel(first.getRunId(), ADMIN, "duplicate import");

            assertEquals(2, engine.activeRuns().size());
            assertEquals(2, engine.findRunsForEntity(PRODUCT).size());
        }
    }

    @Nested
    @DisplayName("Assignment and task state")
    class Assignment {

        @Test
        void testAssignedTaskOnlyActionableByAssignee() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = engine.taskQueue().assign(openTask(run.getRunId()).getTaskId(), "dana");

            assertEquals("dana", task.getAssignee());
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertEquals(List.of(task), engine.taskQueue().findActionable(STEWARD));
            assertTrue(engine.taskQueue().findActionable(OTHER_STEWARD).isEmpty());
            assertEquals(List.of(task), engine.taskQueue().findByAssignee("dana", null));

            assertThrows(ForbiddenException.class,
                    () -> engine.resolveTask(task.getTaskId(), OTHER_STEWARD, Outcome.APPROVE, null));

            WorkflowRun done = engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null);
            assertEquals(RunStatus.COMPLETED, done.getStatus());
        }

        @Test
        void testResolvedTaskCannotBeResolvedAgain() throws Exception {
            WorkflowRun run = engine.start("two-step", ASSET, IMPORTER);
            Task legal = openTask(run.getRunId());
            engine.resolveTask(legal.getTaskId(), COMPLIANCE, Outcome.APPROVE, "licence checked");

            AlreadyResolvedException e = assertThrows(AlreadyResolvedException.class,
                    () -> engine.resolveTask(legal.getTaskId(), COMPLIANCE, Outcome.APPROVE, null));

            assertEquals(TaskStatus.RESOLVED, e.getCurrentState());
            assertThrows(AlreadyResolvedException.class,
                    () -> engine.taskQueue().assign(legal.getTaskId(), "cleo"));
            assertEquals("marketing", engine.getRun(run.getRunId()).getCurrentStageId());
        }

        @Test
        void testRequestChangesReturnsToReentrantStage() throws Exception {
            WorkflowRun run = engine.start("two-step", ASSET, IMPORTER);
            engine.resolveTask(openTask(run.getRunId()).getTaskId(), COMPLIANCE, Outcome.APPROVE, null);

            run = engine.resolveTask(openTask(run.getRunId()).getTaskId(), MARKETER,
                    Outcome.REQUEST_CHANGES, "crop is off-brand");

            assertEquals("legal", run.getCurrentStageId());
            assertEquals(RoleCatalog.COMPLIANCE_OFFICER, openTask(run.getRunId()).getAssignedRole());
            assertEquals(3, engine.taskQueue().findByRun(run.getRunId()).size());
        }
    }

    @Nested
    @DisplayName("Cancellation and expiry")
    class Cancellation {

        @Test
        void testCancelExpiresOpenTask() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());

            WorkflowRun cancelled = engine.cancel(run.getRunId(), ADMIN, "supplier withdrew product");

            assertEquals(RunStatus.CANCELLED, cancelled.getStatus());
            assertEquals("supplier withdrew product", cancelled.getCancellationReason());
            assertEquals("review", cancelled.getCurrentStageId());

            Task expired = engine.taskQueue().get(task.getTaskId());
            assertEquals(TaskStatus.EXPIRED, expired.getStatus());
            assertEquals("run cancelled: supplier withdrew product", expired.getExpiryReason());

            List<AuditEntry> entries = audit(run.getRunId());
            assertEquals(3, entries.size());
            AuditEntry last = entries.get(2);
            assertEquals(AuditAction.RUN_CANCELLED, last.getAction());
            assertEquals(ADMIN, last.getActor());
            assertEquals(3, last.getSequence());

            assertEquals(0, locks.size());
            assertThrows(AlreadyTerminalException.class, () -> engine.cancel(run.getRunId(), ADMIN, "again"));
            assertThrows(AlreadyTerminalException.class,
                    () -> engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null));
        }

        @Test
        void testExpireTaskCancelsRun() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());

            Task expired = engine.taskQueue().expire(task.getTaskId(), ADMIN, "no response in 5 days");

            assertEquals(TaskStatus.EXPIRED, expired.getStatus());
            assertEquals(ADMIN, expired.getResolvedBy());
            WorkflowRun after = engine.getRun(run.getRunId());
            assertEquals(RunStatus.CANCELLED, after.getStatus());
            assertEquals("task expired: no response in 5 days", after.getCancellationReason());
        }

        @Test
        void testExpireRequiresAdminOrTaskRole() throws Exception {
            WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
            Task task = openTask(run.getRunId());

            assertThrows(ForbiddenException.class,
                    () -> engine.expireTask(task.getTaskId(), MARKETER, "not mine"));
            assertTrue(engine.getRun(run.getRunId()).isActive());

            Task expired = engine.expireTask(task.getTaskId(), STEWARD, "stale import");
            assertEquals(TaskStatus.EXPIRED, expired.getStatus());
        }
    }

    @Nested
    @DisplayName("Unknown references")
    class UnknownReferences {

        @Test
        void testUnknownDefinition() {
            NotFoundException e = assertThrows(NotFoundException.class,
                    () -> engine.start("missing", PRODUCT, IMPORTER));
            assertEquals("WorkflowDefinition", e.getResourceType());
            assertTrue(engine.activeRuns().isEmpty());
        }

        @Test
        void testUnknownEntity() {
            NotFoundException e = assertThrows(NotFoundException.class,
                    () -> engine.start("import-review", EntityReference.product("ghost"), IMPORTER));
            assertEquals("Entity", e.getResourceType());
        }

        @Test
        void testUnknownTaskAndRun() {
            assertThrows(NotFoundException.class,
                    () -> engine.resolveTask("no-such-task", STEWARD, Outcome.APPROVE, null));
            assertThrows(NotFoundException.class, () -> engine.expireTask("no-such-task", ADMIN, "x"));
            assertThrows(NotFoundException.class, () -> engine.cancel("no-such-run", ADMIN, "x"));
            assertThrows(NotFoundException.class, () -> engine.getRun("no-such-run"));
        }
    }

    @Test
    void testAutomaticOnlyDefinitionCompletesAtStart() throws Exception {
        WorkflowRun run = engine.start("auto-publish", PRODUCT, IMPORTER);

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals("done", run.getCurrentStageId());
        assertTrue(engine.taskQueue().findByRun(run.getRunId()).isEmpty());
        assertEquals(3, audit(run.getRunId()).size());
        assertEquals(0, locks.size());
    }

    @Test
    void testListenerReceivesEventsInOrder() throws Exception {
        WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
        engine.resolveTask(openTask(run.getRunId()).getTaskId(), STEWARD, Outcome.APPROVE, null);

        ArgumentCaptor<TransitionEvent> events = ArgumentCaptor.forClass(TransitionEvent.class);
        verify(listener, times(4)).onTransition(events.capture());

        List<TransitionEvent> captured = events.getAllValues();
        assertEquals(TransitionEvent.Type.STAGE_ENTERED, captured.get(0).getType());
        assertEquals("validate", captured.get(0).getToStageId());
        assertEquals("review", captured.get(1).getToStageId());
        assertEquals("publish", captured.get(2).getToStageId());
        assertEquals(Outcome.APPROVE, captured.get(2).getOutcome());
        assertEquals(TransitionEvent.Type.RUN_COMPLETED, captured.get(3).getType());
        assertEquals(PRODUCT, captured.get(3).getTarget());
    }

    @Test
    void testListenerFailureDoesNotUndoTransition() throws Exception {
        doThrow(new IllegalStateException("mail server down")).when(listener).onTransition(any());

        WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);

        assertEquals(run, engine.getRun(run.getRunId()));
        assertTrue(engine.taskQueue().findOpenTask(run.getRunId()).isPresent());
        verify(listener, times(2)).onTransition(any());
    }

    @Test
    void testStorageFailureLeavesStateUnchanged() throws Exception {
        WorkflowRun run = engine.start("import-review", PRODUCT, IMPORTER);
        Task task = openTask(run.getRunId());
        clearInvocations(listener);
        doThrow(new StorageUnavailableException("audit volume full")).when(auditLog).append(anyList());

        assertThrows(StorageUnavailableException.class,
                () -> engine.resolveTask(task.getTaskId(), STEWARD, Outcome.APPROVE, null));

        assertEquals(run, engine.getRun(run.getRunId()));
        assertEquals(task, engine.taskQueue().get(task.getTaskId()));
        assertEquals(1, engine.taskQueue().findByRun(run.getRunId()).size());
        assertEquals(2, audit(run.getRunId()).size());
        verifyNoInteractions(listener);
        assertFalse(locks.isLocked(run.getRunId()));
    }

    @Test
    void testStorageFailureOnStartLeavesNoRun() throws Exception {
        doThrow(new StorageUnavailableException("audit volume full")).when(auditLog).append(anyList());

        assertThrows(StorageUnavailableException.class, () -> engine.start("import-review", PRODUCT, IMPORTER));

        assertTrue(engine.activeRuns().isEmpty());
        assertTrue(engine.taskQueue().findByStatus(null).isEmpty());
        assertEquals(0, locks.size());
    }
}
