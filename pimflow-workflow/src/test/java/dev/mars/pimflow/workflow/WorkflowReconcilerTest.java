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
import dev.mars.pimflow.entity.InMemoryEntityStore;
import dev.mars.pimflow.workflow.audit.AuditAction;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.definition.InMemoryWorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.run.RunStatus;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.store.FileWorkflowStore;
import dev.mars.pimflow.workflow.store.InMemoryWorkflowStore;
import dev.mars.pimflow.workflow.store.StoreTransaction;
import dev.mars.pimflow.workflow.store.WorkflowStore;
import dev.mars.pimflow.workflow.task.Task;
import dev.mars.pimflow.workflow.task.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowReconciler repairs of stored state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
class WorkflowReconcilerTest {

    private static final EntityReference PRODUCT = EntityReference.product("sku-3003");
    private static final Actor IMPORTER = Actor.of("ingest-bot", RoleCatalog.ADMIN);

    private InMemoryWorkflowDefinitionRegistry registry;
    private InMemoryEntityStore entities;
    private TestWorkflows.MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        registry = new InMemoryWorkflowDefinitionRegistry(RoleCatalog.defaults());
        registry.register(TestWorkflows.importReview());
        entities = new InMemoryEntityStore();
        entities.put(PRODUCT, "Garden hose");
        clock = TestWorkflows.clock();
    }

    private WorkflowReconciler reconciler(WorkflowStore store) {
        return new WorkflowReconciler(registry, store, new RunLockManager(), clock);
    }

    private static WorkflowRun activeRunAt(String runId, String definitionId, String stageId) {
        return WorkflowRun.builder()
                .runId(runId)
                .definitionId(definitionId)
                .target(PRODUCT)
                .initiator(IMPORTER)
                .currentStageId(stageId)
                .status(RunStatus.ACTIVE)
                .createdAt(TestWorkflows.EPOCH)
                .build();
    }

    private static Task pendingTask(String taskId, String runId, String stageId, Duration age) {
        return Task.builder()
                .taskId(taskId)
                .runId(runId)
                .stageId(stageId)
                .assignedRole(RoleCatalog.DATA_STEWARD)
                .createdAt(TestWorkflows.EPOCH.plus(age))
                .build();
    }

    private static AuditEntry entered(String runId, long sequence, String stageId) {
        return AuditEntry.builder()
                .entryId(runId + "-" + sequence)
                .runId(runId)
                .sequence(sequence)
                .action(AuditAction.STAGE_ENTERED)
                .stageId(stageId)
                .actor(Actor.system())
                .timestamp(TestWorkflows.EPOCH)
                .build();
    }

    private static List<AuditEntry> audit(WorkflowStore store, String runId) {
        List<AuditEntry> entries = new ArrayList<>();
        store.auditLog().query(runId).forEach(entries::add);
        return entries;
    }

    @Test
    void testCleanStoreNeedsNothing() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        SimpleWorkflowEngine engine = SimpleWorkflowEngine.builder()
                .registry(registry).entityStore(entities).store(store).clock(clock).build();
        engine.start("import-review", PRODUCT, IMPORTER);

        ReconciliationReport report = reconciler(store).reconcile();

        assertTrue(report.isClean(), report.toString());
        assertEquals(1, report.getRunsScanned());
    }

    @Test
    void testMissingTaskFileIsRecreated(@TempDir Path storeDir) throws Exception {
        WorkflowRun run;
        Task lost;
        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            SimpleWorkflowEngine engine = SimpleWorkflowEngine.builder()
                    .registry(registry).entityStore(entities).store(store).clock(clock).build();
            run = engine.start("import-review", PRODUCT, IMPORTER);
            lost = engine.taskQueue().findOpenTask(run.getRunId()).orElseThrow();
        }
        Files.delete(storeDir.resolve("tasks").resolve(lost.getTaskId() + ".json"));

        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            assertTrue(store.findTasks(task -> true).isEmpty());

            ReconciliationReport report = reconciler(store).reconcile();

            assertEquals(1, report.getRecreatedTasks().size());
            Task recreated = store.findTask(report.getRecreatedTasks().get(0)).orElseThrow();
            assertEquals("review", recreated.getStageId());
            assertEquals(RoleCatalog.DATA_STEWARD, recreated.getAssignedRole());
            assertTrue(recreated.isPending());
            assertTrue(report.getRecoveredAuditRuns().isEmpty(), "audit already ends at review");
            assertEquals(run, store.findRun(run.getRunId()).orElseThrow(), "run is never moved");
        }
    }

    @Test
    void testMissingAuditEntryIsRecovered() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        store.commit(StoreTransaction.forRun(activeRunAt("r1", "import-review", "review"))
                .task(pendingTask("t1", "r1", "review", Duration.ZERO))
                .audit(entered("r1", 1, "validate"))
                .build());

        ReconciliationReport report = reconciler(store).reconcile();

        assertEquals(List.of("r1"), report.getRecoveredAuditRuns());
        List<AuditEntry> entries = audit(store, "r1");
        assertEquals(2, entries.size());
        AuditEntry recovered = entries.get(1);
        assertEquals(2, recovered.getSequence());
        assertEquals("review", recovered.getStageId());
        assertEquals(WorkflowReconciler.RECOVERED_NOTE, recovered.getNote());
        assertEquals(Actor.system(), recovered.getActor());

        assertTrue(reconciler(store).reconcile().isClean(), "a second pass finds nothing");
    }

    @Test
    void testLostEntriesOfReenteredStagesAreRecovered(@TempDir Path storeDir) throws Exception {
        Actor steward = Actor.of("dana", RoleCatalog.DATA_STEWARD);
        WorkflowRun run;
        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            SimpleWorkflowEngine engine = SimpleWorkflowEngine.builder()
                    .registry(registry).entityStore(entities).store(store).clock(clock).build();
            run = engine.start("import-review", PRODUCT, IMPORTER);
            Task review = engine.taskQueue().findOpenTask(run.getRunId()).orElseThrow();
            clock.advance(Duration.ofMinutes(3));
            run = engine.resolveTask(review.getTaskId(), steward, Outcome.REJECT, "blurry");
        }
        assertEquals(4, run.getHistory().size());

        // the two entries of the rejection never reached the disk
        Path auditFile = storeDir.resolve("audit.jsonl");
        List<String> lines = Files.readAllLines(auditFile);
        assertEquals(4, lines.size());
        Files.writeString(auditFile, String.join("\n", lines.subList(0, 2)) + "\n");

        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            ReconciliationReport report = reconciler(store).reconcile();

            assertFalse(report.isClean());
            assertEquals(List.of(run.getRunId()), report.getRecoveredAuditRuns());
            List<AuditEntry> entries = audit(store, run.getRunId());
            assertEquals(List.of(1L, 2L, 3L, 4L),
                    entries.stream().map(AuditEntry::getSequence).collect(Collectors.toList()));
            assertEquals(List.of("validate", "review", "validate", "review"),
                    entries.stream().map(AuditEntry::getStageId).collect(Collectors.toList()));
            AuditEntry rejected = entries.get(2);
            assertEquals(steward, rejected.getActor());
            assertEquals(Outcome.REJECT, rejected.getOutcome());
            assertEquals(WorkflowReconciler.RECOVERED_NOTE, rejected.getNote());
            assertEquals(TestWorkflows.EPOCH.plus(Duration.ofMinutes(3)), rejected.getTimestamp());

            assertTrue(reconciler(store).reconcile().isClean(), "a second pass finds nothing");
        }
    }

    @Test
    void testStaleAndDuplicateTasksAreExpired() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        store.commit(StoreTransaction.forRun(activeRunAt("r1", "import-review", "review"))
                .task(pendingTask("older", "r1", "review", Duration.ZERO))
                .task(pendingTask("newer", "r1", "review", Duration.ofMinutes(1)))
                .task(pendingTask("wrong-stage", "r1", "validate", Duration.ZERO))
                .audit(entered("r1", 1, "validate"))
                .audit(entered("r1", 2, "review"))
                .build());

        ReconciliationReport report = reconciler(store).reconcile();

        assertTrue(report.getExpiredTasks().containsAll(List.of("older", "wrong-stage")));
        assertEquals(2, report.getExpiredTasks().size());
        assertTrue(store.findTask("newer").orElseThrow().isPending());
        assertEquals(TaskStatus.EXPIRED, store.findTask("older").orElseThrow().getStatus());
        assertTrue(report.getRecreatedTasks().isEmpty());
    }

    @Test
    void testPendingTaskOfTerminalRunIsExpired() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        WorkflowRun cancelled = activeRunAt("r1", "import-review", "review").cancel("withdrawn", TestWorkflows.EPOCH);
        store.commit(StoreTransaction.forRun(cancelled)
                .task(pendingTask("t1", "r1", "review", Duration.ZERO))
                .build());

        ReconciliationReport report = reconciler(store).reconcile();

        assertEquals(List.of("t1"), report.getExpiredTasks());
        assertEquals(TaskStatus.EXPIRED, store.findTask("t1").orElseThrow().getStatus());
    }

    @Test
    void testOrphanTaskIsExpired() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        store.commit(StoreTransaction.withoutRun().task(pendingTask("orphan", "gone", "review", Duration.ZERO)).build());

        ReconciliationReport report = reconciler(store).reconcile();

        assertEquals(List.of("orphan"), report.getExpiredTasks());
        assertEquals(0, report.getRunsScanned());
    }

    @Test
    void testUnrepairableRunsAreReported() throws Exception {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        store.commit(StoreTransaction.forRun(activeRunAt("r1", "retired-workflow", "review")).build());
        store.commit(StoreTransaction.forRun(activeRunAt("r2", "import-review", "validate"))
                .audit(entered("r2", 1, "validate"))
                .build());

        ReconciliationReport report = reconciler(store).reconcile();

        assertFalse(report.isClean());
        assertTrue(report.getRunsNeedingAttention().get("r1").contains("retired-workflow"));
        assertTrue(report.getRunsNeedingAttention().get("r2").contains("automatic"));
        assertEquals(RunStatus.ACTIVE, store.findRun("r2").orElseThrow().getStatus());
    }
}
