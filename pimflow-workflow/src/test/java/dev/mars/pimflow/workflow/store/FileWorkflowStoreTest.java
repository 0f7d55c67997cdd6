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

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.EntityReference;
import dev.mars.pimflow.core.Outcome;
import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.entity.InMemoryEntityStore;
import dev.mars.pimflow.workflow.SimpleWorkflowEngine;
import dev.mars.pimflow.workflow.TestWorkflows;
import dev.mars.pimflow.workflow.audit.AuditEntry;
import dev.mars.pimflow.workflow.definition.InMemoryWorkflowDefinitionRegistry;
import dev.mars.pimflow.workflow.run.RunStatus;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;
import dev.mars.pimflow.workflow.task.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileWorkflowStore persistence across reopen.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
class FileWorkflowStoreTest {

    private static final EntityReference PRODUCT = EntityReference.product("sku-2002");

    @TempDir
    Path storeDir;

    private InMemoryWorkflowDefinitionRegistry registry;
    private InMemoryEntityStore entities;

    @BeforeEach
    void setUp() throws Exception {
        registry = new InMemoryWorkflowDefinitionRegistry(RoleCatalog.defaults());
        registry.register(TestWorkflows.importReview());
        entities = new InMemoryEntityStore();
        entities.put(PRODUCT, "Cordless drill");
    }

    private SimpleWorkflowEngine engine(FileWorkflowStore store) {
        return SimpleWorkflowEngine.builder()
                .registry(registry)
                .entityStore(entities)
                .store(store)
                .clock(TestWorkflows.clock())
                .build();
    }

    @Test
    void testStateSurvivesReopen() throws Exception {
        WorkflowRun run;
        Task task;
        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            SimpleWorkflowEngine engine = engine(store);
            run = engine.start("import-review", PRODUCT, Actor.of("ingest-bot", RoleCatalog.ADMIN));
            task = engine.taskQueue().assign(
                    engine.taskQueue().findOpenTask(run.getRunId()).orElseThrow().getTaskId(), "dana");
        }

        assertTrue(Files.exists(storeDir.resolve("runs").resolve(run.getRunId() + ".json")));
        assertTrue(Files.exists(storeDir.resolve("tasks").resolve(task.getTaskId() + ".json")));
        assertTrue(Files.exists(storeDir.resolve("audit.jsonl")));

        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            assertEquals(run, store.findRun(run.getRunId()).orElseThrow());
            assertEquals(task, store.findTask(task.getTaskId()).orElseThrow());
            assertEquals(2, store.auditLog().lastSequence(run.getRunId()));
            assertEquals(storeDir, store.getDirectory());

            SimpleWorkflowEngine engine = engine(store);
            WorkflowRun done = engine.resolveTask(task.getTaskId(), Actor.of("dana", RoleCatalog.DATA_STEWARD),
                    Outcome.APPROVE, "ship it");
            assertEquals(RunStatus.COMPLETED, done.getStatus());
        }

        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            WorkflowRun reloaded = store.findRun(run.getRunId()).orElseThrow();
            assertEquals(RunStatus.COMPLETED, reloaded.getStatus());
            assertEquals(3, reloaded.getHistory().size());
            assertEquals(Outcome.APPROVE, reloaded.getHistory().get(2).getOutcome());

            Task resolved = store.findTask(task.getTaskId()).orElseThrow();
            assertEquals(TaskStatus.RESOLVED, resolved.getStatus());
            assertEquals("ship it", resolved.getNote());

            List<AuditEntry> entries = new ArrayList<>();
            store.auditLog().query(run.getRunId()).forEach(entries::add);
            assertEquals(3, entries.size());
        }
    }

    @Test
    void testLeftoverTempFilesAreRemoved() throws Exception {
        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            engine(store).start("import-review", PRODUCT, Actor.of("ingest-bot", RoleCatalog.ADMIN));
        }
        Path leftover = storeDir.resolve("runs").resolve("half-written.json.tmp");
        Files.writeString(leftover, "{\"runId\":");

        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            assertEquals(1, store.findRuns(run -> true).size());
        }
        assertFalse(Files.exists(leftover));
    }

    @Test
    void testNoTempFilesAfterCommit() throws Exception {
        try (FileWorkflowStore store = new FileWorkflowStore(storeDir)) {
            engine(store).start("import-review", PRODUCT, Actor.of("ingest-bot", RoleCatalog.ADMIN));
        }

        try (Stream<Path> files = Files.walk(storeDir)) {
            assertTrue(files.noneMatch(path -> path.toString().endsWith(".tmp")));
        }
    }
}
