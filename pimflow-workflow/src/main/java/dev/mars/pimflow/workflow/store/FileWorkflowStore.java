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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import dev.mars.pimflow.workflow.audit.AuditLog;
import dev.mars.pimflow.workflow.audit.JsonLinesAuditLog;
import dev.mars.pimflow.workflow.run.WorkflowRun;
import dev.mars.pimflow.workflow.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed workflow store.
 * <p>
 * Layout under the store directory:
 * <pre>
 * runs/&lt;runId&gt;.json    one document per run
 * tasks/&lt;taskId&gt;.json  one document per task
 * audit.jsonl          append-only audit log
 * </pre>
 * Each document is written to a temporary file, forced to disk and atomically renamed over
 * the previous version. A commit writes the run, then its tasks, then the audit entries.
 * A crash part way through leaves state that {@code WorkflowReconciler} repairs on the next open.
 * An audit failure reported while the process is alive rolls the document writes back.
 * <p>
 * Commits are serialised by a commit lock while the files are written. The in-memory view is
 * then updated under the write half of a read-write lock that every query reads under.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class FileWorkflowStore implements WorkflowStore, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(FileWorkflowStore.class);

    private static final String RUNS_DIR = "runs";
    private static final String TASKS_DIR = "tasks";
    private static final String AUDIT_FILE = "audit.jsonl";
    private static final String JSON_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Path runsDirectory;
    private final Path tasksDirectory;
    private final ObjectMapper objectMapper;
    private final JsonLinesAuditLog auditLog;
    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final ReentrantLock commitLock = new ReentrantLock();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public FileWorkflowStore(Path directory) throws StorageUnavailableException {
        this(directory, WorkflowJson.createObjectMapper());
    }

    public FileWorkflowStore(Path directory, ObjectMapper objectMapper) throws StorageUnavailableException {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.runsDirectory = directory.resolve(RUNS_DIR);
        this.tasksDirectory = directory.resolve(TASKS_DIR);
        try {
            Files.createDirectories(runsDirectory);
            Files.createDirectories(tasksDirectory);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create store directory " + directory, e);
        }

        loadDocuments(runsDirectory, WorkflowRun.class, runs, WorkflowRun::getRunId);
        loadDocuments(tasksDirectory, Task.class, tasks, Task::getTaskId);
        this.auditLog = new JsonLinesAuditLog(directory.resolve(AUDIT_FILE), objectMapper);

        logger.info("Opened file workflow store at {} with {} runs and {} tasks", directory, runs.size(), tasks.size());
    }

    private <T> void loadDocuments(Path dir, Class<T> type, Map<String, T> target,
                                   Function<T, String> idOf) throws StorageUnavailableException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list " + dir, e);
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            if (name.endsWith(TEMP_SUFFIX)) {
                // leftover from a write that never reached its rename
                logger.warn("Removing incomplete document {}", file);
                deleteQuietly(file);
                continue;
            }
            if (!name.endsWith(JSON_SUFFIX)) {
                continue;
            }
            try {
                T value = objectMapper.readValue(file.toFile(), type);
                target.put(idOf.apply(value), value);
            } catch (IOException e) {
                throw new StorageUnavailableException("Cannot read " + file, e);
            }
        }
    }

    @Override
    public void commit(StoreTransaction transaction) throws StorageUnavailableException {
        Objects.requireNonNull(transaction, "transaction");
        if (transaction.isEmpty()) {
            return;
        }

        commitLock.lock();
        try {
            WorkflowRun run = transaction.getRun();
            WorkflowRun previousRun = run != null ? runs.get(run.getRunId()) : null;
            Map<String, Task> previousTasks = new HashMap<>();
            for (Task task : transaction.getTasks()) {
                previousTasks.put(task.getTaskId(), tasks.get(task.getTaskId()));
            }

            List<Runnable> undo = new ArrayList<>();
            try {
                if (run != null) {
                    writeDocument(runFile(run.getRunId()), run);
                    undo.add(() -> restoreDocument(runFile(run.getRunId()), previousRun));
                }
                for (Task task : transaction.getTasks()) {
                    writeDocument(taskFile(task.getTaskId()), task);
                    Task previous = previousTasks.get(task.getTaskId());
                    undo.add(() -> restoreDocument(taskFile(task.getTaskId()), previous));
                }
                auditLog.append(transaction.getAuditEntries());
            } catch (StorageUnavailableException e) {
                logger.warn("Commit failed, rolling back {}: {}", transaction, e.getMessage());
                for (int i = undo.size() - 1; i >= 0; i--) {
                    undo.get(i).run();
                }
                throw e;
            }

            // publish run and tasks together so that queries never see half a transition
            lock.writeLock().lock();
            try {
                if (run != null) {
                    runs.put(run.getRunId(), run);
                }
                for (Task task : transaction.getTasks()) {
                    tasks.put(task.getTaskId(), task);
                }
            } finally {
                lock.writeLock().unlock();
            }
            logger.debug("Committed {}", transaction);
        } finally {
            commitLock.unlock();
        }
    }

    private Path runFile(String runId) {
        return runsDirectory.resolve(runId + JSON_SUFFIX);
    }

    private Path taskFile(String taskId) {
        return tasksDirectory.resolve(taskId + JSON_SUFFIX);
    }

    private void writeDocument(Path target, Object value) throws StorageUnavailableException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(value);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageUnavailableException("Cannot write " + target, e);
        }
    }

    private void restoreDocument(Path target, Object previous) {
        try {
            if (previous != null) {
                writeDocument(target, previous);
            } else {
                Files.deleteIfExists(target);
            }
        } catch (StorageUnavailableException | IOException e) {
            logger.error("Failed to roll back {}, reconciliation will repair it", target, e);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Cannot delete {}: {}", file, e.getMessage());
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

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void close() throws IOException {
        auditLog.close();
        logger.debug("Closed file workflow store at {}", directory);
    }
}
