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

package dev.mars.pimflow.workflow.audit;

import dev.mars.pimflow.core.exceptions.StorageUnavailableException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit log held in memory. Used for embedding and tests; entries are lost on restart.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class InMemoryAuditLog implements AuditLog {

    private final Map<String, CopyOnWriteArrayList<AuditEntry>> entriesByRun = new ConcurrentHashMap<>();

    @Override
    public synchronized void append(List<AuditEntry> entries) throws StorageUnavailableException {
        Objects.requireNonNull(entries, "entries");
        for (AuditEntry entry : entries) {
            entriesByRun.computeIfAbsent(entry.getRunId(), id -> new CopyOnWriteArrayList<>()).add(entry);
        }
    }

    @Override
    public Iterable<AuditEntry> query(String runId) {
        // CopyOnWriteArrayList iterators are snapshots, so each iteration sees a consistent prefix
        return () -> entriesByRun.getOrDefault(runId, new CopyOnWriteArrayList<>()).iterator();
    }

    @Override
    public long lastSequence(String runId) {
        List<AuditEntry> entries = entriesByRun.get(runId);
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        return entries.get(entries.size() - 1).getSequence();
    }

    public int size() {
        return entriesByRun.values().stream().mapToInt(List::size).sum();
    }
}
