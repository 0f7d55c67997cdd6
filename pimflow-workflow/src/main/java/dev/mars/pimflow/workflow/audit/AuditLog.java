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

/**
 * Append-only record of every run transition.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public interface AuditLog {

    /**
     * Appends entries in order. Either all entries are appended or none are.
     *
     * @throws StorageUnavailableException if the log cannot be written; the caller decides whether to retry
     */
    void append(List<AuditEntry> entries) throws StorageUnavailableException;

    /**
     * Entries of one run in sequence order. The returned sequence is lazy and every call to
     * {@code iterator()} starts again from the first entry.
     */
    Iterable<AuditEntry> query(String runId);

    /**
     * Sequence number of the last entry appended for the run, or 0 if there is none.
     */
    long lastSequence(String runId);
}
