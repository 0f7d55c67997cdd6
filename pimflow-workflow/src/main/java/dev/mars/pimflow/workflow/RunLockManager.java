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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reentrant lock per workflow run. Operations on the same run are serialised,
 * operations on different runs proceed in parallel.
 * <p>
 * Usage:
 * <pre>
 * ReentrantLock lock = locks.lock(runId);
 * try {
 *     ...
 * } finally {
 *     locks.release(runId, lock, runStillActive);
 * }
 * </pre>
 * Entries exist only for active runs. Any call that ends with the run finished, or not
 * stored at all, forgets the entry on release, including calls rejected because the run
 * had already finished.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class RunLockManager {

    private static final Logger logger = LoggerFactory.getLogger(RunLockManager.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Acquires the run's lock, blocking until it is available.
     *
     * @return the held lock, to be released by the caller
     */
    public ReentrantLock lock(String runId) {
        Objects.requireNonNull(runId, "runId");
        ReentrantLock lock = locks.computeIfAbsent(runId, id -> new ReentrantLock());
        lock.lock();
        return lock;
    }

    /**
     * Releases a lock taken with {@link #lock(String)}, forgetting it first unless the run is
     * still active. Callers still queued on the forgotten lock observe the finished run once
     * they acquire it.
     */
    public void release(String runId, ReentrantLock lock, boolean runActive) {
        try {
            if (!runActive && locks.remove(runId, lock)) {
                logger.debug("Discarded lock for finished run {}", runId);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String runId) {
        ReentrantLock lock = locks.get(runId);
        return lock != null && lock.isLocked();
    }

    public int size() {
        return locks.size();
    }
}
