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

package dev.mars.pimflow.workflow.task;

import dev.mars.pimflow.core.Actor;
import dev.mars.pimflow.core.exceptions.PimflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Expires pending tasks that have waited longer than a configured timeout.
 * <p>
 * The engine has no timers of its own; expiry is driven from here, either by calling
 * {@link #sweep(Instant)} from an external scheduler or by {@link #start()}, which sweeps
 * periodically on a single daemon thread. A timeout of zero disables expiry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class OverdueTaskSweeper implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(OverdueTaskSweeper.class);

    private final TaskQueue taskQueue;
    private final Duration timeout;
    private final Duration interval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public OverdueTaskSweeper(TaskQueue taskQueue, Duration timeout, Duration interval, Clock clock) {
        this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Task timeout cannot be negative: " + timeout);
        }
    }

    public boolean isEnabled() {
        return !timeout.isZero();
    }

    /**
     * Expires every pending task created at or before {@code now - timeout}.
     *
     * @return the number of tasks expired by this sweep
     */
    public int sweep(Instant now) {
        if (!isEnabled()) {
            return 0;
        }

        List<Task> pending = taskQueue.findByStatus(TaskStatus.PENDING);
        int expired = 0;
        for (Task task : pending) {
            if (task.age(now).compareTo(timeout) < 0) {
                continue;
            }
            try {
                taskQueue.expire(task.getTaskId(), Actor.system(), "no resolution within " + timeout);
                expired++;
            } catch (PimflowException e) {
                // resolved or cancelled between the scan and the expiry
                logger.debug("Skipped expiring task {}: {}", task.getTaskId(), e.getMessage());
            }
        }
        if (expired > 0) {
            logger.info("Expired {} overdue tasks", expired);
        }
        return expired;
    }

    public synchronized void start() {
        if (!isEnabled()) {
            logger.info("Task timeout disabled, overdue task sweeper not started");
            return;
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "pimflow-task-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(1, interval.toMillis());
        sweepTask = scheduler.scheduleAtFixedRate(this::scheduledSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Overdue task sweeper started: timeout {}, interval {}", timeout, interval);
    }

    private void scheduledSweep() {
        try {
            sweep(clock.instant());
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            logger.error("Overdue task sweep failed", e);
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        logger.debug("Overdue task sweeper stopped");
    }
}
