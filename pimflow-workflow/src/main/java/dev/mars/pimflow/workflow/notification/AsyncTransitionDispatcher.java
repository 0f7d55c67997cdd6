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

package dev.mars.pimflow.workflow.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers transitions to a delegate on a background executor so that slow notification
 * channels never hold a run lock. Delivery is fire-and-forget.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class AsyncTransitionDispatcher implements TransitionListener, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(AsyncTransitionDispatcher.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final TransitionListener delegate;
    private final ExecutorService executor;

    public AsyncTransitionDispatcher(TransitionListener delegate, int threads) {
        this(delegate, Executors.newFixedThreadPool(Math.max(1, threads), new DispatcherThreadFactory()));
    }

    public AsyncTransitionDispatcher(TransitionListener delegate, ExecutorService executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void onTransition(TransitionEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            logger.warn("Dropping transition {}, dispatcher is shut down", event);
        }
    }

    private void deliver(TransitionEvent event) {
        try {
            delegate.onTransition(event);
        } catch (RuntimeException e) {
            logger.warn("Asynchronous delivery of {} failed", event, e);
        }
    }

    /**
     * Stops accepting events and waits briefly for queued deliveries.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Notification dispatcher did not drain within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class DispatcherThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pimflow-notify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
