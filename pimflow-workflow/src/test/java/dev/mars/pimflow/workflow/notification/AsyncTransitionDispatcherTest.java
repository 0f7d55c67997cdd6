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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for AsyncTransitionDispatcher.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
class AsyncTransitionDispatcherTest {

    @Test
    void testDeliversOffCallerThread() throws Exception {
        CountDownLatch delivered = new CountDownLatch(1);
        List<String> threads = new CopyOnWriteArrayList<>();
        TransitionListener delegate = event -> {
            threads.add(Thread.currentThread().getName());
            delivered.countDown();
        };

        try (AsyncTransitionDispatcher dispatcher = new AsyncTransitionDispatcher(delegate, 1)) {
            dispatcher.onTransition(CompositeTransitionListenerTest.event(TransitionEvent.Type.STAGE_ENTERED));
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        }

        assertEquals(1, threads.size());
        assertTrue(threads.get(0).startsWith("pimflow-notify-"));
        assertNotEquals(Thread.currentThread().getName(), threads.get(0));
    }

    @Test
    void testSlowListenerDoesNotBlockCaller() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(3);
        TransitionListener slow = event -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        };

        try (AsyncTransitionDispatcher dispatcher = new AsyncTransitionDispatcher(slow, 1)) {
            long startNanos = System.nanoTime();
            for (int i = 0; i < 3; i++) {
                dispatcher.onTransition(CompositeTransitionListenerTest.event(TransitionEvent.Type.STAGE_ENTERED));
            }
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos) < 1000);

            release.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void testDelegateFailureIsContained() throws Exception {
        TransitionListener failing = mock(TransitionListener.class);
        doThrow(new IllegalStateException("smtp down")).when(failing).onTransition(any());

        AsyncTransitionDispatcher dispatcher = new AsyncTransitionDispatcher(failing, 2);
        dispatcher.onTransition(CompositeTransitionListenerTest.event(TransitionEvent.Type.RUN_COMPLETED));
        dispatcher.onTransition(CompositeTransitionListenerTest.event(TransitionEvent.Type.RUN_COMPLETED));
        dispatcher.close();

        verify(failing, times(2)).onTransition(any());
    }

    @Test
    void testEventsAfterCloseAreDropped() {
        TransitionListener delegate = mock(TransitionListener.class);
        AsyncTransitionDispatcher dispatcher = new AsyncTransitionDispatcher(delegate, 1);
        dispatcher.close();

        assertDoesNotThrow(() ->
                dispatcher.onTransition(CompositeTransitionListenerTest.event(TransitionEvent.Type.STAGE_ENTERED)));
        verifyNoInteractions(delegate);
    }
}
