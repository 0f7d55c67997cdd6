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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans each event out to every registered listener in registration order.
 * A failing listener is logged and does not stop the others.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class CompositeTransitionListener implements TransitionListener {

    private static final Logger logger = LoggerFactory.getLogger(CompositeTransitionListener.class);

    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public CompositeTransitionListener(TransitionListener... listeners) {
        this.listeners.addAll(List.of(listeners));
    }

    public CompositeTransitionListener addListener(TransitionListener listener) {
        listeners.add(listener);
        return this;
    }

    public boolean removeListener(TransitionListener listener) {
        return listeners.remove(listener);
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onTransition(TransitionEvent event) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                logger.warn("Transition listener {} failed for {}", listener.getClass().getSimpleName(), event, e);
            }
        }
    }
}
