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

/**
 * Writes every transition to the {@code pimflow.transitions} logger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class LoggingTransitionListener implements TransitionListener {

    private static final Logger logger = LoggerFactory.getLogger("pimflow.transitions");

    @Override
    public void onTransition(TransitionEvent event) {
        switch (event.getType()) {
            case STAGE_ENTERED:
                logger.info("Run {} ({}) entered stage '{}' from '{}' by {}",
                        event.getRunId(), event.getTarget(), event.getToStageId(),
                        event.getFromStageId(), event.getActor());
                break;
            case RUN_COMPLETED:
                logger.info("Run {} ({}) completed at stage '{}'",
                        event.getRunId(), event.getTarget(), event.getToStageId());
                break;
            case RUN_CANCELLED:
                logger.info("Run {} ({}) cancelled at stage '{}' by {}",
                        event.getRunId(), event.getTarget(), event.getFromStageId(), event.getActor());
                break;
            default:
                logger.debug("Transition {}", event);
        }
    }
}
