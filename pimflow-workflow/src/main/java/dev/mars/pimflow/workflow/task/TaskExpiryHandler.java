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

/**
 * Performs the expiry transition of a pending task. Implemented by the workflow engine,
 * which also cancels the task's run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
@FunctionalInterface
public interface TaskExpiryHandler {

    Task expireTask(String taskId, Actor actor, String reason) throws PimflowException;
}
