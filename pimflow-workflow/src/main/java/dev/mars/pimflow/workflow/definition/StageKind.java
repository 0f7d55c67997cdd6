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

package dev.mars.pimflow.workflow.definition;

import java.util.Locale;

/**
 * How a stage is completed.
 */
public enum StageKind {

    /**
     * Blocks the run on a task until a qualifying human records an outcome.
     */
    HUMAN,

    /**
     * A systems-only step; the engine passes through it to its single {@code next} stage.
     */
    AUTOMATIC,

    /**
     * Entering this stage completes the run.
     */
    TERMINAL;

    public static StageKind fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage kind cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
