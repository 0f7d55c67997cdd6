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

package dev.mars.pimflow.core;

import java.util.Locale;

/**
 * The decision a human records when resolving a task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public enum Outcome {

    APPROVE("approve"),

    REJECT("reject"),

    REQUEST_CHANGES("request-changes");

    private final String key;

    Outcome(String key) {
        this.key = key;
    }

    /**
     * The lower-case key used in workflow definition files.
     */
    public String getKey() {
        return key;
    }

    /**
     * Parses a definition key or enum name, e.g. {@code request-changes},
     * {@code request_changes} or {@code REQUEST_CHANGES}.
     *
     * @throws IllegalArgumentException if the value names no outcome
     */
    public static Outcome fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Outcome outcome : values()) {
            if (outcome.key.equals(normalized)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown outcome: " + value);
    }
}
