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

package dev.mars.pimflow.core.exceptions;

import java.util.List;

/**
 * Thrown when a workflow definition is rejected at registration.
 * Carries every problem found, not only the first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class InvalidDefinitionException extends PimflowException {

    private final String definitionId;
    private final List<String> problems;

    public InvalidDefinitionException(String definitionId, List<String> problems) {
        super(formatMessage(definitionId, problems));
        this.definitionId = definitionId;
        this.problems = problems != null ? List.copyOf(problems) : List.of();
    }

    public InvalidDefinitionException(String definitionId, String problem) {
        this(definitionId, List.of(problem));
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String formatMessage(String definitionId, List<String> problems) {
        StringBuilder sb = new StringBuilder("Invalid workflow definition '")
                .append(definitionId).append("'");
        if (problems != null) {
            for (String problem : problems) {
                sb.append("\n  - ").append(problem);
            }
        }
        return sb.toString();
    }
}
