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

/**
 * Thrown when a workflow document cannot be read or turned into a {@link WorkflowDefinition}.
 * Graph-level problems are not parse errors; they surface at registration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class WorkflowParseException extends Exception {

    private final String source;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(null, fieldPath, message, null);
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        this(null, fieldPath, message, cause);
    }

    public WorkflowParseException(String source, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.fieldPath = fieldPath;
    }

    /**
     * Returns a copy of this exception that names the file or resource it came from.
     */
    public WorkflowParseException withSource(String source) {
        return new WorkflowParseException(source, fieldPath, super.getMessage(), getCause());
    }

    public String getSource() {
        return source;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (source != null) {
            sb.append(source).append(": ");
        }
        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        sb.append(super.getMessage());
        return sb.toString();
    }
}
