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

package dev.mars.flowrun.core.exceptions;

/**
 * Exception thrown when a workflow document cannot be parsed or lacks the structure
 * every workflow needs (a node list and a connection graph).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @version 1.0
 */
public class InvalidWorkflowFormatException extends FlowrunException {

    private final String source;
    private final String fieldPath;

    public InvalidWorkflowFormatException(String message) {
        this(null, null, message, null);
    }

    public InvalidWorkflowFormatException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public InvalidWorkflowFormatException(String source, String fieldPath, String message) {
        this(source, fieldPath, message, null);
    }

    public InvalidWorkflowFormatException(String source, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.fieldPath = fieldPath;
    }

    /**
     * Creates a copy of this exception attributed to the given source (file path or workflow id).
     */
    public InvalidWorkflowFormatException withSource(String source) {
        InvalidWorkflowFormatException copy =
                new InvalidWorkflowFormatException(source, fieldPath, super.getMessage(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getSource() {
        return source;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * Whether the document could not be decoded at all. A decoded document that lacks required
     * structure always carries a field path.
     */
    public boolean isMalformed() {
        return fieldPath == null;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (source != null) {
            sb.append("The file \"").append(source).append("\" does not contain valid workflow data: ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
