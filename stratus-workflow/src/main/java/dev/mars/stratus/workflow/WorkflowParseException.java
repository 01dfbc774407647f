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

package dev.mars.stratus.workflow;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;

import java.util.List;

/**
 * Exception thrown when a workflow document cannot be read, parsed or does not
 * match the workflow schema.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class WorkflowParseException extends StratusException {

    private final String fieldPath;
    private final List<String> issues;

    public WorkflowParseException(String message) {
        this(null, message, List.of(), null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, message, List.of(), cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(fieldPath, message, List.of(), null);
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        this(fieldPath, message, List.of(), cause);
    }

    public WorkflowParseException(String fieldPath, String message, List<String> issues, Throwable cause) {
        super(ErrorCode.WORKFLOW_PARSE_ERROR, ErrorCode.WORKFLOW_PARSE_ERROR.formatMessage(
                fieldPath != null ? fieldPath + ": " + message : message), cause);
        this.fieldPath = fieldPath;
        this.issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * Individual schema violations, empty for syntax and I/O errors.
     */
    public List<String> getIssues() {
        return issues;
    }
}
