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
 * Exception thrown when a workflow definition is malformed: missing fields,
 * unresolved dependency references or a dependency cycle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class WorkflowValidationException extends StratusException {

    private final List<String> issues;

    public WorkflowValidationException(String message) {
        this(ErrorCode.VALIDATION_ERROR, message);
    }

    public WorkflowValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.issues = List.of(message);
    }

    public WorkflowValidationException(String message, Throwable cause) {
        super(ErrorCode.WORKFLOW_PARSE_ERROR, message, cause);
        this.issues = List.of(message);
    }

    /**
     * Builds an exception from a failed validation, keeping the first error's code.
     */
    public WorkflowValidationException(String workflowName, ValidationResult result) {
        super(ErrorCode.fromCode(result.getErrors().isEmpty() ? null : result.getErrors().get(0).getCode())
                        .orElse(ErrorCode.VALIDATION_ERROR),
                "Workflow '" + workflowName + "' is invalid: " + String.join("; ", result.getIssues()));
        this.issues = result.getIssues();
    }

    public List<String> getIssues() {
        return issues;
    }
}
