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

package dev.mars.stratus.core;

import dev.mars.stratus.core.exceptions.ErrorKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * Well-known error codes raised by Stratus and by operation backends.
 *
 * <p>Each error code includes:</p>
 * <ul>
 *   <li>A unique string code (e.g., "NETWORK_ERROR")</li>
 *   <li>The {@link ErrorKind} it belongs to</li>
 *   <li>A message template for consistent error messages</li>
 * </ul>
 *
 * <p>Backends may report codes that are not listed here; the engine carries those
 * through as plain strings and classifies them as unknown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorCode {

    // ==================== Validation ====================

    /** Workflow definition failed validation */
    VALIDATION_ERROR("VALIDATION_ERROR", ErrorKind.VALIDATION, "Validation failed: %s"),

    /** Dependency graph contains a cycle */
    CYCLIC_DEPENDENCY("CYCLIC_DEPENDENCY", ErrorKind.VALIDATION, "Cyclic dependency detected: %s"),

    /** A dependsOn entry names a step that does not exist */
    MISSING_DEPENDENCY("MISSING_DEPENDENCY", ErrorKind.VALIDATION, "Step '%s' depends on unknown step '%s'"),

    /** Workflow document could not be parsed */
    WORKFLOW_PARSE_ERROR("WORKFLOW_PARSE_ERROR", ErrorKind.VALIDATION, "Failed to parse workflow definition: %s"),

    // ==================== Backend / Execution ====================

    /** Step or backend configuration is wrong */
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", ErrorKind.EXECUTION, "Configuration error: %s"),

    /** Transient network failure */
    NETWORK_ERROR("NETWORK_ERROR", ErrorKind.EXECUTION, "Network error: %s"),

    /** Operation did not finish in time */
    TIMEOUT_ERROR("TIMEOUT_ERROR", ErrorKind.EXECUTION, "Operation timed out: %s"),

    /** Backend reported a temporary condition */
    TEMPORARY_FAILURE("TEMPORARY_FAILURE", ErrorKind.EXECUTION, "Temporary failure: %s"),

    /** Caller lacks permission for the operation */
    PERMISSION_DENIED("PERMISSION_DENIED", ErrorKind.EXECUTION, "Permission denied: %s"),

    /** Credentials were rejected */
    AUTHENTICATION_FAILED("AUTHENTICATION_FAILED", ErrorKind.EXECUTION, "Authentication failed: %s"),

    /** Resource is being modified concurrently */
    RESOURCE_CONFLICT("RESOURCE_CONFLICT", ErrorKind.EXECUTION, "Resource conflict: %s"),

    /** Infrastructure state is locked by another process */
    STATE_LOCK_ERROR("STATE_LOCK_ERROR", ErrorKind.EXECUTION, "State is locked: %s"),

    /** Command is not known to the backend */
    UNSUPPORTED_OPERATION("UNSUPPORTED_OPERATION", ErrorKind.EXECUTION, "Unsupported operation '%s'"),

    /** Backend reported failure without a more specific code */
    OPERATION_FAILED("OPERATION_FAILED", ErrorKind.EXECUTION, "Operation failed: %s"),

    /** Step stopped because the workflow was cancelled or timed out */
    STEP_CANCELLED("STEP_CANCELLED", ErrorKind.EXECUTION, "Step '%s' was cancelled"),

    /** Workflow state machine rejected a transition */
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", ErrorKind.EXECUTION, "Invalid state transition: %s"),

    // ==================== Recovery ====================

    /** Retry attempts exhausted */
    MAX_RETRIES_EXCEEDED("MAX_RETRIES_EXCEEDED", ErrorKind.RECOVERY_EXHAUSTED, "Step '%s' failed after %d attempts"),

    /** Manual intervention id is unknown */
    INTERVENTION_NOT_FOUND("INTERVENTION_NOT_FOUND", ErrorKind.INTERVENTION_REQUIRED, "Manual intervention '%s' not found"),

    /** Run has used up its manual interventions */
    INTERVENTION_LIMIT_EXCEEDED("INTERVENTION_LIMIT_EXCEEDED", ErrorKind.INTERVENTION_REQUIRED,
            "Manual intervention limit of %d reached"),

    /** Intervention was not resolved in time */
    INTERVENTION_TIMEOUT("INTERVENTION_TIMEOUT", ErrorKind.INTERVENTION_REQUIRED,
            "Manual intervention for step '%s' was not resolved in time"),

    // ==================== Rollback ====================

    /** A rollback step failed */
    ROLLBACK_STEP_FAILED("ROLLBACK_STEP_FAILED", ErrorKind.ROLLBACK_STEP, "Rollback step '%s' failed: %s"),

    /** Manual rollback strategy was declined */
    ROLLBACK_NOT_CONFIRMED("ROLLBACK_NOT_CONFIRMED", ErrorKind.ROLLBACK_STEP, "Rollback of '%s' was not confirmed"),

    // ==================== Checkpoints ====================

    /** Checkpoint id is unknown */
    CHECKPOINT_NOT_FOUND("CHECKPOINT_NOT_FOUND", ErrorKind.CHECKPOINT_IO, "Checkpoint '%s' not found"),

    /** Checkpoint file could not be read or written */
    CHECKPOINT_IO_ERROR("CHECKPOINT_IO_ERROR", ErrorKind.CHECKPOINT_IO, "Checkpoint I/O failed: %s"),

    /** Checkpoint id or content is malformed */
    CHECKPOINT_INVALID("CHECKPOINT_INVALID", ErrorKind.CHECKPOINT_IO, "Invalid checkpoint: %s");

    private final String code;
    private final ErrorKind kind;
    private final String messageTemplate;

    ErrorCode(String code, ErrorKind kind, String messageTemplate) {
        this.code = code;
        this.kind = kind;
        this.messageTemplate = messageTemplate;
    }

    /**
     * Returns the string error code.
     */
    public String code() {
        return code;
    }

    /**
     * Returns the kind of failure this code belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the message template (may contain format placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    /**
     * Formats the message template with the provided arguments.
     */
    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }
}
