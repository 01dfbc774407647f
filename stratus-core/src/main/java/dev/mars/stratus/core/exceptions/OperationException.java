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

package dev.mars.stratus.core.exceptions;

import dev.mars.stratus.core.ErrorCode;

/**
 * Exception thrown when an infrastructure operation fails.
 * The error code is whatever the operation backend reported, which may be one of
 * the well-known {@link ErrorCode} values or a backend-specific string.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class OperationException extends StratusException {

    private final String operation;

    public OperationException(String operation, String errorCode, String message) {
        super(ErrorKind.EXECUTION, errorCode, message);
        this.operation = operation;
    }

    public OperationException(String operation, String errorCode, String message, Throwable cause) {
        super(ErrorKind.EXECUTION, errorCode, message, cause);
        this.operation = operation;
    }

    public OperationException(String operation, ErrorCode errorCode, String message) {
        this(operation, errorCode.code(), message);
    }

    public static OperationException unsupported(String operation) {
        return new OperationException(operation, ErrorCode.UNSUPPORTED_OPERATION,
                ErrorCode.UNSUPPORTED_OPERATION.formatMessage(operation));
    }

    public String getOperation() {
        return operation;
    }
}
