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

import java.util.Objects;

/**
 * Base exception class for all Stratus-related exceptions.
 * Every instance carries an {@link ErrorKind} and a string error code so callers
 * can classify failures without parsing messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class StratusException extends Exception {

    private final ErrorKind kind;
    private final String errorCode;

    public StratusException(ErrorKind kind, String errorCode, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.errorCode = errorCode;
    }

    public StratusException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.errorCode = errorCode;
    }

    public StratusException(ErrorCode errorCode, String message) {
        this(errorCode.kind(), errorCode.code(), message);
    }

    public StratusException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode.kind(), errorCode.code(), message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the error code, or {@code null} when the failure carried none.
     */
    public String getErrorCode() {
        return errorCode;
    }

    public boolean hasErrorCode(ErrorCode code) {
        return code != null && code.code().equals(errorCode);
    }
}
