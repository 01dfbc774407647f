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

package dev.mars.stratus.workflow.retry;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;

import java.util.List;
import java.util.Objects;

/**
 * Raised after a step's configured attempts are spent. Carries every attempt's
 * error message and the last failure, whose code drives recovery classification.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class RecoveryExhaustedException extends StratusException {

    private final String stepName;
    private final int attempts;
    private final List<String> errorMessages;
    private final StratusException lastError;

    public RecoveryExhaustedException(String stepName, int attempts, List<String> errorMessages,
                                      StratusException lastError) {
        super(ErrorCode.MAX_RETRIES_EXCEEDED, ErrorCode.MAX_RETRIES_EXCEEDED.formatMessage(stepName, attempts),
                lastError);
        this.stepName = stepName;
        this.attempts = attempts;
        this.errorMessages = List.copyOf(errorMessages);
        this.lastError = Objects.requireNonNull(lastError, "Last error cannot be null");
    }

    public String getStepName() {
        return stepName;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns one message per failed attempt, in attempt order.
     */
    public List<String> getErrorMessages() {
        return errorMessages;
    }

    public StratusException getLastError() {
        return lastError;
    }

    public String getLastErrorCode() {
        return lastError.getErrorCode();
    }
}
