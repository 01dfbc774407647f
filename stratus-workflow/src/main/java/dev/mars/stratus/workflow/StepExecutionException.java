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

import dev.mars.stratus.core.exceptions.ErrorKind;
import dev.mars.stratus.core.exceptions.StratusException;

/**
 * Wraps a failure raised while running a step that did not come from the
 * operation backend itself (timeouts, cancellation, unexpected runtime errors).
 * Never escapes the engine; it is always routed through error recovery.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class StepExecutionException extends StratusException {

    private final String stepName;

    public StepExecutionException(String stepName, String errorCode, String message) {
        super(ErrorKind.EXECUTION, errorCode, message);
        this.stepName = stepName;
    }

    public StepExecutionException(String stepName, String errorCode, String message, Throwable cause) {
        super(ErrorKind.EXECUTION, errorCode, message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
