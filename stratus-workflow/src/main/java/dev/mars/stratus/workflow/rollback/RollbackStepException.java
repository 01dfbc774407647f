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

package dev.mars.stratus.workflow.rollback;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;

/**
 * A compensating step that failed. Collected into the rollback result rather than
 * thrown out of the rollback manager.
 */
public class RollbackStepException extends StratusException {

    private final String stepName;

    public RollbackStepException(String stepName, String message, Throwable cause) {
        super(ErrorCode.ROLLBACK_STEP_FAILED, ErrorCode.ROLLBACK_STEP_FAILED.formatMessage(stepName, message), cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
