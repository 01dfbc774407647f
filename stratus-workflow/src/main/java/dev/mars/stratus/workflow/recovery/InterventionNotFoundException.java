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

package dev.mars.stratus.workflow.recovery;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;

/**
 * Thrown when resolving a manual intervention id that is not pending.
 */
public class InterventionNotFoundException extends StratusException {

    private final String interventionId;

    public InterventionNotFoundException(String interventionId) {
        super(ErrorCode.INTERVENTION_NOT_FOUND, ErrorCode.INTERVENTION_NOT_FOUND.formatMessage(interventionId));
        this.interventionId = interventionId;
    }

    public String getInterventionId() {
        return interventionId;
    }
}
