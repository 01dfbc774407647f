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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * What caused a rollback.
 */
public enum RollbackTriggerType {
    STEP_FAILURE("step-failure"),
    TIMEOUT("timeout"),
    RESOURCE_ERROR("resource-error"),
    STATE_INCONSISTENCY("state-inconsistency"),
    MANUAL("manual");

    private final String value;

    RollbackTriggerType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<RollbackTriggerType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
    }
}
