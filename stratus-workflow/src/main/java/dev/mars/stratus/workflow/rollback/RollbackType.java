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
 * What a rollback step does, which decides how the rollback manager runs it.
 */
public enum RollbackType {
    STATE_RESTORE("state-restore"),
    RESOURCE_DESTROY("resource-destroy"),
    CONFIGURATION_REVERT("configuration-revert"),
    CLEANUP("cleanup"),
    VALIDATION("validation"),
    CUSTOM("custom");

    private final String value;

    RollbackType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Steps that run after the main rollback plan.
     */
    public boolean isPostPlan() {
        return this == CLEANUP || this == VALIDATION;
    }

    public static Optional<RollbackType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values()).filter(type -> type.value.equals(normalized)).findFirst();
    }
}
