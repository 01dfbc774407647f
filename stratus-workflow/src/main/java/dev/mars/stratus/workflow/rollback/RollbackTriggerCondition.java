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

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Condition under which a rollback strategy fires.
 *
 * @param type         the trigger type that must match
 * @param stepName     only fire for this failed step, or null for any step
 * @param errorPattern regular expression searched in the error message, or null for any error
 */
public record RollbackTriggerCondition(RollbackTriggerType type, String stepName, String errorPattern) {

    public RollbackTriggerCondition {
        Objects.requireNonNull(type, "Trigger type cannot be null");
        if (errorPattern != null) {
            try {
                Pattern.compile(errorPattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid error pattern: " + errorPattern, e);
            }
        }
    }

    public static RollbackTriggerCondition on(RollbackTriggerType type) {
        return new RollbackTriggerCondition(type, null, null);
    }

    public Optional<String> getStepName() {
        return Optional.ofNullable(stepName);
    }

    public Optional<String> getErrorPattern() {
        return Optional.ofNullable(errorPattern);
    }

    /**
     * Whether this condition matches a rollback context.
     */
    public boolean matches(RollbackContext context) {
        if (type != context.getTrigger()) {
            return false;
        }
        if (stepName != null && !stepName.equals(context.getFailedStep())) {
            return false;
        }
        if (errorPattern != null) {
            String message = context.getErrorMessage().orElse("");
            return Pattern.compile(errorPattern).matcher(message).find();
        }
        return true;
    }
}
