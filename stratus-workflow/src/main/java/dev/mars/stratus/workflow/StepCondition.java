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

import java.util.Objects;

/**
 * Condition guarding a step. A step whose condition evaluates to false is skipped.
 *
 * @param type     the predicate type
 * @param value    the path, resource address, output name or expression
 * @param expected the expected value for {@link ConditionType#OUTPUT_EQUALS}, otherwise null
 */
public record StepCondition(ConditionType type, String value, String expected) {

    public StepCondition {
        Objects.requireNonNull(type, "Condition type cannot be null");
        Objects.requireNonNull(value, "Condition value cannot be null");
    }

    public static StepCondition fileExists(String path) {
        return new StepCondition(ConditionType.FILE_EXISTS, path, null);
    }

    public static StepCondition stateHasResource(String address) {
        return new StepCondition(ConditionType.STATE_HAS_RESOURCE, address, null);
    }

    public static StepCondition outputEquals(String output, String expected) {
        return new StepCondition(ConditionType.OUTPUT_EQUALS, output,
                Objects.requireNonNull(expected, "Expected value cannot be null"));
    }

    public static StepCondition custom(String expression) {
        return new StepCondition(ConditionType.CUSTOM, expression, null);
    }
}
