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

import java.util.Arrays;
import java.util.Optional;

/**
 * Predicate types a step condition can use.
 */
public enum ConditionType {

    /** A file exists, relative to the engine's working directory. */
    FILE_EXISTS("file-exists"),

    /** A resource address is present in the state backend. */
    STATE_HAS_RESOURCE("state-has-resource"),

    /** An output recorded by an earlier step, or in the state, equals a value. */
    OUTPUT_EQUALS("output-equals"),

    /** A Spring Expression Language expression. */
    CUSTOM("custom");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConditionType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
