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
 * Shape of the delay between retry attempts.
 */
public enum BackoffStrategy {
    FIXED("fixed"),
    LINEAR("linear"),
    EXPONENTIAL("exponential");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<BackoffStrategy> fromValue(String value) {
        return Arrays.stream(values())
                .filter(strategy -> strategy.value.equals(value))
                .findFirst();
    }
}
