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
 * How and when compensating steps run.
 *
 * <ul>
 *   <li>{@code AUTOMATIC}: immediately on trigger</li>
 *   <li>{@code MANUAL}: only after operator confirmation</li>
 *   <li>{@code SELECTIVE}: only steps touching the failure's affected resources</li>
 *   <li>{@code PROGRESSIVE}: reverse completion order, re-reading state after each step</li>
 * </ul>
 */
public enum RollbackStrategyType {
    AUTOMATIC,
    MANUAL,
    SELECTIVE,
    PROGRESSIVE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RollbackStrategyType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.value().equalsIgnoreCase(value.trim())).findFirst();
    }
}
