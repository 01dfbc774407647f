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
 * Rollback step priority. Declared highest first, so {@link #ordinal()} sorts
 * critical steps to the front.
 */
public enum RollbackPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHigherThan(RollbackPriority other) {
        return ordinal() < other.ordinal();
    }

    public static Optional<RollbackPriority> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(p -> p.value().equalsIgnoreCase(value.trim())).findFirst();
    }
}
