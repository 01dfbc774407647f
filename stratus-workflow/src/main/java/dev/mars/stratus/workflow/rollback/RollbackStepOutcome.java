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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one rollback step, in the order the steps ran.
 *
 * @param name the rollback step name
 * @param success whether the step eventually succeeded
 * @param duration wall time across all attempts of the step
 * @param error last error message of a failed step, null on success
 */
public record RollbackStepOutcome(String name, boolean success, Duration duration, String error) {

    public RollbackStepOutcome {
        Objects.requireNonNull(name, "Step name cannot be null");
        Objects.requireNonNull(duration, "Duration cannot be null");
    }

    public static RollbackStepOutcome succeeded(String name, Duration duration) {
        return new RollbackStepOutcome(name, true, duration, null);
    }

    public static RollbackStepOutcome failed(String name, Duration duration, String error) {
        return new RollbackStepOutcome(name, false, duration, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
