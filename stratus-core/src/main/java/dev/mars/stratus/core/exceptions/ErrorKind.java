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

package dev.mars.stratus.core.exceptions;

/**
 * Closed classification of every failure the engine can raise.
 *
 * <p>Recovery decisions pattern-match on the kind together with the error code
 * rather than inspecting message text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ErrorKind {

    /** Malformed workflow definition, detected before execution starts. */
    VALIDATION,

    /** Failure reported by an operation backend or raised while running a step. */
    EXECUTION,

    /** All configured attempts of a step have been spent. */
    RECOVERY_EXHAUSTED,

    /** A step is suspended waiting for an operator decision. */
    INTERVENTION_REQUIRED,

    /** A compensating step failed during rollback. */
    ROLLBACK_STEP,

    /** A checkpoint could not be written or read. */
    CHECKPOINT_IO
}
