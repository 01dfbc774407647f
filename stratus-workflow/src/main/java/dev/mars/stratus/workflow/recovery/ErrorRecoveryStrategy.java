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

package dev.mars.stratus.workflow.recovery;

import java.util.List;
import java.util.Objects;

/**
 * How to recover from a step failure. Closed set of variants; callers switch on
 * {@link #type()} and cast to the concrete record.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public sealed interface ErrorRecoveryStrategy {

    RecoveryType type();

    String reason();

    /**
     * Re-attempt the step, optionally after an injected delay.
     *
     * @param delayMs delay before the next attempt, 0 to use the step's backoff
     */
    record Retry(String reason, long delayMs) implements ErrorRecoveryStrategy {
        public Retry {
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs cannot be negative");
            }
        }

        @Override
        public RecoveryType type() {
            return RecoveryType.RETRY;
        }
    }

    /**
     * Record the step as skipped and carry on.
     */
    record Skip(String reason) implements ErrorRecoveryStrategy {
        @Override
        public RecoveryType type() {
            return RecoveryType.SKIP;
        }
    }

    /**
     * Stop the workflow and run the rollback plan.
     */
    record Rollback(String reason) implements ErrorRecoveryStrategy {
        @Override
        public RecoveryType type() {
            return RecoveryType.ROLLBACK;
        }
    }

    /**
     * Suspend the step until an operator decides.
     */
    record Manual(String reason, List<String> suggestedActions) implements ErrorRecoveryStrategy {
        public Manual {
            suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
        }

        @Override
        public RecoveryType type() {
            return RecoveryType.MANUAL;
        }
    }

    /**
     * Terminate the workflow immediately; no further steps run.
     */
    record Abort(String reason) implements ErrorRecoveryStrategy {
        @Override
        public RecoveryType type() {
            return RecoveryType.ABORT;
        }
    }

    static ErrorRecoveryStrategy retry(String reason) {
        return new Retry(reason, 0);
    }

    static ErrorRecoveryStrategy retry(String reason, long delayMs) {
        return new Retry(reason, delayMs);
    }

    static ErrorRecoveryStrategy skip(String reason) {
        return new Skip(reason);
    }

    static ErrorRecoveryStrategy rollback(String reason) {
        return new Rollback(reason);
    }

    static ErrorRecoveryStrategy manual(String reason, List<String> suggestedActions) {
        return new Manual(reason, suggestedActions);
    }

    static ErrorRecoveryStrategy abort(String reason) {
        return new Abort(Objects.requireNonNullElse(reason, "aborted"));
    }
}
