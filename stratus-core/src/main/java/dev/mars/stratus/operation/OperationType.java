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

package dev.mars.stratus.operation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operations understood by an {@link OperationBackend}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum OperationType {

    DEPLOY("deploy", true),
    DESTROY("destroy", true),
    PLAN("plan", false),
    SYNTH("synth", false),
    DIFF("diff", false);

    private final String command;
    private final boolean mutating;

    OperationType(String command, boolean mutating) {
        this.command = command;
        this.mutating = mutating;
    }

    public String command() {
        return command;
    }

    /**
     * Returns true if the operation changes infrastructure.
     */
    public boolean isMutating() {
        return mutating;
    }

    /**
     * Maps a workflow step command onto an operation. {@code apply} is accepted as an
     * alias for {@link #DEPLOY}.
     *
     * @param command the command name, case-insensitive
     * @return the matching operation, or empty if the command is not a backend operation
     */
    public static Optional<OperationType> fromCommand(String command) {
        if (command == null) {
            return Optional.empty();
        }
        String normalized = command.trim().toLowerCase(Locale.ROOT);
        if ("apply".equals(normalized)) {
            return Optional.of(DEPLOY);
        }
        return Arrays.stream(values())
                .filter(type -> type.command.equals(normalized))
                .findFirst();
    }
}
