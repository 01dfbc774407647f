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

import dev.mars.stratus.core.exceptions.OperationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contract for the external infrastructure-as-code tool the workflow engine drives.
 *
 * <p>Implementations are opaque to the engine. The only part of a failure the
 * engine inspects is its error code, which drives recovery classification.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface OperationBackend {

    OperationResult deploy(Map<String, Object> options) throws OperationException;

    OperationResult destroy(Map<String, Object> options) throws OperationException;

    OperationResult plan(Map<String, Object> options) throws OperationException;

    OperationResult synth(Map<String, Object> options) throws OperationException;

    OperationResult diff(Map<String, Object> options) throws OperationException;

    /**
     * Dispatches a workflow step command to the matching operation.
     * Step arguments are passed through under the {@code args} option key.
     *
     * @param command the step command
     * @param args positional step arguments
     * @param options step options
     * @return the operation result
     * @throws OperationException if the operation fails or the command is not supported
     */
    default OperationResult execute(String command, List<String> args, Map<String, Object> options)
            throws OperationException {
        OperationType type = OperationType.fromCommand(command)
                .orElseThrow(() -> OperationException.unsupported(command));

        Map<String, Object> merged = new HashMap<>(options != null ? options : Map.of());
        if (args != null && !args.isEmpty()) {
            merged.put("args", List.copyOf(args));
        }

        return switch (type) {
            case DEPLOY -> deploy(merged);
            case DESTROY -> destroy(merged);
            case PLAN -> plan(merged);
            case SYNTH -> synth(merged);
            case DIFF -> diff(merged);
        };
    }
}
