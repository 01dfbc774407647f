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

package dev.mars.stratus.workflow.checkpoint;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;

/**
 * Exception thrown when a checkpoint cannot be written, read or found.
 * Always fatal for the operation that depended on it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class CheckpointException extends StratusException {

    private final String checkpointId;

    public CheckpointException(ErrorCode errorCode, String checkpointId, String message) {
        super(errorCode, message);
        this.checkpointId = checkpointId;
    }

    public CheckpointException(ErrorCode errorCode, String checkpointId, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
