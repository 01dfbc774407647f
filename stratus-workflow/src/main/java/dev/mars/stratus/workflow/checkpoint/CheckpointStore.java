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

import java.util.List;

/**
 * Persists, loads and lists workflow checkpoints.
 */
public interface CheckpointStore {

    /**
     * Writes a checkpoint.
     *
     * @return where the checkpoint was written
     * @throws CheckpointException if the checkpoint cannot be written
     */
    String save(WorkflowCheckpoint checkpoint) throws CheckpointException;

    /**
     * @throws CheckpointException coded {@code CHECKPOINT_NOT_FOUND} if no checkpoint has the id
     */
    WorkflowCheckpoint load(String id) throws CheckpointException;

    /**
     * Lists checkpoints newest first.
     *
     * @param workflowName only return checkpoints of this workflow, or null for all
     */
    List<WorkflowCheckpoint> list(String workflowName) throws CheckpointException;
}
