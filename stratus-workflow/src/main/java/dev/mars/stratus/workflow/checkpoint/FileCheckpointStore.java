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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.stratus.core.ErrorCode;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.logging.Logger;

/**
 * File-backed checkpoint store: one {@code <id>.json} file per checkpoint.
 *
 * <p>The directory is created on first write. Each file is written to a temporary
 * sibling and atomically moved into place, so a crash never leaves a partially
 * written checkpoint behind. Checkpoint ids become file names and are restricted
 * to {@code [A-Za-z0-9._-]}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(FileCheckpointStore.class.getName());
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Checkpoint directory cannot be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String save(WorkflowCheckpoint checkpoint) throws CheckpointException {
        Objects.requireNonNull(checkpoint, "Checkpoint cannot be null");
        Path target = resolve(checkpoint.getId());
        Path tmp = directory.resolve(checkpoint.getId() + EXTENSION + ".tmp");

        try {
            Files.createDirectories(directory);
            Files.write(tmp, objectMapper.writeValueAsBytes(checkpoint));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.severe("Failed to save checkpoint " + checkpoint.getId() + ": " + e.getMessage());
            throw new CheckpointException(ErrorCode.CHECKPOINT_IO_ERROR, checkpoint.getId(),
                    ErrorCode.CHECKPOINT_IO_ERROR.formatMessage("cannot write " + target + ": " + e.getMessage()), e);
        }

        logger.info("Saved checkpoint " + checkpoint.getId() + " for workflow " + checkpoint.getWorkflowName());
        return target.toString();
    }

    @Override
    public WorkflowCheckpoint load(String id) throws CheckpointException {
        Path file = resolve(id);
        try {
            return objectMapper.readValue(Files.readAllBytes(file), WorkflowCheckpoint.class);
        } catch (NoSuchFileException e) {
            throw new CheckpointException(ErrorCode.CHECKPOINT_NOT_FOUND, id,
                    ErrorCode.CHECKPOINT_NOT_FOUND.formatMessage(id), e);
        } catch (JsonProcessingException e) {
            throw new CheckpointException(ErrorCode.CHECKPOINT_INVALID, id,
                    ErrorCode.CHECKPOINT_INVALID.formatMessage(id + ": " + e.getOriginalMessage()), e);
        } catch (IOException e) {
            logger.severe("Failed to load checkpoint " + id + ": " + e.getMessage());
            throw new CheckpointException(ErrorCode.CHECKPOINT_IO_ERROR, id,
                    ErrorCode.CHECKPOINT_IO_ERROR.formatMessage("cannot read " + file + ": " + e.getMessage()), e);
        }
    }

    @Override
    public List<WorkflowCheckpoint> list(String workflowName) throws CheckpointException {
        List<WorkflowCheckpoint> checkpoints = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return checkpoints;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                try {
                    WorkflowCheckpoint checkpoint = objectMapper.readValue(Files.readAllBytes(file),
                            WorkflowCheckpoint.class);
                    if (workflowName == null || workflowName.equals(checkpoint.getWorkflowName())) {
                        checkpoints.add(checkpoint);
                    }
                } catch (IOException e) {
                    logger.warning("Skipping unreadable checkpoint file " + file.getFileName() + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            logger.severe("Failed to list checkpoints in " + directory + ": " + e.getMessage());
            throw new CheckpointException(ErrorCode.CHECKPOINT_IO_ERROR, null,
                    ErrorCode.CHECKPOINT_IO_ERROR.formatMessage("cannot list " + directory + ": " + e.getMessage()), e);
        }

        checkpoints.sort(Comparator.comparing(WorkflowCheckpoint::getTimestamp).reversed());
        return checkpoints;
    }

    private Path resolve(String id) throws CheckpointException {
        if (id == null || !VALID_ID.matcher(id).matches() || id.startsWith(".")) {
            throw new CheckpointException(ErrorCode.CHECKPOINT_INVALID, id,
                    ErrorCode.CHECKPOINT_INVALID.formatMessage("illegal checkpoint id '" + id + "'"));
        }
        return directory.resolve(id + EXTENSION);
    }
}
