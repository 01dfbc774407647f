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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time snapshot of workflow progress, persisted so a later run can resume
 * past already-completed steps. Immutable once written.
 *
 * <p>The state map is held in its JSON form: numbers read back the way a JSON parser
 * yields them (a {@code Long} that fits in an int becomes an {@code Integer}, a
 * {@code Float} becomes a {@code Double}) and dates become ISO-8601 strings, so a
 * checkpoint equals itself after a save and load.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowCheckpoint {

    public static final String EMERGENCY_PREFIX = "emergency_";

    private static final ObjectMapper STATE_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() { };

    private final String id;
    private final String workflowName;
    private final int stepIndex;
    private final String stepName;
    private final Instant timestamp;
    private final Map<String, Object> state;
    private final List<String> completedSteps;
    private final List<String> failedSteps;

    @JsonCreator
    public WorkflowCheckpoint(
            @JsonProperty("id") String id,
            @JsonProperty("workflowName") String workflowName,
            @JsonProperty("stepIndex") int stepIndex,
            @JsonProperty("stepName") String stepName,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("state") Map<String, Object> state,
            @JsonProperty("completedSteps") List<String> completedSteps,
            @JsonProperty("failedSteps") List<String> failedSteps) {
        this.id = Objects.requireNonNull(id, "Checkpoint id cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.stepIndex = stepIndex;
        this.stepName = stepName;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.state = state != null ? Collections.unmodifiableMap(toJsonShape(state)) : Map.of();
        this.completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
        this.failedSteps = failedSteps != null ? List.copyOf(failedSteps) : List.of();
    }

    private static Map<String, Object> toJsonShape(Map<String, Object> state) {
        try {
            return STATE_MAPPER.readValue(STATE_MAPPER.writeValueAsBytes(state), STATE_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Checkpoint state is not JSON-serialisable: " + e.getMessage(), e);
        }
    }

    public String getId() {
        return id;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return stepName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getState() {
        return state;
    }

    public List<String> getCompletedSteps() {
        return completedSteps;
    }

    public List<String> getFailedSteps() {
        return failedSteps;
    }

    @JsonIgnore
    public boolean isEmergency() {
        return id.startsWith(EMERGENCY_PREFIX);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowCheckpoint that = (WorkflowCheckpoint) o;
        return stepIndex == that.stepIndex &&
               id.equals(that.id) &&
               workflowName.equals(that.workflowName) &&
               Objects.equals(stepName, that.stepName) &&
               timestamp.equals(that.timestamp) &&
               state.equals(that.state) &&
               completedSteps.equals(that.completedSteps) &&
               failedSteps.equals(that.failedSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, workflowName, stepIndex, stepName, timestamp, state, completedSteps, failedSteps);
    }

    @Override
    public String toString() {
        return "WorkflowCheckpoint{" +
               "id='" + id + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", stepIndex=" + stepIndex +
               ", stepName='" + stepName + '\'' +
               ", timestamp=" + timestamp +
               ", completedSteps=" + completedSteps +
               ", failedSteps=" + failedSteps +
               '}';
    }
}
