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

package dev.mars.stratus.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.mars.stratus.core.ErrorCode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validates raw workflow documents against the closed JSON schema
 * {@code schema/workflow-schema.json} before any typed model is built.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class WorkflowSchemaValidator {

    private static final Logger logger = Logger.getLogger(WorkflowSchemaValidator.class.getName());

    static final String SCHEMA_RESOURCE = "/schema/workflow-schema.json";

    private final ObjectMapper objectMapper;
    private final JsonSchema schema;

    public WorkflowSchemaValidator() {
        this.objectMapper = new ObjectMapper();
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream in = WorkflowSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Workflow schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            this.schema = factory.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load workflow schema " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Validates a document loaded from YAML or JSON.
     *
     * @param document the raw document tree
     * @return errors keyed by JSON path; empty when the document matches
     */
    public ValidationResult validateWorkflowSchema(Map<String, Object> document) {
        ValidationResult result = new ValidationResult();
        if (document == null) {
            result.addError(ErrorCode.WORKFLOW_PARSE_ERROR.code(), "$", "Workflow document is empty");
            return result;
        }

        JsonNode node = objectMapper.valueToTree(document);
        Set<ValidationMessage> messages = schema.validate(node);
        messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getPath).thenComparing(ValidationMessage::getMessage))
                .forEach(message -> result.addError(ErrorCode.WORKFLOW_PARSE_ERROR.code(), message.getPath(),
                        message.getMessage()));

        if (!result.isValid()) {
            logger.fine("Workflow document has " + result.getErrorCount() + " schema violations");
        }
        return result;
    }
}
