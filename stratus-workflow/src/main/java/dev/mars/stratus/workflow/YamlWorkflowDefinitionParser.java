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

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.workflow.rollback.RollbackOptions;
import dev.mars.stratus.workflow.rollback.RollbackPriority;
import dev.mars.stratus.workflow.rollback.RollbackStep;
import dev.mars.stratus.workflow.rollback.RollbackStrategy;
import dev.mars.stratus.workflow.rollback.RollbackStrategyType;
import dev.mars.stratus.workflow.rollback.RollbackTriggerCondition;
import dev.mars.stratus.workflow.rollback.RollbackTriggerType;
import dev.mars.stratus.workflow.rollback.RollbackType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML (or JSON) workflow definitions using SnakeYAML.
 *
 * <p>The raw document is validated against the workflow schema first, so the
 * typed model is only built from well-formed input.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = Logger.getLogger(YamlWorkflowDefinitionParser.class.getName());

    private final Yaml yaml;
    private final WorkflowSchemaValidator schemaValidator;

    public YamlWorkflowDefinitionParser() {
        this(new WorkflowSchemaValidator());
    }

    public YamlWorkflowDefinitionParser(WorkflowSchemaValidator schemaValidator) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = schemaValidator;
    }

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);

        ValidationResult validation = schemaValidator.validateWorkflowSchema(data);
        if (!validation.isValid()) {
            ValidationResult.ValidationIssue first = validation.getErrors().get(0);
            throw new WorkflowParseException(first.getFieldPath(),
                    first.getMessage() + (validation.getErrorCount() > 1
                            ? " (and " + (validation.getErrorCount() - 1) + " more)" : ""),
                    validation.getIssues(), null);
        }

        WorkflowDefinition definition = parseWorkflowDefinition(data);
        logger.fine("Parsed workflow " + definition.getName() + " with " + definition.getSteps().size() + " steps");
        return definition;
    }

    @Override
    public ValidationResult validateSchema(String content) {
        try {
            return schemaValidator.validateWorkflowSchema(load(content));
        } catch (WorkflowParseException e) {
            ValidationResult result = new ValidationResult();
            result.addError(ErrorCode.WORKFLOW_PARSE_ERROR.code(), e.getMessage());
            return result;
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String content) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("$", "Workflow document must be a mapping");
        }
        return (Map<String, Object>) data;
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder()
                .name(getStringValue(data, "name"))
                .description(getStringValue(data, "description"))
                .steps(parseSteps(getListValue(data, "steps"), "steps"))
                .preHooks(parseSteps(getListValue(data, "preHooks"), "preHooks"))
                .postHooks(parseSteps(getListValue(data, "postHooks"), "postHooks"))
                .rollbackSteps(parseRollbackSteps(getListValue(data, "rollbackSteps"), "rollbackSteps"));

        Map<String, Object> strategy = getMapValue(data, "rollbackStrategy");
        if (strategy != null) {
            builder.rollbackStrategy(parseRollbackStrategy(strategy));
        }
        return builder.build();
    }

    private List<WorkflowStep> parseSteps(List<Map<String, Object>> list, String path)
            throws WorkflowParseException {
        if (list == null) {
            return List.of();
        }
        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            steps.add(parseStep(list.get(i), path + "[" + i + "]"));
        }
        return steps;
    }

    private WorkflowStep parseStep(Map<String, Object> data, String path) throws WorkflowParseException {
        WorkflowStep.Builder builder = WorkflowStep.builder()
                .name(getStringValue(data, "name"))
                .description(getStringValue(data, "description"))
                .command(getStringValue(data, "command"))
                .args(parseStringList(data.get("args")))
                .options(parseObjectMap(getMapValue(data, "options")))
                .dependsOn(parseStringList(data.get("dependsOn")))
                .parallelGroup(getStringValue(data, "parallelGroup"));

        Map<String, Object> condition = getMapValue(data, "condition");
        if (condition != null) {
            builder.condition(parseCondition(condition, path + ".condition"));
        }
        Map<String, Object> retry = getMapValue(data, "retry");
        if (retry != null) {
            builder.retry(parseRetryPolicy(retry, path + ".retry"));
        }
        if (data.get("timeout") != null) {
            builder.timeout(parseDuration(data.get("timeout"), path + ".timeout"));
        }
        return builder.build();
    }

    private StepCondition parseCondition(Map<String, Object> data, String path) throws WorkflowParseException {
        String type = getStringValue(data, "type");
        ConditionType conditionType = ConditionType.fromValue(type)
                .orElseThrow(() -> new WorkflowParseException(path + ".type", "Unknown condition type: " + type));
        return new StepCondition(conditionType, getStringValue(data, "value"), getStringValue(data, "expected"));
    }

    private RetryPolicy parseRetryPolicy(Map<String, Object> data, String path) throws WorkflowParseException {
        RetryPolicy.Builder builder = RetryPolicy.builder()
                .maxAttempts(getIntValue(data, "maxAttempts", 1))
                .jitter(getBooleanValue(data, "jitter", true));
        if (data.get("delayMs") != null) {
            builder.delayMs(getLongValue(data, "delayMs", 0));
        }
        if (data.get("maxDelayMs") != null) {
            builder.maxDelayMs(getLongValue(data, "maxDelayMs", RetryPolicy.DEFAULT_MAX_DELAY_MS));
        }
        if (data.get("backoffMultiplier") instanceof Number multiplier) {
            builder.backoffMultiplier(multiplier.doubleValue());
        }
        String strategy = getStringValue(data, "strategy");
        if (strategy != null) {
            builder.strategy(BackoffStrategy.fromValue(strategy)
                    .orElseThrow(() -> new WorkflowParseException(path + ".strategy",
                            "Unknown backoff strategy: " + strategy)));
        }
        if (data.get("retryOnCodes") != null) {
            builder.retryOnCodes(new LinkedHashSet<>(parseStringList(data.get("retryOnCodes"))));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private List<RollbackStep> parseRollbackSteps(List<Map<String, Object>> list, String path)
            throws WorkflowParseException {
        if (list == null) {
            return List.of();
        }
        List<RollbackStep> steps = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            steps.add(parseRollbackStep(list.get(i), path + "[" + i + "]"));
        }
        return steps;
    }

    private RollbackStep parseRollbackStep(Map<String, Object> data, String path) throws WorkflowParseException {
        WorkflowStep.Builder step = WorkflowStep.builder()
                .name(getStringValue(data, "name"))
                .description(getStringValue(data, "description"))
                .command(getStringValue(data, "command"))
                .args(parseStringList(data.get("args")))
                .options(parseObjectMap(getMapValue(data, "options")));
        if (data.get("timeout") != null) {
            step.timeout(parseDuration(data.get("timeout"), path + ".timeout"));
        }

        RollbackStep.Builder builder = RollbackStep.builder()
                .step(step.build())
                .dependencies(parseStringList(data.get("dependencies")))
                .rollbackData(parseObjectMap(getMapValue(data, "rollbackData")))
                .resources(parseStringList(data.get("resources")))
                .compensates(getStringValue(data, "compensates"));

        String type = getStringValue(data, "rollbackType");
        if (type != null) {
            builder.rollbackType(RollbackType.fromValue(type)
                    .orElseThrow(() -> new WorkflowParseException(path + ".rollbackType",
                            "Unknown rollback type: " + type)));
        }
        String priority = getStringValue(data, "priority");
        if (priority != null) {
            builder.priority(RollbackPriority.fromValue(priority)
                    .orElseThrow(() -> new WorkflowParseException(path + ".priority",
                            "Unknown rollback priority: " + priority)));
        }
        return builder.build();
    }

    private RollbackStrategy parseRollbackStrategy(Map<String, Object> data) throws WorkflowParseException {
        String path = "rollbackStrategy";
        RollbackStrategy.Builder builder = RollbackStrategy.builder()
                .rollbackSteps(parseRollbackSteps(getListValue(data, "rollbackSteps"), path + ".rollbackSteps"));

        String type = getStringValue(data, "type");
        if (type != null) {
            builder.type(RollbackStrategyType.fromValue(type)
                    .orElseThrow(() -> new WorkflowParseException(path + ".type",
                            "Unknown rollback strategy type: " + type)));
        }

        List<Map<String, Object>> triggers = getListValue(data, "triggerConditions");
        if (triggers != null) {
            for (int i = 0; i < triggers.size(); i++) {
                builder.triggerCondition(parseTriggerCondition(triggers.get(i),
                        path + ".triggerConditions[" + i + "]"));
            }
        }

        Map<String, Object> options = getMapValue(data, "options");
        if (options != null) {
            builder.options(parseRollbackOptions(options, path + ".options"));
        }
        return builder.build();
    }

    private RollbackTriggerCondition parseTriggerCondition(Map<String, Object> data, String path)
            throws WorkflowParseException {
        String type = getStringValue(data, "type");
        RollbackTriggerType triggerType = RollbackTriggerType.fromValue(type)
                .orElseThrow(() -> new WorkflowParseException(path + ".type", "Unknown trigger type: " + type));
        try {
            return new RollbackTriggerCondition(triggerType, getStringValue(data, "stepName"),
                    getStringValue(data, "errorPattern"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".errorPattern", e.getMessage(), e);
        }
    }

    private RollbackOptions parseRollbackOptions(Map<String, Object> data, String path)
            throws WorkflowParseException {
        RollbackOptions.Builder builder = RollbackOptions.builder()
                .maxRollbackAttempts(getIntValue(data, "maxRollbackAttempts", 1))
                .preserveState(getBooleanValue(data, "preserveState", false))
                .validateAfterRollback(getBooleanValue(data, "validateAfterRollback", true))
                .rollbackOnPartialSuccess(getBooleanValue(data, "rollbackOnPartialSuccess", false));
        if (data.get("rollbackTimeout") != null) {
            builder.rollbackTimeout(parseDuration(data.get("rollbackTimeout"), path + ".rollbackTimeout"));
        }
        return builder.build();
    }

    /**
     * Parses "500ms", "30s", "5m", "2h" or a plain number of milliseconds.
     */
    static Duration parseDuration(Object value, String path) throws WorkflowParseException {
        if (value instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        String trimmed = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2)));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Invalid duration: " + value, e);
        }
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<Map<String, Object>>) value : null;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    private long getLongValue(Map<String, Object> data, String key, long defaultValue) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }

    private List<String> parseStringList(Object data) {
        if (!(data instanceof List)) return List.of();

        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) data) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private Map<String, Object> parseObjectMap(Map<String, Object> data) {
        if (data == null) return Map.of();

        Map<String, Object> result = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (key != null && value != null) {
                result.put(String.valueOf(key), value);
            }
        });
        return result;
    }
}
