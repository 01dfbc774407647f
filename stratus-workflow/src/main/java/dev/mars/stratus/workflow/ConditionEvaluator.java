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
import dev.mars.stratus.core.exceptions.OperationException;
import dev.mars.stratus.operation.StateBackend;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Decides whether a step's condition holds.
 *
 * <ul>
 *   <li>{@code file-exists}: the path, resolved against the working directory, exists</li>
 *   <li>{@code state-has-resource}: the address is listed in the state backend's resources</li>
 *   <li>{@code output-equals}: an earlier step output equals the expected value. The output is
 *       named {@code step.key}, or just {@code key} to search every completed step and then
 *       the state's {@code outputs}</li>
 *   <li>{@code custom}: a Spring expression over a {@link ConditionContext}, evaluated with
 *       read-only data binding</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Path workingDirectory;
    private final StateBackend stateBackend;

    /**
     * @param workingDirectory base directory for relative {@code file-exists} paths
     * @param stateBackend     state access, or null if the run has none
     */
    public ConditionEvaluator(Path workingDirectory, StateBackend stateBackend) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        this.stateBackend = stateBackend;
    }

    /**
     * @throws StepExecutionException coded {@code CONFIGURATION_ERROR} if a custom expression is
     *                                malformed or does not yield a boolean, or with the backend's code
     *                                if the state cannot be read
     */
    public boolean evaluate(String stepName, StepCondition condition, ConditionContext context)
            throws StepExecutionException {
        boolean result = switch (condition.type()) {
            case FILE_EXISTS -> Files.exists(workingDirectory.resolve(condition.value()));
            case STATE_HAS_RESOURCE -> StateBackend.resourceAddresses(loadState(stepName)).contains(condition.value());
            case OUTPUT_EQUALS -> outputEquals(stepName, condition, context);
            case CUSTOM -> evaluateExpression(stepName, condition.value(),
                    stateBackend != null ? context.withState(loadState(stepName)) : context);
        };
        logger.fine("Condition " + condition.type().value() + " '" + condition.value() + "' of step " + stepName +
                " evaluated to " + result);
        return result;
    }

    private boolean outputEquals(String stepName, StepCondition condition, ConditionContext context)
            throws StepExecutionException {
        Object actual = findOutput(condition.value(), context);
        if (actual == null) {
            Object stateOutputs = loadState(stepName).get("outputs");
            if (stateOutputs instanceof Map<?, ?> outputs) {
                actual = outputs.get(condition.value());
            }
        }
        return actual != null && String.valueOf(actual).equals(condition.expected());
    }

    private static Object findOutput(String name, ConditionContext context) {
        int dot = name.indexOf('.');
        if (dot > 0) {
            Map<String, Object> stepOutputs = context.getOutputs().get(name.substring(0, dot));
            if (stepOutputs != null && stepOutputs.containsKey(name.substring(dot + 1))) {
                return stepOutputs.get(name.substring(dot + 1));
            }
        }

        // latest completed step wins
        List<String> completed = new ArrayList<>(context.getCompletedSteps());
        Collections.reverse(completed);
        for (String step : completed) {
            Map<String, Object> stepOutputs = context.getOutputs().get(step);
            if (stepOutputs != null && stepOutputs.containsKey(name)) {
                return stepOutputs.get(name);
            }
        }
        return null;
    }

    private boolean evaluateExpression(String stepName, String expression, ConditionContext context)
            throws StepExecutionException {
        try {
            EvaluationContext evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding()
                    .withInstanceMethods()
                    .withRootObject(context)
                    .build();
            Boolean value = parser.parseExpression(expression).getValue(evaluationContext, Boolean.class);
            if (value == null) {
                throw invalidExpression(stepName, expression, "expression yielded null", null);
            }
            return value;
        } catch (ParseException | EvaluationException e) {
            throw invalidExpression(stepName, expression, e.getMessage(), e);
        }
    }

    private Map<String, Object> loadState(String stepName) throws StepExecutionException {
        if (stateBackend == null) {
            return Map.of();
        }
        try {
            Map<String, Object> state = stateBackend.loadState();
            return state != null ? state : Map.of();
        } catch (OperationException e) {
            throw new StepExecutionException(stepName, e.getErrorCode(),
                    "Could not load state to evaluate condition: " + e.getMessage(), e);
        }
    }

    private static StepExecutionException invalidExpression(String stepName, String expression, String detail,
                                                            Throwable cause) {
        return new StepExecutionException(stepName, ErrorCode.CONFIGURATION_ERROR.code(),
                "Invalid condition expression '" + expression + "': " + detail, cause);
    }
}
