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

package dev.mars.stratus.workflow.retry;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.StratusException;
import dev.mars.stratus.workflow.RetryPolicy;
import dev.mars.stratus.workflow.StepExecutionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one step's operation under a backoff, jitter and retry-code policy.
 *
 * <p>Attempts run on the supplied executor. When a {@link Semaphore} is given, an
 * attempt holds one permit only while the operation runs; the backoff wait between
 * attempts is a scheduled continuation and holds no permit and no thread. The
 * per-attempt timeout is measured from the moment the permit is acquired.</p>
 *
 * <p>Delay before the retry that follows failed attempt {@code n} (1-indexed):</p>
 * <ul>
 *   <li>fixed: {@code delayMs}</li>
 *   <li>linear: {@code delayMs * n}</li>
 *   <li>exponential: {@code delayMs * backoffMultiplier^(n-1)}</li>
 * </ul>
 * <p>The delay is clamped to {@code maxDelayMs}, then jitter of up to 10% either way
 * is added, and the result is rounded and floored at zero.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class RetryExecutor {

    private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());
    private static final double JITTER_FRACTION = 0.1;

    private final Executor executor;
    private final Random random;

    public RetryExecutor(Executor executor) {
        this(executor, new Random());
    }

    public RetryExecutor(Executor executor, Random random) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    /**
     * Observes individual attempts, e.g. to record timings or concurrency.
     */
    public interface AttemptListener {

        AttemptListener NONE = new AttemptListener() { };

        default void onAttemptStarted(String stepName, int attempt) {
        }

        default void onAttemptFinished(String stepName, int attempt, Instant startTime, Instant endTime,
                                       StratusException failure) {
        }
    }

    /**
     * Blocking form: runs the operation until it succeeds or the policy gives up.
     *
     * @return the operation's result
     * @throws RecoveryExhaustedException naming the step, the attempt count and every error message
     */
    public <T> T runWithRetry(StepOperation<T> operation, RetryPolicy policy, String stepName)
            throws RecoveryExhaustedException {
        try {
            return execute(operation, policy, stepName).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running step " + stepName, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RecoveryExhaustedException) {
                throw (RecoveryExhaustedException) e.getCause();
            }
            throw new IllegalStateException("Unexpected failure running step " + stepName, e.getCause());
        }
    }

    public <T> CompletableFuture<T> execute(StepOperation<T> operation, RetryPolicy policy, String stepName) {
        return execute(operation, policy, stepName, null, new CancellationToken(), null, AttemptListener.NONE);
    }

    /**
     * Runs the operation asynchronously.
     *
     * <p>The returned future completes with the operation's result, or exceptionally
     * with a {@link RecoveryExhaustedException}, or with a {@link StepExecutionException}
     * coded {@code STEP_CANCELLED} if the token was cancelled before an attempt could start.</p>
     *
     * @param operation the operation to attempt
     * @param policy the retry policy
     * @param stepName step name for errors and logs
     * @param permits concurrency limiter shared by a run, or null for no limit
     * @param token cancellation token of the run
     * @param attemptTimeout per-attempt timeout, or null for none
     * @param listener attempt observer
     */
    public <T> CompletableFuture<T> execute(StepOperation<T> operation, RetryPolicy policy, String stepName,
                                            Semaphore permits, CancellationToken token, Duration attemptTimeout,
                                            AttemptListener listener) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(policy, "Retry policy cannot be null");
        Objects.requireNonNull(token, "Cancellation token cannot be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        AttemptState<T> state = new AttemptState<>(operation, policy, stepName, permits, token, attemptTimeout,
                listener != null ? listener : AttemptListener.NONE);
        attempt(state, 1, result);
        return result;
    }

    /**
     * Computes the delay before the retry that follows failed attempt {@code attempt}.
     *
     * @param attempt the 1-indexed attempt that just failed
     * @param policy the retry policy
     * @return delay in milliseconds, never negative
     */
    public long calculateDelay(int attempt, RetryPolicy policy) {
        double delay = switch (policy.getStrategy()) {
            case FIXED -> policy.getDelayMs();
            case LINEAR -> (double) policy.getDelayMs() * attempt;
            case EXPONENTIAL -> policy.getDelayMs() * Math.pow(policy.getBackoffMultiplier(), attempt - 1);
        };

        delay = Math.min(delay, policy.getMaxDelayMs());

        if (policy.isJitter()) {
            double jitterAmount = delay * JITTER_FRACTION;
            delay += (random.nextDouble() - 0.5) * 2 * jitterAmount;
        }

        return Math.max(0, Math.round(delay));
    }

    private <T> void attempt(AttemptState<T> state, int attemptNumber, CompletableFuture<T> result) {
        if (state.token.isCancelled()) {
            result.completeExceptionally(cancelled(state));
            return;
        }

        CompletableFuture<T> attemptFuture = new CompletableFuture<>();
        executor.execute(() -> runAttempt(state, attemptNumber, attemptFuture));

        attemptFuture.whenComplete((value, error) -> {
            if (error == null) {
                if (attemptNumber > 1) {
                    logger.info(state.stepName + " succeeded on attempt " + attemptNumber + "/" +
                            state.policy.getMaxAttempts());
                }
                result.complete(value);
                return;
            }

            StratusException failure = toFailure(state.stepName, error, state.attemptTimeout);
            if (failure instanceof StepExecutionException && failure.hasErrorCode(ErrorCode.STEP_CANCELLED)) {
                result.completeExceptionally(failure);
                return;
            }
            state.errors.add(describe(failure));

            if (!state.policy.isRetryable(failure.getErrorCode())) {
                logger.fine("Not retrying " + state.stepName + " - error code " + failure.getErrorCode() +
                        " not in retry list");
                result.completeExceptionally(exhausted(state, attemptNumber, failure));
                return;
            }

            if (attemptNumber >= state.policy.getMaxAttempts()) {
                logger.warning(state.stepName + " failed after " + attemptNumber + " attempts");
                result.completeExceptionally(exhausted(state, attemptNumber, failure));
                return;
            }

            long delay = calculateDelay(attemptNumber, state.policy);
            logger.warning(state.stepName + " failed (attempt " + attemptNumber + "), retrying in " + delay +
                    "ms: " + failure.getMessage());

            CompletableFuture<Void> backoff = new CompletableFuture<>();
            CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor)
                    .execute(() -> backoff.complete(null));
            state.token.onCancel(() -> backoff.complete(null));
            backoff.thenRun(() -> attempt(state, attemptNumber + 1, result));
        });
    }

    /**
     * Runs one attempt and completes {@code attemptFuture} with its outcome.
     *
     * <p>The attempt timeout starts once the permit is held, so time spent queued behind
     * other steps does not count against it. An attempt whose future is already complete
     * when the permit arrives never calls the operation. A result that arrives after the
     * timeout fired is discarded, since the future is already complete.</p>
     */
    private <T> void runAttempt(AttemptState<T> state, int attemptNumber, CompletableFuture<T> attemptFuture) {
        boolean acquired = false;
        try {
            if (state.permits != null) {
                state.permits.acquire();
                acquired = true;
            }
            if (state.token.isCancelled()) {
                attemptFuture.completeExceptionally(cancelled(state));
                return;
            }
            if (attemptFuture.isDone()) {
                logger.fine("Skipping abandoned attempt " + attemptNumber + " of " + state.stepName);
                return;
            }
            if (state.attemptTimeout != null && !state.attemptTimeout.isZero()) {
                attemptFuture.orTimeout(state.attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            Instant start = Instant.now();
            state.listener.onAttemptStarted(state.stepName, attemptNumber);
            logger.fine("Executing " + state.stepName + " (attempt " + attemptNumber + "/" +
                    state.policy.getMaxAttempts() + ")");
            T value = null;
            StratusException failure = null;
            try {
                value = state.operation.call();
            } catch (Exception e) {
                failure = toFailure(state.stepName, e, null);
            }

            boolean late = attemptFuture.isDone();
            if (late) {
                logger.warning("Discarding late result of " + state.stepName + " (attempt " + attemptNumber +
                        "), the attempt had already timed out");
            }
            state.listener.onAttemptFinished(state.stepName, attemptNumber, start, Instant.now(),
                    late ? toFailure(state.stepName, new TimeoutException(), state.attemptTimeout) : failure);
            if (failure != null) {
                attemptFuture.completeExceptionally(failure);
            } else {
                attemptFuture.complete(value);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attemptFuture.completeExceptionally(cancelled(state));
        } catch (RuntimeException e) {
            attemptFuture.completeExceptionally(e);
        } finally {
            if (acquired) {
                state.permits.release();
            }
        }
    }

    private static RecoveryExhaustedException exhausted(AttemptState<?> state, int attempts,
                                                        StratusException lastError) {
        return new RecoveryExhaustedException(state.stepName, attempts, state.errors, lastError);
    }

    private static StepExecutionException cancelled(AttemptState<?> state) {
        String reason = state.token.getReason().orElse("cancelled");
        return new StepExecutionException(state.stepName, ErrorCode.STEP_CANCELLED.code(),
                ErrorCode.STEP_CANCELLED.formatMessage(state.stepName) + ": " + reason);
    }

    private static String describe(StratusException failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return failure.getErrorCode() != null ? failure.getErrorCode() + ": " + message : message;
    }

    /**
     * Normalises any attempt failure into a coded exception.
     */
    public static StratusException toFailure(String stepName, Throwable error, Duration attemptTimeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof StratusException) {
            return (StratusException) cause;
        }
        if (cause instanceof TimeoutException) {
            String limit = attemptTimeout != null ? " after " + attemptTimeout.toMillis() + "ms" : "";
            return new StepExecutionException(stepName, ErrorCode.TIMEOUT_ERROR.code(),
                    ErrorCode.TIMEOUT_ERROR.formatMessage("step '" + stepName + "'" + limit), cause);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Unexpected failure in step " + stepName, cause);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new StepExecutionException(stepName, null, message, cause);
    }

    private static final class AttemptState<T> {
        private final StepOperation<T> operation;
        private final RetryPolicy policy;
        private final String stepName;
        private final Semaphore permits;
        private final CancellationToken token;
        private final Duration attemptTimeout;
        private final AttemptListener listener;
        private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

        private AttemptState(StepOperation<T> operation, RetryPolicy policy, String stepName, Semaphore permits,
                             CancellationToken token, Duration attemptTimeout, AttemptListener listener) {
            this.operation = operation;
            this.policy = policy;
            this.stepName = stepName;
            this.permits = permits;
            this.token = token;
            this.attemptTimeout = attemptTimeout;
            this.listener = listener;
        }
    }
}
