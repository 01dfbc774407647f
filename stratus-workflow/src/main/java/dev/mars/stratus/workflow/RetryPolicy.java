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

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Attempt count, backoff shape and error-code filter governing re-execution of a failed step.
 *
 * <p>When {@code retryOnCodes} is present, a failure whose code is not in the set stops
 * retrying immediately. An absent set means every failure is retried.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
public final class RetryPolicy {

    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_DELAY_MS = 30000;

    private final int maxAttempts;
    private final long delayMs;
    private final BackoffStrategy strategy;
    private final double backoffMultiplier;
    private final long maxDelayMs;
    private final boolean jitter;
    private final Set<String> retryOnCodes;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + builder.maxAttempts);
        }
        if (builder.delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative");
        }
        this.maxAttempts = builder.maxAttempts;
        this.delayMs = builder.delayMs;
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy cannot be null");
        this.backoffMultiplier = builder.backoffMultiplier;
        this.maxDelayMs = builder.maxDelayMs;
        this.jitter = builder.jitter;
        this.retryOnCodes = builder.retryOnCodes != null
                ? Set.copyOf(new LinkedHashSet<>(builder.retryOnCodes)) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A policy that runs the operation once.
     */
    public static RetryPolicy singleAttempt() {
        return builder().maxAttempts(1).delayMs(0).jitter(false).build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMs() {
        return delayMs;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public boolean isJitter() {
        return jitter;
    }

    public Optional<Set<String>> getRetryOnCodes() {
        return Optional.ofNullable(retryOnCodes);
    }

    /**
     * Returns true if a failure carrying the given code may be retried.
     * A null code never matches an explicit allow-list.
     */
    public boolean isRetryable(String errorCode) {
        if (retryOnCodes == null) {
            return true;
        }
        return errorCode != null && retryOnCodes.contains(errorCode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts &&
               delayMs == that.delayMs &&
               Double.compare(that.backoffMultiplier, backoffMultiplier) == 0 &&
               maxDelayMs == that.maxDelayMs &&
               jitter == that.jitter &&
               strategy == that.strategy &&
               Objects.equals(retryOnCodes, that.retryOnCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, delayMs, strategy, backoffMultiplier, maxDelayMs, jitter, retryOnCodes);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxAttempts=" + maxAttempts +
               ", delayMs=" + delayMs +
               ", strategy=" + strategy +
               ", backoffMultiplier=" + backoffMultiplier +
               ", maxDelayMs=" + maxDelayMs +
               ", jitter=" + jitter +
               ", retryOnCodes=" + retryOnCodes +
               '}';
    }

    public static class Builder {
        private int maxAttempts = 1;
        private long delayMs = 1000;
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private boolean jitter = true;
        private Set<String> retryOnCodes;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder delayMs(long delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder retryOnCodes(Set<String> retryOnCodes) {
            this.retryOnCodes = retryOnCodes;
            return this;
        }

        public Builder retryOnCodes(String... retryOnCodes) {
            return retryOnCodes(Set.of(retryOnCodes));
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
